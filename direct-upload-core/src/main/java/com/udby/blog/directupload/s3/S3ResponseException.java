/*
Copyright 2025 Jesper Udby

Licensed under the Apache License, Version 2.0 (the "License");
you may not use this file except in compliance with the License.
You may obtain a copy of the License at

    http://www.apache.org/licenses/LICENSE-2.0

Unless required by applicable law or agreed to in writing, software
distributed under the License is distributed on an "AS IS" BASIS,
WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
See the License for the specific language governing permissions and
limitations under the License.
*/
package com.udby.blog.directupload.s3;

import java.net.http.HttpHeaders;
import java.nio.charset.StandardCharsets;
import java.util.Optional;

/**
 * The object store answered with an unsuccessful status, or with an error document on a 200.
 * <p>
 * Carries the status code, the response headers and at most {@value StorageFacilityHttpClient#ERROR_BODY_MAX_LENGTH}
 * bytes of the response body.
 */
public final class S3ResponseException extends S3ClientException {
    private static final int MAX_RESPONSE_BODY_STRING_LENGTH = 2048;

    private final int responseStatusCode;
    private final byte[] responseBody;
    private final HttpHeaders responseHeaders;

    public S3ResponseException(int responseStatusCode, byte[] responseBody, HttpHeaders responseHeaders, String message) {
        super(message);
        this.responseStatusCode = responseStatusCode;
        this.responseBody = responseBody == null ? new byte[0] : responseBody;
        this.responseHeaders = responseHeaders;
    }

    public int getResponseStatusCode() {
        return responseStatusCode;
    }

    public byte[] getResponseBody() {
        return responseBody.clone();
    }

    public Optional<HttpHeaders> getResponseHeaders() {
        return Optional.ofNullable(responseHeaders);
    }

    /**
     * @return the response body as text, cut at {@value MAX_RESPONSE_BODY_STRING_LENGTH} characters
     */
    public String responseBodySnippet() {
        final var body = new String(responseBody, StandardCharsets.UTF_8);
        return body.length() > MAX_RESPONSE_BODY_STRING_LENGTH
                ? body.substring(0, MAX_RESPONSE_BODY_STRING_LENGTH) + " ..."
                : body;
    }

    @Override
    public String toString() {
        final var sb = new StringBuilder(getClass().getName());
        if (getMessage() != null) {
            sb.append(": ").append(getMessage());
        }
        sb.append(System.lineSeparator()).append("    Response status code: ").append(responseStatusCode);
        if (responseBody.length > 0) {
            sb.append(System.lineSeparator()).append("    Response body: ").append(responseBodySnippet());
        }
        return sb.toString();
    }
}
