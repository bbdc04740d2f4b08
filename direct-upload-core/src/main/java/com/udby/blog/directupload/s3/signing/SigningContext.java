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
package com.udby.blog.directupload.s3.signing;

import java.time.Duration;
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Everything that goes into one signature. Created per request and thrown away afterwards.
 *
 * @param method       HTTP method
 * @param resourcePath bucket or object path
 * @param queryParams  query parameters, including the X-Amz-* parameters when presigning
 * @param headers      headers to sign, including host
 * @param bodyHash     hex SHA-256 of the payload or {@link RequestSigner#UNSIGNED_PAYLOAD}
 * @param timestamp    signing time
 * @param presigned    true for query-string signing, the query must then carry a matching X-Amz-Expires
 * @param expiry       validity of a presigned request in whole seconds, null in header mode
 */
public record SigningContext(String method,
                             ResourcePath resourcePath,
                             List<QueryParameter> queryParams,
                             Map<String, String> headers,
                             String bodyHash,
                             Instant timestamp,
                             boolean presigned,
                             Duration expiry) {
    public SigningContext {
        Objects.requireNonNull(method, "method");
        Objects.requireNonNull(resourcePath, "resourcePath");
        Objects.requireNonNull(bodyHash, "bodyHash");
        Objects.requireNonNull(timestamp, "timestamp");
        queryParams = List.copyOf(queryParams);
        headers = Collections.unmodifiableMap(new LinkedHashMap<>(headers));
        if (presigned && expiry == null) {
            throw new IllegalArgumentException("A presigned request needs an expiry");
        }
    }
}
