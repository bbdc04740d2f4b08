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

import com.udby.blog.directupload.s3.signing.PresignedUrl;
import com.udby.blog.directupload.s3.signing.QueryParameter;
import com.udby.blog.directupload.s3.signing.RequestSigner;
import com.udby.blog.directupload.s3.signing.ResourcePath;
import com.udby.blog.directupload.s3.signing.SignedRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InterruptedIOException;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Arrays;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

import static com.udby.blog.directupload.s3.signing.MessageDigestHelper.MD5;

/**
 * {@link StorageFacility} on top of the JDK {@link HttpClient}; every request is signed by a {@link RequestSigner}.
 * <p>
 * Single attempt per call. A non-2xx answer becomes an {@link S3ResponseException} with the status and the start of
 * the response body, retrying is left to the caller.
 */
public final class StorageFacilityHttpClient implements StorageFacility {
    private static final Logger log = LoggerFactory.getLogger(StorageFacilityHttpClient.class);

    /** The size limit of response body to be read for an exceptional response */
    static final int ERROR_BODY_MAX_LENGTH = 4096;

    private static final String GET = "GET";
    private static final String POST = "POST";
    private static final String PUT = "PUT";
    private static final String DELETE = "DELETE";

    private static final String CONTENT_TYPE = "content-type";
    private static final String CONTENT_MD5 = "content-md5";
    private static final String APPLICATION_XML = "application/xml";

    private final RequestSigner requestSigner;
    private final HttpClient httpClient;

    public StorageFacilityHttpClient(RequestSigner requestSigner, HttpClient httpClient) {
        this.requestSigner = Objects.requireNonNull(requestSigner, "requestSigner");
        this.httpClient = Objects.requireNonNull(httpClient, "httpClient");
    }

    @Override
    public String prepareMultipartUpload(String bucket, String key, String contentType, Map<String, String> metadataHeaders)
            throws S3ResponseException, IOException {
        final var headers = new LinkedHashMap<String, String>();
        if (contentType != null && !contentType.isBlank()) {
            headers.put(CONTENT_TYPE, contentType);
        }
        headers.putAll(metadataHeaders);

        final var request = requestSigner.signHeaders(POST, ResourcePath.forObject(bucket, key),
                List.of(QueryParameter.flag("uploads")), headers, null);
        final var response = send(request);
        requireSuccess(response, "Failed to create multipart upload: key=%s".formatted(key));

        final var uploadId = S3Xml.firstText(response.body(), "UploadId")
                .filter(id -> !id.isBlank())
                .orElseThrow(() -> new S3ResponseException(response.statusCode(), truncated(response.body()),
                        response.headers(), "No UploadId in create multipart upload response: key=%s".formatted(key)));
        log.debug("Created multipart upload: key={}, uploadId={}", key, uploadId);
        return uploadId;
    }

    @Override
    public void abortMultipartUpload(String bucket, String key, String uploadId) throws S3ResponseException, IOException {
        final var request = requestSigner.signHeaders(DELETE, ResourcePath.forObject(bucket, key),
                List.of(QueryParameter.of("uploadId", uploadId)), Map.of(), null);
        final var response = send(request);
        requireSuccess(response, "Failed to abort multipart upload: key=%s, uploadId=%s".formatted(key, uploadId));
        log.debug("Aborted multipart upload: key={}, uploadId={}", key, uploadId);
    }

    @Override
    public PresignedUrl presignedUploadPartRequest(String bucket, String key, String uploadId, int partNumber, Duration signatureDuration) {
        return requestSigner.presign(PUT, ResourcePath.forObject(bucket, key),
                List.of(QueryParameter.of("partNumber", Integer.toString(partNumber)), QueryParameter.of("uploadId", uploadId)),
                signatureDuration);
    }

    @Override
    public void completeMultipartUpload(String bucket, String key, String uploadId, Collection<? extends UploadedPart> parts)
            throws S3ResponseException, IOException {
        final var body = S3Xml.completeMultipartUpload(parts).getBytes(StandardCharsets.UTF_8);
        final var request = requestSigner.signHeaders(POST, ResourcePath.forObject(bucket, key),
                List.of(QueryParameter.of("uploadId", uploadId)), Map.of(CONTENT_TYPE, APPLICATION_XML), body);
        final var response = send(request);
        final var message = "Failed to complete multipart upload: key=%s, uploadId=%s".formatted(key, uploadId);
        requireSuccess(response, message);
        // the store may report a failed completion with 200 and an error document
        if (S3Xml.isErrorDocument(response.body())) {
            throw new S3ResponseException(response.statusCode(), truncated(response.body()), response.headers(), message);
        }
        log.debug("Completed multipart upload: key={}, uploadId={}, parts={}", key, uploadId, parts.size());
    }

    @Override
    public void putObject(String bucket, String key, byte[] body, String contentType, Map<String, String> metadataHeaders)
            throws S3ResponseException, IOException {
        final var headers = new LinkedHashMap<String, String>();
        if (contentType != null && !contentType.isBlank()) {
            headers.put(CONTENT_TYPE, contentType);
        }
        headers.putAll(metadataHeaders);

        final var request = requestSigner.signHeaders(PUT, ResourcePath.forObject(bucket, key), List.of(), headers, body);
        final var response = send(request);
        requireSuccess(response, "Failed to upload object: key=%s".formatted(key));
        log.debug("Uploaded object: key={}, bytes={}", key, request.body().length);
    }

    @Override
    public PresignedUrl presignedGetObjectRequest(String bucket, String key, Duration signatureDuration) {
        return requestSigner.presign(GET, ResourcePath.forObject(bucket, key), List.of(), signatureDuration);
    }

    @Override
    public void putBucketCors(String bucket, String corsConfigurationXml) throws S3ResponseException, IOException {
        final var body = corsConfigurationXml.getBytes(StandardCharsets.UTF_8);
        final var headers = Map.of(
                CONTENT_TYPE, APPLICATION_XML,
                CONTENT_MD5, MD5.base64Digest(body));
        final var request = requestSigner.signHeaders(PUT, ResourcePath.forBucket(bucket),
                List.of(QueryParameter.flag("cors")), headers, body);
        final var response = send(request);
        requireSuccess(response, "Failed to configure bucket CORS: bucket=%s".formatted(bucket));
    }

    @Override
    public String endpointHost() {
        return requestSigner.hostHeader();
    }

    private HttpResponse<byte[]> send(SignedRequest signedRequest) throws IOException {
        final var builder = HttpRequest.newBuilder(signedRequest.uri());
        signedRequest.headers().forEach(builder::header);
        final var body = signedRequest.body();
        final var publisher = body.length == 0
                ? HttpRequest.BodyPublishers.noBody()
                : new ByteBufferBodyPublisher(ByteBuffer.wrap(body));
        final var request = builder.method(signedRequest.method(), publisher).build();
        try {
            return httpClient.send(request, HttpResponse.BodyHandlers.ofByteArray());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            final var interrupted = new InterruptedIOException("Interrupted calling %s %s".formatted(signedRequest.method(), signedRequest.uri()));
            interrupted.initCause(e);
            throw interrupted;
        }
    }

    private static void requireSuccess(HttpResponse<byte[]> response, String message) throws S3ResponseException {
        final var statusCode = response.statusCode();
        if (statusCode < 200 || statusCode > 299) {
            throw new S3ResponseException(statusCode, truncated(response.body()), response.headers(), message);
        }
    }

    private static byte[] truncated(byte[] body) {
        if (body == null) {
            return new byte[0];
        }
        return body.length > ERROR_BODY_MAX_LENGTH ? Arrays.copyOf(body, ERROR_BODY_MAX_LENGTH) : body;
    }
}
