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
import com.udby.blog.directupload.s3.signing.RequestSigner;

import java.io.IOException;
import java.net.http.HttpClient;
import java.time.Duration;
import java.util.Collection;
import java.util.Map;

/**
 * The REST calls this library makes against an S3-compatible store, plus the presigned URLs it hands out.
 */
public sealed interface StorageFacility
        permits StorageFacilityHttpClient {
    static StorageFacility forSigner(RequestSigner requestSigner) {
        final var httpClient = HttpClient.newBuilder()
                .version(HttpClient.Version.HTTP_1_1)
                .connectTimeout(Duration.ofSeconds(30))
                .build();
        return new StorageFacilityHttpClient(requestSigner, httpClient);
    }

    /**
     * {@code POST /bucket/key?uploads}
     *
     * @return the upload id
     */
    String prepareMultipartUpload(String bucket, String key, String contentType, Map<String, String> metadataHeaders)
            throws S3ResponseException, IOException;

    /**
     * {@code DELETE /bucket/key?uploadId=U}
     */
    void abortMultipartUpload(String bucket, String key, String uploadId) throws S3ResponseException, IOException;

    /**
     * Presigned {@code PUT /bucket/key?partNumber=N&uploadId=U}. Pure computation, no network.
     */
    PresignedUrl presignedUploadPartRequest(String bucket, String key, String uploadId, int partNumber, Duration signatureDuration);

    /**
     * {@code POST /bucket/key?uploadId=U} listing every part in ascending part number order.
     */
    void completeMultipartUpload(String bucket, String key, String uploadId, Collection<? extends UploadedPart> parts)
            throws S3ResponseException, IOException;

    /**
     * Single {@code PUT /bucket/key} of a small object.
     */
    void putObject(String bucket, String key, byte[] body, String contentType, Map<String, String> metadataHeaders)
            throws S3ResponseException, IOException;

    /**
     * Presigned {@code GET /bucket/key}. Pure computation, no network.
     */
    PresignedUrl presignedGetObjectRequest(String bucket, String key, Duration signatureDuration);

    /**
     * {@code PUT /bucket?cors} replacing the bucket CORS configuration.
     */
    void putBucketCors(String bucket, String corsConfigurationXml) throws S3ResponseException, IOException;

    /**
     * Host the store is reached at, used for best-effort public URLs.
     */
    String endpointHost();

    interface UploadedPart {
        int partNumber();

        String eTag();
    }
}
