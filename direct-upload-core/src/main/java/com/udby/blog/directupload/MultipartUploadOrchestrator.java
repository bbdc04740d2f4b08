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
package com.udby.blog.directupload;

import com.udby.blog.directupload.cors.CorsProvisioner;
import com.udby.blog.directupload.metadata.MetadataSanitizer;
import com.udby.blog.directupload.model.AbortRequest;
import com.udby.blog.directupload.model.CompletionRequest;
import com.udby.blog.directupload.model.MultipartUploadSession;
import com.udby.blog.directupload.model.PresignedPart;
import com.udby.blog.directupload.model.UploadIntent;
import com.udby.blog.directupload.model.UploadedPart;
import com.udby.blog.directupload.s3.S3ResponseException;
import com.udby.blog.directupload.s3.StorageFacility;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;

/**
 * Drives the multipart upload lifecycle: create (plan parts, presign one PUT URL per part), complete and abort.
 * <p>
 * The bytes never pass through here: the client PUTs every part straight to its presigned URL, collects the ETags
 * and hands them back for completion. Every call is a single attempt, callers decide about retries.
 * <p>
 * Simple usage:
 * <pre>
 * {@code
 *     var session = orchestrator.create(UploadIntent.of("user-42", "holiday.mp4", "video/mp4", size));
 *     // client uploads session.parts() and reports the ETags...
 *     orchestrator.complete(CompletionRequest.of(session.uploadId(), session.key(), uploadedParts));
 * }
 * </pre>
 */
public class MultipartUploadOrchestrator {
    private static final Logger log = LoggerFactory.getLogger(MultipartUploadOrchestrator.class);

    public static final Duration PART_URL_TTL = Duration.ofMinutes(30);

    private final StorageFacility storageFacility;
    private final String bucket;
    private final ObjectKeys objectKeys;
    private final PublicUrlResolver publicUrlResolver;
    private final CorsProvisioner corsProvisioner;
    private final Executor signingExecutor;

    /**
     * @param storageFacility   the store
     * @param bucket            bucket uploads go to
     * @param objectKeys        key derivation
     * @param publicUrlResolver public URL of the finished object
     * @param corsProvisioner   one-time CORS setup, shared by everything using the same bucket
     * @param signingExecutor   executor the per-part signing is fanned out on
     */
    public MultipartUploadOrchestrator(StorageFacility storageFacility,
                                       String bucket,
                                       ObjectKeys objectKeys,
                                       PublicUrlResolver publicUrlResolver,
                                       CorsProvisioner corsProvisioner,
                                       Executor signingExecutor) {
        this.storageFacility = Objects.requireNonNull(storageFacility, "storageFacility");
        this.bucket = Objects.requireNonNull(bucket, "bucket");
        this.objectKeys = Objects.requireNonNull(objectKeys, "objectKeys");
        this.publicUrlResolver = Objects.requireNonNull(publicUrlResolver, "publicUrlResolver");
        this.corsProvisioner = Objects.requireNonNull(corsProvisioner, "corsProvisioner");
        this.signingExecutor = Objects.requireNonNull(signingExecutor, "signingExecutor");
    }

    /**
     * Start a multipart upload and presign every part.
     *
     * @param intent what to upload
     * @return the session the client uploads against
     * @throws S3ResponseException if the store refuses to create the upload
     * @throws IOException         on transport failure
     */
    public MultipartUploadSession create(UploadIntent intent) throws S3ResponseException, IOException {
        Objects.requireNonNull(intent, "intent");
        if (intent.ownerId().isBlank()) {
            throw new IllegalArgumentException("ownerId must not be blank");
        }

        corsProvisioner.ensureConfigured();

        final var key = objectKeys.keyFor(intent.ownerId(), intent.filename(), intent.contentType(), intent.kind());
        final var metadataHeaders = MetadataSanitizer.toHeaders(intent.metadata());

        final var uploadId = storageFacility.prepareMultipartUpload(bucket, key, intent.contentType(), metadataHeaders);

        final var plan = PartPlan.plan(intent.fileSize(), intent.totalParts());
        final List<PresignedPart> parts;
        try {
            parts = presignParts(key, uploadId, plan.partCount());
        } catch (RuntimeException e) {
            abortQuietly(key, uploadId, e);
            throw e;
        }

        log.debug("Multipart upload created: key={}, uploadId={}, partSize={}, parts={}",
                key, uploadId, plan.partSizeBytes(), plan.partCount());

        return new MultipartUploadSession(uploadId, key, bucket, plan.partSizeBytes(), parts, publicUrlResolver.publicUrl(key));
    }

    /**
     * Complete a multipart upload from the parts the client reported.
     *
     * @param request upload id, key and parts in any order
     * @throws IllegalArgumentException if no parts are given
     * @throws S3ResponseException      if the store refuses the completion
     * @throws IOException              on transport failure
     */
    public void complete(CompletionRequest request) throws S3ResponseException, IOException {
        Objects.requireNonNull(request, "request");
        requireSession(request.uploadId(), request.key());
        if (request.parts().isEmpty()) {
            throw new IllegalArgumentException("No parts provided for completion");
        }
        final var parts = request.parts().stream()
                .map(part -> UploadedPart.of(part.partNumber(), stripQuotes(part.eTag())))
                .toList();

        storageFacility.completeMultipartUpload(bucket, request.key(), request.uploadId(), parts);
    }

    /**
     * Abort a multipart upload. Safe to attempt more than once, though the store may reject a repeated abort.
     *
     * @param request upload id and key
     * @throws S3ResponseException if the store refuses the abort
     * @throws IOException         on transport failure
     */
    public void abort(AbortRequest request) throws S3ResponseException, IOException {
        Objects.requireNonNull(request, "request");
        requireSession(request.uploadId(), request.key());
        storageFacility.abortMultipartUpload(bucket, request.key(), request.uploadId());
    }

    private List<PresignedPart> presignParts(String key, String uploadId, int partCount) {
        final var futures = new ArrayList<CompletableFuture<PresignedPart>>(partCount);
        for (int partNumber = 1; partNumber <= partCount; partNumber++) {
            final var number = partNumber;
            // Send this part for signing via the executor
            futures.add(CompletableFuture.supplyAsync(() -> presignPart(key, uploadId, number), signingExecutor));
        }
        try {
            return futures.stream()
                    .map(CompletableFuture::join)
                    .toList();
        } catch (CompletionException e) {
            futures.forEach(future -> future.cancel(false));
            if (e.getCause() instanceof RuntimeException runtimeException) {
                throw runtimeException;
            }
            throw new IllegalStateException("Presigning parts of %s".formatted(key), e.getCause());
        }
    }

    private PresignedPart presignPart(String key, String uploadId, int partNumber) {
        final var presigned = storageFacility.presignedUploadPartRequest(bucket, key, uploadId, partNumber, PART_URL_TTL);
        return new PresignedPart(partNumber, presigned.url(), presigned.expiresAt());
    }

    private void abortQuietly(String key, String uploadId, RuntimeException failure) {
        try {
            storageFacility.abortMultipartUpload(bucket, key, uploadId);
        } catch (IOException | S3ResponseException | RuntimeException e) {
            failure.addSuppressed(e);
            log.warn("Unable to abort multipart upload after failed presigning: key={}, uploadId={}", key, uploadId, e);
        }
    }

    private static void requireSession(String uploadId, String key) {
        if (uploadId == null || uploadId.isBlank()) {
            throw new IllegalArgumentException("uploadId must not be blank");
        }
        if (key == null || key.isBlank()) {
            throw new IllegalArgumentException("key must not be blank");
        }
    }

    static String stripQuotes(String eTag) {
        if (eTag == null) {
            throw new IllegalArgumentException("ETag must not be null");
        }
        return eTag.replace("\"", "");
    }
}
