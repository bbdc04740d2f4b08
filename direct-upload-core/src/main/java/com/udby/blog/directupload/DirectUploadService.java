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

import com.udby.blog.directupload.config.StorageSettings;
import com.udby.blog.directupload.cors.CorsProvisioner;
import com.udby.blog.directupload.cors.CorsRule;
import com.udby.blog.directupload.metadata.MetadataSanitizer;
import com.udby.blog.directupload.model.AbortRequest;
import com.udby.blog.directupload.model.BufferUpload;
import com.udby.blog.directupload.model.CompletionRequest;
import com.udby.blog.directupload.model.MultipartUploadSession;
import com.udby.blog.directupload.model.StoredObject;
import com.udby.blog.directupload.model.UploadIntent;
import com.udby.blog.directupload.s3.StorageFacility;
import com.udby.blog.directupload.s3.signing.PresignedUrl;
import com.udby.blog.directupload.s3.signing.RequestSigner;
import com.udby.blog.directupload.telemetry.Operation;
import com.udby.blog.directupload.telemetry.Slf4jStorageTelemetry;
import com.udby.blog.directupload.telemetry.StorageEvent;
import com.udby.blog.directupload.telemetry.StorageTelemetry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * Entry point for the application: direct browser uploads to an S3-compatible bucket.
 * <p>
 * Every operation is reported to {@link StorageTelemetry} and every failure surfaces as a
 * {@link StorageServiceException} carrying an {@link ErrorCode}. One instance per process; it owns its signing
 * executor unless one is passed in, and {@link #close()} shuts an owned executor down.
 * <p>
 * Simple usage:
 * <pre>
 * {@code
 *     try (var service = DirectUploadService.create(StorageSettings.fromEnvironment(System.getenv()))) {
 *         var session = service.createMultipartUpload(UploadIntent.of(userId, "clip.mp4", "video/mp4", size));
 *         ...
 *     }
 * }
 * </pre>
 */
public class DirectUploadService implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(DirectUploadService.class);

    public static final Duration DEFAULT_SIGNED_URL_EXPIRY = Duration.ofHours(1);
    static final int SIGNING_THREADS = 4;

    private final StorageSettings settings;
    private final StorageFacility storageFacility;
    private final PublicUrlResolver publicUrlResolver;
    private final CorsProvisioner corsProvisioner;
    private final MultipartUploadOrchestrator orchestrator;
    private final BufferUploader bufferUploader;
    private final StorageTelemetry telemetry;
    private final ExecutorService signingExecutor;
    private final boolean ownsExecutor;

    /**
     * @param settings        storage settings
     * @param clock           clock signatures are timestamped with
     * @param signingExecutor executor for per-part signing, or null to create and own one
     * @param telemetry       receives one event per operation
     * @param uuids           source of the unique part of object keys
     */
    public DirectUploadService(StorageSettings settings,
                               Clock clock,
                               ExecutorService signingExecutor,
                               StorageTelemetry telemetry,
                               Supplier<UUID> uuids) {
        this.settings = Objects.requireNonNull(settings, "settings");
        this.telemetry = Objects.requireNonNull(telemetry, "telemetry");
        this.ownsExecutor = signingExecutor == null;
        this.signingExecutor = ownsExecutor ? newSigningExecutor() : signingExecutor;

        final var requestSigner = new RequestSigner(settings.credentials(), settings.endpoint(), clock);
        this.storageFacility = StorageFacility.forSigner(requestSigner);
        this.publicUrlResolver = new PublicUrlResolver(settings.bucket(), settings.publicBaseUrl(),
                settings.proxyPath(), storageFacility.endpointHost());
        this.corsProvisioner = new CorsProvisioner(storageFacility, settings.bucket(), CorsRule.forSettings(settings));
        this.orchestrator = new MultipartUploadOrchestrator(storageFacility, settings.bucket(),
                new ObjectKeys(settings.uploadPrefix(), uuids), publicUrlResolver, corsProvisioner, this.signingExecutor);
        this.bufferUploader = new BufferUploader(storageFacility, settings.bucket(), publicUrlResolver);
    }

    public static DirectUploadService create(StorageSettings settings) {
        return new DirectUploadService(settings, Clock.systemUTC(), null, new Slf4jStorageTelemetry(), UUID::randomUUID);
    }

    public MultipartUploadSession createMultipartUpload(UploadIntent intent) throws StorageServiceException {
        final var attributes = attributes("ownerId", intent == null ? null : intent.ownerId(),
                "contentType", intent == null ? null : intent.contentType());
        return observe(Operation.MULTIPART_CREATE, ErrorCode.MULTIPART_INIT_FAILED, attributes,
                session -> attributes("key", session.key(),
                        "uploadId", session.uploadId(),
                        "partSize", session.partSizeBytes(),
                        "parts", session.parts().size()),
                () -> orchestrator.create(intent));
    }

    public void completeMultipartUpload(CompletionRequest request) throws StorageServiceException {
        final var attributes = attributes("key", request == null ? null : request.key(),
                "uploadId", request == null ? null : request.uploadId(),
                "parts", request == null ? null : request.parts().size());
        final var metadata = request == null ? Map.<String, String>of() : MetadataSanitizer.sanitize(request.metadata());
        if (!metadata.isEmpty()) {
            attributes.put("metadata", metadata);
        }
        observe(Operation.MULTIPART_COMPLETE, ErrorCode.MULTIPART_COMPLETE_FAILED, attributes, ignored -> attributes, () -> {
            orchestrator.complete(request);
            return null;
        });
    }

    public void abortMultipartUpload(AbortRequest request) throws StorageServiceException {
        final var attributes = attributes("key", request == null ? null : request.key(),
                "uploadId", request == null ? null : request.uploadId());
        observe(Operation.MULTIPART_ABORT, ErrorCode.MULTIPART_ABORT_FAILED, attributes, ignored -> attributes, () -> {
            orchestrator.abort(request);
            return null;
        });
    }

    public String getPublicUrl(String key) throws StorageServiceException {
        final var attributes = attributes("key", key);
        return observe(Operation.PUBLIC_URL, ErrorCode.PUBLIC_URL_UNAVAILABLE, attributes, ignored -> attributes,
                () -> publicUrlResolver.publicUrl(key));
    }

    public StoredObject uploadBuffer(BufferUpload upload) throws StorageServiceException {
        final var attributes = attributes("key", upload == null ? null : upload.key(),
                "contentType", upload == null ? null : upload.contentType());
        return observe(Operation.UPLOAD_BUFFER, ErrorCode.UPLOAD_FAILED, attributes,
                stored -> attributes("key", stored.key(),
                        "bytes", upload.body().length,
                        "contentType", upload.contentType()),
                () -> bufferUploader.upload(upload));
    }

    public PresignedUrl getSignedObjectUrl(String key) throws StorageServiceException {
        return getSignedObjectUrl(key, DEFAULT_SIGNED_URL_EXPIRY);
    }

    public PresignedUrl getSignedObjectUrl(String key, Duration expiry) throws StorageServiceException {
        final var attributes = attributes("key", key);
        return observe(Operation.SIGNED_URL, ErrorCode.SIGNED_URL_FAILED, attributes,
                presigned -> attributes("key", key, "expiresAt", presigned.expiresAt()), () -> {
            Objects.requireNonNull(key, "key");
            if (key.isBlank()) {
                throw new IllegalArgumentException("key must not be blank");
            }
            return storageFacility.presignedGetObjectRequest(settings.bucket(), key, expiry);
        });
    }

    public String getUploadPrefix() {
        final var started = System.nanoTime();
        final var prefix = settings.uploadPrefix();
        telemetry.record(StorageEvent.succeeded(Operation.UPLOAD_PREFIX, elapsedSince(started), attributes("prefix", prefix)));
        return prefix;
    }

    CorsProvisioner corsProvisioner() {
        return corsProvisioner;
    }

    @Override
    public void close() {
        if (!ownsExecutor) {
            return;
        }
        signingExecutor.shutdown();
        try {
            if (!signingExecutor.awaitTermination(10, TimeUnit.SECONDS)) {
                log.warn("Signing executor did not terminate in time");
                signingExecutor.shutdownNow();
            }
        } catch (InterruptedException e) {
            signingExecutor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    /**
     * Run one operation, report it and wrap any failure.
     *
     * @param failureAttributes attributes known up front, reported on failure
     * @param successAttributes attributes derived from the result, reported on success
     */
    private <T> T observe(Operation operation,
                          ErrorCode errorCode,
                          Map<String, Object> failureAttributes,
                          Function<T, Map<String, Object>> successAttributes,
                          StorageCall<T> call) throws StorageServiceException {
        final var started = System.nanoTime();
        final T result;
        try {
            result = call.call();
        } catch (Exception e) {
            telemetry.record(StorageEvent.failed(operation, elapsedSince(started), failureAttributes, e));
            throw new StorageServiceException(errorCode, "%s failed: %s".formatted(operation, e.getMessage()), e);
        }
        telemetry.record(StorageEvent.succeeded(operation, elapsedSince(started), successAttributes.apply(result)));
        return result;
    }

    private static Duration elapsedSince(long startedNanos) {
        return Duration.ofNanos(System.nanoTime() - startedNanos);
    }

    private static Map<String, Object> attributes(Object... namesAndValues) {
        final var attributes = new LinkedHashMap<String, Object>();
        for (int i = 0; i + 1 < namesAndValues.length; i += 2) {
            if (namesAndValues[i + 1] != null) {
                attributes.put((String) namesAndValues[i], namesAndValues[i + 1]);
            }
        }
        return attributes;
    }

    private static ExecutorService newSigningExecutor() {
        final var counter = new AtomicInteger();
        return Executors.newFixedThreadPool(SIGNING_THREADS, runnable -> {
            final var thread = new Thread(runnable, "direct-upload-signer-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        });
    }

    @FunctionalInterface
    private interface StorageCall<T> {
        T call() throws Exception;
    }
}
