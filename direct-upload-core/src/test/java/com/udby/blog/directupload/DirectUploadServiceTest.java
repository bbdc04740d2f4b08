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

import com.github.tomakehurst.wiremock.junit5.WireMockRuntimeInfo;
import com.github.tomakehurst.wiremock.junit5.WireMockTest;
import com.udby.blog.directupload.config.StorageSettings;
import com.udby.blog.directupload.model.AbortRequest;
import com.udby.blog.directupload.model.BufferUpload;
import com.udby.blog.directupload.model.CompletionRequest;
import com.udby.blog.directupload.model.UploadIntent;
import com.udby.blog.directupload.model.UploadedPart;
import com.udby.blog.directupload.telemetry.Operation;
import com.udby.blog.directupload.telemetry.StorageEvent;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.CopyOnWriteArrayList;

import static com.github.tomakehurst.wiremock.client.WireMock.aResponse;
import static com.github.tomakehurst.wiremock.client.WireMock.delete;
import static com.github.tomakehurst.wiremock.client.WireMock.givenThat;
import static com.github.tomakehurst.wiremock.client.WireMock.noContent;
import static com.github.tomakehurst.wiremock.client.WireMock.ok;
import static com.github.tomakehurst.wiremock.client.WireMock.okXml;
import static com.github.tomakehurst.wiremock.client.WireMock.post;
import static com.github.tomakehurst.wiremock.client.WireMock.put;
import static com.github.tomakehurst.wiremock.client.WireMock.urlEqualTo;
import static com.github.tomakehurst.wiremock.client.WireMock.urlPathEqualTo;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.tuple;

@WireMockTest
class DirectUploadServiceTest {
    private static final Instant NOW = Instant.parse("2025-03-01T12:00:00Z");
    private static final UUID FIXED = UUID.fromString("00000000-0000-0000-0000-000000000007");
    private static final String KEY = "media-uploads/user-9/file/" + FIXED + "-report.pdf";

    private final List<StorageEvent> events = new CopyOnWriteArrayList<>();
    private DirectUploadService service;

    @BeforeEach
    void setUp(WireMockRuntimeInfo wmRuntimeInfo) throws Exception {
        final var env = new HashMap<String, String>();
        env.put(StorageSettings.ENDPOINT, wmRuntimeInfo.getHttpBaseUrl());
        env.put(StorageSettings.ACCESS_KEY_ID, "key");
        env.put(StorageSettings.SECRET_ACCESS_KEY, "secret");
        env.put(StorageSettings.BUCKET, "media");
        env.put(StorageSettings.UPLOAD_PREFIX, "media-uploads/");
        env.put(StorageSettings.PUBLIC_BASE_URL, "https://media.local.example");
        final var settings = StorageSettings.fromEnvironment(env);

        service = new DirectUploadService(settings, Clock.fixed(NOW, ZoneOffset.UTC), null, events::add, () -> FIXED);

        givenThat(put(urlEqualTo("/media?cors="))
                .willReturn(ok()));
    }

    @AfterEach
    void tearDown() {
        service.close();
    }

    @Test
    void multipartLifecycle_sunshine_telemetryRecorded() throws Exception {
        // Given
        givenThat(post(urlEqualTo("/media/" + KEY + "?uploads="))
                .willReturn(okXml("<InitiateMultipartUploadResult><UploadId>u-9</UploadId></InitiateMultipartUploadResult>")));
        givenThat(post(urlEqualTo("/media/" + KEY + "?uploadId=u-9"))
                .willReturn(okXml("<CompleteMultipartUploadResult/>")));

        // When
        final var session = service.createMultipartUpload(UploadIntent.of("user-9", "Report.pdf", "application/pdf", 20 * PartPlan.ONE_M));
        service.completeMultipartUpload(CompletionRequest.of(session.uploadId(), session.key(), List.of(
                UploadedPart.of(1, "\"a\""), UploadedPart.of(3, "\"c\""), UploadedPart.of(2, "\"b\""))));

        // Then
        assertThat(session.key()).isEqualTo(KEY);
        assertThat(session.parts()).hasSize(3);
        assertThat(session.absoluteUrl()).isEqualTo("/api/uploads/r2/object/" + KEY);
        assertThat(service.corsProvisioner().isConfigured()).isTrue();
        assertThat(events)
                .extracting(StorageEvent::operation, StorageEvent::success)
                .containsExactly(
                        tuple(Operation.MULTIPART_CREATE, true),
                        tuple(Operation.MULTIPART_COMPLETE, true));
        assertThat(events.get(0).attributes())
                .containsEntry("key", KEY)
                .containsEntry("partSize", 8 * PartPlan.ONE_M)
                .containsEntry("parts", 3);
        assertThat(events.get(1).attributes())
                .containsEntry("key", KEY)
                .containsEntry("uploadId", "u-9")
                .containsEntry("parts", 3)
                .doesNotContainKey("metadata");
    }

    @Test
    void completeMultipartUpload_withMetadata_sanitizedMetadataRecorded() throws Exception {
        // Given
        givenThat(post(urlEqualTo("/media/" + KEY + "?uploadId=u-9"))
                .willReturn(okXml("<CompleteMultipartUploadResult/>")));
        final var request = new CompletionRequest("u-9", KEY, List.of(UploadedPart.of(1, "\"a\"")),
                Map.of("Post ID", "p-77\n"));

        // When
        service.completeMultipartUpload(request);

        // Then
        assertThat(events).singleElement().satisfies(event -> {
            assertThat(event.operation()).isEqualTo(Operation.MULTIPART_COMPLETE);
            assertThat(event.success()).isTrue();
            assertThat(event.attributes())
                    .containsEntry("key", KEY)
                    .containsEntry("parts", 1)
                    .containsEntry("metadata", Map.of("post_id", "p-77"));
        });
    }

    @Test
    void createMultipartUpload_storeFails_initFailedWithStatus() {
        // Given
        givenThat(post(urlPathEqualTo("/media/" + KEY))
                .willReturn(aResponse().withStatus(503)));

        // When / Then
        assertThatThrownBy(() -> service.createMultipartUpload(UploadIntent.of("user-9", "Report.pdf", "application/pdf", 1L)))
                .isInstanceOfSatisfying(StorageServiceException.class, e -> {
                    assertThat(e.errorCode()).isEqualTo(ErrorCode.MULTIPART_INIT_FAILED);
                    assertThat(e.statusCode()).hasValue(503);
                });
        assertThat(events).singleElement().satisfies(event -> {
            assertThat(event.operation()).isEqualTo(Operation.MULTIPART_CREATE);
            assertThat(event.success()).isFalse();
            assertThat(event.failure()).isNotNull();
            assertThat(event.attributes()).containsEntry("ownerId", "user-9").doesNotContainKey("key");
        });
    }

    @Test
    void completeMultipartUpload_noParts_completeFailed() {
        assertThatThrownBy(() -> service.completeMultipartUpload(CompletionRequest.of("u-9", KEY, List.of())))
                .isInstanceOfSatisfying(StorageServiceException.class, e -> {
                    assertThat(e.errorCode()).isEqualTo(ErrorCode.MULTIPART_COMPLETE_FAILED);
                    assertThat(e.statusCode()).isEmpty();
                    assertThat(e.getCause()).isInstanceOf(IllegalArgumentException.class);
                });
    }

    @Test
    void abortMultipartUpload_sunshine() throws Exception {
        // Given
        givenThat(delete(urlEqualTo("/media/" + KEY + "?uploadId=u-9"))
                .willReturn(noContent()));

        // When
        service.abortMultipartUpload(new AbortRequest("u-9", KEY));

        // Then
        assertThat(events).singleElement().satisfies(event -> {
            assertThat(event.operation()).isEqualTo(Operation.MULTIPART_ABORT);
            assertThat(event.attributes()).containsEntry("key", KEY);
        });
    }

    @Test
    void abortMultipartUpload_storeFails_abortFailed() {
        // Given
        givenThat(delete(urlEqualTo("/media/" + KEY + "?uploadId=u-9"))
                .willReturn(aResponse().withStatus(404)));

        // When / Then
        assertThatThrownBy(() -> service.abortMultipartUpload(new AbortRequest("u-9", KEY)))
                .isInstanceOfSatisfying(StorageServiceException.class, e ->
                        assertThat(e.errorCode()).isEqualTo(ErrorCode.MULTIPART_ABORT_FAILED));
    }

    @Test
    void uploadBuffer_sunshine() throws Exception {
        // Given
        givenThat(put(urlEqualTo("/media/avatars/u.png"))
                .willReturn(ok()));

        // When
        final var stored = service.uploadBuffer(new BufferUpload("avatars/u.png", new byte[]{1, 2}, "image/png", null));

        // Then
        assertThat(stored.url()).isEqualTo("/api/uploads/r2/object/avatars/u.png");
        assertThat(events).singleElement().satisfies(event -> {
            assertThat(event.operation()).isEqualTo(Operation.UPLOAD_BUFFER);
            assertThat(event.attributes())
                    .containsEntry("key", "avatars/u.png")
                    .containsEntry("bytes", 2)
                    .containsEntry("contentType", "image/png");
        });
    }

    @Test
    void uploadBuffer_storeFails_uploadFailed() {
        // Given
        givenThat(put(urlEqualTo("/media/avatars/u.png"))
                .willReturn(aResponse().withStatus(500)));

        // When / Then
        assertThatThrownBy(() -> service.uploadBuffer(new BufferUpload("avatars/u.png", new byte[]{1, 2}, "image/png", null)))
                .isInstanceOfSatisfying(StorageServiceException.class, e -> {
                    assertThat(e.errorCode()).isEqualTo(ErrorCode.UPLOAD_FAILED);
                    assertThat(e.statusCode()).hasValue(500);
                });
        assertThat(events).singleElement().satisfies(event -> {
            assertThat(event.success()).isFalse();
            assertThat(event.attributes())
                    .containsEntry("key", "avatars/u.png")
                    .containsEntry("contentType", "image/png")
                    .doesNotContainKey("bytes");
        });
    }

    @Test
    void getPublicUrl_emptyKey_unavailable() {
        assertThatThrownBy(() -> service.getPublicUrl(""))
                .isInstanceOfSatisfying(StorageServiceException.class, e ->
                        assertThat(e.errorCode()).isEqualTo(ErrorCode.PUBLIC_URL_UNAVAILABLE));
    }

    @Test
    void getSignedObjectUrl_defaultExpiry_oneHour() throws Exception {
        // When
        final var presignedUrl = service.getSignedObjectUrl("private/doc.pdf");

        // Then
        assertThat(presignedUrl.url()).contains("/media/private/doc.pdf?").contains("X-Amz-Expires=3600");
        assertThat(presignedUrl.expiresAt()).isEqualTo(NOW.plus(Duration.ofHours(1)));
    }

    @Test
    void getSignedObjectUrl_tooLong_signedUrlFailed() {
        assertThatThrownBy(() -> service.getSignedObjectUrl("private/doc.pdf", Duration.ofDays(8)))
                .isInstanceOfSatisfying(StorageServiceException.class, e ->
                        assertThat(e.errorCode()).isEqualTo(ErrorCode.SIGNED_URL_FAILED));
    }

    @Test
    void getUploadPrefix_normalized_telemetryRecorded() {
        // When
        final var prefix = service.getUploadPrefix();

        // Then
        assertThat(prefix).isEqualTo("media-uploads");
        assertThat(events).singleElement().satisfies(event -> {
            assertThat(event.operation()).isEqualTo(Operation.UPLOAD_PREFIX);
            assertThat(event.success()).isTrue();
            assertThat(event.attributes()).containsEntry("prefix", "media-uploads");
        });
    }
}
