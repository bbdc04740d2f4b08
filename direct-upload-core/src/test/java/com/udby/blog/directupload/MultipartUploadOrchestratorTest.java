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
import com.udby.blog.directupload.cors.CorsProvisioner;
import com.udby.blog.directupload.cors.CorsRule;
import com.udby.blog.directupload.model.AbortRequest;
import com.udby.blog.directupload.model.CompletionRequest;
import com.udby.blog.directupload.model.UploadIntent;
import com.udby.blog.directupload.model.UploadedPart;
import com.udby.blog.directupload.s3.S3ResponseException;
import com.udby.blog.directupload.s3.StorageFacility;
import com.udby.blog.directupload.s3.signing.Credentials;
import com.udby.blog.directupload.s3.signing.RequestSigner;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.net.URI;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static com.github.tomakehurst.wiremock.client.WireMock.aResponse;
import static com.github.tomakehurst.wiremock.client.WireMock.delete;
import static com.github.tomakehurst.wiremock.client.WireMock.deleteRequestedFor;
import static com.github.tomakehurst.wiremock.client.WireMock.equalTo;
import static com.github.tomakehurst.wiremock.client.WireMock.exactly;
import static com.github.tomakehurst.wiremock.client.WireMock.givenThat;
import static com.github.tomakehurst.wiremock.client.WireMock.noContent;
import static com.github.tomakehurst.wiremock.client.WireMock.ok;
import static com.github.tomakehurst.wiremock.client.WireMock.okXml;
import static com.github.tomakehurst.wiremock.client.WireMock.post;
import static com.github.tomakehurst.wiremock.client.WireMock.postRequestedFor;
import static com.github.tomakehurst.wiremock.client.WireMock.put;
import static com.github.tomakehurst.wiremock.client.WireMock.putRequestedFor;
import static com.github.tomakehurst.wiremock.client.WireMock.urlEqualTo;
import static com.github.tomakehurst.wiremock.client.WireMock.urlPathEqualTo;
import static com.github.tomakehurst.wiremock.client.WireMock.verify;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@WireMockTest
class MultipartUploadOrchestratorTest {
    private static final Instant NOW = Instant.parse("2025-03-01T12:00:00Z");
    private static final UUID FIXED = UUID.fromString("00000000-0000-0000-0000-00000000002a");
    private static final String KEY = "uploads/user-1/video/" + FIXED + "-clip.mp4";
    private static final String OBJECT_URL = "/media/" + KEY;

    private ExecutorService executor;
    private MultipartUploadOrchestrator orchestrator;

    @BeforeEach
    void setUp(WireMockRuntimeInfo wmRuntimeInfo) {
        final var endpoint = URI.create(wmRuntimeInfo.getHttpBaseUrl());
        final var signer = new RequestSigner(Credentials.forR2("key", "secret", endpoint.getAuthority()), endpoint,
                Clock.fixed(NOW, ZoneOffset.UTC));
        final var storageFacility = StorageFacility.forSigner(signer);
        final var corsProvisioner = new CorsProvisioner(storageFacility, "media",
                new CorsRule(List.of("*"), CorsRule.METHODS, List.of("*"), List.of("ETag"), 3600));
        executor = Executors.newFixedThreadPool(4);
        orchestrator = new MultipartUploadOrchestrator(storageFacility, "media",
                new ObjectKeys("uploads", () -> FIXED),
                new PublicUrlResolver("media", "https://cdn.example.org", null, storageFacility.endpointHost()),
                corsProvisioner, executor);

        givenThat(put(urlEqualTo("/media?cors="))
                .willReturn(ok()));
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    private static void givenCreateSucceeds() {
        givenThat(post(urlEqualTo(OBJECT_URL + "?uploads="))
                .willReturn(okXml("<InitiateMultipartUploadResult><UploadId>upload-1</UploadId></InitiateMultipartUploadResult>")));
    }

    @Test
    void create_100M_thirteenPresignedParts() throws Exception {
        // Given
        givenCreateSucceeds();
        final var intent = new UploadIntent("user-1", "clip.mp4", "video/mp4", 100 * PartPlan.ONE_M, null, "video",
                Map.of("Original Name", "clip.mp4"));

        // When
        final var session = orchestrator.create(intent);

        // Then
        assertThat(session.uploadId()).isEqualTo("upload-1");
        assertThat(session.key()).isEqualTo(KEY);
        assertThat(session.bucket()).isEqualTo("media");
        assertThat(session.partSizeBytes()).isEqualTo(8 * PartPlan.ONE_M);
        assertThat(session.absoluteUrl()).isEqualTo("https://cdn.example.org/" + KEY);
        assertThat(session.parts()).hasSize(13);
        for (int i = 0; i < session.parts().size(); i++) {
            final var part = session.parts().get(i);
            assertThat(part.partNumber()).isEqualTo(i + 1);
            assertThat(part.url())
                    .contains("partNumber=" + (i + 1))
                    .contains("uploadId=upload-1")
                    .contains("X-Amz-Expires=1800");
            assertThat(part.expiresAt()).isEqualTo(NOW.plus(MultipartUploadOrchestrator.PART_URL_TTL));
        }

        verify(exactly(1), putRequestedFor(urlEqualTo("/media?cors=")));
        verify(postRequestedFor(urlEqualTo(OBJECT_URL + "?uploads="))
                .withHeader("x-amz-meta-original_name", equalTo("clip.mp4"))
                .withHeader("Content-Type", equalTo("video/mp4")));
    }

    @Test
    void create_unknownSize_singlePart() throws Exception {
        // Given
        givenCreateSucceeds();

        // When
        final var session = orchestrator.create(new UploadIntent("user-1", "clip.mp4", "video/mp4", null, null, "video", null));

        // Then
        assertThat(session.partSizeBytes()).isEqualTo(16 * PartPlan.ONE_M);
        assertThat(session.parts()).hasSize(1);
    }

    @Test
    void create_corsFailing_uploadStillCreated() throws Exception {
        // Given
        givenThat(put(urlEqualTo("/media?cors="))
                .willReturn(aResponse().withStatus(403)));
        givenCreateSucceeds();

        // When
        final var session = orchestrator.create(new UploadIntent("user-1", "clip.mp4", "video/mp4", 1L, null, "video", null));

        // Then
        assertThat(session.uploadId()).isEqualTo("upload-1");
    }

    @Test
    void create_storeRefuses_responseException() {
        // Given
        givenThat(post(urlPathEqualTo(OBJECT_URL))
                .willReturn(aResponse().withStatus(500)));

        // When / Then
        assertThatThrownBy(() -> orchestrator.create(new UploadIntent("user-1", "clip.mp4", "video/mp4", 1L, null, "video", null)))
                .isInstanceOf(S3ResponseException.class);
    }

    @Test
    void create_blankOwner_fails() {
        assertThatThrownBy(() -> orchestrator.create(UploadIntent.of(" ", "clip.mp4", "video/mp4", 1L)))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void complete_quotedEtagsOutOfOrder_sortedAndUnquoted() throws Exception {
        // Given
        givenThat(post(urlEqualTo(OBJECT_URL + "?uploadId=upload-1"))
                .willReturn(okXml("<CompleteMultipartUploadResult/>")));

        // When
        orchestrator.complete(CompletionRequest.of("upload-1", KEY, List.of(
                UploadedPart.of(2, "\"etag-2\""), UploadedPart.of(1, "\"etag-1\""))));

        // Then
        verify(postRequestedFor(urlEqualTo(OBJECT_URL + "?uploadId=upload-1"))
                .withRequestBody(equalTo("<CompleteMultipartUpload xmlns=\"http://s3.amazonaws.com/doc/2006-03-01/\">"
                        + "<Part><PartNumber>1</PartNumber><ETag>etag-1</ETag></Part>"
                        + "<Part><PartNumber>2</PartNumber><ETag>etag-2</ETag></Part>"
                        + "</CompleteMultipartUpload>")));
    }

    @Test
    void complete_noParts_fails() {
        assertThatThrownBy(() -> orchestrator.complete(CompletionRequest.of("upload-1", KEY, List.of())))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessage("No parts provided for completion");
    }

    @Test
    void complete_blankUploadId_fails() {
        assertThatThrownBy(() -> orchestrator.complete(CompletionRequest.of("", KEY, List.of(UploadedPart.of(1, "a")))))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void abort_sunshine_deleteSent() throws Exception {
        // Given
        givenThat(delete(urlEqualTo(OBJECT_URL + "?uploadId=upload-1"))
                .willReturn(noContent()));

        // When
        orchestrator.abort(new AbortRequest("upload-1", KEY));
        orchestrator.abort(new AbortRequest("upload-1", KEY));

        // Then
        verify(exactly(2), deleteRequestedFor(urlEqualTo(OBJECT_URL + "?uploadId=upload-1")));
    }

    @Test
    void stripQuotes() {
        assertThat(MultipartUploadOrchestrator.stripQuotes("\"abc\"")).isEqualTo("abc");
        assertThat(MultipartUploadOrchestrator.stripQuotes("abc")).isEqualTo("abc");
    }
}
