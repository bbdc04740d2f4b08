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
package com.udby.blog.directupload.telemetry;

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.HashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class Slf4jStorageTelemetryTest {
    @Test
    void record_successAndFailure_doNotThrow() {
        // Given
        final var telemetry = new Slf4jStorageTelemetry();

        // When / Then
        assertThatCode(() -> {
            telemetry.record(StorageEvent.succeeded(Operation.UPLOAD_BUFFER, Duration.ofMillis(12), Map.of("key", "a.png")));
            telemetry.record(StorageEvent.failed(Operation.MULTIPART_CREATE, Duration.ofMillis(40), Map.of(),
                    new IllegalStateException("boom")));
        }).doesNotThrowAnyException();
    }

    @Test
    void storageEvent_attributesCopied() {
        // Given
        final var attributes = new HashMap<String, Object>();
        attributes.put("key", "a.png");

        // When
        final var event = StorageEvent.succeeded(Operation.PUBLIC_URL, Duration.ZERO, attributes);
        attributes.put("key", "changed");

        // Then
        assertThat(event.attributes()).containsEntry("key", "a.png");
        assertThat(event.failure()).isNull();
    }

    @Test
    void storageEvent_failedWithoutCause_rejected() {
        assertThatThrownBy(() -> StorageEvent.failed(Operation.PUBLIC_URL, Duration.ZERO, Map.of(), null))
                .isInstanceOf(NullPointerException.class);
    }
}
