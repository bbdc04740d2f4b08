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

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SigningKeyChainTest {
    @Test
    void deriveSigningKey_publishedExample_matches() {
        // When
        final var signingKey = SigningKeyChain.deriveSigningKey(
                "wJalrXUtnFEMI/K7MDENG+bPxRfiCYEXAMPLEKEY", "20120215", "us-east-1", "iam");

        // Then
        assertThat(signingKey).asHexString()
                .isEqualToIgnoringCase("f4780e2d9f65fa895f9c67b32ce1baf0b0d8a43505a000a1a9e090d414db404d");
    }

    @Test
    void deriveSigningKey_differentDay_differentKey() {
        // When
        final var monday = SigningKeyChain.deriveSigningKey("secret", "20240101", "auto", "s3");
        final var tuesday = SigningKeyChain.deriveSigningKey("secret", "20240102", "auto", "s3");

        // Then
        assertThat(monday).isNotEqualTo(tuesday);
    }

    @Test
    void deriveSigningKey_badDateStamp_fails() {
        assertThatThrownBy(() -> SigningKeyChain.deriveSigningKey("secret", "2024-01-01", "auto", "s3"))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
