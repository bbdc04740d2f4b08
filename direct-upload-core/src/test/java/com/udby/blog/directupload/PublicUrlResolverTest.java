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

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class PublicUrlResolverTest {
    private static final String PROXY = "/api/uploads/r2/object";
    private static final String ENDPOINT_HOST = "account.r2.cloudflarestorage.com";

    @Test
    void publicUrl_realBaseUrl_baseSlashKey() {
        // Given
        final var resolver = new PublicUrlResolver("media", "https://cdn.example.org/", PROXY, ENDPOINT_HOST);

        // When
        final var url = resolver.publicUrl("/uploads/u/file/a b.png");

        // Then
        assertThat(url).isEqualTo("https://cdn.example.org/uploads/u/file/a b.png");
    }

    @ParameterizedTest
    @ValueSource(strings = {
            "https://media.local.example",
            "https://assets.example",
            "http://localhost:3000",
            "https://cdn.invalid",
            "not a url at all"
    })
    void publicUrl_placeholderBaseUrl_proxyPath(String baseUrl) {
        // Given
        final var resolver = new PublicUrlResolver("media", baseUrl, PROXY, ENDPOINT_HOST);

        // When
        final var url = resolver.publicUrl("uploads/u/file/a b.png");

        // Then
        assertThat(url).isEqualTo(PROXY + "/uploads/u/file/a%20b.png");
    }

    @Test
    void publicUrl_noBaseNoProxy_vendorUrl() {
        // Given
        final var resolver = new PublicUrlResolver("media", null, null, ENDPOINT_HOST);

        // When
        final var url = resolver.publicUrl("uploads/x.png");

        // Then
        assertThat(url).isEqualTo("https://media.account.r2.cloudflarestorage.com/uploads/x.png");
    }

    @Test
    void publicUrl_emptyKey_fails() {
        final var resolver = new PublicUrlResolver("media", null, PROXY, ENDPOINT_HOST);

        assertThatThrownBy(() -> resolver.publicUrl("/"))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void isPlaceholderHost_realHost_false() {
        assertThat(PublicUrlResolver.isPlaceholderHost("https://pub-123.r2.dev")).isFalse();
    }
}
