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

import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.assertj.core.api.Assertions.assertThat;

class UriEncodingTest {
    @ParameterizedTest
    @CsvSource({
            "abcXYZ019-_.~, abcXYZ019-_.~",
            "a b, a%20b",
            "a+b=c&d, a%2Bb%3Dc%26d",
            "æøå, %C3%A6%C3%B8%C3%A5",
            "uploads/user/file.png, uploads%2Fuser%2Ffile.png"
    })
    void encode_queryComponent_succeeds(String value, String expected) {
        assertThat(UriEncoding.encode(value, false)).isEqualTo(expected);
    }

    @ParameterizedTest
    @CsvSource({
            "/bucket/uploads/user/file.png, /bucket/uploads/user/file.png",
            "/bucket/my file (1).png, /bucket/my%20file%20%281%29.png"
    })
    void encode_path_keepsSlashes(String value, String expected) {
        assertThat(UriEncoding.encode(value, true)).isEqualTo(expected);
    }
}
