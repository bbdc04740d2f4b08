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
package com.udby.blog.directupload.model;

import java.util.Map;
import java.util.Objects;

/**
 * A small object to store in one request.
 *
 * @param key         object key
 * @param body        content
 * @param contentType MIME type, may be null
 * @param metadata    arbitrary metadata, may be null
 */
public record BufferUpload(String key, byte[] body, String contentType, Map<String, ?> metadata) {
    public BufferUpload {
        Objects.requireNonNull(key, "key");
        Objects.requireNonNull(body, "body");
        metadata = metadata == null ? Map.of() : metadata;
    }
}
