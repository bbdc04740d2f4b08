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

import java.util.List;
import java.util.Map;

/**
 * Request to complete a multipart upload. Parts may be listed in any order.
 *
 * @param uploadId upload id from the session
 * @param key      object key from the session
 * @param parts    uploaded parts
 * @param metadata application metadata for the finished object, recorded with the completion event only
 */
public record CompletionRequest(String uploadId, String key, List<UploadedPart> parts, Map<String, ?> metadata) {
    public CompletionRequest {
        parts = parts == null ? List.of() : List.copyOf(parts);
        metadata = metadata == null ? Map.of() : metadata;
    }

    public static CompletionRequest of(String uploadId, String key, List<UploadedPart> parts) {
        return new CompletionRequest(uploadId, key, parts, null);
    }
}
