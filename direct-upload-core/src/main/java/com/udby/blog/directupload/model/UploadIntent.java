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
 * What the application wants to upload. Everything but the owner is optional.
 *
 * @param ownerId     id of the owning user, becomes part of the object key
 * @param filename    original file name, may be null
 * @param contentType MIME type, may be null
 * @param fileSize    size in bytes if known, may be null
 * @param totalParts  number of parts the client intends to send, may be null
 * @param kind        logical kind of upload (e.g. "profile_avatar"), may be null
 * @param metadata    arbitrary metadata stored with the object, may be null
 */
public record UploadIntent(String ownerId,
                           String filename,
                           String contentType,
                           Long fileSize,
                           Integer totalParts,
                           String kind,
                           Map<String, ?> metadata) {
    public UploadIntent {
        Objects.requireNonNull(ownerId, "ownerId");
        metadata = metadata == null ? Map.of() : metadata;
    }

    public static UploadIntent of(String ownerId, String filename, String contentType, Long fileSize) {
        return new UploadIntent(ownerId, filename, contentType, fileSize, null, null, null);
    }
}
