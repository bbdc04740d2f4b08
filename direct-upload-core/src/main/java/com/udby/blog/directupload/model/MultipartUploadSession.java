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

/**
 * A started multipart upload. {@code uploadId} and {@code key} must be handed back to complete or abort it.
 *
 * @param uploadId      id the store assigned
 * @param key           object key
 * @param bucket        bucket
 * @param partSizeBytes size every part but the last must have
 * @param parts         one presigned URL per part, ascending part numbers
 * @param absoluteUrl   where the object can be read once completed
 */
public record MultipartUploadSession(String uploadId,
                                     String key,
                                     String bucket,
                                     long partSizeBytes,
                                     List<PresignedPart> parts,
                                     String absoluteUrl) {
    public MultipartUploadSession {
        parts = List.copyOf(parts);
    }
}
