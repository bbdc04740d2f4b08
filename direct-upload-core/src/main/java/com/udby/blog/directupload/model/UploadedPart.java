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

import com.udby.blog.directupload.s3.StorageFacility;

/**
 * A part the client uploaded, with the ETag the store answered. ETags may arrive with or without quotes.
 */
public record UploadedPart(int partNumber, String eTag) implements StorageFacility.UploadedPart {
    public static UploadedPart of(int partNumber, String eTag) {
        return new UploadedPart(partNumber, eTag);
    }
}
