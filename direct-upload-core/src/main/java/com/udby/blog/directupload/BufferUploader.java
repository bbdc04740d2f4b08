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

import com.udby.blog.directupload.metadata.MetadataSanitizer;
import com.udby.blog.directupload.model.BufferUpload;
import com.udby.blog.directupload.model.StoredObject;
import com.udby.blog.directupload.s3.S3ResponseException;
import com.udby.blog.directupload.s3.StorageFacility;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.Objects;

/**
 * Uploads a small, fully buffered object with one header-signed PUT.
 */
public class BufferUploader {
    private static final Logger log = LoggerFactory.getLogger(BufferUploader.class);

    private final StorageFacility storageFacility;
    private final String bucket;
    private final PublicUrlResolver publicUrlResolver;

    public BufferUploader(StorageFacility storageFacility, String bucket, PublicUrlResolver publicUrlResolver) {
        this.storageFacility = Objects.requireNonNull(storageFacility, "storageFacility");
        this.bucket = Objects.requireNonNull(bucket, "bucket");
        this.publicUrlResolver = Objects.requireNonNull(publicUrlResolver, "publicUrlResolver");
    }

    public StoredObject upload(BufferUpload upload) throws S3ResponseException, IOException {
        Objects.requireNonNull(upload, "upload");
        final var key = stripLeadingSlashes(upload.key());
        if (key.isBlank()) {
            throw new IllegalArgumentException("key must not be blank");
        }

        storageFacility.putObject(bucket, key, upload.body(), upload.contentType(),
                MetadataSanitizer.toHeaders(upload.metadata()));

        log.debug("Uploaded {} bytes to {}", upload.body().length, key);

        return new StoredObject(key, publicUrlResolver.publicUrl(key));
    }

    private static String stripLeadingSlashes(String key) {
        var start = 0;
        while (start < key.length() && key.charAt(start) == '/') {
            start++;
        }
        return key.substring(start);
    }
}
