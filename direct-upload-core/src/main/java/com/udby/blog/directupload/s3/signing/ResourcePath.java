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

import java.util.Objects;

/**
 * Logical, unencoded path of a bucket or an object. Slashes inside the object key are path separators and survive
 * encoding, every segment is encoded on its own.
 */
public record ResourcePath(String path) {
    public ResourcePath {
        Objects.requireNonNull(path, "path");
        if (!path.startsWith("/")) {
            path = "/" + path;
        }
    }

    public static ResourcePath forBucket(String bucket) {
        return new ResourcePath("/" + bucket);
    }

    public static ResourcePath forObject(String bucket, String key) {
        return new ResourcePath("/" + bucket + "/" + key);
    }

    public String encoded() {
        return UriEncoding.encode(path, true);
    }
}
