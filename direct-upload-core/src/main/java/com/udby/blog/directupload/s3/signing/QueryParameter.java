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
 * One query parameter, unencoded. A {@code null} value means a bare parameter such as {@code ?uploads}, which
 * canonicalizes as {@code uploads=}.
 */
public record QueryParameter(String name, String value) {
    public QueryParameter {
        Objects.requireNonNull(name, "name");
    }

    public static QueryParameter of(String name, String value) {
        return new QueryParameter(name, value);
    }

    public static QueryParameter flag(String name) {
        return new QueryParameter(name, null);
    }

    String encodedName() {
        return UriEncoding.encode(name, false);
    }

    String encodedValue() {
        return value == null ? "" : UriEncoding.encode(value, false);
    }
}
