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

import java.net.URI;
import java.util.Map;

/**
 * A header-signed request ready to send.
 *
 * @param method  HTTP method
 * @param uri     full request URI, query in canonical form
 * @param headers headers to send including Authorization, without host (the HTTP client adds that one)
 * @param body    request body, empty array when none
 */
public record SignedRequest(String method, URI uri, Map<String, String> headers, byte[] body) {
    public SignedRequest {
        headers = Map.copyOf(headers);
        body = body == null ? new byte[0] : body;
    }
}
