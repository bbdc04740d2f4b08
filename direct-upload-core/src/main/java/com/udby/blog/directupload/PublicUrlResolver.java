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

import com.udby.blog.directupload.s3.signing.UriEncoding;

import java.net.URI;
import java.net.URISyntaxException;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * Decides where an object can be read from.
 * <ol>
 *     <li>the configured public base URL, unless its host is a placeholder or local development host</li>
 *     <li>a same-origin proxy path, so local development works without a public domain</li>
 *     <li>a best-effort URL on the store's own host</li>
 * </ol>
 */
public class PublicUrlResolver {
    private static final List<String> PLACEHOLDER_SUFFIXES = List.of(".example", ".invalid", ".localhost", ".test");
    private static final String LOCALHOST = "localhost";

    private final String bucket;
    private final String publicBaseUrl;
    private final String proxyPath;
    private final String endpointHost;

    /**
     * @param bucket        bucket name
     * @param publicBaseUrl configured public base URL, may be null
     * @param proxyPath     proxy path prefix, may be null to disable the proxy
     * @param endpointHost  host of the store endpoint
     */
    public PublicUrlResolver(String bucket, String publicBaseUrl, String proxyPath, String endpointHost) {
        this.bucket = Objects.requireNonNull(bucket, "bucket");
        this.endpointHost = Objects.requireNonNull(endpointHost, "endpointHost");
        this.publicBaseUrl = usableBaseUrl(publicBaseUrl);
        this.proxyPath = proxyPath == null || proxyPath.isBlank() ? null : stripTrailingSlashes(proxyPath.trim());
    }

    public String publicUrl(String key) {
        Objects.requireNonNull(key, "key");
        final var normalizedKey = stripLeadingSlashes(key);
        if (normalizedKey.isEmpty()) {
            throw new IllegalArgumentException("Object key must not be empty");
        }
        if (publicBaseUrl != null) {
            return publicBaseUrl + "/" + normalizedKey;
        }
        if (proxyPath != null) {
            return proxyPath + "/" + UriEncoding.encode(normalizedKey, true);
        }
        return "https://" + bucket + "." + endpointHost + "/" + normalizedKey;
    }

    /**
     * @return the base URL without trailing slashes, or null if absent or a placeholder
     */
    static String usableBaseUrl(String publicBaseUrl) {
        if (publicBaseUrl == null || publicBaseUrl.isBlank()) {
            return null;
        }
        final var trimmed = stripTrailingSlashes(publicBaseUrl.trim());
        return isPlaceholderHost(trimmed) ? null : trimmed;
    }

    static boolean isPlaceholderHost(String baseUrl) {
        final String host;
        try {
            host = new URI(baseUrl).getHost();
        } catch (URISyntaxException e) {
            return true;
        }
        if (host == null) {
            return true;
        }
        final var lowerHost = host.toLowerCase(Locale.ROOT);
        return LOCALHOST.equals(lowerHost) || PLACEHOLDER_SUFFIXES.stream().anyMatch(lowerHost::endsWith);
    }

    private static String stripTrailingSlashes(String value) {
        var end = value.length();
        while (end > 0 && value.charAt(end - 1) == '/') {
            end--;
        }
        return value.substring(0, end);
    }

    private static String stripLeadingSlashes(String value) {
        var start = 0;
        while (start < value.length() && value.charAt(start) == '/') {
            start++;
        }
        return value.substring(start);
    }
}
