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
package com.udby.blog.directupload.cors;

import com.udby.blog.directupload.config.StorageSettings;

import java.net.URI;
import java.net.URISyntaxException;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * The single CORS rule the bucket gets. Browsers upload parts straight to the store and need to read the ETag of
 * every part back, hence the exposed ETag header.
 */
public record CorsRule(List<String> allowedOrigins,
                       List<String> allowedMethods,
                       List<String> allowedHeaders,
                       List<String> exposeHeaders,
                       int maxAgeSeconds) {
    public static final String ANY_ORIGIN = "*";
    public static final List<String> METHODS = List.of("GET", "PUT", "POST");
    public static final int MAX_AGE_SECONDS = 60 * 60;

    private static final Pattern HTTP_PREFIX = Pattern.compile("^https?://.*", Pattern.CASE_INSENSITIVE);

    public CorsRule {
        allowedOrigins = List.copyOf(allowedOrigins);
        allowedMethods = List.copyOf(allowedMethods);
        allowedHeaders = List.copyOf(allowedHeaders);
        exposeHeaders = List.copyOf(exposeHeaders);
    }

    /**
     * Site origin, public asset origin and any extra configured origins; outside production the wildcard is added,
     * and an otherwise empty set falls back to the wildcard.
     */
    public static CorsRule forSettings(StorageSettings settings) {
        final Set<String> origins = new LinkedHashSet<>();
        addIfPresent(origins, originOf(settings.siteUrl()));
        addIfPresent(origins, originOf(settings.publicBaseUrl()));
        for (final var extra : settings.extraCorsOrigins()) {
            final var origin = originOf(extra);
            addIfPresent(origins, origin != null ? origin : extra);
        }
        if (!settings.operatingMode().isProduction()) {
            origins.add(ANY_ORIGIN);
        }
        if (origins.isEmpty()) {
            origins.add(ANY_ORIGIN);
        }
        return new CorsRule(List.copyOf(origins), METHODS, List.of("*"), List.of("ETag"), MAX_AGE_SECONDS);
    }

    /**
     * @return the {@code CORSConfiguration} document for {@code PUT ?cors}
     */
    public String toXml() {
        final var sb = new StringBuilder(256);
        sb.append("<CORSConfiguration xmlns=\"http://s3.amazonaws.com/doc/2006-03-01/\"><CORSRule>");
        allowedOrigins.forEach(origin -> element(sb, "AllowedOrigin", origin));
        allowedMethods.forEach(method -> element(sb, "AllowedMethod", method));
        allowedHeaders.forEach(header -> element(sb, "AllowedHeader", header));
        exposeHeaders.forEach(header -> element(sb, "ExposeHeader", header));
        element(sb, "MaxAgeSeconds", Integer.toString(maxAgeSeconds));
        sb.append("</CORSRule></CORSConfiguration>");
        return sb.toString();
    }

    /**
     * @return scheme://host[:port] of an URL, the value itself for a bare http(s) origin that does not parse, or null
     */
    static String originOf(String urlLike) {
        if (urlLike == null || urlLike.isBlank()) {
            return null;
        }
        final var value = urlLike.trim();
        try {
            final var uri = new URI(value);
            if (uri.getScheme() != null && uri.getHost() != null) {
                final var scheme = uri.getScheme().toLowerCase(Locale.ROOT);
                final var host = uri.getHost().toLowerCase(Locale.ROOT);
                return uri.getPort() == -1 ? scheme + "://" + host : scheme + "://" + host + ":" + uri.getPort();
            }
        } catch (URISyntaxException e) {
            return lenientOrigin(value);
        }
        return lenientOrigin(value);
    }

    private static String lenientOrigin(String value) {
        return HTTP_PREFIX.matcher(value).matches() ? value : null;
    }

    private static void addIfPresent(Set<String> origins, String origin) {
        if (origin != null && !origin.isBlank()) {
            origins.add(origin);
        }
    }

    private static void element(StringBuilder sb, String name, String value) {
        sb.append('<').append(name).append('>')
                .append(value.replace("&", "&amp;").replace("<", "&lt;").replace(">", "&gt;"))
                .append("</").append(name).append('>');
    }
}
