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
package com.udby.blog.directupload.config;

import com.udby.blog.directupload.s3.signing.Credentials;

import java.net.URI;
import java.net.URISyntaxException;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Storage configuration, read once at startup and never changed afterwards.
 *
 * @param credentials      access key, secret and signing scope
 * @param endpoint         store endpoint (scheme and authority)
 * @param bucket           bucket all objects live in
 * @param uploadPrefix     first segment of generated object keys
 * @param publicBaseUrl    base URL objects are publicly served from, may be null
 * @param siteUrl          URL of the hosting site, its origin is allowed by CORS; may be null
 * @param extraCorsOrigins additional origins allowed by CORS
 * @param proxyPath        same-origin path objects are proxied under when there is no public base URL; null disables
 * @param operatingMode    production or not
 */
public record StorageSettings(Credentials credentials,
                              URI endpoint,
                              String bucket,
                              String uploadPrefix,
                              String publicBaseUrl,
                              String siteUrl,
                              List<String> extraCorsOrigins,
                              String proxyPath,
                              OperatingMode operatingMode) {
    public static final String ACCOUNT_ID = "R2_ACCOUNT_ID";
    public static final String ACCESS_KEY_ID = "R2_ACCESS_KEY_ID";
    public static final String SECRET_ACCESS_KEY = "R2_SECRET_ACCESS_KEY";
    public static final String BUCKET = "R2_BUCKET";
    public static final String ENDPOINT = "R2_ENDPOINT";
    public static final String UPLOAD_PREFIX = "R2_UPLOAD_PREFIX";
    public static final String PUBLIC_BASE_URL = "R2_PUBLIC_BASE_URL";
    public static final String PROXY_PATH = "R2_PROXY_PATH";
    public static final String SITE_URL = "SITE_URL";
    public static final String CORS_ORIGINS = "UPLOAD_CORS_ORIGINS";
    public static final String APP_ENVIRONMENT = "APP_ENVIRONMENT";

    public static final String DEFAULT_UPLOAD_PREFIX = "uploads";
    public static final String DEFAULT_PROXY_PATH = "/api/uploads/r2/object";
    static final String ACCOUNT_HOST_SUFFIX = ".r2.cloudflarestorage.com";

    public StorageSettings {
        Objects.requireNonNull(credentials, "credentials");
        Objects.requireNonNull(endpoint, "endpoint");
        Objects.requireNonNull(bucket, "bucket");
        Objects.requireNonNull(operatingMode, "operatingMode");
        uploadPrefix = normalizePrefix(uploadPrefix);
        extraCorsOrigins = extraCorsOrigins == null ? List.of() : List.copyOf(extraCorsOrigins);
        publicBaseUrl = blankToNull(publicBaseUrl);
        siteUrl = blankToNull(siteUrl);
        proxyPath = blankToNull(proxyPath);
    }

    /**
     * Read settings from environment style variables, normally {@link System#getenv()}.
     *
     * @param env variables
     * @return settings
     * @throws StorageConfigurationException if a required value is missing or the endpoint is not a valid URI
     */
    public static StorageSettings fromEnvironment(Map<String, String> env) throws StorageConfigurationException {
        final var accessKeyId = required(env, ACCESS_KEY_ID);
        final var secretAccessKey = required(env, SECRET_ACCESS_KEY);
        final var bucket = required(env, BUCKET);

        final var endpoint = endpoint(env);
        final var credentials = Credentials.forR2(accessKeyId, secretAccessKey, endpoint.getRawAuthority());

        // absent means default, present but blank disables the proxy
        final var proxyPath = env.containsKey(PROXY_PATH) ? env.get(PROXY_PATH) : DEFAULT_PROXY_PATH;

        return new StorageSettings(
                credentials,
                endpoint,
                bucket,
                env.get(UPLOAD_PREFIX),
                env.get(PUBLIC_BASE_URL),
                env.get(SITE_URL),
                splitOrigins(env.get(CORS_ORIGINS)),
                proxyPath,
                OperatingMode.parse(env.get(APP_ENVIRONMENT)));
    }

    private static URI endpoint(Map<String, String> env) throws StorageConfigurationException {
        final var override = blankToNull(env.get(ENDPOINT));
        if (override != null) {
            try {
                final var uri = new URI(override.trim());
                if (uri.getScheme() == null || uri.getHost() == null) {
                    throw new StorageConfigurationException("%s must be an absolute URL: %s".formatted(ENDPOINT, override));
                }
                return uri;
            } catch (URISyntaxException e) {
                throw new StorageConfigurationException("%s is not a valid URL: %s".formatted(ENDPOINT, override), e);
            }
        }
        final var accountId = required(env, ACCOUNT_ID);
        return URI.create("https://" + accountId + ACCOUNT_HOST_SUFFIX);
    }

    private static String required(Map<String, String> env, String name) throws StorageConfigurationException {
        final var value = blankToNull(env.get(name));
        if (value == null) {
            throw new StorageConfigurationException("Missing required storage setting %s".formatted(name));
        }
        return value.trim();
    }

    static String normalizePrefix(String prefix) {
        if (prefix == null) {
            return DEFAULT_UPLOAD_PREFIX;
        }
        var trimmed = prefix.trim();
        while (trimmed.endsWith("/")) {
            trimmed = trimmed.substring(0, trimmed.length() - 1);
        }
        while (trimmed.startsWith("/")) {
            trimmed = trimmed.substring(1);
        }
        return trimmed.isEmpty() ? DEFAULT_UPLOAD_PREFIX : trimmed;
    }

    private static List<String> splitOrigins(String value) {
        if (value == null || value.isBlank()) {
            return List.of();
        }
        return Arrays.stream(value.split(","))
                .map(String::trim)
                .filter(origin -> !origin.isEmpty())
                .toList();
    }

    private static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value;
    }
}
