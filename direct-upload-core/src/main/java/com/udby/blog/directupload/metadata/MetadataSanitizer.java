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
package com.udby.blog.directupload.metadata;

import com.udby.blog.directupload.s3.signing.UriEncoding;

import java.nio.charset.StandardCharsets;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Turns caller supplied metadata into values that are safe to send as {@code x-amz-meta-*} headers.
 * <ul>
 *     <li>keys: lower-case, anything outside {@code [a-z0-9._-]} becomes '_', leading and trailing '_' trimmed</li>
 *     <li>values: control characters removed, non-ASCII and '%' percent-encoded (UTF-8), trimmed, at most
 *     {@value #MAX_VALUE_BYTES} bytes without cutting a {@code %XX} escape in half</li>
 * </ul>
 * Entries with an empty key or value after sanitizing are dropped.
 */
public final class MetadataSanitizer {
    public static final String HEADER_PREFIX = "x-amz-meta-";
    public static final int MAX_VALUE_BYTES = 1024;

    private MetadataSanitizer() {
    }

    /**
     * @param metadata arbitrary metadata, null values are skipped, other values rendered with {@link String#valueOf}
     * @return sanitized key to value, in input order; a later key that sanitizes to an existing one replaces it
     */
    public static Map<String, String> sanitize(Map<String, ?> metadata) {
        if (metadata == null || metadata.isEmpty()) {
            return Map.of();
        }
        final var sanitized = new LinkedHashMap<String, String>();
        metadata.forEach((rawKey, rawValue) -> {
            if (rawKey == null || rawValue == null) {
                return;
            }
            final var key = sanitizeKey(rawKey);
            final var value = sanitizeValue(String.valueOf(rawValue));
            if (!key.isEmpty() && !value.isEmpty()) {
                sanitized.put(key, value);
            }
        });
        return Collections.unmodifiableMap(sanitized);
    }

    /**
     * @return sanitized metadata as {@code x-amz-meta-<key>} headers
     */
    public static Map<String, String> toHeaders(Map<String, ?> metadata) {
        final var headers = new LinkedHashMap<String, String>();
        sanitize(metadata).forEach((key, value) -> headers.put(HEADER_PREFIX + key, value));
        return Collections.unmodifiableMap(headers);
    }

    static String sanitizeKey(String rawKey) {
        final var lower = rawKey.toLowerCase(Locale.ROOT);
        final var sb = new StringBuilder(lower.length());
        for (int i = 0; i < lower.length(); i++) {
            final char c = lower.charAt(i);
            sb.append(isKeyChar(c) ? c : '_');
        }
        int start = 0;
        int end = sb.length();
        while (start < end && sb.charAt(start) == '_') {
            start++;
        }
        while (end > start && sb.charAt(end - 1) == '_') {
            end--;
        }
        return sb.substring(start, end);
    }

    static String sanitizeValue(String rawValue) {
        final var sb = new StringBuilder(rawValue.length());
        rawValue.codePoints()
                .filter(codePoint -> !Character.isISOControl(codePoint))
                .forEach(codePoint -> {
                    if (codePoint == '%') {
                        UriEncoding.appendEscaped(sb, codePoint);
                    } else if (codePoint < 0x80) {
                        sb.append((char) codePoint);
                    } else {
                        for (final byte b : new String(Character.toChars(codePoint)).getBytes(StandardCharsets.UTF_8)) {
                            UriEncoding.appendEscaped(sb, b & 0xFF);
                        }
                    }
                });
        final var trimmed = sb.toString().trim();
        // only ASCII left, so one char is one byte
        return truncate(trimmed).trim();
    }

    private static String truncate(String value) {
        if (value.length() <= MAX_VALUE_BYTES) {
            return value;
        }
        var end = MAX_VALUE_BYTES;
        // every '%' left starts an escape, back up if the cut lands inside one
        if (value.charAt(end - 1) == '%') {
            end -= 1;
        } else if (value.charAt(end - 2) == '%') {
            end -= 2;
        }
        return value.substring(0, end);
    }

    private static boolean isKeyChar(char c) {
        return (c >= 'a' && c <= 'z') || (c >= '0' && c <= '9') || c == '.' || c == '_' || c == '-';
    }
}
