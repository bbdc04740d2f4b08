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

import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;
import java.util.function.Supplier;
import java.util.regex.Pattern;

/**
 * Derives object keys: {@code <prefix>/<owner>/<kind>/<uuid>[-<name>].<ext>}.
 * <p>
 * Owner and kind are reduced to {@code [a-z0-9_-]}, the name is the file name stem (at most 64 characters), the
 * extension comes from the file name, then the content type, then defaults to {@code bin}.
 */
public class ObjectKeys {
    static final String DEFAULT_KIND = "file";
    static final String ANONYMOUS_OWNER = "anonymous";
    static final String DEFAULT_EXTENSION = "bin";
    static final int MAX_STEM_LENGTH = 64;

    private static final Pattern NOT_SEGMENT_CHAR = Pattern.compile("[^a-z0-9_-]+");
    private static final Pattern NOT_STEM_CHAR = Pattern.compile("[^a-z0-9._-]+");
    private static final Pattern DASH_RUN = Pattern.compile("-{2,}");
    private static final Pattern EXTENSION = Pattern.compile("[a-z0-9]{1,10}");

    private static final Map<String, String> EXTENSION_BY_CONTENT_TYPE = Map.ofEntries(
            Map.entry("image/jpeg", "jpg"),
            Map.entry("image/png", "png"),
            Map.entry("image/gif", "gif"),
            Map.entry("image/webp", "webp"),
            Map.entry("image/avif", "avif"),
            Map.entry("image/heic", "heic"),
            Map.entry("image/svg+xml", "svg"),
            Map.entry("video/mp4", "mp4"),
            Map.entry("video/quicktime", "mov"),
            Map.entry("video/webm", "webm"),
            Map.entry("audio/mpeg", "mp3"),
            Map.entry("audio/wav", "wav"),
            Map.entry("audio/ogg", "ogg"),
            Map.entry("application/pdf", "pdf"),
            Map.entry("application/json", "json"),
            Map.entry("application/zip", "zip"),
            Map.entry("text/plain", "txt"),
            Map.entry("text/csv", "csv"),
            Map.entry("text/markdown", "md"));

    private final String prefix;
    private final Supplier<UUID> uuids;

    public ObjectKeys(String prefix, Supplier<UUID> uuids) {
        this.prefix = Objects.requireNonNull(prefix, "prefix");
        this.uuids = Objects.requireNonNull(uuids, "uuids");
    }

    public static ObjectKeys withRandomIds(String prefix) {
        return new ObjectKeys(prefix, UUID::randomUUID);
    }

    public String keyFor(String ownerId, String filename, String contentType, String kind) {
        final var owner = segment(ownerId, ANONYMOUS_OWNER);
        final var kindSegment = segment(kind, DEFAULT_KIND);
        final var stem = stem(filename);
        final var extension = extension(filename, contentType);
        final var name = stem.isEmpty()
                ? uuids.get() + "." + extension
                : uuids.get() + "-" + stem + "." + extension;
        return prefix + "/" + owner + "/" + kindSegment + "/" + name;
    }

    static String segment(String value, String fallback) {
        if (value == null) {
            return fallback;
        }
        final var cleaned = NOT_SEGMENT_CHAR.matcher(value.trim().toLowerCase(Locale.ROOT)).replaceAll("_");
        final var trimmed = trim(cleaned, '_');
        return trimmed.isEmpty() ? fallback : trimmed;
    }

    static String stem(String filename) {
        if (filename == null || filename.isBlank()) {
            return "";
        }
        var name = baseName(filename).toLowerCase(Locale.ROOT);
        final var dot = name.lastIndexOf('.');
        if (dot > 0) {
            name = name.substring(0, dot);
        }
        name = DASH_RUN.matcher(NOT_STEM_CHAR.matcher(name).replaceAll("-")).replaceAll("-");
        name = trim(trim(name, '-'), '.');
        if (name.length() > MAX_STEM_LENGTH) {
            name = trim(name.substring(0, MAX_STEM_LENGTH), '-');
        }
        return name;
    }

    static String extension(String filename, String contentType) {
        if (filename != null) {
            final var name = baseName(filename).toLowerCase(Locale.ROOT);
            final var dot = name.lastIndexOf('.');
            if (dot > 0 && dot < name.length() - 1) {
                final var candidate = name.substring(dot + 1);
                if (EXTENSION.matcher(candidate).matches()) {
                    return candidate;
                }
            }
        }
        if (contentType != null) {
            final var mime = contentType.split(";", 2)[0].trim().toLowerCase(Locale.ROOT);
            final var mapped = EXTENSION_BY_CONTENT_TYPE.get(mime);
            if (mapped != null) {
                return mapped;
            }
        }
        return DEFAULT_EXTENSION;
    }

    private static String baseName(String filename) {
        final var trimmed = filename.trim();
        final var slash = Math.max(trimmed.lastIndexOf('/'), trimmed.lastIndexOf('\\'));
        return slash >= 0 ? trimmed.substring(slash + 1) : trimmed;
    }

    private static String trim(String value, char c) {
        int start = 0;
        int end = value.length();
        while (start < end && value.charAt(start) == c) {
            start++;
        }
        while (end > start && value.charAt(end - 1) == c) {
            end--;
        }
        return value.substring(start, end);
    }
}
