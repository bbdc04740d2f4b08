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

import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * The canonical form of a request: the exact text that is hashed and signed.
 * <p>
 * Query parameters and headers are sorted by ordinal (byte-wise for ASCII) comparison, since the store rebuilds the
 * same string on its side and any ordering difference breaks the signature.
 *
 * @param canonicalString the newline separated canonical request
 * @param signedHeaders   lower-case header names in sorted order
 */
public record CanonicalRequest(String canonicalString, List<String> signedHeaders) {
    private static final Pattern WHITESPACE_RUN = Pattern.compile("\\s+");

    private static final Comparator<QueryParameter> QUERY_ORDER = Comparator
            .comparing(QueryParameter::encodedName)
            .thenComparing(QueryParameter::encodedValue);

    public CanonicalRequest {
        Objects.requireNonNull(canonicalString, "canonicalString");
        signedHeaders = List.copyOf(signedHeaders);
    }

    /**
     * Build the canonical request.
     *
     * @param method       HTTP method, upper-case
     * @param resourcePath logical resource path, encoded here
     * @param queryParams  query parameters in any order, repeated names allowed
     * @param headers      headers to sign; names differing only by case are folded into one comma joined value
     * @param payloadHash  hex SHA-256 of the body or {@link RequestSigner#UNSIGNED_PAYLOAD}
     * @return the canonical request
     */
    public static CanonicalRequest of(String method,
                                      ResourcePath resourcePath,
                                      List<QueryParameter> queryParams,
                                      Map<String, String> headers,
                                      String payloadHash) {
        final var canonicalHeaders = canonicalHeaders(headers);
        final var signedHeaders = List.copyOf(canonicalHeaders.keySet());

        final var sb = new StringBuilder(256);
        sb.append(method).append('\n');
        sb.append(resourcePath.encoded()).append('\n');
        sb.append(canonicalQueryString(queryParams)).append('\n');
        canonicalHeaders.forEach((name, value) -> sb.append(name).append(':').append(value).append('\n'));
        sb.append('\n');
        sb.append(String.join(";", signedHeaders)).append('\n');
        sb.append(payloadHash);

        return new CanonicalRequest(sb.toString(), signedHeaders);
    }

    public String signedHeaderNames() {
        return String.join(";", signedHeaders);
    }

    /**
     * @return encoded {@code name=value} pairs sorted by name then value and joined by '&amp;', empty for no parameters
     */
    public static String canonicalQueryString(List<QueryParameter> queryParams) {
        return queryParams.stream()
                .sorted(QUERY_ORDER)
                .map(parameter -> parameter.encodedName() + "=" + parameter.encodedValue())
                .collect(Collectors.joining("&"));
    }

    /**
     * @return lower-case header name to trimmed, whitespace collapsed value, sorted by name
     */
    static TreeMap<String, String> canonicalHeaders(Map<String, String> headers) {
        // fold names that only differ by case, keeping encounter order of the values
        final var folded = new LinkedHashMap<String, String>();
        headers.forEach((name, value) -> {
            final var lowerName = name.toLowerCase(Locale.ROOT).trim();
            final var normalizedValue = value == null ? "" : WHITESPACE_RUN.matcher(value.trim()).replaceAll(" ");
            folded.merge(lowerName, normalizedValue, (existing, added) -> existing + "," + added);
        });
        return new TreeMap<>(folded);
    }
}
