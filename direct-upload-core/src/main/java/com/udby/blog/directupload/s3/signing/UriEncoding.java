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

import java.nio.charset.StandardCharsets;

/**
 * Percent-encoding as the signature scheme defines it: RFC 3986 unreserved characters are kept, every other byte of
 * the UTF-8 representation becomes {@code %XX} with upper-case hex.
 */
public final class UriEncoding {
    private static final char[] HEX_DIGITS = "0123456789ABCDEF".toCharArray();

    private UriEncoding() {
    }

    /**
     * @param value         value to encode
     * @param keepPathSlash true to leave '/' alone (paths), false to encode it (query names and values)
     * @return the encoded value
     */
    public static String encode(String value, boolean keepPathSlash) {
        final var bytes = value.getBytes(StandardCharsets.UTF_8);
        final var sb = new StringBuilder(bytes.length + 16);
        for (final byte b : bytes) {
            final int c = b & 0xFF;
            if (isUnreserved(c) || (keepPathSlash && c == '/')) {
                sb.append((char) c);
            } else {
                appendEscaped(sb, c);
            }
        }
        return sb.toString();
    }

    public static void appendEscaped(StringBuilder sb, int octet) {
        sb.append('%')
                .append(HEX_DIGITS[(octet >> 4) & 0x0F])
                .append(HEX_DIGITS[octet & 0x0F]);
    }

    private static boolean isUnreserved(int c) {
        return (c >= 'A' && c <= 'Z')
                || (c >= 'a' && c <= 'z')
                || (c >= '0' && c <= '9')
                || c == '-' || c == '_' || c == '.' || c == '~';
    }
}
