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

import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;
import java.nio.charset.StandardCharsets;
import java.security.InvalidKeyException;
import java.security.NoSuchAlgorithmException;

/**
 * Derives the request scoped signing key from the long-lived secret:
 * <pre>
 *     kDate    = HMAC("AWS4" + secret, yyyyMMdd)
 *     kRegion  = HMAC(kDate, region)
 *     kService = HMAC(kRegion, service)
 *     kSigning = HMAC(kService, "aws4_request")
 * </pre>
 * Keys are derived per signing call and never cached, so a rotated secret is picked up immediately.
 */
public final class SigningKeyChain {
    static final String SCHEME = "AWS4";
    static final String TERMINATOR = "aws4_request";
    private static final String HMAC_SHA256 = "HmacSHA256";

    private SigningKeyChain() {
    }

    /**
     * @param secretAccessKey secret access key
     * @param dateStamp       UTC date as yyyyMMdd
     * @param region          signing region
     * @param service         signing service
     * @return the signing key for that day, region and service
     */
    public static byte[] deriveSigningKey(String secretAccessKey, String dateStamp, String region, String service) {
        if (dateStamp.length() != 8) {
            throw new IllegalArgumentException("dateStamp must be yyyyMMdd: %s".formatted(dateStamp));
        }
        final var kSecret = (SCHEME + secretAccessKey).getBytes(StandardCharsets.UTF_8);
        final var kDate = hmacSha256(kSecret, dateStamp);
        final var kRegion = hmacSha256(kDate, region);
        final var kService = hmacSha256(kRegion, service);
        return hmacSha256(kService, TERMINATOR);
    }

    /**
     * @param key  HMAC key
     * @param data data, UTF-8 encoded before signing
     * @return HMAC-SHA256 of data
     */
    public static byte[] hmacSha256(byte[] key, String data) {
        try {
            final var mac = Mac.getInstance(HMAC_SHA256);
            mac.init(new SecretKeySpec(key, HMAC_SHA256));
            return mac.doFinal(data.getBytes(StandardCharsets.UTF_8));
        } catch (NoSuchAlgorithmException | InvalidKeyException e) {
            throw new SigningException("Unable to compute %s".formatted(HMAC_SHA256), e);
        }
    }
}
