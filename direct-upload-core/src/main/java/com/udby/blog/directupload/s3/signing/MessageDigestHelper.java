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

import java.nio.ByteBuffer;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.Base64;
import java.util.HexFormat;

/**
 * Helps doing message digests (SHA-256 payload hashes, MD5 content checksums) in a thread-safe not-synchronized manner...
 * <p>
 * Each thread gets its own clone of a prototype digest, so no instance is ever shared between threads.
 */
public class MessageDigestHelper {
    public static final MessageDigestHelper SHA256 = new MessageDigestHelper("SHA-256");
    public static final MessageDigestHelper MD5 = new MessageDigestHelper("MD5");

    private static final HexFormat HEX = HexFormat.of();

    private final MessageDigest prototype;
    private final ThreadLocal<MessageDigest> perThread = ThreadLocal.withInitial(this::clonedPrototype);

    public MessageDigestHelper(String algorithm) {
        try {
            final var messageDigest = MessageDigest.getInstance(algorithm);
            // fail fast if the provider cannot clone
            cloned(messageDigest);
            this.prototype = messageDigest;
        } catch (NoSuchAlgorithmException e) {
            throw new SigningException("Digest algorithm not available: %s".formatted(algorithm), e);
        }
    }

    private MessageDigest clonedPrototype() {
        return cloned(prototype);
    }

    private static MessageDigest cloned(MessageDigest messageDigest) {
        try {
            return (MessageDigest) messageDigest.clone();
        } catch (CloneNotSupportedException e) {
            throw new SigningException("Digest cannot be cloned: %s".formatted(messageDigest.getAlgorithm()), e);
        }
    }

    public byte[] digest(ByteBuffer byteBuffer) {
        final var digest = perThread.get();
        try {
            digest.update(byteBuffer);
            return digest.digest();
        } finally {
            digest.reset();
        }
    }

    public byte[] digest(byte[] bytes) {
        return digest(ByteBuffer.wrap(bytes));
    }

    /**
     * @return lower-case hex digest, as used for x-amz-content-sha256 and the canonical request hash
     */
    public String hexDigest(byte[] bytes) {
        return HEX.formatHex(digest(bytes));
    }

    /**
     * @return base64 digest, as used for Content-MD5
     */
    public String base64Digest(byte[] bytes) {
        return Base64.getEncoder().encodeToString(digest(bytes));
    }
}
