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

/**
 * How a file is cut into parts for a multipart upload.
 * <p>
 * Part size is {@code ceil(fileSize / 10000)} bounded to [8M, 5G], or 16M when the size is unknown. Part count is what
 * the client asked for, or whatever covers the file at that part size, bounded to [1, 10000].
 *
 * @param partSizeBytes size of every part but the last
 * @param partCount     number of parts to presign
 */
public record PartPlan(long partSizeBytes, int partCount) {
    public static final long ONE_K = 1024L;
    public static final long ONE_M = ONE_K * ONE_K;
    public static final long ONE_G = ONE_M * ONE_K;

    public static final int MAX_PARTS = 10_000;
    public static final long MIN_PART_SIZE = 8 * ONE_M;
    public static final long MAX_PART_SIZE = 5 * ONE_G;
    public static final long DEFAULT_PART_SIZE = 16 * ONE_M;

    /**
     * @param fileSize   file size in bytes, null or non-positive if unknown
     * @param totalParts requested part count, null or non-positive to derive it from the size
     * @return the plan
     */
    public static PartPlan plan(Long fileSize, Integer totalParts) {
        final var partSize = partSize(fileSize);
        final long wanted;
        if (totalParts != null && totalParts > 0) {
            wanted = totalParts;
        } else {
            final var size = fileSize != null && fileSize > 0 ? fileSize : partSize;
            wanted = ceilDiv(size, partSize);
        }
        final var count = (int) Math.max(1L, Math.min(wanted, MAX_PARTS));
        return new PartPlan(partSize, count);
    }

    static long partSize(Long fileSize) {
        if (fileSize == null || fileSize <= 0) {
            return DEFAULT_PART_SIZE;
        }
        final var raw = ceilDiv(fileSize, MAX_PARTS);
        return Math.min(Math.max(raw, MIN_PART_SIZE), MAX_PART_SIZE);
    }

    private static long ceilDiv(long dividend, long divisor) {
        return -Math.floorDiv(-dividend, divisor);
    }
}
