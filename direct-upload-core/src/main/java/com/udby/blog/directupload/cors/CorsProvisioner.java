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

import com.udby.blog.directupload.s3.S3ResponseException;
import com.udby.blog.directupload.s3.StorageFacility;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;

/**
 * Pushes the bucket CORS rule to the store once per process.
 * <p>
 * Unconfigured, then provisioning, then configured; a failed attempt goes back to unconfigured and the next caller
 * tries again. Concurrent callers during provisioning wait for the attempt already running instead of starting their
 * own. Failures are logged and swallowed, uploads never fail because CORS could not be set.
 * <p>
 * Double-checked like a lazily created singleton: the volatile flag is the fast path, the lock only guards the
 * handle of the attempt in flight and is never held across the network call.
 */
public class CorsProvisioner {
    private static final Logger log = LoggerFactory.getLogger(CorsProvisioner.class);

    private final StorageFacility storageFacility;
    private final String bucket;
    private final CorsRule corsRule;

    private final Object lock = new Object();
    private volatile boolean configured;
    // guarded by lock
    private CompletableFuture<Boolean> inFlight;

    public CorsProvisioner(StorageFacility storageFacility, String bucket, CorsRule corsRule) {
        this.storageFacility = Objects.requireNonNull(storageFacility, "storageFacility");
        this.bucket = Objects.requireNonNull(bucket, "bucket");
        this.corsRule = Objects.requireNonNull(corsRule, "corsRule");
    }

    /**
     * Make sure the CORS rule has been applied, applying it now if nobody has.
     *
     * @return true if the bucket is known to be configured, false if the attempt this call waited for failed
     */
    public boolean ensureConfigured() {
        if (configured) {
            return true;
        }
        final CompletableFuture<Boolean> attempt;
        final boolean leader;
        synchronized (lock) {
            if (configured) {
                return true;
            }
            leader = inFlight == null;
            if (leader) {
                inFlight = new CompletableFuture<>();
            }
            attempt = inFlight;
        }
        if (leader) {
            provision(attempt);
        }
        // never completed exceptionally
        return attempt.join();
    }

    public boolean isConfigured() {
        return configured;
    }

    private void provision(CompletableFuture<Boolean> attempt) {
        var success = false;
        try {
            storageFacility.putBucketCors(bucket, corsRule.toXml());
            success = true;
            log.info("Configured CORS for bucket {}: origins={}", bucket, corsRule.allowedOrigins());
        } catch (S3ResponseException e) {
            log.warn("CORS configuration rejected for bucket {}: status={}, body={}",
                    bucket, e.getResponseStatusCode(), e.responseBodySnippet());
        } catch (IOException | RuntimeException e) {
            log.warn("CORS configuration failed for bucket {}", bucket, e);
        } finally {
            synchronized (lock) {
                if (success) {
                    configured = true;
                }
                inFlight = null;
            }
            attempt.complete(success);
        }
    }
}
