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

import java.util.Objects;

/**
 * Long-lived credentials for the object store. The region is always "auto" and the service always "s3" for R2,
 * other values are accepted to allow verification against published test vectors.
 *
 * @param accessKeyId     access key id, goes into the credential scope
 * @param secretAccessKey secret, only ever used as HMAC seed
 * @param region          signing region
 * @param service         signing service
 * @param accountHost     host of the account endpoint, e.g. {@code <account>.r2.cloudflarestorage.com}
 */
public record Credentials(String accessKeyId, String secretAccessKey, String region, String service, String accountHost) {
    public static final String AUTO_REGION = "auto";
    public static final String S3_SERVICE = "s3";

    public Credentials {
        Objects.requireNonNull(accessKeyId, "accessKeyId");
        Objects.requireNonNull(secretAccessKey, "secretAccessKey");
        Objects.requireNonNull(region, "region");
        Objects.requireNonNull(service, "service");
        Objects.requireNonNull(accountHost, "accountHost");
    }

    public static Credentials forR2(String accessKeyId, String secretAccessKey, String accountHost) {
        return new Credentials(accessKeyId, secretAccessKey, AUTO_REGION, S3_SERVICE, accountHost);
    }

    @Override
    public String toString() {
        return "Credentials[accessKeyId=%s, secretAccessKey=****, region=%s, service=%s, accountHost=%s]"
                .formatted(accessKeyId, region, service, accountHost);
    }
}
