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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.HexFormat;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

import static com.udby.blog.directupload.s3.signing.MessageDigestHelper.SHA256;

/**
 * Signs requests for the object store, either with an Authorization header (requests we send ourselves) or as a
 * presigned URL (a capability handed to a client that does not hold the credentials).
 * <p>
 * Stateless apart from the credentials, so one instance may sign from any number of threads.
 */
public final class RequestSigner {
    private static final Logger log = LoggerFactory.getLogger(RequestSigner.class);

    public static final String ALGORITHM = SigningKeyChain.SCHEME + "-HMAC-SHA256";
    public static final String UNSIGNED_PAYLOAD = "UNSIGNED-PAYLOAD";
    public static final String EMPTY_BODY_SHA256 = "e3b0c44298fc1c149afbf4c8996fb92427ae41e4649b934ca495991b7852b855";
    public static final Duration MAX_PRESIGNED_EXPIRY = Duration.ofDays(7);

    public static final String X_AMZ_ALGORITHM = "X-Amz-Algorithm";
    public static final String X_AMZ_CREDENTIAL = "X-Amz-Credential";
    public static final String X_AMZ_DATE = "X-Amz-Date";
    public static final String X_AMZ_EXPIRES = "X-Amz-Expires";
    public static final String X_AMZ_SIGNED_HEADERS = "X-Amz-SignedHeaders";
    public static final String X_AMZ_SIGNATURE = "X-Amz-Signature";

    static final String HOST = "host";
    static final String HEADER_X_AMZ_DATE = "x-amz-date";
    static final String HEADER_X_AMZ_CONTENT_SHA256 = "x-amz-content-sha256";
    static final String HEADER_AUTHORIZATION = "Authorization";

    static final DateTimeFormatter DATE_TIME_FORMATTER =
            DateTimeFormatter.ofPattern("yyyyMMdd'T'HHmmss'Z'").withZone(ZoneOffset.UTC);
    static final DateTimeFormatter DATE_STAMP_FORMATTER =
            DateTimeFormatter.ofPattern("yyyyMMdd").withZone(ZoneOffset.UTC);

    private final Credentials credentials;
    private final String baseUrl;
    private final String hostHeader;
    private final Clock clock;

    /**
     * @param credentials credentials and scope
     * @param endpoint    scheme and authority of the store, any path is ignored
     * @param clock       source of signing timestamps
     */
    public RequestSigner(Credentials credentials, URI endpoint, Clock clock) {
        this.credentials = Objects.requireNonNull(credentials, "credentials");
        this.clock = Objects.requireNonNull(clock, "clock");
        Objects.requireNonNull(endpoint, "endpoint");
        if (endpoint.getScheme() == null || endpoint.getHost() == null) {
            throw new IllegalArgumentException("endpoint must be absolute: %s".formatted(endpoint));
        }
        this.hostHeader = hostHeader(endpoint);
        this.baseUrl = endpoint.getScheme() + "://" + endpoint.getRawAuthority();
    }

    /**
     * Sign a request in header mode. The body is hashed for real.
     *
     * @param method       HTTP method
     * @param resourcePath bucket or object
     * @param queryParams  query parameters
     * @param headers      additional headers to sign and send (content-type, x-amz-meta-*, ...)
     * @param body         request body, null or empty for none
     * @return the request to send
     */
    public SignedRequest signHeaders(String method,
                                     ResourcePath resourcePath,
                                     List<QueryParameter> queryParams,
                                     Map<String, String> headers,
                                     byte[] body) {
        final var bodyHash = body == null || body.length == 0 ? EMPTY_BODY_SHA256 : SHA256.hexDigest(body);
        final var timestamp = clock.instant();

        final var signingHeaders = new LinkedHashMap<String, String>();
        headers.forEach((name, value) -> {
            if (!HOST.equalsIgnoreCase(name)) {
                signingHeaders.put(name, value);
            }
        });
        signingHeaders.put(HOST, hostHeader);
        signingHeaders.put(HEADER_X_AMZ_DATE, DATE_TIME_FORMATTER.format(timestamp));
        signingHeaders.put(HEADER_X_AMZ_CONTENT_SHA256, bodyHash);

        final var context = new SigningContext(method, resourcePath, queryParams, signingHeaders, bodyHash, timestamp, false, null);
        final var signature = sign(context);

        final var authorization = ALGORITHM
                + " Credential=" + credentials.accessKeyId() + "/" + signature.credentialScope()
                + ", SignedHeaders=" + signature.canonicalRequest().signedHeaderNames()
                + ", Signature=" + signature.signature();

        final var sendHeaders = new LinkedHashMap<>(signingHeaders);
        sendHeaders.remove(HOST);
        sendHeaders.put(HEADER_AUTHORIZATION, authorization);

        final var query = CanonicalRequest.canonicalQueryString(queryParams);
        final var uri = URI.create(baseUrl + resourcePath.encoded() + (query.isEmpty() ? "" : "?" + query));

        log.debug("Signed {} {} (signed headers: {})", method, uri, signature.canonicalRequest().signedHeaderNames());

        return new SignedRequest(method, uri, sendHeaders, body);
    }

    /**
     * Presign a request. Only the host header is signed and the payload is unsigned, so the holder can send any body.
     *
     * @param method       HTTP method
     * @param resourcePath bucket or object
     * @param queryParams  operation query parameters, e.g. partNumber and uploadId
     * @param expiry       validity, 1 second up to 7 days
     * @return the URL and the instant it expires
     */
    public PresignedUrl presign(String method, ResourcePath resourcePath, List<QueryParameter> queryParams, Duration expiry) {
        Objects.requireNonNull(expiry, "expiry");
        if (expiry.getSeconds() < 1 || expiry.compareTo(MAX_PRESIGNED_EXPIRY) > 0) {
            throw new IllegalArgumentException("Presigned expiry must be between 1s and %s: %s".formatted(MAX_PRESIGNED_EXPIRY, expiry));
        }
        // X-Amz-Expires carries whole seconds only
        final var wholeSeconds = Duration.ofSeconds(expiry.getSeconds());
        final var timestamp = clock.instant();

        final var params = new ArrayList<>(queryParams);
        params.add(QueryParameter.of(X_AMZ_ALGORITHM, ALGORITHM));
        params.add(QueryParameter.of(X_AMZ_CREDENTIAL, credentials.accessKeyId() + "/" + credentialScope(timestamp)));
        params.add(QueryParameter.of(X_AMZ_DATE, DATE_TIME_FORMATTER.format(timestamp)));
        params.add(QueryParameter.of(X_AMZ_EXPIRES, Long.toString(wholeSeconds.getSeconds())));
        params.add(QueryParameter.of(X_AMZ_SIGNED_HEADERS, HOST));

        final var context = new SigningContext(method, resourcePath, params, Map.of(HOST, hostHeader), UNSIGNED_PAYLOAD, timestamp, true, wholeSeconds);
        final var signature = sign(context);

        final var url = baseUrl + resourcePath.encoded()
                + "?" + CanonicalRequest.canonicalQueryString(params)
                + "&" + X_AMZ_SIGNATURE + "=" + signature.signature();

        return new PresignedUrl(url, timestamp.plus(wholeSeconds));
    }

    /**
     * Compute the signature of a fully prepared context.
     *
     * @param context request to sign
     * @return canonical request, scope, string to sign and hex signature
     * @throws IllegalArgumentException when a presigned context's X-Amz-Expires does not match its expiry
     */
    public Signature sign(SigningContext context) {
        if (context.presigned()) {
            checkExpiresParameter(context);
        }
        final var timestamp = context.timestamp();
        final var dateStamp = DATE_STAMP_FORMATTER.format(timestamp);
        final var scope = credentialScope(timestamp);

        final var canonicalRequest = CanonicalRequest.of(
                context.method().toUpperCase(Locale.ROOT),
                context.resourcePath(),
                context.queryParams(),
                context.headers(),
                context.bodyHash());

        final var stringToSign = ALGORITHM + "\n"
                + DATE_TIME_FORMATTER.format(timestamp) + "\n"
                + scope + "\n"
                + SHA256.hexDigest(canonicalRequest.canonicalString().getBytes(StandardCharsets.UTF_8));

        final var signingKey = SigningKeyChain.deriveSigningKey(
                credentials.secretAccessKey(), dateStamp, credentials.region(), credentials.service());
        final var signature = HexFormat.of().formatHex(SigningKeyChain.hmacSha256(signingKey, stringToSign));

        return new Signature(canonicalRequest, scope, stringToSign, signature);
    }

    private static void checkExpiresParameter(SigningContext context) {
        final var expected = Long.toString(context.expiry().getSeconds());
        final var expires = context.queryParams().stream()
                .filter(param -> X_AMZ_EXPIRES.equals(param.name()))
                .map(QueryParameter::value)
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Presigned request without " + X_AMZ_EXPIRES));
        if (!expected.equals(expires)) {
            throw new IllegalArgumentException("%s=%s does not match expiry %s".formatted(X_AMZ_EXPIRES, expires, context.expiry()));
        }
    }

    public String hostHeader() {
        return hostHeader;
    }

    private String credentialScope(Instant timestamp) {
        return DATE_STAMP_FORMATTER.format(timestamp) + "/" + credentials.region() + "/" + credentials.service() + "/" + SigningKeyChain.TERMINATOR;
    }

    /**
     * The Host header as the JDK HttpClient sends it: the port is only present when it is not the scheme default.
     */
    static String hostHeader(URI endpoint) {
        final var host = endpoint.getHost();
        final var port = endpoint.getPort();
        if (port == -1) {
            return host;
        }
        final var defaultPort = "https".equalsIgnoreCase(endpoint.getScheme()) ? 443 : 80;
        return port == defaultPort ? host : host + ":" + port;
    }
}
