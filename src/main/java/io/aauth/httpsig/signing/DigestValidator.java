/*
 * Copyright 2025 Red Hat, Inc. and/or its affiliates
 * and other contributors as indicated by the @author tags.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package io.aauth.httpsig.signing;

import io.aauth.httpsig.signing.exceptions.HttpSignatureException;
import io.aauth.httpsig.signing.exceptions.SignatureVerificationException;
import org.jboss.logging.Logger;
import org.keycloak.common.util.MultivaluedHashMap;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.Base64;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Creates and validates {@code Digest} header values per RFC 3230.
 *
 * Format: {@code SHA-256=base64digest}, several digests separated by commas.
 * Example: {@code SHA-256=X48E9qOokqqrvdts8nOJRJN3OWDUoyWxBf7kbu9DBPE=}
 *
 * A signature only protects the body if {@code digest} is covered and the digest
 * is checked against the body that was actually received.
 */
public class DigestValidator {

    private static final Logger logger = Logger.getLogger(DigestValidator.class);

    public static final String DIGEST_HEADER = "digest";

    public static final String SHA_256 = "SHA-256";
    public static final String SHA_512 = "SHA-512";

    private DigestValidator() {
    }

    /**
     * Validate a {@code Digest} header value against the body.
     *
     * At least one listed algorithm must be supported; every supported one that is listed must match.
     *
     * @param digestHeader The Digest header value (e.g. "SHA-256=base64")
     * @param body The received body bytes, null is treated as empty
     * @throws SignatureVerificationException If no algorithm is supported or a digest does not match
     */
    public static void validateDigest(String digestHeader, byte[] body) throws SignatureVerificationException {
        if (digestHeader == null || digestHeader.trim().isEmpty()) {
            throw new SignatureVerificationException(HttpSignatureException.Reason.MISSING_SIGNED_HEADER,
                "Digest header is missing or empty");
        }
        if (body == null) {
            body = new byte[0];
        }

        MultivaluedHashMap<String, String> digests = parseDigestHeader(digestHeader);

        boolean validated = false;
        for (Map.Entry<String, List<String>> entry : digests.entrySet()) {
            String algorithm = entry.getKey();
            if (!isSupported(algorithm)) {
                logger.debugf("Skipping unsupported algorithm in Digest: %s", algorithm);
                continue;
            }

            byte[] actual = calculate(body, algorithm).getBytes(StandardCharsets.US_ASCII);
            // A repeated algorithm must match on every occurrence
            for (String value : entry.getValue()) {
                if (!MessageDigest.isEqual(value.getBytes(StandardCharsets.US_ASCII), actual)) {
                    throw new SignatureVerificationException(HttpSignatureException.Reason.DIGEST_MISMATCH,
                        "Digest validation failed: " + algorithm + " digest does not match body");
                }
            }
            validated = true;
        }

        if (!validated) {
            throw new SignatureVerificationException(HttpSignatureException.Reason.UNSUPPORTED_DIGEST,
                "No supported algorithm in Digest header, only " + SHA_256 + " and " + SHA_512 + " are supported");
        }
        logger.debugf("Digest validated against %d body bytes", body.length);
    }

    /**
     * Build a {@code Digest} header value for the body.
     *
     * @param body The body bytes, null is treated as empty
     * @param algorithm {@link #SHA_256} or {@link #SHA_512}, case-insensitive
     * @return The header value, e.g. "SHA-256=base64"
     * @throws HttpSignatureException If the algorithm is not supported
     */
    public static String createDigest(byte[] body, String algorithm) throws HttpSignatureException {
        String normalized = algorithm == null ? null : algorithm.trim().toUpperCase(Locale.ROOT);
        if (!isSupported(normalized)) {
            throw new HttpSignatureException(HttpSignatureException.Reason.UNSUPPORTED_DIGEST,
                "Unsupported digest algorithm: " + algorithm);
        }
        return normalized + "=" + calculate(body == null ? new byte[0] : body, normalized);
    }

    /**
     * Parse a Digest header into algorithm (upper case) to base64 value.
     */
    static MultivaluedHashMap<String, String> parseDigestHeader(String header) {
        MultivaluedHashMap<String, String> digests = new MultivaluedHashMap<>();
        for (String part : header.split(",")) {
            part = part.trim();
            int equalsIndex = part.indexOf('=');
            if (equalsIndex <= 0) {
                continue;
            }
            String algorithm = part.substring(0, equalsIndex).trim().toUpperCase(Locale.ROOT);
            String value = part.substring(equalsIndex + 1).trim();
            if (!value.isEmpty()) {
                digests.add(algorithm, value);
            }
        }
        return digests;
    }

    static boolean isSupported(String algorithm) {
        return SHA_256.equals(algorithm) || SHA_512.equals(algorithm);
    }

    private static String calculate(byte[] body, String algorithm) {
        try {
            return Base64.getEncoder().encodeToString(MessageDigest.getInstance(algorithm).digest(body));
        } catch (NoSuchAlgorithmException e) {
            // SHA-256 and SHA-512 are mandatory on every JDK
            throw new IllegalStateException(algorithm + " is not available", e);
        }
    }
}
