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

import io.aauth.httpsig.message.HttpHeaders;
import io.aauth.httpsig.message.HttpMessage;
import io.aauth.httpsig.signing.algorithms.AlgorithmBinding;
import io.aauth.httpsig.signing.exceptions.HttpSignatureException;
import io.aauth.httpsig.signing.exceptions.SignatureParameterException;
import org.jboss.logging.Logger;

import java.nio.charset.StandardCharsets;
import java.security.Key;
import java.security.SecureRandom;
import java.util.ArrayList;
import java.util.Base64;
import java.util.Collections;
import java.util.List;

/**
 * Signs HTTP messages with one algorithm over a fixed list of covered components.
 *
 * Signing:
 * 1. Builds the signature string from the message headers (and request line, for requests)
 * 2. Signs it with the bound algorithm
 * 3. Appends a signature header to the message; existing signature headers are kept
 *
 * Instances are immutable and can sign any number of messages. The caller must not sign
 * the same message from several threads at once.
 *
 * Use {@link HTTPSigSigners} to create instances.
 */
public class HTTPSigSigner {

    private static final Logger logger = Logger.getLogger(HTTPSigSigner.class);

    private final AlgorithmBinding algorithm;
    private final List<String> headers;
    private final SignatureScheme scheme;
    private final SecureRandom random;
    private final String digestAlgorithm;

    HTTPSigSigner(AlgorithmBinding algorithm, List<String> headers, SignatureScheme scheme,
                  SecureRandom random, String digestAlgorithm) {
        this.algorithm = algorithm;
        this.headers = headers == null || headers.isEmpty()
            ? SignatureStringBuilder.DEFAULT_HEADERS
            : Collections.unmodifiableList(new ArrayList<>(headers));
        this.scheme = scheme == null ? SignatureScheme.SIGNATURE : scheme;
        this.random = random;
        this.digestAlgorithm = digestAlgorithm == null ? DigestValidator.SHA_256 : digestAlgorithm;
    }

    /**
     * Sign a message.
     *
     * @param message The message to sign; one header is appended on success
     * @param keyId Identifier the verifier uses to find the matching key
     * @param key A private key, or a raw {@link javax.crypto.SecretKey} for MAC algorithms
     * @throws HttpSignatureException If a covered component is missing or not permitted, or signing fails
     */
    public void sign(HttpMessage message, String keyId, Key key) throws HttpSignatureException {
        sign(message, keyId, key, null);
    }

    /**
     * Sign a message, first adding a {@code Digest} header for the body.
     *
     * The digest is only protected if {@code digest} is one of the covered components.
     *
     * @param message The message to sign
     * @param keyId Identifier the verifier uses to find the matching key
     * @param key A private key, or a raw {@link javax.crypto.SecretKey} for MAC algorithms
     * @param body The message body, or null to skip the digest; the message must not already have a Digest
     * @throws HttpSignatureException If a covered component is missing or not permitted, signing fails,
     *         or the Digest (or, for the Authorization scheme, Authorization) header is already present
     */
    public void sign(HttpMessage message, String keyId, Key key, byte[] body) throws HttpSignatureException {
        if (keyId == null || keyId.isEmpty()) {
            throw new SignatureParameterException(HttpSignatureException.Reason.MISSING_REQUIRED_PARAMETER,
                "Missing \"" + SignatureParametersCodec.KEY_ID + "\" for http signature");
        }
        // Verifiers only read the first Authorization value
        if (scheme == SignatureScheme.AUTHORIZATION && message.getHeaders().contains(scheme.getHeaderName())) {
            throw new HttpSignatureException(HttpSignatureException.Reason.HEADER_ALREADY_PRESENT,
                "Message already has an Authorization header");
        }

        HttpHeaders signed = message.getHeaders().copy();
        String digest = null;
        if (body != null) {
            if (signed.contains(DigestValidator.DIGEST_HEADER)) {
                throw new HttpSignatureException(HttpSignatureException.Reason.HEADER_ALREADY_PRESENT,
                    "Message already has a Digest header, cannot add one for the body");
            }
            digest = DigestValidator.createDigest(body, digestAlgorithm);
            signed.add(DigestValidator.DIGEST_HEADER, digest);
        }

        String signatureString = SignatureStringBuilder.build(signed, headers,
            RequestTargetProvider.forMessage(message));
        byte[] signatureBytes = algorithm.sign(random, key, signatureString.getBytes(StandardCharsets.UTF_8));
        String encoded = Base64.getEncoder().encodeToString(signatureBytes);

        if (digest != null) {
            message.addHeader(DigestValidator.DIGEST_HEADER, digest);
        }
        message.addHeader(scheme.getHeaderName(),
            scheme.getValuePrefix() + SignatureParametersCodec.serialize(keyId, algorithm.getName(), headers, encoded));

        logger.debugf("Signed %s with %s, keyId=%s, headers=%s", message.isRequest() ? "request" : "response",
            algorithm.getName(), keyId, headers);
    }

    /**
     * @return The canonical name of the signing algorithm
     */
    public String getAlgorithm() {
        return algorithm.getName();
    }

    public List<String> getHeaders() {
        return headers;
    }

    public SignatureScheme getScheme() {
        return scheme;
    }
}
