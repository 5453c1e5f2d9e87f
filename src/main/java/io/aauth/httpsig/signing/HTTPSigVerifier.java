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

import io.aauth.httpsig.message.HttpMessage;
import io.aauth.httpsig.signing.algorithms.AlgorithmBinding;
import io.aauth.httpsig.signing.algorithms.AlgorithmRegistry;
import io.aauth.httpsig.signing.exceptions.HttpSignatureException;
import io.aauth.httpsig.signing.exceptions.SignatureParameterException;
import io.aauth.httpsig.signing.exceptions.SignatureVerificationException;
import org.jboss.logging.Logger;

import java.nio.charset.StandardCharsets;
import java.security.Key;
import java.util.Base64;
import java.util.List;

/**
 * Verifies the HTTP signature carried by a message.
 *
 * Verification happens in two steps so the caller can look up the key:
 * 1. Construction locates the signature header and parses its parameters
 * 2. {@link #verify(Key, String)} rebuilds the signature string and checks the signature
 *
 * <pre>
 * HTTPSigVerifier verifier = HTTPSigVerifier.forRequest(message);
 * Key key = keyStore.lookup(verifier.getKeyId());
 * verifier.verify(key, "rsa-sha256");
 * </pre>
 *
 * The algorithm is always chosen by the caller; the deprecated {@code algorithm} parameter is not used.
 */
public class HTTPSigVerifier {

    private static final Logger logger = Logger.getLogger(HTTPSigVerifier.class);

    private final HttpMessage message;
    private final AlgorithmRegistry registry;
    private final RequestTargetProvider requestTarget;
    private final SignatureParameters parameters;

    /**
     * @param message The signed message, only read
     * @param registry Available algorithms
     * @param requestTarget Supplies {@code (request-target)}, or refuses it
     * @throws SignatureParameterException If the signature header is ambiguous, missing or malformed
     */
    public HTTPSigVerifier(HttpMessage message, AlgorithmRegistry registry, RequestTargetProvider requestTarget)
            throws SignatureParameterException {
        this.message = message;
        this.registry = registry;
        this.requestTarget = requestTarget;
        this.parameters = SignatureParametersCodec.extract(message.getHeaders());
        logger.debugf("Parsed http signature parameters: %s", parameters);
    }

    public static HTTPSigVerifier forRequest(HttpMessage message) throws SignatureParameterException {
        return forRequest(message, AlgorithmRegistry.defaultRegistry());
    }

    public static HTTPSigVerifier forRequest(HttpMessage message, AlgorithmRegistry registry)
            throws SignatureParameterException {
        if (!message.isRequest()) {
            throw new IllegalArgumentException("Message is not a request");
        }
        return new HTTPSigVerifier(message, registry, RequestTargetProvider.forMessage(message));
    }

    public static HTTPSigVerifier forResponse(HttpMessage message) throws SignatureParameterException {
        return forResponse(message, AlgorithmRegistry.defaultRegistry());
    }

    public static HTTPSigVerifier forResponse(HttpMessage message, AlgorithmRegistry registry)
            throws SignatureParameterException {
        return new HTTPSigVerifier(message, registry, RequestTargetProvider.notPermitted());
    }

    /**
     * @return The key identifier from the signature, for looking up the verification key
     */
    public String getKeyId() {
        return parameters.getKeyId();
    }

    /**
     * @return The covered components, lowercased, in signing order
     */
    public List<String> getSignedHeaders() {
        return parameters.getHeaders();
    }

    /**
     * @return The deprecated {@code algorithm} parameter as sent, or null. For diagnostics only.
     */
    public String getAlgorithmHint() {
        return parameters.getAlgorithm();
    }

    /**
     * Verify the signature.
     *
     * @param key The public key, or the shared raw {@link javax.crypto.SecretKey} for MAC algorithms
     * @param algorithm The algorithm name (e.g. "rsa-sha256")
     * @throws HttpSignatureException If the algorithm is unknown, a covered header is missing,
     *         the signature is not valid base64, or it does not verify
     */
    public void verify(Key key, String algorithm) throws HttpSignatureException {
        AlgorithmBinding binding = registry.resolve(algorithm);

        String signatureString = SignatureStringBuilder.build(message.getHeaders(), parameters.getHeaders(),
            requestTarget);

        byte[] signature;
        try {
            signature = decodeBase64(parameters.getSignature());
        } catch (IllegalArgumentException e) {
            throw new SignatureVerificationException(HttpSignatureException.Reason.BASE64_DECODE_FAILURE,
                "Invalid base64 signature", e);
        }

        try {
            binding.verify(key, signatureString.getBytes(StandardCharsets.UTF_8), signature);
        } catch (SignatureVerificationException e) {
            logger.warnf("Http signature verification failed: keyId=%s, algorithm=%s, headers=%s",
                parameters.getKeyId(), binding.getName(), parameters.getHeaders());
            throw e;
        }

        logger.debugf("Http signature verified: keyId=%s, algorithm=%s", parameters.getKeyId(), binding.getName());
    }

    /**
     * Decode standard base64, padding required.
     */
    private static byte[] decodeBase64(String value) {
        if (value.length() % 4 != 0) {
            throw new IllegalArgumentException("Base64 input length is not a multiple of 4");
        }
        return Base64.getDecoder().decode(value);
    }

    /**
     * Check every {@code Digest} header value of the message against the received body.
     *
     * Call after {@link #verify(Key, String)}: the digest is only trustworthy if {@code digest} is signed.
     *
     * @param body The received body bytes
     * @throws HttpSignatureException If {@code digest} is not covered by the signature, or does not match the body
     */
    public void verifyDigest(byte[] body) throws HttpSignatureException {
        if (!parameters.getHeaders().contains(DigestValidator.DIGEST_HEADER)) {
            throw new SignatureVerificationException(HttpSignatureException.Reason.MISSING_SIGNED_HEADER,
                "Digest header is not covered by the signature");
        }
        List<String> digests = message.getHeaders().get(DigestValidator.DIGEST_HEADER);
        DigestValidator.validateDigest(digests.isEmpty() ? null : String.join(", ", digests), body);
    }
}
