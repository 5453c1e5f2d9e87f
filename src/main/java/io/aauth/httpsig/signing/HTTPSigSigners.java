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

import io.aauth.httpsig.HttpSignatureConfig;
import io.aauth.httpsig.message.HttpMessage;
import io.aauth.httpsig.signing.algorithms.AlgorithmBinding;
import io.aauth.httpsig.signing.algorithms.AlgorithmRegistry;
import io.aauth.httpsig.signing.exceptions.HttpSignatureException;
import io.aauth.httpsig.signing.exceptions.UnsupportedAlgorithmException;
import org.jboss.logging.Logger;

import java.security.Key;
import java.security.SecureRandom;
import java.util.List;

/**
 * Factory for {@link HTTPSigSigner} instances.
 */
public class HTTPSigSigners {

    private static final Logger logger = Logger.getLogger(HTTPSigSigners.class);

    private HTTPSigSigners() {
    }

    /**
     * Create a signer for the first algorithm in {@code preferences} that the registry supports.
     *
     * @param registry Available algorithms
     * @param preferences Algorithm names, most preferred first
     * @param headers Covered components; null or empty means {@code date}
     * @param scheme Header slot to write to; null means {@link SignatureScheme#SIGNATURE}
     * @return The signer
     * @throws UnsupportedAlgorithmException If no preference is supported
     */
    public static HTTPSigSigner newSigner(AlgorithmRegistry registry, List<String> preferences, List<String> headers,
                                          SignatureScheme scheme) throws UnsupportedAlgorithmException {
        return newSigner(registry, preferences, headers, scheme, HttpSignatureConfig.DEFAULT_DIGEST_ALGORITHM);
    }

    public static HTTPSigSigner newSigner(AlgorithmRegistry registry, String algorithm, List<String> headers,
                                          SignatureScheme scheme) throws UnsupportedAlgorithmException {
        return new HTTPSigSigner(registry.resolve(algorithm), headers, scheme, new SecureRandom(),
            HttpSignatureConfig.DEFAULT_DIGEST_ALGORITHM);
    }

    /**
     * Create a signer from configuration, using the default algorithm registry.
     */
    public static HTTPSigSigner newSigner(HttpSignatureConfig config) throws UnsupportedAlgorithmException {
        return newSigner(AlgorithmRegistry.defaultRegistry(), config.getAlgorithms(), config.getHeaders(),
            config.getScheme(), config.getDigestAlgorithm());
    }

    /**
     * Sign a message in one call with the default registry, writing to the {@code Signature} header.
     *
     * @param message The message to sign; one header is appended on success
     * @param keyId Identifier the verifier uses to find the matching key
     * @param key A private key, or a raw {@link javax.crypto.SecretKey} for MAC algorithms
     * @param algorithm The algorithm name (e.g. "hmac-sha256")
     * @param headers Covered components; null or empty means {@code date}
     * @throws HttpSignatureException If the algorithm is unknown, the key has the wrong type,
     *         or a covered component is missing or not permitted
     */
    public static void sign(HttpMessage message, String keyId, Key key, String algorithm, List<String> headers)
            throws HttpSignatureException {
        newSigner(AlgorithmRegistry.defaultRegistry(), algorithm, headers, SignatureScheme.SIGNATURE)
            .sign(message, keyId, key);
    }

    private static HTTPSigSigner newSigner(AlgorithmRegistry registry, List<String> preferences, List<String> headers,
                                           SignatureScheme scheme, String digestAlgorithm)
            throws UnsupportedAlgorithmException {
        for (String preference : preferences) {
            if (registry.isSupported(preference)) {
                AlgorithmBinding binding = registry.resolve(preference);
                logger.debugf("Selected signing algorithm %s from preferences %s", binding.getName(), preferences);
                return new HTTPSigSigner(binding, headers, scheme, new SecureRandom(), digestAlgorithm);
            }
        }
        throw new UnsupportedAlgorithmException("No cryptographic implementation available for any of " + preferences);
    }
}
