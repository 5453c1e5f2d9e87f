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

package io.aauth.httpsig.signing.algorithms;

import io.aauth.httpsig.signing.exceptions.HttpSignatureException;

import java.security.Key;
import java.security.SecureRandom;

/**
 * A public-key signature algorithm (RSA, ECDSA, EdDSA, ...).
 *
 * Implementations check that the keys they are handed have the shape they expect.
 */
public interface AsymmetricSigner {

    /**
     * @return The algorithm name as written in the {@code algorithm} parameter (e.g. "rsa-sha256")
     */
    String canonicalName();

    /**
     * Sign data with a private key.
     *
     * @param random Randomness for algorithms that need it
     * @param privateKey The signing key
     * @param data The signature string bytes
     * @return The raw signature bytes
     * @throws HttpSignatureException If the key does not fit this algorithm or signing fails
     */
    byte[] sign(SecureRandom random, Key privateKey, byte[] data) throws HttpSignatureException;

    /**
     * Verify a signature with a public key.
     *
     * @param publicKey The verification key
     * @param data The signature string bytes
     * @param signature The raw signature bytes
     * @throws HttpSignatureException If the key does not fit this algorithm or the signature does not verify
     */
    void verify(Key publicKey, byte[] data, byte[] signature) throws HttpSignatureException;
}
