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

import java.security.MessageDigest;

/**
 * A keyed message authentication code (HMAC, ...) over a shared secret.
 */
public interface MacProvider {

    /**
     * @return The algorithm name as written in the {@code algorithm} parameter (e.g. "hmac-sha256")
     */
    String canonicalName();

    /**
     * Compute the authentication code of data.
     *
     * @param data The signature string bytes
     * @param secret The raw shared secret
     * @return The code
     * @throws HttpSignatureException If the secret is unusable or the MAC cannot be computed
     */
    byte[] sign(byte[] data, byte[] secret) throws HttpSignatureException;

    /**
     * Check a candidate code against the one computed over data, in constant time.
     *
     * @return true if the codes match
     */
    default boolean verify(byte[] data, byte[] candidate, byte[] secret) throws HttpSignatureException {
        return MessageDigest.isEqual(sign(data, secret), candidate);
    }
}
