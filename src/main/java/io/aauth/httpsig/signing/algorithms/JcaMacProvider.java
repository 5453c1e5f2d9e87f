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
import io.aauth.httpsig.signing.exceptions.KeyTypeException;

import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;
import java.security.GeneralSecurityException;
import java.security.InvalidKeyException;

/**
 * {@link MacProvider} backed by a JCA {@link Mac}.
 */
public class JcaMacProvider implements MacProvider {

    private final String name;
    private final String javaAlgorithm;

    /**
     * @param name The canonical name (e.g. "hmac-sha256")
     * @param javaAlgorithm The JCA MAC algorithm (e.g. "HmacSHA256")
     */
    public JcaMacProvider(String name, String javaAlgorithm) {
        this.name = name;
        this.javaAlgorithm = javaAlgorithm;
    }

    @Override
    public String canonicalName() {
        return name;
    }

    @Override
    public byte[] sign(byte[] data, byte[] secret) throws HttpSignatureException {
        if (secret == null || secret.length == 0) {
            throw new KeyTypeException("Secret for " + name + " must not be empty");
        }
        try {
            Mac mac = Mac.getInstance(javaAlgorithm);
            mac.init(new SecretKeySpec(secret, javaAlgorithm));
            return mac.doFinal(data);
        } catch (InvalidKeyException e) {
            throw new KeyTypeException("Secret rejected by " + javaAlgorithm, e);
        } catch (GeneralSecurityException e) {
            throw new HttpSignatureException(HttpSignatureException.Reason.UNKNOWN_ALGORITHM,
                javaAlgorithm + " is not available", e);
        }
    }
}
