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
import io.aauth.httpsig.signing.exceptions.SignatureVerificationException;
import org.jboss.logging.Logger;

import java.security.GeneralSecurityException;
import java.security.InvalidKeyException;
import java.security.NoSuchAlgorithmException;
import java.security.Key;
import java.security.PrivateKey;
import java.security.PublicKey;
import java.security.SecureRandom;
import java.security.Signature;
import java.security.SignatureException;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashSet;
import java.util.Set;

/**
 * {@link AsymmetricSigner} backed by a JCA {@link Signature}.
 *
 * A new {@link Signature} instance is created per call, so instances can be shared between threads.
 */
public class JcaAsymmetricSigner implements AsymmetricSigner {

    private static final Logger logger = Logger.getLogger(JcaAsymmetricSigner.class);

    private final String name;
    private final String javaAlgorithm;
    private final Set<String> keyAlgorithms;

    /**
     * @param name The canonical name (e.g. "rsa-sha256")
     * @param javaAlgorithm The JCA signature algorithm (e.g. "SHA256withRSA")
     * @param keyAlgorithms The {@link Key#getAlgorithm()} values accepted (e.g. "RSA")
     */
    public JcaAsymmetricSigner(String name, String javaAlgorithm, String... keyAlgorithms) {
        this.name = name;
        this.javaAlgorithm = javaAlgorithm;
        this.keyAlgorithms = Collections.unmodifiableSet(new HashSet<>(Arrays.asList(keyAlgorithms)));
    }

    @Override
    public String canonicalName() {
        return name;
    }

    public String getJavaAlgorithm() {
        return javaAlgorithm;
    }

    @Override
    public byte[] sign(SecureRandom random, Key privateKey, byte[] data) throws HttpSignatureException {
        if (!(privateKey instanceof PrivateKey)) {
            throw new KeyTypeException("Key for signing with " + name + " must be a private key, got " + describe(privateKey));
        }
        checkKeyAlgorithm(privateKey);

        try {
            Signature signature = Signature.getInstance(javaAlgorithm);
            if (random != null) {
                signature.initSign((PrivateKey) privateKey, random);
            } else {
                signature.initSign((PrivateKey) privateKey);
            }
            signature.update(data);
            return signature.sign();
        } catch (InvalidKeyException e) {
            throw new KeyTypeException("Private key rejected by " + javaAlgorithm, e);
        } catch (NoSuchAlgorithmException e) {
            throw new HttpSignatureException(HttpSignatureException.Reason.UNKNOWN_ALGORITHM,
                javaAlgorithm + " is not available", e);
        } catch (GeneralSecurityException e) {
            throw new HttpSignatureException(HttpSignatureException.Reason.VERIFICATION_FAILURE,
                "Failed to sign with " + name, e);
        }
    }

    @Override
    public void verify(Key publicKey, byte[] data, byte[] signatureBytes) throws HttpSignatureException {
        if (!(publicKey instanceof PublicKey)) {
            throw new KeyTypeException("Key for verifying with " + name + " must be a public key, got " + describe(publicKey));
        }
        checkKeyAlgorithm(publicKey);

        boolean valid;
        try {
            Signature signature = Signature.getInstance(javaAlgorithm);
            signature.initVerify((PublicKey) publicKey);
            signature.update(data);
            valid = signature.verify(signatureBytes);
        } catch (InvalidKeyException e) {
            throw new KeyTypeException("Public key rejected by " + javaAlgorithm, e);
        } catch (SignatureException e) {
            logger.debugf("Malformed %s signature (%d bytes): %s", name, signatureBytes.length, e.getMessage());
            throw new SignatureVerificationException(HttpSignatureException.Reason.VERIFICATION_FAILURE,
                "Signature verification failed", e);
        } catch (NoSuchAlgorithmException e) {
            throw new HttpSignatureException(HttpSignatureException.Reason.UNKNOWN_ALGORITHM,
                javaAlgorithm + " is not available", e);
        }

        if (!valid) {
            throw new SignatureVerificationException(HttpSignatureException.Reason.VERIFICATION_FAILURE,
                "Signature verification failed");
        }
    }

    private void checkKeyAlgorithm(Key key) throws KeyTypeException {
        if (!keyAlgorithms.contains(key.getAlgorithm())) {
            throw new KeyTypeException(name + " requires a key of type " + keyAlgorithms + ", got " + key.getAlgorithm());
        }
    }

    private static String describe(Key key) {
        return key == null ? "null" : key.getClass().getSimpleName();
    }
}
