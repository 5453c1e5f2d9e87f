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

import javax.crypto.SecretKey;
import java.security.Key;
import java.security.SecureRandom;

/**
 * An algorithm name bound to exactly one capability: an {@link AsymmetricSigner} or a {@link MacProvider}.
 *
 * Signing and verification dispatch on {@link #getKind()}. MAC algorithms take the shared secret
 * as a {@link SecretKey} with {@code RAW} encoding, on both sides.
 */
public final class AlgorithmBinding {

    public enum Kind {
        ASYMMETRIC,
        MAC
    }

    private final String name;
    private final Kind kind;
    private final AsymmetricSigner signer;
    private final MacProvider mac;

    private AlgorithmBinding(String name, Kind kind, AsymmetricSigner signer, MacProvider mac) {
        this.name = name;
        this.kind = kind;
        this.signer = signer;
        this.mac = mac;
    }

    public static AlgorithmBinding asymmetric(AsymmetricSigner signer) {
        return new AlgorithmBinding(signer.canonicalName(), Kind.ASYMMETRIC, signer, null);
    }

    public static AlgorithmBinding mac(MacProvider mac) {
        return new AlgorithmBinding(mac.canonicalName(), Kind.MAC, null, mac);
    }

    /**
     * @return The canonical algorithm name
     */
    public String getName() {
        return name;
    }

    public Kind getKind() {
        return kind;
    }

    public AsymmetricSigner getAsymmetricSigner() {
        if (kind != Kind.ASYMMETRIC) {
            throw new IllegalStateException(name + " is not an asymmetric algorithm");
        }
        return signer;
    }

    public MacProvider getMacProvider() {
        if (kind != Kind.MAC) {
            throw new IllegalStateException(name + " is not a MAC algorithm");
        }
        return mac;
    }

    /**
     * Sign data with the bound capability.
     *
     * @param random Randomness for asymmetric algorithms
     * @param key A private key, or the shared secret for MAC algorithms
     * @param data The signature string bytes
     * @return The raw signature bytes
     * @throws HttpSignatureException If the key has the wrong type or signing fails
     */
    public byte[] sign(SecureRandom random, Key key, byte[] data) throws HttpSignatureException {
        switch (kind) {
            case ASYMMETRIC:
                return signer.sign(random, key, data);
            case MAC:
                return mac.sign(data, secretBytes(key, "signing"));
            default:
                throw new IllegalStateException("Unknown algorithm kind: " + kind);
        }
    }

    /**
     * Verify raw signature bytes over data with the bound capability.
     *
     * @param key A public key, or the shared secret for MAC algorithms
     * @param data The signature string bytes
     * @param signature The raw signature bytes
     * @throws HttpSignatureException If the key has the wrong type or the signature does not verify
     */
    public void verify(Key key, byte[] data, byte[] signature) throws HttpSignatureException {
        switch (kind) {
            case ASYMMETRIC:
                signer.verify(key, data, signature);
                return;
            case MAC:
                if (!mac.verify(data, signature, secretBytes(key, "verifying"))) {
                    throw new SignatureVerificationException(HttpSignatureException.Reason.SIGNATURE_MISMATCH,
                        "Invalid http signature");
                }
                return;
            default:
                throw new IllegalStateException("Unknown algorithm kind: " + kind);
        }
    }

    private byte[] secretBytes(Key key, String operation) throws KeyTypeException {
        if (!(key instanceof SecretKey)) {
            throw new KeyTypeException("Key for MAC " + operation + " with " + name + " must be a raw secret key, got "
                + (key == null ? "null" : key.getClass().getSimpleName()));
        }
        byte[] encoded = key.getEncoded();
        if (!"RAW".equalsIgnoreCase(key.getFormat()) || encoded == null) {
            throw new KeyTypeException("Key for MAC " + operation + " with " + name + " must have RAW encoding");
        }
        return encoded;
    }

    @Override
    public String toString() {
        return name + " (" + kind + ")";
    }
}
