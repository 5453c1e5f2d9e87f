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

import io.aauth.httpsig.signing.exceptions.UnsupportedAlgorithmException;
import org.jboss.logging.Logger;
import org.keycloak.crypto.JavaAlgorithm;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Maps algorithm names to signing capabilities.
 *
 * Names are matched case-insensitively. {@link #resolve(String)} tries the asymmetric algorithms
 * first and the MAC algorithms second, so a name registered as both resolves as asymmetric.
 */
public class AlgorithmRegistry {

    private static final Logger logger = Logger.getLogger(AlgorithmRegistry.class);

    public static final String RSA_SHA256 = "rsa-sha256";
    public static final String RSA_SHA512 = "rsa-sha512";
    public static final String ECDSA_SHA256 = "ecdsa-sha256";
    public static final String ECDSA_SHA512 = "ecdsa-sha512";
    public static final String ED25519 = "ed25519";
    public static final String HMAC_SHA256 = "hmac-sha256";
    public static final String HMAC_SHA512 = "hmac-sha512";

    private final Map<String, AsymmetricSigner> signers = new LinkedHashMap<>();
    private final Map<String, MacProvider> macs = new LinkedHashMap<>();

    /**
     * Create a registry with the JCA-backed algorithms available on every JDK 17.
     */
    public static AlgorithmRegistry defaultRegistry() {
        AlgorithmRegistry registry = new AlgorithmRegistry();
        registry.register(new JcaAsymmetricSigner(RSA_SHA256, JavaAlgorithm.RS256, "RSA"));
        registry.register(new JcaAsymmetricSigner(RSA_SHA512, JavaAlgorithm.RS512, "RSA"));
        registry.register(new JcaAsymmetricSigner(ECDSA_SHA256, JavaAlgorithm.ES256, "EC"));
        registry.register(new JcaAsymmetricSigner(ECDSA_SHA512, JavaAlgorithm.ES512, "EC"));
        registry.register(new JcaAsymmetricSigner(ED25519, "Ed25519", "Ed25519", "EdDSA"));
        registry.register(new JcaMacProvider(HMAC_SHA256, JavaAlgorithm.HS256));
        registry.register(new JcaMacProvider(HMAC_SHA512, JavaAlgorithm.HS512));
        return registry;
    }

    public AlgorithmRegistry register(AsymmetricSigner signer) {
        signers.put(key(signer.canonicalName()), signer);
        logger.debugf("Registered asymmetric algorithm %s", signer.canonicalName());
        return this;
    }

    public AlgorithmRegistry register(MacProvider mac) {
        macs.put(key(mac.canonicalName()), mac);
        logger.debugf("Registered MAC algorithm %s", mac.canonicalName());
        return this;
    }

    public Optional<AsymmetricSigner> resolveSigner(String name) {
        return name == null ? Optional.empty() : Optional.ofNullable(signers.get(key(name)));
    }

    public Optional<MacProvider> resolveMac(String name) {
        return name == null ? Optional.empty() : Optional.ofNullable(macs.get(key(name)));
    }

    /**
     * Resolve an algorithm name, asymmetric first, then MAC.
     *
     * @param name The algorithm name
     * @return The binding
     * @throws UnsupportedAlgorithmException If neither kind is registered under the name
     */
    public AlgorithmBinding resolve(String name) throws UnsupportedAlgorithmException {
        Optional<AsymmetricSigner> signer = resolveSigner(name);
        if (signer.isPresent()) {
            return AlgorithmBinding.asymmetric(signer.get());
        }
        Optional<MacProvider> mac = resolveMac(name);
        if (mac.isPresent()) {
            return AlgorithmBinding.mac(mac.get());
        }
        throw new UnsupportedAlgorithmException("No cryptographic implementation available for algorithm " + name);
    }

    public boolean isSupported(String name) {
        return resolveSigner(name).isPresent() || resolveMac(name).isPresent();
    }

    public Set<String> getAsymmetricAlgorithms() {
        return Collections.unmodifiableSet(signers.keySet());
    }

    public Set<String> getMacAlgorithms() {
        return Collections.unmodifiableSet(macs.keySet());
    }

    private static String key(String name) {
        return name.trim().toLowerCase(Locale.ROOT);
    }
}
