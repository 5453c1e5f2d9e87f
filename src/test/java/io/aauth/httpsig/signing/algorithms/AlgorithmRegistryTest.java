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
import io.aauth.httpsig.signing.exceptions.UnsupportedAlgorithmException;
import org.junit.jupiter.api.Test;

import java.security.Key;
import java.security.SecureRandom;

import static org.junit.jupiter.api.Assertions.*;

class AlgorithmRegistryTest {

    @Test
    void defaultRegistryResolvesBothKinds() throws Exception {
        AlgorithmRegistry registry = AlgorithmRegistry.defaultRegistry();

        AlgorithmBinding rsa = registry.resolve("rsa-sha256");
        assertEquals(AlgorithmBinding.Kind.ASYMMETRIC, rsa.getKind());
        assertEquals("rsa-sha256", rsa.getName());

        AlgorithmBinding hmac = registry.resolve("HMAC-SHA256");
        assertEquals(AlgorithmBinding.Kind.MAC, hmac.getKind());
        assertEquals("hmac-sha256", hmac.getName());

        assertTrue(registry.resolveSigner("ed25519").isPresent());
        assertFalse(registry.resolveSigner("hmac-sha256").isPresent());
        assertTrue(registry.resolveMac("hmac-sha512").isPresent());
        assertFalse(registry.resolveMac("rsa-sha512").isPresent());
    }

    @Test
    void unknownNameFails() {
        AlgorithmRegistry registry = AlgorithmRegistry.defaultRegistry();

        UnsupportedAlgorithmException e = assertThrows(UnsupportedAlgorithmException.class,
            () -> registry.resolve("rsa-md5"));

        assertEquals(HttpSignatureException.Reason.UNKNOWN_ALGORITHM, e.getReason());
        assertEquals("No cryptographic implementation available for algorithm rsa-md5", e.getMessage());
        assertFalse(registry.isSupported(null));
    }

    @Test
    void asymmetricWinsOverMacForTheSameName() throws Exception {
        AlgorithmRegistry registry = new AlgorithmRegistry()
            .register(new JcaMacProvider("custom", "HmacSHA256"))
            .register(new StubSigner("custom"));

        assertEquals(AlgorithmBinding.Kind.ASYMMETRIC, registry.resolve("custom").getKind());
    }

    @Test
    void bindingRefusesWrongCapability() throws Exception {
        AlgorithmBinding hmac = AlgorithmRegistry.defaultRegistry().resolve("hmac-sha256");

        assertNotNull(hmac.getMacProvider());
        assertThrows(IllegalStateException.class, hmac::getAsymmetricSigner);
    }

    @Test
    void customMacProviderIsUsed() throws Exception {
        MacProvider xor = new MacProvider() {
            @Override
            public String canonicalName() {
                return "xor";
            }

            @Override
            public byte[] sign(byte[] data, byte[] secret) {
                byte[] result = new byte[data.length];
                for (int i = 0; i < data.length; i++) {
                    result[i] = (byte) (data[i] ^ secret[i % secret.length]);
                }
                return result;
            }
        };
        AlgorithmRegistry registry = new AlgorithmRegistry().register(xor);

        assertTrue(xor.verify(new byte[] {1, 2}, new byte[] {0, 3}, new byte[] {1}));
        assertFalse(xor.verify(new byte[] {1, 2}, new byte[] {0, 2}, new byte[] {1}));
        assertEquals(AlgorithmBinding.Kind.MAC, registry.resolve("XOR").getKind());
        assertEquals(1, registry.getMacAlgorithms().size());
        assertTrue(registry.getAsymmetricAlgorithms().isEmpty());
    }

    private static class StubSigner implements AsymmetricSigner {

        private final String name;

        StubSigner(String name) {
            this.name = name;
        }

        @Override
        public String canonicalName() {
            return name;
        }

        @Override
        public byte[] sign(SecureRandom random, Key privateKey, byte[] data) {
            return data;
        }

        @Override
        public void verify(Key publicKey, byte[] data, byte[] signature) {
        }
    }
}
