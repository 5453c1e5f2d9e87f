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

package io.aauth.httpsig;

import io.aauth.httpsig.signing.SignatureScheme;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.Properties;

import static org.junit.jupiter.api.Assertions.*;

class HttpSignatureConfigTest {

    @Test
    void defaults() {
        HttpSignatureConfig config = HttpSignatureConfig.defaults();

        assertEquals(Collections.singletonList("date"), config.getHeaders());
        assertEquals(SignatureScheme.SIGNATURE, config.getScheme());
        assertEquals(Arrays.asList("rsa-sha256", "ecdsa-sha256", "ed25519", "hmac-sha256"), config.getAlgorithms());
        assertEquals("SHA-256", config.getDigestAlgorithm());
    }

    @Test
    void readsAttributes() {
        Map<String, String> attributes = new HashMap<>();
        attributes.put(HttpSignatureConfig.HEADERS, "  (request-target)   host date ");
        attributes.put(HttpSignatureConfig.SCHEME, "Authorization");
        attributes.put(HttpSignatureConfig.ALGORITHMS, "ed25519, rsa-sha512 ,");
        attributes.put(HttpSignatureConfig.DIGEST_ALGORITHM, "sha-512");

        HttpSignatureConfig config = new HttpSignatureConfig(attributes);

        assertEquals(Arrays.asList("(request-target)", "host", "date"), config.getHeaders());
        assertEquals(SignatureScheme.AUTHORIZATION, config.getScheme());
        assertEquals(Arrays.asList("ed25519", "rsa-sha512"), config.getAlgorithms());
        assertEquals("SHA-512", config.getDigestAlgorithm());
    }

    @Test
    void invalidValuesFallBackToDefaults() {
        Properties properties = new Properties();
        properties.setProperty(HttpSignatureConfig.SCHEME, "Proxy-Authorization");
        properties.setProperty(HttpSignatureConfig.DIGEST_ALGORITHM, "MD5");
        properties.setProperty(HttpSignatureConfig.HEADERS, "   ");

        HttpSignatureConfig config = HttpSignatureConfig.fromProperties(properties);

        assertEquals(SignatureScheme.SIGNATURE, config.getScheme());
        assertEquals("SHA-256", config.getDigestAlgorithm());
        assertEquals(Collections.singletonList("date"), config.getHeaders());
    }
}
