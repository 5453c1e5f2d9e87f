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

import io.aauth.httpsig.signing.DigestValidator;
import io.aauth.httpsig.signing.SignatureScheme;
import io.aauth.httpsig.signing.SignatureStringBuilder;
import io.aauth.httpsig.signing.algorithms.AlgorithmRegistry;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Properties;

/**
 * Configuration settings for HTTP signing.
 *
 * Reads string attributes (system properties, an application's own settings, ...),
 * providing typed access with defaults. Invalid values fall back to the defaults.
 */
public class HttpSignatureConfig {

    // Attribute keys
    public static final String HEADERS = "httpsig.headers";
    public static final String SCHEME = "httpsig.scheme";
    public static final String ALGORITHMS = "httpsig.algorithms";
    public static final String DIGEST_ALGORITHM = "httpsig.digest.algorithm";

    // Default values
    public static final List<String> DEFAULT_HEADERS = SignatureStringBuilder.DEFAULT_HEADERS;
    public static final SignatureScheme DEFAULT_SCHEME = SignatureScheme.SIGNATURE;
    public static final List<String> DEFAULT_ALGORITHMS = Collections.unmodifiableList(Arrays.asList(
        AlgorithmRegistry.RSA_SHA256, AlgorithmRegistry.ECDSA_SHA256, AlgorithmRegistry.ED25519,
        AlgorithmRegistry.HMAC_SHA256));
    public static final String DEFAULT_DIGEST_ALGORITHM = DigestValidator.SHA_256;

    private final Map<String, String> attributes;

    public HttpSignatureConfig(Map<String, String> attributes) {
        this.attributes = attributes == null ? Collections.emptyMap() : new HashMap<>(attributes);
    }

    /**
     * Covered components, in signing order. Space separated, e.g. "(request-target) host date".
     */
    public List<String> getHeaders() {
        List<String> headers = getListAttribute(HEADERS, "\\s+");
        return headers.isEmpty() ? DEFAULT_HEADERS : headers;
    }

    /**
     * Header slot that signatures are written to.
     */
    public SignatureScheme getScheme() {
        SignatureScheme scheme = SignatureScheme.fromHeaderName(attributes.get(SCHEME));
        return scheme == null ? DEFAULT_SCHEME : scheme;
    }

    /**
     * Signing algorithms in order of preference. Comma separated.
     */
    public List<String> getAlgorithms() {
        List<String> algorithms = getListAttribute(ALGORITHMS, ",");
        return algorithms.isEmpty() ? DEFAULT_ALGORITHMS : algorithms;
    }

    /**
     * Algorithm for the Digest header, SHA-256 or SHA-512.
     */
    public String getDigestAlgorithm() {
        String value = attributes.get(DIGEST_ALGORITHM);
        if (value == null) {
            return DEFAULT_DIGEST_ALGORITHM;
        }
        String normalized = value.trim().toUpperCase(Locale.ROOT);
        if (DigestValidator.SHA_256.equals(normalized) || DigestValidator.SHA_512.equals(normalized)) {
            return normalized;
        }
        return DEFAULT_DIGEST_ALGORITHM;
    }

    /**
     * Split an attribute into its non-empty, trimmed parts.
     */
    private List<String> getListAttribute(String key, String separator) {
        String value = attributes.get(key);
        if (value == null || value.trim().isEmpty()) {
            return Collections.emptyList();
        }

        List<String> result = new ArrayList<>();
        for (String part : value.trim().split(separator)) {
            if (!part.trim().isEmpty()) {
                result.add(part.trim());
            }
        }
        return Collections.unmodifiableList(result);
    }

    /**
     * Configuration with every setting at its default.
     */
    public static HttpSignatureConfig defaults() {
        return new HttpSignatureConfig(Collections.emptyMap());
    }

    /**
     * Configuration read from properties, e.g. {@code System.getProperties()}.
     */
    public static HttpSignatureConfig fromProperties(Properties properties) {
        Map<String, String> attributes = new HashMap<>();
        for (String name : properties.stringPropertyNames()) {
            attributes.put(name, properties.getProperty(name));
        }
        return new HttpSignatureConfig(attributes);
    }
}
