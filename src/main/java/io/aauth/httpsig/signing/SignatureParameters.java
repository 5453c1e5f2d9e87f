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

import java.util.Collections;
import java.util.List;

/**
 * The parameters carried by a signature header.
 */
public class SignatureParameters {

    private final String keyId;
    private final String algorithm;
    private final List<String> headers;
    private final String signature;

    public SignatureParameters(String keyId, String algorithm, List<String> headers, String signature) {
        this.keyId = keyId;
        this.algorithm = algorithm;
        this.headers = Collections.unmodifiableList(headers);
        this.signature = signature;
    }

    public String getKeyId() {
        return keyId;
    }

    /**
     * Deprecated {@code algorithm} parameter as received. Never used to pick the verification algorithm.
     *
     * @return The value, or null when the parameter was absent
     */
    public String getAlgorithm() {
        return algorithm;
    }

    /**
     * @return The covered components, in signing order
     */
    public List<String> getHeaders() {
        return headers;
    }

    /**
     * @return The base64-encoded signature
     */
    public String getSignature() {
        return signature;
    }

    @Override
    public String toString() {
        return "SignatureParameters{keyId=" + keyId + ", algorithm=" + algorithm + ", headers=" + headers + "}";
    }
}
