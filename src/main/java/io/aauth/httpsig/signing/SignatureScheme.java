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

import java.util.Locale;

/**
 * The header slot that carries the signature parameters.
 */
public enum SignatureScheme {

    /**
     * {@code Signature: keyId="...",algorithm="...",headers="...",signature="..."}
     */
    SIGNATURE("Signature", ""),

    /**
     * {@code Authorization: Signature keyId="...",algorithm="...",headers="...",signature="..."}
     */
    AUTHORIZATION("Authorization", "Signature ");

    private final String headerName;
    private final String valuePrefix;

    SignatureScheme(String headerName, String valuePrefix) {
        this.headerName = headerName;
        this.valuePrefix = valuePrefix;
    }

    public String getHeaderName() {
        return headerName;
    }

    /**
     * Prefix written before the parameter list, e.g. the {@code Signature} auth-scheme token.
     */
    public String getValuePrefix() {
        return valuePrefix;
    }

    /**
     * Remove this slot's prefix (matched case-insensitively) from a raw header value.
     */
    String stripPrefix(String value) {
        String trimmed = value.trim();
        String prefix = valuePrefix.trim();
        if (!prefix.isEmpty()
                && trimmed.length() > prefix.length()
                && trimmed.regionMatches(true, 0, prefix, 0, prefix.length())
                && Character.isWhitespace(trimmed.charAt(prefix.length()))) {
            return trimmed.substring(prefix.length()).trim();
        }
        return trimmed;
    }

    /**
     * Parse a configured scheme name ("Signature" or "Authorization"), case-insensitively.
     *
     * @return The scheme, or null if the name is not recognised
     */
    public static SignatureScheme fromHeaderName(String name) {
        if (name == null) {
            return null;
        }
        String normalized = name.trim().toLowerCase(Locale.ROOT);
        for (SignatureScheme scheme : values()) {
            if (scheme.headerName.toLowerCase(Locale.ROOT).equals(normalized)) {
                return scheme;
            }
        }
        return null;
    }
}
