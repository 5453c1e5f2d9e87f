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

package io.aauth.httpsig.message;

import org.keycloak.common.util.MultivaluedHashMap;

import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Case-insensitive, multi-valued HTTP header collection.
 *
 * Names are stored lowercased. Each name keeps its values in the order they were added,
 * which is the order they are joined in when a signature string is built.
 */
public class HttpHeaders {

    private final MultivaluedHashMap<String, String> headers = new MultivaluedHashMap<>();

    /**
     * Append a value to the header, keeping any values already present.
     */
    public HttpHeaders add(String name, String value) {
        if (name == null || name.trim().isEmpty()) {
            throw new IllegalArgumentException("Header name must not be empty");
        }
        headers.add(normalize(name), value == null ? "" : value);
        return this;
    }

    /**
     * Get all values of a header in occurrence order, or an empty list when absent.
     */
    public List<String> get(String name) {
        if (name == null) {
            return Collections.emptyList();
        }
        List<String> values = headers.get(normalize(name));
        return values == null ? Collections.emptyList() : Collections.unmodifiableList(values);
    }

    /**
     * Get the first value of a header, or null when absent.
     */
    public String getFirst(String name) {
        return name == null ? null : headers.getFirst(normalize(name));
    }

    public boolean contains(String name) {
        return name != null && headers.containsKey(normalize(name));
    }

    /**
     * Create an independent copy with the same names and values.
     */
    public HttpHeaders copy() {
        HttpHeaders copy = new HttpHeaders();
        for (String name : headers.keySet()) {
            for (String value : headers.get(name)) {
                copy.headers.add(name, value);
            }
        }
        return copy;
    }

    public Set<String> names() {
        return Collections.unmodifiableSet(headers.keySet());
    }

    @Override
    public String toString() {
        return headers.toString();
    }

    static String normalize(String name) {
        return name.trim().toLowerCase(Locale.ROOT);
    }
}
