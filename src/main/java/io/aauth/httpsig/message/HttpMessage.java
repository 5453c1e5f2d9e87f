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

import java.net.URI;
import java.util.Locale;

/**
 * An HTTP message as seen by the signer and verifier: its headers and, for requests, the request line.
 *
 * A message created with {@link #response()} has no request line, so it can never
 * cover the {@code (request-target)} component.
 */
public class HttpMessage {

    private final HttpHeaders headers = new HttpHeaders();
    private final String method;
    private final String requestTarget;

    private HttpMessage(String method, String requestTarget) {
        this.method = method;
        this.requestTarget = requestTarget;
    }

    /**
     * Create a request.
     *
     * @param method The HTTP method (e.g. "GET")
     * @param requestTarget The request target exactly as it appears on the request line (e.g. "/foo?bar=1")
     */
    public static HttpMessage request(String method, String requestTarget) {
        if (method == null || method.trim().isEmpty()) {
            throw new IllegalArgumentException("Request method must not be empty");
        }
        if (requestTarget == null || requestTarget.isEmpty()) {
            throw new IllegalArgumentException("Request target must not be empty");
        }
        return new HttpMessage(method.trim(), requestTarget);
    }

    /**
     * Create a request whose target is the raw path and query of the given URI.
     */
    public static HttpMessage request(String method, URI uri) {
        String path = uri.getRawPath();
        if (path == null || path.isEmpty()) {
            path = "/";
        }
        String query = uri.getRawQuery();
        return request(method, query == null ? path : path + "?" + query);
    }

    public static HttpMessage response() {
        return new HttpMessage(null, null);
    }

    public HttpHeaders getHeaders() {
        return headers;
    }

    /**
     * Shortcut for {@code getHeaders().add(name, value)}.
     */
    public HttpMessage addHeader(String name, String value) {
        headers.add(name, value);
        return this;
    }

    public boolean isRequest() {
        return method != null;
    }

    /**
     * @return The request method as given, or null for a response
     */
    public String getMethod() {
        return method;
    }

    /**
     * @return The request target, or null for a response
     */
    public String getRequestTarget() {
        return requestTarget;
    }

    @Override
    public String toString() {
        if (isRequest()) {
            return method.toUpperCase(Locale.ROOT) + " " + requestTarget + " " + headers;
        }
        return "response " + headers;
    }
}
