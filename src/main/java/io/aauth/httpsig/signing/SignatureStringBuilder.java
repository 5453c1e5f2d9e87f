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

import io.aauth.httpsig.message.HttpHeaders;
import io.aauth.httpsig.signing.exceptions.HttpSignatureException;
import io.aauth.httpsig.signing.exceptions.SignatureBaseException;
import org.jboss.logging.Logger;

import java.nio.charset.StandardCharsets;
import java.util.Collections;
import java.util.List;
import java.util.Locale;

/**
 * Builds the signature string that is signed and later re-derived for verification.
 *
 * Each covered component becomes one line {@code "<name>: <value>"}, lines are joined with
 * {@code "\n"} and there is no trailing newline. For a header the value is every occurrence,
 * trimmed, joined with {@code ", "} in occurrence order. For {@code (request-target)} it is
 * {@code "<lowercased-method> <target>"}.
 *
 * Example, covering {@code (request-target) date} on {@code GET /foo}:
 * <pre>
 * (request-target): get /foo
 * date: Tue, 07 Jun 2014 20:51:35 GMT
 * </pre>
 */
public class SignatureStringBuilder {

    private static final Logger logger = Logger.getLogger(SignatureStringBuilder.class);

    /**
     * Pseudo-component standing for the request method and target.
     */
    public static final String REQUEST_TARGET = "(request-target)";

    public static final String DATE = "date";

    /**
     * Components covered when the caller does not name any.
     */
    public static final List<String> DEFAULT_HEADERS = Collections.singletonList(DATE);

    static final String FIELD_DELIMITER = ": ";
    static final String LINE_DELIMITER = "\n";
    static final String VALUE_DELIMITER = ", ";

    private SignatureStringBuilder() {
    }

    /**
     * Build the signature string.
     *
     * @param headers The message headers
     * @param components The covered components in signing order; null or empty means {@link #DEFAULT_HEADERS}
     * @param requestTarget Supplies the {@code (request-target)} value, or refuses it for responses
     * @return The signature string
     * @throws SignatureBaseException If a covered header is missing or {@code (request-target)} is not permitted
     */
    public static String build(HttpHeaders headers, List<String> components, RequestTargetProvider requestTarget)
            throws SignatureBaseException {

        List<String> covered = components == null || components.isEmpty() ? DEFAULT_HEADERS : components;

        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < covered.size(); i++) {
            String component = covered.get(i).trim().toLowerCase(Locale.ROOT);

            if (REQUEST_TARGET.equals(component)) {
                sb.append(REQUEST_TARGET).append(FIELD_DELIMITER).append(requestTarget.requestTarget());
            } else {
                List<String> values = headers.get(component);
                if (values.isEmpty()) {
                    throw new SignatureBaseException(HttpSignatureException.Reason.MISSING_SIGNED_HEADER,
                        "Missing header: " + component);
                }
                sb.append(component).append(FIELD_DELIMITER);
                for (int v = 0; v < values.size(); v++) {
                    if (v > 0) {
                        sb.append(VALUE_DELIMITER);
                    }
                    sb.append(values.get(v).trim());
                }
            }

            if (i < covered.size() - 1) {
                sb.append(LINE_DELIMITER);
            }
        }

        String signatureString = sb.toString();
        if (logger.isDebugEnabled()) {
            logger.debugf("Signature string for %s: %s", covered, signatureString);
        }
        return signatureString;
    }

    /**
     * Same as {@link #build(HttpHeaders, List, RequestTargetProvider)}, UTF-8 encoded.
     */
    public static byte[] buildBytes(HttpHeaders headers, List<String> components, RequestTargetProvider requestTarget)
            throws SignatureBaseException {
        return build(headers, components, requestTarget).getBytes(StandardCharsets.UTF_8);
    }
}
