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
import io.aauth.httpsig.signing.exceptions.SignatureParameterException;
import org.jboss.logging.Logger;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Reads and writes the signature parameter list.
 *
 * Format: {@code keyId="rsa-key-1",algorithm="rsa-sha256",headers="(request-target) date",signature="Base64=="}
 *
 * The {@code algorithm} parameter is deprecated: it is always written and always ignored when read.
 * Unrecognised parameters are ignored.
 */
public class SignatureParametersCodec {

    private static final Logger logger = Logger.getLogger(SignatureParametersCodec.class);

    public static final String KEY_ID = "keyId";
    public static final String ALGORITHM = "algorithm";
    public static final String HEADERS = "headers";
    public static final String SIGNATURE = "signature";

    private static final String KV_SEPARATOR = "=";
    private static final String VALUE_DELIMITER = "\"";
    private static final String PARAMETER_SEPARATOR = ",";
    private static final String HEADERS_SEPARATOR = " ";

    private SignatureParametersCodec() {
    }

    /**
     * Decide which header slot carries the signature parameters.
     *
     * A slot carries parameters when its value mentions {@code keyId}, {@code headers} or {@code signature}.
     *
     * @param signatureValue First value of the {@code Signature} header, may be null
     * @param authorizationValue First value of the {@code Authorization} header, may be null
     * @return The authoritative slot
     * @throws SignatureParameterException If both slots or neither carry parameters
     */
    public static SignatureScheme locate(String signatureValue, String authorizationValue)
            throws SignatureParameterException {
        boolean inSignature = hasParameters(signatureValue);
        boolean inAuthorization = hasParameters(authorizationValue);

        if (inSignature && inAuthorization) {
            throw new SignatureParameterException(HttpSignatureException.Reason.SCHEME_AMBIGUOUS,
                "Both \"Signature\" and \"Authorization\" have signature parameters");
        }
        if (!inSignature && !inAuthorization) {
            throw new SignatureParameterException(HttpSignatureException.Reason.SCHEME_MISSING,
                "Neither \"Signature\" nor \"Authorization\" have signature parameters");
        }
        return inSignature ? SignatureScheme.SIGNATURE : SignatureScheme.AUTHORIZATION;
    }

    /**
     * Locate and parse the signature parameters of a message.
     *
     * @param headers The message headers
     * @return The parsed parameters
     * @throws SignatureParameterException If the slot is ambiguous or missing, or the parameters are invalid
     */
    public static SignatureParameters extract(HttpHeaders headers) throws SignatureParameterException {
        String signatureValue = headers.getFirst(SignatureScheme.SIGNATURE.getHeaderName());
        String authorizationValue = headers.getFirst(SignatureScheme.AUTHORIZATION.getHeaderName());

        SignatureScheme scheme = locate(signatureValue, authorizationValue);
        String raw = scheme == SignatureScheme.SIGNATURE ? signatureValue : authorizationValue;

        logger.debugf("Signature parameters found in %s header", scheme.getHeaderName());
        return parse(scheme.stripPrefix(raw));
    }

    /**
     * Parse a signature parameter list.
     *
     * @param value The parameter list, without any auth-scheme prefix
     * @return The parsed parameters; {@code headers} defaults to {@code date} when absent
     * @throws SignatureParameterException If a parameter is malformed or keyId/signature is missing
     */
    public static SignatureParameters parse(String value) throws SignatureParameterException {
        if (value == null) {
            throw new SignatureParameterException(HttpSignatureException.Reason.MISSING_REQUIRED_PARAMETER,
                "Missing \"" + KEY_ID + "\" parameter in http signature");
        }

        String keyId = null;
        String algorithm = null;
        List<String> headers = new ArrayList<>();
        String signature = null;

        for (String token : value.split(PARAMETER_SEPARATOR, -1)) {
            int equalsIndex = token.indexOf(KV_SEPARATOR);
            if (equalsIndex < 0) {
                throw new SignatureParameterException(HttpSignatureException.Reason.MALFORMED_PARAMETER,
                    "Malformed http signature parameter: " + token.trim());
            }

            String name = token.substring(0, equalsIndex).trim();
            String parameterValue = unquote(token.substring(equalsIndex + 1).trim());

            switch (name) {
                case KEY_ID:
                    keyId = parameterValue;
                    break;
                case ALGORITHM:
                    // Deprecated, kept for diagnostics only
                    algorithm = parameterValue;
                    break;
                case HEADERS:
                    headers.clear();
                    for (String header : parameterValue.split(HEADERS_SEPARATOR)) {
                        if (!header.isEmpty()) {
                            headers.add(header.toLowerCase(Locale.ROOT));
                        }
                    }
                    break;
                case SIGNATURE:
                    signature = parameterValue;
                    break;
                default:
                    logger.debugf("Ignoring unrecognised http signature parameter: %s", name);
                    break;
            }
        }

        if (keyId == null || keyId.isEmpty()) {
            throw new SignatureParameterException(HttpSignatureException.Reason.MISSING_REQUIRED_PARAMETER,
                "Missing \"" + KEY_ID + "\" parameter in http signature");
        }
        if (signature == null || signature.isEmpty()) {
            throw new SignatureParameterException(HttpSignatureException.Reason.MISSING_REQUIRED_PARAMETER,
                "Missing \"" + SIGNATURE + "\" parameter in http signature");
        }
        if (headers.isEmpty()) {
            headers.addAll(SignatureStringBuilder.DEFAULT_HEADERS);
        }

        return new SignatureParameters(keyId, algorithm, headers, signature);
    }

    /**
     * Write a signature parameter list in the fixed order keyId, algorithm, headers, signature.
     *
     * @param keyId The key identifier
     * @param algorithm Canonical algorithm name, written for older verifiers
     * @param headers Covered components; null or empty means {@code date}
     * @param signature The base64-encoded signature
     * @return The parameter list
     */
    public static String serialize(String keyId, String algorithm, List<String> headers, String signature) {
        List<String> covered = headers == null || headers.isEmpty() ? SignatureStringBuilder.DEFAULT_HEADERS : headers;

        StringBuilder sb = new StringBuilder();
        appendParameter(sb, KEY_ID, keyId).append(PARAMETER_SEPARATOR);
        appendParameter(sb, ALGORITHM, algorithm).append(PARAMETER_SEPARATOR);

        StringBuilder joined = new StringBuilder();
        for (int i = 0; i < covered.size(); i++) {
            if (i > 0) {
                joined.append(HEADERS_SEPARATOR);
            }
            joined.append(covered.get(i).trim().toLowerCase(Locale.ROOT));
        }
        appendParameter(sb, HEADERS, joined.toString()).append(PARAMETER_SEPARATOR);
        appendParameter(sb, SIGNATURE, signature);
        return sb.toString();
    }

    private static StringBuilder appendParameter(StringBuilder sb, String name, String value) {
        return sb.append(name).append(KV_SEPARATOR).append(VALUE_DELIMITER).append(value).append(VALUE_DELIMITER);
    }

    private static boolean hasParameters(String value) {
        return value != null
            && (value.contains(KEY_ID) || value.contains(HEADERS) || value.contains(SIGNATURE));
    }

    /**
     * Strip every leading and trailing {@code "}.
     */
    private static String unquote(String value) {
        int start = 0;
        int end = value.length();
        while (start < end && value.charAt(start) == '"') {
            start++;
        }
        while (end > start && value.charAt(end - 1) == '"') {
            end--;
        }
        return value.substring(start, end);
    }
}
