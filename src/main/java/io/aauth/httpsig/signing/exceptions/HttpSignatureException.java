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

package io.aauth.httpsig.signing.exceptions;

import org.keycloak.common.VerificationException;

/**
 * Base class for every failure raised while signing or verifying an HTTP signature.
 *
 * The {@link Reason} tells callers which step failed without having to parse messages.
 */
public class HttpSignatureException extends VerificationException {

    private static final long serialVersionUID = 1L;

    /**
     * Why an HTTP signature operation failed.
     */
    public enum Reason {
        SCHEME_AMBIGUOUS,
        SCHEME_MISSING,
        MALFORMED_PARAMETER,
        MISSING_REQUIRED_PARAMETER,
        UNKNOWN_ALGORITHM,
        KEY_TYPE_MISMATCH,
        MISSING_SIGNED_HEADER,
        REQUEST_TARGET_NOT_PERMITTED,
        BASE64_DECODE_FAILURE,
        SIGNATURE_MISMATCH,
        VERIFICATION_FAILURE,
        UNSUPPORTED_DIGEST,
        HEADER_ALREADY_PRESENT,
        DIGEST_MISMATCH
    }

    private final Reason reason;

    public HttpSignatureException(Reason reason, String message) {
        super(message);
        this.reason = reason;
    }

    public HttpSignatureException(Reason reason, String message, Throwable cause) {
        super(message, cause);
        this.reason = reason;
    }

    public Reason getReason() {
        return reason;
    }
}
