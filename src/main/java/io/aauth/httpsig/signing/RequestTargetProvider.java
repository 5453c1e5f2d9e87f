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

import io.aauth.httpsig.message.HttpMessage;
import io.aauth.httpsig.signing.exceptions.HttpSignatureException;
import io.aauth.httpsig.signing.exceptions.SignatureBaseException;

import java.util.Locale;

/**
 * Supplies the value of the {@code (request-target)} component: {@code "<lowercased-method> <target>"}.
 *
 * Only requests have a request line, so responses use {@link #notPermitted()}.
 */
@FunctionalInterface
public interface RequestTargetProvider {

    String requestTarget() throws SignatureBaseException;

    static RequestTargetProvider forRequest(String method, String target) {
        return () -> method.toLowerCase(Locale.ROOT) + " " + target;
    }

    static RequestTargetProvider forMessage(HttpMessage message) {
        if (!message.isRequest()) {
            return notPermitted();
        }
        return forRequest(message.getMethod(), message.getRequestTarget());
    }

    static RequestTargetProvider notPermitted() {
        return () -> {
            throw new SignatureBaseException(HttpSignatureException.Reason.REQUEST_TARGET_NOT_PERMITTED,
                "Cannot cover " + SignatureStringBuilder.REQUEST_TARGET + " on anything other than an HTTP request");
        };
    }
}
