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

import io.aauth.httpsig.HttpSignatureConfig;
import io.aauth.httpsig.message.HttpMessage;
import io.aauth.httpsig.signing.algorithms.AlgorithmRegistry;
import io.aauth.httpsig.signing.exceptions.HttpSignatureException;
import io.aauth.httpsig.signing.exceptions.KeyTypeException;
import io.aauth.httpsig.signing.exceptions.SignatureBaseException;
import io.aauth.httpsig.signing.exceptions.SignatureParameterException;
import io.aauth.httpsig.signing.exceptions.UnsupportedAlgorithmException;
import org.junit.jupiter.api.Test;

import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;
import java.nio.charset.StandardCharsets;
import java.security.KeyPair;
import java.security.KeyPairGenerator;
import java.util.Arrays;
import java.util.Base64;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class HTTPSigSignerTest {

    private static final String DATE = "Tue, 07 Jun 2014 20:51:35 GMT";
    private static final SecretKeySpec SECRET = new SecretKeySpec("secret".getBytes(StandardCharsets.UTF_8), "HmacSHA256");

    @Test
    void signsHmacRequestWithExpectedHeader() throws Exception {
        HttpMessage request = HttpMessage.request("GET", "/foo").addHeader("Date", DATE);

        HTTPSigSigners.sign(request, "Test", SECRET, "hmac-sha256", Arrays.asList("(request-target)", "date"));

        Mac mac = Mac.getInstance("HmacSHA256");
        mac.init(SECRET);
        String expected = Base64.getEncoder().encodeToString(mac.doFinal(
            ("(request-target): get /foo\ndate: " + DATE).getBytes(StandardCharsets.UTF_8)));

        assertEquals("keyId=\"Test\",algorithm=\"hmac-sha256\",headers=\"(request-target) date\",signature=\""
            + expected + "\"", request.getHeaders().getFirst("Signature"));
    }

    @Test
    void defaultHeaderListIsDate() throws Exception {
        HttpMessage request = HttpMessage.request("GET", "/foo").addHeader("Date", DATE);

        HTTPSigSigners.sign(request, "Test", SECRET, "hmac-sha256", null);

        SignatureParameters parameters = SignatureParametersCodec.parse(request.getHeaders().getFirst("Signature"));
        assertEquals(Collections.singletonList("date"), parameters.getHeaders());
    }

    @Test
    void missingDateFailsWithoutTouchingMessage() {
        HttpMessage request = HttpMessage.request("GET", "/foo").addHeader("Host", "example.org");

        SignatureBaseException e = assertThrows(SignatureBaseException.class,
            () -> HTTPSigSigners.sign(request, "Test", SECRET, "hmac-sha256", Collections.emptyList()));

        assertEquals(HttpSignatureException.Reason.MISSING_SIGNED_HEADER, e.getReason());
        assertFalse(request.getHeaders().contains("Signature"));
    }

    @Test
    void responseCannotCoverRequestTarget() {
        HttpMessage response = HttpMessage.response().addHeader("Date", DATE);

        SignatureBaseException e = assertThrows(SignatureBaseException.class,
            () -> HTTPSigSigners.sign(response, "Test", SECRET, "hmac-sha256", Arrays.asList("(request-target)", "date")));

        assertEquals(HttpSignatureException.Reason.REQUEST_TARGET_NOT_PERMITTED, e.getReason());
        assertFalse(response.getHeaders().contains("Signature"));
    }

    @Test
    void responseCanBeSignedOverHeaders() throws Exception {
        HttpMessage response = HttpMessage.response().addHeader("Date", DATE);

        HTTPSigSigners.sign(response, "Test", SECRET, "hmac-sha256", null);

        assertTrue(response.getHeaders().contains("Signature"));
    }

    @Test
    void unknownAlgorithmFails() {
        HttpMessage request = HttpMessage.request("GET", "/foo").addHeader("Date", DATE);

        UnsupportedAlgorithmException e = assertThrows(UnsupportedAlgorithmException.class,
            () -> HTTPSigSigners.sign(request, "Test", SECRET, "rot13", null));

        assertEquals(HttpSignatureException.Reason.UNKNOWN_ALGORITHM, e.getReason());
        assertTrue(e.getMessage().contains("rot13"));
    }

    @Test
    void macRejectsPrivateKey() throws Exception {
        KeyPair rsa = KeyPairGenerator.getInstance("RSA").generateKeyPair();
        HttpMessage request = HttpMessage.request("GET", "/foo").addHeader("Date", DATE);

        KeyTypeException e = assertThrows(KeyTypeException.class,
            () -> HTTPSigSigners.sign(request, "Test", rsa.getPrivate(), "hmac-sha256", null));

        assertEquals(HttpSignatureException.Reason.KEY_TYPE_MISMATCH, e.getReason());
        assertFalse(request.getHeaders().contains("Signature"));
    }

    @Test
    void asymmetricRejectsSecretAndMismatchedKeys() throws Exception {
        KeyPair ec = KeyPairGenerator.getInstance("EC").generateKeyPair();
        HttpMessage request = HttpMessage.request("GET", "/foo").addHeader("Date", DATE);

        assertThrows(KeyTypeException.class,
            () -> HTTPSigSigners.sign(request, "Test", SECRET, "rsa-sha256", null));
        assertThrows(KeyTypeException.class,
            () -> HTTPSigSigners.sign(request, "Test", ec.getPrivate(), "rsa-sha256", null));
        assertThrows(KeyTypeException.class,
            () -> HTTPSigSigners.sign(request, "Test", ec.getPublic(), "ecdsa-sha256", null));
    }

    @Test
    void multipleSignaturesAreAppended() throws Exception {
        HttpMessage request = HttpMessage.request("GET", "/foo").addHeader("Date", DATE);
        KeyPair rsa = KeyPairGenerator.getInstance("RSA").generateKeyPair();

        HTTPSigSigners.sign(request, "first", SECRET, "hmac-sha256", null);
        HTTPSigSigners.sign(request, "second", rsa.getPrivate(), "rsa-sha256", null);

        List<String> signatures = request.getHeaders().get("Signature");
        assertEquals(2, signatures.size());
        assertTrue(signatures.get(0).startsWith("keyId=\"first\""));
        assertTrue(signatures.get(1).startsWith("keyId=\"second\""));
        assertEquals(DATE, request.getHeaders().getFirst("Date"));
    }

    @Test
    void authorizationSchemeIsPrefixed() throws Exception {
        HttpMessage request = HttpMessage.request("GET", "/foo").addHeader("Date", DATE);
        HTTPSigSigner signer = HTTPSigSigners.newSigner(AlgorithmRegistry.defaultRegistry(), "hmac-sha256",
            null, SignatureScheme.AUTHORIZATION);

        signer.sign(request, "Test", SECRET);

        assertFalse(request.getHeaders().contains("Signature"));
        assertTrue(request.getHeaders().getFirst("Authorization").startsWith("Signature keyId=\"Test\",algorithm=\"hmac-sha256\""));
    }

    @Test
    void firstSupportedPreferenceWins() throws Exception {
        HTTPSigSigner signer = HTTPSigSigners.newSigner(AlgorithmRegistry.defaultRegistry(),
            Arrays.asList("rot13", "HMAC-SHA512", "rsa-sha256"), null, null);

        assertEquals("hmac-sha512", signer.getAlgorithm());
        assertEquals(Collections.singletonList("date"), signer.getHeaders());
        assertEquals(SignatureScheme.SIGNATURE, signer.getScheme());
    }

    @Test
    void noSupportedPreferenceFails() {
        UnsupportedAlgorithmException e = assertThrows(UnsupportedAlgorithmException.class,
            () -> HTTPSigSigners.newSigner(AlgorithmRegistry.defaultRegistry(), Arrays.asList("rot13", "md5"), null, null));

        assertTrue(e.getMessage().contains("rot13"));
        assertTrue(e.getMessage().contains("md5"));
    }

    @Test
    void signerFromConfig() throws Exception {
        Map<String, String> attributes = new HashMap<>();
        attributes.put(HttpSignatureConfig.HEADERS, "(request-target) host date");
        attributes.put(HttpSignatureConfig.SCHEME, "authorization");
        attributes.put(HttpSignatureConfig.ALGORITHMS, "hmac-sha256");

        HTTPSigSigner signer = HTTPSigSigners.newSigner(new HttpSignatureConfig(attributes));

        assertEquals("hmac-sha256", signer.getAlgorithm());
        assertEquals(Arrays.asList("(request-target)", "host", "date"), signer.getHeaders());
        assertEquals(SignatureScheme.AUTHORIZATION, signer.getScheme());
    }

    @Test
    void bodyAddsDigestHeader() throws Exception {
        byte[] body = "{\"hello\": \"world\"}".getBytes(StandardCharsets.UTF_8);
        HttpMessage request = HttpMessage.request("POST", "/foo").addHeader("Date", DATE);
        HTTPSigSigner signer = HTTPSigSigners.newSigner(AlgorithmRegistry.defaultRegistry(), "hmac-sha256",
            Arrays.asList("date", "digest"), SignatureScheme.SIGNATURE);

        signer.sign(request, "Test", SECRET, body);

        assertEquals("SHA-256=X48E9qOokqqrvdts8nOJRJN3OWDUoyWxBf7kbu9DBPE=", request.getHeaders().getFirst("Digest"));
        assertTrue(request.getHeaders().getFirst("Signature").contains("headers=\"date digest\""));
    }

    @Test
    void failedSignLeavesNoDigest() throws Exception {
        HttpMessage request = HttpMessage.request("POST", "/foo");
        HTTPSigSigner signer = HTTPSigSigners.newSigner(AlgorithmRegistry.defaultRegistry(), "hmac-sha256",
            Arrays.asList("date", "digest"), SignatureScheme.SIGNATURE);

        assertThrows(SignatureBaseException.class, () -> signer.sign(request, "Test", SECRET, new byte[] {1, 2, 3}));

        assertFalse(request.getHeaders().contains("Digest"));
        assertFalse(request.getHeaders().contains("Signature"));
    }

    @Test
    void occupiedAuthorizationSlotIsRefused() throws Exception {
        HttpMessage request = HttpMessage.request("GET", "/foo")
            .addHeader("Date", DATE)
            .addHeader("Authorization", "Basic dXNlcjpwYXNz");
        HTTPSigSigner signer = HTTPSigSigners.newSigner(AlgorithmRegistry.defaultRegistry(), "hmac-sha256",
            null, SignatureScheme.AUTHORIZATION);

        HttpSignatureException e = assertThrows(HttpSignatureException.class,
            () -> signer.sign(request, "Test", SECRET));

        assertEquals(HttpSignatureException.Reason.HEADER_ALREADY_PRESENT, e.getReason());
        assertEquals(Collections.singletonList("Basic dXNlcjpwYXNz"), request.getHeaders().get("Authorization"));
    }

    @Test
    void emptyKeyIdFails() {
        HttpMessage request = HttpMessage.request("GET", "/foo").addHeader("Date", DATE);

        SignatureParameterException e = assertThrows(SignatureParameterException.class,
            () -> HTTPSigSigners.sign(request, "", SECRET, "hmac-sha256", null));

        assertEquals(HttpSignatureException.Reason.MISSING_REQUIRED_PARAMETER, e.getReason());
        assertFalse(request.getHeaders().contains("Signature"));
    }
}
