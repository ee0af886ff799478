/*
 * Licensed to the Apache Software Foundation (ASF) under one
 * or more contributor license agreements.  See the NOTICE file
 * distributed with this work for additional information
 * regarding copyright ownership.  The ASF licenses this file
 * to you under the Apache License, Version 2.0 (the
 * "License"); you may not use this file except in compliance
 * with the License.  You may obtain a copy of the License at
 *
 *   http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing,
 * software distributed under the License is distributed on an
 * "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY
 * KIND, either express or implied.  See the License for the
 * specific language governing permissions and limitations
 * under the License.
 */
package org.apache.sling.auth.oidc_rp.impl;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.Date;

import com.nimbusds.jose.JOSEException;
import com.nimbusds.jose.JWSAlgorithm;
import com.nimbusds.jose.JWSHeader;
import com.nimbusds.jose.JWSSigner;
import com.nimbusds.jose.crypto.RSASSASigner;
import com.nimbusds.jose.jwk.JWKSet;
import com.nimbusds.jose.jwk.RSAKey;
import com.nimbusds.jose.jwk.gen.RSAKeyGenerator;
import com.nimbusds.jwt.JWTClaimsSet;
import com.nimbusds.jwt.SignedJWT;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;
import org.apache.sling.auth.oidc_rp.Claim;
import org.apache.sling.auth.oidc_rp.Identity;
import org.apache.sling.auth.oidc_rp.ProviderMetadata;

/**
 * Shared test utilities: signing keys, ID tokens and an in-process HTTP server.
 */
class OidcTestSupport {

    static final String ISSUER = "https://idp.example.com";
    static final String CLIENT_ID = "my-client";
    static final String CLIENT_SECRET = "my-secret";
    static final String SUBJECT = "alice";
    static final String KEY_ID = "test-key-id";
    static final URI TOKEN_ENDPOINT = URI.create("https://idp.example.com/token");
    static final URI USER_INFO_ENDPOINT = URI.create("https://idp.example.com/userinfo");
    static final URI JWK_SET_URI = URI.create("https://idp.example.com/jwks");

    private final RSAKey rsaKey;
    private final JWSSigner signer;

    OidcTestSupport() throws JOSEException {
        rsaKey = new RSAKeyGenerator(2048).keyID(KEY_ID).generate();
        signer = new RSASSASigner(rsaKey);
    }

    RSAKey getRsaKey() {
        return rsaKey;
    }

    static ProviderMetadata providerMetadata() {
        return new ProviderMetadata(ISSUER, TOKEN_ENDPOINT, USER_INFO_ENDPOINT, JWK_SET_URI);
    }

    static Identity identity(String... typesAndValues) {
        Claim[] claims = new Claim[typesAndValues.length / 2];
        for (int i = 0; i < claims.length; i++) {
            claims[i] = new Claim(typesAndValues[2 * i], typesAndValues[2 * i + 1]);
        }
        return new Identity(Arrays.asList(claims));
    }

    /**
     * Claims of a valid ID token issued to {@link #CLIENT_ID}.
     */
    static JWTClaimsSet.Builder idTokenClaims() {
        return new JWTClaimsSet.Builder()
                .issuer(ISSUER)
                .subject(SUBJECT)
                .audience(CLIENT_ID)
                .expirationTime(new Date(System.currentTimeMillis() + 3600000))
                .issueTime(new Date());
    }

    String sign(JWTClaimsSet claimsSet) throws JOSEException {
        return sign(claimsSet, KEY_ID);
    }

    String sign(JWTClaimsSet claimsSet, String keyId) throws JOSEException {
        JWSHeader.Builder headerBuilder = new JWSHeader.Builder(JWSAlgorithm.RS256);
        if (keyId != null) {
            headerBuilder.keyID(keyId);
        }
        SignedJWT signedJWT = new SignedJWT(headerBuilder.build(), claimsSet);
        signedJWT.sign(signer);
        return signedJWT.serialize();
    }

    /**
     * Creates a started server without contexts, bound to an ephemeral port.
     */
    static HttpServer createServer() throws IOException {
        HttpServer server = HttpServer.create(new InetSocketAddress(0), 0);
        server.start();
        return server;
    }

    /**
     * Adds a JWK Set endpoint serving the public key to the server.
     */
    void addJwkSetContext(HttpServer server, String path) {
        server.createContext(path, exchange -> {
            JWKSet jwkSet = new JWKSet(rsaKey.toPublicJWK());
            respond(exchange, 200, "application/json", jwkSet.toString());
        });
    }

    static URI uri(HttpServer server, String path) {
        return URI.create("http://localhost:" + server.getAddress().getPort() + path);
    }

    static void respond(HttpExchange exchange, int status, String contentType, String body) throws IOException {
        byte[] bytes = body.getBytes(StandardCharsets.UTF_8);
        if (contentType != null) {
            exchange.getResponseHeaders().set("Content-Type", contentType);
        }
        exchange.sendResponseHeaders(status, bytes.length);
        try (OutputStream out = exchange.getResponseBody()) {
            out.write(bytes);
        }
    }

    static String readBody(HttpExchange exchange) throws IOException {
        return new String(exchange.getRequestBody().readAllBytes(), StandardCharsets.UTF_8);
    }
}
