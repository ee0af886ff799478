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

import java.net.URI;
import java.util.Arrays;
import java.util.concurrent.atomic.AtomicReference;

import com.sun.net.httpserver.HttpServer;
import org.apache.sling.auth.oidc_rp.UserInfoResult;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.apache.sling.auth.oidc_rp.impl.OidcTestSupport.*;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class NimbusUserInfoClientTest {

    private OidcTestSupport support;
    private HttpServer server;
    private NimbusUserInfoClient client;

    private final AtomicReference<String> authorizationHeader = new AtomicReference<>();

    @BeforeEach
    void setUp() throws Exception {
        support = new OidcTestSupport();
        server = createServer();

        NimbusUserInfoClient.Config config = mock(NimbusUserInfoClient.Config.class);
        when(config.connectTimeoutMillis()).thenReturn(5000);
        when(config.readTimeoutMillis()).thenReturn(5000);
        client = new NimbusUserInfoClient(config);
    }

    @AfterEach
    void tearDown() {
        if (server != null) {
            server.stop(0);
        }
    }

    @Test
    void testFetch() {
        server.createContext("/userinfo", exchange -> {
            authorizationHeader.set(exchange.getRequestHeaders().getFirst("Authorization"));
            respond(exchange, 200, "application/json",
                    "{\"sub\":\"alice\",\"email\":\"alice@example.com\",\"groups\":[\"admins\",\"users\"]}");
        });

        UserInfoResult result = client.fetch(uri(server, "/userinfo"), "at-1");

        assertFalse(result.isError());
        assertEquals("alice", result.getClaims().getSubject());
        assertEquals("alice@example.com", result.getClaims().findFirst("email"));
        assertEquals(Arrays.asList("admins", "users"), result.getClaims().findAll("groups"));
        assertEquals("Bearer at-1", authorizationHeader.get());
    }

    @Test
    void testFetch_InvalidToken() {
        server.createContext("/userinfo", exchange -> {
            exchange.getResponseHeaders().set("WWW-Authenticate",
                    "Bearer error=\"invalid_token\", error_description=\"The access token expired\"");
            respond(exchange, 401, null, "");
        });

        UserInfoResult result = client.fetch(uri(server, "/userinfo"), "expired");

        assertTrue(result.isError());
        assertTrue(result.getError().startsWith("Error in userinfo response: invalid_token"), result.getError());
        assertThrows(IllegalStateException.class, result::getClaims);
    }

    @Test
    void testFetch_JwtResponseIsRejected() throws Exception {
        String jwt = support.sign(idTokenClaims().build());
        server.createContext("/userinfo", exchange -> respond(exchange, 200, "application/jwt", jwt));

        UserInfoResult result = client.fetch(uri(server, "/userinfo"), "at-1");

        assertTrue(result.isError());
    }

    @Test
    void testFetch_EndpointUnreachable() {
        URI endpoint = uri(server, "/userinfo");
        server.stop(0);
        server = null;

        UserInfoResult result = client.fetch(endpoint, "at-1");

        assertTrue(result.isError());
        assertTrue(result.getError().startsWith("Error while processing userinfo response"), result.getError());
    }
}
