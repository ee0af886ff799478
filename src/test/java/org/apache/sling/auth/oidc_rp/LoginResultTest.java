/*
 * Licensed to the Apache Software Foundation (ASF) under one or more
 * contributor license agreements.  See the NOTICE file distributed with
 * this work for additional information regarding copyright ownership.
 * The ASF licenses this file to You under the Apache License, Version 2.0
 * (the "License"); you may not use this file except in compliance with
 * the License.  You may obtain a copy of the License at
 *
 *      http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package org.apache.sling.auth.oidc_rp;

import java.net.URI;
import java.time.Instant;
import java.util.Collections;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class LoginResultTest {

    @Test
    void failedResult() {
        LoginResult result = LoginResult.failure("invalid state");

        assertFalse(result.isSuccess());
        assertEquals("invalid state", result.getError());
        assertThrows(IllegalStateException.class, result::getIdentity);
        assertThrows(IllegalStateException.class, result::getAccessToken);
        assertThrows(IllegalStateException.class, result::getIdentityToken);
        assertThrows(IllegalStateException.class, result::getAccessTokenExpiration);
    }

    @Test
    void failedResultRequiresMessage() {
        assertThrows(IllegalArgumentException.class, () -> LoginResult.failure(""));
    }

    @Test
    void successfulResult() {
        Instant now = Instant.now();
        Identity identity = new Identity(Collections.singletonList(new Claim("sub", "alice")));

        LoginResult result = LoginResult.success(identity, "at", "id", null, now.plusSeconds(60), now, null);

        assertTrue(result.isSuccess());
        assertThrows(IllegalStateException.class, result::getError);
        assertEquals(identity, result.getIdentity());
        assertEquals("at", result.getAccessToken());
        assertEquals("id", result.getIdentityToken());
        assertFalse(result.getRefreshToken().isPresent());
        assertFalse(result.getRefreshTokenHandler().isPresent());
        assertEquals(now, result.getAuthenticationTime());
    }

    @Test
    void tokenEndpointHidesSecret() {
        TokenEndpoint endpoint = new TokenEndpoint(URI.create("https://idp.example.com/token"), "my-client", "s3cr3t");

        assertTrue(endpoint.hasClientSecret());
        assertFalse(endpoint.toString().contains("s3cr3t"));
        assertFalse(new TokenEndpoint(endpoint.uri(), "my-client", "").hasClientSecret());
    }
}
