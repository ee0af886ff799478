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
package org.apache.sling.auth.oidc_rp.impl;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class AuthorizeResponseTest {

    @Test
    void parseQueryOfRedirectUrl() {
        AuthorizeResponse response = AuthorizeResponse.parse("https://app.example.com/cb?code=abc&state=xyz");

        assertFalse(response.isError());
        assertEquals("abc", response.code());
        assertEquals("xyz", response.state());
        assertNull(response.identityToken());
    }

    @Test
    void parseFragmentOfRedirectUrl() {
        AuthorizeResponse response = AuthorizeResponse.parse(
                "https://app.example.com/cb?ignored=1#code=abc&id_token=eyJ.eyJ.sig&state=xyz");

        assertEquals("abc", response.code());
        assertEquals("xyz", response.state());
        assertEquals("eyJ.eyJ.sig", response.identityToken());
    }

    @Test
    void parseBareParameters() {
        AuthorizeResponse response = AuthorizeResponse.parse("code=abc&state=xyz");

        assertEquals("abc", response.code());
        assertEquals("xyz", response.state());
    }

    @Test
    void parseDecodesValues() {
        AuthorizeResponse response = AuthorizeResponse.parse("?code=a%2Bb%3D&state=x%20y");

        assertEquals("a+b=", response.code());
        assertEquals("x y", response.state());
    }

    @Test
    void parseError() {
        AuthorizeResponse response = AuthorizeResponse.parse(
                "https://app.example.com/cb?error=access_denied&error_description=User%20cancelled&state=xyz");

        assertTrue(response.isError());
        assertEquals("access_denied", response.error());
        assertEquals("User cancelled", response.errorDescription());
    }

    @Test
    void parseWithoutParameters() {
        AuthorizeResponse response = AuthorizeResponse.parse("");

        assertFalse(response.isError());
        assertNull(response.code());
        assertNull(response.state());
    }
}
