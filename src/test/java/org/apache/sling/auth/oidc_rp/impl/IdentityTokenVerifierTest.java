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

import org.apache.sling.auth.oidc_rp.Identity;
import org.apache.sling.auth.oidc_rp.ProviderMetadata;
import org.apache.sling.auth.oidc_rp.spi.ClaimsDiagnostics;
import org.apache.sling.auth.oidc_rp.spi.IdentityTokenValidator;
import org.apache.sling.auth.oidc_rp.spi.IdentityTokenValidator.IdentityTokenValidationResult;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.apache.sling.auth.oidc_rp.impl.OidcTestSupport.*;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.mockito.ArgumentMatchers.any;

class IdentityTokenVerifierTest {

    private static final String TOKEN = "id-token";

    private IdentityTokenValidator validator;
    private ClaimsDiagnostics diagnostics;
    private IdentityTokenVerifier verifier;
    private ProviderMetadata metadata;

    @BeforeEach
    void setUp() {
        validator = mock(IdentityTokenValidator.class);
        diagnostics = mock(ClaimsDiagnostics.class);
        verifier = new IdentityTokenVerifier(validator, diagnostics);
        metadata = providerMetadata();
    }

    private void validatorReturns(Identity identity) {
        when(validator.validate(TOKEN, CLIENT_ID, metadata)).thenReturn(IdentityTokenValidationResult.success(identity));
    }

    @Test
    void testValidToken() {
        Identity identity = identity("sub", SUBJECT, "iss", ISSUER, "aud", CLIENT_ID);
        validatorReturns(identity);

        IdentityTokenValidationResult result = verifier.validate(TOKEN, CLIENT_ID, metadata);

        assertTrue(result.isSuccess());
        assertEquals(identity, result.getIdentity());
        verify(diagnostics).claims("identity token", identity);
    }

    @Test
    void testAudienceOfOtherClient() {
        validatorReturns(identity("sub", SUBJECT, "iss", ISSUER, "aud", "other-client"));

        IdentityTokenValidationResult result = verifier.validate(TOKEN, CLIENT_ID, metadata);

        assertFalse(result.isSuccess());
        assertEquals("invalid audience", result.getError());
    }

    @Test
    void testOnlyFirstAudienceIsCompared() {
        validatorReturns(identity("sub", SUBJECT, "iss", ISSUER, "aud", "other-client", "aud", CLIENT_ID));

        IdentityTokenValidationResult result = verifier.validate(TOKEN, CLIENT_ID, metadata);

        assertEquals("invalid audience", result.getError());
    }

    @Test
    void testMissingAudience() {
        validatorReturns(identity("sub", SUBJECT, "iss", ISSUER));

        assertEquals("invalid audience", verifier.validate(TOKEN, CLIENT_ID, metadata).getError());
    }

    @Test
    void testIssuerOfOtherProvider() {
        validatorReturns(identity("sub", SUBJECT, "iss", "https://evil.example.com", "aud", CLIENT_ID));

        IdentityTokenValidationResult result = verifier.validate(TOKEN, CLIENT_ID, metadata);

        assertFalse(result.isSuccess());
        assertEquals("invalid issuer", result.getError());
    }

    @Test
    void testIssuerComparisonIsExact() {
        validatorReturns(identity("sub", SUBJECT, "iss", ISSUER + "/", "aud", CLIENT_ID));

        assertEquals("invalid issuer", verifier.validate(TOKEN, CLIENT_ID, metadata).getError());
    }

    @Test
    void testValidatorFailureIsReturnedUnchanged() {
        when(validator.validate(TOKEN, CLIENT_ID, metadata))
                .thenReturn(IdentityTokenValidationResult.failure("identity token has expired"));

        IdentityTokenValidationResult result = verifier.validate(TOKEN, CLIENT_ID, metadata);

        assertFalse(result.isSuccess());
        assertEquals("identity token has expired", result.getError());
        verify(diagnostics, never()).claims(any(), any());
    }
}
