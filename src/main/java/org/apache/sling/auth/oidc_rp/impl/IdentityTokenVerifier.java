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
import org.jetbrains.annotations.NotNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Validates an ID token with the configured {@link IdentityTokenValidator} and then binds it to this client and to
 * the provider.
 *
 * <p>The <code>aud</code> claim must be equal to the client id and the <code>iss</code> claim must be equal to the
 * issuer of the provider metadata. Both comparisons are exact; a missing claim is compared as the empty string.</p>
 */
class IdentityTokenVerifier {

    static final String INVALID_AUDIENCE = "invalid audience";
    static final String INVALID_ISSUER = "invalid issuer";

    private static final String AUDIENCE_CLAIM = "aud";
    private static final String ISSUER_CLAIM = "iss";

    private static final Logger logger = LoggerFactory.getLogger(IdentityTokenVerifier.class);

    private final IdentityTokenValidator validator;
    private final ClaimsDiagnostics diagnostics;

    IdentityTokenVerifier(@NotNull IdentityTokenValidator validator, @NotNull ClaimsDiagnostics diagnostics) {
        this.validator = validator;
        this.diagnostics = diagnostics;
    }

    @NotNull
    IdentityTokenValidationResult validate(@NotNull String identityToken, @NotNull String clientId,
                                           @NotNull ProviderMetadata providerMetadata) {
        logger.debug("Calling identity token validator: {}", validator.getClass().getName());

        // First, check structure and signature
        IdentityTokenValidationResult result = validator.validate(identityToken, clientId, providerMetadata);
        if (!result.isSuccess()) {
            return result;
        }

        Identity identity = result.getIdentity();
        diagnostics.claims("identity token", identity);

        if (!validateAudience(identity, clientId)) {
            return IdentityTokenValidationResult.failure(INVALID_AUDIENCE);
        }

        if (!validateIssuer(identity, providerMetadata.issuer())) {
            return IdentityTokenValidationResult.failure(INVALID_ISSUER);
        }

        return result;
    }

    private static boolean validateAudience(@NotNull Identity identity, @NotNull String clientId) {
        String audience = valueOrEmpty(identity, AUDIENCE_CLAIM);
        if (!clientId.equals(audience)) {
            logger.error("client id ({}) does not match audience ({})", clientId, audience);
            return false;
        }
        return true;
    }

    private static boolean validateIssuer(@NotNull Identity identity, @NotNull String issuer) {
        String tokenIssuer = valueOrEmpty(identity, ISSUER_CLAIM);
        if (!issuer.equals(tokenIssuer)) {
            logger.error("configured issuer ({}) does not match token issuer ({})", issuer, tokenIssuer);
            return false;
        }
        return true;
    }

    private static @NotNull String valueOrEmpty(@NotNull Identity identity, @NotNull String type) {
        String value = identity.findFirst(type);
        return value == null ? "" : value;
    }
}
