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

import org.apache.sling.auth.oidc_rp.AuthorizeState;
import org.apache.sling.auth.oidc_rp.Identity;
import org.apache.sling.auth.oidc_rp.ProviderMetadata;
import org.apache.sling.auth.oidc_rp.TokenEndpointResponse;
import org.apache.sling.auth.oidc_rp.spi.IdentityTokenValidator.IdentityTokenValidationResult;
import org.apache.sling.auth.oidc_rp.spi.TokenEndpointClient;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

/**
 * Authorization code flow: the code is redeemed first, then the ID token from the token endpoint is validated and
 * bound to the access token through <code>at_hash</code>.
 */
class CodeFlow extends ValidationFlow {

    static final String INVALID_ACCESS_TOKEN_HASH = "invalid access token hash";

    CodeFlow(@NotNull IdentityTokenVerifier identityTokenVerifier, @NotNull TokenEndpointClient tokenEndpointClient,
             @NotNull String clientId, @Nullable String clientSecret) {
        super(identityTokenVerifier, tokenEndpointClient, clientId, clientSecret);
    }

    @Override
    @NotNull
    FlowOutcome validate(@NotNull AuthorizeResponse response, @NotNull AuthorizeState state,
                         @NotNull ProviderMetadata providerMetadata) {
        logger.debug("Processing authorization code response");

        TokenEndpointResponse tokens = redeemCode(response.code(), state, providerMetadata);
        if (tokens.isError()) {
            return fail(tokens.getError());
        }

        String identityToken = tokens.getIdentityToken();
        if (isMissing(identityToken)) {
            return fail(MISSING_IDENTITY_TOKEN);
        }

        IdentityTokenValidationResult validationResult =
                identityTokenVerifier.validate(identityToken, clientId, providerMetadata);
        if (!validationResult.isSuccess()) {
            return fail(validationResult);
        }

        String accessToken = tokens.getAccessToken();
        if (isMissing(accessToken)) {
            return fail(MISSING_ACCESS_TOKEN);
        }

        Identity identity = validationResult.getIdentity();
        if (!HashBinder.verifyAccessTokenBinding(accessToken,
                identity.findFirst(HashBinder.ACCESS_TOKEN_HASH_CLAIM))) {
            return fail(INVALID_ACCESS_TOKEN_HASH);
        }

        return FlowOutcome.validated(tokens, identityToken, identity);
    }
}
