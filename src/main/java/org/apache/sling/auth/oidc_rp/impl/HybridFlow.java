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
 * Hybrid flow: the ID token delivered with the code is validated and bound to the session nonce and to the code
 * (<code>c_hash</code>) before the code is redeemed. A response that fails any of these checks never reaches the
 * token endpoint.
 */
class HybridFlow extends ValidationFlow {

    static final String INVALID_NONCE = "invalid nonce";
    static final String INVALID_CODE_HASH = "invalid c_hash";

    HybridFlow(@NotNull IdentityTokenVerifier identityTokenVerifier, @NotNull TokenEndpointClient tokenEndpointClient,
               @NotNull String clientId, @Nullable String clientSecret) {
        super(identityTokenVerifier, tokenEndpointClient, clientId, clientSecret);
    }

    @Override
    @NotNull
    FlowOutcome validate(@NotNull AuthorizeResponse response, @NotNull AuthorizeState state,
                         @NotNull ProviderMetadata providerMetadata) {
        logger.debug("Processing hybrid flow response");

        String frontChannelToken = response.identityToken();
        if (isMissing(frontChannelToken)) {
            return fail(MISSING_IDENTITY_TOKEN);
        }

        IdentityTokenValidationResult validationResult =
                identityTokenVerifier.validate(frontChannelToken, clientId, providerMetadata);
        if (!validationResult.isSuccess()) {
            return fail(validationResult);
        }

        Identity identity = validationResult.getIdentity();
        if (!NonceVerifier.verify(state.nonce().getValue(), identity.findFirst(NonceVerifier.NONCE_CLAIM))) {
            return fail(INVALID_NONCE);
        }

        if (!HashBinder.verifyCodeBinding(response.code(), identity.findFirst(HashBinder.CODE_HASH_CLAIM))) {
            return fail(INVALID_CODE_HASH);
        }

        TokenEndpointResponse tokens = redeemCode(response.code(), state, providerMetadata);
        if (tokens.isError()) {
            return fail(tokens.getError());
        }

        // the identity stays the one of the front channel token
        String identityToken = tokens.getIdentityToken();
        return FlowOutcome.validated(tokens, isMissing(identityToken) ? frontChannelToken : identityToken, identity);
    }
}
