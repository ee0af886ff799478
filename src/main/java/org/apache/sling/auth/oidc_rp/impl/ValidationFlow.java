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

import com.nimbusds.oauth2.sdk.pkce.CodeVerifier;
import org.apache.sling.auth.oidc_rp.AuthorizeState;
import org.apache.sling.auth.oidc_rp.Identity;
import org.apache.sling.auth.oidc_rp.ProviderMetadata;
import org.apache.sling.auth.oidc_rp.TokenEndpoint;
import org.apache.sling.auth.oidc_rp.TokenEndpointResponse;
import org.apache.sling.auth.oidc_rp.spi.IdentityTokenValidator.IdentityTokenValidationResult;
import org.apache.sling.auth.oidc_rp.spi.TokenEndpointClient;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Base class for the response style specific validation steps.
 *
 * <p>Subclasses are invoked once the authorize response passed the state check. They decide in which order the
 * authorization code is redeemed and the ID token is validated and bound.</p>
 */
abstract class ValidationFlow {

    static final String MISSING_IDENTITY_TOKEN = "missing identity token";
    static final String IDENTITY_TOKEN_VALIDATION_ERROR = "identity token validation error";
    static final String MISSING_ACCESS_TOKEN = "missing access token";
    static final String UNKNOWN_ERROR = "unknown error";

    protected final Logger logger = LoggerFactory.getLogger(getClass());

    protected final IdentityTokenVerifier identityTokenVerifier;
    protected final TokenEndpointClient tokenEndpointClient;
    protected final String clientId;
    protected final @Nullable String clientSecret;

    protected ValidationFlow(@NotNull IdentityTokenVerifier identityTokenVerifier,
                             @NotNull TokenEndpointClient tokenEndpointClient,
                             @NotNull String clientId, @Nullable String clientSecret) {
        this.identityTokenVerifier = identityTokenVerifier;
        this.tokenEndpointClient = tokenEndpointClient;
        this.clientId = clientId;
        this.clientSecret = clientSecret;
    }

    /**
     * @param response the authorize response, with a non-empty code and a verified state
     * @param state the state kept since the authorize request
     * @param providerMetadata the provider metadata snapshot of this validation
     * @return the outcome, never null
     */
    @NotNull
    abstract FlowOutcome validate(@NotNull AuthorizeResponse response, @NotNull AuthorizeState state,
                                  @NotNull ProviderMetadata providerMetadata);

    @NotNull
    protected TokenEndpointResponse redeemCode(@NotNull String code, @NotNull AuthorizeState state,
                                               @NotNull ProviderMetadata providerMetadata) {
        TokenEndpoint tokenEndpoint = new TokenEndpoint(providerMetadata.tokenEndpoint(), clientId, clientSecret);
        CodeVerifier codeVerifier = state.codeVerifier();

        logger.debug("Redeeming authorization code at {}", tokenEndpoint);
        return tokenEndpointClient.redeemAuthorizationCode(tokenEndpoint, code, state.redirectUri(),
                codeVerifier != null ? codeVerifier.getValue() : null);
    }

    @NotNull
    protected FlowOutcome fail(@Nullable String error) {
        String message = isMissing(error) ? UNKNOWN_ERROR : error;
        logger.error(message);
        return FlowOutcome.failed(message);
    }

    @NotNull
    protected FlowOutcome fail(@NotNull IdentityTokenValidationResult validationResult) {
        String error = validationResult.getError();
        return fail(isMissing(error) ? IDENTITY_TOKEN_VALIDATION_ERROR : error);
    }

    static boolean isMissing(@Nullable String value) {
        return value == null || value.isEmpty();
    }

    /**
     * Either an error or the redeemed tokens together with the validated ID token.
     */
    static final class FlowOutcome {

        private final @Nullable String error;
        private final @Nullable TokenEndpointResponse tokens;
        private final @Nullable String identityToken;
        private final @Nullable Identity identity;

        private FlowOutcome(@Nullable String error, @Nullable TokenEndpointResponse tokens,
                            @Nullable String identityToken, @Nullable Identity identity) {
            this.error = error;
            this.tokens = tokens;
            this.identityToken = identityToken;
            this.identity = identity;
        }

        static @NotNull FlowOutcome failed(@NotNull String error) {
            return new FlowOutcome(error, null, null, null);
        }

        static @NotNull FlowOutcome validated(@NotNull TokenEndpointResponse tokens, @NotNull String identityToken,
                                              @NotNull Identity identity) {
            return new FlowOutcome(null, tokens, identityToken, identity);
        }

        boolean isValid() {
            return error == null;
        }

        @NotNull String error() {
            if (error == null)
                throw new IllegalStateException("Flow succeeded, no error present.");
            return error;
        }

        @NotNull TokenEndpointResponse tokens() {
            if (tokens == null)
                throw new IllegalStateException("Flow failed, no tokens present.");
            return tokens;
        }

        @NotNull String identityToken() {
            if (identityToken == null)
                throw new IllegalStateException("Flow failed, no identity token present.");
            return identityToken;
        }

        @NotNull Identity identity() {
            if (identity == null)
                throw new IllegalStateException("Flow failed, no identity present.");
            return identity;
        }
    }
}
