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
package org.apache.sling.auth.oidc_rp.spi;

import java.net.URI;

import org.apache.sling.auth.oidc_rp.TokenEndpoint;
import org.apache.sling.auth.oidc_rp.TokenEndpointResponse;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

/**
 * Sends requests to the token endpoint of an OpenID provider.
 *
 * <p>Implementations report transport failures and error responses through
 * {@link TokenEndpointResponse#error(String)} and do not retry.</p>
 */
public interface TokenEndpointClient {

    /**
     * Exchanges an authorization code for tokens.
     *
     * @param tokenEndpoint the token endpoint and the client credentials
     * @param code the authorization code
     * @param redirectUri the redirect URI sent with the authentication request
     * @param codeVerifier the PKCE code verifier, null if PKCE was not used
     * @return the token response
     */
    @NotNull
    TokenEndpointResponse redeemAuthorizationCode(@NotNull TokenEndpoint tokenEndpoint, @NotNull String code,
                                                  @NotNull URI redirectUri, @Nullable String codeVerifier);

    /**
     * Exchanges a refresh token for new tokens.
     *
     * @param tokenEndpoint the token endpoint and the client credentials
     * @param refreshToken the refresh token
     * @return the token response
     */
    @NotNull
    TokenEndpointResponse refreshToken(@NotNull TokenEndpoint tokenEndpoint, @NotNull String refreshToken);
}
