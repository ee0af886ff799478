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

import org.jetbrains.annotations.NotNull;

/**
 * Entry point for validating the response an OpenID provider sends to the redirect URI
 *
 * <p>Implementations are configured for a single client registration and a single response style
 * (authorization code or hybrid). They keep no state between calls; all per-login state is passed in
 * with the {@link AuthorizeState}.</p>
 */
public interface OidcClient {

    /**
     * Validates an authorization response and, if valid, redeems the authorization code.
     *
     * <p>Every failed check, as well as errors reported by the provider, results in a failed {@link LoginResult}
     * carrying the reason. No check is skipped and no tokens are returned for failed logins.</p>
     *
     * @param data the raw response: the full redirect URL, or its query or fragment part
     * @param state the state generated for the login attempt this response belongs to
     * @return the login result
     */
    @NotNull LoginResult validateResponse(@NotNull String data, @NotNull AuthorizeState state);

    /**
     * Retrieves the claims of the user the access token was issued to from the UserInfo endpoint
     *
     * @param accessToken the access token
     * @return the claims, or the error reported by the endpoint
     */
    @NotNull UserInfoResult getUserInfo(@NotNull String accessToken);

    /**
     * Uses a refresh token to obtain new tokens from the token endpoint.
     *
     * @param refreshToken the refresh token
     * @return the token response
     */
    @NotNull TokenEndpointResponse refreshToken(@NotNull String refreshToken);
}
