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
import org.jetbrains.annotations.Nullable;

/**
 * The result of a token request, either an authorization code redemption or a refresh.
 *
 * <p>Error responses only carry the {@link #getError() error}; all token accessors return null for them.</p>
 */
public final class TokenEndpointResponse {

    private final @Nullable String error;
    private final @Nullable String identityToken;
    private final @Nullable String accessToken;
    private final @Nullable String refreshToken;
    private final long expiresIn;

    private TokenEndpointResponse(@Nullable String error, @Nullable String identityToken, @Nullable String accessToken,
                                  @Nullable String refreshToken, long expiresIn) {
        this.error = error;
        this.identityToken = identityToken;
        this.accessToken = accessToken;
        this.refreshToken = refreshToken;
        this.expiresIn = expiresIn;
    }

    public static @NotNull TokenEndpointResponse success(@Nullable String identityToken, @NotNull String accessToken,
                                                         @Nullable String refreshToken, long expiresIn) {
        return new TokenEndpointResponse(null, identityToken, accessToken, refreshToken, expiresIn);
    }

    public static @NotNull TokenEndpointResponse error(@NotNull String error) {
        return new TokenEndpointResponse(error, null, null, null, 0);
    }

    public boolean isError() {
        return error != null;
    }

    public @Nullable String getError() {
        return error;
    }

    public @Nullable String getIdentityToken() {
        return identityToken;
    }

    public @Nullable String getAccessToken() {
        return accessToken;
    }

    public @Nullable String getRefreshToken() {
        return refreshToken;
    }

    /**
     * @return the lifetime of the access token in seconds, 0 if the provider did not send one
     */
    public long getExpiresIn() {
        return expiresIn;
    }
}
