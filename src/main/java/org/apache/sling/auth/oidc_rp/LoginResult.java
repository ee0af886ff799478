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

import java.time.Instant;
import java.util.Optional;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

/**
 * Encapsulates the outcome of validating an authorization response.
 *
 * <p>This class has two top-level states:</p>
 * <ol>
 *   <li>successful: {@link #isSuccess()} returns {@code true}, the identity and the tokens are available.</li>
 *   <li>failed: {@link #isSuccess()} returns {@code false}, and {@link #getError()} returns the reason.</li>
 * </ol>
 *
 * <p>Methods throw {@link IllegalStateException} if they are called in an unexpected state and do not return null
 * values, except for the optional refresh token.</p>
 */
public final class LoginResult {

    private final @Nullable String error;
    private final @Nullable Identity identity;
    private final @Nullable String accessToken;
    private final @Nullable String identityToken;
    private final @Nullable String refreshToken;
    private final @Nullable Instant accessTokenExpiration;
    private final @Nullable Instant authenticationTime;
    private final @Nullable RefreshTokenHandler refreshTokenHandler;

    private LoginResult(@Nullable String error, @Nullable Identity identity, @Nullable String accessToken,
                        @Nullable String identityToken, @Nullable String refreshToken,
                        @Nullable Instant accessTokenExpiration, @Nullable Instant authenticationTime,
                        @Nullable RefreshTokenHandler refreshTokenHandler) {
        this.error = error;
        this.identity = identity;
        this.accessToken = accessToken;
        this.identityToken = identityToken;
        this.refreshToken = refreshToken;
        this.accessTokenExpiration = accessTokenExpiration;
        this.authenticationTime = authenticationTime;
        this.refreshTokenHandler = refreshTokenHandler;
    }

    public static @NotNull LoginResult failure(@NotNull String error) {
        if (error.isEmpty()) {
            throw new IllegalArgumentException("A failed login result requires an error message");
        }
        return new LoginResult(error, null, null, null, null, null, null, null);
    }

    public static @NotNull LoginResult success(@NotNull Identity identity, @NotNull String accessToken,
                                               @NotNull String identityToken, @Nullable String refreshToken,
                                               @NotNull Instant accessTokenExpiration,
                                               @NotNull Instant authenticationTime,
                                               @Nullable RefreshTokenHandler refreshTokenHandler) {
        return new LoginResult(null, identity, accessToken, identityToken, refreshToken, accessTokenExpiration,
                authenticationTime, refreshTokenHandler);
    }

    public boolean isSuccess() {
        return error == null;
    }

    /**
     * @return the reason why the login failed
     * @throws IllegalStateException if the login succeeded
     */
    public @NotNull String getError() {
        if (error == null)
            throw new IllegalStateException("Login succeeded, no error present.");
        return error;
    }

    public @NotNull Identity getIdentity() {
        return requireSuccess(identity);
    }

    public @NotNull String getAccessToken() {
        return requireSuccess(accessToken);
    }

    public @NotNull String getIdentityToken() {
        return requireSuccess(identityToken);
    }

    public @NotNull Optional<String> getRefreshToken() {
        requireSuccess(identity);
        return Optional.ofNullable(refreshToken);
    }

    public @NotNull Instant getAccessTokenExpiration() {
        return requireSuccess(accessTokenExpiration);
    }

    public @NotNull Instant getAuthenticationTime() {
        return requireSuccess(authenticationTime);
    }

    /**
     * @return the handler used to renew the access token, present only if a refresh token was issued
     */
    public @NotNull Optional<RefreshTokenHandler> getRefreshTokenHandler() {
        requireSuccess(identity);
        return Optional.ofNullable(refreshTokenHandler);
    }

    private <T> @NotNull T requireSuccess(@Nullable T value) {
        if (error != null)
            throw new IllegalStateException("Login failed: " + error);
        if (value == null)
            throw new IllegalStateException("Value not present in successful login result.");
        return value;
    }
}
