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

import java.net.URI;

import com.nimbusds.oauth2.sdk.id.State;
import com.nimbusds.oauth2.sdk.pkce.CodeVerifier;
import com.nimbusds.openid.connect.sdk.Nonce;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

/**
 * The values generated for a single login attempt when the authentication request was built.
 *
 * <p>An instance must be used to validate exactly one authorization response. Codes and nonces are single use, so a
 * new login attempt always requires a new instance.</p>
 */
public final class AuthorizeState {

    private final @NotNull State state;
    private final @Nullable CodeVerifier codeVerifier;
    private final @NotNull URI redirectUri;
    private final @NotNull Nonce nonce;

    public AuthorizeState(@NotNull State state, @Nullable CodeVerifier codeVerifier, @NotNull URI redirectUri,
                          @NotNull Nonce nonce) {
        this.state = state;
        this.codeVerifier = codeVerifier;
        this.redirectUri = redirectUri;
        this.nonce = nonce;
    }

    public @NotNull State state() {
        return state;
    }

    /**
     * @return the PKCE code verifier, null if PKCE was not used for this request
     */
    public @Nullable CodeVerifier codeVerifier() {
        return codeVerifier;
    }

    public @NotNull URI redirectUri() {
        return redirectUri;
    }

    public @NotNull Nonce nonce() {
        return nonce;
    }
}
