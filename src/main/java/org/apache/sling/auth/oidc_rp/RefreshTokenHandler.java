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

import org.apache.sling.auth.oidc_rp.spi.TokenEndpointClient;
import org.jetbrains.annotations.NotNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Renews the access token of a completed login without running the authorization flow again.
 *
 * <p>The handler keeps the current access and refresh token pair. After a successful {@link #refresh()} the pair is
 * replaced by the renewed tokens; if the provider does not rotate refresh tokens the previous refresh token is
 * kept.</p>
 */
public class RefreshTokenHandler {

    private final Logger logger = LoggerFactory.getLogger(getClass());

    private final TokenEndpoint tokenEndpoint;
    private final TokenEndpointClient tokenEndpointClient;
    private String refreshToken;
    private String accessToken;

    public RefreshTokenHandler(@NotNull TokenEndpoint tokenEndpoint, @NotNull TokenEndpointClient tokenEndpointClient,
                               @NotNull String refreshToken, @NotNull String accessToken) {
        this.tokenEndpoint = tokenEndpoint;
        this.tokenEndpointClient = tokenEndpointClient;
        this.refreshToken = refreshToken;
        this.accessToken = accessToken;
    }

    public @NotNull TokenEndpoint getTokenEndpoint() {
        return tokenEndpoint;
    }

    public synchronized @NotNull String getRefreshToken() {
        return refreshToken;
    }

    public synchronized @NotNull String getAccessToken() {
        return accessToken;
    }

    /**
     * Exchanges the current refresh token for new tokens.
     *
     * <p>Refreshes are serialized, a rotated refresh token is never sent twice.</p>
     *
     * @return the token endpoint response; on error the current tokens are left unchanged
     */
    public synchronized @NotNull TokenEndpointResponse refresh() {
        if (logger.isDebugEnabled())
            logger.debug("Refreshing access token at {}", tokenEndpoint);

        TokenEndpointResponse response = tokenEndpointClient.refreshToken(tokenEndpoint, refreshToken);
        if (response.isError()) {
            logger.error("Refreshing access token failed: {}", response.getError());
            return response;
        }

        String renewedAccessToken = response.getAccessToken();
        if (renewedAccessToken != null) {
            accessToken = renewedAccessToken;
        }
        String rotatedRefreshToken = response.getRefreshToken();
        if (rotatedRefreshToken != null && !rotatedRefreshToken.isBlank()) {
            logger.debug("Provider rotated the refresh token");
            refreshToken = rotatedRefreshToken;
        }
        return response;
    }
}
