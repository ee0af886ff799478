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

import java.io.IOException;
import java.net.URI;

import com.nimbusds.oauth2.sdk.AccessTokenResponse;
import com.nimbusds.oauth2.sdk.AuthorizationCode;
import com.nimbusds.oauth2.sdk.AuthorizationCodeGrant;
import com.nimbusds.oauth2.sdk.AuthorizationGrant;
import com.nimbusds.oauth2.sdk.ParseException;
import com.nimbusds.oauth2.sdk.RefreshTokenGrant;
import com.nimbusds.oauth2.sdk.TokenRequest;
import com.nimbusds.oauth2.sdk.TokenResponse;
import com.nimbusds.oauth2.sdk.auth.ClientSecretBasic;
import com.nimbusds.oauth2.sdk.auth.Secret;
import com.nimbusds.oauth2.sdk.http.HTTPRequest;
import com.nimbusds.oauth2.sdk.http.HTTPResponse;
import com.nimbusds.oauth2.sdk.id.ClientID;
import com.nimbusds.oauth2.sdk.pkce.CodeVerifier;
import com.nimbusds.oauth2.sdk.token.AccessToken;
import com.nimbusds.oauth2.sdk.token.RefreshToken;
import com.nimbusds.openid.connect.sdk.OIDCTokenResponse;
import com.nimbusds.openid.connect.sdk.OIDCTokenResponseParser;
import org.apache.sling.auth.oidc_rp.TokenEndpoint;
import org.apache.sling.auth.oidc_rp.TokenEndpointResponse;
import org.apache.sling.auth.oidc_rp.spi.TokenEndpointClient;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import org.osgi.service.component.annotations.Activate;
import org.osgi.service.component.annotations.Component;
import org.osgi.service.metatype.annotations.AttributeDefinition;
import org.osgi.service.metatype.annotations.Designate;
import org.osgi.service.metatype.annotations.ObjectClassDefinition;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Token endpoint client based on the Nimbus OAuth 2.0 SDK.
 *
 * <p>Confidential clients authenticate with HTTP Basic, public clients (no secret) send their client id only.</p>
 */
@Component(service = TokenEndpointClient.class)
@Designate(ocd = NimbusTokenEndpointClient.Config.class)
public class NimbusTokenEndpointClient implements TokenEndpointClient {

    private static final Logger logger = LoggerFactory.getLogger(NimbusTokenEndpointClient.class);

    @ObjectClassDefinition(
            name = "Apache Sling OpenID Connect Token Endpoint Client",
            description = "Sends authorization code and refresh token requests to the token endpoint"
    )
    @interface Config {
        @AttributeDefinition(name = "Connect Timeout",
                description = "Connect timeout in milliseconds, 0 means no timeout")
        int connectTimeoutMillis() default 10000;

        @AttributeDefinition(name = "Read Timeout",
                description = "Read timeout in milliseconds, 0 means no timeout")
        int readTimeoutMillis() default 10000;
    }

    private final int connectTimeoutMillis;
    private final int readTimeoutMillis;

    @Activate
    public NimbusTokenEndpointClient(Config config) {
        if (config.connectTimeoutMillis() < 0 || config.readTimeoutMillis() < 0) {
            throw new IllegalArgumentException("Timeouts must not be negative");
        }
        this.connectTimeoutMillis = config.connectTimeoutMillis();
        this.readTimeoutMillis = config.readTimeoutMillis();
    }

    @Override
    public @NotNull TokenEndpointResponse redeemAuthorizationCode(@NotNull TokenEndpoint tokenEndpoint, @NotNull String code,
                                                                  @NotNull URI redirectUri, @Nullable String codeVerifier) {
        AuthorizationGrant grant = new AuthorizationCodeGrant(new AuthorizationCode(code), redirectUri,
                codeVerifier != null ? new CodeVerifier(codeVerifier) : null);
        return sendTokenRequest(tokenEndpoint, grant);
    }

    @Override
    public @NotNull TokenEndpointResponse refreshToken(@NotNull TokenEndpoint tokenEndpoint, @NotNull String refreshToken) {
        return sendTokenRequest(tokenEndpoint, new RefreshTokenGrant(new RefreshToken(refreshToken)));
    }

    private @NotNull TokenEndpointResponse sendTokenRequest(@NotNull TokenEndpoint tokenEndpoint, @NotNull AuthorizationGrant grant) {
        ClientID clientID = new ClientID(tokenEndpoint.clientId());
        TokenRequest tokenRequest;
        if (tokenEndpoint.hasClientSecret()) {
            tokenRequest = new TokenRequest(tokenEndpoint.uri(),
                    new ClientSecretBasic(clientID, new Secret(tokenEndpoint.clientSecret())), grant);
        } else {
            tokenRequest = new TokenRequest(tokenEndpoint.uri(), clientID, grant);
        }

        HTTPRequest httpRequest = tokenRequest.toHTTPRequest();
        // GitHub requires an explicitly set Accept header, otherwise the response is url encoded
        httpRequest.setAccept("application/json");
        httpRequest.setConnectTimeout(connectTimeoutMillis);
        httpRequest.setReadTimeout(readTimeoutMillis);

        try {
            HTTPResponse httpResponse = httpRequest.send();
            TokenResponse tokenResponse = OIDCTokenResponseParser.parse(httpResponse);

            if (!tokenResponse.indicatesSuccess()) {
                logger.debug("Token error. Received code: {}, message: {}", tokenResponse.toErrorResponse().getErrorObject().getCode(), tokenResponse.toErrorResponse().getErrorObject().getDescription());
                return TokenEndpointResponse.error(ErrorResponses.toErrorMessage("Error in token response", tokenResponse.toErrorResponse()));
            }
            return toTokenEndpointResponse(tokenResponse.toSuccessResponse());
        } catch (IOException e) {
            logger.error("Failed to send token request to {}: {}", tokenEndpoint.uri(), e.getMessage(), e);
            return TokenEndpointResponse.error("Failed to send token request: " + e.getMessage());
        } catch (ParseException e) {
            logger.error("Failed to parse token response: {}", e.getMessage(), e);
            return TokenEndpointResponse.error("Failed to parse token response: " + e.getMessage());
        }
    }

    private static @NotNull TokenEndpointResponse toTokenEndpointResponse(@NotNull AccessTokenResponse successResponse) {
        String identityToken = null;
        if (successResponse instanceof OIDCTokenResponse) {
            identityToken = ((OIDCTokenResponse) successResponse).getOIDCTokens().getIDTokenString();
        }

        AccessToken accessToken = successResponse.getTokens().getAccessToken();
        RefreshToken refreshToken = successResponse.getTokens().getRefreshToken();
        return TokenEndpointResponse.success(identityToken, accessToken.getValue(),
                refreshToken != null ? refreshToken.getValue() : null, accessToken.getLifetime());
    }
}
