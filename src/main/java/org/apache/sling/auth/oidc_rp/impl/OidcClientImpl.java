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

import java.net.URI;
import java.time.Instant;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import org.apache.sling.auth.oidc_rp.AuthorizeState;
import org.apache.sling.auth.oidc_rp.Identity;
import org.apache.sling.auth.oidc_rp.LoginResult;
import org.apache.sling.auth.oidc_rp.OidcClient;
import org.apache.sling.auth.oidc_rp.OidcException;
import org.apache.sling.auth.oidc_rp.ProviderMetadata;
import org.apache.sling.auth.oidc_rp.RefreshTokenHandler;
import org.apache.sling.auth.oidc_rp.TokenEndpoint;
import org.apache.sling.auth.oidc_rp.TokenEndpointResponse;
import org.apache.sling.auth.oidc_rp.UserInfoResult;
import org.apache.sling.auth.oidc_rp.impl.ValidationFlow.FlowOutcome;
import org.apache.sling.auth.oidc_rp.spi.ClaimsDiagnostics;
import org.apache.sling.auth.oidc_rp.spi.IdentityTokenValidator;
import org.apache.sling.auth.oidc_rp.spi.ProviderMetadataSource;
import org.apache.sling.auth.oidc_rp.spi.TokenEndpointClient;
import org.apache.sling.auth.oidc_rp.spi.UserInfoClient;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import org.osgi.service.component.annotations.Activate;
import org.osgi.service.component.annotations.Component;
import org.osgi.service.component.annotations.Reference;
import org.osgi.service.component.annotations.ReferenceCardinality;
import org.osgi.service.component.annotations.ReferencePolicyOption;
import org.osgi.service.metatype.annotations.AttributeDefinition;
import org.osgi.service.metatype.annotations.AttributeType;
import org.osgi.service.metatype.annotations.Designate;
import org.osgi.service.metatype.annotations.ObjectClassDefinition;
import org.osgi.service.metatype.annotations.Option;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

@Component(service = OidcClient.class)
@Designate(ocd = OidcClientImpl.Config.class, factory = true)
public class OidcClientImpl implements OidcClient {

    static final String MISSING_AUTHORIZATION_CODE = "missing authorization code";
    static final String MISSING_STATE = "missing state";
    static final String INVALID_STATE = "invalid state";

    private static final Logger logger = LoggerFactory.getLogger(OidcClientImpl.class);

    @ObjectClassDefinition(
            name = "Apache Sling OpenID Connect Relying Party Client",
            description = "Validates the responses an OpenID provider sends to the redirect URI"
    )
    @interface Config {
        @AttributeDefinition(name = "Client ID",
                description = "Client id registered with the OpenID provider")
        String clientId();

        @AttributeDefinition(name = "Client Secret",
                description = "Client secret. Leave empty for public clients, which authenticate with the client id only.",
                type = AttributeType.PASSWORD)
        String clientSecret() default "";

        @AttributeDefinition(name = "Response Style",
                description = "Response style the authorize requests of this client use",
                options = {
                        @Option(label = "Authorization Code", value = "code"),
                        @Option(label = "Hybrid", value = "hybrid")
                })
        String responseStyle() default "code";

        @AttributeDefinition(name = "UserInfo Enabled",
                description = "Load claims from the UserInfo endpoint and add those the ID token does not have")
        boolean userInfoEnabled() default true;

        @AttributeDefinition(name = "Filter Claims",
                description = "Remove protocol claims from the resulting identity")
        boolean filterClaims() default true;

        @AttributeDefinition(name = "Filtered Claims",
                description = "Claim types removed from the resulting identity when filtering is enabled",
                cardinality = Integer.MAX_VALUE)
        String[] filteredClaims() default {"iss", "exp", "nbf", "aud", "nonce", "iat", "auth_time", "c_hash", "at_hash"};

        String webconsole_configurationFactory_nameHint() default
                "Client ID: {clientId}, response style: {responseStyle}";
    }

    private final String clientId;
    private final String clientSecret;
    private final boolean userInfoEnabled;

    private final ProviderMetadataSource providerMetadataSource;
    private final TokenEndpointClient tokenEndpointClient;
    private final UserInfoClient userInfoClient;
    private final ClaimsDiagnostics claimsDiagnostics;

    private final ClaimsMerger claimsMerger;
    private final ValidationFlow flow;

    @Activate
    public OidcClientImpl(Config config,
                          @Reference(policyOption = ReferencePolicyOption.GREEDY) @NotNull ProviderMetadataSource providerMetadataSource,
                          @Reference(policyOption = ReferencePolicyOption.GREEDY) @NotNull IdentityTokenValidator identityTokenValidator,
                          @Reference @NotNull TokenEndpointClient tokenEndpointClient,
                          @Reference @NotNull UserInfoClient userInfoClient,
                          @Reference(cardinality = ReferenceCardinality.OPTIONAL, policyOption = ReferencePolicyOption.GREEDY) ClaimsDiagnostics claimsDiagnostics
    ) {
        if (config.clientId() == null || config.clientId().isEmpty()) {
            throw new IllegalArgumentException("Client ID must be configured");
        }

        this.clientId = config.clientId();
        this.clientSecret = config.clientSecret() == null || config.clientSecret().isEmpty() ? null : config.clientSecret();
        this.userInfoEnabled = config.userInfoEnabled();
        this.providerMetadataSource = providerMetadataSource;
        this.tokenEndpointClient = tokenEndpointClient;
        this.userInfoClient = userInfoClient;
        this.claimsDiagnostics = claimsDiagnostics != null ? claimsDiagnostics : ClaimsDiagnostics.NONE;

        List<String> filteredClaims = config.filteredClaims() != null ? Arrays.asList(config.filteredClaims()) : Collections.emptyList();
        this.claimsMerger = new ClaimsMerger(config.filterClaims(), filteredClaims, this.claimsDiagnostics);

        ResponseStyle responseStyle = ResponseStyle.fromConfig(config.responseStyle());
        IdentityTokenVerifier identityTokenVerifier = new IdentityTokenVerifier(identityTokenValidator, this.claimsDiagnostics);
        switch (responseStyle) {
            case AUTHORIZATION_CODE:
                this.flow = new CodeFlow(identityTokenVerifier, tokenEndpointClient, clientId, clientSecret);
                break;
            case HYBRID:
                this.flow = new HybridFlow(identityTokenVerifier, tokenEndpointClient, clientId, clientSecret);
                break;
            default:
                throw new IllegalArgumentException("Unsupported response style: " + responseStyle);
        }

        logger.info("OidcClient for client id '{}' activated, response style: {}", clientId, responseStyle.configValue());
    }

    @Override
    public @NotNull LoginResult validateResponse(@NotNull String data, @NotNull AuthorizeState state) {
        logger.debug("Validating authorize response");

        AuthorizeResponse response = AuthorizeResponse.parse(data);
        if (response.isError()) {
            logger.error("Authorize response contains error: {}, description: {}", response.error(), response.errorDescription());
            return LoginResult.failure(response.error());
        }

        if (ValidationFlow.isMissing(response.code())) {
            return fail(MISSING_AUTHORIZATION_CODE);
        }

        if (ValidationFlow.isMissing(response.state())) {
            return fail(MISSING_STATE);
        }

        if (!state.state().getValue().equals(response.state())) {
            return fail(INVALID_STATE);
        }

        ProviderMetadata providerMetadata;
        try {
            providerMetadata = providerMetadataSource.getProviderMetadata();
        } catch (OidcException e) {
            logger.error("Failed to obtain provider metadata: {}", e.getMessage(), e);
            return LoginResult.failure(errorMessage("Failed to obtain provider metadata", e));
        }

        FlowOutcome outcome = flow.validate(response, state, providerMetadata);
        if (!outcome.isValid()) {
            return LoginResult.failure(outcome.error());
        }

        return processClaims(outcome, providerMetadata);
    }

    private @NotNull LoginResult processClaims(@NotNull FlowOutcome outcome, @NotNull ProviderMetadata providerMetadata) {
        TokenEndpointResponse tokens = outcome.tokens();
        String accessToken = tokens.getAccessToken();
        if (ValidationFlow.isMissing(accessToken)) {
            return fail(ValidationFlow.MISSING_ACCESS_TOKEN);
        }

        Identity userInfoClaims = null;
        if (userInfoEnabled) {
            logger.debug("Loading claims from the UserInfo endpoint");
            UserInfoResult userInfo = fetchUserInfo(providerMetadata, accessToken);
            if (userInfo.isError()) {
                return fail(userInfo.getError());
            }
            userInfoClaims = userInfo.getClaims();
            claimsDiagnostics.claims("userinfo", userInfoClaims);
        }

        Identity identity = claimsMerger.mergeAndFilter(outcome.identity(), userInfoClaims);

        Instant now = Instant.now();
        String refreshToken = tokens.getRefreshToken();
        RefreshTokenHandler refreshTokenHandler = null;
        if (refreshToken != null && !refreshToken.isBlank()) {
            refreshTokenHandler = new RefreshTokenHandler(tokenEndpoint(providerMetadata), tokenEndpointClient,
                    refreshToken, accessToken);
        }

        logger.info("User {} authenticated", outcome.identity().getSubject());
        return LoginResult.success(identity, accessToken, outcome.identityToken(), refreshToken,
                now.plusSeconds(tokens.getExpiresIn()), now, refreshTokenHandler);
    }

    @Override
    public @NotNull UserInfoResult getUserInfo(@NotNull String accessToken) {
        ProviderMetadata providerMetadata;
        try {
            providerMetadata = providerMetadataSource.getProviderMetadata();
        } catch (OidcException e) {
            logger.error("Failed to obtain provider metadata: {}", e.getMessage(), e);
            return UserInfoResult.error(errorMessage("Failed to obtain provider metadata", e));
        }
        return fetchUserInfo(providerMetadata, accessToken);
    }

    @Override
    public @NotNull TokenEndpointResponse refreshToken(@NotNull String refreshToken) {
        ProviderMetadata providerMetadata;
        try {
            providerMetadata = providerMetadataSource.getProviderMetadata();
        } catch (OidcException e) {
            logger.error("Failed to obtain provider metadata: {}", e.getMessage(), e);
            return TokenEndpointResponse.error(errorMessage("Failed to obtain provider metadata", e));
        }
        return tokenEndpointClient.refreshToken(tokenEndpoint(providerMetadata), refreshToken);
    }

    private @NotNull UserInfoResult fetchUserInfo(@NotNull ProviderMetadata providerMetadata, @NotNull String accessToken) {
        URI userInfoEndpoint = providerMetadata.userInfoEndpoint();
        if (userInfoEndpoint == null) {
            logger.error("No UserInfo endpoint available for issuer {}", providerMetadata.issuer());
            return UserInfoResult.error("UserInfo endpoint not available");
        }
        return userInfoClient.fetch(userInfoEndpoint, accessToken);
    }

    private @NotNull TokenEndpoint tokenEndpoint(@NotNull ProviderMetadata providerMetadata) {
        return new TokenEndpoint(providerMetadata.tokenEndpoint(), clientId, clientSecret);
    }

    private static @NotNull LoginResult fail(@Nullable String error) {
        logger.error(error);
        return LoginResult.failure(ValidationFlow.isMissing(error) ? ValidationFlow.UNKNOWN_ERROR : error);
    }

    private static @NotNull String errorMessage(@NotNull String context, @NotNull Exception e) {
        return e.getMessage() != null ? context + ": " + e.getMessage() : context;
    }
}
