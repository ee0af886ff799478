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
import java.net.URISyntaxException;

import com.nimbusds.oauth2.sdk.GeneralException;
import com.nimbusds.oauth2.sdk.id.Issuer;
import com.nimbusds.openid.connect.sdk.op.OIDCProviderMetadata;
import org.apache.sling.auth.oidc_rp.OidcException;
import org.apache.sling.auth.oidc_rp.ProviderMetadata;
import org.apache.sling.auth.oidc_rp.spi.ProviderMetadataSource;
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
 * Provides the provider metadata either from OpenID Connect discovery or from explicitly configured endpoints.
 *
 * <p>With a base URL the discovery document is fetched for every snapshot.</p>
 */
@Component(service = ProviderMetadataSource.class)
@Designate(ocd = OidcProviderMetadataSource.Config.class)
public class OidcProviderMetadataSource implements ProviderMetadataSource {

    private static final Logger logger = LoggerFactory.getLogger(OidcProviderMetadataSource.class);

    @ObjectClassDefinition(name = "Apache Sling OpenID Connect Provider Metadata")
    public @interface Config {
        @AttributeDefinition(name = "Base URL",
                description = "Issuer URL used for discovery. Leave empty when configuring the endpoints explicitly.")
        String baseUrl();

        String issuer();

        String tokenEndpoint();

        String userInfoEndpoint();

        String jwkSetURL();
    }

    private final String baseUrl;
    private final @Nullable ProviderMetadata configuredMetadata;

    @Activate
    public OidcProviderMetadataSource(Config cfg) {
        this.baseUrl = cfg.baseUrl();
        boolean hasBaseUrl = !isNullOrEmpty(cfg.baseUrl());
        boolean hasAnyEndpoint = !isNullOrEmpty(cfg.issuer())
                || !isNullOrEmpty(cfg.tokenEndpoint())
                || !isNullOrEmpty(cfg.userInfoEndpoint())
                || !isNullOrEmpty(cfg.jwkSetURL());
        boolean hasAllEndpoints = !isNullOrEmpty(cfg.issuer())
                && !isNullOrEmpty(cfg.tokenEndpoint())
                && !isNullOrEmpty(cfg.userInfoEndpoint())
                && !isNullOrEmpty(cfg.jwkSetURL());

        // if baseUrl is provided, no explicit endpoint must be provided
        if (hasBaseUrl && hasAnyEndpoint) {
            throw new IllegalArgumentException(
                    "Either baseUrl OR explicit endpoints "
                            + "(issuer, tokenEndpoint, userInfoEndpoint, jwkSetURL) must be provided, not both");
        }

        // if baseUrl is not provided, all explicit endpoints must be provided
        if (!hasBaseUrl && !hasAllEndpoints) {
            throw new IllegalArgumentException("Either baseUrl must be provided OR all explicit endpoints "
                    + "(issuer, tokenEndpoint, userInfoEndpoint, jwkSetURL) must be provided");
        }

        if (hasBaseUrl) {
            this.configuredMetadata = null;
            logger.info("Provider metadata will be discovered from {}", baseUrl);
        } else {
            this.configuredMetadata = new ProviderMetadata(cfg.issuer(), toURI("tokenEndpoint", cfg.tokenEndpoint()),
                    toURI("userInfoEndpoint", cfg.userInfoEndpoint()), toURI("jwkSetURL", cfg.jwkSetURL()));
            logger.info("Using configured provider metadata for issuer {}", cfg.issuer());
        }
    }

    @Override
    public @NotNull ProviderMetadata getProviderMetadata() {
        if (configuredMetadata != null) {
            return configuredMetadata;
        }

        logger.debug("Resolving provider metadata from {}", baseUrl);
        OIDCProviderMetadata metadata;
        try {
            metadata = OIDCProviderMetadata.resolve(new Issuer(baseUrl));
        } catch (GeneralException | IOException e) {
            throw new OidcException(String.format("Failed to resolve provider metadata for %s", baseUrl), e);
        }

        URI tokenEndpoint = metadata.getTokenEndpointURI();
        if (tokenEndpoint == null) {
            throw new OidcException(String.format("Provider %s does not publish a token endpoint", baseUrl));
        }
        return new ProviderMetadata(metadata.getIssuer().getValue(), tokenEndpoint,
                metadata.getUserInfoEndpointURI(), metadata.getJWKSetURI());
    }

    private static @NotNull URI toURI(@NotNull String name, @NotNull String value) {
        try {
            URI uri = new URI(value);
            if (!uri.isAbsolute()) {
                throw new IllegalArgumentException(String.format("%s is not an absolute URI: %s", name, value));
            }
            return uri;
        } catch (URISyntaxException e) {
            throw new IllegalArgumentException(String.format("%s is not a valid URI: %s", name, value), e);
        }
    }

    private static boolean isNullOrEmpty(@Nullable String str) {
        return str == null || str.isEmpty();
    }
}
