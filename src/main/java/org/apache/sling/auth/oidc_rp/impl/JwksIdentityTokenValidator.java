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
import java.text.ParseException;
import java.time.Instant;
import java.util.Date;

import com.nimbusds.jose.JOSEException;
import com.nimbusds.jose.JWSAlgorithm;
import com.nimbusds.jose.JWSVerifier;
import com.nimbusds.jose.crypto.RSASSAVerifier;
import com.nimbusds.jose.jwk.JWK;
import com.nimbusds.jose.jwk.JWKSet;
import com.nimbusds.jose.jwk.RSAKey;
import com.nimbusds.jwt.JWT;
import com.nimbusds.jwt.JWTClaimsSet;
import com.nimbusds.jwt.JWTParser;
import com.nimbusds.jwt.SignedJWT;
import org.apache.sling.auth.oidc_rp.Identity;
import org.apache.sling.auth.oidc_rp.ProviderMetadata;
import org.apache.sling.auth.oidc_rp.spi.IdentityTokenValidator;
import org.jetbrains.annotations.NotNull;
import org.osgi.service.component.annotations.Activate;
import org.osgi.service.component.annotations.Component;
import org.osgi.service.metatype.annotations.AttributeDefinition;
import org.osgi.service.metatype.annotations.Designate;
import org.osgi.service.metatype.annotations.ObjectClassDefinition;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * ID token validator that verifies the RSA signature of the token with the JWK Set published by the provider, and
 * its expiration.
 *
 * <p>The JWK Set is loaded on each validation.</p>
 */
@Component(service = IdentityTokenValidator.class)
@Designate(ocd = JwksIdentityTokenValidator.Config.class)
public class JwksIdentityTokenValidator implements IdentityTokenValidator {

    private static final Logger logger = LoggerFactory.getLogger(JwksIdentityTokenValidator.class);

    @ObjectClassDefinition(
            name = "Apache Sling OpenID Connect JWKS Identity Token Validator",
            description = "Validates ID tokens by verifying their signature with the JWK Set of the provider")
    @interface Config {
        @AttributeDefinition(
                name = "Clock Skew",
                description = "Tolerated clock skew in seconds when checking the token expiration")
        long clockSkewSeconds() default 60;
    }

    private final long clockSkewSeconds;

    @Activate
    public JwksIdentityTokenValidator(Config config) {
        if (config.clockSkewSeconds() < 0) {
            throw new IllegalArgumentException("Clock skew must not be negative");
        }
        this.clockSkewSeconds = config.clockSkewSeconds();
        logger.info("JwksIdentityTokenValidator activated, clock skew: {}s", clockSkewSeconds);
    }

    @Override
    public @NotNull IdentityTokenValidationResult validate(@NotNull String identityToken, @NotNull String clientId,
                                                           @NotNull ProviderMetadata providerMetadata) {
        try {
            JWT jwt = JWTParser.parse(identityToken);
            if (!(jwt instanceof SignedJWT)) {
                logger.debug("Identity token is not a signed JWT");
                return IdentityTokenValidationResult.failure("identity token is not signed");
            }

            SignedJWT signedJWT = (SignedJWT) jwt;
            JWTClaimsSet claimsSet = signedJWT.getJWTClaimsSet();

            JWSAlgorithm algorithm = signedJWT.getHeader().getAlgorithm();
            if (!JWSAlgorithm.Family.RSA.contains(algorithm)) {
                logger.debug("Unsupported signature algorithm: {}", algorithm);
                return IdentityTokenValidationResult.failure("unsupported identity token signature algorithm: " + algorithm);
            }

            if (isExpired(claimsSet)) {
                logger.debug("Identity token has expired");
                return IdentityTokenValidationResult.failure("identity token has expired");
            }

            URI jwkSetURI = providerMetadata.jwkSetURI();
            if (jwkSetURI == null) {
                logger.debug("No JWK Set URI for issuer {}", providerMetadata.issuer());
                return IdentityTokenValidationResult.failure("no JWK Set available for issuer " + providerMetadata.issuer());
            }

            // Get the key ID from the JWT header
            String keyID = signedJWT.getHeader().getKeyID();
            if (keyID == null) {
                logger.debug("No key ID in JWT header");
                return IdentityTokenValidationResult.failure("identity token has no key ID");
            }

            // Find the matching key in the JWK set
            JWKSet jwkSet = JWKSet.load(jwkSetURI.toURL());
            JWK jwk = jwkSet.getKeyByKeyId(keyID);
            if (!(jwk instanceof RSAKey)) {
                logger.debug("No matching RSA key found for key ID: {}", keyID);
                return IdentityTokenValidationResult.failure("no matching key found for key ID " + keyID);
            }

            JWSVerifier verifier = new RSASSAVerifier((RSAKey) jwk);
            if (!signedJWT.verify(verifier)) {
                logger.debug("Identity token signature verification failed");
                return IdentityTokenValidationResult.failure("invalid identity token signature");
            }

            String subject = claimsSet.getSubject();
            if (subject == null || subject.isEmpty()) {
                logger.debug("Identity token has no subject claim");
                return IdentityTokenValidationResult.failure("identity token has no subject");
            }

            logger.debug("Identity token signature verified for subject: {}", subject);
            return IdentityTokenValidationResult.success(Identity.fromClaimsSet(claimsSet));

        } catch (ParseException e) {
            logger.debug("Failed to parse identity token: {}", e.getMessage());
            return IdentityTokenValidationResult.failure("malformed identity token");
        } catch (IOException e) {
            logger.error("Failed to load JWK Set from {}: {}", providerMetadata.jwkSetURI(), e.getMessage(), e);
            return IdentityTokenValidationResult.failure("failed to load JWK Set: " + e.getMessage());
        } catch (JOSEException e) {
            logger.error("Failed to verify identity token signature: {}", e.getMessage(), e);
            return IdentityTokenValidationResult.failure("failed to verify identity token signature");
        }
    }

    private boolean isExpired(@NotNull JWTClaimsSet claimsSet) {
        Date expirationTime = claimsSet.getExpirationTime();
        return expirationTime != null
                && expirationTime.toInstant().plusSeconds(clockSkewSeconds).isBefore(Instant.now());
    }
}
