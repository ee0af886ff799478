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

import org.apache.sling.auth.oidc_rp.Identity;
import org.apache.sling.auth.oidc_rp.ProviderMetadata;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

/**
 * Service Provider Interface for ID token validation.
 *
 * <p>Implementations check the structure and the signature of the token (and may check its lifetime). Binding the
 * token to the client id (<code>aud</code>) and to the provider (<code>iss</code>) is not their responsibility, it is
 * always enforced by the caller.</p>
 */
public interface IdentityTokenValidator {

    /**
     * Validates the given ID token.
     *
     * @param identityToken the serialized ID token
     * @param clientId the client id the token is expected to be issued to
     * @param providerMetadata the metadata of the provider that issued the token
     * @return the validation result, never null
     */
    @NotNull
    IdentityTokenValidationResult validate(@NotNull String identityToken, @NotNull String clientId,
                                           @NotNull ProviderMetadata providerMetadata);

    /**
     * Result of ID token validation containing the validated claims.
     */
    final class IdentityTokenValidationResult {
        private final Identity identity;
        private final String error;

        private IdentityTokenValidationResult(@Nullable Identity identity, @Nullable String error) {
            this.identity = identity;
            this.error = error;
        }

        public static @NotNull IdentityTokenValidationResult success(@NotNull Identity identity) {
            return new IdentityTokenValidationResult(identity, null);
        }

        /**
         * @param error the reason, null if the validator cannot name one
         */
        public static @NotNull IdentityTokenValidationResult failure(@Nullable String error) {
            return new IdentityTokenValidationResult(null, error);
        }

        public boolean isSuccess() {
            return identity != null;
        }

        @Nullable
        public Identity getIdentity() {
            return identity;
        }

        @Nullable
        public String getError() {
            return error;
        }
    }
}
