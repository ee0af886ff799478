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

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.Arrays;

import com.nimbusds.jose.util.Base64URL;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Checks that an ID token was issued together with a given authorization code (<code>c_hash</code>) or access token
 * (<code>at_hash</code>).
 *
 * <p>The hash is always the left-most 128 bits of the SHA-256 digest of the UTF-8 encoded value, base64url encoded without
 * padding. A token that carries no hash claim is accepted.</p>
 *
 * @see <a href="https://openid.net/specs/openid-connect-core-1_0.html#HybridIDToken">ID Token for the hybrid flow</a>
 */
final class HashBinder {

    static final String CODE_HASH_CLAIM = "c_hash";
    static final String ACCESS_TOKEN_HASH_CLAIM = "at_hash";

    private static final String DIGEST_ALGORITHM = "SHA-256";
    private static final int HASH_LENGTH = 16;

    private static final Logger logger = LoggerFactory.getLogger(HashBinder.class);

    private HashBinder() {
        // Utility class
    }

    static boolean verifyCodeBinding(@Nullable String code, @Nullable String cHash) {
        logger.debug("validate authorization code hash");
        if (isMissing(cHash)) {
            logger.debug("No {} claim present, authorization code binding not applicable", CODE_HASH_CLAIM);
            return true;
        }
        if (isMissing(code)) {
            logger.error("{} present but no authorization code to bind", CODE_HASH_CLAIM);
            return false;
        }
        String computed = leftHalfHash(code);
        return matches(CODE_HASH_CLAIM, computed, cHash);
    }

    static boolean verifyAccessTokenBinding(@Nullable String accessToken, @Nullable String atHash) {
        logger.debug("validate access token hash");
        if (isMissing(atHash)) {
            logger.debug("No {} claim present, access token binding not applicable", ACCESS_TOKEN_HASH_CLAIM);
            return true;
        }
        if (isMissing(accessToken)) {
            logger.error("{} present but no access token to bind", ACCESS_TOKEN_HASH_CLAIM);
            return false;
        }
        String computed = leftHalfHash(accessToken);
        return matches(ACCESS_TOKEN_HASH_CLAIM, computed, atHash);
    }

    static @NotNull String leftHalfHash(@NotNull String value) {
        try {
            byte[] digest = MessageDigest.getInstance(DIGEST_ALGORITHM).digest(value.getBytes(StandardCharsets.UTF_8));
            return Base64URL.encode(Arrays.copyOf(digest, HASH_LENGTH)).toString();
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException(DIGEST_ALGORITHM + " is not available", e);
        }
    }

    private static boolean matches(@NotNull String claimName, @NotNull String computed, @NotNull String claimed) {
        boolean match = computed.equals(claimed);
        if (!match) {
            logger.error("computed hash ({}) does not match {} from token ({})", computed, claimName, claimed);
        }
        return match;
    }

    private static boolean isMissing(@Nullable String value) {
        return value == null || value.isEmpty();
    }
}
