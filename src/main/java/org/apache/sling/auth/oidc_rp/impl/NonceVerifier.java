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

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

final class NonceVerifier {

    static final String NONCE_CLAIM = "nonce";

    private static final Logger logger = LoggerFactory.getLogger(NonceVerifier.class);

    private NonceVerifier() {
        // Utility class
    }

    /**
     * @param sessionNonce the nonce sent with the authentication request
     * @param tokenNonce the nonce claim of the ID token, a missing claim never matches a non-empty nonce
     * @return true if both are equal
     */
    static boolean verify(@NotNull String sessionNonce, @Nullable String tokenNonce) {
        logger.debug("validate nonce");

        String actual = tokenNonce == null ? "" : tokenNonce;
        boolean match = sessionNonce.equals(actual);
        if (!match) {
            logger.error("nonce ({}) does not match nonce from token ({})", sessionNonce, actual);
        }
        return match;
    }
}
