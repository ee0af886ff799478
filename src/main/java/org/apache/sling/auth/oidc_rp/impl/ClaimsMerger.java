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

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

import org.apache.sling.auth.oidc_rp.Claim;
import org.apache.sling.auth.oidc_rp.Identity;
import org.apache.sling.auth.oidc_rp.spi.ClaimsDiagnostics;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Builds the identity exposed to callers from the ID token claims and the optional UserInfo claims.
 *
 * <p>UserInfo claims are only added for claim types the ID token does not have, so the ID token always wins. When
 * filtering is enabled, all claims of an excluded type are removed afterwards, whatever their source.</p>
 */
class ClaimsMerger {

    private static final Logger logger = LoggerFactory.getLogger(ClaimsMerger.class);

    private final boolean filterClaims;
    private final Set<String> filteredClaims;
    private final ClaimsDiagnostics diagnostics;

    ClaimsMerger(boolean filterClaims, @NotNull Collection<String> filteredClaims,
                 @NotNull ClaimsDiagnostics diagnostics) {
        this.filterClaims = filterClaims;
        this.filteredClaims = Collections.unmodifiableSet(new LinkedHashSet<>(filteredClaims));
        this.diagnostics = diagnostics;
    }

    @NotNull
    Identity mergeAndFilter(@NotNull Identity primary, @Nullable Identity userInfoClaims) {
        Identity merged = userInfoClaims == null ? primary : merge(primary, userInfoClaims);
        diagnostics.claims("merged", merged);

        Identity result = filter(merged);
        diagnostics.claims("filtered", result);
        return result;
    }

    static @NotNull Identity merge(@NotNull Identity primary, @NotNull Identity userInfoClaims) {
        Set<String> primaryTypes = primary.getClaimTypes();

        List<Claim> claims = new ArrayList<>(primary.getClaims());
        for (Claim claim : userInfoClaims.getClaims()) {
            if (!primaryTypes.contains(claim.type())) {
                claims.add(claim);
            }
        }
        return new Identity(claims);
    }

    @NotNull
    Identity filter(@NotNull Identity identity) {
        if (!filterClaims) {
            logger.debug("Claim filtering is disabled");
            return identity;
        }

        logger.debug("filtering claims {}", filteredClaims);
        return new Identity(identity.getClaims().stream()
                .filter(c -> !filteredClaims.contains(c.type()))
                .collect(Collectors.toList()));
    }
}
