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

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Date;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

import com.nimbusds.jose.util.JSONObjectUtils;
import com.nimbusds.jwt.JWTClaimsSet;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

/**
 * The claims known about an authenticated end user.
 *
 * <p>An identity is an immutable, ordered list of {@link Claim claims}. A claim type may occur more than once
 * (e.g. one <code>groups</code> claim per group); single valued claims such as <code>iss</code> or <code>aud</code>
 * are looked up with {@link #findFirst(String)}.</p>
 *
 * <p>Identities built from JSON (ID token claim sets, UserInfo responses) are flattened: arrays contribute one claim
 * per element, dates are expressed in seconds since the epoch and nested objects are kept as JSON text.</p>
 */
public final class Identity {

    private final List<Claim> claims;

    public Identity(@NotNull List<Claim> claims) {
        this.claims = Collections.unmodifiableList(new ArrayList<>(claims));
    }

    public static @NotNull Identity fromClaimsSet(@NotNull JWTClaimsSet claimsSet) {
        return fromJsonObject(claimsSet.getClaims());
    }

    public static @NotNull Identity fromJsonObject(@NotNull Map<String, Object> jsonObject) {
        List<Claim> claims = new ArrayList<>();
        jsonObject.forEach((type, value) -> addClaims(claims, type, value));
        return new Identity(claims);
    }

    public @NotNull List<Claim> getClaims() {
        return claims;
    }

    /**
     * @param type the claim type
     * @return the value of the first claim with the given type, or null if there is none
     */
    public @Nullable String findFirst(@NotNull String type) {
        for (Claim claim : claims) {
            if (claim.type().equals(type)) {
                return claim.value();
            }
        }
        return null;
    }

    public @NotNull List<String> findAll(@NotNull String type) {
        return claims.stream()
                .filter(c -> c.type().equals(type))
                .map(Claim::value)
                .collect(Collectors.toList());
    }

    public boolean hasClaim(@NotNull String type) {
        return findFirst(type) != null;
    }

    public @NotNull Set<String> getClaimTypes() {
        Set<String> types = new LinkedHashSet<>();
        claims.forEach(c -> types.add(c.type()));
        return types;
    }

    public @Nullable String getSubject() {
        return findFirst("sub");
    }

    public boolean isEmpty() {
        return claims.isEmpty();
    }

    private static void addClaims(@NotNull List<Claim> claims, @NotNull String type, @Nullable Object value) {
        if (value == null) {
            return;
        }
        if (value instanceof Collection) {
            for (Object element : (Collection<?>) value) {
                addClaims(claims, type, element);
            }
            return;
        }
        claims.add(new Claim(type, toClaimValue(value)));
    }

    @SuppressWarnings("unchecked")
    private static @NotNull String toClaimValue(@NotNull Object value) {
        if (value instanceof Date) {
            return Long.toString(((Date) value).getTime() / 1000);
        }
        if (value instanceof Map) {
            return JSONObjectUtils.toJSONString((Map<String, ?>) value);
        }
        return value.toString();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Identity)) return false;
        return claims.equals(((Identity) o).claims);
    }

    @Override
    public int hashCode() {
        return claims.hashCode();
    }

    // claim values may be sensitive, only the types are printed
    @Override
    public String toString() {
        return "Identity" + getClaimTypes();
    }
}
