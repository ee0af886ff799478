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

import java.net.URI;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

/**
 * Snapshot of the OpenID provider metadata needed to validate an authorization response.
 *
 * <p>Instances are immutable and may be shared between concurrent login attempts.</p>
 */
public final class ProviderMetadata {

    private final @NotNull String issuer;
    private final @NotNull URI tokenEndpoint;
    private final @Nullable URI userInfoEndpoint;
    private final @Nullable URI jwkSetURI;

    public ProviderMetadata(@NotNull String issuer, @NotNull URI tokenEndpoint, @Nullable URI userInfoEndpoint,
                            @Nullable URI jwkSetURI) {
        this.issuer = issuer;
        this.tokenEndpoint = tokenEndpoint;
        this.userInfoEndpoint = userInfoEndpoint;
        this.jwkSetURI = jwkSetURI;
    }

    public @NotNull String issuer() {
        return issuer;
    }

    public @NotNull URI tokenEndpoint() {
        return tokenEndpoint;
    }

    public @Nullable URI userInfoEndpoint() {
        return userInfoEndpoint;
    }

    public @Nullable URI jwkSetURI() {
        return jwkSetURI;
    }
}
