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
 * A token endpoint together with the client credentials used to authenticate against it.
 */
public final class TokenEndpoint {

    private final @NotNull URI uri;
    private final @NotNull String clientId;
    private final @Nullable String clientSecret;

    public TokenEndpoint(@NotNull URI uri, @NotNull String clientId, @Nullable String clientSecret) {
        this.uri = uri;
        this.clientId = clientId;
        this.clientSecret = clientSecret;
    }

    public @NotNull URI uri() {
        return uri;
    }

    public @NotNull String clientId() {
        return clientId;
    }

    public @Nullable String clientSecret() {
        return clientSecret;
    }

    /**
     * @return false for public clients, which authenticate with their client id only
     */
    public boolean hasClientSecret() {
        return clientSecret != null && !clientSecret.isEmpty();
    }

    @Override
    public String toString() {
        return "TokenEndpoint[" + uri + ", clientId=" + clientId + "]";
    }
}
