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

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

/**
 * The claims returned by the UserInfo endpoint, or the reason why they could not be retrieved.
 */
public final class UserInfoResult {

    private final @Nullable Identity claims;
    private final @Nullable String error;

    private UserInfoResult(@Nullable Identity claims, @Nullable String error) {
        this.claims = claims;
        this.error = error;
    }

    public static @NotNull UserInfoResult success(@NotNull Identity claims) {
        return new UserInfoResult(claims, null);
    }

    public static @NotNull UserInfoResult error(@NotNull String error) {
        return new UserInfoResult(null, error);
    }

    public boolean isError() {
        return error != null;
    }

    public @Nullable String getError() {
        return error;
    }

    public @NotNull Identity getClaims() {
        if (claims == null)
            throw new IllegalStateException("UserInfo request failed: " + error);
        return claims;
    }
}
