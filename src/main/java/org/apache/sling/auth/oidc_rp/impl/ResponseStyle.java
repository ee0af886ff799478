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
package org.apache.sling.auth.oidc_rp.impl;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

/**
 * The response styles the client can be configured for.
 */
enum ResponseStyle {

    /** <code>response_type=code</code>, all tokens come from the token endpoint */
    AUTHORIZATION_CODE("code"),

    /** <code>response_type=code id_token</code>, the ID token is delivered together with the code */
    HYBRID("hybrid");

    private final String configValue;

    ResponseStyle(String configValue) {
        this.configValue = configValue;
    }

    @NotNull String configValue() {
        return configValue;
    }

    static @NotNull ResponseStyle fromConfig(@Nullable String value) {
        for (ResponseStyle style : values()) {
            if (style.configValue.equals(value)) {
                return style;
            }
        }
        throw new IllegalArgumentException(String.format("Invalid authentication style '%s', expected 'code' or 'hybrid'", value));
    }
}
