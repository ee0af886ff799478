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

import java.util.List;
import java.util.Map;

import com.nimbusds.oauth2.sdk.util.MultivaluedMapUtils;
import com.nimbusds.oauth2.sdk.util.URLUtils;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

/**
 * The parameters the OpenID provider sent to the redirect URI.
 */
final class AuthorizeResponse {

    private final @Nullable String error;
    private final @Nullable String errorDescription;
    private final @Nullable String code;
    private final @Nullable String state;
    private final @Nullable String identityToken;

    private AuthorizeResponse(@Nullable String error, @Nullable String errorDescription, @Nullable String code,
                              @Nullable String state, @Nullable String identityToken) {
        this.error = error;
        this.errorDescription = errorDescription;
        this.code = code;
        this.state = state;
        this.identityToken = identityToken;
    }

    /**
     * Parses a redirect URL, or its query or fragment part. Parameters in the fragment take precedence over the ones
     * in the query, as used by the hybrid flow.
     *
     * @param data the raw response
     * @return the parsed response, never null
     */
    static @NotNull AuthorizeResponse parse(@NotNull String data) {
        String parameters = data;
        int fragmentStart = data.indexOf('#');
        if (fragmentStart >= 0) {
            parameters = data.substring(fragmentStart + 1);
        } else {
            int queryStart = data.indexOf('?');
            if (queryStart >= 0) {
                parameters = data.substring(queryStart + 1);
            }
        }

        Map<String, List<String>> params = URLUtils.parseParameters(parameters);
        return new AuthorizeResponse(
                MultivaluedMapUtils.getFirstValue(params, "error"),
                MultivaluedMapUtils.getFirstValue(params, "error_description"),
                MultivaluedMapUtils.getFirstValue(params, "code"),
                MultivaluedMapUtils.getFirstValue(params, "state"),
                MultivaluedMapUtils.getFirstValue(params, "id_token"));
    }

    boolean isError() {
        return error != null && !error.isEmpty();
    }

    @Nullable String error() {
        return error;
    }

    @Nullable String errorDescription() {
        return errorDescription;
    }

    @Nullable String code() {
        return code;
    }

    @Nullable String state() {
        return state;
    }

    @Nullable String identityToken() {
        return identityToken;
    }
}
