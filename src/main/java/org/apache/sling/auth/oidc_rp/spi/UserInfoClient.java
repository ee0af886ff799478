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

import java.net.URI;

import org.apache.sling.auth.oidc_rp.UserInfoResult;
import org.jetbrains.annotations.NotNull;

/**
 * Retrieves claims from the UserInfo endpoint of an OpenID provider.
 * See: https://openid.net/specs/openid-connect-core-1_0.html#UserInfo
 */
public interface UserInfoClient {

    /**
     * @param userInfoEndpoint the UserInfo endpoint
     * @param accessToken the bearer access token
     * @return the claims, or the error reported by the endpoint
     */
    @NotNull
    UserInfoResult fetch(@NotNull URI userInfoEndpoint, @NotNull String accessToken);
}
