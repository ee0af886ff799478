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

import java.io.IOException;
import java.net.URI;

import com.nimbusds.oauth2.sdk.ParseException;
import com.nimbusds.oauth2.sdk.http.HTTPRequest;
import com.nimbusds.oauth2.sdk.token.BearerAccessToken;
import com.nimbusds.openid.connect.sdk.UserInfoRequest;
import com.nimbusds.openid.connect.sdk.UserInfoResponse;
import com.nimbusds.openid.connect.sdk.claims.UserInfo;
import org.apache.sling.auth.oidc_rp.Identity;
import org.apache.sling.auth.oidc_rp.UserInfoResult;
import org.apache.sling.auth.oidc_rp.spi.UserInfoClient;
import org.jetbrains.annotations.NotNull;
import org.osgi.service.component.annotations.Activate;
import org.osgi.service.component.annotations.Component;
import org.osgi.service.metatype.annotations.AttributeDefinition;
import org.osgi.service.metatype.annotations.Designate;
import org.osgi.service.metatype.annotations.ObjectClassDefinition;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * UserInfo client based on the Nimbus OpenID Connect SDK. Only plain JSON responses are accepted.
 */
@Component(service = UserInfoClient.class)
@Designate(ocd = NimbusUserInfoClient.Config.class)
public class NimbusUserInfoClient implements UserInfoClient {

    private static final Logger logger = LoggerFactory.getLogger(NimbusUserInfoClient.class);

    @ObjectClassDefinition(
            name = "Apache Sling OpenID Connect UserInfo Client",
            description = "Retrieves claims from the UserInfo endpoint"
    )
    @interface Config {
        @AttributeDefinition(name = "Connect Timeout",
                description = "Connect timeout in milliseconds, 0 means no timeout")
        int connectTimeoutMillis() default 10000;

        @AttributeDefinition(name = "Read Timeout",
                description = "Read timeout in milliseconds, 0 means no timeout")
        int readTimeoutMillis() default 10000;
    }

    private final int connectTimeoutMillis;
    private final int readTimeoutMillis;

    @Activate
    public NimbusUserInfoClient(Config config) {
        if (config.connectTimeoutMillis() < 0 || config.readTimeoutMillis() < 0) {
            throw new IllegalArgumentException("Timeouts must not be negative");
        }
        this.connectTimeoutMillis = config.connectTimeoutMillis();
        this.readTimeoutMillis = config.readTimeoutMillis();
    }

    @Override
    public @NotNull UserInfoResult fetch(@NotNull URI userInfoEndpoint, @NotNull String accessToken) {
        HTTPRequest httpRequest = new UserInfoRequest(userInfoEndpoint, new BearerAccessToken(accessToken))
                .toHTTPRequest();
        httpRequest.setConnectTimeout(connectTimeoutMillis);
        httpRequest.setReadTimeout(readTimeoutMillis);

        try {
            UserInfoResponse userInfoResponse = UserInfoResponse.parse(httpRequest.send());
            if (!userInfoResponse.indicatesSuccess()) {
                // The request failed, e.g. due to invalid or expired token
                logger.debug("UserInfo error. Received code: {}, message: {}", userInfoResponse.toErrorResponse().getErrorObject().getCode(), userInfoResponse.toErrorResponse().getErrorObject().getDescription());
                return UserInfoResult.error(ErrorResponses.toErrorMessage("Error in userinfo response", userInfoResponse.toErrorResponse()));
            }

            UserInfo userInfo = userInfoResponse.toSuccessResponse().getUserInfo();
            if (userInfo == null) {
                logger.error("UserInfo endpoint {} returned a JWT, only JSON responses are supported", userInfoEndpoint);
                return UserInfoResult.error("Unsupported userinfo response: JWT responses are not supported");
            }
            return UserInfoResult.success(Identity.fromJsonObject(userInfo.toJSONObject()));
        } catch (IOException | ParseException e) {
            logger.error("Error while processing UserInfo: {}", e.getMessage(), e);
            return UserInfoResult.error("Error while processing userinfo response: " + e.getMessage());
        }
    }
}
