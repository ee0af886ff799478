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

import org.apache.sling.auth.oidc_rp.Claim;
import org.apache.sling.auth.oidc_rp.Identity;
import org.apache.sling.auth.oidc_rp.spi.ClaimsDiagnostics;
import org.jetbrains.annotations.NotNull;
import org.osgi.service.component.annotations.Component;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Writes the claims of each validation step to the debug log.
 */
@Component(service = ClaimsDiagnostics.class)
public class LoggingClaimsDiagnostics implements ClaimsDiagnostics {

    private static final Logger logger = LoggerFactory.getLogger(LoggingClaimsDiagnostics.class);

    @Override
    public void claims(@NotNull String step, @NotNull Identity claims) {
        if (!logger.isDebugEnabled()) {
            return;
        }
        logger.debug("{} claims:", step);
        for (Claim claim : claims.getClaims()) {
            logger.debug("  {}", claim);
        }
    }
}
