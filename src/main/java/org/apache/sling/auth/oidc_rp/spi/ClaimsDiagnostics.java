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

import org.apache.sling.auth.oidc_rp.Identity;
import org.jetbrains.annotations.NotNull;

/**
 * Receives the claims seen at each validation step, for troubleshooting.
 *
 * <p>Claims may contain personal data. Nothing is reported unless an implementation is registered.</p>
 */
public interface ClaimsDiagnostics {

    ClaimsDiagnostics NONE = (step, claims) -> {};

    /**
     * @param step short name of the validation step, e.g. "identity token" or "userinfo"
     * @param claims the claims at that step
     */
    void claims(@NotNull String step, @NotNull Identity claims);
}
