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

import org.apache.sling.auth.oidc_rp.OidcException;
import org.apache.sling.auth.oidc_rp.ProviderMetadata;
import org.jetbrains.annotations.NotNull;

/**
 * Supplies the metadata of the OpenID provider.
 *
 * <p>The returned metadata is trusted as is. Implementations that fetch the discovery document are free to cache
 * it; callers take one snapshot per login attempt.</p>
 */
public interface ProviderMetadataSource {

    /**
     * @return the provider metadata
     * @throws OidcException if the metadata cannot be obtained
     */
    @NotNull
    ProviderMetadata getProviderMetadata();
}
