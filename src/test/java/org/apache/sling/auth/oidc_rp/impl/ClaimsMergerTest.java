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

import java.util.Arrays;
import java.util.List;

import org.apache.sling.auth.oidc_rp.Identity;
import org.apache.sling.auth.oidc_rp.spi.ClaimsDiagnostics;
import org.junit.jupiter.api.Test;

import static org.apache.sling.auth.oidc_rp.impl.OidcTestSupport.identity;
import static org.junit.jupiter.api.Assertions.*;

class ClaimsMergerTest {

    private static final List<String> FILTERED = Arrays.asList("iss", "exp", "nbf", "aud", "nonce", "iat", "auth_time", "c_hash", "at_hash");

    @Test
    void testMergeAddsOnlyMissingTypes() {
        Identity primary = identity("sub", "alice", "name", "Alice");
        Identity userInfo = identity("sub", "bob", "name", "Bob", "email", "alice@example.com");

        Identity merged = ClaimsMerger.merge(primary, userInfo);

        assertEquals("alice", merged.getSubject());
        assertEquals(Arrays.asList("Alice"), merged.findAll("name"));
        assertEquals("alice@example.com", merged.findFirst("email"));
        assertEquals(3, merged.getClaims().size());
    }

    @Test
    void testMergeKeepsAllValuesOfNewType() {
        Identity primary = identity("sub", "alice");
        Identity userInfo = identity("groups", "admins", "groups", "users");

        Identity merged = ClaimsMerger.merge(primary, userInfo);

        assertEquals(Arrays.asList("admins", "users"), merged.findAll("groups"));
    }

    @Test
    void testMergeDoesNotModifyInputs() {
        Identity primary = identity("sub", "alice");
        Identity userInfo = identity("email", "alice@example.com");

        ClaimsMerger.merge(primary, userInfo);

        assertEquals(1, primary.getClaims().size());
        assertEquals(1, userInfo.getClaims().size());
    }

    @Test
    void testFilterRemovesProtocolClaims() {
        ClaimsMerger merger = new ClaimsMerger(true, FILTERED, ClaimsDiagnostics.NONE);
        Identity identity = identity("sub", "alice", "iss", "https://idp.example.com", "aud", "a", "aud", "b",
                "nonce", "n", "at_hash", "h", "email", "alice@example.com");

        Identity filtered = merger.filter(identity);

        assertEquals(identity("sub", "alice", "email", "alice@example.com"), filtered);
    }

    @Test
    void testFilterDisabledReturnsIdentityUnchanged() {
        ClaimsMerger merger = new ClaimsMerger(false, FILTERED, ClaimsDiagnostics.NONE);
        Identity identity = identity("sub", "alice", "iss", "https://idp.example.com");

        assertSame(identity, merger.filter(identity));
    }

    @Test
    void testFilterAppliesToUserInfoClaims() {
        ClaimsMerger merger = new ClaimsMerger(true, FILTERED, ClaimsDiagnostics.NONE);
        Identity primary = identity("sub", "alice");
        Identity userInfo = identity("auth_time", "1700000000", "email", "alice@example.com");

        Identity result = merger.mergeAndFilter(primary, userInfo);

        assertFalse(result.hasClaim("auth_time"));
        assertTrue(result.hasClaim("email"));
    }

    @Test
    void testMergeAndFilterWithoutUserInfo() {
        ClaimsMerger merger = new ClaimsMerger(true, FILTERED, ClaimsDiagnostics.NONE);

        Identity result = merger.mergeAndFilter(identity("sub", "alice", "exp", "1700000000"), null);

        assertEquals(identity("sub", "alice"), result);
    }
}
