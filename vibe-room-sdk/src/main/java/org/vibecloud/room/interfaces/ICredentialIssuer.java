/*
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *   http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package org.vibecloud.room.interfaces;

import org.vibecloud.room.api.pojo.TurnCredential;

/**
 * ICredentialIssuer is responsible for providing time-limited TURN url and credentials.
 */
public interface ICredentialIssuer {
    /**
     * Longest time-to-live accepted for a credential (30 days).
     */
    long MAX_TTL_SECONDS = 30L * 24 * 60 * 60;

    /**
     * Given an identifier (normally the user id), generates credentials for the TURN server valid
     * for the default time-to-live.
     * @param identifier
     * @return
     */
    TurnCredential generateCredentials(final String identifier);

    /**
     * Same as {@link #generateCredentials(String)} with an explicit time-to-live, which must be
     * between 1 and {@link #MAX_TTL_SECONDS}.
     * @param identifier
     * @param ttlSeconds
     * @return
     */
    TurnCredential generateCredentials(final String identifier, final long ttlSeconds);

    /**
     * Recomputes the credential for the given username. Never throws: malformed, expired or
     * tampered credentials just yield false.
     * @param username
     * @param credential
     * @return
     */
    boolean verifyCredentials(final String username, final String credential);
}
