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

package org.vibecloud.room.api.pojo;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Time-limited credentials for the TURN relay, following the TURN REST API scheme: the username is
 * {@code <expiryEpochSeconds>:<identifier>} and the credential is the base64 HMAC-SHA1 of the
 * username keyed with the secret shared with the TURN server.
 */
public class TurnCredential {
    private final String username;
    private final String credential;
    private final long ttl;
    private final List<String> urls;

    public TurnCredential(String username, String credential, long ttl, List<String> urls) {
        this.username = username;
        this.credential = credential;
        this.ttl = ttl;
        this.urls = Collections.unmodifiableList(new ArrayList<>(urls));
    }

    public String getUsername() {
        return username;
    }

    public String getCredential() {
        return credential;
    }

    /**
     * @return validity of the credential, in seconds
     */
    public long getTtl() {
        return ttl;
    }

    public List<String> getUrls() {
        return urls;
    }

    @Override
    public String toString() {
        return "TurnCredential{" +
                "username='" + username + '\'' +
                ", ttl=" + ttl +
                ", urls=" + urls +
                '}';
    }
}
