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

package org.vibecloud.room.client;

/**
 * One entry of an RTCConfiguration {@code iceServers} list. STUN entries carry no credentials.
 */
public class IceServer {
    private final String urls;
    private final String username;
    private final String credential;

    public IceServer(String urls) {
        this(urls, null, null);
    }

    public IceServer(String urls, String username, String credential) {
        this.urls = urls;
        this.username = username;
        this.credential = credential;
    }

    public String getUrls() {
        return urls;
    }

    public String getUsername() {
        return username;
    }

    public String getCredential() {
        return credential;
    }

    @Override
    public String toString() {
        return "IceServer{urls='" + urls + "'" + (username != null ? ", username='" + username + "'" : "") + "}";
    }
}
