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

public class PeerClientOptions {
    public static final String DEFAULT_SIGNALING_PATH = "/signaling";

    private final String serverUrl;
    private final String userId;
    private final String deviceId;
    private String signalingPath = DEFAULT_SIGNALING_PATH;

    /**
     * @param serverUrl base url of the server, http(s) or ws(s)
     */
    public PeerClientOptions(String serverUrl, String userId, String deviceId) {
        if (serverUrl == null || serverUrl.isEmpty()) {
            throw new IllegalArgumentException("Server url is required");
        }
        if (userId == null || userId.isEmpty()) {
            throw new IllegalArgumentException("User id is required");
        }
        this.serverUrl = serverUrl.endsWith("/") ? serverUrl.substring(0, serverUrl.length() - 1) : serverUrl;
        this.userId = userId;
        this.deviceId = deviceId;
    }

    public String getServerUrl() {
        return serverUrl;
    }

    public String getUserId() {
        return userId;
    }

    public String getDeviceId() {
        return deviceId;
    }

    public String getSignalingPath() {
        return signalingPath;
    }

    public PeerClientOptions setSignalingPath(String signalingPath) {
        this.signalingPath = signalingPath;
        return this;
    }
}
