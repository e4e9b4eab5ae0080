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

package org.vibecloud.room.internal;

import org.vibecloud.room.api.ConnectionState;
import org.vibecloud.room.api.PeerConnection;

/**
 * Protocol state of one client connection: who it claims to be and which peer, if any, it
 * currently owns. A connection owns at most one peer at a time.
 */
public class SignalingSession {
    private final PeerConnection connection;
    private final String remoteAddress;

    private volatile ConnectionState state = ConnectionState.CONNECTED;
    private volatile String userId;
    private volatile String deviceId;
    private volatile String peerId;

    public SignalingSession(PeerConnection connection) {
        this.connection = connection;
        this.remoteAddress = connection.getRemoteAddress();
    }

    public PeerConnection getConnection() {
        return connection;
    }

    public String getRemoteAddress() {
        return remoteAddress;
    }

    public ConnectionState getState() {
        return state;
    }

    public String getUserId() {
        return userId;
    }

    public String getDeviceId() {
        return deviceId;
    }

    public String getPeerId() {
        return peerId;
    }

    public void authenticated(String userId, String deviceId) {
        this.userId = userId;
        this.deviceId = deviceId;
        if (state == ConnectionState.CONNECTED) {
            state = ConnectionState.AUTHENTICATED;
        }
    }

    public void joined(String peerId, String userId, String deviceId) {
        this.peerId = peerId;
        this.userId = userId;
        this.deviceId = deviceId;
        this.state = ConnectionState.IN_ROOM;
    }

    public void left() {
        this.peerId = null;
        if (state == ConnectionState.IN_ROOM) {
            state = ConnectionState.AUTHENTICATED;
        }
    }

    public void disconnected() {
        this.peerId = null;
        this.state = ConnectionState.DISCONNECTED;
    }

    @Override
    public String toString() {
        return "[Session: connection=" + connection.getId() + ", state=" + state + ", user=" + userId
                + ", peer=" + peerId + "]";
    }
}
