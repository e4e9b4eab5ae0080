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

import org.vibecloud.room.api.PeerConnection;
import org.vibecloud.room.api.pojo.PeerInfo;

import java.time.Instant;

/**
 * A connection that has joined a room. Peers are created on join and dropped on leave or
 * disconnect; a peer id is never reused.
 */
public class Peer {
    private final String peerId;
    private final String userId;
    private final String deviceId;
    private final String roomId;
    private final Instant joinedAt;
    private final PeerConnection connection;

    public Peer(String peerId, String userId, String deviceId, String roomId, Instant joinedAt,
                PeerConnection connection) {
        this.peerId = peerId;
        this.userId = userId;
        this.deviceId = deviceId;
        this.roomId = roomId;
        this.joinedAt = joinedAt;
        this.connection = connection;
    }

    public String getPeerId() {
        return peerId;
    }

    public String getUserId() {
        return userId;
    }

    public String getDeviceId() {
        return deviceId;
    }

    public String getRoomId() {
        return roomId;
    }

    public Instant getJoinedAt() {
        return joinedAt;
    }

    public PeerConnection getConnection() {
        return connection;
    }

    public PeerInfo toPeerInfo() {
        return new PeerInfo(peerId, userId, deviceId);
    }

    @Override
    public String toString() {
        return "[Peer: id=" + peerId + ", user=" + userId + ", device=" + deviceId + ", room=" + roomId + "]";
    }
}
