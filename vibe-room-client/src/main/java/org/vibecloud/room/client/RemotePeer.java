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

import java.util.Objects;

/**
 * Another peer of the room the client is in.
 */
public class RemotePeer {
    private String peerId;
    private String userId;
    private String deviceId;

    public RemotePeer() {
    }

    public RemotePeer(String peerId, String userId, String deviceId) {
        this.peerId = peerId;
        this.userId = userId;
        this.deviceId = deviceId;
    }

    public String getPeerId() {
        return peerId;
    }

    public void setPeerId(String peerId) {
        this.peerId = peerId;
    }

    public String getUserId() {
        return userId;
    }

    public void setUserId(String userId) {
        this.userId = userId;
    }

    public String getDeviceId() {
        return deviceId;
    }

    public void setDeviceId(String deviceId) {
        this.deviceId = deviceId;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        RemotePeer that = (RemotePeer) o;
        return Objects.equals(peerId, that.peerId) && Objects.equals(userId, that.userId)
                && Objects.equals(deviceId, that.deviceId);
    }

    @Override
    public int hashCode() {
        return Objects.hash(peerId, userId, deviceId);
    }

    @Override
    public String toString() {
        return "RemotePeer{peerId='" + peerId + "', userId='" + userId + "', deviceId='" + deviceId + "'}";
    }
}
