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

/**
 * Payload of the {@code peer-left} notification.
 */
public class PeerLeftEvent {
    private final String peerId;
    private final String userId;

    public PeerLeftEvent(String peerId, String userId) {
        this.peerId = peerId;
        this.userId = userId;
    }

    public String getPeerId() {
        return peerId;
    }

    public String getUserId() {
        return userId;
    }

    @Override
    public String toString() {
        return "PeerLeftEvent{peerId='" + peerId + "', userId='" + userId + "'}";
    }
}
