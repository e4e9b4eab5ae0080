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

import java.util.List;

/**
 * Successful answer to {@code join-room}: the room and peer ids assigned to the caller, the peers
 * that were already in the room and the TURN credentials issued for the caller.
 */
public class JoinRoomResponse extends Acknowledgement {
    private final String roomId;
    private final String peerId;
    private final List<PeerInfo> existingPeers;
    private final TurnCredential turnCredentials;

    public JoinRoomResponse(String roomId, String peerId, List<PeerInfo> existingPeers,
                            TurnCredential turnCredentials) {
        super(true, null);
        this.roomId = roomId;
        this.peerId = peerId;
        this.existingPeers = existingPeers;
        this.turnCredentials = turnCredentials;
    }

    public String getRoomId() {
        return roomId;
    }

    public String getPeerId() {
        return peerId;
    }

    public List<PeerInfo> getExistingPeers() {
        return existingPeers;
    }

    public TurnCredential getTurnCredentials() {
        return turnCredentials;
    }
}
