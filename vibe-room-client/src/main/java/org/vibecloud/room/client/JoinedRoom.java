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

import java.util.Collections;
import java.util.List;

public class JoinedRoom {
    private final String roomId;
    private final String peerId;
    private final List<RemotePeer> peers;
    private final TurnCredentials turnCredentials;

    public JoinedRoom(String roomId, String peerId, List<RemotePeer> peers, TurnCredentials turnCredentials) {
        this.roomId = roomId;
        this.peerId = peerId;
        this.peers = Collections.unmodifiableList(peers);
        this.turnCredentials = turnCredentials;
    }

    public String getRoomId() {
        return roomId;
    }

    public String getPeerId() {
        return peerId;
    }

    /**
     * @return peers that were in the room before this client joined
     */
    public List<RemotePeer> getPeers() {
        return peers;
    }

    public TurnCredentials getTurnCredentials() {
        return turnCredentials;
    }
}
