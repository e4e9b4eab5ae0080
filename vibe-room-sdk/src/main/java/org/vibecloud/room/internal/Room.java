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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * A named group of peers allowed to exchange signals. Rooms are created on the first join and
 * outlive their peers: only the reaper removes them.
 */
public class Room {
    private final static Logger log = LoggerFactory.getLogger(Room.class);

    private final ConcurrentMap<String, Peer> peers = new ConcurrentHashMap<>();
    private final String id;
    private final Instant createdAt;
    private final String creatorId;
    private final boolean isPrivate;
    private final Map<String, Object> metadata;

    public Room(String id, Instant createdAt, String creatorId, boolean isPrivate,
                Map<String, Object> metadata) {
        this.id = id;
        this.createdAt = createdAt;
        this.creatorId = creatorId;
        this.isPrivate = isPrivate;
        this.metadata = metadata == null ? Collections.emptyMap()
                : Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
        log.debug("New ROOM instance, id '{}'", id);
    }

    public String getId() {
        return id;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public String getCreatorId() {
        return creatorId;
    }

    public boolean isPrivate() {
        return isPrivate;
    }

    public Map<String, Object> getMetadata() {
        return metadata;
    }

    public void join(Peer peer) {
        if (!id.equals(peer.getRoomId())) {
            throw new IllegalArgumentException(
                    "Peer " + peer.getPeerId() + " belongs to room " + peer.getRoomId() + ", not to " + id);
        }
        peers.put(peer.getPeerId(), peer);
        log.debug("ROOM {}: Added peer {}", id, peer);
    }

    /**
     * @return the removed peer, null if it was not in this room
     */
    public Peer leave(String peerId) {
        Peer peer = peers.remove(peerId);
        if (peer != null) {
            log.debug("ROOM {}: Removed peer {}", id, peer);
        }
        return peer;
    }

    public Peer getPeer(String peerId) {
        return peers.get(peerId);
    }

    public Collection<Peer> getPeers() {
        return Collections.unmodifiableCollection(peers.values());
    }

    public boolean isEmpty() {
        return peers.isEmpty();
    }

    public Duration getAge(Instant now) {
        return Duration.between(createdAt, now);
    }

    @Override
    public String toString() {
        return "[Room: id=" + id + ", peers=" + peers.size() + ", private=" + isPrivate + "]";
    }
}
