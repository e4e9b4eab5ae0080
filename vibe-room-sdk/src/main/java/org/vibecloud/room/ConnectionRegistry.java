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

package org.vibecloud.room;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.vibecloud.room.api.pojo.PeerInfo;
import org.vibecloud.room.internal.Peer;
import org.vibecloud.room.internal.Room;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * In-memory owner of the rooms and of the global peer index.
 * <p/>
 * Every mutation runs under this object's monitor. Callers that need several steps to be atomic
 * (join = create room + add peer + snapshot) synchronize on the registry themselves; the monitor is
 * reentrant. Reads of a single entry and the counters go straight to the concurrent maps.
 * <p/>
 * Invariant: a peer id is in {@code peers} iff it is in the {@code peers} of the room named by its
 * room id.
 */
public class ConnectionRegistry {
  private final Logger log = LoggerFactory.getLogger(ConnectionRegistry.class);

  private final ConcurrentMap<String, Room> rooms = new ConcurrentHashMap<>();
  private final ConcurrentMap<String, Peer> peers = new ConcurrentHashMap<>();

  private final Clock clock;

  public ConnectionRegistry(Clock clock) {
    this.clock = clock;
  }

  /**
   * Returns the room with the given id, creating it if needed.
   *
   * @param roomId    requested id, or null/empty for a fresh random id
   * @param creatorId user recorded as creator if the room is created by this call
   */
  public synchronized Room createOrGetRoom(String roomId, String creatorId, boolean isPrivate,
      Map<String, Object> metadata) {
    String id = roomId == null || roomId.isEmpty() ? newRoomId() : roomId;
    Room room = rooms.get(id);
    if (room == null) {
      room = new Room(id, clock.instant(), creatorId, isPrivate, metadata);
      rooms.put(id, room);
      log.info("Room created: {} by user {}", id, creatorId);
    }
    return room;
  }

  public synchronized void addPeer(Room room, Peer peer) {
    if (rooms.get(room.getId()) != room) {
      throw new IllegalStateException("Room '" + room.getId() + "' is not registered");
    }
    room.join(peer);
    peers.put(peer.getPeerId(), peer);
  }

  /**
   * Removes the peer from the global index and from its room.
   *
   * @return the room the peer was in, null if the peer is unknown
   */
  public synchronized Room removePeer(String peerId) {
    Peer peer = peers.remove(peerId);
    if (peer == null) {
      return null;
    }
    Room room = rooms.get(peer.getRoomId());
    if (room != null) {
      room.leave(peerId);
    }
    return room;
  }

  /**
   * @param excludingPeerId peer left out of the result, may be null
   */
  public synchronized List<PeerInfo> snapshotPeers(Room room, String excludingPeerId) {
    List<PeerInfo> result = new ArrayList<>();
    for (Peer peer : room.getPeers()) {
      if (!peer.getPeerId().equals(excludingPeerId)) {
        result.add(peer.toPeerInfo());
      }
    }
    return result;
  }

  public Peer getPeer(String peerId) {
    return peerId == null ? null : peers.get(peerId);
  }

  public Room getRoom(String roomId) {
    return roomId == null ? null : rooms.get(roomId);
  }

  public int getRoomCount() {
    return rooms.size();
  }

  public int getPeerCount() {
    return peers.size();
  }

  /**
   * Deletes the rooms without peers that are older than the timeout. Occupied rooms are kept
   * whatever their age.
   *
   * @return number of rooms removed
   */
  public synchronized int removeStaleRooms(Duration timeout) {
    Instant now = clock.instant();
    int removed = 0;
    Iterator<Room> it = rooms.values().iterator();
    while (it.hasNext()) {
      Room room = it.next();
      if (room.isEmpty() && room.getAge(now).compareTo(timeout) > 0) {
        it.remove();
        removed++;
        log.debug("Room '{}' removed after {} without peers", room.getId(), room.getAge(now));
      }
    }
    return removed;
  }

  private String newRoomId() {
    String id;
    do {
      id = UUID.randomUUID().toString();
    } while (rooms.containsKey(id));
    return id;
  }
}
