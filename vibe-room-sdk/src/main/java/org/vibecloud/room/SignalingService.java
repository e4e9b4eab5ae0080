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
import org.vibecloud.room.api.ConnectionState;
import org.vibecloud.room.api.PeerConnection;
import org.vibecloud.room.api.pojo.Acknowledgement;
import org.vibecloud.room.api.pojo.AuthenticateResponse;
import org.vibecloud.room.api.pojo.JoinRoomResponse;
import org.vibecloud.room.api.pojo.PeerInfo;
import org.vibecloud.room.api.pojo.PeerLeftEvent;
import org.vibecloud.room.api.pojo.SignalEvent;
import org.vibecloud.room.api.pojo.SignalingStats;
import org.vibecloud.room.api.pojo.TurnCredential;
import org.vibecloud.room.api.request.AuthenticateRequest;
import org.vibecloud.room.api.request.JoinRoomRequest;
import org.vibecloud.room.api.request.SignalRequest;
import org.vibecloud.room.api.request.SignalingRequest;
import org.vibecloud.room.exception.SignalingException;
import org.vibecloud.room.exception.SignalingException.Code;
import org.vibecloud.room.interfaces.ICredentialIssuer;
import org.vibecloud.room.internal.Peer;
import org.vibecloud.room.internal.Room;
import org.vibecloud.room.internal.SignalingSession;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Transport-agnostic handler of the signaling protocol. The transport calls
 * {@link #onConnect(PeerConnection)} and {@link #onDisconnect(String)} around the life of each
 * connection and {@link #handle(String, SignalingRequest)} for every decoded message, in the order
 * the messages were received on that connection.
 * <p/>
 * Registry changes are made while holding the registry monitor; notifications are pushed once it
 * has been released.
 * <p/>
 * Trust boundary: the user id claimed by {@code authenticate} and {@code join-room} is accepted
 * as is. Nothing checks that the connecting party owns it.
 */
public class SignalingService {
    private final Logger log = LoggerFactory.getLogger(SignalingService.class);

    public static final String PEER_JOINED = "peer-joined";
    public static final String PEER_LEFT = "peer-left";
    public static final String SIGNAL = "signal";

    static final String DEFAULT_AUTH_DEVICE_ID = "unknown-device";
    static final String DEFAULT_PEER_DEVICE_ID = "unknown";

    private final ConnectionRegistry registry;
    private final ICredentialIssuer credentialIssuer;
    private final ConnectionLimiter connectionLimiter;
    private final Clock clock;

    // ConnectionId -> session
    private final ConcurrentMap<String, SignalingSession> sessions = new ConcurrentHashMap<>();

    public SignalingService(ConnectionRegistry registry, ICredentialIssuer credentialIssuer,
                            ConnectionLimiter connectionLimiter, Clock clock) {
        this.registry = registry;
        this.credentialIssuer = credentialIssuer;
        this.connectionLimiter = connectionLimiter;
        this.clock = clock;
    }

    /**
     * Registers a new transport connection. If its source address is over the connection limit the
     * connection is closed right away and false is returned.
     */
    public boolean onConnect(PeerConnection connection) {
        SignalingSession session = new SignalingSession(connection);
        String address = session.getRemoteAddress();
        // registered before any close so that onDisconnect releases the counter
        sessions.put(connection.getId(), session);

        if (!connectionLimiter.acquire(address)) {
            log.warn("Too many connections from IP: {}", address);
            session.disconnected();
            connection.close();
            return false;
        }
        log.debug("New connection from {}, connection ID: {}", address, connection.getId());
        return true;
    }

    /**
     * Dispatches a decoded request.
     *
     * @return the acknowledgement to send back, null for fire-and-forget requests
     * @throws SignalingException if the request is not valid
     */
    public Acknowledgement handle(String connectionId, SignalingRequest request) {
        switch (request.getMethod()) {
            case AUTHENTICATE:
                return authenticate(connectionId, (AuthenticateRequest) request);
            case JOIN_ROOM:
                return joinRoom(connectionId, (JoinRoomRequest) request);
            case SIGNAL:
                signal(connectionId, (SignalRequest) request);
                return null;
            case LEAVE_ROOM:
                return leaveRoom(connectionId);
            default:
                throw new SignalingException(Code.UNKNOWN_METHOD_ERROR_CODE,
                        "Unknown method " + request.getMethod());
        }
    }

    public AuthenticateResponse authenticate(String connectionId, AuthenticateRequest request) {
        SignalingSession session = getSession(connectionId);
        if (isBlank(request.getUserId())) {
            throw new SignalingException(Code.USER_ID_REQUIRED_ERROR_CODE,
                    "User ID is required to authenticate");
        }
        String deviceId = isBlank(request.getDeviceId()) ? DEFAULT_AUTH_DEVICE_ID : request.getDeviceId();
        session.authenticated(request.getUserId(), deviceId);

        log.info("User authenticated: {}, device: {}", request.getUserId(), deviceId);
        return new AuthenticateResponse(request.getUserId());
    }

    public JoinRoomResponse joinRoom(String connectionId, JoinRoomRequest request) {
        SignalingSession session = getSession(connectionId);
        String userId = request.getUserId();
        if (isBlank(userId)) {
            throw new SignalingException(Code.USER_ID_REQUIRED_ERROR_CODE,
                    "User ID is required to join a room");
        }
        String deviceId = isBlank(request.getDeviceId()) ? DEFAULT_PEER_DEVICE_ID : request.getDeviceId();

        Departure previous;
        Room room;
        Peer peer;
        List<PeerInfo> existingPeers;
        List<Peer> recipients;
        synchronized (registry) {
            // onDisconnect may have run since getSession
            if (sessions.get(connectionId) != session || session.getState() == ConnectionState.DISCONNECTED) {
                throw new SignalingException(Code.GENERIC_ERROR_CODE,
                        "Connection '" + connectionId + "' closed while joining");
            }
            previous = detach(session);
            room = registry.createOrGetRoom(request.getRoomId(), userId, request.isPrivate(),
                    request.getMetadata());
            peer = new Peer(UUID.randomUUID().toString(), userId, deviceId, room.getId(), clock.instant(),
                    session.getConnection());
            registry.addPeer(room, peer);
            existingPeers = registry.snapshotPeers(room, peer.getPeerId());
            recipients = othersIn(room, peer.getPeerId());
            session.joined(peer.getPeerId(), userId, deviceId);
        }

        if (previous != null) {
            announceDeparture(previous);
        }

        TurnCredential turnCredentials = credentialIssuer.generateCredentials(userId);

        PeerInfo joined = peer.toPeerInfo();
        for (Peer other : recipients) {
            send(other.getConnection(), PEER_JOINED, joined);
        }

        log.info("Peer {} (user: {}) joined room {}", peer.getPeerId(), userId, room.getId());
        return new JoinRoomResponse(room.getId(), peer.getPeerId(), existingPeers, turnCredentials);
    }

    /**
     * Relays an opaque signal to its target peer. Signals that can't be routed are dropped without
     * telling the sender.
     */
    public void signal(String connectionId, SignalRequest request) {
        SignalingSession session = getSession(connectionId);
        String senderPeerId = session.getPeerId();
        if (senderPeerId == null) {
            log.warn("Signal from connection {} which has not joined a room", connectionId);
            return;
        }
        Peer target = registry.getPeer(request.getTarget());
        if (target == null) {
            log.warn("Signal sent to unknown peer: {}", request.getTarget());
            return;
        }
        send(target.getConnection(), SIGNAL, new SignalEvent(senderPeerId, request.getSignal(), request.getType()));
        log.debug("Signal ({}) forwarded from {} to {}", request.getType(), senderPeerId, target.getPeerId());
    }

    public Acknowledgement leaveRoom(String connectionId) {
        SignalingSession session = getSession(connectionId);
        Departure departure;
        synchronized (registry) {
            departure = detach(session);
        }
        if (departure == null) {
            log.debug("Connection {} asked to leave but is not in a room", connectionId);
        } else {
            announceDeparture(departure);
        }
        return Acknowledgement.ok();
    }

    /**
     * Cleans up after a closed transport connection: the peer, if any, leaves its room before this
     * method returns, and the address's connection count is released.
     */
    public void onDisconnect(String connectionId) {
        SignalingSession session = sessions.remove(connectionId);
        if (session == null) {
            return;
        }
        Departure departure;
        synchronized (registry) {
            departure = detach(session);
            session.disconnected();
        }
        if (departure != null) {
            announceDeparture(departure);
        }
        connectionLimiter.release(session.getRemoteAddress());
        log.debug("Connection closed: {}", connectionId);
    }

    public SignalingStats getStats() {
        return new SignalingStats(registry.getRoomCount(), registry.getPeerCount(),
                connectionLimiter.getTrackedAddressCount());
    }

    /**
     * @return the session of a live connection, null if the connection is unknown or closed
     */
    public SignalingSession getSessionOrNull(String connectionId) {
        return sessions.get(connectionId);
    }

    private SignalingSession getSession(String connectionId) {
        SignalingSession session = sessions.get(connectionId);
        if (session == null || session.getState() == ConnectionState.DISCONNECTED) {
            throw new SignalingException(Code.GENERIC_ERROR_CODE,
                    "Connection '" + connectionId + "' is not registered");
        }
        return session;
    }

    // Must be called holding the registry monitor
    private Departure detach(SignalingSession session) {
        String peerId = session.getPeerId();
        if (peerId == null) {
            return null;
        }
        Peer peer = registry.getPeer(peerId);
        Room room = registry.removePeer(peerId);
        session.left();
        if (peer == null || room == null) {
            return null;
        }
        return new Departure(peer, room, othersIn(room, peerId));
    }

    private void announceDeparture(Departure departure) {
        Peer peer = departure.peer;
        PeerLeftEvent event = new PeerLeftEvent(peer.getPeerId(), peer.getUserId());
        for (Peer other : departure.remaining) {
            send(other.getConnection(), PEER_LEFT, event);
        }
        log.info("Peer {} (user: {}) left room {}", peer.getPeerId(), peer.getUserId(), departure.room.getId());
        if (departure.remaining.isEmpty()) {
            log.info("Room {} is now empty, will be removed after timeout", departure.room.getId());
        }
    }

    private static List<Peer> othersIn(Room room, String excludedPeerId) {
        List<Peer> others = new ArrayList<>();
        for (Peer p : room.getPeers()) {
            if (!p.getPeerId().equals(excludedPeerId)) {
                others.add(p);
            }
        }
        return others;
    }

    private void send(PeerConnection connection, String method, Object params) {
        try {
            connection.sendNotification(method, params);
        } catch (Exception e) {
            log.warn("Could not deliver '{}' to connection {}: {}", method, connection.getId(), e.getMessage());
        }
    }

    private static boolean isBlank(String value) {
        return value == null || value.trim().isEmpty();
    }

    private static class Departure {
        final Peer peer;
        final Room room;
        final List<Peer> remaining;

        Departure(Peer peer, Room room, List<Peer> remaining) {
            this.peer = peer;
            this.room = room;
            this.remaining = Collections.unmodifiableList(remaining);
        }
    }
}
