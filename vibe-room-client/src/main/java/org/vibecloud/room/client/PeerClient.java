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

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.web.client.RestTemplate;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketHttpHeaders;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.client.WebSocketClient;
import org.springframework.web.socket.client.standard.StandardWebSocketClient;
import org.springframework.web.socket.handler.TextWebSocketHandler;

import java.io.IOException;
import java.net.URI;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Consumer;

/**
 * Client side of the signaling protocol. Connects to the server, joins a room, keeps a mirror of the
 * room's peers and relays signals, so that the embedding application can set up its WebRTC
 * connections.
 * <p/>
 * TURN credentials are not refreshed automatically; callers should invoke
 * {@link #refreshTurnCredentials()} before the current ones expire.
 */
public class PeerClient {
    private static final Logger log = LoggerFactory.getLogger(PeerClient.class);

    public static final String STUN_FALLBACK_URL = "stun:stun.l.google.com:19302";
    static final String CREDENTIALS_PATH = "/api/turn/credentials";

    private final PeerClientOptions options;
    private final WebSocketClient webSocketClient;
    private final RestTemplate restTemplate;
    private final ObjectMapper mapper = new ObjectMapper()
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    private final SignalingHandler handler = new SignalingHandler();

    private final AtomicLong nextRequestId = new AtomicLong();
    // Request id -> result of the request
    private final ConcurrentMap<Long, CompletableFuture<JsonNode>> pendingRequests = new ConcurrentHashMap<>();
    // PeerId -> peer
    private final ConcurrentMap<String, RemotePeer> peers = new ConcurrentHashMap<>();

    private final List<Consumer<Boolean>> connectionListeners = new CopyOnWriteArrayList<>();
    private final List<Consumer<RemotePeer>> peerJoinListeners = new CopyOnWriteArrayList<>();
    private final List<Consumer<String>> peerLeaveListeners = new CopyOnWriteArrayList<>();
    private final List<Consumer<SignalData>> signalListeners = new CopyOnWriteArrayList<>();

    private volatile WebSocketSession session;
    private volatile String roomId;
    private volatile String peerId;
    private volatile TurnCredentials turnCredentials;

    public PeerClient(PeerClientOptions options) {
        this(options, new StandardWebSocketClient(), new RestTemplate());
    }

    public PeerClient(PeerClientOptions options, WebSocketClient webSocketClient, RestTemplate restTemplate) {
        this.options = options;
        this.webSocketClient = webSocketClient;
        this.restTemplate = restTemplate;
    }

    /**
     * Opens the signaling connection and authenticates. The future fails if the handshake fails, the
     * connection drops before the answer, or the server rejects the authentication.
     */
    public CompletableFuture<Void> connect() {
        URI uri = getSignalingUri();
        log.debug("Connecting to signaling server at {}", uri);
        CompletableFuture<WebSocketSession> handshake;
        try {
            handshake = webSocketClient.doHandshake(handler, new WebSocketHttpHeaders(), uri).completable();
        } catch (RuntimeException e) {
            return failed(e);
        }
        return handshake
                .thenCompose(established -> {
                    ObjectNode params = mapper.createObjectNode();
                    params.put("userId", options.getUserId());
                    params.put("deviceId", options.getDeviceId());
                    return request("authenticate", params);
                })
                .thenAccept(result -> log.info("Authenticated with server as {}", options.getUserId()))
                .whenComplete((result, error) -> {
                    if (error != null) {
                        log.error("Error connecting to signaling server: {}", error.getMessage());
                    }
                });
    }

    /**
     * Joins the given room, or a fresh room chosen by the server when {@code roomId} is null.
     * Replaces the local peer mirror with the peers already in the room.
     */
    public CompletableFuture<JoinedRoom> joinRoom(String roomId) {
        ObjectNode params = mapper.createObjectNode();
        if (roomId != null) {
            params.put("roomId", roomId);
        }
        params.put("userId", options.getUserId());
        params.put("deviceId", options.getDeviceId());

        return request("join-room", params).thenApply(result -> {
            JoinedRoom joined = toJoinedRoom(result);
            this.roomId = joined.getRoomId();
            this.peerId = joined.getPeerId();
            this.turnCredentials = joined.getTurnCredentials();
            peers.clear();
            for (RemotePeer peer : joined.getPeers()) {
                peers.put(peer.getPeerId(), peer);
            }
            log.info("Joined room: {} as peer: {}", joined.getRoomId(), joined.getPeerId());
            return joined;
        });
    }

    /**
     * Leaves the current room. Completes normally whatever the server answers; the local room state
     * is cleared in any case.
     */
    public CompletableFuture<Void> leaveRoom() {
        String current = roomId;
        if (session == null || current == null) {
            return CompletableFuture.completedFuture(null);
        }
        ObjectNode params = mapper.createObjectNode();
        params.put("roomId", current);
        return request("leave-room", params).handle((result, error) -> {
            if (error != null) {
                log.debug("leave-room was not acknowledged: {}", error.getMessage());
            }
            clearRoomState();
            return null;
        });
    }

    /**
     * Sends an opaque signal to another peer of the room. Nothing is sent back, whether or not the
     * target exists.
     */
    public void signal(String targetPeerId, Object signal, String type) {
        WebSocketSession current = session;
        if (current == null || peerId == null) {
            log.error("Cannot signal: not connected or not in a room");
            return;
        }
        ObjectNode params = mapper.createObjectNode();
        params.put("target", targetPeerId);
        params.set("signal", mapper.valueToTree(signal));
        params.put("type", type);
        try {
            send(current, message(null, "signal", params));
        } catch (IOException e) {
            log.warn("Could not send signal to {}: {}", targetPeerId, e.getMessage());
        }
    }

    /**
     * Builds the ICE server list: one entry per TURN url with the current credentials, followed by a
     * public STUN server. Without credentials only the STUN server is returned.
     */
    public IceConfiguration getWebRTCConfig() {
        List<IceServer> servers = new ArrayList<>();
        TurnCredentials credentials = turnCredentials;
        if (credentials != null) {
            for (String url : credentials.getUrls()) {
                servers.add(new IceServer(url, credentials.getUsername(), credentials.getCredential()));
            }
        }
        servers.add(new IceServer(STUN_FALLBACK_URL));
        return new IceConfiguration(servers);
    }

    /**
     * Fetches new TURN credentials over HTTP, independently of the signaling connection.
     */
    public CompletableFuture<TurnCredentials> refreshTurnCredentials() {
        String url = getHttpBaseUrl() + CREDENTIALS_PATH;
        Map<String, String> body = Collections.singletonMap("userId", options.getUserId());
        return CompletableFuture.supplyAsync(() -> {
            TurnCredentials credentials = restTemplate.postForObject(url, body, TurnCredentials.class);
            if (credentials == null) {
                throw new PeerClientException("Empty answer from " + url);
            }
            this.turnCredentials = credentials;
            return credentials;
        }).whenComplete((credentials, error) -> {
            if (error != null) {
                log.error("Error refreshing TURN credentials: {}", error.getMessage());
            }
        });
    }

    /**
     * Closes the signaling connection and forgets the room state.
     */
    public void disconnect() {
        WebSocketSession current = session;
        session = null;
        if (current != null) {
            try {
                current.close(CloseStatus.NORMAL);
            } catch (IOException e) {
                log.debug("Error closing signaling connection: {}", e.getMessage());
            }
        }
        clearRoomState();
    }

    public Subscription onConnectionStateChanged(Consumer<Boolean> listener) {
        return subscribe(connectionListeners, listener);
    }

    public Subscription onPeerJoined(Consumer<RemotePeer> listener) {
        return subscribe(peerJoinListeners, listener);
    }

    /**
     * The listener receives the id of the departed peer.
     */
    public Subscription onPeerLeft(Consumer<String> listener) {
        return subscribe(peerLeaveListeners, listener);
    }

    public Subscription onSignal(Consumer<SignalData> listener) {
        return subscribe(signalListeners, listener);
    }

    public boolean isConnected() {
        WebSocketSession current = session;
        return current != null && current.isOpen();
    }

    public String getRoomId() {
        return roomId;
    }

    public String getPeerId() {
        return peerId;
    }

    public TurnCredentials getTurnCredentials() {
        return turnCredentials;
    }

    public Collection<RemotePeer> getPeers() {
        return Collections.unmodifiableCollection(new ArrayList<>(peers.values()));
    }

    URI getSignalingUri() {
        String base = options.getServerUrl();
        if (base.startsWith("https://")) {
            base = "wss://" + base.substring("https://".length());
        } else if (base.startsWith("http://")) {
            base = "ws://" + base.substring("http://".length());
        }
        return URI.create(base + options.getSignalingPath());
    }

    String getHttpBaseUrl() {
        String base = options.getServerUrl();
        if (base.startsWith("wss://")) {
            return "https://" + base.substring("wss://".length());
        } else if (base.startsWith("ws://")) {
            return "http://" + base.substring("ws://".length());
        }
        return base;
    }

    private CompletableFuture<JsonNode> request(String method, ObjectNode params) {
        WebSocketSession current = session;
        if (current == null || !current.isOpen()) {
            return failed(new PeerClientException("Not connected to signaling server"));
        }
        long id = nextRequestId.incrementAndGet();
        CompletableFuture<JsonNode> response = new CompletableFuture<>();
        pendingRequests.put(id, response);
        try {
            send(current, message(id, method, params));
        } catch (IOException e) {
            pendingRequests.remove(id);
            response.completeExceptionally(new PeerClientException("Could not send " + method, e));
        }
        return response.thenApply(result -> {
            if (!result.path("success").asBoolean(false)) {
                String error = result.path("error").asText("");
                throw new PeerClientException(error.isEmpty() ? method + " failed" : error);
            }
            return result;
        });
    }

    private String message(Long id, String method, ObjectNode params) throws IOException {
        ObjectNode message = mapper.createObjectNode();
        message.put("jsonrpc", "2.0");
        if (id != null) {
            message.put("id", id);
        }
        message.put("method", method);
        message.set("params", params);
        return mapper.writeValueAsString(message);
    }

    private void send(WebSocketSession target, String text) throws IOException {
        // WebSocketSession does not allow concurrent sends
        synchronized (target) {
            target.sendMessage(new TextMessage(text));
        }
    }

    private JoinedRoom toJoinedRoom(JsonNode result) {
        String joinedRoomId = result.path("roomId").asText(null);
        String joinedPeerId = result.path("peerId").asText(null);
        JsonNode credentials = result.get("turnCredentials");
        if (joinedRoomId == null || joinedPeerId == null || credentials == null || credentials.isNull()) {
            throw new PeerClientException("Server returned incomplete data");
        }
        List<RemotePeer> existing = new ArrayList<>();
        try {
            for (JsonNode peer : result.path("existingPeers")) {
                existing.add(mapper.treeToValue(peer, RemotePeer.class));
            }
            return new JoinedRoom(joinedRoomId, joinedPeerId, existing,
                    mapper.treeToValue(credentials, TurnCredentials.class));
        } catch (JsonProcessingException e) {
            throw new PeerClientException("Server returned malformed room data", e);
        }
    }

    private void clearRoomState() {
        roomId = null;
        peerId = null;
        peers.clear();
    }

    void onServerMessage(String payload) {
        JsonNode message;
        try {
            message = mapper.readTree(payload);
        } catch (JsonProcessingException e) {
            log.warn("Ignoring malformed message from server: {}", e.getMessage());
            return;
        }
        JsonNode id = message.get("id");
        if (id != null && id.canConvertToLong()) {
            CompletableFuture<JsonNode> pending = pendingRequests.remove(id.asLong());
            if (pending == null) {
                log.debug("Response to unknown request {}", id);
            } else {
                pending.complete(message.path("result"));
            }
            return;
        }
        String method = message.path("method").asText("");
        JsonNode params = message.path("params");
        switch (method) {
            case "peer-joined":
                onPeerJoinedMessage(params);
                break;
            case "peer-left":
                onPeerLeftMessage(params);
                break;
            case "signal":
                SignalData data = new SignalData(params.path("peerId").asText(null), params.get("signal"),
                        params.path("type").asText(null));
                fire(signalListeners, data);
                break;
            default:
                log.debug("Ignoring unknown notification '{}'", method);
        }
    }

    private void onPeerJoinedMessage(JsonNode params) {
        RemotePeer peer;
        try {
            peer = mapper.treeToValue(params, RemotePeer.class);
        } catch (JsonProcessingException e) {
            log.warn("Ignoring malformed peer-joined: {}", e.getMessage());
            return;
        }
        log.info("Peer joined: {} ({})", peer.getPeerId(), peer.getUserId());
        peers.put(peer.getPeerId(), peer);
        fire(peerJoinListeners, peer);
    }

    private void onPeerLeftMessage(JsonNode params) {
        String leftPeerId = params.path("peerId").asText(null);
        if (leftPeerId == null) {
            return;
        }
        log.info("Peer left: {} ({})", leftPeerId, params.path("userId").asText(""));
        peers.remove(leftPeerId);
        fire(peerLeaveListeners, leftPeerId);
    }

    private void onConnectionClosed(WebSocketSession closed) {
        if (session == closed) {
            session = null;
        }
        PeerClientException error = new PeerClientException("Connection to signaling server closed");
        for (Long id : new ArrayList<>(pendingRequests.keySet())) {
            CompletableFuture<JsonNode> pending = pendingRequests.remove(id);
            if (pending != null) {
                pending.completeExceptionally(error);
            }
        }
        log.info("Disconnected from signaling server");
        fire(connectionListeners, Boolean.FALSE);
    }

    private <T> void fire(List<Consumer<T>> listeners, T event) {
        for (Consumer<T> listener : listeners) {
            try {
                listener.accept(event);
            } catch (RuntimeException e) {
                log.warn("Listener failed on {}", event, e);
            }
        }
    }

    private static <T> Subscription subscribe(List<Consumer<T>> listeners, Consumer<T> listener) {
        listeners.add(listener);
        return () -> listeners.remove(listener);
    }

    private static <T> CompletableFuture<T> failed(Throwable error) {
        CompletableFuture<T> future = new CompletableFuture<>();
        future.completeExceptionally(error);
        return future;
    }

    private class SignalingHandler extends TextWebSocketHandler {
        @Override
        public void afterConnectionEstablished(WebSocketSession established) {
            session = established;
            log.info("Connected to signaling server");
            fire(connectionListeners, Boolean.TRUE);
        }

        @Override
        protected void handleTextMessage(WebSocketSession source, TextMessage message) {
            onServerMessage(message.getPayload());
        }

        @Override
        public void handleTransportError(WebSocketSession source, Throwable exception) {
            log.warn("Signaling transport error: {}", exception.getMessage());
        }

        @Override
        public void afterConnectionClosed(WebSocketSession closed, CloseStatus status) {
            onConnectionClosed(closed);
        }
    }
}
