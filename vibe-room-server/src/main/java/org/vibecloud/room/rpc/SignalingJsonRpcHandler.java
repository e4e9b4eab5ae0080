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

package org.vibecloud.room.rpc;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.ConcurrentWebSocketSessionDecorator;
import org.springframework.web.socket.handler.TextWebSocketHandler;
import org.vibecloud.room.SignalingService;
import org.vibecloud.room.api.pojo.Acknowledgement;
import org.vibecloud.room.api.request.SignalingRequest;
import org.vibecloud.room.exception.SignalingException;

import java.io.IOException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * WebSocket endpoint of the signaling protocol. Each frame is decoded, handed to the
 * {@link SignalingService} and, for requests carrying an id, answered with an acknowledgement.
 * <p/>
 * This is the per-connection error boundary: whatever goes wrong while handling one frame is
 * reported to that client only and never closes the connection.
 */
public class SignalingJsonRpcHandler extends TextWebSocketHandler {
    private static final Logger log = LoggerFactory.getLogger(SignalingJsonRpcHandler.class);

    static final String INTERNAL_ERROR = "Internal server error";

    private static final int SEND_TIME_LIMIT_MS = 10000;
    private static final int SEND_BUFFER_SIZE_LIMIT = 512 * 1024;

    private final SignalingService signalingService;
    private final JsonRpcCodec codec;

    // SessionId -> connection
    private final ConcurrentMap<String, WebSocketPeerConnection> connections = new ConcurrentHashMap<>();

    public SignalingJsonRpcHandler(SignalingService signalingService, JsonRpcCodec codec) {
        this.signalingService = signalingService;
        this.codec = codec;
    }

    @Override
    public void afterConnectionEstablished(WebSocketSession session) {
        WebSocketPeerConnection connection = new WebSocketPeerConnection(
                new ConcurrentWebSocketSessionDecorator(session, SEND_TIME_LIMIT_MS, SEND_BUFFER_SIZE_LIMIT), codec);
        connections.put(session.getId(), connection);
        signalingService.onConnect(connection);
    }

    @Override
    protected void handleTextMessage(WebSocketSession session, TextMessage message) {
        WebSocketPeerConnection connection = connections.get(session.getId());
        if (connection == null) {
            log.debug("Dropping message from unregistered session {}", session.getId());
            return;
        }

        JsonRpcRequest rpc;
        try {
            rpc = codec.parse(message.getPayload());
        } catch (SignalingException e) {
            log.warn("Malformed message from connection {}: {}", session.getId(), e.getMessage());
            return;
        }

        try {
            SignalingRequest request = codec.toSignalingRequest(rpc);
            Acknowledgement ack = signalingService.handle(connection.getId(), request);
            if (ack != null) {
                reply(connection, rpc, ack);
            }
        } catch (SignalingException e) {
            log.warn("PARTICIPANT {}: Error handling {}: {}", session.getId(), rpc.getMethod(), e.getMessage());
            reply(connection, rpc, Acknowledgement.failure(e.getMessage()));
        } catch (Exception e) {
            log.error("PARTICIPANT {}: Unexpected error handling {}", session.getId(), rpc.getMethod(), e);
            reply(connection, rpc, Acknowledgement.failure(INTERNAL_ERROR));
        }
    }

    @Override
    public void handleTransportError(WebSocketSession session, Throwable exception) {
        log.debug("Transport error on connection {}: {}", session.getId(), exception.getMessage());
    }

    @Override
    public void afterConnectionClosed(WebSocketSession session, CloseStatus status) {
        connections.remove(session.getId());
        signalingService.onDisconnect(session.getId());
        log.debug("Socket disconnected: {} ({})", session.getId(), status);
    }

    int getConnectionCount() {
        return connections.size();
    }

    private void reply(WebSocketPeerConnection connection, JsonRpcRequest rpc, Acknowledgement ack) {
        if (!rpc.hasId()) {
            return;
        }
        try {
            connection.sendResponse(rpc.getId(), ack);
        } catch (IOException e) {
            log.warn("Could not answer {} on connection {}: {}", rpc.getMethod(), connection.getId(), e.getMessage());
        }
    }
}
