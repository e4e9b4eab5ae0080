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

import com.fasterxml.jackson.databind.JsonNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.vibecloud.room.api.PeerConnection;
import org.vibecloud.room.api.pojo.Acknowledgement;

import java.io.IOException;
import java.net.InetSocketAddress;

/**
 * {@link PeerConnection} backed by a Spring WebSocket session. The session is expected to be safe
 * for concurrent sends (see {@link org.springframework.web.socket.handler.ConcurrentWebSocketSessionDecorator}).
 */
public class WebSocketPeerConnection implements PeerConnection {
    private static final Logger log = LoggerFactory.getLogger(WebSocketPeerConnection.class);

    static final String UNKNOWN_ADDRESS = "unknown";

    private final WebSocketSession session;
    private final JsonRpcCodec codec;
    private final String remoteAddress;

    public WebSocketPeerConnection(WebSocketSession session, JsonRpcCodec codec) {
        this.session = session;
        this.codec = codec;
        this.remoteAddress = addressOf(session.getRemoteAddress());
    }

    @Override
    public String getId() {
        return session.getId();
    }

    @Override
    public String getRemoteAddress() {
        return remoteAddress;
    }

    @Override
    public void sendNotification(String method, Object params) throws IOException {
        send(codec.encodeNotification(method, params));
    }

    public void sendResponse(JsonNode id, Acknowledgement result) throws IOException {
        send(codec.encodeResponse(id, result));
    }

    @Override
    public void close() {
        try {
            session.close(CloseStatus.POLICY_VIOLATION);
        } catch (IOException e) {
            log.debug("Error closing WebSocket session {}: {}", session.getId(), e.getMessage());
        }
    }

    private void send(String text) throws IOException {
        if (!session.isOpen()) {
            throw new IOException("WebSocket session " + session.getId() + " is closed");
        }
        session.sendMessage(new TextMessage(text));
    }

    static String addressOf(InetSocketAddress address) {
        if (address == null) {
            return UNKNOWN_ADDRESS;
        }
        return address.getAddress() != null ? address.getAddress().getHostAddress() : address.getHostString();
    }
}
