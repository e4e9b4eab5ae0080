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
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.Test;
import org.vibecloud.room.api.pojo.Acknowledgement;
import org.vibecloud.room.api.pojo.PeerLeftEvent;
import org.vibecloud.room.api.request.JoinRoomRequest;
import org.vibecloud.room.api.request.Method;
import org.vibecloud.room.api.request.SignalRequest;
import org.vibecloud.room.api.request.SignalingRequest;
import org.vibecloud.room.exception.SignalingException;
import org.vibecloud.room.exception.SignalingException.Code;

import java.util.Map;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

public class JsonRpcCodecTest {
    private final ObjectMapper mapper = new ObjectMapper();
    private final JsonRpcCodec codec = new JsonRpcCodec(mapper);

    @Test
    public void decodesJoinRoomWithOptionalFields() {
        JsonRpcRequest rpc = codec.parse("{\"jsonrpc\":\"2.0\",\"id\":3,\"method\":\"join-room\",\"params\":"
                + "{\"roomId\":\"r1\",\"userId\":\"alice\",\"deviceId\":\"laptop\",\"isPrivate\":true,"
                + "\"metadata\":{\"topic\":\"standup\",\"size\":4}}}");
        assertTrue(rpc.hasId());
        assertEquals(3, rpc.getId().asInt());

        SignalingRequest request = codec.toSignalingRequest(rpc);
        assertEquals(Method.JOIN_ROOM, request.getMethod());
        JoinRoomRequest join = (JoinRoomRequest) request;
        assertEquals("r1", join.getRoomId());
        assertEquals("alice", join.getUserId());
        assertEquals("laptop", join.getDeviceId());
        assertTrue(join.isPrivate());
        Map<String, Object> metadata = join.getMetadata();
        assertEquals("standup", metadata.get("topic"));
        assertEquals(4, metadata.get("size"));
    }

    @Test
    public void missingOptionalFieldsDecodeAsDefaults() {
        JoinRoomRequest join = (JoinRoomRequest) codec.toSignalingRequest(
                codec.parse("{\"id\":1,\"method\":\"join-room\",\"params\":{\"userId\":\"alice\"}}"));
        assertNull(join.getRoomId());
        assertNull(join.getDeviceId());
        assertFalse(join.isPrivate());
        assertTrue(join.getMetadata() == null || join.getMetadata().isEmpty());
    }

    @Test
    public void signalPayloadIsKeptOpaque() throws Exception {
        JsonRpcRequest rpc = codec.parse("{\"jsonrpc\":\"2.0\",\"method\":\"signal\",\"params\":"
                + "{\"target\":\"p2\",\"type\":\"offer\",\"signal\":{\"sdp\":\"v=0\\r\\n\",\"nested\":[1,{\"a\":null}]}}}");
        assertFalse(rpc.hasId());

        SignalRequest signal = (SignalRequest) codec.toSignalingRequest(rpc);
        assertEquals("p2", signal.getTarget());
        assertEquals("offer", signal.getType());
        assertEquals(mapper.readTree("{\"sdp\":\"v=0\\r\\n\",\"nested\":[1,{\"a\":null}]}"), signal.getSignal());
    }

    @Test
    public void rejectsFramesThatAreNotJsonObjects() {
        assertInvalid("not json");
        assertInvalid("[1,2,3]");
        assertInvalid("\"join-room\"");
    }

    @Test
    public void missingMethodIsReportedAfterParsing() {
        JsonRpcRequest rpc = codec.parse("{\"jsonrpc\":\"2.0\",\"id\":9,\"params\":{}}");
        assertTrue(rpc.hasId());
        assertNull(rpc.getMethod());
        try {
            codec.toSignalingRequest(rpc);
            fail("A request without method must be rejected");
        } catch (SignalingException e) {
            assertEquals(Code.INVALID_MESSAGE_ERROR_CODE, e.getCode());
        }
    }

    @Test
    public void unknownMethodIsRejected() {
        try {
            codec.toSignalingRequest(codec.parse("{\"id\":1,\"method\":\"kick-peer\",\"params\":{}}"));
            fail("Unknown methods must be rejected");
        } catch (SignalingException e) {
            assertEquals(Code.UNKNOWN_METHOD_ERROR_CODE, e.getCode());
            assertEquals("Unknown method: kick-peer", e.getMessage());
        }
    }

    @Test
    public void structuredUserIdIsRejected() {
        try {
            codec.toSignalingRequest(codec.parse(
                    "{\"id\":1,\"method\":\"authenticate\",\"params\":{\"userId\":{\"name\":\"alice\"}}}"));
            fail("userId must be a scalar");
        } catch (SignalingException e) {
            assertEquals(Code.INVALID_MESSAGE_ERROR_CODE, e.getCode());
        }
    }

    @Test
    public void paramsMustBeAnObject() {
        try {
            codec.toSignalingRequest(codec.parse("{\"id\":1,\"method\":\"leave-room\",\"params\":[\"r1\"]}"));
            fail("Positional params are not supported");
        } catch (SignalingException e) {
            assertEquals(Code.INVALID_MESSAGE_ERROR_CODE, e.getCode());
        }
    }

    @Test
    public void encodesResponsesWithoutNullFields() throws Exception {
        JsonNode id = mapper.readTree("7");

        JsonNode ok = mapper.readTree(codec.encodeResponse(id, Acknowledgement.ok()));
        assertEquals("2.0", ok.get("jsonrpc").asText());
        assertEquals(7, ok.get("id").asInt());
        assertTrue(ok.get("result").get("success").asBoolean());
        assertFalse(ok.get("result").has("error"));

        JsonNode failed = mapper.readTree(codec.encodeResponse(id, Acknowledgement.failure("nope")));
        assertFalse(failed.get("result").get("success").asBoolean());
        assertEquals("nope", failed.get("result").get("error").asText());
    }

    @Test
    public void encodesNotificationsWithoutId() throws Exception {
        JsonNode pushed = mapper.readTree(codec.encodeNotification("peer-left", new PeerLeftEvent("p1", "alice")));
        assertFalse(pushed.has("id"));
        assertEquals("peer-left", pushed.get("method").asText());
        assertEquals("p1", pushed.get("params").get("peerId").asText());
        assertEquals("alice", pushed.get("params").get("userId").asText());
    }

    private void assertInvalid(String payload) {
        try {
            codec.parse(payload);
            fail("Expected '" + payload + "' to be rejected");
        } catch (SignalingException e) {
            assertEquals(Code.INVALID_MESSAGE_ERROR_CODE, e.getCode());
        }
    }
}
