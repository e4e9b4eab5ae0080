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

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.NullNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.vibecloud.room.api.pojo.Acknowledgement;
import org.vibecloud.room.api.request.AuthenticateRequest;
import org.vibecloud.room.api.request.JoinRoomRequest;
import org.vibecloud.room.api.request.LeaveRoomRequest;
import org.vibecloud.room.api.request.Method;
import org.vibecloud.room.api.request.SignalRequest;
import org.vibecloud.room.api.request.SignalingRequest;
import org.vibecloud.room.exception.SignalingException;
import org.vibecloud.room.exception.SignalingException.Code;

import java.util.Map;

/**
 * Converts between WebSocket text frames in JSON-RPC 2.0 framing and the typed signaling
 * requests. Decoding validates the shape of each field once; the services downstream only see
 * typed values.
 */
public class JsonRpcCodec {
    public static final String JSON_RPC_VERSION = "2.0";

    private static final TypeReference<Map<String, Object>> METADATA_TYPE =
            new TypeReference<Map<String, Object>>() {
            };

    private final ObjectMapper mapper;

    public JsonRpcCodec(ObjectMapper mapper) {
        this.mapper = mapper.copy().setSerializationInclusion(JsonInclude.Include.NON_NULL);
    }

    /**
     * Reads the JSON-RPC envelope. Only the framing is checked here so that the id of a request
     * with bad fields can still be answered.
     *
     * @throws SignalingException if the frame is not a JSON object
     */
    public JsonRpcRequest parse(String payload) {
        JsonNode root;
        try {
            root = mapper.readTree(payload);
        } catch (JsonProcessingException e) {
            throw new SignalingException(Code.INVALID_MESSAGE_ERROR_CODE, "Message is not valid JSON", e);
        }
        if (root == null || !root.isObject()) {
            throw new SignalingException(Code.INVALID_MESSAGE_ERROR_CODE, "Message must be a JSON object");
        }
        JsonNode method = root.get("method");
        return new JsonRpcRequest(root.get("id"), method != null && method.isTextual() ? method.asText() : null,
                root.get("params"));
    }

    /**
     * @throws SignalingException if the method is missing or unknown, or a field has the wrong type
     */
    public SignalingRequest toSignalingRequest(JsonRpcRequest request) {
        if (request.getMethod() == null) {
            throw new SignalingException(Code.INVALID_MESSAGE_ERROR_CODE, "Message has no method");
        }
        Method method = Method.fromWireName(request.getMethod());
        if (method == null) {
            throw new SignalingException(Code.UNKNOWN_METHOD_ERROR_CODE, "Unknown method: " + request.getMethod());
        }
        JsonNode params = request.getParams();
        if (params == null || params.isNull()) {
            params = JsonNodeFactory.instance.objectNode();
        } else if (!params.isObject()) {
            throw new SignalingException(Code.INVALID_MESSAGE_ERROR_CODE, "Params must be a JSON object");
        }
        switch (method) {
            case AUTHENTICATE:
                return new AuthenticateRequest(text(params, "userId"), text(params, "deviceId"));
            case JOIN_ROOM:
                return new JoinRoomRequest(text(params, "roomId"), text(params, "userId"), text(params, "deviceId"),
                        bool(params, "isPrivate"), metadata(params));
            case SIGNAL:
                JsonNode signal = params.get("signal");
                return new SignalRequest(text(params, "target"), signal == null ? NullNode.getInstance() : signal,
                        text(params, "type"));
            case LEAVE_ROOM:
                return new LeaveRoomRequest(text(params, "roomId"));
            default:
                throw new SignalingException(Code.UNKNOWN_METHOD_ERROR_CODE, "Unknown method: " + method);
        }
    }

    public String encodeResponse(JsonNode id, Acknowledgement result) {
        ObjectNode message = envelope();
        message.set("id", id);
        message.set("result", mapper.valueToTree(result));
        return write(message);
    }

    public String encodeNotification(String method, Object params) {
        ObjectNode message = envelope();
        message.put("method", method);
        message.set("params", mapper.valueToTree(params));
        return write(message);
    }

    private ObjectNode envelope() {
        ObjectNode message = mapper.createObjectNode();
        message.put("jsonrpc", JSON_RPC_VERSION);
        return message;
    }

    private String write(ObjectNode message) {
        try {
            return mapper.writeValueAsString(message);
        } catch (JsonProcessingException e) {
            throw new SignalingException(Code.GENERIC_ERROR_CODE, "Could not serialize message", e);
        }
    }

    private static String text(JsonNode params, String field) {
        JsonNode value = params.get(field);
        if (value == null || value.isNull()) {
            return null;
        }
        if (!value.isValueNode()) {
            throw new SignalingException(Code.INVALID_MESSAGE_ERROR_CODE, "Field '" + field + "' must be a string");
        }
        return value.asText();
    }

    private static boolean bool(JsonNode params, String field) {
        JsonNode value = params.get(field);
        return value != null && value.asBoolean(false);
    }

    private Map<String, Object> metadata(JsonNode params) {
        JsonNode value = params.get("metadata");
        if (value == null || value.isNull()) {
            return null;
        }
        if (!value.isObject()) {
            throw new SignalingException(Code.INVALID_MESSAGE_ERROR_CODE, "Field 'metadata' must be an object");
        }
        return mapper.convertValue(value, METADATA_TYPE);
    }
}
