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

/**
 * A JSON-RPC 2.0 message received from a client. Requests without id are notifications and get no
 * response.
 */
public class JsonRpcRequest {
    private final JsonNode id;
    private final String method;
    private final JsonNode params;

    public JsonRpcRequest(JsonNode id, String method, JsonNode params) {
        this.id = id;
        this.method = method;
        this.params = params;
    }

    public JsonNode getId() {
        return id;
    }

    public boolean hasId() {
        return id != null && !id.isNull();
    }

    public String getMethod() {
        return method;
    }

    public JsonNode getParams() {
        return params;
    }

    @Override
    public String toString() {
        return "JsonRpcRequest{id=" + id + ", method='" + method + "'}";
    }
}
