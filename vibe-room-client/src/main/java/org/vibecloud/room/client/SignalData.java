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

import com.fasterxml.jackson.databind.JsonNode;

/**
 * A signal relayed from another peer. The payload is passed through untouched.
 */
public class SignalData {
    private final String peerId;
    private final JsonNode signal;
    private final String type;

    public SignalData(String peerId, JsonNode signal, String type) {
        this.peerId = peerId;
        this.signal = signal;
        this.type = type;
    }

    /**
     * @return id of the sending peer
     */
    public String getPeerId() {
        return peerId;
    }

    public JsonNode getSignal() {
        return signal;
    }

    public String getType() {
        return type;
    }
}
