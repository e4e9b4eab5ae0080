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

package org.vibecloud.room.api.request;

public class SignalRequest extends SignalingRequest {
    private final String target;
    private final Object signal;
    private final String type;

    /**
     * @param target peer id of the receiver
     * @param signal opaque negotiation payload (SDP, ICE candidate...)
     * @param type   free-form kind of the payload, e.g. {@code offer}
     */
    public SignalRequest(String target, Object signal, String type) {
        this.target = target;
        this.signal = signal;
        this.type = type;
    }

    @Override
    public Method getMethod() {
        return Method.SIGNAL;
    }

    public String getTarget() {
        return target;
    }

    public Object getSignal() {
        return signal;
    }

    public String getType() {
        return type;
    }
}
