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

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

public class JoinRoomRequest extends SignalingRequest {
    private final String roomId;
    private final String userId;
    private final String deviceId;
    private final boolean isPrivate;
    private final Map<String, Object> metadata;

    /**
     * @param roomId room to join; null asks for a freshly generated room
     */
    public JoinRoomRequest(String roomId, String userId, String deviceId, boolean isPrivate,
                           Map<String, Object> metadata) {
        this.roomId = roomId;
        this.userId = userId;
        this.deviceId = deviceId;
        this.isPrivate = isPrivate;
        this.metadata = metadata == null ? Collections.emptyMap()
                : Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
    }

    public JoinRoomRequest(String roomId, String userId, String deviceId) {
        this(roomId, userId, deviceId, false, null);
    }

    @Override
    public Method getMethod() {
        return Method.JOIN_ROOM;
    }

    public String getRoomId() {
        return roomId;
    }

    public String getUserId() {
        return userId;
    }

    public String getDeviceId() {
        return deviceId;
    }

    public boolean isPrivate() {
        return isPrivate;
    }

    public Map<String, Object> getMetadata() {
        return metadata;
    }
}
