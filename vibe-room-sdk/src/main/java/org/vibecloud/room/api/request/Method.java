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

/**
 * Client to server methods of the signaling protocol.
 */
public enum Method {
    AUTHENTICATE("authenticate"),
    JOIN_ROOM("join-room"),
    SIGNAL("signal"),
    LEAVE_ROOM("leave-room");

    private final String wireName;

    Method(String wireName) {
        this.wireName = wireName;
    }

    public String getWireName() {
        return wireName;
    }

    /**
     * @return the method with the given wire name, or null if there is none
     */
    public static Method fromWireName(String wireName) {
        for (Method method : values()) {
            if (method.wireName.equals(wireName)) {
                return method;
            }
        }
        return null;
    }
}
