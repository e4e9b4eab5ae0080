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

package org.vibecloud.room.api.pojo;

/**
 * Sizes of the coordination state at one point in time.
 */
public class SignalingStats {
    private final int roomCount;
    private final int peerCount;
    private final int ipConnectionCount;

    public SignalingStats(int roomCount, int peerCount, int ipConnectionCount) {
        this.roomCount = roomCount;
        this.peerCount = peerCount;
        this.ipConnectionCount = ipConnectionCount;
    }

    public int getRoomCount() {
        return roomCount;
    }

    public int getPeerCount() {
        return peerCount;
    }

    /**
     * @return number of distinct source addresses holding at least one connection
     */
    public int getIpConnectionCount() {
        return ipConnectionCount;
    }
}
