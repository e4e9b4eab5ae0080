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

package org.vibecloud.room;

import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Counts the open connections per source address. An address entry exists only while it holds at
 * least one connection.
 */
public class ConnectionLimiter {
    // Address -> open connections
    private final ConcurrentMap<String, Integer> counters = new ConcurrentHashMap<>();

    private final int maxConnectionsPerIp;

    public ConnectionLimiter(int maxConnectionsPerIp) {
        this.maxConnectionsPerIp = maxConnectionsPerIp;
    }

    /**
     * Counts a new connection from the address.
     *
     * @return false if the address is now over the limit; the connection is counted anyway and
     * must be released when it closes
     */
    public boolean acquire(String address) {
        int current = counters.merge(address, 1, Integer::sum);
        return current <= maxConnectionsPerIp;
    }

    public void release(String address) {
        counters.computeIfPresent(address, (key, count) -> count <= 1 ? null : count - 1);
    }

    public int getConnectionCount(String address) {
        return counters.getOrDefault(address, 0);
    }

    public int getTrackedAddressCount() {
        return counters.size();
    }

    public int getMaxConnectionsPerIp() {
        return maxConnectionsPerIp;
    }
}
