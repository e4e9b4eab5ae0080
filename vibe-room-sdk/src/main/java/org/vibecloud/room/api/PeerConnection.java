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

package org.vibecloud.room.api;

import java.io.IOException;

/**
 * Transport handle of one live client connection. The signaling service only needs to identify
 * the connection, know where it comes from, push notifications to it and drop it.
 */
public interface PeerConnection {

    /**
     * @return identifier of the connection, unique among the live connections
     */
    String getId();

    /**
     * @return source address of the connection, used for the per-IP connection limit
     */
    String getRemoteAddress();

    /**
     * Pushes an event to the client.
     *
     * @param method name of the event (e.g. {@code peer-joined})
     * @param params event payload
     * @throws IOException if the transport could not write the message
     */
    void sendNotification(String method, Object params) throws IOException;

    /**
     * Closes the underlying transport. No protocol-level message is sent before closing.
     */
    void close();
}
