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

import org.junit.After;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.web.server.LocalServerPort;
import org.springframework.test.context.junit4.SpringRunner;
import org.vibecloud.room.client.PeerClient;
import org.vibecloud.room.client.PeerClientOptions;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

@RunWith(SpringRunner.class)
@SpringBootTest(classes = SignalingServerApp.class, webEnvironment = SpringBootTest.WebEnvironment.RANDOM_PORT,
        properties = {"server.address=127.0.0.1", "signaling.max-connections-per-ip=2"})
public class ConnectionLimitTest {
    private static final String LOCALHOST = "127.0.0.1";

    @LocalServerPort
    private int port;

    @Autowired
    private ConnectionLimiter connectionLimiter;

    private final List<PeerClient> clients = new ArrayList<>();

    @After
    public void tearDown() {
        for (PeerClient client : clients) {
            client.disconnect();
        }
    }

    @Test
    public void thirdConnectionFromTheSameAddressIsClosed() throws Exception {
        PeerClient first = client("alice");
        PeerClient second = client("bob");
        first.connect().get(5, TimeUnit.SECONDS);
        second.connect().get(5, TimeUnit.SECONDS);

        PeerClient third = client("mallory");
        try {
            third.connect().get(5, TimeUnit.SECONDS);
            fail("The third connection should have been refused");
        } catch (ExecutionException e) {
            // closed by the server before authenticate was answered
        }

        assertFalse(third.isConnected());
        assertTrue(first.isConnected());
        assertTrue(second.isConnected());
        awaitConnectionCount(2);

        first.disconnect();
        awaitConnectionCount(1);
        PeerClient fourth = client("carol");
        fourth.connect().get(5, TimeUnit.SECONDS);
        assertTrue(fourth.isConnected());
    }

    private void awaitConnectionCount(int expected) throws InterruptedException {
        long deadline = System.currentTimeMillis() + 5000;
        while (connectionLimiter.getConnectionCount(LOCALHOST) != expected && System.currentTimeMillis() < deadline) {
            Thread.sleep(20);
        }
        assertEquals(expected, connectionLimiter.getConnectionCount(LOCALHOST));
    }

    private PeerClient client(String userId) {
        PeerClient client = new PeerClient(new PeerClientOptions("http://" + LOCALHOST + ":" + port, userId, "test"));
        clients.add(client);
        return client;
    }
}
