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

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.After;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.web.server.LocalServerPort;
import org.springframework.test.context.junit4.SpringRunner;
import org.springframework.web.client.RestTemplate;
import org.vibecloud.room.client.JoinedRoom;
import org.vibecloud.room.client.PeerClient;
import org.vibecloud.room.client.PeerClientOptions;
import org.vibecloud.room.client.RemotePeer;
import org.vibecloud.room.client.SignalData;
import org.vibecloud.room.client.TurnCredentials;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNotEquals;
import static org.junit.Assert.assertNotNull;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;

@RunWith(SpringRunner.class)
@SpringBootTest(classes = SignalingServerApp.class, webEnvironment = SpringBootTest.WebEnvironment.RANDOM_PORT,
        properties = {"server.address=127.0.0.1", "turn.host=turn.test", "turn.auth-secret=integration-secret"})
public class SignalingServerTest {
    private static final long TIMEOUT_SECONDS = 5;

    @LocalServerPort
    private int port;

    @Autowired
    private ConnectionRegistry registry;

    @Autowired
    private CredentialIssuer credentialIssuer;

    private final List<PeerClient> clients = new ArrayList<>();

    @After
    public void tearDown() {
        for (PeerClient client : clients) {
            client.disconnect();
        }
    }

    @Test
    public void healthAndServiceInfoAreServed() {
        RestTemplate rest = new RestTemplate();
        JsonNode health = rest.getForObject(baseUrl() + "/health", JsonNode.class);
        assertEquals("healthy", health.get("status").asText());

        JsonNode info = rest.getForObject(baseUrl() + "/", JsonNode.class);
        assertEquals("vibe-cloud", info.get("service").asText());
        assertEquals("running", info.get("status").asText());
    }

    @Test
    public void secondPeerIsAnnouncedToTheFirstAndSeesIt() throws Exception {
        PeerClient alice = connected("alice", "laptop");
        BlockingQueue<RemotePeer> aliceJoins = new LinkedBlockingQueue<>();
        alice.onPeerJoined(aliceJoins::add);
        JoinedRoom aliceRoom = alice.joinRoom("standup").get(TIMEOUT_SECONDS, TimeUnit.SECONDS);
        assertTrue(aliceRoom.getPeers().isEmpty());

        PeerClient bob = connected("bob", "phone");
        JoinedRoom bobRoom = bob.joinRoom("standup").get(TIMEOUT_SECONDS, TimeUnit.SECONDS);

        assertEquals("standup", bobRoom.getRoomId());
        assertEquals(Collections.singletonList(new RemotePeer(aliceRoom.getPeerId(), "alice", "laptop")),
                bobRoom.getPeers());

        RemotePeer announced = aliceJoins.poll(TIMEOUT_SECONDS, TimeUnit.SECONDS);
        assertEquals(new RemotePeer(bobRoom.getPeerId(), "bob", "phone"), announced);
        assertNull(aliceJoins.poll(200, TimeUnit.MILLISECONDS));

        TurnCredentials credentials = bobRoom.getTurnCredentials();
        assertTrue(credentials.getUsername().endsWith(":bob"));
        assertTrue(credentialIssuer.verifyCredentials(credentials.getUsername(), credentials.getCredential()));
        assertEquals("turn:turn.test:3478", credentials.getUrls().get(0));
    }

    @Test
    public void signalsAreRelayedBetweenPeers() throws Exception {
        PeerClient alice = connected("alice", "laptop");
        PeerClient bob = connected("bob", "phone");
        BlockingQueue<SignalData> bobSignals = new LinkedBlockingQueue<>();
        bob.onSignal(bobSignals::add);
        JoinedRoom aliceRoom = alice.joinRoom("pairing").get(TIMEOUT_SECONDS, TimeUnit.SECONDS);
        JoinedRoom bobRoom = bob.joinRoom("pairing").get(TIMEOUT_SECONDS, TimeUnit.SECONDS);

        JsonNode offer = new ObjectMapper().readTree("{\"type\":\"offer\",\"sdp\":\"v=0\\r\\no=- 1 2 IN IP4 0.0.0.0\"}");
        alice.signal(bobRoom.getPeerId(), offer, "offer");

        SignalData received = bobSignals.poll(TIMEOUT_SECONDS, TimeUnit.SECONDS);
        assertNotNull(received);
        assertEquals(aliceRoom.getPeerId(), received.getPeerId());
        assertEquals("offer", received.getType());
        assertEquals(offer, received.getSignal());
    }

    @Test
    public void disconnectIsAnnouncedAndLaterSignalsAreDropped() throws Exception {
        PeerClient alice = connected("alice", "laptop");
        PeerClient bob = connected("bob", "phone");
        BlockingQueue<String> aliceLeaves = new LinkedBlockingQueue<>();
        alice.onPeerLeft(aliceLeaves::add);
        alice.joinRoom("farewell").get(TIMEOUT_SECONDS, TimeUnit.SECONDS);
        JoinedRoom bobRoom = bob.joinRoom("farewell").get(TIMEOUT_SECONDS, TimeUnit.SECONDS);

        bob.disconnect();

        assertEquals(bobRoom.getPeerId(), aliceLeaves.poll(TIMEOUT_SECONDS, TimeUnit.SECONDS));
        assertNull(aliceLeaves.poll(200, TimeUnit.MILLISECONDS));
        assertTrue(alice.getPeers().isEmpty());

        alice.signal(bobRoom.getPeerId(), "late answer", "answer");
        alice.leaveRoom().get(TIMEOUT_SECONDS, TimeUnit.SECONDS);
        assertTrue(alice.isConnected());
        assertNotNull(registry.getRoom("farewell"));
    }

    @Test
    public void roomsWithoutIdGetFreshIds() throws Exception {
        PeerClient alice = connected("alice", "laptop");
        PeerClient bob = connected("bob", "phone");

        String first = alice.joinRoom(null).get(TIMEOUT_SECONDS, TimeUnit.SECONDS).getRoomId();
        String second = bob.joinRoom(null).get(TIMEOUT_SECONDS, TimeUnit.SECONDS).getRoomId();

        assertNotNull(first);
        assertNotEquals(first, second);
    }

    @Test
    public void credentialsCanBeRefreshedOverHttp() throws Exception {
        PeerClient alice = client("alice", "laptop");

        TurnCredentials credentials = alice.refreshTurnCredentials().get(TIMEOUT_SECONDS, TimeUnit.SECONDS);

        assertTrue(credentials.getUsername().matches("^\\d+:alice$"));
        assertEquals(86400, credentials.getTtl());
        assertTrue(credentialIssuer.verifyCredentials(credentials.getUsername(), credentials.getCredential()));
        assertEquals(4, alice.getWebRTCConfig().getIceServers().size());
    }

    private PeerClient connected(String userId, String deviceId) throws Exception {
        PeerClient client = client(userId, deviceId);
        client.connect().get(TIMEOUT_SECONDS, TimeUnit.SECONDS);
        return client;
    }

    private PeerClient client(String userId, String deviceId) {
        PeerClient client = new PeerClient(new PeerClientOptions(baseUrl(), userId, deviceId));
        clients.add(client);
        return client;
    }

    private String baseUrl() {
        return "http://127.0.0.1:" + port;
    }
}
