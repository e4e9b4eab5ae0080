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

import org.junit.Assert;
import org.junit.Before;
import org.junit.Test;
import org.vibecloud.room.api.pojo.TurnCredential;

import java.time.Duration;
import java.time.Instant;
import java.util.Arrays;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

public class CredentialIssuerTest {

    private static final Instant START = Instant.ofEpochSecond(1_700_000_000L);

    private MutableClock clock;
    private CredentialIssuer issuer;

    @Before
    public void before() {
        clock = new MutableClock(START);
        issuer = new CredentialIssuer("turn.example.org", 3478, 5349, "vibe.local", "default-secret-key",
                CredentialIssuer.DEFAULT_TTL_SECONDS, clock);
    }

    @Test
    public void usernameCarriesExpiryAndIdentifier() {
        TurnCredential credential = issuer.generateCredentials("alice");

        assertEquals("1700086400:alice", credential.getUsername());
        assertEquals(86400, credential.getTtl());
        // base64(HMAC-SHA1("default-secret-key", "1700086400:alice"))
        assertEquals("EBtN6AVyDVn8Co4aaPOY9fTn95w=", credential.getCredential());
    }

    @Test
    public void urlsCoverUdpTcpAndTls() {
        TurnCredential credential = issuer.generateCredentials("alice", 60);

        assertEquals(Arrays.asList(
                "turn:turn.example.org:3478",
                "turn:turn.example.org:3478?transport=tcp",
                "turns:turn.example.org:5349"), credential.getUrls());
    }

    @Test
    public void freshCredentialsVerify() {
        TurnCredential credential = issuer.generateCredentials("u1", 600);

        assertTrue(issuer.verifyCredentials(credential.getUsername(), credential.getCredential()));
    }

    @Test
    public void identifiersWithColonsVerify() {
        TurnCredential credential = issuer.generateCredentials("did:vibe:abc", 600);

        assertEquals("1700000600:did:vibe:abc", credential.getUsername());
        assertTrue(issuer.verifyCredentials(credential.getUsername(), credential.getCredential()));
        assertFalse(issuer.verifyCredentials("1700000600:did:vibe:abd", credential.getCredential()));
    }

    @Test
    public void ttlOutsideTheAcceptedRangeIsRefused() {
        for (long ttl : new long[] {0, -1, CredentialIssuer.MAX_TTL_SECONDS + 1, Long.MAX_VALUE}) {
            try {
                issuer.generateCredentials("u1", ttl);
                Assert.fail("ttl " + ttl + " accepted");
            } catch (IllegalArgumentException e) {
                // expected
            }
        }
    }

    @Test
    public void credentialsExpire() {
        TurnCredential credential = issuer.generateCredentials("u1", 600);

        clock.advance(Duration.ofSeconds(600));
        assertTrue("still valid on the expiry second",
                issuer.verifyCredentials(credential.getUsername(), credential.getCredential()));

        clock.advance(Duration.ofSeconds(1));
        assertFalse(issuer.verifyCredentials(credential.getUsername(), credential.getCredential()));
    }

    @Test
    public void tamperedUsernameIsRejected() {
        TurnCredential credential = issuer.generateCredentials("u1", 600);
        String username = credential.getUsername();
        String tampered = username.substring(0, username.length() - 1) + "2";

        assertFalse(issuer.verifyCredentials(tampered, credential.getCredential()));
    }

    @Test
    public void tamperedExpiryIsRejected() {
        TurnCredential credential = issuer.generateCredentials("u1", 600);
        String username = credential.getUsername();
        char first = username.charAt(0);
        String tampered = (first == '9' ? '8' : (char) (first + 1)) + username.substring(1);

        assertFalse(issuer.verifyCredentials(tampered, credential.getCredential()));
    }

    @Test
    public void tamperedCredentialIsRejected() {
        TurnCredential credential = issuer.generateCredentials("u1", 600);
        String password = credential.getCredential();
        char first = password.charAt(0);
        String tampered = (first == 'A' ? 'B' : 'A') + password.substring(1);

        assertFalse(issuer.verifyCredentials(credential.getUsername(), tampered));
    }

    @Test
    public void otherSecretDoesNotVerify() {
        CredentialIssuer other = new CredentialIssuer("turn.example.org", 3478, 5349, "vibe.local", "another-secret",
                CredentialIssuer.DEFAULT_TTL_SECONDS, clock);
        TurnCredential credential = other.generateCredentials("u1");

        assertFalse(issuer.verifyCredentials(credential.getUsername(), credential.getCredential()));
    }

    @Test
    public void malformedInputNeverThrows() {
        assertFalse(issuer.verifyCredentials(null, "x"));
        assertFalse(issuer.verifyCredentials("1700086400:alice", null));
        assertFalse(issuer.verifyCredentials("", ""));
        assertFalse(issuer.verifyCredentials("alice", "EBtN6AVyDVn8Co4aaPOY9fTn95w="));
        assertFalse(issuer.verifyCredentials("soon:alice", "EBtN6AVyDVn8Co4aaPOY9fTn95w="));
        assertFalse(issuer.verifyCredentials("1700086400:alice:extra", "EBtN6AVyDVn8Co4aaPOY9fTn95w="));
    }

    @Test
    public void emptyIdentifierIsRefused() {
        try {
            issuer.generateCredentials("");
            Assert.fail("empty identifier accepted");
        } catch (IllegalArgumentException e) {
            // expected
        }
    }

    @Test(expected = IllegalArgumentException.class)
    public void emptySecretIsRefused() {
        new CredentialIssuer("localhost", 3478, 5349, "vibe.local", "", 86400, clock);
    }
}
