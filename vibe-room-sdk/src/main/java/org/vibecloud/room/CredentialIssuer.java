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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.vibecloud.room.api.pojo.TurnCredential;
import org.vibecloud.room.interfaces.ICredentialIssuer;

import javax.annotation.PostConstruct;
import javax.annotation.PreDestroy;
import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.MessageDigest;
import java.time.Clock;
import java.util.Arrays;
import java.util.Base64;
import java.util.List;

/**
 * Issues TURN credentials with the TURN REST API mechanism used by Coturn's
 * {@code use-auth-secret} mode. Nothing is stored: a credential is valid as long as its HMAC
 * matches and its expiry has not passed, so it can't be revoked before it expires.
 */
public class CredentialIssuer implements ICredentialIssuer {
    private final Logger log = LoggerFactory.getLogger(CredentialIssuer.class);

    public static final long DEFAULT_TTL_SECONDS = 86400;

    private static final String HMAC_ALGORITHM = "HmacSHA1";

    private final String host;
    private final int port;
    private final int tlsPort;
    private final String realm;
    private final byte[] secret;
    private final long defaultTtl;
    private final Clock clock;

    public CredentialIssuer(String host, int port, int tlsPort, String realm, String secret,
                            long defaultTtl, Clock clock) {
        if (secret == null || secret.isEmpty()) {
            throw new IllegalArgumentException("TURN auth secret must not be empty");
        }
        this.host = host;
        this.port = port;
        this.tlsPort = tlsPort;
        this.realm = realm;
        this.secret = secret.getBytes(StandardCharsets.UTF_8);
        this.defaultTtl = defaultTtl > 0 && defaultTtl <= MAX_TTL_SECONDS ? defaultTtl : DEFAULT_TTL_SECONDS;
        this.clock = clock;
    }

    @PostConstruct
    public void start() {
        log.info("Using external Coturn server at {}:{} (realm {})", host, port, realm);
    }

    @PreDestroy
    public void stop() {
        log.info("TURN service shutdown");
    }

    @Override
    public TurnCredential generateCredentials(final String identifier) {
        return generateCredentials(identifier, defaultTtl);
    }

    @Override
    public TurnCredential generateCredentials(final String identifier, final long ttlSeconds) {
        if (identifier == null || identifier.isEmpty()) {
            throw new IllegalArgumentException("A TURN identifier is required");
        }
        if (ttlSeconds <= 0 || ttlSeconds > MAX_TTL_SECONDS) {
            throw new IllegalArgumentException("TURN credential ttl out of range: " + ttlSeconds);
        }
        long expiresAt = clock.instant().getEpochSecond() + ttlSeconds;
        String username = expiresAt + ":" + identifier;
        String credential = sign(username);

        log.debug("Generated TURN credentials for {} valid for {} seconds", identifier, ttlSeconds);
        return new TurnCredential(username, credential, ttlSeconds, getUrls());
    }

    @Override
    public boolean verifyCredentials(final String username, final String credential) {
        if (username == null || credential == null) {
            return false;
        }
        String[] parts = username.split(":", 2);
        if (parts.length != 2 || parts[1].isEmpty()) {
            return false;
        }
        long expiry;
        try {
            expiry = Long.parseLong(parts[0]);
        } catch (NumberFormatException e) {
            return false;
        }
        if (expiry < clock.instant().getEpochSecond()) {
            log.debug("Expired TURN credentials for {}", parts[1]);
            return false;
        }
        byte[] expected = sign(username).getBytes(StandardCharsets.UTF_8);
        return MessageDigest.isEqual(expected, credential.getBytes(StandardCharsets.UTF_8));
    }

    /**
     * UDP, TCP-forced and TLS relay addresses of the configured TURN server.
     */
    public List<String> getUrls() {
        return Arrays.asList(
                "turn:" + host + ":" + port,
                "turn:" + host + ":" + port + "?transport=tcp",
                "turns:" + host + ":" + tlsPort);
    }

    public String getRealm() {
        return realm;
    }

    public long getDefaultTtl() {
        return defaultTtl;
    }

    private String sign(String username) {
        try {
            Mac mac = Mac.getInstance(HMAC_ALGORITHM);
            mac.init(new SecretKeySpec(secret, HMAC_ALGORITHM));
            byte[] digest = mac.doFinal(username.getBytes(StandardCharsets.UTF_8));
            return Base64.getEncoder().encodeToString(digest);
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException(HMAC_ALGORITHM + " is not available", e);
        }
    }
}
