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

package org.vibecloud.room.rest;

import com.fasterxml.jackson.databind.JsonNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;
import org.vibecloud.room.api.pojo.TurnCredential;
import org.vibecloud.room.interfaces.ICredentialIssuer;

/**
 * Issues TURN credentials outside of a signaling session, so that a client can refresh them before
 * they expire.
 */
@RestController
public class TurnCredentialsController {
    private final Logger log = LoggerFactory.getLogger(TurnCredentialsController.class);

    static final String USER_ID_REQUIRED = "User ID is required";
    static final String GENERATION_FAILED = "Failed to generate credentials";

    private final ICredentialIssuer credentialIssuer;

    public TurnCredentialsController(ICredentialIssuer credentialIssuer) {
        this.credentialIssuer = credentialIssuer;
    }

    @PostMapping("/api/turn/credentials")
    public ResponseEntity<Object> generate(@RequestBody(required = false) JsonNode body) {
        String userId = body == null ? null : text(body.get("userId"));
        if (userId == null || userId.trim().isEmpty()) {
            return ResponseEntity.badRequest().body(new ErrorResponse(USER_ID_REQUIRED));
        }
        Long ttl = ttlOf(body.get("ttl"));
        try {
            TurnCredential credential = ttl == null
                    ? credentialIssuer.generateCredentials(userId)
                    : credentialIssuer.generateCredentials(userId, ttl);
            return ResponseEntity.ok(credential);
        } catch (RuntimeException e) {
            log.error("Error generating TURN credentials for {}", userId, e);
            return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(new ErrorResponse(GENERATION_FAILED));
        }
    }

    // Number or numeric string up to MAX_TTL_SECONDS; null means the issuer's default
    private static Long ttlOf(JsonNode ttl) {
        if (ttl == null || ttl.isNull()) {
            return null;
        }
        long value;
        if (ttl.isNumber()) {
            value = ttl.asLong();
        } else if (ttl.isTextual()) {
            try {
                value = Long.parseLong(ttl.asText().trim());
            } catch (NumberFormatException e) {
                return null;
            }
        } else {
            return null;
        }
        return value > 0 && value <= ICredentialIssuer.MAX_TTL_SECONDS ? value : null;
    }

    private static String text(JsonNode node) {
        return node != null && node.isValueNode() && !node.isNull() ? node.asText() : null;
    }
}
