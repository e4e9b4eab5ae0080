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

package org.vibecloud.room.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;
import org.vibecloud.room.ConnectionLimiter;
import org.vibecloud.room.ConnectionRegistry;
import org.vibecloud.room.CredentialIssuer;
import org.vibecloud.room.RoomReaper;
import org.vibecloud.room.SignalingService;
import org.vibecloud.room.rpc.JsonRpcCodec;
import org.vibecloud.room.rpc.SignalingJsonRpcHandler;

import java.time.Clock;
import java.time.Duration;

/**
 * Wires the signaling core from the {@code turn.*} and {@code signaling.*} settings.
 */
@Configuration
public class SignalingConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public CredentialIssuer credentialIssuer(TurnProperties turn, Clock clock) {
        return new CredentialIssuer(turn.getHost(), turn.getPort(), turn.getTlsPort(), turn.getRealm(),
                turn.getAuthSecret(), turn.getDefaultTtl(), clock);
    }

    @Bean
    public ConnectionRegistry connectionRegistry(Clock clock) {
        return new ConnectionRegistry(clock);
    }

    @Bean
    public ConnectionLimiter connectionLimiter(SignalingProperties signaling) {
        return new ConnectionLimiter(signaling.getMaxConnectionsPerIp());
    }

    @Bean
    public SignalingService signalingService(ConnectionRegistry registry, CredentialIssuer credentialIssuer,
                                             ConnectionLimiter connectionLimiter, Clock clock) {
        return new SignalingService(registry, credentialIssuer, connectionLimiter, clock);
    }

    @Bean
    public ThreadPoolTaskScheduler roomReaperScheduler() {
        ThreadPoolTaskScheduler scheduler = new ThreadPoolTaskScheduler();
        scheduler.setPoolSize(1);
        scheduler.setThreadNamePrefix("room-reaper-");
        scheduler.setDaemon(true);
        return scheduler;
    }

    // roomReaperScheduler() resolves to the singleton bean, the websocket support registers its own scheduler
    @Bean
    public RoomReaper roomReaper(ConnectionRegistry registry, SignalingProperties signaling) {
        return new RoomReaper(registry, roomReaperScheduler(), Duration.ofMillis(signaling.getRoomTimeout()));
    }

    @Bean
    public JsonRpcCodec jsonRpcCodec(ObjectMapper objectMapper) {
        return new JsonRpcCodec(objectMapper);
    }

    @Bean
    public SignalingJsonRpcHandler signalingJsonRpcHandler(SignalingService signalingService, JsonRpcCodec codec) {
        return new SignalingJsonRpcHandler(signalingService, codec);
    }
}
