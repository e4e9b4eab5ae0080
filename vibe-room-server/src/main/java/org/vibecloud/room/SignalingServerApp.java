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

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.vibecloud.room.config.SignalingProperties;
import org.vibecloud.room.config.TurnProperties;

/**
 * Signaling server: WebSocket signaling on {@code signaling.path} plus the REST routes for TURN
 * credentials, health and stats.
 */
@SpringBootApplication
@EnableConfigurationProperties({TurnProperties.class, SignalingProperties.class})
public class SignalingServerApp {

    public static void main(String[] args) {
        SpringApplication.run(SignalingServerApp.class, args);
    }
}
