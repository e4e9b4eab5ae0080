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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.servlet.config.annotation.CorsRegistry;
import org.springframework.web.servlet.config.annotation.WebMvcConfigurer;
import org.springframework.web.socket.config.annotation.EnableWebSocket;
import org.springframework.web.socket.config.annotation.WebSocketConfigurer;
import org.springframework.web.socket.config.annotation.WebSocketHandlerRegistry;
import org.springframework.web.socket.server.standard.ServletServerContainerFactoryBean;
import org.vibecloud.room.rpc.SignalingJsonRpcHandler;

/**
 * Exposes the signaling protocol on a plain WebSocket endpoint and opens the REST routes to
 * cross-origin callers.
 */
@Configuration
@EnableWebSocket
public class WebSocketConfig implements WebSocketConfigurer, WebMvcConfigurer {
    private final Logger log = LoggerFactory.getLogger(WebSocketConfig.class);

    private final SignalingJsonRpcHandler signalingHandler;
    private final SignalingProperties properties;

    public WebSocketConfig(SignalingJsonRpcHandler signalingHandler, SignalingProperties properties) {
        this.signalingHandler = signalingHandler;
        this.properties = properties;
    }

    @Override
    public void registerWebSocketHandlers(WebSocketHandlerRegistry registry) {
        registry.addHandler(signalingHandler, properties.getPath())
                .setAllowedOriginPatterns(properties.getAllowedOrigins());
        log.info("Signaling server initialized on {}", properties.getPath());
    }

    @Override
    public void addCorsMappings(CorsRegistry registry) {
        registry.addMapping("/**")
                .allowedOriginPatterns(properties.getAllowedOrigins())
                .allowedMethods("GET", "POST");
    }

    @Bean
    public ServletServerContainerFactoryBean createWebSocketContainer() {
        ServletServerContainerFactoryBean container = new ServletServerContainerFactoryBean();
        // SDP offers with many candidates do not fit the container default
        container.setMaxTextMessageBufferSize(properties.getMaxTextMessageSize());
        return container;
    }
}
