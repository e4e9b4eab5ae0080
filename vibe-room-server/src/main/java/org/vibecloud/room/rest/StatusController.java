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

import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;
import org.vibecloud.room.SignalingService;
import org.vibecloud.room.api.pojo.SignalingStats;
import org.vibecloud.room.config.SignalingProperties;

import java.lang.management.ManagementFactory;
import java.lang.management.MemoryMXBean;
import java.lang.management.MemoryUsage;
import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.Map;

@RestController
public class StatusController {

    private final SignalingService signalingService;
    private final SignalingProperties properties;
    private final Clock clock;

    public StatusController(SignalingService signalingService, SignalingProperties properties, Clock clock) {
        this.signalingService = signalingService;
        this.properties = properties;
        this.clock = clock;
    }

    @GetMapping("/")
    public Map<String, Object> info() {
        Map<String, Object> info = new LinkedHashMap<>();
        info.put("service", properties.getServiceName());
        info.put("status", "running");
        info.put("version", properties.getVersion());
        return info;
    }

    @GetMapping("/health")
    public Map<String, Object> health() {
        Map<String, Object> health = new LinkedHashMap<>();
        health.put("status", "healthy");
        return health;
    }

    @GetMapping("/api/stats")
    public Map<String, Object> stats() {
        SignalingStats current = signalingService.getStats();
        Map<String, Object> stats = new LinkedHashMap<>();
        stats.put("roomCount", current.getRoomCount());
        stats.put("peerCount", current.getPeerCount());
        stats.put("ipConnectionCount", current.getIpConnectionCount());
        stats.put("uptime", ManagementFactory.getRuntimeMXBean().getUptime() / 1000.0);
        stats.put("memoryUsage", memoryUsage());
        stats.put("timestamp", clock.instant().toString());
        return stats;
    }

    // Bytes
    private static Map<String, Long> memoryUsage() {
        MemoryMXBean memory = ManagementFactory.getMemoryMXBean();
        MemoryUsage heap = memory.getHeapMemoryUsage();
        Map<String, Long> usage = new LinkedHashMap<>();
        usage.put("heapTotal", heap.getCommitted());
        usage.put("heapUsed", heap.getUsed());
        usage.put("heapMax", heap.getMax());
        usage.put("nonHeapUsed", memory.getNonHeapMemoryUsage().getUsed());
        return usage;
    }
}
