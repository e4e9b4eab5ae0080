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
import org.springframework.scheduling.TaskScheduler;

import javax.annotation.PostConstruct;
import javax.annotation.PreDestroy;
import java.time.Duration;
import java.util.concurrent.ScheduledFuture;

/**
 * Periodically removes the rooms that stayed empty for longer than the room timeout. The sweep
 * runs every half timeout, so an empty room may linger up to one timeout after its last peer left.
 */
public class RoomReaper {
    private final Logger log = LoggerFactory.getLogger(RoomReaper.class);

    private final ConnectionRegistry registry;
    private final TaskScheduler scheduler;
    private final Duration roomTimeout;

    private ScheduledFuture<?> task;

    public RoomReaper(ConnectionRegistry registry, TaskScheduler scheduler, Duration roomTimeout) {
        if (roomTimeout.isNegative() || roomTimeout.isZero()) {
            throw new IllegalArgumentException("Room timeout must be positive: " + roomTimeout);
        }
        this.registry = registry;
        this.scheduler = scheduler;
        this.roomTimeout = roomTimeout;
    }

    @PostConstruct
    public synchronized void start() {
        if (task != null) {
            return;
        }
        Duration interval = getSweepInterval();
        task = scheduler.scheduleAtFixedRate(this::sweepSafely, interval);
        log.info("Room reaper started, timeout {} ms, sweeping every {} ms", roomTimeout.toMillis(),
                interval.toMillis());
    }

    @PreDestroy
    public synchronized void stop() {
        if (task != null) {
            task.cancel(false);
            task = null;
            log.info("Room reaper stopped");
        }
    }

    public synchronized boolean isRunning() {
        return task != null;
    }

    /**
     * Runs one sweep now.
     *
     * @return number of rooms removed
     */
    public int sweep() {
        int removed = registry.removeStaleRooms(roomTimeout);
        if (removed > 0) {
            log.info("Cleaned up {} inactive rooms", removed);
        }
        return removed;
    }

    public Duration getRoomTimeout() {
        return roomTimeout;
    }

    public Duration getSweepInterval() {
        Duration half = roomTimeout.dividedBy(2);
        return half.isZero() ? Duration.ofMillis(1) : half;
    }

    private void sweepSafely() {
        try {
            sweep();
        } catch (RuntimeException e) {
            // an exception would cancel the periodic task
            log.error("Error while removing inactive rooms", e);
        }
    }
}
