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

import org.junit.Before;
import org.junit.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.scheduling.TaskScheduler;
import org.vibecloud.room.api.request.JoinRoomRequest;

import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.ScheduledFuture;

import static org.junit.Assert.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

public class RoomReaperTest {

    private static final Duration TIMEOUT = Duration.ofHours(1);

    private MutableClock clock;
    private ConnectionRegistry registry;
    private SignalingService service;
    private TaskScheduler scheduler;
    private ScheduledFuture<?> future;
    private RoomReaper reaper;

    @Before
    public void before() {
        clock = new MutableClock(Instant.parse("2024-01-01T00:00:00Z"));
        registry = new ConnectionRegistry(clock);
        CredentialIssuer issuer = new CredentialIssuer("localhost", 3478, 5349, "vibe.local", "secret", 86400, clock);
        service = new SignalingService(registry, issuer, new ConnectionLimiter(50), clock);
        scheduler = mock(TaskScheduler.class);
        future = mock(ScheduledFuture.class);
        doReturn(future).when(scheduler).scheduleAtFixedRate(any(Runnable.class), any(Duration.class));
        reaper = new RoomReaper(registry, scheduler, TIMEOUT);
    }

    @Test
    public void schedulesEveryHalfTimeoutAndCancelsOnStop() {
        reaper.start();
        reaper.start();

        verify(scheduler, times(1)).scheduleAtFixedRate(any(Runnable.class), eq(Duration.ofMinutes(30)));
        assertTrue(reaper.isRunning());

        reaper.stop();
        verify(future).cancel(false);
        assertFalse(reaper.isRunning());
    }

    @Test
    public void scheduledTaskSweeps() {
        ArgumentCaptor<Runnable> task = ArgumentCaptor.forClass(Runnable.class);
        reaper.start();
        verify(scheduler).scheduleAtFixedRate(task.capture(), any(Duration.class));

        registry.createOrGetRoom("abandoned", "alice", false, null);
        clock.advance(TIMEOUT.plusSeconds(1));
        task.getValue().run();

        assertEquals(0, registry.getRoomCount());
    }

    @Test
    public void emptiedRoomStaysUntilOlderThanTimeout() {
        RecordingConnection alice = new RecordingConnection("c1", "10.0.0.1");
        service.onConnect(alice);
        service.joinRoom("c1", new JoinRoomRequest("lobby", "alice", "laptop"));
        service.onDisconnect("c1");

        assertEquals("room survives its last peer", 1, service.getStats().getRoomCount());
        assertEquals(0, reaper.sweep());

        clock.advance(TIMEOUT);
        assertEquals(0, reaper.sweep());
        assertEquals(1, service.getStats().getRoomCount());

        clock.advance(Duration.ofSeconds(1));
        assertEquals(1, reaper.sweep());
        assertEquals(0, service.getStats().getRoomCount());
    }

    @Test
    public void occupiedRoomIsNeverReaped() {
        service.onConnect(new RecordingConnection("c1", "10.0.0.1"));
        service.joinRoom("c1", new JoinRoomRequest("lobby", "alice", "laptop"));

        clock.advance(TIMEOUT.multipliedBy(10));

        assertEquals(0, reaper.sweep());
        assertNotNull(registry.getRoom("lobby"));
    }

    @Test(expected = IllegalArgumentException.class)
    public void zeroTimeoutIsRefused() {
        new RoomReaper(registry, scheduler, Duration.ZERO);
    }
}
