package com.odin.peer_mesh_service.service;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.ArrayList;
import java.util.List;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import com.odin.peer_mesh_service.enums.TaskPurpose;
import com.odin.peer_mesh_service.support.ManualControlLoop;

class ScheduledTaskTableTest {

    private ManualControlLoop loop;
    private ScheduledTaskTable tasks;
    private List<String> fired;

    @BeforeEach
    void setUp() {
        loop = new ManualControlLoop();
        tasks = new ScheduledTaskTable(loop);
        fired = new ArrayList<>();
    }

    @Test
    void runsAfterDelay() {
        tasks.schedule("p1", TaskPurpose.RECONNECT, 1000, () -> fired.add("reconnect"));

        loop.advance(999);
        assertThat(fired).isEmpty();
        assertThat(tasks.isScheduled("p1", TaskPurpose.RECONNECT)).isTrue();

        loop.advance(1);
        assertThat(fired).containsExactly("reconnect");
        assertThat(tasks.isScheduled("p1", TaskPurpose.RECONNECT)).isFalse();
    }

    @Test
    void schedulingSameKeySupersedesOlderTask() {
        tasks.schedule("p1", TaskPurpose.JOIN_RETRY, 100, () -> fired.add("first"));
        tasks.schedule("p1", TaskPurpose.JOIN_RETRY, 500, () -> fired.add("second"));

        loop.advance(1000);

        assertThat(fired).containsExactly("second");
    }

    @Test
    void differentPurposesForSamePeerAreIndependent() {
        tasks.schedule("p1", TaskPurpose.RECONNECT, 100, () -> fired.add("reconnect"));
        tasks.schedule("p1", TaskPurpose.TRANSITION, 100, () -> fired.add("transition"));

        loop.advance(100);

        assertThat(fired).containsExactlyInAnyOrder("reconnect", "transition");
    }

    @Test
    void cancelledTaskNeverRuns() {
        tasks.schedule("p1", TaskPurpose.REMOVAL, 100, () -> fired.add("removal"));

        assertThat(tasks.cancel("p1", TaskPurpose.REMOVAL)).isTrue();
        assertThat(tasks.cancel("p1", TaskPurpose.REMOVAL)).isFalse();
        loop.advance(200);

        assertThat(fired).isEmpty();
    }

    @Test
    void cancelAllOnlyTouchesThatPeer() {
        tasks.schedule("p1", TaskPurpose.RECONNECT, 100, () -> fired.add("p1-reconnect"));
        tasks.schedule("p1", TaskPurpose.TRANSITION, 100, () -> fired.add("p1-transition"));
        tasks.schedule("p2", TaskPurpose.RECONNECT, 100, () -> fired.add("p2-reconnect"));

        tasks.cancelAll("p1");
        loop.advance(100);

        assertThat(fired).containsExactly("p2-reconnect");
    }

    @Test
    void cancelEverythingEmptiesTable() {
        tasks.schedule("p1", TaskPurpose.RECONNECT, 100, () -> fired.add("a"));
        tasks.schedule("p2", TaskPurpose.RECONNECT, 100, () -> fired.add("b"));

        tasks.cancelEverything();
        loop.advance(100);

        assertThat(tasks.size()).isZero();
        assertThat(fired).isEmpty();
    }

    @Test
    void taskMayRescheduleItsOwnKey() {
        int[] runs = {0};
        Runnable[] retry = new Runnable[1];
        retry[0] = () -> {
            runs[0]++;
            if (runs[0] < 3) {
                tasks.schedule("p1", TaskPurpose.JOIN_RETRY, 3000, retry[0]);
            }
        };
        tasks.schedule("p1", TaskPurpose.JOIN_RETRY, 3000, retry[0]);

        loop.advance(20_000);

        assertThat(runs[0]).isEqualTo(3);
        assertThat(tasks.isScheduled("p1", TaskPurpose.JOIN_RETRY)).isFalse();
    }
}
