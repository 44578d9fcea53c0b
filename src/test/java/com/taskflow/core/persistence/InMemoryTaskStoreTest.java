package com.taskflow.core.persistence;

import com.taskflow.core.TestHarness;
import com.taskflow.core.TestTasks;
import com.taskflow.core.model.ChangelogEntry;
import com.taskflow.core.model.StepState;
import com.taskflow.core.model.TaskStatus;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class InMemoryTaskStoreTest {

    private InMemoryTaskStore store;

    @BeforeEach
    void setUp() {
        store = new InMemoryTaskStore(Clock.fixed(TestHarness.NOW, ZoneOffset.UTC));
    }

    @Test
    @DisplayName("create starts a DRAFT at version 1")
    void create() {
        var task = store.create(TestTasks.spec());

        assertTrue(task.id().startsWith("TASK-"));
        assertEquals(TaskStatus.DRAFT, task.status());
        assertEquals(1L, task.version());
        assertEquals(3, task.steps().size());
        assertEquals(task, store.load(task.id()));
    }

    @Test
    @DisplayName("Saving a stale version is rejected")
    void staleSave() {
        var task = store.create(TestTasks.spec());
        var saved = store.save(task.toBuilder().status(TaskStatus.REQUIREMENTS_REVIEW).build());
        assertEquals(2L, saved.version());

        var conflict = assertThrows(ConcurrentTaskModificationException.class,
                () -> store.save(task.toBuilder().title("stale").build()));
        assertEquals(1L, conflict.getExpectedVersion());
        assertEquals(2L, conflict.getActualVersion());
        assertEquals(TaskStatus.REQUIREMENTS_REVIEW, store.load(task.id()).status());
    }

    @Test
    @DisplayName("Of two concurrent saves of the same version exactly one wins")
    void concurrentSaves() throws Exception {
        var task = store.create(TestTasks.spec());
        var start = new CountDownLatch(1);
        var successes = new AtomicInteger();
        var conflicts = new AtomicInteger();
        ExecutorService pool = Executors.newFixedThreadPool(2);
        try {
            for (int i = 0; i < 2; i++) {
                var title = "writer " + i;
                pool.submit(() -> {
                    start.await();
                    try {
                        store.save(task.toBuilder().title(title).build());
                        successes.incrementAndGet();
                    } catch (ConcurrentTaskModificationException e) {
                        conflicts.incrementAndGet();
                    }
                    return null;
                });
            }
            start.countDown();
        } finally {
            pool.shutdown();
            assertTrue(pool.awaitTermination(5, TimeUnit.SECONDS));
        }

        assertEquals(1, successes.get());
        assertEquals(1, conflicts.get());
        assertEquals(2L, store.load(task.id()).version());
    }

    @Test
    @DisplayName("update retries on conflict so concurrent appends are all kept")
    void updateRetries() throws Exception {
        var task = store.create(TestTasks.spec());
        List<Throwable> errors = Collections.synchronizedList(new ArrayList<>());
        var threads = new ArrayList<Thread>();
        for (int i = 0; i < 4; i++) {
            var n = i;
            var thread = new Thread(() -> {
                try {
                    store.appendChangelog(task.id(),
                            new ChangelogEntry(TestHarness.NOW, "test", "entry " + n, "none", "t" + n));
                } catch (Throwable e) {
                    errors.add(e);
                }
            });
            threads.add(thread);
            thread.start();
        }
        for (var thread : threads) {
            thread.join();
        }

        assertTrue(errors.isEmpty(), () -> "errors: " + errors);
        assertEquals(1 + 4, store.load(task.id()).changelog().size());
    }

    @Test
    @DisplayName("updateStep records state and evidence")
    void updateStep() {
        var task = store.create(TestTasks.spec());

        var updated = store.updateStep(task.id(), 1, StepState.DONE, "commit abc123");

        assertEquals(StepState.DONE, updated.steps().get(1).state());
        assertEquals("commit abc123", updated.steps().get(1).evidence());
        assertEquals(StepState.PENDING, updated.steps().get(0).state());
    }

    @Test
    @DisplayName("Unknown ids raise TaskNotFoundException")
    void notFound() {
        assertThrows(TaskNotFoundException.class, () -> store.load("TASK-missing"));
    }
}
