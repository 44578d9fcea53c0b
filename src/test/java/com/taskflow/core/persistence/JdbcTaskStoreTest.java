package com.taskflow.core.persistence;

import com.taskflow.core.TestHarness;
import com.taskflow.core.TestTasks;
import com.taskflow.core.model.ChangelogEntry;
import com.taskflow.core.model.GateId;
import com.taskflow.core.model.Task;
import com.taskflow.core.model.TaskStatus;
import org.h2.jdbcx.JdbcDataSource;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.ZoneOffset;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

class JdbcTaskStoreTest {

    private JdbcTaskStore store;

    @BeforeEach
    void setUp() throws Exception {
        var dataSource = new JdbcDataSource();
        dataSource.setURL("jdbc:h2:mem:tasks-" + UUID.randomUUID() + ";MODE=PostgreSQL;DB_CLOSE_DELAY=-1");
        store = new JdbcTaskStore(dataSource, new TaskDocumentCodec(), Clock.fixed(TestHarness.NOW, ZoneOffset.UTC));
        store.createTables();
        store.createTables();
    }

    @Test
    @DisplayName("A saved task loads back with every field")
    void roundTrip() {
        var task = store.create(TestTasks.spec());
        var changed = task.toBuilder()
                .status(TaskStatus.TEST_PLAN_REVIEW)
                .addGatePassed(GateId.REQUIREMENTS)
                .incrementRevisions(GateId.TEST_PLAN)
                .addChangelog(new ChangelogEntry(TestHarness.NOW, "gate:requirements", "Gate passed", "status", "alice"))
                .build()
                .withIssueRef("42");

        var saved = store.save(changed);
        var loaded = store.load(task.id());

        assertEquals(saved, loaded);
        assertEquals(2L, loaded.version());
        assertEquals(1, loaded.revisionCount(GateId.TEST_PLAN));
    }

    @Test
    @DisplayName("Stale versions are rejected with the stored version")
    void conflict() {
        var task = store.create(TestTasks.spec());
        store.save(task.toBuilder().title("first").build());

        var e = assertThrows(ConcurrentTaskModificationException.class,
                () -> store.save(task.toBuilder().title("second").build()));
        assertEquals(2L, e.getActualVersion());
        assertEquals("first", store.load(task.id()).title());
    }

    @Test
    @DisplayName("Saving an unknown task raises TaskNotFoundException")
    void saveUnknown() {
        var ghost = Task.draft("TASK-ghost", TestTasks.spec(), TestHarness.NOW).withVersion(1L, TestHarness.NOW);
        assertThrows(TaskNotFoundException.class, () -> store.save(ghost));
        assertThrows(TaskNotFoundException.class, () -> store.load("TASK-ghost"));
    }

    @Test
    @DisplayName("list returns tasks in creation order")
    void list() {
        var first = store.create(TestTasks.spec());
        var second = store.create(TestTasks.childSpec("Child").withParent(first.id()));

        var all = store.list();

        assertEquals(2, all.size());
        assertTrue(all.stream().anyMatch(t -> t.id().equals(second.id()) && first.id().equals(t.parentTaskId())));
    }
}
