package com.taskflow.core.config;

import org.junit.jupiter.api.Test;
import org.springframework.boot.context.properties.bind.Binder;
import org.springframework.boot.context.properties.source.MapConfigurationPropertySource;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class TaskflowPropertiesTest {

    @Test
    void defaultsAreReasonable() {
        var props = new TaskflowProperties();
        assertEquals(5, props.getGates().getMaxRevisions());
        assertEquals(300, props.getDispatch().getTimeoutSeconds());
        assertEquals(30, props.getSync().getTimeoutSeconds());
        assertEquals("taskflow/", props.getGit().getBranchPrefix());
        assertEquals("main", props.getGit().getBaseBranch());
        assertEquals(0, props.getReconciliation().getIntervalSeconds());
        assertFalse(props.getGithub().isConfigured());
    }

    @Test
    void bindsKebabCaseKeys() {
        var source = new MapConfigurationPropertySource(Map.of(
                "taskflow.gates.max-revisions", "3",
                "taskflow.dispatch.timeout-seconds", "60",
                "taskflow.github.token", "ghp_test",
                "taskflow.github.repository", "acme/shop",
                "taskflow.reconciliation.interval-seconds", "900"));

        var props = new Binder(source).bind("taskflow", TaskflowProperties.class).get();

        assertEquals(3, props.getGates().getMaxRevisions());
        assertEquals(60, props.getDispatch().getTimeoutSeconds());
        assertEquals(900, props.getReconciliation().getIntervalSeconds());
        assertTrue(props.getGithub().isConfigured());
    }

    @Test
    void repositoryNeedsOwner() {
        var github = new TaskflowProperties.GitHub();
        github.setToken("ghp_test");
        github.setRepository("shop");
        assertFalse(github.isConfigured());
    }
}
