package com.taskflow.core.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Component
@ConfigurationProperties(prefix = "taskflow")
public class TaskflowProperties {

    private Gates gates = new Gates();
    private Dispatch dispatch = new Dispatch();
    private Sync sync = new Sync();
    private Git git = new Git();
    private GitHub github = new GitHub();
    private Reconciliation reconciliation = new Reconciliation();

    public Gates getGates() { return gates; }
    public void setGates(Gates gates) { this.gates = gates; }
    public Dispatch getDispatch() { return dispatch; }
    public void setDispatch(Dispatch dispatch) { this.dispatch = dispatch; }
    public Sync getSync() { return sync; }
    public void setSync(Sync sync) { this.sync = sync; }
    public Git getGit() { return git; }
    public void setGit(Git git) { this.git = git; }
    public GitHub getGithub() { return github; }
    public void setGithub(GitHub github) { this.github = github; }
    public Reconciliation getReconciliation() { return reconciliation; }
    public void setReconciliation(Reconciliation reconciliation) { this.reconciliation = reconciliation; }

    public static class Gates {
        /** NEEDS_REVISION verdicts tolerated per gate before it is declared stuck. */
        private int maxRevisions = 5;

        public int getMaxRevisions() { return maxRevisions; }
        public void setMaxRevisions(int maxRevisions) { this.maxRevisions = maxRevisions; }
    }

    public static class Dispatch {
        private int timeoutSeconds = 300;
        private int maxConcurrent = 4;

        public int getTimeoutSeconds() { return timeoutSeconds; }
        public void setTimeoutSeconds(int timeoutSeconds) { this.timeoutSeconds = timeoutSeconds; }
        public int getMaxConcurrent() { return maxConcurrent; }
        public void setMaxConcurrent(int maxConcurrent) { this.maxConcurrent = maxConcurrent; }
    }

    public static class Sync {
        private int timeoutSeconds = 30;

        public int getTimeoutSeconds() { return timeoutSeconds; }
        public void setTimeoutSeconds(int timeoutSeconds) { this.timeoutSeconds = timeoutSeconds; }
    }

    public static class Git {
        private String workDir = ".";
        private String remote = "origin";
        private String branchPrefix = "taskflow/";
        private String baseBranch = "main";

        public String getWorkDir() { return workDir; }
        public void setWorkDir(String workDir) { this.workDir = workDir; }
        public String getRemote() { return remote; }
        public void setRemote(String remote) { this.remote = remote; }
        public String getBranchPrefix() { return branchPrefix; }
        public void setBranchPrefix(String branchPrefix) { this.branchPrefix = branchPrefix; }
        public String getBaseBranch() { return baseBranch; }
        public void setBaseBranch(String baseBranch) { this.baseBranch = baseBranch; }
    }

    public static class GitHub {
        private String apiUrl = "https://api.github.com";
        private String token = "";
        /** Repository in {@code owner/name} form. */
        private String repository = "";

        public String getApiUrl() { return apiUrl; }
        public void setApiUrl(String apiUrl) { this.apiUrl = apiUrl; }
        public String getToken() { return token; }
        public void setToken(String token) { this.token = token; }
        public String getRepository() { return repository; }
        public void setRepository(String repository) { this.repository = repository; }

        public boolean isConfigured() {
            return token != null && !token.isBlank() && repository != null && repository.contains("/");
        }
    }

    public static class Reconciliation {
        /** Period of the background reconciler; 0 disables it. */
        private long intervalSeconds = 0;
        private boolean repair = true;

        public long getIntervalSeconds() { return intervalSeconds; }
        public void setIntervalSeconds(long intervalSeconds) { this.intervalSeconds = intervalSeconds; }
        public boolean isRepair() { return repair; }
        public void setRepair(boolean repair) { this.repair = repair; }
    }
}
