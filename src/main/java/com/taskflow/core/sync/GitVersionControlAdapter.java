package com.taskflow.core.sync;

import com.fasterxml.jackson.databind.JsonNode;
import com.taskflow.core.config.TaskflowProperties;
import com.taskflow.core.model.ChangeRequestDraft;
import com.taskflow.core.model.TaskSnapshot;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * {@link VersionControlAdapter} backed by the local {@code git} CLI for branches and the
 * GitHub pull request API for change requests.
 *
 * <p>Branches are named {@code <branch-prefix><taskId>} and cut from the remote base branch
 * without touching the operator's working tree. Existence is always checked with
 * {@code git ls-remote}, never from local state, so a restart cannot cause a second push.
 */
@Component
public class GitVersionControlAdapter implements VersionControlAdapter {

    private static final Logger log = LoggerFactory.getLogger(GitVersionControlAdapter.class);

    private static final Pattern SENSITIVE_URL_PATTERN = Pattern.compile("(https?://)([^:]+:[^@]+)@");

    private final TaskflowProperties.Git git;
    private final GitHubApiClient gitHub;
    private final long timeoutSeconds;

    public GitVersionControlAdapter(TaskflowProperties properties, GitHubApiClient gitHub) {
        this.git = properties.getGit();
        this.gitHub = gitHub;
        this.timeoutSeconds = properties.getSync().getTimeoutSeconds();
    }

    @Override
    public String branchNameFor(String taskId) {
        return git.getBranchPrefix() + taskId;
    }

    @Override
    public String ensureBranch(TaskSnapshot task) {
        var branch = branchNameFor(task.id());
        if (remoteBranchExists(branch)) {
            log.info("Branch '{}' already exists on {}", branch, git.getRemote());
            return branch;
        }

        log.info("Creating branch '{}' from {}/{}", branch, git.getRemote(), git.getBaseBranch());
        requireSuccess(runGit("fetch", git.getRemote(), git.getBaseBranch()), "fetch " + git.getBaseBranch());
        if (runGit("rev-parse", "--verify", "--quiet", "refs/heads/" + branch) != 0) {
            requireSuccess(runGit("branch", branch, git.getRemote() + "/" + git.getBaseBranch()),
                    "create branch " + branch);
        }
        requireSuccess(runGit("push", "-u", git.getRemote(), branch), "push branch " + branch);
        return branch;
    }

    @Override
    public String openChangeRequest(TaskSnapshot task, ChangeRequestDraft draft) {
        var branch = task.branchRef() != null ? task.branchRef() : branchNameFor(task.id());
        var existing = findPullRequest(branch);
        if (existing.isPresent()) {
            var number = existing.get().path("number").asText();
            log.info("Change request #{} already open for '{}'", number, branch);
            return number;
        }

        var body = gitHub.newBody();
        body.put("title", draft.title());
        body.put("body", draft.body());
        body.put("head", branch);
        body.put("base", git.getBaseBranch());
        var created = gitHub.post(gitHub.repoPath("/pulls"), body);
        var number = created.path("number").asText();
        log.info("Opened change request #{} for '{}'", number, branch);
        return number;
    }

    @Override
    public String mergeChangeRequest(TaskSnapshot task) {
        var number = task.changeRequestRef();
        if (number == null) {
            var branch = task.branchRef() != null ? task.branchRef() : branchNameFor(task.id());
            number = findPullRequest(branch)
                    .map(pr -> pr.path("number").asText())
                    .orElseThrow(() -> new ExternalSyncException("No change request exists for " + task.id()));
        }

        var pull = gitHub.get(gitHub.repoPath("/pulls/" + number));
        if (pull.path("merged").asBoolean(false)) {
            var sha = pull.path("merge_commit_sha").asText();
            log.info("Change request #{} already merged as {}", number, sha);
            return sha;
        }

        var body = gitHub.newBody();
        body.put("merge_method", "squash");
        body.put("commit_title", task.title() + " (" + task.id() + ")");
        var merged = gitHub.put(gitHub.repoPath("/pulls/" + number + "/merge"), body);
        var sha = merged.path("sha").asText();
        log.info("Merged change request #{} as {}", number, sha);
        return sha;
    }

    private Optional<JsonNode> findPullRequest(String branch) {
        var pulls = gitHub.get(gitHub.repoPath("/pulls?state=all&head="
                + GitHubApiClient.encode(gitHub.owner() + ":" + branch)));
        if (pulls.isArray() && !pulls.isEmpty()) {
            return Optional.of(pulls.get(0));
        }
        return Optional.empty();
    }

    boolean remoteBranchExists(String branch) {
        var output = runGitOutput("ls-remote", "--heads", git.getRemote(), branch);
        return output.lines().anyMatch(line -> line.endsWith("refs/heads/" + branch));
    }

    private void requireSuccess(int exitCode, String action) {
        if (exitCode != 0) {
            throw new ExternalSyncException("git %s failed (exit code %d)".formatted(action, exitCode));
        }
    }

    /**
     * Runs a git command in the configured work dir and returns the exit code.
     */
    int runGit(String... args) {
        var command = buildCommand(args);
        log.debug("Running: {}", maskCommand(command));
        try {
            var process = new ProcessBuilder(command)
                    .directory(Path.of(git.getWorkDir()).toFile())
                    .redirectErrorStream(true)
                    .start();

            try (var reader = new BufferedReader(new InputStreamReader(process.getInputStream(), StandardCharsets.UTF_8))) {
                String line;
                while ((line = reader.readLine()) != null) {
                    log.debug("git: {}", maskSensitiveData(line));
                }
            }
            return awaitExit(process, command);
        } catch (IOException e) {
            throw new ExternalSyncException("git command failed: " + maskCommand(command), e);
        }
    }

    /**
     * Runs a git command and captures stdout. A non-zero exit is a failure.
     */
    String runGitOutput(String... args) {
        var command = buildCommand(args);
        log.debug("Running (capture): {}", maskCommand(command));
        try {
            var process = new ProcessBuilder(command)
                    .directory(Path.of(git.getWorkDir()).toFile())
                    .redirectErrorStream(false)
                    .start();
            // stderr is read concurrently: neither pipe may fill up while the other is read
            var errors = CompletableFuture.supplyAsync(() -> readAll(process.getErrorStream()));

            String output;
            try (var reader = new BufferedReader(new InputStreamReader(process.getInputStream(), StandardCharsets.UTF_8))) {
                output = reader.lines().collect(Collectors.joining("\n"));
            }
            int exitCode = awaitExit(process, command);
            String stderr = errors.join().strip();
            if (exitCode != 0) {
                throw new ExternalSyncException("git command exited with code %d: %s%s".formatted(
                        exitCode, maskCommand(command), stderr.isEmpty() ? "" : ": " + maskSensitiveData(stderr)));
            }
            if (!stderr.isEmpty()) {
                log.debug("git: {}", maskSensitiveData(stderr));
            }
            return output;
        } catch (IOException e) {
            throw new ExternalSyncException("git command failed: " + maskCommand(command), e);
        }
    }

    private static String readAll(InputStream stream) {
        try (stream) {
            return new String(stream.readAllBytes(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            log.debug("Could not read git stderr: {}", e.getMessage());
            return "";
        }
    }

    private int awaitExit(Process process, List<String> command) {
        try {
            if (!process.waitFor(timeoutSeconds, TimeUnit.SECONDS)) {
                process.destroyForcibly();
                throw new ExternalSyncException("git command timed out after %ds: %s"
                        .formatted(timeoutSeconds, maskCommand(command)), null, true);
            }
            return process.exitValue();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            process.destroyForcibly();
            throw new ExternalSyncException("git command interrupted: " + maskCommand(command), e, true);
        }
    }

    static String maskSensitiveData(String text) {
        if (text == null) {
            return null;
        }
        return SENSITIVE_URL_PATTERN.matcher(text).replaceAll("$1****@");
    }

    private static String maskCommand(List<String> command) {
        return command.stream()
                .map(GitVersionControlAdapter::maskSensitiveData)
                .collect(Collectors.joining(" "));
    }

    List<String> buildCommand(String... args) {
        var command = new ArrayList<String>();
        command.add("git");
        command.addAll(List.of(args));
        return command;
    }
}
