package com.taskflow.core.sync;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.MissingNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.taskflow.core.config.TaskflowProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;

/**
 * HTTP client for the GitHub REST API, scoped to the configured repository.
 *
 * <p>Uses the JDK {@link HttpClient} and Jackson directly rather than a GitHub SDK.
 * Authentication is a bearer token from {@code taskflow.github.token}. Every request is
 * bounded by {@code taskflow.sync.timeout-seconds}; a timeout surfaces as an
 * {@link ExternalSyncException} whose outcome is unknown.
 */
@Component
public class GitHubApiClient {

    private static final Logger log = LoggerFactory.getLogger(GitHubApiClient.class);

    private final TaskflowProperties.GitHub github;
    private final Duration requestTimeout;
    private final HttpClient httpClient;
    private final ObjectMapper objectMapper;

    public GitHubApiClient(TaskflowProperties properties) {
        this.github = properties.getGithub();
        this.requestTimeout = Duration.ofSeconds(properties.getSync().getTimeoutSeconds());
        this.httpClient = HttpClient.newBuilder()
                .connectTimeout(Duration.ofSeconds(10))
                .build();
        this.objectMapper = new ObjectMapper();
    }

    public boolean isConfigured() {
        return github.isConfigured();
    }

    public ObjectNode newBody() {
        return objectMapper.createObjectNode();
    }

    public String owner() {
        var repository = github.getRepository();
        int slash = repository.indexOf('/');
        return slash < 0 ? repository : repository.substring(0, slash);
    }

    /** Path under {@code /repos/<owner>/<name>}. */
    public String repoPath(String suffix) {
        return "/repos/" + github.getRepository() + suffix;
    }

    public JsonNode get(String path) {
        return send("GET", path, null);
    }

    public JsonNode post(String path, JsonNode body) {
        return send("POST", path, body);
    }

    public JsonNode put(String path, JsonNode body) {
        return send("PUT", path, body);
    }

    public JsonNode patch(String path, JsonNode body) {
        return send("PATCH", path, body);
    }

    JsonNode send(String method, String path, JsonNode body) {
        if (!isConfigured()) {
            throw new ExternalSyncException("GitHub is not configured (taskflow.github.repository / token)");
        }
        var publisher = body == null
                ? HttpRequest.BodyPublishers.noBody()
                : HttpRequest.BodyPublishers.ofString(body.toString());
        var request = HttpRequest.newBuilder()
                .uri(URI.create(github.getApiUrl() + path))
                .timeout(requestTimeout)
                .header("Authorization", "Bearer " + github.getToken())
                .header("Accept", "application/vnd.github+json")
                .header("Content-Type", "application/json")
                .method(method, publisher)
                .build();

        log.debug("GitHub {} {}", method, path);
        try {
            var response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
            if (response.statusCode() >= 400) {
                throw new ExternalSyncException("GitHub %s %s failed (HTTP %d): %s"
                        .formatted(method, path, response.statusCode(), response.body()));
            }
            var content = response.body();
            return content == null || content.isBlank() ? MissingNode.getInstance() : objectMapper.readTree(content);
        } catch (HttpTimeoutException e) {
            throw new ExternalSyncException("GitHub %s %s timed out after %s".formatted(method, path, requestTimeout),
                    e, true);
        } catch (IOException e) {
            throw new ExternalSyncException("GitHub request failed: %s %s".formatted(method, path), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ExternalSyncException("GitHub request interrupted: %s %s".formatted(method, path), e, true);
        }
    }

    public static String encode(String value) {
        return URLEncoder.encode(value, StandardCharsets.UTF_8);
    }
}
