package com.taskflow.core.sync;

import com.taskflow.core.model.SyncOperation;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;

/**
 * SHA-256 over the canonical form of a sync request. Two calls with the same hash express
 * the same intent, which is how reconciliation matches expectations to records.
 */
public final class PayloadHash {

    private PayloadHash() {}

    public static String of(SyncOperation operation, String taskId, String... parts) {
        var canonical = new StringBuilder(operation.name()).append('\n').append(taskId);
        for (String part : parts) {
            canonical.append('\n').append(part == null ? "" : part);
        }
        try {
            var digest = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(digest.digest(canonical.toString().getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    public static String ensureBranch(String taskId) {
        return of(SyncOperation.ENSURE_BRANCH, taskId);
    }

    public static String ensureIssue(String taskId) {
        return of(SyncOperation.ENSURE_ISSUE, taskId);
    }

    public static String syncStatus(String taskId, String externalStatus) {
        return of(SyncOperation.SYNC_STATUS, taskId, externalStatus);
    }

    public static String openChangeRequest(String taskId) {
        return of(SyncOperation.OPEN_CHANGE_REQUEST, taskId);
    }

    public static String mergeChangeRequest(String taskId) {
        return of(SyncOperation.MERGE_CHANGE_REQUEST, taskId);
    }

    public static String comment(String taskId, String body) {
        return of(SyncOperation.COMMENT, taskId, body);
    }
}
