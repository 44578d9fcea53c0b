package com.taskflow.core.model;

import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * The aggregate root for one unit of work, from business intent to merge.
 * <p>
 * Instances are immutable; every change produces a copy. {@link #version()} is the
 * optimistic concurrency token checked by the task store on save.
 *
 * @param id               stable identifier (e.g. "TASK-1a2b3c4d")
 * @param title            short name of the work
 * @param requirements     business intent
 * @param testPlan         approved test plan
 * @param status           current lifecycle status, written only by the gate controller
 * @param gatesPassed      satisfied gates in canonical order, append-only
 * @param branchRef        version control branch, set at most once
 * @param issueRef         issue tracker reference, set at most once
 * @param changeRequestRef change request (pull request) reference, set at most once
 * @param changelog        append-only history
 * @param steps            technical steps
 * @param invocations      every gate invocation ever made for this task
 * @param revisionCounts   NEEDS_REVISION verdicts per gate
 * @param stuckGate        gate whose revision loop exceeded the limit, nullable
 * @param blockedFrom      status to resume when a block is cleared, nullable
 * @param parentTaskId     parent task when created by a split, nullable
 * @param handover         continuation block for the next driver, nullable
 * @param createdAt        creation time
 * @param updatedAt        last save time
 * @param version          optimistic concurrency token
 */
public record Task(
    String id,
    String title,
    String requirements,
    String testPlan,
    TaskStatus status,
    List<GateId> gatesPassed,
    String branchRef,
    String issueRef,
    String changeRequestRef,
    List<ChangelogEntry> changelog,
    List<Step> steps,
    List<GateInvocation> invocations,
    Map<GateId, Integer> revisionCounts,
    GateId stuckGate,
    TaskStatus blockedFrom,
    String parentTaskId,
    HandoverNote handover,
    Instant createdAt,
    Instant updatedAt,
    long version
) {

    public Task {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(status, "status");
        gatesPassed = gatesPassed == null ? List.of() : List.copyOf(gatesPassed);
        changelog = changelog == null ? List.of() : List.copyOf(changelog);
        steps = steps == null ? List.of() : List.copyOf(steps);
        invocations = invocations == null ? List.of() : List.copyOf(invocations);
        revisionCounts = revisionCounts == null || revisionCounts.isEmpty()
                ? Map.of() : Map.copyOf(revisionCounts);
    }

    /**
     * A new task in {@link TaskStatus#DRAFT} built from a spec.
     */
    public static Task draft(String id, TaskSpec spec, Instant now) {
        var steps = spec.steps().stream()
                .map(s -> Step.pending(s.description(), s.acceptanceCriteria()))
                .toList();
        var created = new ChangelogEntry(now, "task", "Task created: " + spec.title(),
                "status " + TaskStatus.DRAFT, "system");
        return new Task(id, spec.title(), spec.requirements(), spec.testPlan(), TaskStatus.DRAFT,
                List.of(), null, null, null, List.of(created), steps, List.of(), Map.of(),
                null, null, spec.parentTaskId(), null, now, now, 0L);
    }

    // ── Queries ──────────────────────────────────────────────────────────

    public Optional<GateInvocation> openInvocation() {
        return invocations.stream().filter(GateInvocation::awaitingVerdict).findFirst();
    }

    public List<GateInvocation> invocationsFor(GateId gate) {
        return invocations.stream().filter(i -> i.gateId() == gate).toList();
    }

    public boolean hasPassed(GateId gate) {
        return gatesPassed.contains(gate);
    }

    public int revisionCount(GateId gate) {
        return revisionCounts.getOrDefault(gate, 0);
    }

    public Optional<Integer> nextPendingStep() {
        for (int i = 0; i < steps.size(); i++) {
            if (!steps.get(i).state().isFinished() && !steps.get(i).delegated()) {
                return Optional.of(i);
            }
        }
        return Optional.empty();
    }

    // ── Copies ───────────────────────────────────────────────────────────

    public Builder toBuilder() {
        return new Builder(this);
    }

    public Task appendChangelog(ChangelogEntry entry) {
        var entries = new ArrayList<>(changelog);
        entries.add(entry);
        return toBuilder().changelog(entries).build();
    }

    public Task withStep(int index, StepState state, String evidence) {
        if (index < 0 || index >= steps.size()) {
            throw new IndexOutOfBoundsException("Task " + id + " has no step " + index);
        }
        var updated = new ArrayList<>(steps);
        updated.set(index, steps.get(index).withCompletion(state, evidence));
        return toBuilder().steps(updated).build();
    }

    public Task withBranchRef(String ref) {
        return toBuilder().branchRef(setOnce("branchRef", branchRef, ref)).build();
    }

    public Task withIssueRef(String ref) {
        return toBuilder().issueRef(setOnce("issueRef", issueRef, ref)).build();
    }

    public Task withChangeRequestRef(String ref) {
        return toBuilder().changeRequestRef(setOnce("changeRequestRef", changeRequestRef, ref)).build();
    }

    public Task withVersion(long newVersion, Instant savedAt) {
        return toBuilder().version(newVersion).updatedAt(savedAt).build();
    }

    private String setOnce(String field, String current, String proposed) {
        if (current == null || current.equals(proposed)) {
            return proposed;
        }
        throw new IllegalStateException(
                "Task %s already has %s '%s'; refusing to reassign to '%s'".formatted(id, field, current, proposed));
    }

    /**
     * Mutable builder used to derive modified copies.
     */
    public static final class Builder {
        private final String id;
        private String title;
        private String requirements;
        private String testPlan;
        private TaskStatus status;
        private List<GateId> gatesPassed;
        private String branchRef;
        private String issueRef;
        private String changeRequestRef;
        private List<ChangelogEntry> changelog;
        private List<Step> steps;
        private List<GateInvocation> invocations;
        private Map<GateId, Integer> revisionCounts;
        private GateId stuckGate;
        private TaskStatus blockedFrom;
        private String parentTaskId;
        private HandoverNote handover;
        private Instant createdAt;
        private Instant updatedAt;
        private long version;

        private Builder(Task t) {
            this.id = t.id;
            this.title = t.title;
            this.requirements = t.requirements;
            this.testPlan = t.testPlan;
            this.status = t.status;
            this.gatesPassed = t.gatesPassed;
            this.branchRef = t.branchRef;
            this.issueRef = t.issueRef;
            this.changeRequestRef = t.changeRequestRef;
            this.changelog = t.changelog;
            this.steps = t.steps;
            this.invocations = t.invocations;
            this.revisionCounts = t.revisionCounts;
            this.stuckGate = t.stuckGate;
            this.blockedFrom = t.blockedFrom;
            this.parentTaskId = t.parentTaskId;
            this.handover = t.handover;
            this.createdAt = t.createdAt;
            this.updatedAt = t.updatedAt;
            this.version = t.version;
        }

        public Builder title(String v) { this.title = v; return this; }
        public Builder requirements(String v) { this.requirements = v; return this; }
        public Builder testPlan(String v) { this.testPlan = v; return this; }
        public Builder status(TaskStatus v) { this.status = v; return this; }
        public Builder gatesPassed(List<GateId> v) { this.gatesPassed = v; return this; }
        public Builder branchRef(String v) { this.branchRef = v; return this; }
        public Builder issueRef(String v) { this.issueRef = v; return this; }
        public Builder changeRequestRef(String v) { this.changeRequestRef = v; return this; }
        public Builder changelog(List<ChangelogEntry> v) { this.changelog = v; return this; }
        public Builder steps(List<Step> v) { this.steps = v; return this; }
        public Builder invocations(List<GateInvocation> v) { this.invocations = v; return this; }
        public Builder revisionCounts(Map<GateId, Integer> v) { this.revisionCounts = v; return this; }
        public Builder stuckGate(GateId v) { this.stuckGate = v; return this; }
        public Builder blockedFrom(TaskStatus v) { this.blockedFrom = v; return this; }
        public Builder parentTaskId(String v) { this.parentTaskId = v; return this; }
        public Builder handover(HandoverNote v) { this.handover = v; return this; }
        public Builder createdAt(Instant v) { this.createdAt = v; return this; }
        public Builder updatedAt(Instant v) { this.updatedAt = v; return this; }
        public Builder version(long v) { this.version = v; return this; }

        public Builder addGatePassed(GateId gate) {
            var list = new ArrayList<>(gatesPassed);
            list.add(gate);
            this.gatesPassed = list;
            return this;
        }

        public Builder addChangelog(ChangelogEntry entry) {
            var list = new ArrayList<>(changelog);
            list.add(entry);
            this.changelog = list;
            return this;
        }

        public Builder addInvocation(GateInvocation invocation) {
            var list = new ArrayList<>(invocations);
            list.add(invocation);
            this.invocations = list;
            return this;
        }

        /** Replaces the invocation with the same id. */
        public Builder replaceInvocation(GateInvocation invocation) {
            var list = new ArrayList<GateInvocation>(invocations.size());
            for (var existing : invocations) {
                list.add(existing.id().equals(invocation.id()) ? invocation : existing);
            }
            this.invocations = list;
            return this;
        }

        public Builder incrementRevisions(GateId gate) {
            var counts = new EnumMap<GateId, Integer>(GateId.class);
            counts.putAll(revisionCounts);
            counts.merge(gate, 1, Integer::sum);
            this.revisionCounts = counts;
            return this;
        }

        public Builder resetRevisions(GateId gate) {
            var counts = new EnumMap<GateId, Integer>(GateId.class);
            counts.putAll(revisionCounts);
            counts.remove(gate);
            this.revisionCounts = counts;
            return this;
        }

        public Task build() {
            return new Task(id, title, requirements, testPlan, status, gatesPassed, branchRef, issueRef,
                    changeRequestRef, changelog, steps, invocations, revisionCounts, stuckGate,
                    blockedFrom, parentTaskId, handover, createdAt, updatedAt, version);
        }
    }
}
