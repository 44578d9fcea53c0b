package com.taskflow.dispatch.api;

import com.taskflow.core.audit.ReconciliationReport;
import com.taskflow.core.engine.CommandReport;
import com.taskflow.core.engine.LifecycleService;
import com.taskflow.core.engine.OperatorDecision;
import com.taskflow.core.engine.OperatorPrompt;
import com.taskflow.core.model.GateId;
import com.taskflow.core.model.Task;
import com.taskflow.core.model.TaskSpec;
import com.taskflow.core.model.TaskStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * REST controller exposing the task lifecycle commands.
 * <p>
 * Operator gates cannot prompt over HTTP, so commands that reach one take the decision in
 * the request body. A decision answers one gate only: the first operator gate the command
 * reaches, or the gate named in {@code gate}. Any further operator gate, and every gate when
 * no decision is given, is left open and reported as awaiting confirmation;
 * {@code POST /{id}/gates/{gate}/confirm} approves it later.
 */
@RestController
@RequestMapping("/api/v1/tasks")
public class TaskController {

    private static final Logger log = LoggerFactory.getLogger(TaskController.class);

    private final LifecycleService lifecycle;

    public TaskController(LifecycleService lifecycle) {
        this.lifecycle = lifecycle;
    }

    // ── Queries ──────────────────────────────────────────────────────────

    /**
     * GET /api/v1/tasks: List tasks, optionally filtered by status.
     */
    @GetMapping
    public List<Task> list(@RequestParam(required = false) String status) {
        var tasks = lifecycle.list();
        if (status == null || status.isBlank()) {
            return tasks;
        }
        TaskStatus wanted = TaskStatus.valueOf(status.toUpperCase());
        return tasks.stream().filter(t -> t.status() == wanted).toList();
    }

    /**
     * GET /api/v1/tasks/{id}: Full task document.
     */
    @GetMapping("/{id}")
    public Task get(@PathVariable String id) {
        return lifecycle.status(id);
    }

    // ── Lifecycle ────────────────────────────────────────────────────────

    /**
     * POST /api/v1/tasks: Create a task; submitted for requirements review unless draft.
     */
    @PostMapping
    public ResponseEntity<CommandReport> create(@RequestBody CreateTaskRequest request) {
        var steps = request.steps() == null ? List.<TaskSpec.StepSpec>of() : request.steps().stream()
                .map(s -> new TaskSpec.StepSpec(s.description(), s.acceptanceCriteria()))
                .toList();
        var spec = new TaskSpec(request.title(), request.requirements(), request.testPlan(), steps, null);
        var report = lifecycle.createTask(spec, Boolean.TRUE.equals(request.draft()), OperatorRequest.DEFAULT_IDENTITY);
        log.info("Created task {} via API", report.task().id());
        return ResponseEntity.status(HttpStatus.CREATED).body(report);
    }

    @PostMapping("/{id}/review-plan")
    public CommandReport reviewPlan(@PathVariable String id, @RequestBody(required = false) OperatorRequest request) {
        return lifecycle.reviewPlan(id, OperatorRequest.identityOf(request), promptFor(request));
    }

    @PostMapping("/{id}/start-implementation")
    public CommandReport startImplementation(@PathVariable String id,
                                             @RequestBody(required = false) OperatorRequest request) {
        return lifecycle.startImplementation(id, OperatorRequest.identityOf(request), promptFor(request));
    }

    @PostMapping("/{id}/continue-implementation")
    public CommandReport continueImplementation(@PathVariable String id,
                                                @RequestBody(required = false) StepCompletionRequest request) {
        if (request == null) {
            return lifecycle.continueImplementation(id, null, null, OperatorRequest.DEFAULT_IDENTITY);
        }
        String identity = request.identity() == null ? OperatorRequest.DEFAULT_IDENTITY : request.identity();
        return lifecycle.continueImplementation(id, request.step(), request.evidence(), identity);
    }

    @PostMapping("/{id}/handover")
    public CommandReport handover(@PathVariable String id, @RequestBody HandoverRequest request) {
        if (request.summary() == null || request.summary().isBlank()) {
            throw new IllegalArgumentException("Handover summary is required");
        }
        String identity = request.identity() == null ? OperatorRequest.DEFAULT_IDENTITY : request.identity();
        return lifecycle.prepareHandover(id, request.summary(),
                request.nextSteps() == null ? List.of() : request.nextSteps(),
                request.openQuestions() == null ? List.of() : request.openQuestions(),
                identity);
    }

    @PostMapping("/{id}/start-review")
    public CommandReport startReview(@PathVariable String id, @RequestBody(required = false) OperatorRequest request) {
        return lifecycle.startReview(id, OperatorRequest.identityOf(request));
    }

    @PostMapping("/{id}/update-documentation")
    public CommandReport updateDocumentation(@PathVariable String id,
                                             @RequestBody(required = false) OperatorRequest request) {
        return lifecycle.updateDocumentation(id, OperatorRequest.identityOf(request));
    }

    @PostMapping("/{id}/merge")
    public CommandReport merge(@PathVariable String id, @RequestBody(required = false) OperatorRequest request) {
        return lifecycle.merge(id, OperatorRequest.identityOf(request), promptFor(request));
    }

    /**
     * POST /api/v1/tasks/{id}/gates/{gate}/confirm: Approve an open operator gate.
     */
    @PostMapping("/{id}/gates/{gate}/confirm")
    public Map<String, Object> confirm(@PathVariable String id, @PathVariable String gate,
                                       @RequestBody(required = false) OperatorRequest request) {
        var outcome = lifecycle.confirm(id, GateId.fromKey(gate), OperatorRequest.identityOf(request));
        Map<String, Object> result = new LinkedHashMap<>();
        result.put("gate", outcome.gate().key());
        result.put("verdict", outcome.verdict());
        result.put("status", outcome.task().status());
        return result;
    }

    // ── Operator actions ─────────────────────────────────────────────────

    @PostMapping("/{id}/block")
    public Task block(@PathVariable String id, @RequestBody OperatorRequest request) {
        if (request.note() == null || request.note().isBlank()) {
            throw new IllegalArgumentException("A block reason is required in 'note'");
        }
        return lifecycle.block(id, request.note(), OperatorRequest.identityOf(request));
    }

    @PostMapping("/{id}/unblock")
    public Task unblock(@PathVariable String id, @RequestBody(required = false) OperatorRequest request) {
        return lifecycle.unblock(id, OperatorRequest.identityOf(request));
    }

    @PostMapping("/{id}/gates/{gate}/override")
    public Task override(@PathVariable String id, @PathVariable String gate,
                         @RequestBody(required = false) OperatorRequest request) {
        return lifecycle.override(id, GateId.fromKey(gate), OperatorRequest.identityOf(request));
    }

    @PostMapping("/{id}/archive")
    public Task archive(@PathVariable String id, @RequestBody(required = false) OperatorRequest request) {
        return lifecycle.archive(id, OperatorRequest.identityOf(request));
    }

    @PostMapping("/{id}/reconcile")
    public ReconciliationReport reconcile(@PathVariable String id,
                                          @RequestParam(defaultValue = "false") boolean repair) {
        return lifecycle.reconcile(id, repair);
    }

    @PostMapping("/reconcile")
    public List<ReconciliationReport> reconcileAll(@RequestParam(defaultValue = "false") boolean repair) {
        return lifecycle.reconcileAll(repair);
    }

    static OperatorPrompt promptFor(OperatorRequest request) {
        if (request == null || request.decision() == null || request.decision().isBlank()) {
            return OperatorPrompt.answering(OperatorDecision.defer());
        }
        var decision = switch (OperatorDecision.Kind.valueOf(request.decision().toUpperCase())) {
            case APPROVE -> OperatorDecision.approve();
            case REVISE -> OperatorDecision.revise(request.note() == null ? "revision requested" : request.note());
            case DEFER -> OperatorDecision.defer();
        };
        GateId target = request.gate() == null || request.gate().isBlank() ? null : GateId.fromKey(request.gate());
        return OperatorPrompt.answeringOnce(decision, target);
    }
}
