package com.taskflow.core.audit;

import com.taskflow.core.config.TaskflowProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnExpression;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.util.concurrent.TimeUnit;

/**
 * Periodic reconciliation across all tasks. Only registered when
 * {@code taskflow.reconciliation.interval-seconds} is positive.
 */
@Component
@ConditionalOnExpression("${taskflow.reconciliation.interval-seconds:0} > 0")
public class ReconciliationScheduler {

    private static final Logger log = LoggerFactory.getLogger(ReconciliationScheduler.class);

    private final Reconciler reconciler;
    private final TaskflowProperties properties;

    public ReconciliationScheduler(Reconciler reconciler, TaskflowProperties properties) {
        this.reconciler = reconciler;
        this.properties = properties;
    }

    @Scheduled(fixedDelayString = "${taskflow.reconciliation.interval-seconds}",
               initialDelayString = "${taskflow.reconciliation.interval-seconds}",
               timeUnit = TimeUnit.SECONDS)
    public void run() {
        var reports = reconciler.reconcileAll(properties.getReconciliation().isRepair());
        long drifted = reports.stream().filter(r -> !r.inSync()).count();
        if (drifted > 0) {
            log.warn("Reconciliation finished: {} of {} task(s) still drifted", drifted, reports.size());
        } else {
            log.info("Reconciliation finished: {} task(s) in sync", reports.size());
        }
    }
}
