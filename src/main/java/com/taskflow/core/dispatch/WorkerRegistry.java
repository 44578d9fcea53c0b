package com.taskflow.core.dispatch;

import com.taskflow.core.model.AgentName;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Indexes the registered {@link Worker} beans by {@link AgentName}.
 */
@Component
public class WorkerRegistry {

    private static final Logger log = LoggerFactory.getLogger(WorkerRegistry.class);

    private final Map<AgentName, Worker> workers;

    public WorkerRegistry(List<Worker> workers) {
        var byName = new EnumMap<AgentName, Worker>(AgentName.class);
        for (var worker : workers) {
            var previous = byName.putIfAbsent(worker.name(), worker);
            if (previous != null) {
                throw new IllegalStateException("Two workers registered for " + worker.name() + ": "
                        + previous.getClass().getSimpleName() + " and " + worker.getClass().getSimpleName());
            }
        }
        this.workers = Collections.unmodifiableMap(byName);
        log.info("Registered workers: {}", this.workers.keySet());
    }

    public Optional<Worker> find(AgentName name) {
        return Optional.ofNullable(workers.get(name));
    }

    public Set<AgentName> registered() {
        return workers.keySet();
    }
}
