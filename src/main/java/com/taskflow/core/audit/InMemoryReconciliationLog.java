package com.taskflow.core.audit;

import com.taskflow.core.model.ExternalSyncRecord;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

public class InMemoryReconciliationLog implements ReconciliationLog {

    private final CopyOnWriteArrayList<ExternalSyncRecord> records = new CopyOnWriteArrayList<>();

    @Override
    public void append(ExternalSyncRecord record) {
        records.add(record);
    }

    @Override
    public List<ExternalSyncRecord> recordsFor(String taskId) {
        return records.stream().filter(r -> r.taskId().equals(taskId)).toList();
    }

    @Override
    public List<ExternalSyncRecord> all() {
        return List.copyOf(records);
    }
}
