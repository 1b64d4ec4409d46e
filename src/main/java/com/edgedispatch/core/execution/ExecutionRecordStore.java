package com.edgedispatch.core.execution;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;

/**
 * In-memory table of execution id to {@link ExecutionRecord}.
 *
 * <p>A single lock guards creation, completion and reads. Critical sections only touch the
 * map; all network and process work happens outside, in the dispatcher's background tasks.
 *
 * <p>Records are never evicted: the table grows with every accepted dispatch for the life
 * of the process.
 */
@Component
public class ExecutionRecordStore {

    private static final Logger log = LoggerFactory.getLogger(ExecutionRecordStore.class);

    private final ReentrantLock lock = new ReentrantLock();
    private final Map<String, ExecutionRecord> records = new LinkedHashMap<>();

    /**
     * Stores a new PENDING record.
     *
     * @throws IllegalStateException if the id is already taken
     */
    public void create(ExecutionRecord record) {
        lock.lock();
        try {
            if (records.containsKey(record.executionId())) {
                throw new IllegalStateException("Duplicate execution id " + record.executionId());
            }
            records.put(record.executionId(), record);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Moves a PENDING record to its terminal state.
     *
     * @return the completed record, or empty if the id is unknown or the record was already terminal
     */
    public Optional<ExecutionRecord> complete(String executionId, RemoteExecutor.Outcome outcome, Instant completedAt) {
        lock.lock();
        try {
            ExecutionRecord current = records.get(executionId);
            if (current == null) {
                log.warn("Completion for unknown execution {}", executionId);
                return Optional.empty();
            }
            if (current.status().isTerminal()) {
                log.debug("Execution {} already {}, ignoring late completion", executionId, current.status());
                return Optional.empty();
            }
            ExecutionRecord completed = current.complete(outcome, completedAt);
            records.put(executionId, completed);
            return Optional.of(completed);
        } finally {
            lock.unlock();
        }
    }

    public Optional<ExecutionRecord> get(String executionId) {
        lock.lock();
        try {
            return Optional.ofNullable(records.get(executionId));
        } finally {
            lock.unlock();
        }
    }

    /**
     * @return all records, newest first
     */
    public List<ExecutionRecord> list() {
        lock.lock();
        try {
            var all = new ArrayList<>(records.values());
            Collections.reverse(all);
            return all;
        } finally {
            lock.unlock();
        }
    }

    public int size() {
        lock.lock();
        try {
            return records.size();
        } finally {
            lock.unlock();
        }
    }
}
