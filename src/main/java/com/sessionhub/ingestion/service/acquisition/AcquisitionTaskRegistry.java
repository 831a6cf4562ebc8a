package com.sessionhub.ingestion.service.acquisition;

import com.sessionhub.ingestion.model.AcquisitionKey;
import com.sessionhub.ingestion.model.AcquisitionRequest;
import com.sessionhub.ingestion.model.AcquisitionTask;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;

/**
 * In-flight acquisition tasks by key. Guarantees at most one active task per (record, slot).
 * Held in memory only; tasks in flight are lost on restart.
 */
@Component
public class AcquisitionTaskRegistry {

    private static final Logger logger = LoggerFactory.getLogger(AcquisitionTaskRegistry.class);

    private final Map<AcquisitionKey, AcquisitionTask> tasks = new HashMap<>();
    private final ReentrantLock lock = new ReentrantLock();

    /**
     * Registers a new PENDING task, or returns empty if the key already has an active task.
     */
    public Optional<AcquisitionTask> register(AcquisitionRequest request) {
        AcquisitionKey key = request.key();
        lock.lock();
        try {
            AcquisitionTask existing = tasks.get(key);
            if (existing != null && existing.getState().isActive()) {
                logger.info("Acquisition for {} already {}; dropping duplicate request", key, existing.getState());
                return Optional.empty();
            }
            AcquisitionTask task = new AcquisitionTask(request);
            tasks.put(key, task);
            return Optional.of(task);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Removes a finished task. A newer task registered under the same key is left alone.
     */
    public void retire(AcquisitionTask task) {
        lock.lock();
        try {
            tasks.remove(task.getKey(), task);
        } finally {
            lock.unlock();
        }
        logger.debug("Retired acquisition task {} in state {}", task.getKey(), task.getState());
    }

    public boolean isInFlight(AcquisitionKey key) {
        lock.lock();
        try {
            AcquisitionTask task = tasks.get(key);
            return task != null && task.getState().isActive();
        } finally {
            lock.unlock();
        }
    }

    public Optional<AcquisitionTask> find(AcquisitionKey key) {
        lock.lock();
        try {
            return Optional.ofNullable(tasks.get(key));
        } finally {
            lock.unlock();
        }
    }

    public int size() {
        lock.lock();
        try {
            return tasks.size();
        } finally {
            lock.unlock();
        }
    }
}
