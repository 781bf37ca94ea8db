package com.flapmyport.core.runtime;

import com.flapmyport.core.spi.SnmpAccessGate;
import com.flapmyport.core.spi.SnmpQueryException;

import java.util.concurrent.locks.ReentrantLock;

/**
 * Lets one device query run at a time across the whole process. Waiters are not served in
 * arrival order.
 */
public class MutexSnmpAccessGate implements SnmpAccessGate {
    private final ReentrantLock lock = new ReentrantLock();

    @Override
    public <T> T execute(Query<T> query) throws SnmpQueryException {
        lock.lock();
        try {
            return query.call();
        } finally {
            lock.unlock();
        }
    }

    /** Threads currently blocked waiting for the gate (estimate). */
    public int queueLength() {
        return lock.getQueueLength();
    }
}
