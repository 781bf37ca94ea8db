package com.flapmyport.core.spi;

/**
 * Admission point for outbound device queries.
 * <p>
 * Implementations decide how many queries may run at once; the resolver only relies on
 * {@link #execute} returning the task's result or rethrowing its exception, and on the
 * gate being released either way.
 */
public interface SnmpAccessGate {

    @FunctionalInterface
    interface Query<T> {
        T call() throws SnmpQueryException;
    }

    <T> T execute(Query<T> query) throws SnmpQueryException;

    /** Runs every query on the caller's thread with no exclusion. */
    SnmpAccessGate PASS_THROUGH = new SnmpAccessGate() {
        @Override
        public <T> T execute(Query<T> query) throws SnmpQueryException {
            return query.call();
        }
    };
}
