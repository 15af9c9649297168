package com.myorg.saga.eventing.runtime;

/**
 * Scope of handling one message. Always used in try-with-resources:
 * {@link #close()} rolls back whatever was not committed.
 */
public interface UnitOfWork extends AutoCloseable {

    void commit();

    @Override
    void close();
}
