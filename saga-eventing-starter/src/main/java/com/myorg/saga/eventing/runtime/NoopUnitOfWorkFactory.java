package com.myorg.saga.eventing.runtime;

// services without a transaction manager; handlers own their writes
public class NoopUnitOfWorkFactory implements UnitOfWorkFactory {

    private static final UnitOfWork NOOP = new UnitOfWork() {
        @Override
        public void commit() {
        }

        @Override
        public void close() {
        }
    };

    @Override
    public UnitOfWork begin(String name) {
        return NOOP;
    }
}
