package com.myorg.saga.eventing.runtime;

import lombok.extern.slf4j.Slf4j;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.TransactionStatus;
import org.springframework.transaction.support.DefaultTransactionDefinition;

/**
 * Every message gets a fresh transaction ({@code REQUIRES_NEW}), never one left open by
 * a previous record on the same consumer thread.
 */
@Slf4j
public class TransactionalUnitOfWorkFactory implements UnitOfWorkFactory {

    private final PlatformTransactionManager txManager;

    public TransactionalUnitOfWorkFactory(PlatformTransactionManager txManager) {
        this.txManager = txManager;
    }

    @Override
    public UnitOfWork begin(String name) {
        DefaultTransactionDefinition def = new DefaultTransactionDefinition(TransactionDefinition.PROPAGATION_REQUIRES_NEW);
        def.setName(name);
        return new TxUnitOfWork(txManager, txManager.getTransaction(def), name);
    }

    private static final class TxUnitOfWork implements UnitOfWork {

        private final PlatformTransactionManager txManager;
        private final TransactionStatus status;
        private final String name;

        private TxUnitOfWork(PlatformTransactionManager txManager, TransactionStatus status, String name) {
            this.txManager = txManager;
            this.status = status;
            this.name = name;
        }

        @Override
        public void commit() {
            txManager.commit(status);
        }

        @Override
        public void close() {
            if (!status.isCompleted()) {
                log.debug("Rolling back unit of work {}", name);
                txManager.rollback(status);
            }
        }
    }
}
