package com.ivamare.architecture.uow;

import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

/**
 * Flushes inside a Spring-managed transaction.
 *
 * <p>A failing flush marks the transaction rollback-only before the unit of
 * work translates the failure.
 */
public class SpringTransactionFlush implements FlushTransaction {

    private final TransactionTemplate transactionTemplate;

    public SpringTransactionFlush(PlatformTransactionManager transactionManager) {
        this.transactionTemplate = new TransactionTemplate(transactionManager);
    }

    @Override
    public void execute(Runnable flush) {
        transactionTemplate.executeWithoutResult(status -> flush.run());
    }
}
