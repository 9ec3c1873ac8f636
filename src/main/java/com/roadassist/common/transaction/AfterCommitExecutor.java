package com.roadassist.common.transaction;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;
import org.springframework.transaction.support.TransactionSynchronization;
import org.springframework.transaction.support.TransactionSynchronizationManager;

import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;

/**
 * Hands work to the push executor once the surrounding transaction has committed.
 *
 * <p>Nothing is submitted when the transaction rolls back. Outside a transaction the task is
 * submitted immediately. Submission never throws to the caller.</p>
 */
@Slf4j
@Component
public class AfterCommitExecutor {

    private final Executor executor;

    public AfterCommitExecutor(@Qualifier("pushExecutor") Executor executor) {
        this.executor = executor;
    }

    public void execute(Runnable task) {
        if (TransactionSynchronizationManager.isSynchronizationActive()) {
            TransactionSynchronizationManager.registerSynchronization(new TransactionSynchronization() {
                @Override
                public void afterCommit() {
                    submit(task);
                }
            });
        } else {
            submit(task);
        }
    }

    private void submit(Runnable task) {
        try {
            executor.execute(task);
        } catch (RejectedExecutionException e) {
            log.warn("Post-commit task rejected, executor saturated: {}", e.getMessage());
        }
    }
}
