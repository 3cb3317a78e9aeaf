package com.cred.freestyle.salesdata.generator;

import com.cred.freestyle.salesdata.generator.PersistOutcome.FailureKind;
import jakarta.persistence.PersistenceException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Component;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.TransactionException;
import org.springframework.transaction.support.TransactionTemplate;

import java.util.function.Supplier;

/**
 * Runs a small piece of persistence work in its own transaction (REQUIRES_NEW) and reports
 * the result as a {@link PersistOutcome} instead of throwing.
 *
 * A failure rolls back only the work passed to {@link #run}; anything committed before, and
 * any transaction the caller may hold, is untouched.
 *
 * @author Sales Data Team
 */
@Component
public class IsolatedUnitOfWork {

    private static final Logger logger = LoggerFactory.getLogger(IsolatedUnitOfWork.class);

    private final TransactionTemplate transactionTemplate;

    public IsolatedUnitOfWork(PlatformTransactionManager transactionManager) {
        this.transactionTemplate = new TransactionTemplate(transactionManager);
        this.transactionTemplate.setPropagationBehavior(TransactionDefinition.PROPAGATION_REQUIRES_NEW);
    }

    /**
     * Execute work in a fresh transaction.
     *
     * @param description Short label used in log lines (e.g., "order item")
     * @param work Work to run
     * @return Success with the work's value, or failure with its kind
     */
    public <T> PersistOutcome<T> run(String description, Supplier<T> work) {
        try {
            T value = transactionTemplate.execute(status -> work.get());
            return PersistOutcome.success(value);
        } catch (DataAccessException | TransactionException | PersistenceException e) {
            logger.warn("Failed to persist {}: {}", description, rootMessage(e));
            return PersistOutcome.failure(FailureKind.PERSISTENCE, rootMessage(e));
        } catch (RuntimeException e) {
            logger.error("Unexpected error while persisting {}", description, e);
            return PersistOutcome.failure(FailureKind.UNEXPECTED, rootMessage(e));
        }
    }

    private static String rootMessage(Throwable throwable) {
        Throwable root = throwable;
        while (root.getCause() != null && root.getCause() != root) {
            root = root.getCause();
        }
        return root.getMessage() != null ? root.getMessage() : root.getClass().getSimpleName();
    }
}
