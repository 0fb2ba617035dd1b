package com.skillsarena.platform.config;

import com.skillsarena.platform.exception.TransientFailureException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.dao.TransientDataAccessException;
import org.springframework.stereotype.Component;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

import java.util.function.Supplier;

/**
 * Runs a unit of work in its own transaction and replays it when the database
 * reports a transient conflict (deadlock, lock timeout, serialization failure).
 * Each attempt starts a fresh transaction, so nothing from a failed attempt is
 * visible to the next one.
 */
@Component
public class TransactionalRetryExecutor {

    private static final Logger logger = LoggerFactory.getLogger(TransactionalRetryExecutor.class);

    private final TransactionTemplate txTemplate;
    private final int maxAttempts;

    @Autowired
    public TransactionalRetryExecutor(
            PlatformTransactionManager txManager,
            @Value("${skillsarena.transaction.max-attempts:3}") int maxAttempts) {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("max-attempts must be at least 1");
        }
        this.txTemplate = new TransactionTemplate(txManager);
        this.maxAttempts = maxAttempts;
    }

    public <T> T execute(String operation, Supplier<T> work) {
        TransientDataAccessException lastFailure = null;
        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            try {
                return txTemplate.execute(status -> work.get());
            } catch (TransientDataAccessException e) {
                lastFailure = e;
                logger.warn("Transient failure during {} (attempt {}/{}): {}",
                    operation, attempt, maxAttempts, e.getMessage());
            }
        }
        logger.error("Giving up on {} after {} attempts", operation, maxAttempts, lastFailure);
        throw new TransientFailureException(
            "Temporary storage conflict during " + operation + ", please retry", lastFailure);
    }

    public int getMaxAttempts() {
        return maxAttempts;
    }
}
