package com.example.rental.infrastructure.sequence;

import com.example.rental.application.exception.SequenceGenerationFailedException;
import com.example.rental.application.port.out.SequenceGenerator;
import com.example.rental.infrastructure.persistence.entity.SequenceCounterEntity;
import com.example.rental.infrastructure.persistence.repository.SequenceCounterRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Component;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.TransactionException;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Clock;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * Sequence generator backed by one locked row per counter.
 * <p>
 * Each {@link #next(String)} runs its own transaction: {@code SELECT ... FOR UPDATE} on the
 * counter row, increment, commit. The row lock serializes callers across connections and
 * processes. The optional in-process lock only cuts contention from threads of this JVM.
 */
@Component
public class JpaSequenceGenerator implements SequenceGenerator {

    private static final Logger log = LoggerFactory.getLogger(JpaSequenceGenerator.class);

    static final int MAX_COUNTER_NAME_LENGTH = 50;

    private final SequenceCounterRepository repository;
    private final TransactionTemplate incrementTx;
    private final TransactionTemplate createTx;
    private final TransactionTemplate readTx;
    private final Clock clock;
    private final boolean localLockEnabled;
    private final Map<String, ReentrantLock> localLocks = new ConcurrentHashMap<>();

    public JpaSequenceGenerator(
            SequenceCounterRepository repository,
            PlatformTransactionManager transactionManager,
            Clock clock,
            @Value("${rental.sequence.isolation:READ_COMMITTED}") SequenceIsolation isolation,
            @Value("${rental.sequence.local-lock-enabled:true}") boolean localLockEnabled) {
        this.repository = repository;
        this.clock = clock;
        this.localLockEnabled = localLockEnabled;

        this.incrementTx = new TransactionTemplate(transactionManager);
        this.incrementTx.setPropagationBehavior(TransactionDefinition.PROPAGATION_REQUIRES_NEW);
        this.incrementTx.setIsolationLevel(isolation.level());

        this.createTx = new TransactionTemplate(transactionManager);
        this.createTx.setPropagationBehavior(TransactionDefinition.PROPAGATION_REQUIRES_NEW);

        this.readTx = new TransactionTemplate(transactionManager);
        this.readTx.setReadOnly(true);

        log.info("[SEQ] Sequence generator ready: isolation={}, localLock={}", isolation, localLockEnabled);
    }

    @Override
    public long next(String counterName) {
        validateName(counterName);
        if (!localLockEnabled) {
            return translated(counterName, () -> increment(counterName));
        }
        ReentrantLock lock = localLocks.computeIfAbsent(counterName, name -> new ReentrantLock());
        lock.lock();
        try {
            return translated(counterName, () -> increment(counterName));
        } finally {
            lock.unlock();
        }
    }

    private long increment(String counterName) {
        ensureCounterExists(counterName);
        Long value = incrementTx.execute(status -> {
            SequenceCounterEntity counter = repository.findForUpdate(counterName)
                    .orElseThrow(() -> new IllegalStateException("Counter vanished after creation: " + counterName));
            return counter.increment(clock.instant());
        });
        log.debug("[SEQ] {} -> {}", counterName, value);
        return value;
    }

    private void ensureCounterExists(String counterName) {
        if (repository.existsById(counterName)) {
            return;
        }
        try {
            createTx.executeWithoutResult(status ->
                    repository.saveAndFlush(new SequenceCounterEntity(counterName, 0, clock.instant())));
            log.info("[SEQ] Counter created: {}", counterName);
        } catch (DataIntegrityViolationException e) {
            log.debug("[SEQ] Counter {} created concurrently", counterName);
        }
    }

    @Override
    public long peek(String counterName) {
        validateName(counterName);
        Long value = translated(counterName, () -> readTx.execute(status -> repository.findById(counterName)
                .map(SequenceCounterEntity::getLastValue)
                .orElse(0L)));
        return value;
    }

    @Override
    public void reset(String counterName, long value) {
        validateName(counterName);
        if (value < 0) {
            throw new IllegalArgumentException("Counter value cannot be negative: " + value);
        }
        translated(counterName, () -> {
            ensureCounterExists(counterName);
            return incrementTx.execute(status -> {
                SequenceCounterEntity counter = repository.findForUpdate(counterName)
                        .orElseThrow(() -> new IllegalStateException("Counter vanished after creation: " + counterName));
                counter.overwrite(value, clock.instant());
                return value;
            });
        });
        log.warn("[SEQ] Counter {} reset to {}", counterName, value);
    }

    private <T> T translated(String counterName, Supplier<T> work) {
        try {
            return work.get();
        } catch (DataAccessException | TransactionException e) {
            log.warn("[SEQ] Transaction on counter {} aborted: {}", counterName, e.getMessage());
            throw new SequenceGenerationFailedException(counterName, e);
        }
    }

    private static void validateName(String counterName) {
        if (counterName == null || counterName.isBlank()) {
            throw new IllegalArgumentException("Counter name cannot be blank");
        }
        if (counterName.length() > MAX_COUNTER_NAME_LENGTH) {
            throw new IllegalArgumentException(
                    "Counter name cannot exceed " + MAX_COUNTER_NAME_LENGTH + " characters: " + counterName);
        }
    }
}
