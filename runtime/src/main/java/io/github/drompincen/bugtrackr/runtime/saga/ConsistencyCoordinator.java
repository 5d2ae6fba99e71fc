package io.github.drompincen.bugtrackr.runtime.saga;

import io.github.drompincen.bugtrackr.persistence.store.StoreSettings;
import io.github.drompincen.bugtrackr.protocol.error.ConsistencyFatalException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;

/**
 * Runs a {@link CompensableWrite} as one unit over a store without multi-item
 * transactions.
 * <ol>
 *   <li>preconditions, before any write;</li>
 *   <li>primary write; a failure here propagates as is;</li>
 *   <li>follow-up write with the timestamp taken before the primary write;</li>
 *   <li>on follow-up failure, compensate and rethrow the follow-up failure;</li>
 *   <li>if compensation fails too, raise {@link ConsistencyFatalException} locating the
 *       orphaned item.</li>
 * </ol>
 */
@Component
public class ConsistencyCoordinator {

    private static final Logger log = LoggerFactory.getLogger(ConsistencyCoordinator.class);

    private final Clock clock;

    public ConsistencyCoordinator(Clock clock) {
        this.clock = clock;
    }

    public <T> T execute(CompensableWrite<T> write) {
        write.checkPreconditions();
        Instant at = clock.instant();
        T written = write.apply(at);

        try {
            write.followUp(written, at);
            return written;
        } catch (RuntimeException followUpFailure) {
            ItemRef ref = write.locate(written);
            log.warn("Follow-up of '{}' failed for item '{}', compensating: {}",
                    write.operation(), ref.id(), followUpFailure.getMessage());
            try {
                write.compensate(written);
            } catch (RuntimeException rollbackFailure) {
                ConsistencyFatalException fatal = new ConsistencyFatalException(
                        write.operation(), ref.collection(), ref.id(), followUpFailure);
                fatal.addSuppressed(rollbackFailure);
                log.error("CRITICAL: rollback of '{}' failed, item '{}' in collection '{}' needs manual cleanup",
                        write.operation(), ref.id(), StoreSettings.label(ref.collection()), rollbackFailure);
                throw fatal;
            }
            log.info("Rolled back '{}' for item '{}'", write.operation(), ref.id());
            throw followUpFailure;
        }
    }
}
