package com.chainmirror.ingestion.job;

import com.chainmirror.ingestion.config.IndexingProperties;
import com.chainmirror.ingestion.reconcile.ChainStateException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.SpringApplication;
import org.springframework.context.ApplicationContext;
import org.springframework.stereotype.Component;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Stops indexing after a broken blocks-table invariant or a too deep reorg. Once halted, cycles are refused until
 * restart; with {@code chainmirror.indexing.exit-on-invariant-violation} the application exits with code 1.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class FatalInvariantHandler {

    static final int EXIT_CODE = 1;

    private final IndexingProperties indexingProperties;
    private final ApplicationContext applicationContext;
    private final AtomicBoolean halted = new AtomicBoolean(false);

    public void handle(ChainStateException e, String cycleId) {
        halted.set(true);
        log.error("Indexing cycle {} hit a fatal chain state error, indexing halted: {}", cycleId, e.getMessage(), e);
        if (indexingProperties.isExitOnInvariantViolation()) {
            // exit off the scheduler thread, which the context shutdown waits on
            Thread exit = new Thread(() -> System.exit(SpringApplication.exit(applicationContext, () -> EXIT_CODE)),
                    "fatal-invariant-exit");
            exit.start();
        }
    }

    public boolean isHalted() {
        return halted.get();
    }
}
