package dev.upgrader;

import dev.upgrader.model.CycleOutcome;
import dev.upgrader.model.RunResult;
import dev.upgrader.model.RunTarget;
import dev.upgrader.service.RunCoordinator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Runs one upgrade pass over both catalogs on the calling thread (run-once mode).
 * Separated from the Application class for testability.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class CycleRunner {

    private static final String SEPARATOR = "========================================";

    private final RunCoordinator runCoordinator;

    /**
     * @return number of items tagged across both catalogs
     * @throws IllegalStateException when another run is in progress or a catalog failed
     */
    public int execute() {
        log.info(SEPARATOR);
        log.info("Upgrader Starting (run once)");
        log.info(SEPARATOR);

        RunResult result = runCoordinator.runNow(RunTarget.BOTH)
                .orElseThrow(() -> new IllegalStateException("Another upgrade run is already in progress"));
        if (!result.ok()) {
            throw new IllegalStateException("Upgrade run failed: " + result.error());
        }

        int tagged = result.cycles().values().stream()
                .map(CycleOutcome::selectedIds)
                .mapToInt(List::size)
                .sum();

        log.info(SEPARATOR);
        log.info("Upgrader Completed Successfully");
        log.info("Items tagged: {}", tagged);
        log.info(SEPARATOR);
        return tagged;
    }
}
