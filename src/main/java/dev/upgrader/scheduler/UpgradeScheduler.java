package dev.upgrader.scheduler;

import dev.upgrader.config.ScheduleConfig;
import dev.upgrader.model.TriggerResult;
import dev.upgrader.service.RunCoordinator;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Periodic upgrade runs through the same coordinator as the HTTP trigger, so a tick
 * that lands during a run is skipped.
 *
 * Default schedule: top of every hour, UTC. Override with schedule.cron / schedule.zone.
 */
@Slf4j
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(prefix = "schedule", name = "enabled", havingValue = "true", matchIfMissing = true)
public class UpgradeScheduler {

    private final RunCoordinator runCoordinator;
    private final ScheduleConfig scheduleConfig;

    @PostConstruct
    public void announce() {
        log.info("Upgrade scheduler ready. Cron: {} ({}), target: {}",
                scheduleConfig.getCron(), scheduleConfig.getZone(), scheduleConfig.getRunTarget().wireName());
    }

    @Scheduled(cron = "${schedule.cron:0 0 * * * *}", zone = "${schedule.zone:UTC}")
    public void scheduledRun() {
        log.info("Scheduled upgrade run triggered");
        try {
            if (runCoordinator.trigger(scheduleConfig.getRunTarget()) == TriggerResult.CONFLICT) {
                log.info("Scheduled run skipped: a run is already in progress");
            }
        } catch (RuntimeException e) {
            log.error("Scheduled upgrade run could not start: {}", e.getMessage(), e);
        }
    }
}
