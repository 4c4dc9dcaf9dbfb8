package dev.upgrader.web;

import dev.upgrader.error.ValidationException;
import dev.upgrader.model.CatalogKind;
import dev.upgrader.model.ProgressEvent;
import dev.upgrader.model.RecentUpgrade;
import dev.upgrader.model.RunStatus;
import dev.upgrader.model.RunTarget;
import dev.upgrader.model.TriggerResult;
import dev.upgrader.service.EventBroadcaster;
import dev.upgrader.service.LibraryReportService;
import dev.upgrader.service.ManualUpgradeService;
import dev.upgrader.service.RunCoordinator;
import dev.upgrader.service.RunStateStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.http.codec.ServerSentEvent;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Flux;

import java.time.Duration;
import java.util.List;
import java.util.Map;

@Slf4j
@RestController
@RequiredArgsConstructor
public class UpgraderController {

    static final Duration KEEPALIVE_INTERVAL = Duration.ofSeconds(15);

    private final RunCoordinator runCoordinator;
    private final RunStateStore stateStore;
    private final EventBroadcaster events;
    private final LibraryReportService reports;
    private final ManualUpgradeService manualUpgrades;

    @GetMapping(path = "/healthz", produces = MediaType.TEXT_PLAIN_VALUE)
    public String healthz() {
        return "ok";
    }

    @GetMapping("/api/status")
    public RunStatus status() {
        return stateStore.getStatus();
    }

    @GetMapping("/api/upgrade-summary")
    public Map<String, Object> upgradeSummary(@RequestParam(defaultValue = "false") boolean detailed) {
        return reports.upgradeSummary(detailed);
    }

    // ── Runs ──────────────────────────────────────────────────────────────────

    @PostMapping("/api/trigger")
    public ResponseEntity<Map<String, Object>> trigger(@RequestBody(required = false) TriggerRequest request) {
        RunTarget target = RunTarget.fromWire(request != null ? request.target() : null);
        TriggerResult result = runCoordinator.trigger(target);
        return switch (result) {
            case ACCEPTED -> ResponseEntity.accepted().body(Map.of("accepted", true, "target", target.wireName()));
            case CONFLICT -> ResponseEntity.status(HttpStatus.CONFLICT).body(Map.of("error", "Run already in progress"));
        };
    }

    /**
     * Live progress events. Starts with a {@code stream start} comment and sends a
     * keepalive comment every 15 seconds.
     */
    @GetMapping(path = "/api/events", produces = MediaType.TEXT_EVENT_STREAM_VALUE)
    public Flux<ServerSentEvent<String>> events() {
        Flux<ServerSentEvent<String>> live = events.subscribe().map(UpgraderController::toSse);
        Flux<ServerSentEvent<String>> keepalive = Flux.interval(KEEPALIVE_INTERVAL, KEEPALIVE_INTERVAL)
                .map(tick -> comment("keepalive"));
        return Flux.merge(live, keepalive)
                .startWith(comment("stream start"))
                .doOnCancel(() -> log.debug("Event stream subscriber left"));
    }

    @GetMapping("/api/recent-upgrades")
    public Map<String, List<RecentUpgrade>> recentUpgrades() {
        return reports.recentUpgrades();
    }

    /**
     * {@code tagged} returns the recently tagged items, {@code eligible} the items the
     * next cycle may pick, neither the live download queues.
     */
    @GetMapping("/api/download-queue")
    public Map<String, ?> downloadQueue(@RequestParam(defaultValue = "false") boolean tagged,
                                        @RequestParam(defaultValue = "false") boolean eligible) {
        if (tagged) {
            return reports.recentUpgrades();
        }
        if (eligible) {
            return reports.eligibleItems();
        }
        return reports.downloadQueue();
    }

    // ── Single-item actions ───────────────────────────────────────────────────

    @PostMapping("/api/upgrade-item")
    public Map<String, Object> upgradeItem(@RequestBody ItemRequest request) {
        manualUpgrades.upgradeItem(request.kind(), request.requiredId());
        return Map.of("ok", true);
    }

    @PostMapping("/api/force-upgrade-item")
    public Map<String, Object> forceUpgradeItem(@RequestBody ItemRequest request) {
        manualUpgrades.forceUpgradeItem(request.kind(), request.requiredId());
        return Map.of("ok", true);
    }

    private static ServerSentEvent<String> toSse(ProgressEvent event) {
        return ServerSentEvent.<String>builder()
                .id(Long.toString(event.sequence()))
                .event(event.type().wireName())
                .data(event.data())
                .build();
    }

    private static ServerSentEvent<String> comment(String text) {
        return ServerSentEvent.<String>builder().comment(text).build();
    }

    public record TriggerRequest(String target) {
    }

    public record ItemRequest(String target, Integer id) {

        CatalogKind kind() {
            return CatalogKind.fromWire(target);
        }

        int requiredId() {
            if (id == null) {
                throw new ValidationException("Missing item id");
            }
            return id;
        }
    }
}
