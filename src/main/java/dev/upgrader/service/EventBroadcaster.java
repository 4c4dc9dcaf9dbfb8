package dev.upgrader.service;

import dev.upgrader.model.EventType;
import dev.upgrader.model.ProgressEvent;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Sinks;

import java.time.Clock;

/**
 * Fan-out of progress events to any number of stream subscribers.
 * <p>
 * Every subscriber receives each event published after it subscribed, through its
 * own unbounded buffer. Publishing never waits for subscribers; a slow subscriber
 * only falls behind. Events published while nobody listens are dropped.
 */
@Slf4j
@Component
public class EventBroadcaster {

    private final Sinks.Many<ProgressEvent> sink = Sinks.many().multicast().directBestEffort();
    private final Clock clock;
    private long sequence;

    public EventBroadcaster(Clock clock) {
        this.clock = clock;
    }

    public synchronized ProgressEvent publish(EventType type, String data) {
        ProgressEvent event = new ProgressEvent(++sequence, type, data, clock.instant());
        Sinks.EmitResult result = sink.tryEmitNext(event);
        if (result.isFailure() && result != Sinks.EmitResult.FAIL_ZERO_SUBSCRIBER) {
            log.warn("Progress event {} not delivered: {}", event.sequence(), result);
        }
        return event;
    }

    public ProgressEvent info(String data) {
        return publish(EventType.INFO, data);
    }

    public ProgressEvent error(String data) {
        return publish(EventType.ERROR, data);
    }

    public ProgressEvent done(String data) {
        return publish(EventType.DONE, data);
    }

    /**
     * Live events from now on, buffered per subscriber.
     */
    public Flux<ProgressEvent> subscribe() {
        return sink.asFlux().onBackpressureBuffer();
    }

    public int subscriberCount() {
        return sink.currentSubscriberCount();
    }
}
