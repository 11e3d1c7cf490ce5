package com.simrelay.core.state;

import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Holds the most recent {@link Snapshot}. Replacement is a single reference swap, so
 * readers see either the previous or the new tree, never a mix.
 */
@Component
public class StateStore {

    private static final Logger log = LoggerFactory.getLogger(StateStore.class);

    private final AtomicReference<Snapshot> current = new AtomicReference<>();
    private final Clock clock;

    public StateStore() {
        this(Clock.systemUTC());
    }

    StateStore(Clock clock) {
        this.clock = clock;
    }

    public Snapshot replace(ObjectNode data, String timestamp) {
        Snapshot snapshot = Snapshot.of(data, timestamp, clock.instant());
        current.set(snapshot);
        log.info("Snapshot replaced: {} top-level keys, last_updated={}", data.size(), timestamp);
        return snapshot;
    }

    public Optional<Snapshot> current() {
        return Optional.ofNullable(current.get());
    }

    public boolean isPopulated() {
        return current.get() != null;
    }
}
