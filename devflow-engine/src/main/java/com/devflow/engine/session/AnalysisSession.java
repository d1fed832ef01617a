package com.devflow.engine.session;

import com.devflow.engine.ProcessAnalysisEngine;
import com.devflow.process.model.AnalysisResult;
import com.devflow.process.model.Event;
import java.time.Clock;
import java.time.Instant;
import java.util.Collection;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Explicitly owned holder of the latest analysis for consumers that work against "the current" result, such as a
 * report or retrieval step. A failed analysis leaves the previously published result in place.
 */
public final class AnalysisSession {
    private final UUID id = UUID.randomUUID();
    private final ProcessAnalysisEngine engine;
    private final Clock clock;
    private final AtomicReference<Snapshot> current = new AtomicReference<>();

    public AnalysisSession(ProcessAnalysisEngine engine, Clock clock) {
        this.engine = engine;
        this.clock = clock;
    }

    public UUID id() {
        return id;
    }

    /** Runs the engine and publishes the result only once it is complete. */
    public AnalysisResult analyze(Collection<Event> events) {
        AnalysisResult result = engine.analyze(events);
        current.set(new Snapshot(result, clock.instant()));
        return result;
    }

    public Optional<AnalysisResult> current() {
        Snapshot snapshot = current.get();
        return snapshot == null ? Optional.empty() : Optional.of(snapshot.result());
    }

    public AnalysisResult requireCurrent() {
        return current().orElseThrow(() -> new IllegalStateException("No analysis has completed in session " + id));
    }

    public Optional<Instant> analyzedAt() {
        Snapshot snapshot = current.get();
        return snapshot == null ? Optional.empty() : Optional.of(snapshot.analyzedAt());
    }

    public void clear() {
        current.set(null);
    }

    private record Snapshot(AnalysisResult result, Instant analyzedAt) {}
}
