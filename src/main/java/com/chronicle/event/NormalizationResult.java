package com.chronicle.event;

import java.util.Objects;
import java.util.Optional;

/**
 * Either a canonical event or a rejection, never both.
 */
public final class NormalizationResult {

    private final HookEvent event;
    private final Rejection rejection;

    private NormalizationResult(HookEvent event, Rejection rejection) {
        this.event = event;
        this.rejection = rejection;
    }

    public static NormalizationResult accepted(HookEvent event) {
        return new NormalizationResult(Objects.requireNonNull(event, "event"), null);
    }

    public static NormalizationResult rejected(Rejection rejection) {
        return new NormalizationResult(null, Objects.requireNonNull(rejection, "rejection"));
    }

    public boolean isAccepted() {
        return event != null;
    }

    public Optional<HookEvent> getEvent() {
        return Optional.ofNullable(event);
    }

    public Optional<Rejection> getRejection() {
        return Optional.ofNullable(rejection);
    }
}
