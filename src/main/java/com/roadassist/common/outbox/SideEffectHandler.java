package com.roadassist.common.outbox;

/**
 * Applies one kind of side effect from its JSON payload.
 *
 * <p>Implementations run inside the relay's per-attempt transaction. Throwing marks the
 * attempt as failed; the entry is retried until the attempt budget is spent.</p>
 */
public interface SideEffectHandler {

    SideEffectType type();

    void apply(String payload);
}
