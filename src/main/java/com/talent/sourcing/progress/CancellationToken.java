package com.talent.sourcing.progress;

import java.util.concurrent.atomic.AtomicReference;

/**
 * Cooperative abort flag shared between a caller and a run. Stages check it between
 * units of work (per entity, per batch, per page), never in the middle of an external call.
 */
public final class CancellationToken {

    private final AtomicReference<String> reason = new AtomicReference<>();
    private final CancellationToken parent;

    private CancellationToken(CancellationToken parent) {
        this.parent = parent;
    }

    public static CancellationToken create() {
        return new CancellationToken(null);
    }

    /**
     * A token that is cancelled when this one is, and that can also be cancelled on its own
     * without affecting this one.
     */
    public CancellationToken child() {
        return new CancellationToken(this);
    }

    /**
     * Requests cancellation. The first reason wins.
     */
    public void cancel(String why) {
        reason.compareAndSet(null, why != null ? why : "cancelled");
    }

    public boolean isCancelled() {
        return getReason() != null;
    }

    /**
     * This token's own reason, or the nearest ancestor's; null while nothing is cancelled.
     */
    public String getReason() {
        String own = reason.get();
        return own != null || parent == null ? own : parent.getReason();
    }

    /**
     * @throws PipelineCancelledException if cancellation was requested
     */
    public void throwIfCancelled() {
        String why = getReason();
        if (why != null) {
            throw new PipelineCancelledException(why);
        }
    }
}
