package com.eyelevel.uploadqueue.service.inflight;

import lombok.extern.slf4j.Slf4j;

/**
 * Cooperative cancellation handle for the operation currently driving one upload.
 * <p>
 * The token is bound to one operation at a time (the transfer subscription, then each poll timer in
 * turn). Binding replaces the previous hook. Once cancelled, the current hook runs and any operation
 * bound afterwards is cancelled on the spot, so a late hand-off can never start a timer for an upload
 * that has already been removed.
 */
@Slf4j
public final class CancellationToken {

    private final String uploadId;
    private Runnable cancelHook;
    private boolean cancelled;

    public CancellationToken(String uploadId) {
        this.uploadId = uploadId;
    }

    public String getUploadId() {
        return uploadId;
    }

    /**
     * Makes {@code hook} the way to abort the operation now driving the upload.
     */
    public void bind(Runnable hook) {
        final boolean runNow;
        synchronized (this) {
            runNow = cancelled;
            if (!runNow) {
                cancelHook = hook;
            }
        }
        if (runNow) {
            log.debug("Token for upload {} already cancelled, aborting newly bound operation.", uploadId);
            hook.run();
        }
    }

    /**
     * Cancels the bound operation.
     *
     * @return {@code false} if the token had already been cancelled
     */
    public boolean cancel() {
        final Runnable hook;
        synchronized (this) {
            if (cancelled) {
                return false;
            }
            cancelled = true;
            hook = cancelHook;
            cancelHook = null;
        }
        if (hook != null) {
            hook.run();
        }
        return true;
    }

    public synchronized boolean isCancelled() {
        return cancelled;
    }
}
