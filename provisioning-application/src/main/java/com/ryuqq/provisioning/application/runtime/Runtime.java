package com.ryuqq.provisioning.application.runtime;

/**
 * Durable saga runtime.
 *
 * <p>A runtime advances persisted work that is due. It keeps no in-memory progress of its
 * own: everything it needs to resume is read from the stores on every call, so any instance
 * can pick up work another instance left behind.</p>
 *
 * <p><strong>pump() flow:</strong></p>
 * <pre>
 * 1. Claim due work with a lease (next_attempt_at &lt;= now, lease free or expired)
 * 2. Advance each claimed item by one step on the worker pool
 * 3. Handle the Outcome:
 *    - Ok    → persist the next stage
 *    - Retry → persist next_attempt_at = now + backoff, or fail once the stage budget is spent
 *    - Fail  → persist FAILED, run compensations, persist the terminal stage
 * 4. Return once the claimed batch is done
 * </pre>
 *
 * <p>pump() is typically invoked from a scheduler. Waits between retries are persisted,
 * never slept on a worker thread.</p>
 *
 * @author Provisioning Team
 * @since 1.0.0
 */
public interface Runtime {

    /**
     * Advance every due item once.
     *
     * <p>Implementations must be safe to call concurrently from several instances
     * sharing the same stores.</p>
     */
    void pump();
}
