package com.lazyframe.runtime;

import com.lazyframe.exception.CancelledException;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Cooperative cancellation flag of one execution.
 *
 * <p>Executors check the token between morsels and between partition units; once it is
 * cancelled no new unit of work is started. Work already running completes. Any thread
 * may cancel.
 *
 * <p>Example usage:
 * <pre>
 *   CancellationToken token = new CancellationToken();
 *   Future&lt;ColumnarBatch&gt; result = executor.submit(() -&gt; frame.collect(config, token));
 *   ...
 *   token.cancel();
 * </pre>
 */
public final class CancellationToken {

    private final AtomicBoolean cancelled = new AtomicBoolean(false);

    /**
     * Requests cancellation. Idempotent.
     *
     * @return true if this call cancelled the token
     */
    public boolean cancel() {
        return cancelled.compareAndSet(false, true);
    }

    public boolean isCancelled() {
        return cancelled.get();
    }

    /**
     * Throws if cancellation was requested.
     *
     * @param operator the operator about to start a unit of work
     * @throws CancelledException if the token is cancelled
     */
    public void throwIfCancelled(String operator) {
        if (cancelled.get()) {
            throw new CancelledException("execution cancelled").withOperator(operator);
        }
    }

    @Override
    public String toString() {
        return "CancellationToken(cancelled=" + cancelled.get() + ")";
    }
}
