package com.amannmalik.money.decimal;

import com.amannmalik.money.util.Ensure;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.atomic.AtomicReference;

/**
 * Rounding configuration for {@link Decimal} operations that are not given an explicit scale.
 *
 * <p>A context can be passed explicitly to the operations that accept one. Operations without a scale
 * or context read the process-wide context at call time, which changes only through
 * {@link #configure(DecimalContext)} and {@link #reset()}.
 */
public record DecimalContext(int defaultScale) {
    public static final int MAX_SCALE = 1_000_000_000;
    public static final DecimalContext DEFAULT = new DecimalContext(20);

    private static final Logger LOG = LoggerFactory.getLogger(DecimalContext.class);
    private static final AtomicReference<DecimalContext> CURRENT = new AtomicReference<>(DEFAULT);

    public DecimalContext {
        Ensure.inRange("decimal.default_scale", defaultScale, 0, MAX_SCALE);
    }

    public static DecimalContext current() {
        return CURRENT.get();
    }

    /**
     * Replaces the process-wide context.
     *
     * @return the context that was in effect before the call
     */
    public static DecimalContext configure(DecimalContext context) {
        Ensure.notNull("context", context);
        var previous = CURRENT.getAndSet(context);
        if (!previous.equals(context)) {
            LOG.info("Default decimal scale changed from {} to {}", previous.defaultScale(), context.defaultScale());
        }
        return previous;
    }

    public static DecimalContext reset() {
        return configure(DEFAULT);
    }
}
