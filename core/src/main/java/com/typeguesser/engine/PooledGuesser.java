package com.typeguesser.engine;

import java.util.Objects;

/**
 * Auto-closeable loan of a {@link Guesser} from a {@link GuesserPool}.
 *
 * <p>Closing the loan resets the guesser and hands it back, even when the
 * caller leaves the try block with an exception:
 * <pre>
 *   try (PooledGuesser pooled = pool.borrow()) {
 *       pooled.get().adjustToCompensateForValue("42");
 *   }
 * </pre>
 *
 * @see GuesserPool
 */
public class PooledGuesser implements AutoCloseable {

    private final Guesser guesser;
    private final GuesserPool pool;
    private boolean released = false;

    PooledGuesser(Guesser guesser, GuesserPool pool) {
        this.guesser = Objects.requireNonNull(guesser, "guesser must not be null");
        this.pool = Objects.requireNonNull(pool, "pool must not be null");
    }

    /**
     * Returns the borrowed guesser.
     *
     * @return the guesser
     * @throws IllegalStateException if the loan was already closed
     */
    public Guesser get() {
        if (released) {
            throw new IllegalStateException("Guesser already released to pool");
        }
        return guesser;
    }

    /**
     * Returns the guesser to the pool. Calling this more than once has no further effect.
     */
    @Override
    public void close() {
        if (!released) {
            released = true;
            pool.release(guesser);
        }
    }

    public boolean isReleased() {
        return released;
    }
}
