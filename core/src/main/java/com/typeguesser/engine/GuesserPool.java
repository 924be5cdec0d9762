package com.typeguesser.engine;

import com.typeguesser.config.GuessSettings;
import com.typeguesser.decider.DeciderRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Pool of reusable guessers for callers that guess many columns.
 *
 * <p>{@link #acquire()} hands out a retained guesser or creates a new one; it
 * never blocks and never resets. {@link #release(Guesser)} resets the guesser,
 * restores the pool's default settings and keeps it if fewer than
 * {@code maxRetained} guessers are idle. Released guessers therefore carry no
 * residue of earlier columns.
 *
 * <p>The pool is thread-safe; the guessers it hands out are not.
 *
 * <p>Example usage:
 * <pre>
 *   GuesserPool pool = new GuesserPool();
 *   try (PooledGuesser pooled = pool.borrow()) {
 *       pooled.get().adjustToCompensateForValues(column);
 *       DatabaseTypeRequest type = pooled.get().guess();
 *   } // reset and returned to the pool
 * </pre>
 *
 * <p>The default capacity is read from the system property
 * {@value #PROP_MAX_RETAINED}, falling back to twice the number of processors.
 */
public class GuesserPool implements AutoCloseable {

    private static final Logger logger = LoggerFactory.getLogger(GuesserPool.class);

    /** System property overriding the default number of retained guessers. */
    public static final String PROP_MAX_RETAINED = "typeguesser.pool.maxRetained";

    private final BlockingQueue<Guesser> idle;
    private final GuessSettings defaults;
    private final DeciderRegistry registry;
    private final int maxRetained;
    private final AtomicInteger created = new AtomicInteger();
    private volatile boolean closed = false;

    /**
     * Creates a pool with default settings and the configured capacity.
     */
    public GuesserPool() {
        this(new Configuration());
    }

    /**
     * Creates a pool with the specified configuration.
     *
     * @param config the configuration
     */
    public GuesserPool(Configuration config) {
        Objects.requireNonNull(config, "config must not be null");
        this.defaults = config.settings.copy();
        this.registry = config.registry;
        this.maxRetained = config.maxRetained > 0 ? config.maxRetained : getConfiguredMaxRetained();
        this.idle = new ArrayBlockingQueue<>(maxRetained);
        logger.debug("Guesser pool created, retaining at most {} guessers", maxRetained);
    }

    /**
     * Takes a guesser from the pool, creating one if none is idle.
     *
     * @return a guesser in its reset state with the pool's default settings
     * @throws IllegalStateException if the pool is closed
     */
    public Guesser acquire() {
        if (closed) {
            throw new IllegalStateException("Guesser pool is closed");
        }
        Guesser guesser = idle.poll();
        if (guesser != null) {
            return guesser;
        }
        created.incrementAndGet();
        return new Guesser(defaults.copy(), registry);
    }

    /**
     * Borrows a guesser that returns itself to the pool when closed.
     *
     * @return the loan
     * @throws IllegalStateException if the pool is closed
     */
    public PooledGuesser borrow() {
        return new PooledGuesser(acquire(), this);
    }

    /**
     * Resets a guesser and returns it to the pool.
     *
     * <p>Guessers beyond capacity, or released after {@link #close()}, are
     * dropped. Releasing a guesser that is still idle has no effect. A guesser
     * must not be released after it was handed out again; the pool cannot
     * tell such a stale release apart from a real one.
     *
     * @param guesser the guesser (may be null)
     */
    public void release(Guesser guesser) {
        if (guesser == null || idle.contains(guesser)) {
            return;
        }
        guesser.reset();
        guesser.getSettings().copyFrom(defaults);
        if (closed) {
            return;
        }
        if (!idle.offer(guesser)) {
            logger.debug("Guesser pool full ({} idle), discarding released guesser", maxRetained);
        }
    }

    /**
     * Drops every idle guesser. Acquiring afterwards fails.
     */
    @Override
    public void close() {
        if (closed) {
            return;
        }
        closed = true;
        int dropped = idle.size();
        idle.clear();
        logger.debug("Guesser pool closed, dropped {} idle guessers", dropped);
    }

    public boolean isClosed() {
        return closed;
    }

    public int getMaxRetained() {
        return maxRetained;
    }

    /**
     * Returns the number of guessers currently waiting in the pool.
     *
     * @return the idle count
     */
    public int idleCount() {
        return idle.size();
    }

    /**
     * Returns how many guessers this pool has constructed.
     *
     * @return the creation count
     */
    public int createdCount() {
        return created.get();
    }

    private static int getConfiguredMaxRetained() {
        String value = System.getProperty(PROP_MAX_RETAINED);
        if (value != null) {
            try {
                int size = Integer.parseInt(value.trim());
                if (size > 0) {
                    return size;
                }
                logger.warn("Ignoring non-positive {}={}", PROP_MAX_RETAINED, value);
            } catch (NumberFormatException e) {
                logger.warn("Ignoring invalid {}={}", PROP_MAX_RETAINED, value);
            }
        }
        return 2 * Runtime.getRuntime().availableProcessors();
    }

    /**
     * Configuration for the pool.
     */
    public static class Configuration {
        /** Maximum idle guessers kept (0 = system property or processor based default) */
        public int maxRetained = 0;

        /** Settings every pooled guesser starts from */
        public GuessSettings settings = new GuessSettings();

        /** Deciders the pooled guessers consult */
        public DeciderRegistry registry = DeciderRegistry.defaultRegistry();

        /**
         * Sets the number of idle guessers to keep.
         *
         * @param size the capacity (0 for the default)
         * @return this configuration
         */
        public Configuration withMaxRetained(int size) {
            if (size < 0) {
                throw new IllegalArgumentException("maxRetained must be non-negative");
            }
            this.maxRetained = size;
            return this;
        }

        public Configuration withSettings(GuessSettings settings) {
            this.settings = Objects.requireNonNull(settings, "settings must not be null");
            return this;
        }

        public Configuration withRegistry(DeciderRegistry registry) {
            this.registry = Objects.requireNonNull(registry, "registry must not be null");
            return this;
        }
    }
}
