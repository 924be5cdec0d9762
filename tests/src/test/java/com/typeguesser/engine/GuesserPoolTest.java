package com.typeguesser.engine;

import com.typeguesser.config.GuessSettings;
import com.typeguesser.decider.DeciderRegistry;
import com.typeguesser.decider.IntegerTypeDecider;
import com.typeguesser.decider.StringTypeDecider;
import com.typeguesser.exception.MixedTypingException;
import com.typeguesser.test.TestBase;
import com.typeguesser.test.TestCategories;
import com.typeguesser.types.DataSize;
import com.typeguesser.types.DatabaseTypeRequest;
import com.typeguesser.types.TypeTag;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.*;

/**
 * Tests for guesser pooling.
 *
 * <p>These tests verify that:
 * <ul>
 *   <li>Released guessers carry no state from earlier columns</li>
 *   <li>Settings changed by a borrower are restored on release</li>
 *   <li>The pool keeps at most its configured number of guessers</li>
 *   <li>Loans release exactly once</li>
 *   <li>Concurrent borrowing is thread-safe</li>
 * </ul>
 */
@TestCategories.Tier1
@TestCategories.Unit
@DisplayName("Guesser Pool Tests")
public class GuesserPoolTest extends TestBase {

    private GuesserPool pool;

    @Override
    protected void doSetUp() {
        pool = new GuesserPool(new GuesserPool.Configuration().withMaxRetained(2));
    }

    @Override
    protected void doTearDown() {
        System.clearProperty(GuesserPool.PROP_MAX_RETAINED);
        if (pool != null && !pool.isClosed()) {
            pool.close();
        }
    }

    // ==================== Reuse ====================

    @Nested
    @DisplayName("Reuse Tests")
    class ReuseTests {

        @Test
        @DisplayName("A reused guesser starts from nothing")
        void testNoResidue() {
            Guesser first = pool.acquire();
            first.adjustToCompensateForValues(List.of("1", "22", "333"));
            assertThat(first.guess().typeTag()).isEqualTo(TypeTag.INTEGER);
            pool.release(first);

            Guesser second = pool.acquire();
            second.adjustToCompensateForValue("false");

            assertThat(second).isSameAs(first);
            assertThat(second.guess()).isEqualTo(new DatabaseTypeRequest(TypeTag.BOOLEAN, DataSize.ofLength(5)));
        }

        @Test
        @DisplayName("Release clears the input regime")
        void testRegimeCleared() {
            Guesser guesser = pool.acquire();
            guesser.adjustToCompensateForValue(5L);
            pool.release(guesser);

            Guesser reused = pool.acquire();

            assertThatCode(() -> reused.adjustToCompensateForValue("x")).doesNotThrowAnyException();
            assertThat(reused.getValueCount()).isEqualTo(1);
        }

        @Test
        @DisplayName("A guesser kept without release remembers its regime")
        void testNoImplicitReset() {
            Guesser guesser = pool.acquire();
            guesser.adjustToCompensateForValue(5L);

            assertThatThrownBy(() -> guesser.adjustToCompensateForValue("x"))
                .isInstanceOfSatisfying(MixedTypingException.class,
                    e -> assertThat(e.getKind()).isEqualTo(MixedTypingException.Kind.STRING_AFTER_HARD_TYPED));
        }

        @Test
        @DisplayName("Settings changed by a borrower are restored")
        void testSettingsRestored() {
            GuesserPool lenient = new GuesserPool(new GuesserPool.Configuration()
                .withMaxRetained(1)
                .withSettings(new GuessSettings().withCharCanBeBoolean(true)));
            try {
                Guesser guesser = lenient.acquire();
                guesser.getSettings().withCharCanBeBoolean(false).withExtraLengthPerNonAsciiCharacter(3);
                lenient.release(guesser);

                Guesser reused = lenient.acquire();
                reused.adjustToCompensateForValues(List.of("Y", "N"));

                assertThat(reused).isSameAs(guesser);
                assertThat(reused.getSettings())
                    .isEqualTo(new GuessSettings().withCharCanBeBoolean(true));
                assertThat(reused.guess().typeTag()).isEqualTo(TypeTag.BOOLEAN);
            } finally {
                lenient.close();
            }
        }

        @Test
        @DisplayName("Pooled guessers consult the configured registry")
        void testCustomRegistry() {
            DeciderRegistry numbersOnly = new DeciderRegistry(
                List.of(IntegerTypeDecider.get(), StringTypeDecider.get()));
            try (GuesserPool custom = new GuesserPool(new GuesserPool.Configuration().withRegistry(numbersOnly))) {
                Guesser guesser = custom.acquire();
                guesser.adjustToCompensateForValues(List.of("true", "false"));

                assertThat(guesser.getRegistry()).isSameAs(numbersOnly);
                assertThat(guesser.guess().typeTag()).isEqualTo(TypeTag.STRING);
            }
        }

        @Test
        @DisplayName("Each created guesser owns its settings")
        void testSettingsNotShared() {
            Guesser a = pool.acquire();
            Guesser b = pool.acquire();

            a.getSettings().withCharCanBeBoolean(true);

            assertThat(b.getSettings().isCharCanBeBoolean()).isFalse();
        }
    }

    // ==================== Capacity ====================

    @Nested
    @DisplayName("Capacity Tests")
    class CapacityTests {

        @Test
        @DisplayName("Acquire creates guessers when none are idle")
        void testCreatesOnDemand() {
            Guesser a = pool.acquire();
            Guesser b = pool.acquire();
            Guesser c = pool.acquire();

            assertThat(a).isNotSameAs(b).isNotSameAs(c);
            assertThat(pool.createdCount()).isEqualTo(3);
            assertThat(pool.idleCount()).isZero();
        }

        @Test
        @DisplayName("Guessers beyond capacity are discarded")
        void testDiscardBeyondCapacity() {
            Guesser a = pool.acquire();
            Guesser b = pool.acquire();
            Guesser c = pool.acquire();

            pool.release(a);
            pool.release(b);
            pool.release(c);

            assertThat(pool.idleCount()).isEqualTo(2);
        }

        @Test
        @DisplayName("Idle guessers are reused before new ones are created")
        void testReuseBeforeCreate() {
            pool.release(pool.acquire());
            pool.acquire();

            assertThat(pool.createdCount()).isEqualTo(1);
        }

        @Test
        @DisplayName("Releasing the same guesser twice keeps one copy")
        void testDoubleRelease() {
            Guesser guesser = pool.acquire();

            pool.release(guesser);
            pool.release(guesser);

            assertThat(pool.idleCount()).isEqualTo(1);
        }

        @Test
        @DisplayName("Releasing an idle guesser again leaves it untouched")
        void testRepeatedReleaseDoesNotReset() {
            Guesser guesser = pool.acquire();
            pool.release(guesser);
            guesser.adjustToCompensateForValue("42");
            guesser.getSettings().withCharCanBeBoolean(true);

            pool.release(guesser);

            assertThat(guesser.getValueCount()).isEqualTo(1);
            assertThat(guesser.getSettings().isCharCanBeBoolean()).isTrue();
            assertThat(pool.idleCount()).isEqualTo(1);
        }

        @Test
        @DisplayName("Null release is safe")
        void testNullRelease() {
            assertThatCode(() -> pool.release(null)).doesNotThrowAnyException();
            assertThat(pool.idleCount()).isZero();
        }

        @Test
        @DisplayName("Capacity comes from the system property when not configured")
        void testSystemProperty() {
            System.setProperty(GuesserPool.PROP_MAX_RETAINED, "3");

            try (GuesserPool configured = new GuesserPool()) {
                assertThat(configured.getMaxRetained()).isEqualTo(3);
            }
        }

        @Test
        @DisplayName("Invalid system property falls back to the processor count")
        void testInvalidSystemProperty() {
            int expected = 2 * Runtime.getRuntime().availableProcessors();

            System.setProperty(GuesserPool.PROP_MAX_RETAINED, "many");
            try (GuesserPool invalid = new GuesserPool()) {
                assertThat(invalid.getMaxRetained()).isEqualTo(expected);
            }

            System.setProperty(GuesserPool.PROP_MAX_RETAINED, "-4");
            try (GuesserPool negative = new GuesserPool()) {
                assertThat(negative.getMaxRetained()).isEqualTo(expected);
            }
        }

        @Test
        @DisplayName("Negative capacity is rejected")
        void testNegativeCapacity() {
            assertThatThrownBy(() -> new GuesserPool.Configuration().withMaxRetained(-1))
                .isInstanceOf(IllegalArgumentException.class);
        }
    }

    // ==================== Loans ====================

    @Nested
    @DisplayName("Loan Tests")
    class LoanTests {

        @Test
        @DisplayName("Loan is released with try-with-resources")
        void testAutoRelease() {
            PooledGuesser pooled = pool.borrow();
            Guesser borrowed = pooled.get();
            try (pooled) {
                borrowed.adjustToCompensateForValue("12.5");
            }

            assertThat(pool.idleCount()).isEqualTo(1);
            assertThat(borrowed.guess()).isEqualTo(DatabaseTypeRequest.unknown());
        }

        @Test
        @DisplayName("Loan is released when the block throws")
        void testReleaseOnException() {
            assertThatThrownBy(() -> {
                try (PooledGuesser pooled = pool.borrow()) {
                    pooled.get().adjustToCompensateForValue(1L);
                    pooled.get().adjustToCompensateForValue("x");
                }
            }).isInstanceOf(MixedTypingException.class);

            assertThat(pool.idleCount()).isEqualTo(1);
        }

        @Test
        @DisplayName("Closing a loan twice releases once")
        void testCloseIdempotent() {
            PooledGuesser pooled = pool.borrow();

            pooled.close();
            pooled.close();

            assertThat(pooled.isReleased()).isTrue();
            assertThat(pool.idleCount()).isEqualTo(1);
        }

        @Test
        @DisplayName("A closed loan cannot be used")
        void testGetAfterClose() {
            PooledGuesser pooled = pool.borrow();
            pooled.close();

            assertThatThrownBy(pooled::get)
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("already released");
        }
    }

    // ==================== Closing ====================

    @Nested
    @DisplayName("Close Tests")
    class CloseTests {

        @Test
        @DisplayName("A closed pool refuses to hand out guessers")
        void testAcquireAfterClose() {
            pool.close();

            assertThatThrownBy(() -> pool.acquire())
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("closed");
            assertThatThrownBy(() -> pool.borrow())
                .isInstanceOf(IllegalStateException.class);
        }

        @Test
        @DisplayName("Closing drops idle guessers and ignores later releases")
        void testCloseDropsIdle() {
            Guesser a = pool.acquire();
            Guesser b = pool.acquire();
            pool.release(a);

            pool.close();
            pool.release(b);

            assertThat(pool.idleCount()).isZero();
            assertThat(b.guess()).isEqualTo(DatabaseTypeRequest.unknown());
        }

        @Test
        @DisplayName("Multiple close calls are safe")
        void testMultipleClose() {
            pool.close();

            assertThatCode(() -> pool.close()).doesNotThrowAnyException();
            assertThat(pool.isClosed()).isTrue();
        }
    }

    // ==================== Concurrency ====================

    @Nested
    @DisplayName("Concurrency Tests")
    class ConcurrencyTests {

        @Test
        @DisplayName("Concurrent borrowers each get a clean guesser")
        void testConcurrentBorrowing() throws Exception {
            int threadCount = 16;
            int rounds = 50;
            CountDownLatch start = new CountDownLatch(1);
            CountDownLatch done = new CountDownLatch(threadCount);
            AtomicInteger successCount = new AtomicInteger(0);
            AtomicInteger errorCount = new AtomicInteger(0);

            for (int i = 0; i < threadCount; i++) {
                boolean numeric = i % 2 == 0;
                new Thread(() -> {
                    try {
                        start.await();
                        for (int round = 0; round < rounds; round++) {
                            try (PooledGuesser pooled = pool.borrow()) {
                                Guesser guesser = pooled.get();
                                if (numeric) {
                                    guesser.adjustToCompensateForValues(List.of("1", "2.5"));
                                    assertThat(guesser.guess().typeTag()).isEqualTo(TypeTag.DECIMAL);
                                } else {
                                    guesser.adjustToCompensateForValue(true);
                                    assertThat(guesser.guess().typeTag()).isEqualTo(TypeTag.BOOLEAN);
                                }
                            }
                        }
                        successCount.incrementAndGet();
                    } catch (Throwable e) {
                        logger.error("Borrower failed", e);
                        errorCount.incrementAndGet();
                    } finally {
                        done.countDown();
                    }
                }).start();
            }

            start.countDown();
            boolean completed = done.await(30, TimeUnit.SECONDS);

            assertThat(completed).as("All threads should complete").isTrue();
            assertThat(successCount.get()).isEqualTo(threadCount);
            assertThat(errorCount.get()).isZero();
            assertThat(pool.idleCount()).isLessThanOrEqualTo(2);
            assertThat(pool.createdCount()).isLessThanOrEqualTo(threadCount);
        }
    }
}
