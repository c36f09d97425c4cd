package relay.adapter.out.storage.memory;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.Mockito.lenient;

import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import relay.core.config.RegistryConfig;
import relay.core.model.audit.AuditEventKind;
import relay.core.model.registration.RegistrationState;
import relay.support.MutableClock;
import relay.support.RecordingAuditLog;

@DisplayName("InMemoryRegistrationRepository")
@ExtendWith(MockitoExtension.class)
class InMemoryRegistrationRepositoryTest {

    private static final Duration AWAIT = Duration.ofSeconds(1);
    private static final Duration TTL = Duration.ofMinutes(5);
    private static final Instant START = Instant.parse("2026-01-01T00:00:00Z");

    @Mock
    private RegistryConfig config;

    private MutableClock clock;
    private RecordingAuditLog auditLog;
    private InMemoryRegistrationRepository repository;

    @BeforeEach
    void setUp() {
        lenient().when(config.ttl()).thenReturn(TTL);
        clock = new MutableClock(START);
        auditLog = new RecordingAuditLog();
        repository = new InMemoryRegistrationRepository(clock, config, auditLog);
    }

    @Nested
    @DisplayName("put()")
    class PutTests {

        @Test
        @DisplayName("should stamp creation and expiry from the clock")
        void shouldStampTimestamps() {
            final var handle = repository
                    .put("user-1", RegistrationState.AWAITING_GROUP_CONTACT, null)
                    .await()
                    .atMost(AWAIT);

            assertEquals(START, handle.entry().createdAt());
            assertEquals(START.plus(TTL), handle.entry().expiresAt());
            assertFalse(handle.replaced());
        }

        @Test
        @DisplayName("should replace rather than duplicate an entry for the same subject")
        void shouldReplaceExistingEntry() {
            repository
                    .put("user-1", RegistrationState.AWAITING_GROUP_CONTACT, null)
                    .await()
                    .atMost(AWAIT);
            clock.advance(Duration.ofMinutes(1));

            final var handle = repository
                    .put("user-1", RegistrationState.FULFILLED, "-100200")
                    .await()
                    .atMost(AWAIT);

            assertTrue(handle.replaced());
            assertEquals(1, repository.liveEntryCount());
            final var entry = repository.get("user-1").await().atMost(AWAIT).orElseThrow();
            assertEquals(RegistrationState.FULFILLED, entry.state());
            assertEquals("-100200", entry.groupId());
            assertEquals(START.plus(Duration.ofMinutes(1)).plus(TTL), entry.expiresAt());
        }

        @Test
        @DisplayName("should not report an expired predecessor as replaced")
        void shouldNotReportExpiredPredecessorAsReplaced() {
            repository
                    .put("user-1", RegistrationState.AWAITING_GROUP_CONTACT, null)
                    .await()
                    .atMost(AWAIT);
            clock.advance(TTL);

            final var handle = repository
                    .put("user-1", RegistrationState.AWAITING_GROUP_CONTACT, null)
                    .await()
                    .atMost(AWAIT);

            assertFalse(handle.replaced());
        }
    }

    @Nested
    @DisplayName("get()")
    class GetTests {

        @Test
        @DisplayName("should return empty for an unknown subject")
        void shouldReturnEmptyForUnknownSubject() {
            assertFalse(repository.get("nobody").await().atMost(AWAIT).isPresent());
        }

        @Test
        @DisplayName("should return the entry before it expires")
        void shouldReturnLiveEntry() {
            repository
                    .put("user-1", RegistrationState.AWAITING_GROUP_CONTACT, null)
                    .await()
                    .atMost(AWAIT);
            clock.advance(TTL.minusSeconds(1));

            assertTrue(repository.get("user-1").await().atMost(AWAIT).isPresent());
        }

        @Test
        @DisplayName("should evict and hide an expired entry without a sweep")
        void shouldEvictExpiredEntryLazily() {
            repository
                    .put("user-1", RegistrationState.AWAITING_GROUP_CONTACT, null)
                    .await()
                    .atMost(AWAIT);
            clock.advance(TTL);

            assertFalse(repository.get("user-1").await().atMost(AWAIT).isPresent());
            assertEquals(0, repository.sweep(clock.instant()));
            assertTrue(auditLog.kinds().contains(AuditEventKind.ENTRY_EXPIRED));
        }

        @Test
        @DisplayName("should not remove the entry")
        void shouldNotRemoveEntry() {
            repository
                    .put("user-1", RegistrationState.AWAITING_GROUP_CONTACT, null)
                    .await()
                    .atMost(AWAIT);

            repository.get("user-1").await().atMost(AWAIT);

            assertTrue(repository.get("user-1").await().atMost(AWAIT).isPresent());
        }
    }

    @Nested
    @DisplayName("take()")
    class TakeTests {

        @Test
        @DisplayName("should return the entry once and then nothing")
        void shouldConsumeOnce() {
            repository.put("user-1", RegistrationState.FULFILLED, "-100200").await().atMost(AWAIT);

            final var first = repository.take("user-1").await().atMost(AWAIT);
            final var second = repository.take("user-1").await().atMost(AWAIT);

            assertTrue(first.isPresent());
            assertEquals("-100200", first.get().groupId());
            assertFalse(second.isPresent());
            assertEquals(0, repository.liveEntryCount());
        }

        @Test
        @DisplayName("should return empty for an expired entry")
        void shouldReturnEmptyForExpiredEntry() {
            repository.put("user-1", RegistrationState.FULFILLED, "-100200").await().atMost(AWAIT);
            clock.advance(TTL.plusSeconds(1));

            assertFalse(repository.take("user-1").await().atMost(AWAIT).isPresent());
        }

        @Test
        @DisplayName("should not affect other subjects")
        void shouldNotAffectOtherSubjects() {
            repository.put("user-1", RegistrationState.FULFILLED, "-100200").await().atMost(AWAIT);
            repository
                    .put("user-2", RegistrationState.AWAITING_GROUP_CONTACT, null)
                    .await()
                    .atMost(AWAIT);

            repository.take("user-1").await().atMost(AWAIT);

            assertTrue(repository.get("user-2").await().atMost(AWAIT).isPresent());
        }
    }

    @Nested
    @DisplayName("sweep()")
    class SweepTests {

        @Test
        @DisplayName("should remove only expired entries")
        void shouldRemoveOnlyExpiredEntries() {
            repository
                    .put("old", RegistrationState.AWAITING_GROUP_CONTACT, null)
                    .await()
                    .atMost(AWAIT);
            clock.advance(Duration.ofMinutes(3));
            repository
                    .put("new", RegistrationState.AWAITING_GROUP_CONTACT, null)
                    .await()
                    .atMost(AWAIT);
            clock.advance(Duration.ofMinutes(2));

            final var removed = repository.sweep(clock.instant());

            assertEquals(1, removed);
            assertFalse(repository.get("old").await().atMost(AWAIT).isPresent());
            assertTrue(repository.get("new").await().atMost(AWAIT).isPresent());
            assertTrue(auditLog.kinds().contains(AuditEventKind.SWEEP_COMPLETED));
        }

        @Test
        @DisplayName("should treat expiry at exactly now as expired")
        void shouldTreatBoundaryAsExpired() {
            repository
                    .put("user-1", RegistrationState.AWAITING_GROUP_CONTACT, null)
                    .await()
                    .atMost(AWAIT);

            assertEquals(1, repository.sweep(START.plus(TTL)));
        }

        @Test
        @DisplayName("should not audit an empty sweep")
        void shouldNotAuditEmptySweep() {
            assertEquals(0, repository.sweep(clock.instant()));
            assertFalse(auditLog.kinds().contains(AuditEventKind.SWEEP_COMPLETED));
        }
    }

    @Nested
    @DisplayName("Concurrent access")
    class ConcurrentAccessTests {

        @Test
        @DisplayName("should keep one entry per subject under concurrent puts")
        void shouldKeepSingleEntryUnderConcurrentPuts() throws InterruptedException {
            final var threadCount = 16;
            final var latch = new CountDownLatch(threadCount);
            final ExecutorService executor = Executors.newFixedThreadPool(threadCount);

            for (int i = 0; i < threadCount; i++) {
                final var groupId = "-100" + i;
                executor.submit(() -> {
                    try {
                        repository
                                .put("user-1", RegistrationState.FULFILLED, groupId)
                                .await()
                                .atMost(AWAIT);
                    } finally {
                        latch.countDown();
                    }
                });
            }

            assertTrue(latch.await(5, TimeUnit.SECONDS));
            executor.shutdown();

            assertEquals(1, repository.liveEntryCount());
        }

        @Test
        @DisplayName("should hand an entry to exactly one concurrent taker")
        void shouldHandEntryToSingleTaker() throws InterruptedException {
            repository.put("user-1", RegistrationState.FULFILLED, "-100200").await().atMost(AWAIT);

            final var threadCount = 16;
            final var latch = new CountDownLatch(threadCount);
            final var winners = new AtomicInteger();
            final ExecutorService executor = Executors.newFixedThreadPool(threadCount);

            for (int i = 0; i < threadCount; i++) {
                executor.submit(() -> {
                    try {
                        if (repository.take("user-1").await().atMost(AWAIT).isPresent()) {
                            winners.incrementAndGet();
                        }
                    } finally {
                        latch.countDown();
                    }
                });
            }

            assertTrue(latch.await(5, TimeUnit.SECONDS));
            executor.shutdown();

            assertEquals(1, winners.get());
        }

        @Test
        @DisplayName("should isolate different subjects")
        void shouldIsolateDifferentSubjects() throws InterruptedException {
            final var threadCount = 16;
            final var latch = new CountDownLatch(threadCount);
            final ExecutorService executor = Executors.newFixedThreadPool(threadCount);

            for (int i = 0; i < threadCount; i++) {
                final var subject = "user-" + i;
                executor.submit(() -> {
                    try {
                        repository
                                .put(subject, RegistrationState.AWAITING_GROUP_CONTACT, null)
                                .await()
                                .atMost(AWAIT);
                    } finally {
                        latch.countDown();
                    }
                });
            }

            assertTrue(latch.await(5, TimeUnit.SECONDS));
            executor.shutdown();

            assertEquals(threadCount, repository.liveEntryCount());
        }
    }
}
