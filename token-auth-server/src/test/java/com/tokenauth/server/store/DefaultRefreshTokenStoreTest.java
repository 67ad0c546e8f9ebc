package com.tokenauth.server.store;

import static org.junit.Assert.*;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.atomic.AtomicInteger;

import org.junit.Before;
import org.junit.Test;

import com.tokenauth.server.MutableClock;

public class DefaultRefreshTokenStoreTest {

    private static final Instant START = Instant.parse("2026-02-01T12:00:00Z");

    private MutableClock clock;
    private InMemoryRefreshRecordRepository repository;
    private DefaultRefreshTokenStore store;

    @Before
    public void setUp() {
        clock = new MutableClock(START);
        repository = new InMemoryRefreshRecordRepository();
        store = new DefaultRefreshTokenStore(repository, clock);
    }

    private Instant expiry() {
        return clock.instant().plus(Duration.ofDays(30));
    }

    @Test
    public void testCreateFamilyStartsAtRotationZero() {
        String familyId = store.createFamily("fam-1", "user-1", "h0", expiry());

        RefreshRecord record = store.find(familyId).orElseThrow();
        assertEquals("fam-1", familyId);
        assertEquals("h0", record.currentRefreshTokenHash());
        assertEquals("user-1", record.subjectId());
        assertEquals(START, record.issuedAt());
        assertEquals(0, record.rotationCount());
        assertFalse(record.revoked());
        assertFalse(store.isRevoked(familyId));
    }

    @Test
    public void testDuplicateFamilyIsConflict() {
        store.createFamily("fam-1", "user-1", "h0", expiry());

        assertThrows(StorageConflictException.class, () -> store.createFamily("fam-1", "user-2", "x", expiry()));
    }

    @Test
    public void testRotateReplacesHashAndCounts() {
        store.createFamily("fam-1", "user-1", "h0", expiry());

        assertEquals(RotationResult.ROTATED, store.rotate("fam-1", "h0", "h1", expiry()));

        RefreshRecord record = store.find("fam-1").orElseThrow();
        assertEquals("h1", record.currentRefreshTokenHash());
        assertEquals(1, record.rotationCount());
    }

    @Test
    public void testOnlyLatestHashIsCurrentAfterManyRotations() {
        int rotations = 5;
        for (int i = 0; i <= rotations; i++) {
            store.createFamily("fam-" + i, "user-1", "h0", expiry());
            for (int r = 1; r <= rotations; r++) {
                assertEquals(RotationResult.ROTATED, store.rotate("fam-" + i, "h" + (r - 1), "h" + r, expiry()));
            }
        }

        // on family i, present superseded hash h(i); the latest hash h(rotations) stays unused
        for (int i = 0; i < rotations; i++) {
            assertEquals("h" + i, RotationResult.REUSE_DETECTED, store.rotate("fam-" + i, "h" + i, "new", expiry()));
            assertTrue(store.isRevoked("fam-" + i));
        }
        assertEquals(RotationResult.ROTATED, store.rotate("fam-" + rotations, "h" + rotations, "new", expiry()));
        assertEquals(rotations + 1, store.find("fam-" + rotations).orElseThrow().rotationCount());
    }

    @Test
    public void testReuseRevokesFamilyForEveryone() {
        store.createFamily("fam-1", "user-1", "h0", expiry());
        store.rotate("fam-1", "h0", "h1", expiry());

        assertEquals(RotationResult.REUSE_DETECTED, store.rotate("fam-1", "h0", "h2", expiry()));
        assertEquals(RotationResult.REVOKED, store.rotate("fam-1", "h1", "h2", expiry()));
        assertTrue(store.isRevoked("fam-1"));
    }

    @Test
    public void testRevokeIsIdempotent() {
        store.createFamily("fam-1", "user-1", "h0", expiry());

        store.revoke("fam-1");
        store.revoke("fam-1");
        store.revoke("never-existed");

        assertTrue(store.isRevoked("fam-1"));
        assertEquals(RotationResult.REVOKED, store.rotate("fam-1", "h0", "h1", expiry()));
    }

    @Test
    public void testUnknownFamily() {
        assertEquals(RotationResult.NOT_FOUND, store.rotate("missing", "h0", "h1", expiry()));
        assertTrue(store.isRevoked("missing"));
    }

    @Test
    public void testExpiredFamilyCannotRotate() {
        store.createFamily("fam-1", "user-1", "h0", clock.instant().plus(Duration.ofHours(1)));
        clock.advance(Duration.ofHours(1));

        assertEquals(RotationResult.NOT_FOUND, store.rotate("fam-1", "h0", "h1", expiry()));
    }

    @Test
    public void testExpiryLeewayMatchesClockSkew() {
        DefaultRefreshTokenStore lenient = new DefaultRefreshTokenStore(repository, clock, Duration.ofSeconds(30));
        lenient.createFamily("fam-1", "user-1", "h0", clock.instant().plus(Duration.ofHours(1)));
        lenient.createFamily("fam-2", "user-1", "h0", clock.instant().plus(Duration.ofHours(1)));
        clock.advance(Duration.ofHours(1).plusSeconds(29));

        assertEquals(0, lenient.purgeExpired(clock.instant()));
        assertEquals(RotationResult.ROTATED, lenient.rotate("fam-1", "h0", "h1", expiry()));

        clock.advance(Duration.ofSeconds(1));

        assertEquals(RotationResult.NOT_FOUND, lenient.rotate("fam-2", "h0", "h1", expiry()));
        assertEquals(1, lenient.purgeExpired(clock.instant()));
    }

    @Test
    public void testRevokeGivesUpAfterOneRetry() {
        AtomicInteger attempts = new AtomicInteger();
        RefreshRecordRepository contended = new InMemoryRefreshRecordRepository() {
            @Override
            public boolean compareAndSet(RefreshRecord expected, RefreshRecord replacement) {
                attempts.incrementAndGet();
                return false;
            }
        };
        DefaultRefreshTokenStore contendedStore = new DefaultRefreshTokenStore(contended, clock);
        contendedStore.createFamily("fam-1", "user-1", "h0", expiry());

        assertThrows(StorageConflictException.class, () -> contendedStore.revoke("fam-1"));
        assertEquals(2, attempts.get());
        assertFalse(contendedStore.isRevoked("fam-1"));
    }

    @Test
    public void testLostCompareAndSetIsConflict() {
        RefreshRecordRepository racing = new InMemoryRefreshRecordRepository() {
            @Override
            public boolean compareAndSet(RefreshRecord expected, RefreshRecord replacement) {
                return false;
            }
        };
        DefaultRefreshTokenStore racingStore = new DefaultRefreshTokenStore(racing, clock);
        racingStore.createFamily("fam-1", "user-1", "h0", expiry());

        assertThrows(StorageConflictException.class, () -> racingStore.rotate("fam-1", "h0", "h1", expiry()));
        assertEquals("h0", racingStore.find("fam-1").orElseThrow().currentRefreshTokenHash());
    }

    @Test
    public void testRevokeSubjectRevokesOnlyThatSubject() {
        store.createFamily("fam-a1", "alice", "h", expiry());
        store.createFamily("fam-a2", "alice", "h", expiry());
        store.createFamily("fam-b1", "bob", "h", expiry());
        store.revoke("fam-a2");

        List<String> revoked = store.revokeSubject("alice");

        assertEquals(List.of("fam-a1"), revoked);
        assertTrue(store.isRevoked("fam-a1"));
        assertFalse(store.isRevoked("fam-b1"));
    }

    @Test
    public void testPurgeExpired() {
        store.createFamily("short", "user-1", "h", clock.instant().plus(Duration.ofMinutes(5)));
        store.createFamily("long", "user-1", "h", clock.instant().plus(Duration.ofDays(5)));
        clock.advance(Duration.ofMinutes(5));

        assertEquals(1, store.purgeExpired(clock.instant()));
        assertFalse(store.find("short").isPresent());
        assertTrue(store.find("long").isPresent());
        assertEquals(1, repository.size());
    }

    @Test
    public void testRecordToStringOmitsHash() {
        store.createFamily("fam-1", "user-1", "secret-hash-value", expiry());

        assertFalse(store.find("fam-1").orElseThrow().toString().contains("secret-hash-value"));
    }

    @Test
    public void testConcurrentRotationsWithSameHashHaveOneWinner() throws Exception {
        store.createFamily("fam-1", "user-1", "h0", expiry());
        int threads = 8;
        List<Thread> workers = new ArrayList<>();
        List<RotationResult> results = Collections.synchronizedList(new ArrayList<>());
        CountDownLatch start = new CountDownLatch(1);

        for (int i = 0; i < threads; i++) {
            String newHash = "h1-" + i;
            Thread t = new Thread(() -> {
                try {
                    start.await();
                    results.add(store.rotate("fam-1", "h0", newHash, expiry()));
                } catch (StorageConflictException e) {
                    results.add(null);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
            });
            workers.add(t);
            t.start();
        }
        start.countDown();
        for (Thread t : workers) {
            t.join();
        }

        long rotated = results.stream().filter(r -> r == RotationResult.ROTATED).count();
        assertEquals(threads, results.size());
        assertEquals(1, rotated);
        assertEquals("h1-", store.find("fam-1").orElseThrow().currentRefreshTokenHash().substring(0, 3));
    }
}
