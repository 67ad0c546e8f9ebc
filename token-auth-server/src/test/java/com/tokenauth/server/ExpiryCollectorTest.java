package com.tokenauth.server;

import static org.junit.Assert.*;

import java.time.Duration;
import java.time.Instant;

import org.junit.Test;

import com.tokenauth.AccessTokenBlacklist;
import com.tokenauth.InMemoryTokenBlacklist;
import com.tokenauth.TokenAuthConfig;
import com.tokenauth.server.store.DefaultRefreshTokenStore;
import com.tokenauth.server.store.InMemoryRefreshRecordRepository;

public class ExpiryCollectorTest {

    @Test
    public void testRunOncePurgesRecordsAndBlacklist() {
        MutableClock clock = new MutableClock(Instant.parse("2026-07-01T00:00:00Z"));
        InMemoryRefreshRecordRepository repository = new InMemoryRefreshRecordRepository();
        DefaultRefreshTokenStore store = new DefaultRefreshTokenStore(repository, clock);
        InMemoryTokenBlacklist entries = new InMemoryTokenBlacklist();
        AccessTokenBlacklist blacklist = new AccessTokenBlacklist(entries, clock, true);

        store.createFamily("old", "u", "h", clock.instant().plus(Duration.ofMinutes(1)));
        store.createFamily("live", "u", "h", clock.instant().plus(Duration.ofDays(1)));
        blacklist.revokeFamily("old", clock.instant().plus(Duration.ofMinutes(1)));

        try (ExpiryCollector collector = ExpiryCollector.start(store, blacklist, clock, TokenAuthConfig.defaults())) {
            assertEquals(0, collector.runOnce());

            clock.advance(Duration.ofMinutes(2));

            assertEquals(2, collector.runOnce());
            assertEquals(1, repository.size());
            assertEquals(0, entries.size());
        }
    }

    @Test
    public void testWorksWithoutBlacklist() {
        MutableClock clock = new MutableClock(Instant.parse("2026-07-01T00:00:00Z"));
        DefaultRefreshTokenStore store = new DefaultRefreshTokenStore(new InMemoryRefreshRecordRepository(), clock);
        store.createFamily("old", "u", "h", clock.instant().plusSeconds(1));
        clock.advance(Duration.ofSeconds(1));

        try (ExpiryCollector collector = new ExpiryCollector(store, null, clock, Duration.ofHours(1))) {
            assertEquals(1, collector.runOnce());
        }
    }
}
