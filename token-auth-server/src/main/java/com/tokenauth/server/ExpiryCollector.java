package com.tokenauth.server;

import java.time.Clock;
import java.time.Duration;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

import com.tokenauth.AccessTokenBlacklist;
import com.tokenauth.TokenAuthConfig;
import com.tokenauth.server.store.RefreshTokenStore;
import lombok.extern.slf4j.Slf4j;

/**
 * Periodically deletes expired refresh records and blacklist entries. Only rows that can no
 * longer be used are removed, so runs need no coordination with other nodes.
 */
@Slf4j
public class ExpiryCollector implements AutoCloseable {

    private final RefreshTokenStore tokenStore;
    private final AccessTokenBlacklist blacklist;
    private final Clock clock;
    private final ScheduledExecutorService ses;

    public ExpiryCollector(RefreshTokenStore tokenStore, AccessTokenBlacklist blacklist, Clock clock, Duration interval) {
        this.tokenStore = tokenStore;
        this.blacklist = blacklist == null ? AccessTokenBlacklist.disabled() : blacklist;
        this.clock = clock;
        this.ses = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "token-expiry-collector");
            t.setDaemon(true);
            return t;
        });
        long millis = interval.toMillis();
        ses.scheduleWithFixedDelay(this::runQuietly, millis, millis, TimeUnit.MILLISECONDS);
    }

    public static ExpiryCollector start(RefreshTokenStore tokenStore, AccessTokenBlacklist blacklist, Clock clock,
                                        TokenAuthConfig config) {
        return new ExpiryCollector(tokenStore, blacklist, clock, config.getCleanupInterval());
    }

    /**
     * @return total number of records and blacklist entries removed
     */
    public int runOnce() {
        int records = tokenStore.purgeExpired(clock.instant());
        int entries = blacklist.purgeExpired();
        if (records > 0 || entries > 0) {
            log.info("Purged {} expired refresh records and {} blacklist entries", records, entries);
        }
        return records + entries;
    }

    private void runQuietly() {
        try {
            runOnce();
        } catch (RuntimeException e) {
            log.warn("Expiry collection failed, will retry on next run", e);
        }
    }

    @Override
    public void close() {
        ses.shutdownNow();
    }
}
