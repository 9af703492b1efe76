package com.vineroute.hoscompliance.config;

import com.github.benmanes.caffeine.cache.Caffeine;
import lombok.extern.slf4j.Slf4j;
import org.springframework.cache.CacheManager;
import org.springframework.cache.annotation.EnableCaching;
import org.springframework.cache.caffeine.CaffeineCache;
import org.springframework.cache.support.SimpleCacheManager;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.List;
import java.util.concurrent.TimeUnit;

/**
 * Caffeine caches for the driver / vehicle roster.
 *
 *   rosterDrivers  - per-driver lookups plus the active-driver list (fleet status).
 *                    TTL 15 minutes, max 200 entries.
 *   rosterVehicles - per-vehicle lookups on every clock-in.
 *                    TTL 15 minutes, max 100 entries.
 *
 * The roster is owned by another subsystem, so a short TTL bounds staleness;
 * RosterService.evictRosterCaches() forces a reload after an import.
 */
@Configuration
@EnableCaching
@Slf4j
public class CacheConfig {

    public static final String CACHE_ROSTER_DRIVERS = "rosterDrivers";

    public static final String CACHE_ROSTER_VEHICLES = "rosterVehicles";

    @Bean
    public CacheManager cacheManager() {
        log.info("[CACHE] Initialising Caffeine CacheManager — caches: '{}', '{}'",
                CACHE_ROSTER_DRIVERS, CACHE_ROSTER_VEHICLES);

        SimpleCacheManager manager = new SimpleCacheManager();
        manager.setCaches(List.of(
                buildCache(CACHE_ROSTER_DRIVERS,  15, 200),
                buildCache(CACHE_ROSTER_VEHICLES, 15, 100)
        ));
        return manager;
    }

    private CaffeineCache buildCache(String name, int ttlMinutes, int maxSize) {
        return new CaffeineCache(name,
                Caffeine.newBuilder()
                        .expireAfterWrite(ttlMinutes, TimeUnit.MINUTES)
                        .maximumSize(maxSize)
                        .recordStats()
                        .build());
    }
}
