package com.vineroute.hoscompliance.service;

import com.vineroute.hoscompliance.config.CacheConfig;
import com.vineroute.hoscompliance.entity.Driver;
import com.vineroute.hoscompliance.entity.Vehicle;
import com.vineroute.hoscompliance.exception.DriverNotFoundException;
import com.vineroute.hoscompliance.exception.VehicleNotFoundException;
import com.vineroute.hoscompliance.repository.DriverRepository;
import com.vineroute.hoscompliance.repository.VehicleRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.cache.annotation.CacheEvict;
import org.springframework.cache.annotation.Cacheable;
import org.springframework.cache.annotation.Caching;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.Optional;

/**
 * Cached, read-only view of the driver / vehicle roster, plus the row
 * locks that serialize clock-ins.
 *
 * Kept as its own bean so every call goes through the Spring cache proxy;
 * self-invocation inside the caller would bypass @Cacheable.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class RosterService {

    private final DriverRepository driverRepository;
    private final VehicleRepository vehicleRepository;

    @Cacheable(value = CacheConfig.CACHE_ROSTER_DRIVERS, key = "'driver-' + #driverId")
    public Optional<Driver> findDriver(Long driverId) {
        log.debug("[CACHE MISS] driver #{} — loading from DB", driverId);
        return driverRepository.findById(driverId);
    }

    @Cacheable(value = CacheConfig.CACHE_ROSTER_VEHICLES, key = "'vehicle-' + #vehicleId")
    public Optional<Vehicle> findVehicle(Long vehicleId) {
        log.debug("[CACHE MISS] vehicle #{} — loading from DB", vehicleId);
        return vehicleRepository.findById(vehicleId);
    }

    @Cacheable(value = CacheConfig.CACHE_ROSTER_DRIVERS, key = "'active-drivers'")
    public List<Driver> getActiveDrivers() {
        log.debug("[CACHE MISS] active drivers — loading from DB");
        return driverRepository.findByActiveTrueOrderByNameAsc();
    }

    /**
     * Row-locks the driver and then the vehicle until the caller's transaction
     * ends, so clock-ins touching either one run one after the other.
     * Always driver first: a fixed order cannot deadlock.
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public void lockForClockIn(Long driverId, Long vehicleId) {
        driverRepository.findByIdForUpdate(driverId)
                .orElseThrow(() -> new DriverNotFoundException(driverId));
        vehicleRepository.findByIdForUpdate(vehicleId)
                .orElseThrow(() -> new VehicleNotFoundException(vehicleId));
    }

    @Caching(evict = {
            @CacheEvict(value = CacheConfig.CACHE_ROSTER_DRIVERS,  allEntries = true),
            @CacheEvict(value = CacheConfig.CACHE_ROSTER_VEHICLES, allEntries = true)
    })
    public void evictRosterCaches() {
        log.info("[CACHE EVICT] roster caches cleared");
    }
}
