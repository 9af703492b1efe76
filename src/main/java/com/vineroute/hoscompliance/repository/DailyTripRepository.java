package com.vineroute.hoscompliance.repository;

import com.vineroute.hoscompliance.entity.DailyTrip;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

@Repository
public interface DailyTripRepository extends JpaRepository<DailyTrip, Long> {

    Optional<DailyTrip> findByDriverIdAndTripDate(Long driverId, LocalDate tripDate);

    /** Exceedance days inside [from, to], oldest first. One row per day by constraint. */
    List<DailyTrip> findByDriverIdAndExceededRadiusTrueAndTripDateBetweenOrderByTripDateAsc(
            Long driverId, LocalDate from, LocalDate to);

    /**
     * Monotonic maximum: raises maxAirMiles (and the furthest point) only when the
     * new distance is larger. A single UPDATE, so concurrent waypoint appends can
     * never lower the stored value. A raise also clears noLocationData, which a
     * finalized empty shift earlier the same day may have set.
     *
     * @return 1 if the maximum was raised, 0 otherwise
     */
    @Modifying(flushAutomatically = true)
    @Query("UPDATE DailyTrip d SET d.maxAirMiles = :distance, d.exceededRadius = :exceeded, " +
           "d.furthestLatitude = :latitude, d.furthestLongitude = :longitude, d.noLocationData = false " +
           "WHERE d.id = :id AND (d.maxAirMiles IS NULL OR d.maxAirMiles < :distance)")
    int raiseMaxDistance(@Param("id") Long id,
                         @Param("distance") double distance,
                         @Param("exceeded") boolean exceeded,
                         @Param("latitude") double latitude,
                         @Param("longitude") double longitude);
}
