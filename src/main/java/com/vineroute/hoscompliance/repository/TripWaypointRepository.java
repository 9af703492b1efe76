package com.vineroute.hoscompliance.repository;

import com.vineroute.hoscompliance.entity.TripWaypoint;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface TripWaypointRepository extends JpaRepository<TripWaypoint, Long> {

    List<TripWaypoint> findByDailyTripIdOrderByRecordedAtAsc(Long dailyTripId);

    long countByDailyTripId(Long dailyTripId);
}
