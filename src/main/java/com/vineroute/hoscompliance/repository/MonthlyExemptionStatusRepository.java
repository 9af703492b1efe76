package com.vineroute.hoscompliance.repository;

import com.vineroute.hoscompliance.entity.MonthlyExemptionStatus;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.time.LocalDate;
import java.util.Optional;

@Repository
public interface MonthlyExemptionStatusRepository extends JpaRepository<MonthlyExemptionStatus, Long> {

    Optional<MonthlyExemptionStatus> findByDriverIdAndWindowStart(Long driverId, LocalDate windowStart);

    /** Latest stored window strictly before the given start, used to detect flag flips */
    Optional<MonthlyExemptionStatus> findTopByDriverIdAndWindowStartBeforeOrderByWindowStartDesc(
            Long driverId, LocalDate windowStart);
}
