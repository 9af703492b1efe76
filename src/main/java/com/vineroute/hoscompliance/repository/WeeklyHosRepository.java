package com.vineroute.hoscompliance.repository;

import com.vineroute.hoscompliance.entity.WeeklyHos;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.time.LocalDate;
import java.util.Optional;

@Repository
public interface WeeklyHosRepository extends JpaRepository<WeeklyHos, Long> {

    Optional<WeeklyHos> findByDriverIdAndWindowEnd(Long driverId, LocalDate windowEnd);
}
