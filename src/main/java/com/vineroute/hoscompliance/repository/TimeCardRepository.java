package com.vineroute.hoscompliance.repository;

import com.vineroute.hoscompliance.entity.TimeCard;
import com.vineroute.hoscompliance.entity.TimeCardStatus;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

/**
 * Time card queries. Every aggregate query filters on status so SUPERSEDED
 * cards never contribute hours.
 */
@Repository
public interface TimeCardRepository extends JpaRepository<TimeCard, Long> {

    /** The driver's OPEN card, whatever its work date (at most one, by constraint) */
    Optional<TimeCard> findByOpenDriverKey(Long driverId);

    /** The OPEN card holding a vehicle (at most one, by constraint) */
    Optional<TimeCard> findByOpenVehicleKey(Long vehicleId);

    /**
     * Loads the driver's OPEN card with a PESSIMISTIC_WRITE lock so two clock-out
     * requests for the same card serialize; the loser then sees it CLOSED.
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT t FROM TimeCard t WHERE t.openDriverKey = :driverId")
    Optional<TimeCard> findOpenByDriverIdForUpdate(@Param("driverId") Long driverId);

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT t FROM TimeCard t WHERE t.id = :id")
    Optional<TimeCard> findByIdForUpdate(@Param("id") Long id);

    List<TimeCard> findByDriverIdAndWorkDateAndStatusOrderByClockInAtAsc(
            Long driverId, LocalDate workDate, TimeCardStatus status);

    List<TimeCard> findByDriverIdAndWorkDateAndStatusNotOrderByClockInAtAsc(
            Long driverId, LocalDate workDate, TimeCardStatus status);

    List<TimeCard> findByDriverIdAndWorkDateBetweenAndStatusOrderByWorkDateAsc(
            Long driverId, LocalDate from, LocalDate to, TimeCardStatus status);

    List<TimeCard> findByDriverIdAndWorkDateBetweenOrderByClockInAtAsc(
            Long driverId, LocalDate from, LocalDate to);

    /** Most recent shift that ended on a date before the given one */
    Optional<TimeCard> findTopByDriverIdAndStatusAndWorkDateBeforeOrderByClockOutAtDesc(
            Long driverId, TimeCardStatus status, LocalDate before);

    /** Earliest card on a date after the given one; its off-duty gap depends on the days before it */
    Optional<TimeCard> findFirstByDriverIdAndStatusAndWorkDateAfterOrderByWorkDateAsc(
            Long driverId, TimeCardStatus status, LocalDate after);
}
