package com.example.schedule.repository;

import com.example.schedule.model.Slot;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

public interface SlotRepository extends JpaRepository<Slot, Long> {

    List<Slot> findByProviderIdAndDateBetweenOrderByDateAscStartTimeAsc(String providerId, LocalDate from, LocalDate to);

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("select s from Slot s where s.id = :id")
    Optional<Slot> findForUpdate(@Param("id") Long id);

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("delete from Slot s where s.providerId = :providerId and s.date between :from and :to and s.booked = false")
    int deleteUnbookedBetween(@Param("providerId") String providerId,
                              @Param("from") LocalDate from,
                              @Param("to") LocalDate to);

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("delete from Slot s where s.providerId = :providerId and s.date >= :from and s.booked = false")
    int deleteUnbookedFrom(@Param("providerId") String providerId, @Param("from") LocalDate from);
}
