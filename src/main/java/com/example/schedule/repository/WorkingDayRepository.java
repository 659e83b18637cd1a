package com.example.schedule.repository;

import com.example.schedule.model.WorkingDay;
import org.springframework.data.jpa.repository.JpaRepository;

import java.time.LocalDate;
import java.util.Collection;
import java.util.List;

public interface WorkingDayRepository extends JpaRepository<WorkingDay, Long> {

    List<WorkingDay> findByProviderId(String providerId);

    List<WorkingDay> findByProviderIdAndWorkDateIn(String providerId, Collection<LocalDate> dates);

    List<WorkingDay> findByProviderIdAndWorkDateGreaterThanEqual(String providerId, LocalDate from);
}
