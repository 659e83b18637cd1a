package com.example.schedule.store.impl;

import com.example.schedule.dto.SlotChange;
import com.example.schedule.model.Slot;
import com.example.schedule.repository.SlotRepository;
import com.example.schedule.service.exception.ScheduleStorageException;
import com.example.schedule.service.exception.ScheduleValidationException;
import com.example.schedule.service.exception.SlotConflictException;
import com.example.schedule.service.exception.SlotNotFoundException;
import com.example.schedule.store.ChangeNotificationChannel;
import com.example.schedule.store.SlotStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.transaction.support.TransactionSynchronization;
import org.springframework.transaction.support.TransactionSynchronizationManager;

import java.time.LocalDate;
import java.time.LocalTime;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

@Slf4j
@Component
@RequiredArgsConstructor
public class JpaSlotStore implements SlotStore {

    private final SlotRepository repository;
    private final ChangeNotificationChannel channel;

    @Override
    @Transactional
    public Slot create(Slot slot) {
        try {
            return repository.saveAndFlush(slot);
        } catch (DataIntegrityViolationException e) {
            throw new ScheduleValidationException("This time slot already exists");
        } catch (DataAccessException e) {
            throw new ScheduleStorageException("Failed to create slot on " + slot.getDate(), e);
        }
    }

    @Override
    @Transactional
    public Slot update(Long slotId, LocalTime startTime, LocalTime endTime) {
        try {
            Slot slot = lockEditable(slotId);
            slot.setStartTime(startTime);
            slot.setEndTime(endTime);
            return repository.saveAndFlush(slot);
        } catch (DataIntegrityViolationException e) {
            throw new ScheduleValidationException("This time slot already exists");
        } catch (DataAccessException e) {
            throw new ScheduleStorageException("Failed to update slot " + slotId, e);
        }
    }

    @Override
    @Transactional
    public void delete(Long slotId) {
        try {
            repository.delete(lockEditable(slotId));
        } catch (DataAccessException e) {
            throw new ScheduleStorageException("Failed to delete slot " + slotId, e);
        }
    }

    @Override
    @Transactional
    public int deleteRange(String providerId, LocalDate from, LocalDate to) {
        try {
            return repository.deleteUnbookedBetween(providerId, from, to);
        } catch (DataAccessException e) {
            throw new ScheduleStorageException("Failed to delete slots " + from + ".." + to, e);
        }
    }

    @Override
    @Transactional
    public int deleteFrom(String providerId, LocalDate from) {
        try {
            return repository.deleteUnbookedFrom(providerId, from);
        } catch (DataAccessException e) {
            throw new ScheduleStorageException("Failed to delete slots from " + from, e);
        }
    }

    @Override
    @Transactional(readOnly = true)
    public List<Slot> listByDateRange(String providerId, LocalDate from, LocalDate to) {
        try {
            return repository.findByProviderIdAndDateBetweenOrderByDateAscStartTimeAsc(providerId, from, to);
        } catch (DataAccessException e) {
            throw new ScheduleStorageException("Failed to load slots " + from + ".." + to, e);
        }
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<Slot> find(Long slotId) {
        try {
            return repository.findById(slotId);
        } catch (DataAccessException e) {
            throw new ScheduleStorageException("Failed to load slot " + slotId, e);
        }
    }

    @Override
    @Transactional
    public ReplaceResult replaceRange(String providerId, LocalDate from, LocalDate to, List<Slot> slots) {
        try {
            int deleted = repository.deleteUnbookedBetween(providerId, from, to);

            // only booked slots are left in the range now
            Set<SlotKey> booked = repository.findByProviderIdAndDateBetweenOrderByDateAscStartTimeAsc(providerId, from, to)
                    .stream()
                    .map(SlotKey::of)
                    .collect(Collectors.toSet());

            List<Slot> toInsert = slots.stream()
                    .filter(slot -> !booked.contains(SlotKey.of(slot)))
                    .toList();
            repository.saveAllAndFlush(toInsert);

            log.info("Replaced slots of provider {} in {}..{}: deleted={}, inserted={}, skipped={}",
                    providerId, from, to, deleted, toInsert.size(), slots.size() - toInsert.size());
            return new ReplaceResult(deleted, toInsert.size(), slots.size() - toInsert.size());
        } catch (DataAccessException e) {
            throw new ScheduleStorageException("Batch replace failed for provider " + providerId, e);
        }
    }

    @Override
    @Transactional
    public Slot markBooked(Long slotId, boolean booked) {
        try {
            Slot slot = repository.findForUpdate(slotId).orElseThrow(() -> new SlotNotFoundException(slotId));
            slot.setBooked(booked);
            Slot saved = repository.save(slot);

            SlotChange change = new SlotChange(saved.getProviderId(), saved.getId(),
                    booked ? SlotChange.ChangeType.BOOKED : SlotChange.ChangeType.RELEASED);
            publishAfterCommit(change);
            return saved;
        } catch (DataAccessException e) {
            throw new ScheduleStorageException("Failed to update booking flag of slot " + slotId, e);
        }
    }

    private Slot lockEditable(Long slotId) {
        Slot slot = repository.findForUpdate(slotId).orElseThrow(() -> new SlotNotFoundException(slotId));
        if (slot.isBooked()) {
            throw new SlotConflictException("Slot " + slotId + " is booked");
        }
        return slot;
    }

    private void publishAfterCommit(SlotChange change) {
        if (!TransactionSynchronizationManager.isSynchronizationActive()) {
            channel.publish(change);
            return;
        }
        TransactionSynchronizationManager.registerSynchronization(new TransactionSynchronization() {
            @Override
            public void afterCommit() {
                channel.publish(change);
            }
        });
    }

    private record SlotKey(LocalDate date, LocalTime start) {
        static SlotKey of(Slot slot) {
            return new SlotKey(slot.getDate(), slot.getStartTime());
        }
    }
}
