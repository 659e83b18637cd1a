package com.example.schedule.model;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.time.LocalDate;
import java.time.LocalTime;

@Entity
@Table(
        name = "slots",
        uniqueConstraints = @UniqueConstraint(name = "uniq_provider_day_start",
                columnNames = {"provider_id", "slot_date", "start_time"})
)
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class Slot {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "provider_id", nullable = false)
    private String providerId;

    @Column(name = "slot_date", nullable = false)
    private LocalDate date;

    @Column(name = "start_time", nullable = false)
    private LocalTime startTime;

    @Column(name = "end_time", nullable = false)
    private LocalTime endTime;

    /** Flipped by the booking lifecycle only; a booked slot is read-only here. */
    @Column(name = "is_booked", nullable = false)
    private boolean booked;

    public boolean isAvailable() {
        return !booked;
    }
}
