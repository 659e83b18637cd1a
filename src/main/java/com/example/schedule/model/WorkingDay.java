package com.example.schedule.model;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDate;

@Entity
@Table(
        name = "working_days",
        uniqueConstraints = @UniqueConstraint(name = "uniq_provider_work_date",
                columnNames = {"provider_id", "work_date"})
)
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class WorkingDay {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "provider_id", nullable = false)
    private String providerId;

    @Column(name = "work_date", nullable = false)
    private LocalDate workDate;

    private boolean working;
}
