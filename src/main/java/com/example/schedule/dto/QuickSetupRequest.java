package com.example.schedule.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class QuickSetupRequest {
    private String fromTime;
    private String toTime;
    private int durationMinutes;
}
