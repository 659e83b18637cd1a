package com.example.schedule.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Start time as HH:MM or HH:MM:SS; may be empty when adding after existing slots. */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class SlotTimeRequest {
    private String time;
}
