package com.journeynsw.backend.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class FareSummary {
    private FarePerson fareType;
    private boolean available;
    private String ticketName;
    private String priceLevel;
    private String price;
}
