package com.example.stock.events;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.UUID;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class BottleAddedEvent {

    private UUID eventId;
    private Long itemId;
    private String name;
    private String style;
    private Integer quantity;
    private Integer sizeInMl;
    private Long barcode;
    private boolean breakageFlagged;
    private Instant eventTimestamp;
}
