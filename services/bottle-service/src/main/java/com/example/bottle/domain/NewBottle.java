package com.example.bottle.domain;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Field values for a beer about to be added to stock.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class NewBottle {

    private String style;
    private String name;
    private double strengthPercent;
    private ContainerSize size;
    private int quantity;
    private long barcode;
}
