package com.example.bottle.domain;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Replacement values for an existing beer. Null or blank text keeps the current value;
 * any non-null number or flag overwrites it.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class BottlePatch {

    private String name;
    private String style;
    private Double strengthPercent;
    private Integer size;
    private Boolean metric;
    private Integer quantity;
    private Long barcode;
}
