package com.example.bottle.domain;

import lombok.Value;

/**
 * Barcode printed on a bottle. Digit count is checked by whoever reads it in, not here.
 */
@Value(staticConstructor = "of")
public class Barcode {

    long value;
}
