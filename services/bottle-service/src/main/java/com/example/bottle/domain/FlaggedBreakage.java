package com.example.bottle.domain;

import lombok.Value;

@Value
public class FlaggedBreakage {

    String name;
    int quantity;
}
