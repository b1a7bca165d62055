package com.example.bottle.domain;

import lombok.Getter;
import lombok.Setter;

@Getter
@Setter
public class BreakageCounter {

    private int totalBreakage;

    public void increment(int amount) {
        totalBreakage += amount;
    }
}
