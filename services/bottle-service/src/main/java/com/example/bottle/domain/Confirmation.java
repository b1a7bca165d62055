package com.example.bottle.domain;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class Confirmation {

    InventoryOperation operation;
    Long itemId;
    String name;
    int quantity;
    boolean breakageFlagged;
    String message;
}
