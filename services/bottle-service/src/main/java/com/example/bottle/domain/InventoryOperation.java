package com.example.bottle.domain;

public enum InventoryOperation {
    ADD,
    REMOVE,
    EDIT
}
