package com.example.bottle.error;

public enum InventoryError {
    INVALID_QUANTITY,
    INVALID_NAME,
    RESERVED_NAME,
    DUPLICATE_NAME,
    NOT_FOUND,
    CONFLICT
}
