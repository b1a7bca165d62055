package com.example.bottle.error;

import lombok.Getter;

/**
 * Rejection of an inventory operation. The inventory is left exactly as it was before the
 * call, so callers can report the message and carry on.
 */
@Getter
public class InventoryException extends RuntimeException {

    private final InventoryError error;

    public InventoryException(InventoryError error, String message) {
        super(message);
        this.error = error;
    }
}
