package com.example.dsr.connector;

import com.example.dsr.models.TableRef;

public class WarehouseException extends RuntimeException {

    public WarehouseException(String message) {
        super(message);
    }

    public static WarehouseException tableUnavailable(TableRef table) {
        return new WarehouseException("Table " + table.qualifiedName() + " is unavailable");
    }
}
