package com.tradegate.access.domain;

public class NotFoundException extends RuntimeException {
    public NotFoundException(String kind, String id) {
        super(kind + " not found: " + id);
    }
}
