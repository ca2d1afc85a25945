package com.acme.render.core;

import java.util.UUID;

public class NotFoundException extends RuntimeException {

    public NotFoundException(String kind, UUID id) {
        super(kind + " not found: " + id);
    }
}
