package com.flagship.job_ledger.exception;

import java.util.UUID;

/**
 * A referenced record does not exist, or does not belong to the parent the
 * caller named. Both cases read the same so that existence is not leaked.
 */
public class NotFoundException extends RuntimeException {

    private final String entityType;

    public NotFoundException(String entityType, Object id) {
        super(String.format("%s not found: %s", entityType, id));
        this.entityType = entityType;
    }

    public static NotFoundException of(String entityType, UUID id) {
        return new NotFoundException(entityType, id);
    }

    public String getEntityType() {
        return entityType;
    }
}
