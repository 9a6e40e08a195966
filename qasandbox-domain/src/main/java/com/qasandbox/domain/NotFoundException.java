package com.qasandbox.domain;

import com.qasandbox.domain.access.ResourceType;

import java.util.Objects;

/**
 * Resource is absent, or exists but is hidden from the current principal.
 * Both cases produce the same exception so callers cannot tell them apart.
 */
public final class NotFoundException extends DomainException {

    private final ResourceType resourceType;
    private final long id;

    public NotFoundException(ResourceType resourceType, long id) {
        super(Objects.requireNonNull(resourceType, "resourceType").displayName() + " not found");
        this.resourceType = resourceType;
        this.id = id;
    }

    public ResourceType resourceType() {
        return resourceType;
    }

    public long id() {
        return id;
    }
}
