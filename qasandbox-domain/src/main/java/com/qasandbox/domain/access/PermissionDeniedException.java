package com.qasandbox.domain.access;

import com.qasandbox.domain.DomainException;

public final class PermissionDeniedException extends DomainException {

    private final Action action;
    private final ResourceType resourceType;

    public PermissionDeniedException(Action action, ResourceType resourceType, String reason) {
        super(reason);
        this.action = action;
        this.resourceType = resourceType;
    }

    public Action action() {
        return action;
    }

    public ResourceType resourceType() {
        return resourceType;
    }
}
