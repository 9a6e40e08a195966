package com.qasandbox.domain.access;

import java.util.Locale;
import java.util.Objects;

/**
 * Single source of truth for "may this principal do that".
 *
 * Rules:
 * - Pure and total: every (role, resource, action) has an outcome, no I/O, no state.
 * - Switches are exhaustive over the enums, so a new Role/Action/ResourceType does not compile
 *   until every table below has a row for it.
 * - Ownership only matters for viewers acting on orders. A null owner means a collection-level
 *   check; narrowing is then done by {@link VisibilityFilter}.
 */
public final class AccessPolicy {

    public AccessDecision authorize(Principal principal, Action action, ResourceType resourceType) {
        return authorize(principal, action, resourceType, null);
    }

    public AccessDecision authorize(Principal principal, Action action, ResourceType resourceType, Long resourceOwner) {
        Objects.requireNonNull(principal, "principal");
        Objects.requireNonNull(action, "action");
        Objects.requireNonNull(resourceType, "resourceType");

        boolean allowed = switch (resourceType) {
            case USER -> userRule(principal.role(), action);
            case CATEGORY, PRODUCT -> catalogRule(principal.role(), action);
            case ORDER -> orderRule(principal.role(), action);
            case ADMIN_OPS -> adminRule(principal.role());
        };
        if (!allowed) {
            return AccessDecision.deny("Role '" + principal.role().value() + "' cannot "
                    + action.name().toLowerCase(Locale.ROOT) + " " + resourceType.displayName());
        }

        if (resourceType == ResourceType.ORDER && ownerBound(principal.role(), action)
                && resourceOwner != null && !principal.owns(resourceOwner)) {
            return AccessDecision.deny("Cannot " + action.name().toLowerCase(Locale.ROOT) + " other users' orders");
        }
        return AccessDecision.allow();
    }

    /**
     * @throws PermissionDeniedException when {@link #authorize} denies
     */
    public void require(Principal principal, Action action, ResourceType resourceType, Long resourceOwner) {
        AccessDecision decision = authorize(principal, action, resourceType, resourceOwner);
        if (decision.denied()) {
            throw new PermissionDeniedException(action, resourceType, decision.reason());
        }
    }

    public void require(Principal principal, Action action, ResourceType resourceType) {
        require(principal, action, resourceType, null);
    }

    private static boolean userRule(Role role, Action action) {
        return switch (role) {
            case ADMIN -> switch (action) {
                case READ, UPDATE, DELETE -> true;
                case CREATE, CANCEL, ADMIN -> false;
            };
            case TESTER, VIEWER -> switch (action) {
                case READ -> true;
                case CREATE, UPDATE, DELETE, CANCEL, ADMIN -> false;
            };
        };
    }

    private static boolean catalogRule(Role role, Action action) {
        return switch (role) {
            case ADMIN, TESTER -> switch (action) {
                case READ, CREATE, UPDATE, DELETE -> true;
                case CANCEL, ADMIN -> false;
            };
            case VIEWER -> switch (action) {
                case READ -> true;
                case CREATE, UPDATE, DELETE, CANCEL, ADMIN -> false;
            };
        };
    }

    private static boolean orderRule(Role role, Action action) {
        return switch (role) {
            case ADMIN, TESTER -> switch (action) {
                case READ, CREATE, UPDATE, DELETE, CANCEL -> true;
                case ADMIN -> false;
            };
            case VIEWER -> switch (action) {
                case READ, CREATE, CANCEL -> true;
                case UPDATE, DELETE, ADMIN -> false;
            };
        };
    }

    private static boolean adminRule(Role role) {
        return switch (role) {
            case ADMIN -> true;
            case TESTER, VIEWER -> false;
        };
    }

    // Viewer rights on orders that are limited to the viewer's own records.
    private static boolean ownerBound(Role role, Action action) {
        return switch (role) {
            case ADMIN, TESTER -> false;
            case VIEWER -> switch (action) {
                case READ, CANCEL -> true;
                case CREATE, UPDATE, DELETE, ADMIN -> false;
            };
        };
    }
}
