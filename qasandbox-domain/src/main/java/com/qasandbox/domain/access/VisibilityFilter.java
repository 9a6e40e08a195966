package com.qasandbox.domain.access;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.function.ToLongFunction;

/**
 * Narrows order result sets to what a principal may see.
 * Admins and testers see everything; viewers see only orders they own.
 */
public final class VisibilityFilter {

    public boolean isVisible(Principal principal, long ownerId) {
        Objects.requireNonNull(principal, "principal");
        return switch (principal.role()) {
            case ADMIN, TESTER -> true;
            case VIEWER -> principal.owns(ownerId);
        };
    }

    /** Owner restriction to push into a query, empty when the principal sees all owners. */
    public Optional<Long> ownerScope(Principal principal) {
        Objects.requireNonNull(principal, "principal");
        return switch (principal.role()) {
            case ADMIN, TESTER -> Optional.empty();
            case VIEWER -> Optional.of(principal.id());
        };
    }

    public <T> List<T> filterVisible(Principal principal, Collection<T> candidates, ToLongFunction<T> ownerOf) {
        Objects.requireNonNull(candidates, "candidates");
        Objects.requireNonNull(ownerOf, "ownerOf");
        List<T> visible = new ArrayList<>(candidates.size());
        for (T candidate : candidates) {
            if (isVisible(principal, ownerOf.applyAsLong(candidate))) {
                visible.add(candidate);
            }
        }
        return visible;
    }
}
