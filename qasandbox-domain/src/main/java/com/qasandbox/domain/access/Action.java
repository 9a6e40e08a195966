package com.qasandbox.domain.access;

public enum Action {
    READ,
    CREATE,
    UPDATE,
    DELETE,
    /** Order cancellation. Separate from UPDATE so viewers can cancel without editing. */
    CANCEL,
    /** Bulk operations such as database reset. */
    ADMIN
}
