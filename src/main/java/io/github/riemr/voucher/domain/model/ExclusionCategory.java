package io.github.riemr.voucher.domain.model;

/** Classes of employee that never receive the voucher. */
public enum ExclusionCategory {
    INTERN,
    APPRENTICE,
    LEAVE,
    OVERSEAS,
    /** Derived from the roster job title rather than a source of its own. */
    DIRECTOR
}
