package io.github.riemr.voucher.application.repository;

import io.github.riemr.voucher.domain.model.Dataset;

public interface DatasetRepository {

    /**
     * Loads the named source. Never fails: a missing or unreadable source is
     * returned as {@link Dataset#empty()}.
     */
    Dataset load(String name);
}
