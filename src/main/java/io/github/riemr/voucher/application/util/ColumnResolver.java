package io.github.riemr.voucher.application.util;

import io.github.riemr.voucher.domain.model.Dataset;

import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Best-effort lookup of a column in a human-maintained sheet. Tries an exact
 * canonical name, then the first column whose name contains one of the tokens
 * (case-insensitive), then an optional position.
 */
public final class ColumnResolver {

    private final String canonical;
    private final List<String> tokens;
    private final Integer position;

    private ColumnResolver(String canonical, List<String> tokens, Integer position) {
        this.canonical = canonical;
        this.tokens = tokens;
        this.position = position;
    }

    public static ColumnResolver containing(String... tokens) {
        return new ColumnResolver(null, List.of(tokens), null);
    }

    public static ColumnResolver at(int position) {
        return new ColumnResolver(null, List.of(), position);
    }

    /** Prefer a column already carrying {@code name}. */
    public ColumnResolver preferring(String name) {
        return new ColumnResolver(name, tokens, position);
    }

    /**
     * Positional fallback. An index past the last column resolves to the last
     * column.
     */
    public ColumnResolver orPosition(int index) {
        return new ColumnResolver(canonical, tokens, index);
    }

    public Optional<String> resolve(Dataset dataset) {
        List<String> columns = dataset.getColumns();
        if (canonical != null && columns.contains(canonical)) {
            return Optional.of(canonical);
        }
        for (String column : columns) {
            String low = column.toLowerCase(Locale.ROOT);
            for (String token : tokens) {
                if (low.contains(token.toLowerCase(Locale.ROOT))) {
                    return Optional.of(column);
                }
            }
        }
        if (position != null && !columns.isEmpty()) {
            return Optional.of(columns.get(Math.min(position, columns.size() - 1)));
        }
        return Optional.empty();
    }
}
