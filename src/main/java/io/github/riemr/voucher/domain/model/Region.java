package io.github.riemr.voucher.domain.model;

import java.util.List;
import java.util.Locale;

/**
 * Regions with their own daily voucher value. A union label is classified by
 * substring match on its upper-cased text, trying the constants in declaration order.
 */
public enum Region {
    SAO_PAULO("São Paulo", List.of("SÃO PAULO", "SAO PAULO", "SP")),
    RIO_DE_JANEIRO("Rio de Janeiro", List.of("RIO DE JANEIRO", "RJ")),
    RIO_GRANDE_DO_SUL("Rio Grande do Sul", List.of("RIO GRANDE DO SUL", "RS")),
    PARANA("Paraná", List.of("PARANÁ", "PARANA", "PR", "CURITIBA")),
    DEFAULT("DEFAULT", List.of());

    private final String tableKey;
    private final List<String> markers;

    Region(String tableKey, List<String> markers) {
        this.tableKey = tableKey;
        this.markers = markers;
    }

    /** Label of this region in the value-by-region reference sheet. */
    public String getTableKey() {
        return tableKey;
    }

    public static Region classify(String unionLabel) {
        String upper = unionLabel == null ? "" : unionLabel.toUpperCase(Locale.ROOT);
        for (Region r : values()) {
            for (String m : r.markers) {
                if (upper.contains(m)) return r;
            }
        }
        return DEFAULT;
    }
}
