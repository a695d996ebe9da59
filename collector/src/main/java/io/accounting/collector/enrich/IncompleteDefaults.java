package io.accounting.collector.enrich;

import java.util.HashMap;
import java.util.Map;

/**
 * Amounts used for components the metrics system never delivered. Components without a
 * configured default get 0.
 */
public class IncompleteDefaults {
    private final Map<String, Long> amounts;

    public IncompleteDefaults(Map<String, Long> amounts) {
        this.amounts = Map.copyOf(amounts);
    }

    public long amountFor(String component) {
        return amounts.getOrDefault(component, 0L);
    }

    /** Parses {@code name=amount}, comma separated. */
    public static IncompleteDefaults parse(String text) {
        Map<String, Long> out = new HashMap<>();
        if (text != null) {
            for (String item : text.split(",")) {
                String spec = item.trim();
                if (spec.isEmpty()) continue;
                int eq = spec.indexOf('=');
                if (eq <= 0) throw new IllegalArgumentException("default must look like component=amount: " + spec);
                long amount = Long.parseLong(spec.substring(eq + 1).trim());
                if (amount < 0) throw new IllegalArgumentException("default amount must not be negative: " + spec);
                out.put(spec.substring(0, eq).trim(), amount);
            }
        }
        return new IncompleteDefaults(out);
    }
}
