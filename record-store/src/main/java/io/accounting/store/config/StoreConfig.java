package io.accounting.store.config;

import java.util.Arrays;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Record store settings. Each value comes from a system property ({@code accounting.store.*}),
 * then an environment variable ({@code ACCOUNTING_STORE_*}), then the default.
 *
 * @param metaCountKeys meta keys for which per-value record counts are exported as metrics
 */
public record StoreConfig(
        int port,
        String jdbcUrl,
        String jdbcUser,
        String jdbcPassword,
        boolean lenient,
        int workers,
        long metricsFrequencySeconds,
        List<String> metaCountKeys
) {
    public static StoreConfig fromEnv() {
        int port = Integer.parseInt(setting("port", "8000"));
        String url = setting("jdbc.url", "jdbc:h2:file:./data/accounting");
        String user = setting("jdbc.user", null);
        String password = setting("jdbc.password", null);
        boolean lenient = Boolean.parseBoolean(setting("lenient", "false"));
        int workers = Integer.parseInt(setting("workers", "8"));
        long frequency = Long.parseLong(setting("metrics.frequency", "30"));
        List<String> keys = Arrays.stream(setting("metrics.meta-keys", "site,group,user").split(","))
                .map(String::trim)
                .filter(s -> !s.isEmpty())
                .collect(Collectors.toList());
        return new StoreConfig(port, url, user, password, lenient, workers, frequency, keys);
    }

    private static String setting(String name, String def) {
        String env = "ACCOUNTING_STORE_" + name.toUpperCase().replace('.', '_').replace('-', '_');
        return System.getProperty("accounting.store." + name, System.getenv().getOrDefault(env, def));
    }
}
