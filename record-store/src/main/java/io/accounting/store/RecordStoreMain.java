package io.accounting.store;

import com.codahale.metrics.MetricRegistry;
import com.codahale.metrics.Slf4jReporter;
import com.google.inject.Guice;
import com.google.inject.Injector;
import io.accounting.store.config.StoreConfig;
import io.accounting.store.server.RecordStoreServer;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;

import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

/**
 * Runs the record store HTTP API until the process is terminated.
 */
@CommandLine.Command(name = "record-store", mixinStandardHelpOptions = true, description = "Serve the accounting record store")
public final class RecordStoreMain implements Callable<Integer> {
    private final StoreConfig defaults = StoreConfig.fromEnv();

    @CommandLine.Option(names = {"-p", "--port"}, description = "HTTP port")
    int port = defaults.port();

    @CommandLine.Option(names = "--jdbc-url", description = "JDBC URL of the record database")
    String jdbcUrl = defaults.jdbcUrl();

    @CommandLine.Option(names = "--lenient", description = "Accept duplicate creates as no-ops instead of conflicts")
    boolean lenient = defaults.lenient();

    @CommandLine.Option(names = {"-w", "--workers"}, description = "HTTP worker threads")
    int workers = defaults.workers();

    @CommandLine.Option(names = "--metrics-log-seconds", description = "Interval for logging metrics, 0 disables", defaultValue = "300")
    long metricsLogSeconds;

    public static void main(String[] args) {
        int code = new CommandLine(new RecordStoreMain()).execute(args);
        System.exit(code);
    }

    @Override
    public Integer call() throws Exception {
        StoreConfig cfg = new StoreConfig(port, jdbcUrl, defaults.jdbcUser(), defaults.jdbcPassword(), lenient, workers,
                defaults.metricsFrequencySeconds(), defaults.metaCountKeys());
        Injector injector = Guice.createInjector(new StoreModule(cfg));
        RecordStoreServer server = injector.getInstance(RecordStoreServer.class);
        Slf4jReporter reporter = Slf4jReporter.forRegistry(injector.getInstance(MetricRegistry.class))
                .outputTo(LoggerFactory.getLogger("io.accounting.store.metrics"))
                .convertDurationsTo(TimeUnit.MILLISECONDS)
                .build();

        CountDownLatch stopped = new CountDownLatch(1);
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            reporter.stop();
            server.close();
            stopped.countDown();
        }, "record-store-shutdown"));

        server.start();
        if (metricsLogSeconds > 0) reporter.start(metricsLogSeconds, TimeUnit.SECONDS);
        stopped.await();
        return 0;
    }
}
