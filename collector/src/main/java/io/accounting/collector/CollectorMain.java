package io.accounting.collector;

import com.codahale.metrics.MetricRegistry;
import com.codahale.metrics.Slf4jReporter;
import com.google.inject.Guice;
import com.google.inject.Injector;
import com.google.inject.ProvisionException;
import io.accounting.collector.config.CollectorConfig;
import io.accounting.collector.runtime.CollectorRuntime;
import io.accounting.error.PersistenceException;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;

import java.net.URI;
import java.nio.file.Path;
import java.time.Duration;
import java.util.concurrent.Callable;
import java.util.concurrent.TimeUnit;

/**
 * Collects Slurm jobs into the record store until terminated, or once with {@code --one-shot}.
 * Exits with 2 when the local collector state cannot be read or written.
 */
@CommandLine.Command(name = "slurm-collector", mixinStandardHelpOptions = true, description = "Deliver Slurm jobs to the accounting record store")
public final class CollectorMain implements Callable<Integer> {
    static final int STATE_FAILURE = 2;

    private final CollectorConfig defaults = CollectorConfig.fromEnv();

    @CommandLine.Option(names = "--store-url", description = "Base URL of the record store")
    URI storeUrl = defaults.storeUrl();

    @CommandLine.Option(names = "--state-dir", description = "Directory of the durable queue and cursor")
    Path stateDir = defaults.stateDir();

    @CommandLine.Option(names = "--collect-interval-seconds", description = "Delay between collect cycles")
    long collectSeconds = defaults.collectInterval().getSeconds();

    @CommandLine.Option(names = "--send-interval-seconds", description = "Delay between send cycles")
    long sendSeconds = defaults.sendInterval().getSeconds();

    @CommandLine.Option(names = "--one-shot", description = "Run one collect and one send cycle, then exit")
    boolean oneShot;

    @CommandLine.Option(names = "--metrics-log-seconds", description = "Interval for logging metrics, 0 disables", defaultValue = "300")
    long metricsLogSeconds;

    public static void main(String[] args) {
        int code = new CommandLine(new CollectorMain()).execute(args);
        System.exit(code);
    }

    @Override
    public Integer call() throws Exception {
        CollectorConfig cfg = defaults.withStoreUrl(storeUrl)
                .withStateDir(stateDir)
                .withIntervals(Duration.ofSeconds(collectSeconds), Duration.ofSeconds(sendSeconds));
        Injector injector = Guice.createInjector(new CollectorModule(cfg));
        CollectorRuntime runtime;
        try {
            runtime = injector.getInstance(CollectorRuntime.class);
        } catch (ProvisionException e) {
            if (e.getCause() instanceof PersistenceException) {
                LoggerFactory.getLogger(CollectorMain.class).error("cannot open collector state in {}", cfg.stateDir(), e.getCause());
                return STATE_FAILURE;
            }
            throw e;
        }
        if (oneShot) return runtime.runOnce() ? 0 : STATE_FAILURE;

        Slf4jReporter reporter = Slf4jReporter.forRegistry(injector.getInstance(MetricRegistry.class))
                .outputTo(LoggerFactory.getLogger("io.accounting.collector.metrics"))
                .convertDurationsTo(TimeUnit.MILLISECONDS)
                .build();
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            reporter.stop();
            runtime.stop();
        }, "collector-shutdown"));

        runtime.start();
        if (metricsLogSeconds > 0) reporter.start(metricsLogSeconds, TimeUnit.SECONDS);
        runtime.awaitStopped();
        reporter.stop();
        return runtime.failure().isPresent() ? STATE_FAILURE : 0;
    }
}
