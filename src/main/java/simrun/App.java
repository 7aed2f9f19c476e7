package simrun;

import simrun.coordinator.config.CoordinatorConfig;
import simrun.coordinator.config.Dependencies;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.util.concurrent.CountDownLatch;

/**
 * Headless coordinator process: opens the stores and keeps run statuses in sync
 * with the compute service until stopped.
 * <p>
 * Usage: {@code App [config.ini]}. Without an argument settings come from
 * {@code SIMRUN_*} environment variables.
 */
public final class App {

    private static final Logger log = LoggerFactory.getLogger(App.class);

    private App() {
    }

    public static void main(String[] args) throws IOException, InterruptedException {
        CoordinatorConfig config = args.length > 0
                ? CoordinatorConfig.fromIni(Path.of(args[0]))
                : CoordinatorConfig.fromEnv();

        Dependencies deps = Dependencies.create(config);
        if (!deps.database().isHealthy()) {
            log.error("Database at {} is not reachable, exiting", config.databaseUrl());
            deps.close();
            System.exit(1);
        }
        CountDownLatch stopped = new CountDownLatch(1);
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            log.info("Shutdown requested");
            deps.close();
            stopped.countDown();
        }, "simrun-shutdown"));

        deps.startScheduler();
        log.info("Coordinator running, refreshing run status every {}s", config.refreshInterval().toSeconds());
        stopped.await();
    }
}
