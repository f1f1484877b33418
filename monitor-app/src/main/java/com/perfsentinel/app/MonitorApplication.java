package com.perfsentinel.app;

import com.perfsentinel.core.config.DetectionSettings;
import com.perfsentinel.core.config.DetectionSettingsLoader;
import com.perfsentinel.core.persistence.PersistenceDispatcher;
import com.perfsentinel.core.service.AnomalyMonitoringService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.time.Clock;
import java.util.concurrent.CountDownLatch;

/**
 * Main entry point of the Perf Sentinel monitor process.
 *
 * <h3>Startup</h3>
 *
 * <pre>
 *   MonitorConfig (env vars)
 *     → DetectionSettings (detection.yml)
 *     → JSON-file stores
 *     → AnomalyMonitoringService.start()   (reload thresholds + open alerts)
 *     → /readiness turns 200
 * </pre>
 *
 * <p>
 * The health server comes up before the reload so liveness checks pass while
 * state is being restored; readiness only flips once {@code start()}
 * returns. Callers embedding the engine obtain the service through
 * {@link #bootstrap(MonitorConfig, Clock)}.
 * </p>
 *
 * @since 1.0.0
 */
public final class MonitorApplication {

    private static final Logger LOG = LoggerFactory.getLogger(MonitorApplication.class);

    private MonitorApplication() {
        // entry-point class
    }

    public static void main(String[] args) throws InterruptedException {
        MonitorConfig config = MonitorConfig.fromEnvironment();
        LOG.info("Starting Perf Sentinel with config: {}", config);

        AnomalyMonitoringService service = bootstrap(config, Clock.systemUTC());

        HealthServer healthServer = new HealthServer(service::isReady);
        healthServer.start(config.getHealthPort());

        CountDownLatch shutdown = new CountDownLatch(1);
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            healthServer.stop();
            service.close();
            shutdown.countDown();
        }, "monitor-shutdown"));

        service.start();
        shutdown.await();
    }

    /**
     * Wire the service against the JSON-file stores. The returned service is
     * not started yet.
     *
     * @throws IllegalStateException if the detection settings are invalid
     */
    static AnomalyMonitoringService bootstrap(MonitorConfig config, Clock clock) {
        DetectionSettings settings = DetectionSettingsLoader.load(config.getDetectionConfigPath());

        return AnomalyMonitoringService.builder()
                .clock(clock)
                .settings(settings)
                .alertStore(new JsonFileAlertStore(Path.of(config.getAlertStorePath())))
                .thresholdStore(new JsonFileThresholdStore(Path.of(config.getThresholdStorePath())))
                .dispatcher(PersistenceDispatcher.withThreads(config.getPersistenceThreads()))
                .build();
    }
}
