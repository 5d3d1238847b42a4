package com.qualitysentinel.service;

import com.qualitysentinel.core.RegressionEngine;
import com.qualitysentinel.core.config.ConfigLoader;
import com.qualitysentinel.core.config.DetectionConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.CountDownLatch;

/**
 * Main entry point of the Quality Sentinel service.
 *
 * <h3>Startup</h3>
 * <pre>
 *   ServiceConfig (environment)
 *     → DetectionConfig (YAML file, or bundled defaults)
 *     → RegressionEngine + JSON alert listener
 *     → HTTP server
 *     → periodic detection
 * </pre>
 *
 * <p>
 * A shutdown hook stops the HTTP server first, then the detection scheduler,
 * letting the cycle in progress finish.
 * </p>
 *
 * @since 1.0.0
 */
public final class QualitySentinelService {

    private static final Logger LOG = LoggerFactory.getLogger(QualitySentinelService.class);

    private QualitySentinelService() {
    }

    public static void main(String[] args) throws InterruptedException {
        ServiceConfig config = ServiceConfig.fromEnvironment();
        LOG.info("Starting Quality Sentinel with config: {}", config);

        DetectionConfig detectionConfig = loadDetectionConfig(config);
        LOG.info("Loaded detection config: {}", detectionConfig);

        JsonCodec codec = new JsonCodec();
        RegressionEngine engine = new RegressionEngine(detectionConfig);
        engine.addListener(new JsonAlertListener(codec));

        SentinelHttpServer server = new SentinelHttpServer(engine, codec);
        server.start(config.getBindAddress(), config.getHttpPort(), config.getHttpThreads());

        CountDownLatch stopped = new CountDownLatch(1);
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            LOG.info("Shutting down Quality Sentinel");
            server.stop();
            engine.close();
            stopped.countDown();
        }, "sentinel-shutdown"));

        engine.start();
        stopped.await();
    }

    static DetectionConfig loadDetectionConfig(ServiceConfig config) {
        return config.hasConfigPath() ? ConfigLoader.load(config.getConfigPath()) : ConfigLoader.load();
    }
}
