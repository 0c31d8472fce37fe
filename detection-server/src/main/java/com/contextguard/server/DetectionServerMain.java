package com.contextguard.server;

import com.contextguard.core.config.GuardConfig;
import com.contextguard.core.config.GuardConfigLoader;
import com.contextguard.core.orchestration.AnalysisOrchestrator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;

/**
 * Main entry point of the remote detection service.
 *
 * <p>
 * All configuration is resolved from environment variables via
 * {@link ServerConfig}; detection settings come from the YAML file named by
 * {@code CONTEXT_GUARD_CONFIG} or the bundled defaults.
 * </p>
 *
 * @since 1.0.0
 */
public final class DetectionServerMain {

    private static final Logger LOG = LoggerFactory.getLogger(DetectionServerMain.class);

    private DetectionServerMain() {
        // entry-point class
    }

    public static void main(String[] args) {
        // 1. Load configuration
        ServerConfig config = ServerConfig.fromEnvironment();
        LOG.info("Starting Context Guard detection server with config: {}", config);

        // 2. Build the engine
        AnalysisOrchestrator orchestrator = AnalysisOrchestrator.fromConfig(loadGuardConfig(config));
        orchestrator.start();

        // 3. Serve, with a shutdown hook
        DetectionServer server = new DetectionServer(orchestrator, config.getWorkerThreads());
        server.start(config.getPort());
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            server.stop();
            orchestrator.close();
        }, "detection-server-shutdown"));
    }

    /**
     * Load detection settings for the service. The remote tier is always
     * disabled here, since the service is itself the remote tier.
     */
    static GuardConfig loadGuardConfig(ServerConfig config) {
        GuardConfigLoader loader = GuardConfigLoader.create();
        GuardConfig guardConfig = config.getConfigPath()
                .map(path -> loader.withFile(Path.of(path)))
                .orElse(loader)
                .resolve();
        if (guardConfig.getRemote().isEnabled()) {
            LOG.info("Ignoring remote tier settings inside the detection server");
            guardConfig.getRemote().setEnabled(false);
        }
        config.getHistoryPath().ifPresent(guardConfig.getHistory()::setPath);
        LOG.info("Loaded {} detection rule(s)", guardConfig.getRules().size());
        return guardConfig;
    }
}
