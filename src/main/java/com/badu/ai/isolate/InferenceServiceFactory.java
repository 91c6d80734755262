package com.badu.ai.isolate;

import com.badu.ai.isolate.config.BridgeConfig;
import com.badu.ai.isolate.config.BridgeConfigParser;
import com.badu.ai.isolate.proxy.InferenceServiceProxy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.function.Supplier;

/**
 * Factory for inference services running on a dedicated worker thread.
 *
 * <p>This factory provides three creation methods:
 * <ul>
 *   <li>{@link #isolated(Supplier)}: default bridge configuration</li>
 *   <li>{@link #isolated(Supplier, BridgeConfig)}: explicit bridge configuration</li>
 *   <li>{@link #isolated(Supplier, Path)}: bridge configuration read from a JSON file</li>
 * </ul>
 *
 * <p>The engine factory is not called here. It runs on the worker thread when the returned
 * service is first initialized, so engines that are expensive to construct never block the
 * caller.
 *
 * <p>Usage example:
 * <pre>{@code
 * InferenceService service = InferenceServiceFactory.isolated(MyEngine::new);
 * service.init(InitOptions.DEFAULT).join();
 * }</pre>
 */
public class InferenceServiceFactory {

    private static final Logger logger = LoggerFactory.getLogger(InferenceServiceFactory.class);

    private InferenceServiceFactory() {
    }

    /**
     * Creates an isolated service with the default bridge configuration.
     *
     * @param engineFactory creates the real service on the worker thread
     * @return proxy implementing the same contract (not initialized)
     */
    public static InferenceServiceProxy isolated(Supplier<? extends InferenceService> engineFactory) {
        return isolated(engineFactory, BridgeConfig.DEFAULT);
    }

    /**
     * Creates an isolated service.
     *
     * @param engineFactory creates the real service on the worker thread
     * @param config bridge configuration
     * @return proxy implementing the same contract (not initialized)
     * @throws IllegalArgumentException if an argument is null
     */
    public static InferenceServiceProxy isolated(Supplier<? extends InferenceService> engineFactory,
                                                 BridgeConfig config) {
        if (engineFactory == null) {
            throw new IllegalArgumentException("Engine factory cannot be null");
        }
        if (config == null) {
            throw new IllegalArgumentException("BridgeConfig cannot be null");
        }

        logger.info("Creating isolated inference service (worker: {}, proxy: {})",
            config.getWorkerName(), config.getProxyName());
        return new InferenceServiceProxy(engineFactory, config);
    }

    /**
     * Creates an isolated service with the bridge configuration read from a JSON file. A missing
     * file falls back to the default configuration.
     *
     * @param engineFactory creates the real service on the worker thread
     * @param configFile bridge configuration file
     * @return proxy implementing the same contract (not initialized)
     * @throws IOException if the file exists but cannot be read
     * @throws InferenceException with type CONFIGURATION if the file content is invalid
     */
    public static InferenceServiceProxy isolated(Supplier<? extends InferenceService> engineFactory,
                                                 Path configFile) throws IOException {
        if (configFile == null) {
            throw new IllegalArgumentException("Config file path cannot be null");
        }
        if (!Files.exists(configFile)) {
            logger.warn("Bridge config {} does not exist, using defaults", configFile);
            return isolated(engineFactory, BridgeConfig.DEFAULT);
        }

        BridgeConfig config = BridgeConfigParser.parse(configFile);
        logger.debug("Loaded bridge config from {}: {}", configFile, config);
        return isolated(engineFactory, config);
    }
}
