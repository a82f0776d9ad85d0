package com.racklite;

import com.racklite.core.DatabaseInitializer;

import com.racklite.core.DiscoveryScanner;

import com.racklite.core.LoggingConfigurator;

import com.racklite.core.ScanProgressTracker;

import com.racklite.core.TcpHostProber;

import com.racklite.verticles.DiscoveryVerticle;

import io.vertx.config.ConfigRetriever;

import io.vertx.config.ConfigRetrieverOptions;

import io.vertx.config.ConfigStoreOptions;

import io.vertx.core.DeploymentOptions;

import io.vertx.core.Future;

import io.vertx.core.Promise;

import io.vertx.core.Vertx;

import io.vertx.core.json.JsonObject;

import org.slf4j.Logger;

import org.slf4j.LoggerFactory;

import java.util.ArrayList;

import java.util.List;

/**
 * RackLite Discovery - Main Entry Point (Vert.x 5)

 * Startup sequence:
 * - Load application.conf (HOCON)
 * - Apply the logging section
 * - Initialize storage services (PostgreSQL or in-memory) via DatabaseInitializer
 * - Build the TCP host prober and the network scanner
 * - Deploy DiscoveryVerticle with the discovery section as its config

 * Communication: Event Bus driven (discovery.scan.*, discovery.promote*)
 */
public class RackLiteApplication
{

    private static final Logger logger = LoggerFactory.getLogger(RackLiteApplication.class);

    private static Vertx vertx;

    private static DatabaseInitializer databaseInitializer;

    private static final List<String> deployedVerticleIds = new ArrayList<>();

    /**
     * Main entry point for the RackLite discovery service.
     *
     * @param args Command line arguments (not used)
     */
    public static void main(String[] args)
    {
        logger.info("Starting RackLite Discovery");

        vertx = Vertx.vertx();

        loadConfiguration()
            .compose(config ->
            {
                LoggingConfigurator.configure(config);

                logger.info("Configuration loaded successfully");

                return initializeDatabase(config);
            })
            .compose(RackLiteApplication::deployDiscoveryVerticle)
            .onSuccess(v ->
            {
                logger.info("RackLite Discovery started successfully");

                Runtime.getRuntime().addShutdownHook(new Thread(() ->
                {
                    logger.info("Shutdown signal received");

                    cleanup()
                        .compose(cleanupResult -> vertx.close())
                        .onSuccess(closeResult -> logger.info("Application stopped gracefully"))
                        .onFailure(cause -> logger.error("Error during graceful shutdown", cause));
                }));
            })
            .onFailure(cause ->
            {
                logger.error("Failed to start RackLite Discovery", cause);

                cleanup()
                    .compose(cleanupResult -> vertx.close())
                    .onComplete(closeResult ->
                    {
                        if (closeResult.failed())
                        {
                            logger.error("Failed to close Vertx instance", closeResult.cause());
                        }

                        System.exit(1);
                    });
            });
    }

    /**
     * Initializes the storage services before any verticle is deployed.
     *
     * @param config Application configuration
     * @return Future containing the config (for chaining)
     */
    private static Future<JsonObject> initializeDatabase(JsonObject config)
    {
        databaseInitializer = new DatabaseInitializer(vertx, config);

        return databaseInitializer.initialize()
            .map(v -> config);
    }

    /**
     * Builds the scanner and deploys DiscoveryVerticle.
     *
     * @param config Application configuration
     * @return Future that completes when the verticle is deployed
     */
    private static Future<Void> deployDiscoveryVerticle(JsonObject config)
    {
        var discoveryConfig = config.getJsonObject("discovery", new JsonObject());

        var maxConcurrentPorts = discoveryConfig.getJsonObject("max", new JsonObject())
            .getJsonObject("concurrent", new JsonObject())
            .getInteger("ports", TcpHostProber.DEFAULT_MAX_CONCURRENT_PORTS);

        var progressInterval = discoveryConfig.getJsonObject("progress", new JsonObject())
            .getInteger("interval", ScanProgressTracker.DEFAULT_NOTIFY_INTERVAL);

        var scanner = new DiscoveryScanner(vertx,
            databaseInitializer.inventoryService(),
            databaseInitializer.discoveryService(),
            new TcpHostProber(vertx, maxConcurrentPorts),
            progressInterval);

        var discoveryOptions = new DeploymentOptions().setConfig(discoveryConfig);

        return vertx.deployVerticle(new DiscoveryVerticle(databaseInitializer.discoveryService(), scanner), discoveryOptions)
            .onSuccess(discoveryId ->
            {
                deployedVerticleIds.add(discoveryId);

                logger.debug("DiscoveryVerticle deployed: {}", discoveryId);
            })
            .onFailure(cause -> logger.error("Failed to deploy DiscoveryVerticle", cause))
            .mapEmpty();
    }

    /**
     * Undeploys verticles and releases database resources.
     *
     * @return Future that completes when cleanup is done
     */
    private static Future<Void> cleanup()
    {
        logger.info("Starting cleanup");

        var cleanupFutures = new ArrayList<Future<?>>();

        for (var deploymentId : deployedVerticleIds)
        {
            cleanupFutures.add(vertx.undeploy(deploymentId)
                .onSuccess(v -> logger.debug("Verticle undeploy: {}", deploymentId))
                .onFailure(cause -> logger.error("Failed to undeploy verticle: {}", deploymentId, cause)));
        }

        // Undeploy first so no scan writes through a closed pool
        return Future.join(cleanupFutures)
            .transform(result ->
            {
                deployedVerticleIds.clear();

                return databaseInitializer != null ? databaseInitializer.cleanup() : Future.<Void>succeededFuture();
            });
    }

    /**
     * Loads application configuration from application.conf using HOCON format.
     *
     * @return Future containing the loaded configuration as JsonObject
     */
    private static Future<JsonObject> loadConfiguration()
    {
        var promise = Promise.<JsonObject>promise();

        var fileStore = new ConfigStoreOptions()
            .setType("file")
            .setFormat("hocon")
            .setConfig(new JsonObject().put("path", "application.conf"));

        var options = new ConfigRetrieverOptions().addStore(fileStore);

        var retriever = ConfigRetriever.create(vertx, options);

        retriever.getConfig()
            .onSuccess(config ->
            {
                var storageType = config.getJsonObject("storage", new JsonObject()).getString("type", DatabaseInitializer.STORAGE_POSTGRES);

                var dbConfig = config.getJsonObject("database", new JsonObject());

                logger.info("Configuration loaded - Storage: {}, Database: {}:{}/{}",
                    storageType,
                    dbConfig.getString("host"),
                    dbConfig.getInteger("port"),
                    dbConfig.getString("database"));

                promise.complete(config);
            })
            .onFailure(cause ->
            {
                logger.error("Failed to load configuration from application.conf", cause);

                promise.fail(cause);
            });

        return promise.future();
    }

}
