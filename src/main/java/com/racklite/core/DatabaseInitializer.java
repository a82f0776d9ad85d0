package com.racklite.core;

import com.racklite.services.DiscoveryService;

import com.racklite.services.InventoryService;

import com.racklite.services.impl.DiscoveryServiceImpl;

import com.racklite.services.impl.InMemoryDatabase;

import com.racklite.services.impl.InMemoryDiscoveryServiceImpl;

import com.racklite.services.impl.InMemoryInventoryServiceImpl;

import com.racklite.services.impl.InventoryServiceImpl;

import io.vertx.core.Future;

import io.vertx.core.Promise;

import io.vertx.core.Vertx;

import io.vertx.core.json.JsonObject;

import io.vertx.pgclient.PgBuilder;

import io.vertx.pgclient.PgConnectOptions;

import io.vertx.sqlclient.Pool;

import io.vertx.sqlclient.PoolOptions;

import org.slf4j.Logger;

import org.slf4j.LoggerFactory;

/**
 * DatabaseInitializer - One-time storage setup at application startup

 * Tasks performed:
 * - storage.type = "postgres": creates the PostgreSQL pool, verifies connectivity,
 *   optionally applies db/schema.sql (database.schema.apply) and creates the Pg services
 * - storage.type = "memory": creates the in-memory services over one shared database

 * Services are ready before any verticle is deployed.
 */
public class DatabaseInitializer
{

    private static final Logger logger = LoggerFactory.getLogger(DatabaseInitializer.class);

    public static final String STORAGE_POSTGRES = "postgres";

    public static final String STORAGE_MEMORY = "memory";

    private static final String SCHEMA_RESOURCE = "db/schema.sql";

    private final Vertx vertx;

    private final JsonObject config;

    private Pool pgPool;

    private InventoryService inventoryService;

    private DiscoveryService discoveryService;

    /**
     * Creates a new DatabaseInitializer instance.
     *
     * @param vertx Vert.x instance
     * @param config Full application configuration (storage and database sections are read)
     */
    public DatabaseInitializer(Vertx vertx, JsonObject config)
    {
        this.vertx = vertx;

        this.config = config;
    }

    /**
     * Creates the storage services for the configured storage type.
     *
     * @return Future that completes when the services are ready
     */
    public Future<Void> initialize()
    {
        try
        {
            var storageType = config.getJsonObject("storage", new JsonObject()).getString("type", STORAGE_POSTGRES);

            logger.info("Initializing storage services: {}", storageType);

            if (STORAGE_MEMORY.equalsIgnoreCase(storageType))
            {
                var database = new InMemoryDatabase();

                this.inventoryService = new InMemoryInventoryServiceImpl(database);

                this.discoveryService = new InMemoryDiscoveryServiceImpl(database);

                return Future.succeededFuture();
            }

            if (!STORAGE_POSTGRES.equalsIgnoreCase(storageType))
            {
                return Future.failedFuture(new DiscoveryException(DiscoveryException.Kind.CONFIGURATION,
                    "unknown storage.type: " + storageType));
            }

            var databaseConfig = config.getJsonObject("database", new JsonObject());

            return setupDatabaseConnection(databaseConfig)
                .compose(pool ->
                {
                    this.pgPool = pool;

                    return applySchema(databaseConfig);
                })
                .map(v ->
                {
                    this.inventoryService = new InventoryServiceImpl(pgPool);

                    this.discoveryService = new DiscoveryServiceImpl(pgPool);

                    logger.info("Database initialization completed");

                    return (Void) null;
                })
                .onFailure(cause -> logger.error("Failed to initialize database services: {}", cause.getMessage()));
        }
        catch (Exception exception)
        {
            logger.error("Error in initialize: {}", exception.getMessage());

            return Future.failedFuture(exception);
        }
    }

    /**
     * Sets up PostgreSQL connection pool and validates connectivity.
     *
     * @param databaseConfig database section of application.conf
     * @return Future resolving to an initialized Pool when the test connection succeeds
     */
    private Future<Pool> setupDatabaseConnection(JsonObject databaseConfig)
    {
        var promise = Promise.<Pool>promise();

        try
        {
            var connectOptions = new PgConnectOptions()
                .setPort(databaseConfig.getInteger("port", 5432))
                .setHost(databaseConfig.getString("host", "localhost"))
                .setDatabase(databaseConfig.getString("database", "racklite"))
                .setUser(databaseConfig.getString("user", "racklite"))
                .setPassword(databaseConfig.getString("password", "racklite"));

            var poolOptions = new PoolOptions()
                .setMaxSize(databaseConfig.getInteger("maxSize", 5));

            var pool = PgBuilder.pool()
                .with(poolOptions)
                .connectingTo(connectOptions)
                .using(vertx)
                .build();

            pool.getConnection()
                .onSuccess(connection ->
                {
                    logger.info("Database connection established");

                    connection.close();

                    promise.complete(pool);
                })
                .onFailure(cause ->
                {
                    logger.error("Database connection failed: {}", cause.getMessage());

                    pool.close();

                    promise.fail(cause);
                });
        }
        catch (Exception exception)
        {
            logger.error("Failed to setup database connection: {}", exception.getMessage());

            promise.fail(exception);
        }

        return promise.future();
    }

    /**
     * Runs db/schema.sql when database.schema.apply is true. The script only uses
     * CREATE ... IF NOT EXISTS, so applying it to an existing database is harmless.
     */
    private Future<Void> applySchema(JsonObject databaseConfig)
    {
        var apply = databaseConfig.getJsonObject("schema", new JsonObject()).getBoolean("apply", false);

        if (!apply)
        {
            return Future.succeededFuture();
        }

        return vertx.fileSystem().readFile(SCHEMA_RESOURCE)
            .compose(buffer -> pgPool.query(buffer.toString()).execute())
            .onSuccess(result -> logger.info("Database schema applied from {}", SCHEMA_RESOURCE))
            .onFailure(cause -> logger.error("Failed to apply database schema: {}", cause.getMessage()))
            .mapEmpty();
    }

    public InventoryService inventoryService()
    {
        return inventoryService;
    }

    public DiscoveryService discoveryService()
    {
        return discoveryService;
    }

    /**
     * Closes the database connection pool and cleans up resources.
     *
     * @return Future that completes when cleanup is done
     */
    public Future<Void> cleanup()
    {
        if (pgPool == null)
        {
            return Future.succeededFuture();
        }

        logger.info("Cleaning up database resources");

        return pgPool.close()
            .onSuccess(v -> logger.debug("Database connection pool closed"))
            .onFailure(cause -> logger.error("Failed to close database pool: {}", cause.getMessage()));
    }

}
