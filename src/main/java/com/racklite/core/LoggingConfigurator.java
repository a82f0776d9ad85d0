package com.racklite.core;

import ch.qos.logback.classic.Level;

import ch.qos.logback.classic.Logger;

import ch.qos.logback.classic.LoggerContext;

import io.vertx.core.json.JsonObject;

import org.slf4j.LoggerFactory;

import java.io.File;

/**
 * LoggingConfigurator - Applies the logging section of application.conf

 * Configuration in application.conf:
 * logging {
 *   enabled = true                       # Enable/disable all logging
 *   level = "INFO"                       # Log level for com.racklite
 *   file.path = "logs/racklite.log"      # Log file path
 *   file.enabled = true                  # Enable file logging
 *   console.enabled = true               # Enable console logging
 *   scanner.level = "INFO"               # Level for per-host scan detail (DEBUG to trace probes)
 * }

 * logback.xml reads the racklite.log.* system properties set here; levels are
 * also applied directly to the running LoggerContext.
 */
public class LoggingConfigurator
{

    static final String APPLICATION_LOGGER = "com.racklite";

    static final String SCANNER_LOGGER = "com.racklite.core";

    private LoggingConfigurator()
    {
    }

    /**
     * Configure logging based on application configuration
     *
     * @param config Application configuration JsonObject
     */
    public static void configure(JsonObject config)
    {
        var loggingConfig = config.getJsonObject("logging", new JsonObject());

        var loggingEnabled = loggingConfig.getBoolean("enabled", true);

        var logLevel = loggingConfig.getString("level", "INFO");

        // HOCON parses dotted keys as nested objects: file.path becomes file -> path
        var fileConfig = loggingConfig.getJsonObject("file", new JsonObject());

        var fileEnabled = fileConfig.getBoolean("enabled", true);

        var filePath = fileConfig.getString("path", "logs/racklite.log");

        var consoleEnabled = loggingConfig.getJsonObject("console", new JsonObject()).getBoolean("enabled", true);

        var scannerLevel = loggingConfig.getJsonObject("scanner", new JsonObject()).getString("level", logLevel);

        System.setProperty("racklite.log.level", loggingEnabled ? logLevel : "OFF");

        System.setProperty("racklite.log.file.path", filePath);

        System.setProperty("racklite.log.console.appender", consoleEnabled ? "CONSOLE" : "NULL");

        System.setProperty("racklite.log.file.appender", fileEnabled ? "FILE" : "NULL");

        var loggerContext = (LoggerContext) LoggerFactory.getILoggerFactory();

        var level = loggingEnabled ? Level.toLevel(logLevel, Level.INFO) : Level.OFF;

        loggerContext.getLogger(Logger.ROOT_LOGGER_NAME).setLevel(level);

        loggerContext.getLogger(APPLICATION_LOGGER).setLevel(level);

        loggerContext.getLogger(SCANNER_LOGGER).setLevel(loggingEnabled ? Level.toLevel(scannerLevel, level) : Level.OFF);

        // Create logs directory if file logging is enabled
        if (fileEnabled && loggingEnabled)
        {
            var logDir = new File(filePath).getParentFile();

            if (logDir != null && !logDir.exists())
            {
                logDir.mkdirs();
            }
        }
    }

}
