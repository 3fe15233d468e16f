package com.hsformatter.util;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Path;
import java.util.logging.ConsoleHandler;
import java.util.logging.FileHandler;
import java.util.logging.Handler;
import java.util.logging.Level;
import java.util.logging.LogManager;
import java.util.logging.Logger;
import java.util.logging.SimpleFormatter;

/**
 * Bootstraps java.util.logging from {@code /logging.properties} and hands out loggers.
 */
public class LoggerUtil {
    private static final Logger rootLogger = Logger.getLogger("");
    private static final String DEFAULT_LOG_CONFIG = "/logging.properties";
    private static boolean initialized = false;
    private static Level consoleLevel = Level.WARNING;

    /**
     * Initializes the logging system with the bundled configuration.
     */
    public static synchronized void initialize() {
        if (initialized) {
            return;
        }

        try (InputStream is = LoggerUtil.class.getResourceAsStream(DEFAULT_LOG_CONFIG)) {
            if (is != null) {
                LogManager.getLogManager().readConfiguration(is);
            } else {
                configureBasicLogging();
            }
        } catch (IOException e) {
            System.err.println("Failed to initialize logging: " + e.getMessage());
            configureBasicLogging();
        }
        initialized = true;
    }

    /**
     * Console-only fallback when the properties file is missing.
     */
    private static void configureBasicLogging() {
        for (Handler handler : rootLogger.getHandlers()) {
            rootLogger.removeHandler(handler);
        }

        ConsoleHandler consoleHandler = new ConsoleHandler();
        consoleHandler.setLevel(consoleLevel);
        consoleHandler.setFormatter(new SimpleFormatter());
        rootLogger.addHandler(consoleHandler);
        rootLogger.setLevel(Level.INFO);
    }

    /**
     * Sets the console logging level; {@code FINE} also lowers the package level
     * so per-file detail reaches the console.
     */
    public static synchronized void setConsoleLevel(Level level) {
        if (!initialized) {
            initialize();
        }
        consoleLevel = level;

        for (Handler handler : rootLogger.getHandlers()) {
            if (handler instanceof ConsoleHandler) {
                handler.setLevel(level);
            }
        }
        Logger packageLogger = Logger.getLogger("com.hsformatter");
        if (packageLogger.getLevel() == null || level.intValue() < packageLogger.getLevel().intValue()) {
            packageLogger.setLevel(level);
        }
    }

    /**
     * Mirrors every record into a log file next to the console output.
     */
    public static synchronized void enableFileLogging(Path logFilePath) {
        if (!initialized) {
            initialize();
        }
        try {
            for (Handler handler : rootLogger.getHandlers()) {
                if (handler instanceof FileHandler) {
                    rootLogger.removeHandler(handler);
                    handler.close();
                }
            }
            FileHandler fileHandler = new FileHandler(logFilePath.toString(), true);
            fileHandler.setLevel(Level.ALL);
            fileHandler.setFormatter(new SimpleFormatter());
            rootLogger.addHandler(fileHandler);
        } catch (IOException e) {
            Logger.getLogger(LoggerUtil.class.getName()).log(
                    Level.SEVERE, "Failed to open log file: " + logFilePath, e);
        }
    }

    /**
     * Gets a logger for a specific class.
     */
    public static Logger getLogger(Class<?> clazz) {
        if (!initialized) {
            initialize();
        }
        return Logger.getLogger(clazz.getName());
    }

    /**
     * Gets a logger for a specific name.
     */
    public static Logger getLogger(String name) {
        if (!initialized) {
            initialize();
        }
        return Logger.getLogger(name);
    }

    /**
     * Flushes and closes all handlers.
     */
    public static void shutdown() {
        for (Handler handler : rootLogger.getHandlers()) {
            handler.flush();
            if (handler instanceof FileHandler) {
                handler.close();
            }
        }
    }
}
