package com.sitesearch.util;

import java.io.IOException;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.util.Date;
import java.util.logging.*;

/**
 * Centralized logging for the data searches tools.
 * Thin static wrapper around java.util.logging; the search log file is opened in append
 * mode so that repeated searches accumulate in the same file.
 */
public class LoggingUtil {
    public enum ConsoleOutputMode {
        ALL_TO_OUT,
        ALL_TO_ERR,
        SPLIT_SEVERE_TO_ERR
    }

    private static final Logger logger = Logger.getLogger("com.sitesearch");
    private static boolean initialized = false;
    private static Level currentLevel = Level.INFO;
    private static boolean consoleLogging = false;
    private static String logFileName = null;
    private static ConsoleOutputMode consoleOutputMode = ConsoleOutputMode.SPLIT_SEVERE_TO_ERR;

    /**
     * One line per record: timestamp, level, message. A thrown exception follows on its own lines.
     */
    static class LineFormatter extends Formatter {
        @Override
        public String format(LogRecord record) {
            StringBuilder line = new StringBuilder(String.format("%1$tF %1$tT %2$s: %3$s%n",
                    new Date(record.getMillis()), record.getLevel().getName(), formatMessage(record)));
            if (record.getThrown() != null) {
                StringWriter trace = new StringWriter();
                record.getThrown().printStackTrace(new PrintWriter(trace));
                line.append(trace);
            }
            return line.toString();
        }
    }

    // Console Handlers
    private static class StdOutHandler extends StreamHandler {
        public StdOutHandler(Level level) {
            super(System.out, new LineFormatter());
            setLevel(level);
        }

        @Override
        public synchronized void publish(LogRecord record) {
            // SEVERE goes to the err handler only when split
            if (consoleOutputMode == ConsoleOutputMode.SPLIT_SEVERE_TO_ERR
                    && record.getLevel().intValue() >= Level.SEVERE.intValue()) {
                return;
            }
            super.publish(record);
            flush();
        }
    }

    private static class StdErrHandler extends StreamHandler {
        public StdErrHandler(Level level) {
            super(System.err, new LineFormatter());
            setLevel(level);
        }

        @Override
        public synchronized void publish(LogRecord record) {
            super.publish(record);
            flush();
        }
    }

    /**
     * Configure where log messages go in console
     */
    public static void setConsoleOutputMode(ConsoleOutputMode mode) {
        consoleOutputMode = mode;
    }

    /**
     * Initialize the logging system once; later calls are ignored until {@link #reinitialize}.
     */
    public static synchronized void initialize(String levelStr, boolean consoleEnabled, String fileName) {
        if (initialized) {
            return;
        }
        configure(levelStr, consoleEnabled, fileName);
    }

    /**
     * Replace the current handlers, typically to point the file handler at a new search log.
     */
    public static synchronized void reinitialize(String levelStr, boolean consoleEnabled, String fileName) {
        configure(levelStr, consoleEnabled, fileName);
    }

    private static void configure(String levelStr, boolean consoleEnabled, String fileName) {
        setLoggingLevel(levelStr);

        clearHandlers();

        consoleLogging = false;
        if (consoleEnabled) {
            setupConsoleHandlers();
        }

        logFileName = null;
        if (fileName != null && !fileName.isEmpty()) {
            try {
                FileHandler fileHandler = new FileHandler(fileName, true);
                fileHandler.setFormatter(new LineFormatter());
                fileHandler.setLevel(currentLevel);
                fileHandler.setEncoding("UTF-8");
                logger.addHandler(fileHandler);
                logFileName = fileName;
            } catch (IOException e) {
                logger.log(Level.SEVERE, "Failed to open log file " + fileName + ": " + e.getMessage());
            }
        }

        logger.setLevel(currentLevel);
        logger.setUseParentHandlers(false);
        initialized = true;

        debug("Logging initialized: level=" + currentLevel +
                ", console=" + consoleLogging +
                ", file=" + (logFileName != null ? logFileName : "disabled"));
    }

    private static void setLoggingLevel(String levelStr) {
        String level = levelStr == null ? "INFO" : levelStr.toUpperCase();
        switch (level) {
            case "SEVERE":
            case "ERROR":
                currentLevel = Level.SEVERE;
                break;
            case "WARNING":
            case "WARN":
                currentLevel = Level.WARNING;
                break;
            case "DEBUG":
                currentLevel = Level.FINE;
                break;
            case "TRACE":
                currentLevel = Level.FINEST;
                break;
            default:
                currentLevel = Level.INFO;
        }
    }

    private static void clearHandlers() {
        for (Handler handler : logger.getHandlers()) {
            logger.removeHandler(handler);
            handler.close();
        }
    }

    private static void setupConsoleHandlers() {
        switch (consoleOutputMode) {
            case ALL_TO_OUT:
                logger.addHandler(new StdOutHandler(currentLevel));
                break;
            case ALL_TO_ERR:
                logger.addHandler(new StdErrHandler(currentLevel));
                break;
            case SPLIT_SEVERE_TO_ERR:
                logger.addHandler(new StdOutHandler(currentLevel));
                logger.addHandler(new StdErrHandler(Level.SEVERE));
                break;
        }
        consoleLogging = true;
    }

    /**
     * Flush and close every handler. The file is released until the next initialize.
     */
    public static synchronized void close() {
        clearHandlers();
        logFileName = null;
        initialized = false;
    }

    public static String getLogFileName() {
        return logFileName;
    }

    public static void debug(String message) {
        ensureInitialized();
        logger.fine(message);
    }

    public static void info(String message) {
        ensureInitialized();
        logger.info(message);
    }

    public static void warn(String message) {
        ensureInitialized();
        logger.warning(message);
    }

    public static void error(String message) {
        ensureInitialized();
        logger.severe(message);
    }

    public static void error(String message, Throwable t) {
        ensureInitialized();
        logger.log(Level.SEVERE, message, t);
    }

    public static boolean isDebugEnabled() {
        return currentLevel.intValue() <= Level.FINE.intValue();
    }

    private static void ensureInitialized() {
        if (!initialized) {
            initialize("INFO", true, null);
        }
    }
}
