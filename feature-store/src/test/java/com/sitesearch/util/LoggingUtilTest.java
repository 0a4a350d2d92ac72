package com.sitesearch.util;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class LoggingUtilTest {

    @AfterEach
    public void tearDown() {
        LoggingUtil.close();
        LoggingUtil.setConsoleOutputMode(LoggingUtil.ConsoleOutputMode.SPLIT_SEVERE_TO_ERR);
    }

    @Test
    public void testLogFileIsAppended(@TempDir Path folder) throws Exception {
        String logFile = folder.resolve("search.log").toString();

        LoggingUtil.reinitialize("INFO", false, logFile);
        LoggingUtil.info("first search started");
        LoggingUtil.close();

        LoggingUtil.reinitialize("INFO", false, logFile);
        LoggingUtil.warn("second search started");
        LoggingUtil.debug("not written at INFO");
        LoggingUtil.close();

        String content = new String(Files.readAllBytes(folder.resolve("search.log")), StandardCharsets.UTF_8);
        assertTrue(content.contains("first search started"), content);
        assertTrue(content.contains("second search started"), content);
        assertFalse(content.contains("not written at INFO"), content);
    }

    @Test
    public void testOneLinePerRecord(@TempDir Path folder) throws Exception {
        Path logFile = folder.resolve("lines.log");

        LoggingUtil.reinitialize("INFO", false, logFile.toString());
        LoggingUtil.info("selection started");
        LoggingUtil.warn("no features selected");
        LoggingUtil.error("export failed");
        LoggingUtil.close();

        List<String> lines = Files.readAllLines(logFile, StandardCharsets.UTF_8);
        assertEquals(3, lines.size(), lines.toString());
        assertTrue(lines.get(0).endsWith("INFO: selection started"), lines.get(0));
        assertTrue(lines.get(1).endsWith("WARNING: no features selected"), lines.get(1));
        assertTrue(lines.get(2).endsWith("SEVERE: export failed"), lines.get(2));
    }

    @Test
    public void testLevels() {
        LoggingUtil.reinitialize("DEBUG", false, null);
        assertTrue(LoggingUtil.isDebugEnabled());
        assertNull(LoggingUtil.getLogFileName());

        LoggingUtil.reinitialize("warn", false, null);
        assertFalse(LoggingUtil.isDebugEnabled());
    }

    @Test
    public void testAllToErrConsoleMode() throws Exception {
        PrintStream original = System.err;
        ByteArrayOutputStream captured = new ByteArrayOutputStream();
        System.setErr(new PrintStream(captured, true, "UTF-8"));
        try {
            LoggingUtil.setConsoleOutputMode(LoggingUtil.ConsoleOutputMode.ALL_TO_ERR);
            LoggingUtil.reinitialize("INFO", true, null);
            LoggingUtil.info("buffer created");
            LoggingUtil.close();
        } finally {
            System.setErr(original);
        }

        assertTrue(captured.toString("UTF-8").contains("buffer created"));
    }
}
