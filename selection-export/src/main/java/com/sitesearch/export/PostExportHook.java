package com.sitesearch.export;

import com.sitesearch.util.LoggingUtil;

import java.io.BufferedReader;
import java.io.File;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Runs an external script after a layer has been exported, passing it the output folder,
 * the exported table and the spreadsheet file it should produce.
 * The script runs in its own folder and the call blocks until it exits.
 */
public class PostExportHook {
    public static final String SPREADSHEET_EXTENSION = ".xlsx";

    private final List<String> launcher;

    /**
     * @param launcher command prefix placed before the script (for example an interpreter);
     *                 empty to execute the script directly
     */
    public PostExportHook(List<String> launcher) {
        this.launcher = launcher == null ? Collections.emptyList() : new ArrayList<>(launcher);
    }

    public List<String> buildCommand(String script, String outputFolder, String tableFile, String tableOutputName) {
        List<String> command = new ArrayList<>(launcher);
        command.add(script);
        command.add(outputFolder);
        command.add(tableFile);
        command.add(tableOutputName + SPREADSHEET_EXTENSION);
        return command;
    }

    /**
     * @return true if the script ran and exited with status 0
     */
    public boolean run(String script, String outputFolder, String tableFile, String tableOutputName) {
        File scriptFile = new File(script);
        if (!scriptFile.exists()) {
            LoggingUtil.error("Post-export script not found: " + script);
            return false;
        }

        List<String> command = buildCommand(scriptFile.getAbsolutePath(), outputFolder, tableFile, tableOutputName);
        ProcessBuilder processBuilder = new ProcessBuilder(command)
                .directory(scriptFile.getAbsoluteFile().getParentFile())
                .redirectErrorStream(true);

        LoggingUtil.info("Running post-export script " + scriptFile.getName());
        LoggingUtil.debug("Command: " + String.join(" ", command));
        try {
            Process process = processBuilder.start();
            try (BufferedReader reader = new BufferedReader(
                    new InputStreamReader(process.getInputStream(), StandardCharsets.UTF_8))) {
                String line;
                while ((line = reader.readLine()) != null) {
                    LoggingUtil.debug("  " + line);
                }
            }
            int status = process.waitFor();
            if (status != 0) {
                LoggingUtil.error("Post-export script " + scriptFile.getName() + " exited with status " + status);
                return false;
            }
            return true;
        } catch (IOException e) {
            LoggingUtil.error("Post-export script " + scriptFile.getName() + " failed: " + e.getMessage(), e);
            return false;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            LoggingUtil.error("Interrupted while waiting for " + scriptFile.getName());
            return false;
        }
    }
}
