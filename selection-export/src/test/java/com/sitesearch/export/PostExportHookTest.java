package com.sitesearch.export;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.condition.EnabledOnOs;
import org.junit.jupiter.api.condition.OS;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class PostExportHookTest {
    @TempDir
    Path folder;

    @Test
    public void testCommandLayout() {
        PostExportHook hook = new PostExportHook(Arrays.asList("python3", "-u"));

        List<String> command = hook.buildCommand("macros/format.py", "/out/AB_1", "SSSIs.csv", "SSSIs");

        assertEquals(Arrays.asList("python3", "-u", "macros/format.py", "/out/AB_1", "SSSIs.csv", "SSSIs.xlsx"),
                command);
    }

    @Test
    public void testDirectLaunch() {
        PostExportHook hook = new PostExportHook(null);

        assertEquals(Arrays.asList("format.sh", "/out", "t.csv", "t.xlsx"),
                hook.buildCommand("format.sh", "/out", "t.csv", "t"));
    }

    @Test
    public void testMissingScript() {
        PostExportHook hook = new PostExportHook(Collections.singletonList("sh"));

        assertFalse(hook.run(folder.resolve("absent.sh").toString(), folder.toString(), "t.csv", "t"));
    }

    @Test
    @EnabledOnOs({OS.LINUX, OS.MAC})
    public void testScriptRunsInItsFolderWithArguments() throws Exception {
        Path scripts = Files.createDirectories(folder.resolve("scripts"));
        Path script = scripts.resolve("record.sh");
        Files.write(script, Arrays.asList(
                "echo \"$1|$2|$3\" > args.txt",
                "exit 0"), StandardCharsets.UTF_8);
        PostExportHook hook = new PostExportHook(Collections.singletonList("sh"));

        assertTrue(hook.run(script.toString(), "/out/AB_1", "Species.csv", "Species"));

        List<String> recorded = Files.readAllLines(scripts.resolve("args.txt"), StandardCharsets.UTF_8);
        assertEquals(Collections.singletonList("/out/AB_1|Species.csv|Species.xlsx"), recorded);
    }

    @Test
    @EnabledOnOs({OS.LINUX, OS.MAC})
    public void testNonZeroExit() throws Exception {
        Path script = folder.resolve("fail.sh");
        Files.write(script, Arrays.asList("echo failing", "exit 3"), StandardCharsets.UTF_8);
        PostExportHook hook = new PostExportHook(Collections.singletonList("sh"));

        assertFalse(hook.run(script.toString(), folder.toString(), "t.csv", "t"));
    }
}
