package com.sitesearch.util;

import net.lingala.zip4j.ZipFile;
import net.lingala.zip4j.model.FileHeader;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.FileNotFoundException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class ArchiveUtilTest {
    @TempDir
    Path folder;

    private Path outputFolder() throws Exception {
        Path output = Files.createDirectories(folder.resolve("123_Farm"));
        Files.write(output.resolve("SSSIs.csv"), Arrays.asList("Name,Area", "Moor,12"), StandardCharsets.UTF_8);
        Files.createDirectories(output.resolve("gis"));
        Files.write(output.resolve("gis").resolve("Buffer.shp"), new byte[]{1, 2, 3});
        Files.write(output.resolve("Buffer.shp.lck"), new byte[0]);
        return output;
    }

    private static List<String> entryNames(ZipFile zip) throws Exception {
        List<String> names = new ArrayList<>();
        for (FileHeader header : zip.getFileHeaders()) {
            names.add(header.getFileName());
        }
        Collections.sort(names);
        return names;
    }

    @Test
    public void testArchiveOutputFolder() throws Exception {
        Path output = outputFolder();

        Path archive = ArchiveUtil.archiveOutputFolder(output, "_archive", null);

        assertEquals(folder.resolve("123_Farm_archive.zip").toAbsolutePath().normalize(), archive);
        try (ZipFile zip = new ZipFile(archive.toFile())) {
            assertFalse(zip.isEncrypted());
            assertEquals(Arrays.asList("SSSIs.csv", "gis/Buffer.shp"), entryNames(zip));
        }
    }

    @Test
    public void testPasswordProtectedArchive() throws Exception {
        Path output = outputFolder();

        Path archive = ArchiveUtil.archiveOutputFolder(output, "", "secret");

        try (ZipFile zip = new ZipFile(archive.toFile(), "secret".toCharArray())) {
            assertTrue(zip.isEncrypted());
            Path extracted = folder.resolve("extracted");
            zip.extractAll(extracted.toString());
            assertEquals(Arrays.asList("Name,Area", "Moor,12"),
                    Files.readAllLines(extracted.resolve("SSSIs.csv"), StandardCharsets.UTF_8));
        }
    }

    @Test
    public void testExistingArchiveIsReplaced() throws Exception {
        Path output = outputFolder();
        Path first = ArchiveUtil.archiveOutputFolder(output, "_archive", null);
        Files.delete(output.resolve("SSSIs.csv"));

        Path second = ArchiveUtil.archiveOutputFolder(output, "_archive", null);

        assertEquals(first, second);
        try (ZipFile zip = new ZipFile(second.toFile())) {
            assertEquals(Collections.singletonList("gis/Buffer.shp"), entryNames(zip));
        }
    }

    @Test
    public void testMissingSourceFilesAreSkipped() throws Exception {
        Path output = outputFolder();
        List<Path> files = Arrays.asList(output.resolve("SSSIs.csv"), output.resolve("absent.csv"));

        int added = ArchiveUtil.archiveFiles(files, output, folder.resolve("zips").resolve("some.zip"), " ");

        assertEquals(1, added);
        try (ZipFile zip = new ZipFile(folder.resolve("zips").resolve("some.zip").toFile())) {
            assertFalse(zip.isEncrypted());
        }
    }

    @Test
    public void testMissingOutputFolder() {
        assertThrows(FileNotFoundException.class,
                () -> ArchiveUtil.archiveOutputFolder(folder.resolve("absent"), "_archive", null));
    }
}
