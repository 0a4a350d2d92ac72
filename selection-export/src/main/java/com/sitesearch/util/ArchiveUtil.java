package com.sitesearch.util;

import java.io.*;
import java.nio.file.*;
import java.util.*;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import net.lingala.zip4j.ZipFile;
import net.lingala.zip4j.exception.ZipException;
import net.lingala.zip4j.model.ZipParameters;
import net.lingala.zip4j.model.enums.AesKeyStrength;
import net.lingala.zip4j.model.enums.EncryptionMethod;

/**
 * Packs the files of a search output folder into a ZIP archive, AES-256 encrypted when a
 * password is given.
 */
public class ArchiveUtil {

    /**
     * Archive files under a base folder, keeping their paths relative to it.
     *
     * @param sourceFiles files to add; missing ones are skipped with a warning
     * @param baseFolder folder the entry names are relative to
     * @param zipPath the archive to create
     * @param password optional password (null or blank for no encryption)
     * @return number of files added
     * @throws IOException if the archive cannot be written
     */
    public static int archiveFiles(List<Path> sourceFiles, Path baseFolder, Path zipPath, String password)
            throws IOException {
        LoggingUtil.info("Creating ZIP archive: " + zipPath);

        if (zipPath.toAbsolutePath().getParent() != null) {
            Files.createDirectories(zipPath.toAbsolutePath().getParent());
        }

        boolean encrypt = password != null && !password.trim().isEmpty();
        int added = 0;
        try (ZipFile zipFile = encrypt ? new ZipFile(zipPath.toFile(), password.toCharArray())
                : new ZipFile(zipPath.toFile())) {
            for (Path sourceFile : sourceFiles) {
                if (!Files.isRegularFile(sourceFile)) {
                    LoggingUtil.warn("Source file does not exist, skipping: " + sourceFile);
                    continue;
                }

                ZipParameters zipParameters = new ZipParameters();
                if (encrypt) {
                    zipParameters.setEncryptFiles(true);
                    zipParameters.setEncryptionMethod(EncryptionMethod.AES);
                    zipParameters.setAesKeyStrength(AesKeyStrength.KEY_STRENGTH_256);
                }
                String fileNameInZip = baseFolder.relativize(sourceFile).toString().replace('\\', '/');
                zipParameters.setFileNameInZip(fileNameInZip);

                zipFile.addFile(sourceFile.toFile(), zipParameters);
                added++;
                LoggingUtil.debug("Added to archive: " + fileNameInZip);
            }
        } catch (ZipException e) {
            LoggingUtil.error("Failed to create archive: " + e.getMessage(), e);
            throw new IOException("Failed to create archive " + zipPath, e);
        }

        LoggingUtil.info("ZIP archive created with " + added + " files" + (encrypt ? " (password protected)" : ""));
        return added;
    }

    /**
     * Archive every file below a search output folder into a sibling archive named
     * {@code <folder><suffix>.zip}.
     *
     * @return the archive path
     */
    public static Path archiveOutputFolder(Path outputFolder, String archiveSuffix, String password)
            throws IOException {
        if (!Files.isDirectory(outputFolder)) {
            throw new FileNotFoundException("Output folder does not exist: " + outputFolder);
        }
        Path folder = outputFolder.toAbsolutePath().normalize();
        Path archivePath = folder.resolveSibling(folder.getFileName() + archiveSuffix + ".zip");

        List<Path> outputFiles;
        try (Stream<Path> walk = Files.walk(folder)) {
            outputFiles = walk.filter(Files::isRegularFile)
                    .filter(file -> !file.getFileName().toString().endsWith(".lck"))
                    .sorted()
                    .collect(Collectors.toList());
        }

        if (outputFiles.isEmpty()) {
            LoggingUtil.warn("No output files found to archive in directory: " + folder);
        }
        Files.deleteIfExists(archivePath);
        archiveFiles(outputFiles, folder, archivePath, password);
        return archivePath;
    }
}
