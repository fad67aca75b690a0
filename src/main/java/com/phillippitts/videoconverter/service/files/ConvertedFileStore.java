package com.phillippitts.videoconverter.service.files;

import com.phillippitts.videoconverter.domain.ConvertedFile;
import com.phillippitts.videoconverter.exception.ConvertedFileNotFoundException;
import com.phillippitts.videoconverter.exception.InvalidRequestException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;

/**
 * Read and delete access to finished conversions in the converted directory.
 *
 * <p>Only plain names are accepted: anything empty, containing {@code ..} or a path separator is
 * rejected with {@link InvalidRequestException} before the file system is touched.
 */
public class ConvertedFileStore {

    private static final Logger LOG = LogManager.getLogger(ConvertedFileStore.class);

    private final Path convertedDir;

    public ConvertedFileStore(Path convertedDir) {
        this.convertedDir = Objects.requireNonNull(convertedDir, "convertedDir");
    }

    public Path convertedDir() {
        return convertedDir;
    }

    /**
     * Lists regular files, newest first. A missing directory yields an empty list.
     *
     * @throws UncheckedIOException if the directory exists but cannot be read
     */
    public List<ConvertedFile> listFiles() {
        if (!Files.isDirectory(convertedDir)) {
            LOG.info("Converted directory not found, returning empty list: {}", convertedDir);
            return List.of();
        }
        List<ConvertedFile> files = new ArrayList<>();
        try (DirectoryStream<Path> entries = Files.newDirectoryStream(convertedDir)) {
            for (Path entry : entries) {
                BasicFileAttributes attrs;
                try {
                    attrs = Files.readAttributes(entry, BasicFileAttributes.class);
                } catch (IOException e) {
                    LOG.warn("Could not get info for file {}: {}", entry.getFileName(), e.toString());
                    continue;
                }
                if (attrs.isRegularFile()) {
                    files.add(ConvertedFile.of(entry.getFileName().toString(), attrs.size(),
                            attrs.lastModifiedTime().toInstant()));
                }
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to list files in " + convertedDir, e);
        }
        files.sort(Comparator.comparing(ConvertedFile::modTime).reversed());
        return files;
    }

    /**
     * Resolves a converted file for download.
     *
     * @throws InvalidRequestException if the name is not a plain file name or names a directory
     * @throws ConvertedFileNotFoundException if no such file exists
     */
    public Path resolve(String fileName) {
        Path file = convertedDir.resolve(requirePlainName(fileName));
        if (!Files.exists(file)) {
            LOG.warn("Requested download file not found: {}", file);
            throw new ConvertedFileNotFoundException(fileName);
        }
        if (Files.isDirectory(file)) {
            throw new InvalidRequestException("Invalid request (directory specified)");
        }
        return file;
    }

    /**
     * Deletes a converted file.
     *
     * @throws InvalidRequestException if the name is not a plain file name
     * @throws ConvertedFileNotFoundException if no such file exists
     * @throws UncheckedIOException if the file exists but cannot be removed
     */
    public void delete(String fileName) {
        Path file = convertedDir.resolve(requirePlainName(fileName));
        try {
            Files.delete(file);
        } catch (NoSuchFileException e) {
            LOG.warn("File not found for deletion: {}", file);
            throw new ConvertedFileNotFoundException(fileName);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to delete file " + fileName, e);
        }
        LOG.info("Deleted file: {}", file);
    }

    static String requirePlainName(String fileName) {
        if (fileName == null || fileName.isBlank() || fileName.contains("..")
                || fileName.indexOf('/') >= 0 || fileName.indexOf('\\') >= 0) {
            LOG.warn("Invalid file name requested: {}", fileName);
            throw new InvalidRequestException("Invalid filename");
        }
        return fileName;
    }
}
