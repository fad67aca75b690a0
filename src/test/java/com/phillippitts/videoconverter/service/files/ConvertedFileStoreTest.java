package com.phillippitts.videoconverter.service.files;

import com.phillippitts.videoconverter.domain.ConvertedFile;
import com.phillippitts.videoconverter.exception.ConvertedFileNotFoundException;
import com.phillippitts.videoconverter.exception.InvalidRequestException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.FileTime;
import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ConvertedFileStoreTest {

    @TempDir
    Path tempDir;

    private Path convertedDir;
    private ConvertedFileStore fileStore;

    @BeforeEach
    void setUp() throws Exception {
        convertedDir = tempDir.resolve("converted");
        Files.createDirectories(convertedDir);
        fileStore = new ConvertedFileStore(convertedDir);
    }

    private Path write(String name, String content, Instant modified) throws Exception {
        Path file = Files.writeString(convertedDir.resolve(name), content);
        Files.setLastModifiedTime(file, FileTime.from(modified));
        return file;
    }

    @Test
    void listsRegularFilesNewestFirst() throws Exception {
        write("old.mp4", "aa", Instant.parse("2024-01-01T00:00:00Z"));
        write("new.mov", "bbbb", Instant.parse("2024-06-01T00:00:00Z"));
        Files.createDirectories(convertedDir.resolve("nested"));

        List<ConvertedFile> files = fileStore.listFiles();

        assertThat(files).extracting(ConvertedFile::name).containsExactly("new.mov", "old.mp4");
        assertThat(files.get(0).size()).isEqualTo(4);
        assertThat(files.get(0).url()).isEqualTo("/download/new.mov");
        assertThat(files.get(0).modTime()).isEqualTo(Instant.parse("2024-06-01T00:00:00Z"));
    }

    @Test
    void missingDirectoryListsNothing() {
        assertThat(new ConvertedFileStore(tempDir.resolve("absent")).listFiles()).isEmpty();
    }

    @Test
    void resolvesExistingFile() throws Exception {
        Path file = write("clip.mp4", "video", Instant.now());

        assertThat(fileStore.resolve("clip.mp4")).isEqualTo(file);
    }

    @Test
    void resolveOfMissingFileIsNotFound() {
        assertThatThrownBy(() -> fileStore.resolve("nope.mp4"))
                .isInstanceOf(ConvertedFileNotFoundException.class)
                .hasMessageContaining("nope.mp4");
    }

    @Test
    void resolveOfDirectoryIsRejected() throws Exception {
        Files.createDirectories(convertedDir.resolve("nested"));

        assertThatThrownBy(() -> fileStore.resolve("nested"))
                .isInstanceOf(InvalidRequestException.class);
    }

    @Test
    void namesThatLeaveTheDirectoryAreRejected() {
        for (String name : List.of("", " ", "..", "../secret", "a/b.mp4", "a\\b.mp4")) {
            assertThatThrownBy(() -> fileStore.resolve(name))
                    .as(name)
                    .isInstanceOf(InvalidRequestException.class);
            assertThatThrownBy(() -> fileStore.delete(name))
                    .as(name)
                    .isInstanceOf(InvalidRequestException.class);
        }
    }

    @Test
    void deletesFile() throws Exception {
        Path file = write("clip.mp4", "video", Instant.now());

        fileStore.delete("clip.mp4");

        assertThat(file).doesNotExist();
        assertThatThrownBy(() -> fileStore.delete("clip.mp4"))
                .isInstanceOf(ConvertedFileNotFoundException.class);
    }
}
