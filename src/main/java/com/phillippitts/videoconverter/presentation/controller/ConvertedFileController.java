package com.phillippitts.videoconverter.presentation.controller;

import com.phillippitts.videoconverter.domain.ConvertedFile;
import com.phillippitts.videoconverter.domain.TargetFormat;
import com.phillippitts.videoconverter.service.files.ConvertedFileStore;
import org.springframework.core.io.FileSystemResource;
import org.springframework.core.io.Resource;
import org.springframework.http.ContentDisposition;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RestController;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;

/**
 * Listing, download and deletion of converted files.
 */
@RestController
class ConvertedFileController {

    private final ConvertedFileStore fileStore;

    ConvertedFileController(ConvertedFileStore fileStore) {
        this.fileStore = fileStore;
    }

    @GetMapping("/api/files")
    List<ConvertedFile> list() {
        return fileStore.listFiles();
    }

    @GetMapping("/download/{fileName}")
    ResponseEntity<Resource> download(@PathVariable("fileName") String fileName) {
        Path file = fileStore.resolve(fileName);
        return ResponseEntity.ok()
                .header(HttpHeaders.CONTENT_DISPOSITION,
                        ContentDisposition.attachment().filename(fileName).build().toString())
                .contentType(contentTypeOf(fileName))
                .body(new FileSystemResource(file));
    }

    @DeleteMapping("/api/file/delete/{fileName}")
    Map<String, Object> delete(@PathVariable("fileName") String fileName) {
        fileStore.delete(fileName);
        return Map.of(
                "success", true,
                "message", "File '" + fileName + "' deleted successfully"
        );
    }

    static MediaType contentTypeOf(String fileName) {
        int dot = fileName.lastIndexOf('.');
        String extension = dot >= 0 ? fileName.substring(dot + 1) : "";
        return TargetFormat.fromExtension(extension)
                .map(format -> MediaType.parseMediaType(format.mediaType()))
                .orElse(MediaType.APPLICATION_OCTET_STREAM);
    }
}
