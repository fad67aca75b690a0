package com.phillippitts.videoconverter.presentation.controller;

import com.phillippitts.videoconverter.domain.AbortResult;
import com.phillippitts.videoconverter.domain.ActiveConversionInfo;
import com.phillippitts.videoconverter.domain.ConversionJob;
import com.phillippitts.videoconverter.domain.ConversionStatusView;
import com.phillippitts.videoconverter.domain.QualitySetting;
import com.phillippitts.videoconverter.domain.TargetFormat;
import com.phillippitts.videoconverter.exception.ConversionNotFoundException;
import com.phillippitts.videoconverter.exception.InvalidRequestException;
import com.phillippitts.videoconverter.service.conversion.AbortCoordinator;
import com.phillippitts.videoconverter.service.conversion.ConversionStatusStore;
import com.phillippitts.videoconverter.service.conversion.ConversionSubmissionService;
import com.phillippitts.videoconverter.service.conversion.QualityCatalog;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RequestPart;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.multipart.MultipartFile;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.io.IOException;
import java.io.InputStream;
import java.util.List;
import java.util.Map;

/**
 * HTTP surface over the conversion core: upload, status polling, active listing, abort, quality
 * presets and the push-event stream.
 */
@RestController
@RequestMapping("/api")
class ConversionController {

    private static final Logger LOG = LogManager.getLogger(ConversionController.class);

    private final ConversionStatusStore store;
    private final AbortCoordinator abortCoordinator;
    private final ConversionEventStreamer eventStreamer;
    private final ConversionSubmissionService submissionService;

    ConversionController(ConversionStatusStore store,
                         AbortCoordinator abortCoordinator,
                         ConversionEventStreamer eventStreamer,
                         ConversionSubmissionService submissionService) {
        this.store = store;
        this.abortCoordinator = abortCoordinator;
        this.eventStreamer = eventStreamer;
        this.submissionService = submissionService;
    }

    @PostMapping(path = "/convert/upload", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    ResponseEntity<Map<String, Object>> upload(@RequestPart("videoFile") MultipartFile videoFile,
                                               @RequestParam("targetFormat") String targetFormat,
                                               @RequestParam(name = "quality", required = false) String quality,
                                               @RequestParam(name = "reverseVideo", defaultValue = "false") boolean reverseVideo,
                                               @RequestParam(name = "removeSound", defaultValue = "false") boolean removeSound)
            throws IOException {
        TargetFormat format = TargetFormat.fromExtension(targetFormat)
                .orElseThrow(() -> new InvalidRequestException("Invalid target format specified"));
        if (videoFile.isEmpty()) {
            throw new InvalidRequestException("Uploaded file is empty");
        }
        ConversionJob job;
        try (InputStream content = videoFile.getInputStream()) {
            job = submissionService.submitUpload(videoFile.getOriginalFilename(), content, format, quality,
                    reverseVideo, removeSound);
        }
        return ResponseEntity.status(HttpStatus.ACCEPTED).body(Map.of(
                "success", true,
                "message", "Upload successful, conversion job queued",
                "conversionId", job.conversionId()
        ));
    }

    @GetMapping("/conversion/status/{id}")
    ConversionStatusView status(@PathVariable("id") String id) {
        return store.getStatus(id)
                .map(status -> ConversionStatusView.of(id, status))
                .orElseThrow(() -> new ConversionNotFoundException(id));
    }

    @GetMapping("/conversions/active")
    List<ActiveConversionInfo> active() {
        return store.getActiveConversionsInfo();
    }

    @PostMapping("/conversion/abort/{id}")
    ResponseEntity<Map<String, Object>> abort(@PathVariable("id") String id) {
        AbortResult result = abortCoordinator.abortConversion(id);
        LOG.info("Abort request for {}: {}", id, result.outcome());
        HttpStatus httpStatus = switch (result.outcome()) {
            case SUCCESS -> HttpStatus.OK;
            case NOT_FOUND -> HttpStatus.NOT_FOUND;
            case CONFLICT -> HttpStatus.CONFLICT;
            case INTERNAL_ERROR -> HttpStatus.INTERNAL_SERVER_ERROR;
        };
        return ResponseEntity.status(httpStatus).body(Map.of(
                "success", result.isSuccess(),
                "message", result.message()
        ));
    }

    @GetMapping("/conversions/qualities")
    List<QualitySetting> qualities() {
        return QualityCatalog.availableQualitySettings();
    }

    @GetMapping(path = "/conversions/stream", produces = MediaType.TEXT_EVENT_STREAM_VALUE)
    SseEmitter stream() {
        return eventStreamer.open();
    }
}
