package com.example.handparse.interfaces.api;

import com.example.handparse.application.service.HandHistoryService;
import com.example.handparse.domain.model.BatchParseResult;
import com.example.handparse.domain.model.HandHeader;
import com.example.handparse.domain.model.HandParseResult;
import com.example.handparse.infrastructure.text.HandTextReader;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.multipart.MultipartFile;

/**
 * Interfaces-layer REST controller that parses PokerStars hand histories posted as plain text
 * or uploaded as a history file. Failures are rendered by
 * {@link com.example.handparse.interfaces.api.error.GlobalExceptionHandler}.
 */
@RestController
@RequestMapping(value = "/api/hands", produces = MediaType.APPLICATION_JSON_VALUE)
public class HandHistoryController {

    private final HandHistoryService handHistoryService;
    private final HandTextReader handTextReader;

    /**
     * Creates the controller with the required application services.
     *
     * @param handHistoryService service running the parse use cases
     * @param handTextReader     reader for uploaded history files
     */
    public HandHistoryController(HandHistoryService handHistoryService, HandTextReader handTextReader) {
        this.handHistoryService = handHistoryService;
        this.handTextReader = handTextReader;
    }

    /**
     * Fully parses one hand.
     *
     * @param text hand text
     * @return parsed hand and skipped lines
     */
    @PostMapping(consumes = MediaType.TEXT_PLAIN_VALUE)
    public ResponseEntity<HandParseResult> parse(@RequestBody(required = false) String text) {
        return ResponseEntity.ok(handHistoryService.parse(text));
    }

    /**
     * Parses only the header line of one hand.
     *
     * @param text hand text
     * @return parsed header
     */
    @PostMapping(value = "/header", consumes = MediaType.TEXT_PLAIN_VALUE)
    public ResponseEntity<HandHeader> parseHeader(@RequestBody(required = false) String text) {
        return ResponseEntity.ok(handHistoryService.parseHeader(text));
    }

    /**
     * Parses every hand of a pasted history file.
     *
     * @param text one or more hands
     * @return batch result
     */
    @PostMapping(value = "/batch", consumes = MediaType.TEXT_PLAIN_VALUE)
    public ResponseEntity<BatchParseResult> parseBatch(@RequestBody(required = false) String text) {
        return ResponseEntity.ok(handHistoryService.parseBatch(text));
    }

    /**
     * Parses every hand of an uploaded history file.
     *
     * @param file multipart history file
     * @return batch result
     */
    @PostMapping(value = "/upload", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    public ResponseEntity<BatchParseResult> upload(@RequestParam(value = "file", required = false) MultipartFile file) {
        String text = handTextReader.read(file);
        return ResponseEntity.ok(handHistoryService.parseBatch(text));
    }
}
