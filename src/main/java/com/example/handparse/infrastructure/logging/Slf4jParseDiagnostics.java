package com.example.handparse.infrastructure.logging;

import com.example.handparse.application.parser.ParseDiagnostics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Diagnostics sink that writes every skipped line to the application log at WARN level.
 */
@Component
public class Slf4jParseDiagnostics implements ParseDiagnostics {

    private static final Logger log = LoggerFactory.getLogger(Slf4jParseDiagnostics.class);

    @Override
    public void unrecognizedLine(String handId, String section, String line) {
        log.warn("Skipping unrecognized line in hand #{} [{}]: {}", handId, section, line);
    }
}
