package com.wirevizweb.dispatch.api;

import com.wirevizweb.core.format.UnsupportedFormatException;
import com.wirevizweb.core.plantuml.DecodeException;
import com.wirevizweb.core.render.RenderEngineException;
import com.wirevizweb.core.render.RenderRequestException;
import com.wirevizweb.core.render.StagingException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.multipart.MaxUploadSizeExceededException;
import org.springframework.web.multipart.support.MissingServletRequestPartException;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Maps the render error taxonomy onto HTTP statuses.
 *
 * <p>Client mistakes (bad format, bad encoding, bad upload) are 4xx; engine
 * failures are 502 and staging failures 500. Bodies are always JSON, whatever
 * image type the client asked for.
 */
@RestControllerAdvice
public class ApiExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(ApiExceptionHandler.class);

    @ExceptionHandler(UnsupportedFormatException.class)
    public ResponseEntity<Map<String, Object>> unsupportedFormat(UnsupportedFormatException e) {
        return error(HttpStatus.BAD_REQUEST, e.getMessage());
    }

    @ExceptionHandler(DecodeException.class)
    public ResponseEntity<Map<String, Object>> decodeFailed(DecodeException e) {
        return error(HttpStatus.BAD_REQUEST, "Invalid PlantUML encoding: " + e.getMessage());
    }

    @ExceptionHandler(RenderRequestException.class)
    public ResponseEntity<Map<String, Object>> badRenderRequest(RenderRequestException e) {
        return error(HttpStatus.BAD_REQUEST, e.getMessage());
    }

    @ExceptionHandler(MissingServletRequestPartException.class)
    public ResponseEntity<Map<String, Object>> missingPart(MissingServletRequestPartException e) {
        return error(HttpStatus.BAD_REQUEST, "Multipart field '" + e.getRequestPartName() + "' is required");
    }

    @ExceptionHandler(MaxUploadSizeExceededException.class)
    public ResponseEntity<Map<String, Object>> uploadTooLarge(MaxUploadSizeExceededException e) {
        return error(HttpStatus.PAYLOAD_TOO_LARGE, "Upload too large: " + e.getMessage());
    }

    @ExceptionHandler(RenderEngineException.class)
    public ResponseEntity<Map<String, Object>> engineFailed(RenderEngineException e) {
        log.warn("Render failed: {}", e.getMessage());
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("error", "WireViz failed: " + e.getMessage());
        if (e.getExitCode() != RenderEngineException.NO_EXIT_CODE) {
            body.put("exit_code", e.getExitCode());
        }
        body.put("output", e.getEngineOutput());
        return ResponseEntity.status(HttpStatus.BAD_GATEWAY)
                .contentType(MediaType.APPLICATION_JSON)
                .body(body);
    }

    @ExceptionHandler(StagingException.class)
    public ResponseEntity<Map<String, Object>> stagingFailed(StagingException e) {
        return error(HttpStatus.INTERNAL_SERVER_ERROR, e.getMessage());
    }

    private static ResponseEntity<Map<String, Object>> error(HttpStatus status, String message) {
        return ResponseEntity.status(status)
                .contentType(MediaType.APPLICATION_JSON)
                .body(Map.of("error", message));
    }
}
