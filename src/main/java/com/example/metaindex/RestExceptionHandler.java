package com.example.metaindex;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

@RestControllerAdvice
public class RestExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(RestExceptionHandler.class);

    @ExceptionHandler(IndexerException.class)
    public ResponseEntity<ApiModels.ErrorBody> indexerError(IndexerException e) {
        HttpStatus status;
        if (e instanceof NoCanonicalBranchException) status = HttpStatus.NOT_FOUND;
        else if (e instanceof ReferentialIntegrityException) status = HttpStatus.CONFLICT;
        else if (e instanceof AuthorityMismatchException) status = HttpStatus.FORBIDDEN;
        else if (e instanceof MetadataParseException || e instanceof UnsupportedFormatException) status = HttpStatus.UNPROCESSABLE_ENTITY;
        else status = HttpStatus.BAD_REQUEST;
        log.info("request failed with {}: {}", e.getClass().getSimpleName(), e.getMessage());
        return ResponseEntity.status(status).body(new ApiModels.ErrorBody(e.getClass().getSimpleName(), e.getMessage()));
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<ApiModels.ErrorBody> badRequest(IllegalArgumentException e) {
        return ResponseEntity.badRequest().body(new ApiModels.ErrorBody("IllegalArgumentException", e.getMessage()));
    }
}
