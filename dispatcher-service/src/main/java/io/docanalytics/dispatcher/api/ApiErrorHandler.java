package io.docanalytics.dispatcher.api;

import io.docanalytics.dispatcher.api.DispatcherApi.ErrorResponse;
import io.docanalytics.model.InvalidInputException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestControllerAdvice;

@RestControllerAdvice
public class ApiErrorHandler {

    private static final Logger log = LoggerFactory.getLogger(ApiErrorHandler.class);

    @ExceptionHandler(InvalidInputException.class)
    @ResponseStatus(HttpStatus.BAD_REQUEST)
    public ErrorResponse invalidInput(InvalidInputException e) {
        log.warn("[REST] rejected request: {}", e.getMessage());
        return ErrorResponse.of("INVALID_INPUT", e.getMessage());
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    @ResponseStatus(HttpStatus.BAD_REQUEST)
    public ErrorResponse unreadable(HttpMessageNotReadableException e) {
        log.warn("[REST] unreadable request body: {}", e.getMostSpecificCause().getMessage());
        return ErrorResponse.of("INVALID_INPUT", "Malformed request body");
    }
}
