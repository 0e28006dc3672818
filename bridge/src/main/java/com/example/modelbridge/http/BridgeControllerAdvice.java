package com.example.modelbridge.http;

import com.example.modelbridge.api.BridgeException;
import com.example.modelbridge.api.BridgeExceptionHandler;
import com.example.modelbridge.api.ErrorCode;
import jakarta.servlet.http.HttpServletRequest;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.HttpMediaTypeNotSupportedException;
import org.springframework.web.HttpRequestMethodNotSupportedException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.servlet.NoHandlerFoundException;
import tools.jackson.databind.node.ObjectNode;

/**
 * Exception handling of both channels.
 * <p>
 * Maps exceptions to the envelope built by {@link BridgeExceptionHandler} and the HTTP status of its
 * {@link ErrorCode}. Paths and methods a channel does not serve are {@code not_found}.
 * </p>
 */
@RestControllerAdvice
@Slf4j
public class BridgeControllerAdvice {

    private final BridgeExceptionHandler exceptionHandler;

    public BridgeControllerAdvice(BridgeExceptionHandler exceptionHandler) {
        this.exceptionHandler = exceptionHandler;
    }

    @ExceptionHandler(BridgeException.class)
    public ResponseEntity<ObjectNode> handleBridgeException(BridgeException ex) {
        return toResponse(exceptionHandler.handle(ex));
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<ObjectNode> handleIllegalArgument(IllegalArgumentException ex) {
        return toResponse(exceptionHandler.invalidArgument(ex));
    }

    @ExceptionHandler({NoHandlerFoundException.class, HttpRequestMethodNotSupportedException.class})
    public ResponseEntity<ObjectNode> handleNoRoute(Exception ex, HttpServletRequest request) {
        log.debug("No route for {} {}", request.getMethod(), request.getRequestURI());
        return ResponseEntity
                .status(ErrorCode.NOT_FOUND.status())
                .body(exceptionHandler.failure(ErrorCode.NOT_FOUND,
                        "No route for " + request.getMethod() + " " + request.getRequestURI()));
    }

    @ExceptionHandler({HttpMessageNotReadableException.class, HttpMediaTypeNotSupportedException.class})
    public ResponseEntity<ObjectNode> handleUnreadableBody(Exception ex) {
        log.warn("Unreadable request: {}", ex.getMessage());
        return ResponseEntity
                .status(ErrorCode.BAD_REQUEST.status())
                .body(exceptionHandler.failure(ErrorCode.BAD_REQUEST, "Request body could not be read"));
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ObjectNode> handleGeneric(Exception ex) {
        return toResponse(exceptionHandler.internal(ex));
    }

    private static ResponseEntity<ObjectNode> toResponse(BridgeExceptionHandler.ErrorReply reply) {
        return ResponseEntity.status(reply.status()).body(reply.body());
    }
}
