package com.agentrunner.orchestration.api;

import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.ResponseStatus;

@ResponseStatus(HttpStatus.BAD_GATEWAY)
public class CompletionFailedException extends RuntimeException {

    public CompletionFailedException(String message, Throwable cause) {
        super(message, cause);
    }
}
