package com.catalogharvester.crawl.service;

import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.ResponseStatus;

@ResponseStatus(HttpStatus.BAD_REQUEST)
public class InvalidRunConfigurationException extends RuntimeException {
    public InvalidRunConfigurationException(String message) {
        super(message);
    }

    public InvalidRunConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
