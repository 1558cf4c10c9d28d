package com.companyintel.profiles.pipeline.service;

import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.ResponseStatus;

@ResponseStatus(HttpStatus.BAD_REQUEST)
public class InputDirectoryMissingException extends RuntimeException {
    public InputDirectoryMissingException(String message) {
        super(message);
    }
}
