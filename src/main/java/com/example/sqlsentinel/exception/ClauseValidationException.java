package com.example.sqlsentinel.exception;

import com.example.sqlsentinel.config.ErrorConfig;

public class ClauseValidationException extends AppException {

    public ClauseValidationException(String message) {
        super(ErrorConfig.INVALID_CLAUSE, message);
    }
}
