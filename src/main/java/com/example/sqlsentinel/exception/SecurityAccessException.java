package com.example.sqlsentinel.exception;

import com.example.sqlsentinel.config.ErrorConfig;

/** Tables read by a query could not be determined, so access cannot be checked. */
public class SecurityAccessException extends AppException {

    public SecurityAccessException(String detail, Throwable cause) {
        super(ErrorConfig.QUERY_SECURITY_ACCESS_ERROR,
                "You may have an error in your SQL statement. " + detail, cause);
    }
}
