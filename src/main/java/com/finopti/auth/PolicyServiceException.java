package com.finopti.auth;

import java.io.IOException;

/**
 * The policy service answered, but not with a usable decision.
 */
public class PolicyServiceException extends IOException {

    public PolicyServiceException(String message) {
        super(message);
    }

    public PolicyServiceException(String message, Throwable cause) {
        super(message, cause);
    }
}
