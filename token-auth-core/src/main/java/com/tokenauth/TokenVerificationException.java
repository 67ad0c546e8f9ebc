package com.tokenauth;

import lombok.Getter;

@Getter
public class TokenVerificationException extends RuntimeException {

    private final RejectionReason reason;

    public TokenVerificationException(RejectionReason reason, String message) {
        super(message);
        this.reason = reason;
    }

    public TokenVerificationException(RejectionReason reason, String message, Throwable cause) {
        super(message, cause);
        this.reason = reason;
    }
}
