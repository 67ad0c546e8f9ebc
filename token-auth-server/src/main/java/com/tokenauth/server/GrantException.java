package com.tokenauth.server;

import lombok.Getter;

/**
 * A grant was refused. The message is for logs; only {@link GrantError#getCode()} goes to clients.
 */
@Getter
public class GrantException extends RuntimeException {

    private final GrantError error;

    public GrantException(GrantError error, String message) {
        super(message);
        this.error = error;
    }

    public GrantException(GrantError error, String message, Throwable cause) {
        super(message, cause);
        this.error = error;
    }

    public Outcome getOutcome() {
        return error.getOutcome();
    }
}
