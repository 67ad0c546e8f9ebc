package com.tokenauth;

/**
 * Thrown when claims fail schema validation and cannot be issued as a token.
 */
public class TokenEncodingException extends RuntimeException {

    public TokenEncodingException(String message) {
        super(message);
    }

    public TokenEncodingException(String message, Throwable cause) {
        super(message, cause);
    }
}
