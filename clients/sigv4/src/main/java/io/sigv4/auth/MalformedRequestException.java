package io.sigv4.auth;

import com.amazonaws.AmazonClientException;

/**
 * Thrown when a request cannot be signed as given, for example because it
 * already carries an Authorization header. The request is left untouched.
 */
public class MalformedRequestException extends AmazonClientException {
    private static final long serialVersionUID = 1L;

    public MalformedRequestException(String message) {
        super(message);
    }

    public MalformedRequestException(String message, Throwable cause) {
        super(message, cause);
    }
}
