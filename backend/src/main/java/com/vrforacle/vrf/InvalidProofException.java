package com.vrforacle.vrf;

/**
 * Thrown when a VRF proof fails verification or cannot be decoded.
 */
public class InvalidProofException extends RuntimeException {

    public InvalidProofException(String message) {
        super(message);
    }

    public InvalidProofException(String message, Throwable cause) {
        super(message, cause);
    }
}
