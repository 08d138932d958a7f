package com.krickert.protocompat.detector;

public class DetectionException extends RuntimeException {
    public DetectionException(String message, Throwable cause) {
        super(message, cause);
    }

    public DetectionException(String message) {
        super(message);
    }
}
