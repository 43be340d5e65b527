package com.answer.pipeline.exception;

public class PipelineTimeoutException extends PipelineException {

    public PipelineTimeoutException(String message) {
        super(ErrorKind.TIMEOUT, message);
    }

    public PipelineTimeoutException(String message, Throwable cause) {
        super(ErrorKind.TIMEOUT, message, cause);
    }
}
