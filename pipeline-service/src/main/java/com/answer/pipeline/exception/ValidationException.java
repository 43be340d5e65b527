package com.answer.pipeline.exception;

public class ValidationException extends PipelineException {

    public ValidationException(String message) {
        super(ErrorKind.VALIDATION, message);
    }
}
