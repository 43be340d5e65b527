package com.answer.pipeline.exception;

public class NoUsableSourcesException extends PipelineException {

    public NoUsableSourcesException(String message) {
        super(ErrorKind.NO_USABLE_SOURCES, message);
    }
}
