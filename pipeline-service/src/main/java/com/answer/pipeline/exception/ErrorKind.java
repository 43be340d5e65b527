package com.answer.pipeline.exception;

public enum ErrorKind {
    VALIDATION,
    DEPENDENCY_FAILURE,
    NO_USABLE_SOURCES,
    TIMEOUT
}
