package com.answer.pipeline.model;

public enum FetchStatus {
    OK,
    FAILED,
    TRUNCATED
}
