package com.answer.pipeline.exception;

/**
 * A collaborator was called and failed. Provider clients throw this with the most
 * specific {@link FailureKind} they can tell apart.
 */
public class DependencyFailureException extends PipelineException {

    private final String dependency;
    private final FailureKind failureKind;

    public DependencyFailureException(String dependency, FailureKind failureKind, String message) {
        super(ErrorKind.DEPENDENCY_FAILURE, message);
        this.dependency = dependency;
        this.failureKind = failureKind;
    }

    public DependencyFailureException(String dependency, FailureKind failureKind, String message, Throwable cause) {
        super(ErrorKind.DEPENDENCY_FAILURE, message, cause);
        this.dependency = dependency;
        this.failureKind = failureKind;
    }

    public String getDependency() {
        return dependency;
    }

    public FailureKind getFailureKind() {
        return failureKind;
    }
}
