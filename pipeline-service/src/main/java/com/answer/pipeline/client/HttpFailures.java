package com.answer.pipeline.client;

import com.answer.pipeline.exception.DependencyFailureException;
import com.answer.pipeline.exception.FailureKind;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import org.springframework.web.reactive.function.client.WebClientResponseException;

import java.util.concurrent.TimeoutException;

/**
 * Maps WebClient errors onto {@link FailureKind}s.
 */
final class HttpFailures {

    private HttpFailures() {
    }

    static DependencyFailureException translate(String dependency, Throwable error) {
        if (error instanceof DependencyFailureException) {
            return (DependencyFailureException) error;
        }
        FailureKind kind = classify(error);
        String message = dependency + " call failed: " + error.getMessage();
        return new DependencyFailureException(dependency, kind, message, error);
    }

    static FailureKind classify(Throwable error) {
        if (error instanceof WebClientResponseException) {
            int status = ((WebClientResponseException) error).getStatusCode().value();
            if (status == 429) {
                return FailureKind.RATE_LIMITED;
            }
            if (status == 404 || status == 410) {
                return FailureKind.NOT_FOUND;
            }
            if (status == 401 || status == 403) {
                return FailureKind.BLOCKED;
            }
            return FailureKind.ERROR;
        }
        if (error instanceof WebClientRequestException) {
            return hasTimeoutCause(error) ? FailureKind.TIMEOUT : FailureKind.ERROR;
        }
        // Mono.block(Duration) signals an elapsed timeout with IllegalStateException
        if (error instanceof IllegalStateException && error.getMessage() != null
                && error.getMessage().startsWith("Timeout on blocking read")) {
            return FailureKind.TIMEOUT;
        }
        return hasTimeoutCause(error) ? FailureKind.TIMEOUT : FailureKind.ERROR;
    }

    private static boolean hasTimeoutCause(Throwable error) {
        Throwable current = error;
        while (current != null) {
            if (current instanceof TimeoutException
                    || current.getClass().getSimpleName().contains("Timeout")) {
                return true;
            }
            current = current.getCause();
        }
        return false;
    }
}
