package com.answer.pipeline.client;

import com.answer.pipeline.exception.DependencyFailureException;
import com.answer.pipeline.exception.FailureKind;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;
import org.springframework.web.reactive.function.client.WebClientResponseException;

import java.nio.charset.StandardCharsets;
import java.util.concurrent.TimeoutException;

import static org.assertj.core.api.Assertions.assertThat;

class HttpFailuresTest {

    @Test
    void mapsStatusCodesToFailureKinds() {
        assertThat(HttpFailures.classify(status(429))).isEqualTo(FailureKind.RATE_LIMITED);
        assertThat(HttpFailures.classify(status(404))).isEqualTo(FailureKind.NOT_FOUND);
        assertThat(HttpFailures.classify(status(410))).isEqualTo(FailureKind.NOT_FOUND);
        assertThat(HttpFailures.classify(status(403))).isEqualTo(FailureKind.BLOCKED);
        assertThat(HttpFailures.classify(status(500))).isEqualTo(FailureKind.ERROR);
    }

    @Test
    void blockingReadTimeoutIsATimeout() {
        assertThat(HttpFailures.classify(new IllegalStateException("Timeout on blocking read for 1000000000 NANOSECONDS")))
                .isEqualTo(FailureKind.TIMEOUT);
        assertThat(HttpFailures.classify(new RuntimeException("wrapped", new TimeoutException())))
                .isEqualTo(FailureKind.TIMEOUT);
    }

    @Test
    void translateKeepsExistingDependencyFailures() {
        DependencyFailureException original = new DependencyFailureException("brave", FailureKind.BLOCKED, "blocked");

        assertThat(HttpFailures.translate("brave", original)).isSameAs(original);
        assertThat(HttpFailures.translate("brave", status(429)).getDependency()).isEqualTo("brave");
    }

    private static WebClientResponseException status(int code) {
        return WebClientResponseException.create(code, "status " + code, HttpHeaders.EMPTY, new byte[0], StandardCharsets.UTF_8);
    }
}
