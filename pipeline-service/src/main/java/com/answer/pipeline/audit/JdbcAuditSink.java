package com.answer.pipeline.audit;

import com.answer.pipeline.model.CostRecord;
import com.answer.pipeline.model.PipelineResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.jdbc.core.JdbcTemplate;

import java.sql.Timestamp;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;

public class JdbcAuditSink implements AuditSink {

    private static final Logger log = LoggerFactory.getLogger(JdbcAuditSink.class);

    private final JdbcTemplate jdbcTemplate;
    private final Executor executor;

    public JdbcAuditSink(JdbcTemplate jdbcTemplate, Executor executor) {
        this.jdbcTemplate = jdbcTemplate;
        this.executor = executor;
    }

    @Override
    public void appendResponse(PipelineResponse response) {
        submit("pipeline_responses", () -> jdbcTemplate.update(
                "INSERT INTO pipeline_responses (fingerprint, query_text, confidence, processing_time, "
                        + "cost_estimate, cached, degraded, source_count, created_at) VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?)",
                response.fingerprint(),
                response.query() == null ? "" : response.query(),
                response.confidence(),
                response.processingTime(),
                response.costEstimate(),
                response.cached(),
                response.degraded(),
                response.sources().size(),
                Timestamp.from(response.timestamp())
        ));
    }

    @Override
    public void appendCost(CostRecord record) {
        submit("cost_records", () -> jdbcTemplate.update(
                "INSERT INTO cost_records (provider, amount, request_fingerprint, created_at) VALUES (?, ?, ?, ?)",
                record.provider(),
                record.amount(),
                record.requestFingerprint(),
                Timestamp.from(record.timestamp())
        ));
    }

    private void submit(String table, Runnable write) {
        try {
            executor.execute(() -> {
                try {
                    write.run();
                } catch (Exception ex) {
                    log.debug("{} write skipped: {}", table, ex.getMessage());
                }
            });
        } catch (RejectedExecutionException ex) {
            log.debug("{} write dropped: {}", table, ex.getMessage());
        }
    }
}
