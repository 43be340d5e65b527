package com.answer.pipeline.audit;

import com.answer.pipeline.model.CostRecord;
import com.answer.pipeline.model.PipelineResponse;

/**
 * Append-only destination for finished responses and cost records. Implementations must
 * not block the caller or throw.
 */
public interface AuditSink {

    void appendResponse(PipelineResponse response);

    void appendCost(CostRecord record);

    static AuditSink noop() {
        return new AuditSink() {
            @Override
            public void appendResponse(PipelineResponse response) {
            }

            @Override
            public void appendCost(CostRecord record) {
            }
        };
    }
}
