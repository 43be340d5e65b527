package com.answer.pipeline.controller;

import com.answer.pipeline.model.PipelineResponse;
import com.answer.pipeline.model.SearchRequest;
import com.answer.pipeline.service.SearchPipelineService;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.UUID;

@RestController
@RequestMapping("/search")
public class SearchController {

    private final SearchPipelineService pipelineService;

    public SearchController(SearchPipelineService pipelineService) {
        this.pipelineService = pipelineService;
    }

    @PostMapping
    public PipelineResponse search(
            @RequestBody SearchRequest request,
            @RequestHeader(value = "X-Trace-Id", required = false) String traceId
    ) {
        String effectiveTraceId = (traceId == null || traceId.isBlank()) ? UUID.randomUUID().toString() : traceId;
        return pipelineService.run(request, effectiveTraceId);
    }
}
