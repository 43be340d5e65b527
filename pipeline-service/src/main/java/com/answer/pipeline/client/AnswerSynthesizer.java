package com.answer.pipeline.client;

import com.answer.pipeline.model.FetchedSource;
import com.answer.pipeline.model.SynthesisResult;

import java.util.List;

public interface AnswerSynthesizer {

    /**
     * Backend name, used as the cost ledger key.
     */
    String name();

    /**
     * Model identifier; each model gets its own circuit.
     */
    String model();

    SynthesisResult synthesize(String query, List<FetchedSource> sources);

    double estimateCost(String query, List<FetchedSource> sources);

    double actualCost(SynthesisResult result);
}
