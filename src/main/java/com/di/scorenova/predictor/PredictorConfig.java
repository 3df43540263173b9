package com.di.scorenova.predictor;

import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Registers the built-in predictors as beans. The orchestrator wires every
 * {@link Predictor} bean into the scoring pipeline, so additional predictors
 * only need to be declared as beans elsewhere.
 */
@Configuration
public class PredictorConfig {

    @Bean
    @ConditionalOnProperty(name = "scorenova.predictors.linear.enabled", havingValue = "true", matchIfMissing = true)
    public Predictor linearRiskPredictor(PredictorProperties props) {
        PredictorProperties.Linear cfg = props.getLinear();
        return new LinearRiskPredictor(cfg.getName(), PredictorProperties.toArray(cfg.getWeights()), cfg.getBias());
    }

    @Bean
    @ConditionalOnProperty(name = "scorenova.predictors.threshold-vote.enabled", havingValue = "true", matchIfMissing = true)
    public Predictor thresholdVotePredictor(PredictorProperties props) {
        PredictorProperties.ThresholdVote cfg = props.getThresholdVote();
        return new ThresholdVotePredictor(cfg.getName(), PredictorProperties.toArray(cfg.getThresholds()));
    }
}
