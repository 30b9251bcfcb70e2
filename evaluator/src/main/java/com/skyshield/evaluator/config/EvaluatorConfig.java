package com.skyshield.evaluator.config;

import com.skyshield.evaluator.gateway.TrackStoreGateway;
import com.skyshield.evaluator.loop.EvaluatorLoop;
import com.skyshield.evaluator.loop.FixedIntervalTicker;
import com.skyshield.evaluator.policy.DeadBandFilter;
import com.skyshield.evaluator.policy.EscalationPolicy;
import com.skyshield.evaluator.scoring.RiskFactors;
import com.skyshield.evaluator.scoring.ScoringWeights;
import com.skyshield.evaluator.scoring.ThreatScorer;
import com.skyshield.shared.util.MetricsCollector;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Builds the pure scoring and policy components from {@link EvaluatorProperties}.
 */
@Configuration
@EnableConfigurationProperties(EvaluatorProperties.class)
public class EvaluatorConfig {

    @Bean
    public RiskFactors riskFactors(EvaluatorProperties properties) {
        return new RiskFactors(
            properties.getSpeedCeiling(),
            properties.getInnerRadius(),
            properties.getOuterRadius(),
            properties.protectedPosition());
    }

    @Bean
    public ScoringWeights scoringWeights(EvaluatorProperties properties) {
        EvaluatorProperties.Weights weights = properties.getWeights();
        return new ScoringWeights(weights.getSpeed(), weights.getProximity(), weights.getIdentification());
    }

    @Bean
    public ThreatScorer threatScorer(RiskFactors riskFactors, ScoringWeights scoringWeights) {
        return new ThreatScorer(riskFactors, scoringWeights);
    }

    @Bean
    public DeadBandFilter deadBandFilter(EvaluatorProperties properties) {
        return new DeadBandFilter(properties.getDeadBandThreshold());
    }

    @Bean
    public EscalationPolicy escalationPolicy(EvaluatorProperties properties) {
        return new EscalationPolicy(properties.getEscalationThreshold());
    }

    @Bean
    public MetricsCollector evaluatorMetrics() {
        return new MetricsCollector();
    }

    // Stopped on context close so a blocked wait returns and the loop ends.
    @Bean(destroyMethod = "stop")
    public FixedIntervalTicker evaluatorTicker(EvaluatorProperties properties) {
        return new FixedIntervalTicker(properties.getPollInterval());
    }

    @Bean
    public EvaluatorLoop evaluatorLoop(TrackStoreGateway gateway,
                                       ThreatScorer threatScorer,
                                       DeadBandFilter deadBandFilter,
                                       EscalationPolicy escalationPolicy,
                                       MetricsCollector evaluatorMetrics) {
        return new EvaluatorLoop(gateway, threatScorer, deadBandFilter, escalationPolicy, evaluatorMetrics);
    }
}
