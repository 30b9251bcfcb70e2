package com.skyshield.evaluator.loop;

import com.skyshield.evaluator.gateway.TrackStoreGateway;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

/**
 * Starts the evaluator once the application context is up. The loop runs on
 * the main thread; a fatal error escapes {@link #run} and Spring Boot exits
 * with the exception's exit code.
 */
@Component
@ConditionalOnProperty(prefix = "skyshield.evaluator.loop", name = "enabled", havingValue = "true", matchIfMissing = true)
public class EvaluatorRunner implements ApplicationRunner {

    private static final Logger log = LoggerFactory.getLogger(EvaluatorRunner.class);

    private final TrackStoreGateway gateway;
    private final EvaluatorLoop loop;
    private final Ticker ticker;

    public EvaluatorRunner(TrackStoreGateway gateway, EvaluatorLoop loop, Ticker ticker) {
        this.gateway = gateway;
        this.loop = loop;
        this.ticker = ticker;
    }

    @Override
    public void run(ApplicationArguments args) {
        log.info("--- SKYSHIELD THREAT EVALUATOR ONLINE ---");
        gateway.verifyConnectivity();
        loop.run(ticker);
    }
}
