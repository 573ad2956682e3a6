package com.pulsetx.pipeline;

import com.pulsetx.heartrate.HeartRateWindowResolver;
import com.pulsetx.ingestion.adapter.solana.LedgerSignatureClient;
import com.pulsetx.pipeline.config.PipelineProperties;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.time.Clock;

/**
 * Creates a fresh pipeline per session from the shared clients.
 */
@Component
@RequiredArgsConstructor
public class CorrelationPipelineFactory {

    private final LedgerSignatureClient ledgerSignatureClient;
    private final HeartRateWindowResolver heartRateWindowResolver;
    private final PipelineProperties pipelineProperties;
    private final Clock clock;

    public CorrelationPipeline create() {
        return new CorrelationPipeline(
                ledgerSignatureClient,
                heartRateWindowResolver,
                clock,
                pipelineProperties.getPageLimit(),
                pipelineProperties.getPageTimeout());
    }
}
