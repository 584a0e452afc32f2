package com.salesadvisor.service;

import com.salesadvisor.config.PipelineProperties;
import com.salesadvisor.exception.PipelineInitializationException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.stereotype.Component;

@Slf4j
@Component
@RequiredArgsConstructor
public class PipelineInitializer implements ApplicationRunner {

    private final RecommendationPipeline pipeline;
    private final PipelineProperties     properties;

    @Override
    public void run(ApplicationArguments args) {
        if (!properties.isBootstrapOnStartup()) {
            log.info("Pipeline bootstrap disabled | pipeline.bootstrap-on-startup=false");
            return;
        }
        log.info("Bootstrapping recommendation pipeline");
        try {
            PipelineStatus status = pipeline.initialize();
            log.info("Service ready | observations={} | features={} | model={}",
                     status.observationCount(), status.featureCount(), status.modelType());
        } catch (PipelineInitializationException ex) {
            log.error("Pipeline initialization failed | errorCode={} | reason={}", ex.getErrorCode(), ex.getMessage());
            throw ex;
        }
    }
}
