package com.salesadvisor.service;

import com.salesadvisor.config.PipelineProperties;
import com.salesadvisor.exception.PipelineInitializationException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.boot.DefaultApplicationArguments;

import java.time.Instant;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class PipelineInitializerTest {

    @Mock RecommendationPipeline pipeline;

    private PipelineProperties properties;
    private PipelineInitializer initializer;

    @BeforeEach
    void setUp() {
        properties = new PipelineProperties();
        initializer = new PipelineInitializer(pipeline, properties);
    }

    @Test
    void run_initializesPipelineOnStartup() {
        when(pipeline.initialize()).thenReturn(new PipelineStatus(true, 20, 16, "placeholder", true, Instant.now()));

        initializer.run(new DefaultApplicationArguments());

        verify(pipeline, times(1)).initialize();
    }

    @Test
    void run_bootstrapDisabled_skipsInitialization() {
        properties.setBootstrapOnStartup(false);

        initializer.run(new DefaultApplicationArguments());

        verifyNoInteractions(pipeline);
    }

    @Test
    void run_initializationFailure_propagates() {
        when(pipeline.initialize()).thenThrow(new PipelineInitializationException("No valid observations in corpus"));

        assertThatThrownBy(() -> initializer.run(new DefaultApplicationArguments()))
            .isInstanceOf(PipelineInitializationException.class);
    }
}
