package com.salesadvisor.config;

import com.salesadvisor.model.Forecaster;
import com.salesadvisor.model.ModelArtifactLoader;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class ForecastingConfig {

    @Bean
    public Forecaster forecaster(ModelArtifactLoader loader) {
        return loader.load();
    }
}
