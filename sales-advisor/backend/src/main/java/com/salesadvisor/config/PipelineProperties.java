package com.salesadvisor.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Getter
@Setter
@Component
@ConfigurationProperties(prefix = "pipeline")
public class PipelineProperties {

    private int cohortSize = 5;
    private boolean bootstrapOnStartup = true;
    private Model model = new Model();

    @Getter
    @Setter
    public static class Model {
        private String artifactLocation = "file:models/sales-model.json";
        private int remoteTimeoutSeconds = 10;
    }
}
