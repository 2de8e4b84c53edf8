package com.arknoa.orchestrator.config;

import com.arknoa.orchestrator.stage.StageRegistry;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

@Configuration
@EnableConfigurationProperties(PipelineProperties.class)
public class PipelineConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    /** Built from pipeline.order / pipeline.stages; a bad declaration stops startup. */
    @Bean
    public StageRegistry stageRegistry(PipelineProperties props) {
        return new StageRegistry(props.toDescriptors());
    }
}
