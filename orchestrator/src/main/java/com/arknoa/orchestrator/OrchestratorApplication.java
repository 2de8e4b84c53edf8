package com.arknoa.orchestrator;

import com.arknoa.orchestrator.stage.StageDescriptor;
import com.arknoa.orchestrator.stage.StageRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.context.annotation.Bean;

import java.util.stream.Collectors;

@SpringBootApplication
public class OrchestratorApplication {

    private static final Logger log = LoggerFactory.getLogger(OrchestratorApplication.class);

    public static void main(String[] args) {
        SpringApplication.run(OrchestratorApplication.class, args);
    }

    /** Print the pipeline this instance will run, once, at startup. */
    @Bean
    CommandLineRunner announcePipeline(StageRegistry registry) {
        return args -> log.info("Pipeline: {}", registry.pipeline().stream()
                .map(StageDescriptor::name)
                .collect(Collectors.joining(" → ")));
    }
}
