package com.hometown.happiness.config;

import com.hometown.happiness.service.HappinessPipelineService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

@Component
@ConditionalOnProperty(name = "happiness.pipeline.run-on-startup", havingValue = "true")
public class PipelineStartupRunner implements ApplicationRunner {
    private static final Logger log = LoggerFactory.getLogger(PipelineStartupRunner.class);

    private final HappinessPipelineService pipelineService;

    public PipelineStartupRunner(HappinessPipelineService pipelineService) {
        this.pipelineService = pipelineService;
    }

    @Override
    public void run(ApplicationArguments args) {
        log.info("[PIPELINE] run-on-startup enabled, starting batch");
        try {
            pipelineService.runAll();
        } catch (RuntimeException ex) {
            log.error("[PIPELINE] batch failed: {}", ex.getMessage(), ex);
            throw ex;
        }
    }
}
