package com.companyintel.profiles.pipeline.service;

import com.companyintel.profiles.config.PipelineProperties;
import com.companyintel.profiles.pipeline.model.MergeSummary;
import com.companyintel.profiles.pipeline.model.PipelineRunSummary;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.SpringApplication;
import org.springframework.context.ConfigurableApplicationContext;
import org.springframework.stereotype.Component;

import java.nio.file.Path;

@Component
public class PipelineCliRunner implements ApplicationRunner {
    private static final Logger log = LoggerFactory.getLogger(PipelineCliRunner.class);

    private final PipelineProperties properties;
    private final ProfilePipelineService pipelineService;
    private final CompanyDirectoryService directoryService;
    private final ConfigurableApplicationContext applicationContext;

    public PipelineCliRunner(
        PipelineProperties properties,
        ProfilePipelineService pipelineService,
        CompanyDirectoryService directoryService,
        ConfigurableApplicationContext applicationContext
    ) {
        this.properties = properties;
        this.pipelineService = pipelineService;
        this.directoryService = directoryService;
        this.applicationContext = applicationContext;
    }

    @Override
    public void run(ApplicationArguments args) {
        if (!properties.getCli().isRun()) {
            return;
        }

        PipelineRunSummary summary = pipelineService.run(
            Path.of(properties.getInputDir()),
            Path.of(properties.getOutputDir()),
            properties.getCli().isMergeAfterRun()
        );
        log.info(
            "Pipeline run {}: documents={}, accepted={}, failed={} (rejected by quality gate={}), reasons={}",
            summary.status(),
            summary.documentsFound(),
            summary.acceptedCount(),
            summary.failedCount(),
            summary.rejectedCount(),
            summary.failuresByReason()
        );
        log.info("Raw output: {}, failures: {}", summary.rawOutputFile(), summary.failedOutputFile());
        MergeSummary merge = summary.merge();
        if (merge != null) {
            log.info(
                "Final artifact {}: companies={}, duplicates_removed={}, coverage={}",
                merge.outputFile(),
                merge.outputCount(),
                merge.duplicatesRemoved(),
                merge.stats().fieldCoverage()
            );
        }

        if (properties.getCli().isExitAfterRun()) {
            int exitCode = SpringApplication.exit(applicationContext, () -> 0);
            System.exit(exitCode);
        }
        directoryService.reload();
    }
}
