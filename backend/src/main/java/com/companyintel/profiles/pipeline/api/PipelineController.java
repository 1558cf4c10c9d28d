package com.companyintel.profiles.pipeline.api;

import com.companyintel.profiles.pipeline.model.MergeSummary;
import com.companyintel.profiles.pipeline.model.PipelineRunSummary;
import com.companyintel.profiles.pipeline.service.CompanyDirectoryService;
import com.companyintel.profiles.pipeline.service.ProfilePipelineService;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.io.IOException;

@RestController
@RequestMapping("/api/pipeline")
public class PipelineController {
    private final ProfilePipelineService pipelineService;
    private final CompanyDirectoryService directoryService;

    public PipelineController(ProfilePipelineService pipelineService, CompanyDirectoryService directoryService) {
        this.pipelineService = pipelineService;
        this.directoryService = directoryService;
    }

    @PostMapping("/run")
    public PipelineRunSummary run() {
        PipelineRunSummary summary = pipelineService.run();
        directoryService.reload();
        return summary;
    }

    @PostMapping("/merge")
    public MergeSummary merge() throws IOException {
        MergeSummary summary = pipelineService.mergeOnly();
        directoryService.reload();
        return summary;
    }
}
