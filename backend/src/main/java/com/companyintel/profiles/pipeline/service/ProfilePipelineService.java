package com.companyintel.profiles.pipeline.service;

import com.companyintel.profiles.config.PipelineProperties;
import com.companyintel.profiles.pipeline.merge.ProfileMerger;
import com.companyintel.profiles.pipeline.model.CompanyDetailView;
import com.companyintel.profiles.pipeline.model.CompanyProfile;
import com.companyintel.profiles.pipeline.model.DocumentOutcome;
import com.companyintel.profiles.pipeline.model.MergeSummary;
import com.companyintel.profiles.pipeline.model.PipelineRunSummary;
import com.companyintel.profiles.pipeline.model.RawDocument;
import com.companyintel.profiles.pipeline.persistence.ProfileFileRepository;
import com.companyintel.profiles.pipeline.util.ReasonCodes;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.stream.Stream;

/**
 * Runs one batch over the input directory: every domain sub-directory becomes one document,
 * documents are processed on the worker pool and the outcomes are written as the raw result,
 * the failure list and (optionally) the merged final artifact.
 */
@Service
public class ProfilePipelineService {
    private static final Logger log = LoggerFactory.getLogger(ProfilePipelineService.class);

    static final String INDEX_FILE = "index.html";

    private final PipelineProperties properties;
    private final CompanyProfileService profileService;
    private final ProfileMerger merger;
    private final ProfileFileRepository fileRepository;
    private final ExecutorService pipelineExecutor;
    private final AtomicBoolean running = new AtomicBoolean(false);

    public ProfilePipelineService(
        PipelineProperties properties,
        CompanyProfileService profileService,
        ProfileMerger merger,
        ProfileFileRepository fileRepository,
        @Qualifier("pipelineExecutor") ExecutorService pipelineExecutor
    ) {
        this.properties = properties;
        this.profileService = profileService;
        this.merger = merger;
        this.fileRepository = fileRepository;
        this.pipelineExecutor = pipelineExecutor;
    }

    public PipelineRunSummary run() {
        return run(Path.of(properties.getInputDir()), Path.of(properties.getOutputDir()), true);
    }

    public PipelineRunSummary run(Path inputDir, Path outputDir, boolean mergeAfterRun) {
        if (!Files.isDirectory(inputDir)) {
            throw new InputDirectoryMissingException("Input directory not found: " + inputDir);
        }
        if (!running.compareAndSet(false, true)) {
            throw new ActivePipelineRunException("A pipeline run is already in progress");
        }
        try {
            return runBatch(inputDir, outputDir, mergeAfterRun);
        } catch (IOException e) {
            throw new UncheckedIOException("Pipeline run failed writing to " + outputDir, e);
        } finally {
            running.set(false);
        }
    }

    public boolean isRunning() {
        return running.get();
    }

    /**
     * Re-merges an existing raw result file into the final artifact. Shares the run guard, so it
     * is refused while a batch is writing the same files.
     */
    public MergeSummary mergeOnly() throws IOException {
        if (!running.compareAndSet(false, true)) {
            throw new ActivePipelineRunException("A pipeline run is already in progress");
        }
        try {
            Path outputDir = Path.of(properties.getOutputDir());
            return merger.mergeFile(
                outputDir.resolve(properties.getRawFile()),
                outputDir.resolve(properties.getFinalFile())
            );
        } finally {
            running.set(false);
        }
    }

    private PipelineRunSummary runBatch(Path inputDir, Path outputDir, boolean mergeAfterRun) throws IOException {
        Instant startedAt = Instant.now();
        List<Path> domainDirs = listDomainDirectories(inputDir);
        log.info("Pipeline run started: {} domain directories under {}", domainDirs.size(), inputDir);

        List<CompletableFuture<DocumentOutcome>> futures = new ArrayList<>();
        for (Path domainDir : domainDirs) {
            String domain = domainDir.getFileName().toString();
            Path indexFile = domainDir.resolve(INDEX_FILE);
            if (!Files.isRegularFile(indexFile)) {
                log.debug("No {} for {}", INDEX_FILE, domain);
                futures.add(CompletableFuture.completedFuture(
                    DocumentOutcome.failed(domain, ReasonCodes.MISSING_INDEX_HTML)
                ));
                continue;
            }
            RawDocument document = new RawDocument(domain, indexFile);
            futures.add(CompletableFuture.supplyAsync(() -> processSafely(document), pipelineExecutor));
        }

        List<CompanyProfile> accepted = new ArrayList<>();
        List<CompanyDetailView> detailViews = new ArrayList<>();
        List<String> failedDomains = new ArrayList<>();
        Map<String, Integer> failuresByReason = new LinkedHashMap<>();
        int rejected = 0;
        for (CompletableFuture<DocumentOutcome> future : futures) {
            DocumentOutcome outcome = future.join();
            if (outcome.isAccepted()) {
                accepted.add(outcome.profile());
                if (outcome.details() != null) {
                    detailViews.add(new CompanyDetailView(outcome.profile(), outcome.details()));
                }
            } else {
                failedDomains.add(outcome.domain());
                failuresByReason.merge(outcome.reasonCode(), 1, Integer::sum);
                if (ReasonCodes.isRejection(outcome.reasonCode())) {
                    rejected++;
                }
            }
        }

        Path rawFile = outputDir.resolve(properties.getRawFile());
        Path failedFile = outputDir.resolve(properties.getFailedFile());
        fileRepository.writeProfiles(rawFile, accepted);
        fileRepository.writeFailures(failedFile, failedDomains);
        Path detailsDir = outputDir.resolve(properties.getDetailsDir());
        for (CompanyDetailView view : detailViews) {
            fileRepository.writeDetail(detailsDir, view);
        }

        MergeSummary mergeSummary = null;
        if (mergeAfterRun) {
            mergeSummary = merger.mergeFile(rawFile, outputDir.resolve(properties.getFinalFile()));
        }

        Instant finishedAt = Instant.now();
        log.info(
            "Pipeline run finished: documents={} accepted={} failed={} rejected={} reasons={}",
            domainDirs.size(),
            accepted.size(),
            failedDomains.size(),
            rejected,
            failuresByReason
        );
        return new PipelineRunSummary(
            startedAt,
            finishedAt,
            "COMPLETED",
            domainDirs.size(),
            accepted.size(),
            failedDomains.size(),
            rejected,
            List.copyOf(failedDomains),
            failuresByReason,
            ProfileMerger.statistics(accepted),
            rawFile.toString(),
            failedFile.toString(),
            mergeSummary
        );
    }

    private DocumentOutcome processSafely(RawDocument document) {
        try {
            return profileService.process(document);
        } catch (RuntimeException e) {
            log.warn("Processing failed for {}", document.domain(), e);
            return DocumentOutcome.failed(document.domain(), ReasonCodes.PROCESSING_EXCEPTION);
        }
    }

    private List<Path> listDomainDirectories(Path inputDir) throws IOException {
        try (Stream<Path> entries = Files.list(inputDir)) {
            return entries
                .filter(Files::isDirectory)
                .sorted(Comparator.comparing(path -> path.getFileName().toString()))
                .toList();
        }
    }
}
