package com.companyintel.profiles.pipeline.service;

import com.companyintel.profiles.config.PipelineProperties;
import com.companyintel.profiles.pipeline.model.CompanyDetailView;
import com.companyintel.profiles.pipeline.model.CompanyListResponse;
import com.companyintel.profiles.pipeline.model.CompanyProfile;
import com.companyintel.profiles.pipeline.model.CompanySummaryView;
import com.companyintel.profiles.pipeline.model.DirectoryStatusResponse;
import com.companyintel.profiles.pipeline.persistence.ProfileFileRepository;
import com.companyintel.profiles.pipeline.util.DomainNames;
import jakarta.annotation.PostConstruct;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Read-only, in-memory view of the final artifact keyed by normalized domain. A reload
 * builds a new map and swaps it in, so lookups never observe a partial load.
 */
@Service
public class CompanyDirectoryService {
    private static final Logger log = LoggerFactory.getLogger(CompanyDirectoryService.class);

    static final String SERVICE_NAME = "company-intel";

    private final PipelineProperties properties;
    private final ProfileFileRepository fileRepository;
    private final AtomicReference<Snapshot> snapshot = new AtomicReference<>(Snapshot.empty());

    public CompanyDirectoryService(PipelineProperties properties, ProfileFileRepository fileRepository) {
        this.properties = properties;
        this.fileRepository = fileRepository;
    }

    @PostConstruct
    void loadOnStartup() {
        if (properties.getDirectory().isLoadOnStartup()) {
            load();
        }
    }

    public int load() {
        Path dataFile = dataFile();
        if (!Files.isRegularFile(dataFile)) {
            log.warn("Data file {} not found, serving an empty directory", dataFile);
            snapshot.set(new Snapshot(Map.of(), Instant.now()));
            return 0;
        }
        List<CompanyProfile> profiles;
        try {
            profiles = fileRepository.readProfiles(dataFile);
        } catch (IOException e) {
            throw new UncheckedIOException("Unable to load " + dataFile, e);
        }
        Map<String, CompanyProfile> byDomain = new LinkedHashMap<>();
        for (CompanyProfile profile : profiles) {
            if (profile.domain() == null || profile.domain().isBlank()) {
                continue;
            }
            byDomain.putIfAbsent(DomainNames.normalizeLookupKey(profile.domain()), profile);
        }
        snapshot.set(new Snapshot(Collections.unmodifiableMap(byDomain), Instant.now()));
        log.info("Loaded {} companies from {}", byDomain.size(), dataFile);
        return byDomain.size();
    }

    public int reload() {
        return load();
    }

    public Optional<CompanyProfile> find(String domain) {
        if (domain == null || domain.isBlank()) {
            return Optional.empty();
        }
        return Optional.ofNullable(snapshot.get().companies().get(DomainNames.normalizeLookupKey(domain)));
    }

    /**
     * Profile plus the per-domain enrichment file when one was written for it.
     */
    public Optional<CompanyDetailView> findDetail(String domain) {
        Optional<CompanyProfile> profile = find(domain);
        if (profile.isEmpty()) {
            return Optional.empty();
        }
        Path detailsDir = Path.of(properties.getOutputDir()).resolve(properties.getDetailsDir());
        try {
            Optional<CompanyDetailView> stored = fileRepository.readDetail(detailsDir, profile.get().domain());
            return Optional.of(new CompanyDetailView(
                profile.get(),
                stored.map(CompanyDetailView::details).orElse(null)
            ));
        } catch (IOException e) {
            log.warn("Unreadable detail file for {}: {}", domain, e.getMessage());
            return Optional.of(new CompanyDetailView(profile.get(), null));
        }
    }

    public CompanyListResponse list() {
        List<CompanySummaryView> rows = snapshot.get().companies().values().stream()
            .map(CompanySummaryView::of)
            .toList();
        return new CompanyListResponse(rows, rows.size());
    }

    public DirectoryStatusResponse status() {
        Snapshot current = snapshot.get();
        return new DirectoryStatusResponse(
            SERVICE_NAME,
            current.companies().size(),
            dataFile().toString(),
            current.loadedAt()
        );
    }

    private Path dataFile() {
        return Path.of(properties.getDirectory().getDataFile());
    }

    private record Snapshot(Map<String, CompanyProfile> companies, Instant loadedAt) {
        static Snapshot empty() {
            return new Snapshot(Map.of(), null);
        }
    }
}
