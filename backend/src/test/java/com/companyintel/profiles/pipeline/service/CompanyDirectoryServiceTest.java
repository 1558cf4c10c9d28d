package com.companyintel.profiles.pipeline.service;

import com.companyintel.profiles.config.PipelineProperties;
import com.companyintel.profiles.pipeline.model.CompanyDetailView;
import com.companyintel.profiles.pipeline.model.CompanyDetails;
import com.companyintel.profiles.pipeline.model.CompanyProfile;
import com.companyintel.profiles.pipeline.model.CompanySummaryView;
import com.companyintel.profiles.pipeline.model.ContactInfo;
import com.companyintel.profiles.pipeline.persistence.ProfileFileRepository;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class CompanyDirectoryServiceTest {
    @TempDir
    Path tempDir;

    private PipelineProperties properties;
    private ProfileFileRepository repository;
    private CompanyDirectoryService directory;
    private Path dataFile;

    @BeforeEach
    void setUp() {
        dataFile = tempDir.resolve("companies.json");
        properties = new PipelineProperties();
        properties.setOutputDir(tempDir.toString());
        properties.getDirectory().setDataFile(dataFile.toString());
        repository = new ProfileFileRepository(new ObjectMapper());
        directory = new CompanyDirectoryService(properties, repository);
    }

    @Test
    void missingDataFileServesEmptyDirectory() {
        assertThat(directory.load()).isZero();
        assertThat(directory.list().total()).isZero();
        assertThat(directory.status().companiesLoaded()).isZero();
        assertThat(directory.status().loadedAt()).isNotNull();
    }

    @Test
    void lookupNormalizesDomain() throws Exception {
        repository.writeProfiles(dataFile, List.of(profile("acme.com", "Acme")));
        directory.load();

        assertThat(directory.find("https://www.ACME.com/about")).map(CompanyProfile::companyName).contains("Acme");
        assertThat(directory.find("acme.com")).isPresent();
        assertThat(directory.find("other.com")).isEmpty();
        assertThat(directory.find(" ")).isEmpty();
    }

    @Test
    void reloadSwapsInNewData() throws Exception {
        repository.writeProfiles(dataFile, List.of(profile("acme.com", "Acme")));
        directory.load();

        repository.writeProfiles(dataFile, List.of(profile("acme.com", "Acme"), profile("beta.io", "Beta")));
        assertThat(directory.reload()).isEqualTo(2);

        assertThat(directory.list().companies()).extracting(CompanySummaryView::domain).containsExactly("acme.com", "beta.io");
        assertThat(directory.find("beta.io")).isPresent();
    }

    @Test
    void detailIncludesEnrichmentWhenPresent() throws Exception {
        repository.writeProfiles(dataFile, List.of(profile("acme.com", "Acme"), profile("beta.io", "Beta")));
        CompanyDetails details = new CompanyDetails(ContactInfo.EMPTY, List.of("React"), null);
        repository.writeDetail(tempDir.resolve("json"), new CompanyDetailView(profile("acme.com", "Acme"), details));
        directory.load();

        assertThat(directory.findDetail("acme.com")).get()
            .extracting(view -> view.details().technologies())
            .isEqualTo(List.of("React"));
        assertThat(directory.findDetail("beta.io")).get()
            .extracting(CompanyDetailView::details)
            .isNull();
        assertThat(directory.findDetail("missing.com")).isEmpty();
    }

    private static CompanyProfile profile(String domain, String name) {
        return new CompanyProfile(domain, name, "", name + " builds things.", name + " builds things.",
            "Technology", "Software", "Software", "7372", "Prepackaged Software", "Technology, Software");
    }
}
