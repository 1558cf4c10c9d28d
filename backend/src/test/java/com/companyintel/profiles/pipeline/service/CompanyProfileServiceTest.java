package com.companyintel.profiles.pipeline.service;

import com.companyintel.profiles.config.PipelineProperties;
import com.companyintel.profiles.pipeline.classify.BusinessClassifier;
import com.companyintel.profiles.pipeline.describe.DescriptionSynthesizer;
import com.companyintel.profiles.pipeline.enrich.CompanyMetadataExtractor;
import com.companyintel.profiles.pipeline.enrich.ContactExtractor;
import com.companyintel.profiles.pipeline.enrich.TechnologyDetector;
import com.companyintel.profiles.pipeline.extract.TextExtractor;
import com.companyintel.profiles.pipeline.logo.LogoResolver;
import com.companyintel.profiles.pipeline.model.DocumentOutcome;
import com.companyintel.profiles.pipeline.model.RawDocument;
import com.companyintel.profiles.pipeline.quality.QualityGate;
import com.companyintel.profiles.pipeline.util.ReasonCodes;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class CompanyProfileServiceTest {
    @Mock
    private LogoResolver logoResolver;

    @TempDir
    Path tempDir;

    private PipelineProperties properties;
    private ExecutorService logoExecutor;
    private CompanyProfileService service;

    @BeforeEach
    void setUp() {
        properties = new PipelineProperties();
        logoExecutor = Executors.newSingleThreadExecutor();
        service = new CompanyProfileService(
            properties,
            new TextExtractor(properties),
            new BusinessClassifier(),
            new DescriptionSynthesizer(),
            logoResolver,
            new QualityGate(),
            new ContactExtractor(),
            new TechnologyDetector(),
            new CompanyMetadataExtractor(),
            logoExecutor
        );
    }

    @AfterEach
    void tearDown() {
        logoExecutor.shutdownNow();
    }

    @Test
    void unreadableFileIsReported() {
        DocumentOutcome outcome = service.process(new RawDocument("gone.com", tempDir.resolve("gone.com/index.html")));

        assertThat(outcome.isAccepted()).isFalse();
        assertThat(outcome.reasonCode()).isEqualTo(ReasonCodes.UNREADABLE_FILE);
    }

    @Test
    void shortTextIsRejectedBeforeLogoLookup() throws Exception {
        Path file = Files.writeString(tempDir.resolve("index.html"), "<html><body>Hello</body></html>");

        DocumentOutcome outcome = service.process(new RawDocument("tiny.com", file));

        assertThat(outcome.reasonCode()).isEqualTo(ReasonCodes.INSUFFICIENT_TEXT);
        verify(logoResolver, never()).resolve(anyString(), anyString());
    }

    @Test
    void nameFallsBackToDomainWhenTitleMissing() throws Exception {
        Path file = Files.writeString(tempDir.resolve("index.html"),
            "<html><body><p>We offer accounting and tax services for small businesses across the country.</p>"
                + "<script src=\"https://js.stripe.com/v3\"></script></body></html>");
        when(logoResolver.resolve(anyString(), anyString())).thenReturn("https://ledger.io/favicon.ico");

        DocumentOutcome outcome = service.process(new RawDocument("www.ledger.io", file));

        assertThat(outcome.isAccepted()).isTrue();
        assertThat(outcome.profile().companyName()).isEqualTo("Ledger");
        assertThat(outcome.profile().sector()).isEqualTo("Financial Services");
        assertThat(outcome.profile().logo()).isEqualTo("https://ledger.io/favicon.ico");
        assertThat(outcome.details().technologies()).containsExactly("Stripe");
    }

    @Test
    void detailsAreSkippedWhenDisabled() throws Exception {
        properties.getEnrichment().setDetailsEnabled(false);
        Path file = Files.writeString(tempDir.resolve("index.html"),
            "<html><body><p>We offer accounting and tax services for small businesses across the country.</p></body></html>");
        when(logoResolver.resolve(anyString(), anyString())).thenReturn("https://ledger.io/favicon.ico");

        DocumentOutcome outcome = service.process(new RawDocument("ledger.io", file));

        assertThat(outcome.isAccepted()).isTrue();
        assertThat(outcome.details()).isNull();
    }
}
