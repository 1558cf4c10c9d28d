package com.companyintel.profiles.pipeline.service;

import com.companyintel.profiles.config.PipelineProperties;
import com.companyintel.profiles.pipeline.classify.BusinessClassifier;
import com.companyintel.profiles.pipeline.describe.DescriptionSynthesizer;
import com.companyintel.profiles.pipeline.enrich.CompanyMetadataExtractor;
import com.companyintel.profiles.pipeline.enrich.ContactExtractor;
import com.companyintel.profiles.pipeline.enrich.TechnologyDetector;
import com.companyintel.profiles.pipeline.extract.TextExtractor;
import com.companyintel.profiles.pipeline.logo.LogoResolver;
import com.companyintel.profiles.pipeline.model.Classification;
import com.companyintel.profiles.pipeline.model.CompanyDetails;
import com.companyintel.profiles.pipeline.model.CompanyProfile;
import com.companyintel.profiles.pipeline.model.Descriptions;
import com.companyintel.profiles.pipeline.model.DocumentOutcome;
import com.companyintel.profiles.pipeline.model.ExtractedText;
import com.companyintel.profiles.pipeline.model.RawDocument;
import com.companyintel.profiles.pipeline.model.ValidationOutcome;
import com.companyintel.profiles.pipeline.quality.QualityGate;
import com.companyintel.profiles.pipeline.util.DomainNames;
import com.companyintel.profiles.pipeline.util.ReasonCodes;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;

/**
 * Processes one archived homepage into an accepted profile or a failure reason. Logo
 * resolution runs on its own executor while classification and description synthesis run
 * on the calling worker; nothing here is shared between documents.
 */
@Service
public class CompanyProfileService {
    private static final Logger log = LoggerFactory.getLogger(CompanyProfileService.class);

    private final PipelineProperties properties;
    private final TextExtractor textExtractor;
    private final BusinessClassifier classifier;
    private final DescriptionSynthesizer descriptionSynthesizer;
    private final LogoResolver logoResolver;
    private final QualityGate qualityGate;
    private final ContactExtractor contactExtractor;
    private final TechnologyDetector technologyDetector;
    private final CompanyMetadataExtractor metadataExtractor;
    private final ExecutorService logoExecutor;

    public CompanyProfileService(
        PipelineProperties properties,
        TextExtractor textExtractor,
        BusinessClassifier classifier,
        DescriptionSynthesizer descriptionSynthesizer,
        LogoResolver logoResolver,
        QualityGate qualityGate,
        ContactExtractor contactExtractor,
        TechnologyDetector technologyDetector,
        CompanyMetadataExtractor metadataExtractor,
        @Qualifier("logoExecutor") ExecutorService logoExecutor
    ) {
        this.properties = properties;
        this.textExtractor = textExtractor;
        this.classifier = classifier;
        this.descriptionSynthesizer = descriptionSynthesizer;
        this.logoResolver = logoResolver;
        this.qualityGate = qualityGate;
        this.contactExtractor = contactExtractor;
        this.technologyDetector = technologyDetector;
        this.metadataExtractor = metadataExtractor;
        this.logoExecutor = logoExecutor;
    }

    public DocumentOutcome process(RawDocument document) {
        String domain = document.domain();
        String html;
        try {
            html = textExtractor.read(document.htmlPath());
        } catch (IOException e) {
            log.warn("Unreadable document for {}: {}", domain, e.getMessage());
            return DocumentOutcome.failed(domain, ReasonCodes.UNREADABLE_FILE);
        }

        ExtractedText extracted = textExtractor.extractFromHtml(html);
        if (extracted.text().length() < properties.getExtraction().getMinTextLength()) {
            log.debug("Insufficient text for {} ({} chars)", domain, extracted.text().length());
            return DocumentOutcome.failed(domain, ReasonCodes.INSUFFICIENT_TEXT);
        }

        CompletableFuture<String> logo = CompletableFuture.supplyAsync(
            () -> logoResolver.resolve(domain, html),
            logoExecutor
        );
        Classification classification = classifier.classify(extracted.text());
        Descriptions descriptions = descriptionSynthesizer.synthesize(extracted.text());

        String companyName = extracted.title().isEmpty()
            ? DomainNames.nameFromDomain(domain)
            : extracted.title();
        CompanyProfile candidate = new CompanyProfile(
            domain,
            companyName,
            awaitLogo(domain, logo),
            descriptions.shortDescription(),
            descriptions.longDescription(),
            classification.sector(),
            classification.industry(),
            classification.subIndustry(),
            classification.sicCode(),
            classification.sicText(),
            classification.tags()
        );

        ValidationOutcome outcome = qualityGate.validate(candidate);
        if (!outcome.isAccepted()) {
            return DocumentOutcome.failed(domain, outcome.reasonCode());
        }
        log.debug("Accepted {}: {} > {}", domain, classification.sector(), classification.industry());
        return DocumentOutcome.accepted(outcome.profile(), details(html, extracted.text()));
    }

    private String awaitLogo(String domain, CompletableFuture<String> logo) {
        try {
            return logo.join();
        } catch (CompletionException e) {
            log.warn("Logo resolution failed for {}, using favicon service", domain, e.getCause());
            return logoResolver.faviconServiceUrl(domain);
        }
    }

    private CompanyDetails details(String html, String text) {
        if (!properties.getEnrichment().isDetailsEnabled()) {
            return null;
        }
        return new CompanyDetails(
            contactExtractor.extract(html, text),
            technologyDetector.detect(html),
            metadataExtractor.extract(text)
        );
    }
}
