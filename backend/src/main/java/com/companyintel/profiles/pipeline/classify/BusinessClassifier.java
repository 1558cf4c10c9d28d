package com.companyintel.profiles.pipeline.classify;

import com.companyintel.profiles.pipeline.model.Classification;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Locale;

/**
 * Deterministic keyword classifier. A keyword counts once if it occurs anywhere in the
 * lowercased text as a plain substring; no word-boundary anchoring.
 */
@Component
public class BusinessClassifier {
    static final int MIN_TEXT_LENGTH = 20;

    public static final Classification DEFAULT = new Classification(
        "Technology",
        "Software",
        "Software",
        "7372",
        "Prepackaged Software",
        "Technology, Software"
    );

    private final List<SectorRule> rules;

    public BusinessClassifier() {
        this(ClassificationRules.DEFAULT);
    }

    public BusinessClassifier(List<SectorRule> rules) {
        this.rules = List.copyOf(rules);
    }

    public Classification classify(String text) {
        if (text == null) {
            return DEFAULT;
        }
        String normalized = text.toLowerCase(Locale.ROOT).trim();
        if (normalized.length() < MIN_TEXT_LENGTH) {
            return DEFAULT;
        }

        SectorRule bestSector = null;
        int bestSectorScore = 0;
        for (SectorRule sector : rules) {
            int score = score(sector.keywords(), normalized);
            // strict > keeps the earliest declared sector on ties
            if (score > bestSectorScore) {
                bestSector = sector;
                bestSectorScore = score;
            }
        }
        if (bestSector == null) {
            return DEFAULT;
        }

        IndustryRule bestIndustry = bestSector.industries().get(0);
        int bestIndustryScore = 0;
        for (IndustryRule industry : bestSector.industries()) {
            int score = score(industry.keywords(), normalized);
            if (score > bestIndustryScore) {
                bestIndustry = industry;
                bestIndustryScore = score;
            }
        }

        return new Classification(
            bestSector.name(),
            bestIndustry.name(),
            bestIndustry.name(),
            bestIndustry.sicCode(),
            bestIndustry.sicText(),
            bestSector.name() + ", " + bestIndustry.name()
        );
    }

    static int score(List<String> keywords, String normalizedText) {
        int score = 0;
        for (String keyword : keywords) {
            if (normalizedText.contains(keyword)) {
                score++;
            }
        }
        return score;
    }
}
