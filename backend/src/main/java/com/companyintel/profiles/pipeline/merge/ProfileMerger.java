package com.companyintel.profiles.pipeline.merge;

import com.companyintel.profiles.pipeline.model.CompanyProfile;
import com.companyintel.profiles.pipeline.model.MergeResult;
import com.companyintel.profiles.pipeline.model.MergeStats;
import com.companyintel.profiles.pipeline.model.MergeSummary;
import com.companyintel.profiles.pipeline.persistence.ProfileFileRepository;
import com.companyintel.profiles.pipeline.quality.ProfileSchema;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.function.Function;

/**
 * Final batch step: schema coercion, de-duplication by domain (first occurrence wins) and a
 * case-insensitive sort by company name.
 */
@Service
public class ProfileMerger {
    private static final Logger log = LoggerFactory.getLogger(ProfileMerger.class);

    static final List<String> COVERAGE_FIELDS = List.of(
        ProfileSchema.LOGO,
        ProfileSchema.SHORT_DESCRIPTION,
        ProfileSchema.LONG_DESCRIPTION,
        ProfileSchema.SECTOR,
        ProfileSchema.INDUSTRY
    );

    private final ProfileFileRepository fileRepository;

    public ProfileMerger(ProfileFileRepository fileRepository) {
        this.fileRepository = fileRepository;
    }

    public MergeResult merge(List<? extends Map<String, ?>> rawProfiles) {
        List<CompanyProfile> coerced = new ArrayList<>();
        for (Map<String, ?> raw : rawProfiles) {
            coerced.add(ProfileSchema.coerce(raw));
        }
        return mergeCoerced(coerced);
    }

    public MergeResult mergeProfiles(List<CompanyProfile> profiles) {
        List<CompanyProfile> coerced = new ArrayList<>();
        for (CompanyProfile profile : profiles) {
            coerced.add(ProfileSchema.coerce(profile));
        }
        return mergeCoerced(coerced);
    }

    public MergeSummary mergeFile(Path rawFile, Path finalFile) throws IOException {
        if (!Files.isRegularFile(rawFile)) {
            throw new NoSuchFileException(rawFile.toString());
        }
        List<Map<String, Object>> raw = fileRepository.readProfileMaps(rawFile);
        log.info("Merging {} raw profiles from {}", raw.size(), rawFile);
        MergeResult result = merge(raw);
        fileRepository.writeProfiles(finalFile, result.profiles());
        return MergeSummary.of(result, finalFile.toString());
    }

    private MergeResult mergeCoerced(List<CompanyProfile> coerced) {
        Set<String> seenDomains = new HashSet<>();
        List<CompanyProfile> unique = new ArrayList<>();
        int duplicates = 0;
        for (CompanyProfile profile : coerced) {
            if (!seenDomains.add(profile.domain())) {
                log.debug("Duplicate domain dropped: {}", profile.domain());
                duplicates++;
                continue;
            }
            unique.add(profile);
        }
        unique.sort(Comparator.comparing(profile -> profile.companyName().toLowerCase(Locale.ROOT)));

        MergeStats stats = statistics(unique);
        log.info(
            "Merge complete: input={} output={} duplicates_removed={} coverage={} sectors={}",
            coerced.size(),
            unique.size(),
            duplicates,
            stats.fieldCoverage(),
            stats.sectorDistribution()
        );
        return new MergeResult(List.copyOf(unique), coerced.size(), duplicates, stats);
    }

    /**
     * Non-empty counts per coverage field and profile counts per sector, largest sector first.
     */
    public static MergeStats statistics(List<CompanyProfile> profiles) {
        Map<String, Function<CompanyProfile, String>> accessors = Map.of(
            ProfileSchema.LOGO, CompanyProfile::logo,
            ProfileSchema.SHORT_DESCRIPTION, CompanyProfile::shortDescription,
            ProfileSchema.LONG_DESCRIPTION, CompanyProfile::longDescription,
            ProfileSchema.SECTOR, CompanyProfile::sector,
            ProfileSchema.INDUSTRY, CompanyProfile::industry
        );
        Map<String, Integer> coverage = new LinkedHashMap<>();
        for (String field : COVERAGE_FIELDS) {
            Function<CompanyProfile, String> accessor = accessors.get(field);
            int count = 0;
            for (CompanyProfile profile : profiles) {
                String value = accessor.apply(profile);
                if (value != null && !value.isEmpty()) {
                    count++;
                }
            }
            coverage.put(field, count);
        }

        Map<String, Integer> sectorCounts = new LinkedHashMap<>();
        for (CompanyProfile profile : profiles) {
            String sector = profile.sector() == null || profile.sector().isEmpty() ? "Unknown" : profile.sector();
            sectorCounts.merge(sector, 1, Integer::sum);
        }
        List<Map.Entry<String, Integer>> entries = new ArrayList<>(sectorCounts.entrySet());
        entries.sort(Map.Entry.<String, Integer>comparingByValue().reversed());
        Map<String, Integer> distribution = new LinkedHashMap<>();
        for (Map.Entry<String, Integer> entry : entries) {
            distribution.put(entry.getKey(), entry.getValue());
        }
        return new MergeStats(profiles.size(), coverage, distribution);
    }
}
