package com.companyintel.profiles.pipeline.persistence;

import com.companyintel.profiles.pipeline.model.CompanyDetailView;
import com.companyintel.profiles.pipeline.model.CompanyProfile;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.stereotype.Repository;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * File-backed storage for pipeline artifacts. Every write goes to a sibling temp file first
 * and is then moved into place, so readers never see a half-written artifact.
 */
@Repository
public class ProfileFileRepository {
    private static final TypeReference<List<Map<String, Object>>> PROFILE_MAPS = new TypeReference<>() {
    };
    private static final TypeReference<List<CompanyProfile>> PROFILES = new TypeReference<>() {
    };

    private final ObjectMapper objectMapper;

    public ProfileFileRepository(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    /**
     * Loosely typed read: values are whatever the JSON holds (strings, numbers, arrays, null).
     */
    public List<Map<String, Object>> readProfileMaps(Path file) throws IOException {
        return objectMapper.readValue(file.toFile(), PROFILE_MAPS);
    }

    public List<CompanyProfile> readProfiles(Path file) throws IOException {
        return objectMapper.readValue(file.toFile(), PROFILES);
    }

    public void writeProfiles(Path file, List<CompanyProfile> profiles) throws IOException {
        writeAtomically(file, objectMapper.writeValueAsBytes(profiles));
    }

    public void writeFailures(Path file, List<String> domains) throws IOException {
        writeAtomically(file, String.join("\n", domains).getBytes(StandardCharsets.UTF_8));
    }

    public void writeDetail(Path detailsDir, CompanyDetailView view) throws IOException {
        writeAtomically(detailFile(detailsDir, view.profile().domain()), objectMapper.writeValueAsBytes(view));
    }

    public Optional<CompanyDetailView> readDetail(Path detailsDir, String domain) throws IOException {
        Path file = detailFile(detailsDir, domain);
        if (!Files.isRegularFile(file)) {
            return Optional.empty();
        }
        return Optional.of(objectMapper.readValue(file.toFile(), CompanyDetailView.class));
    }

    static Path detailFile(Path detailsDir, String domain) {
        String safeName = domain.replaceAll("[^A-Za-z0-9._-]", "_");
        return detailsDir.resolve(safeName + ".json");
    }

    private void writeAtomically(Path file, byte[] payload) throws IOException {
        Path parent = file.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        Path temp = file.resolveSibling(file.getFileName() + ".tmp");
        Files.write(temp, payload);
        Files.move(temp, file, StandardCopyOption.REPLACE_EXISTING);
    }
}
