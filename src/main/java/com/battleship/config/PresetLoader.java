package com.battleship.config;

import tools.jackson.databind.ObjectMapper;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.io.Resource;
import org.springframework.core.io.support.PathMatchingResourcePatternResolver;
import org.springframework.stereotype.Component;

import jakarta.annotation.PostConstruct;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.*;
import java.util.*;
import java.util.stream.Stream;

/**
 * Loads all available board presets at startup.
 * <p>
 * Presets are loaded from two locations (in order):
 * <ol>
 *   <li>Classpath: {@code classpath:presets/*.json} – built-in presets (small, medium, big)</li>
 *   <li>External folder: {@code ./presets/} next to the running jar – user-defined presets</li>
 * </ol>
 * If an external preset has the same {@code id} as a built-in one, the external one wins.
 */
@Component
@Slf4j
public class PresetLoader {

    private final ObjectMapper objectMapper;

    /** All loaded presets keyed by their id. */
    @Getter
    private final Map<String, BoardPreset> presets = new LinkedHashMap<>();

    public PresetLoader(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    @PostConstruct
    public void loadPresets() {
        loadClasspathPresets();
        loadExternalPresets();

        if (presets.isEmpty()) {
            log.warn("No board presets found! A game cannot be created without at least one preset.");
        } else {
            log.info("Loaded {} preset(s): {}", presets.size(),
                    getAvailablePresets().stream().map(BoardPreset::id).toList());
        }
    }

    /**
     * Returns every loaded preset, smallest board first.
     */
    public List<BoardPreset> getAvailablePresets() {
        return presets.values().stream()
                .sorted(Comparator.comparingInt((BoardPreset p) -> p.rows() * p.cols())
                        .thenComparing(BoardPreset::id))
                .toList();
    }

    /**
     * Get a specific preset by its id (case-insensitive).
     *
     * @throws IllegalArgumentException if the preset id is unknown
     */
    public BoardPreset getPreset(String presetId) {
        BoardPreset preset = presetId == null ? null : presets.get(presetId.trim().toLowerCase());
        if (preset == null) {
            throw new IllegalArgumentException("Unknown preset: " + presetId
                    + ". Available presets: " + presets.keySet());
        }
        return preset;
    }

    // ── classpath presets ───────────────────────────────────────────────

    private void loadClasspathPresets() {
        try {
            var resolver = new PathMatchingResourcePatternResolver();
            Resource[] resources = resolver.getResources("classpath:presets/*.json");

            for (Resource resource : resources) {
                try (InputStream is = resource.getInputStream()) {
                    register(objectMapper.readValue(is, BoardPreset.class));
                    log.debug("Loaded built-in preset from {}", resource.getFilename());
                } catch (IOException | RuntimeException e) {
                    log.error("Failed to load classpath preset: {}", resource.getFilename(), e);
                }
            }
        } catch (IOException e) {
            log.warn("Could not scan classpath for presets: {}", e.getMessage());
        }
    }

    // ── external presets (./presets/ folder) ────────────────────────────

    private void loadExternalPresets() {
        Path externalDir = Paths.get("presets");
        if (!Files.isDirectory(externalDir)) {
            log.debug("No external presets directory found at '{}'", externalDir.toAbsolutePath());
            return;
        }

        try (Stream<Path> files = Files.list(externalDir)) {
            files.filter(p -> p.toString().endsWith(".json"))
                 .sorted()
                 .forEach(this::loadExternalPresetFile);
        } catch (IOException e) {
            log.error("Error reading external presets directory", e);
        }
    }

    private void loadExternalPresetFile(Path path) {
        try {
            register(objectMapper.readValue(path.toFile(), BoardPreset.class));
            log.info("Loaded custom preset from {}", path);
        } catch (Exception e) {
            log.error("Failed to load custom preset: {}", path, e);
        }
    }

    private void register(BoardPreset preset) {
        preset.validate();
        presets.put(preset.id().toLowerCase(), preset);
    }
}
