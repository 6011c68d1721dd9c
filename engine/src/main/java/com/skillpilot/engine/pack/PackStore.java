package com.skillpilot.engine.pack;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.skillpilot.engine.skill.ErrorCode;
import com.skillpilot.engine.skill.ResolvedSkill;
import com.skillpilot.engine.skill.SkillDefinition;
import com.skillpilot.engine.skill.SkillDefinitionLoader;
import com.skillpilot.engine.skill.SkillRunException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Stream;

/**
 * Reads the on-disk pack store written by the pack installer.
 *
 * Layout:
 * <pre>
 *   {packs-dir}/{pack}/pack.yaml
 *   {packs-dir}/{pack}/.install.json
 *   {packs-dir}/{pack}/skills/{skill}/skill.yaml | compose.yaml
 * </pre>
 *
 * Nothing here is cached: every {@link #open()} rescans the directory.
 */
@Component
public class PackStore {

    private static final Logger log = LoggerFactory.getLogger(PackStore.class);

    static final String       INSTALL_RECORD = ".install.json";
    static final List<String> MANIFEST_FILES = List.of("pack.yaml", "pack.yml");

    private static final TypeReference<Map<String, Object>> JSON_OBJECT = new TypeReference<>() {};

    private final Path         packsDir;
    private final ObjectMapper json;

    public PackStore(@Value("${skillpilot.packs-dir}") Path packsDir, ObjectMapper objectMapper) {
        this.packsDir = packsDir;
        this.json     = objectMapper;
    }

    /** Scan every pack directory and return a snapshot for one invocation. */
    public SkillRegistry open() {
        List<InstalledPack> packs = new ArrayList<>();
        if (Files.isDirectory(packsDir)) {
            for (Path root : sortedDirectories(packsDir)) {
                packs.add(loadPack(root));
            }
        } else {
            log.debug("Packs directory {} does not exist; no skills installed", packsDir);
        }
        return new SkillRegistry(packs);
    }

    // ------------------------------------------------------------------
    // Single pack
    // ------------------------------------------------------------------

    public InstalledPack loadPack(Path root) {
        PackManifest  manifest = loadManifest(root).orElse(null);
        InstallRecord record   = readInstallRecord(root).orElse(null);
        String name = manifest != null && manifest.name() != null
                ? manifest.name()
                : root.getFileName().toString();
        return new InstalledPack(root, name, manifest, record, findSkills(root, name));
    }

    public Optional<PackManifest> loadManifest(Path root) {
        for (String candidate : MANIFEST_FILES) {
            Path file = root.resolve(candidate);
            if (!Files.isRegularFile(file)) continue;
            try {
                Map<String, Object> raw = SkillDefinitionLoader.readYamlObject(file);
                return Optional.of(json.convertValue(raw, PackManifest.class));
            } catch (SkillRunException | IllegalArgumentException e) {
                log.warn("Ignoring unreadable pack manifest {}: {}", file, e.getMessage());
                return Optional.empty();
            }
        }
        return Optional.empty();
    }

    public Optional<InstallRecord> readInstallRecord(Path root) {
        Path file = root.resolve(INSTALL_RECORD);
        if (!Files.isRegularFile(file)) return Optional.empty();
        try {
            InstallRecord record = json.readValue(file.toFile(), InstallRecord.class);
            if (record.schema() != null && !InstallRecord.SCHEMA.equals(record.schema())) {
                log.warn("Install record {} has unexpected schema '{}'", file, record.schema());
            }
            return Optional.of(record);
        } catch (IOException e) {
            log.warn("Ignoring broken install record {}: {}", file, e.getMessage());
            return Optional.empty();
        }
    }

    /**
     * Read a pack-relative JSON file that must contain an object
     * (entrypoint workflow bodies and default inputs).
     */
    public Map<String, Object> readJsonObject(Path packRoot, String relativePath) {
        Path file = packRoot.resolve(relativePath).normalize();
        if (!Files.isRegularFile(file)) {
            throw new SkillRunException(ErrorCode.SKILL_INVALID_DEFINITION,
                    "File " + relativePath + " is missing from pack " + packRoot.getFileName() + ".",
                    Map.of("path", file.toString()));
        }
        try {
            return json.readValue(file.toFile(), JSON_OBJECT);
        } catch (IOException e) {
            throw new SkillRunException(ErrorCode.SKILL_INVALID_DEFINITION,
                    "File " + relativePath + " must be a valid JSON object.",
                    Map.of("path", file.toString()), e);
        }
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private List<ResolvedSkill> findSkills(Path root, String packName) {
        Path skillsDir = root.resolve("skills");
        if (!Files.isDirectory(skillsDir)) return List.of();

        List<ResolvedSkill> skills = new ArrayList<>();
        for (Path dir : sortedDirectories(skillsDir)) {
            if (!SkillDefinitionLoader.isSkillDirectory(dir)) continue;
            try {
                SkillDefinition definition = SkillDefinitionLoader.load(dir);
                skills.add(new ResolvedSkill(dir, packName, root, definition));
            } catch (SkillRunException e) {
                log.debug("Skipping {}: {}", dir, e.getMessage());
            }
        }
        return skills;
    }

    private static List<Path> sortedDirectories(Path parent) {
        try (Stream<Path> entries = Files.list(parent)) {
            return entries.filter(Files::isDirectory)
                    .sorted(Comparator.comparing(p -> p.getFileName().toString()))
                    .toList();
        } catch (IOException e) {
            throw new SkillRunException(ErrorCode.REQUEST_FAILED,
                    "Could not list " + parent + ": " + e.getMessage(), e);
        }
    }
}
