package com.skillpilot.engine.pack;

import com.skillpilot.engine.skill.ResolvedSkill;

import java.nio.file.Path;
import java.util.List;
import java.util.Optional;

/**
 * One pack directory as seen at the start of an invocation.
 *
 * @param manifest      Null when the directory has no readable pack.yaml.
 * @param installRecord Null when the pack was never installed through the installer.
 * @param skills        Every loadable skill under {@code skills/}, sorted by directory name.
 */
public record InstalledPack(
        Path                root,
        String              name,
        PackManifest        manifest,
        InstallRecord       installRecord,
        List<ResolvedSkill> skills) {

    public InstalledPack {
        skills = skills == null ? List.of() : List.copyOf(skills);
    }

    public String directoryName() {
        return root.getFileName().toString();
    }

    public Optional<String> provisionedSkillWorkflow(String skillName) {
        if (installRecord == null) return Optional.empty();
        return nonBlank(installRecord.provisionedSkills().get(skillName));
    }

    public Optional<String> provisionedEntrypointWorkflow(String entrypointId) {
        if (installRecord == null) return Optional.empty();
        return nonBlank(installRecord.provisionedEntrypoints().get(entrypointId));
    }

    public Optional<PackEntrypoint> entrypoint(String id) {
        return manifest == null ? Optional.empty() : manifest.entrypoint(id);
    }

    private static Optional<String> nonBlank(String value) {
        return value == null || value.isBlank() ? Optional.empty() : Optional.of(value);
    }
}
