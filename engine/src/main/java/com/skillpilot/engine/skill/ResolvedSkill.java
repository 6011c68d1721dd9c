package com.skillpilot.engine.skill;

import java.nio.file.Path;

/**
 * A skill definition together with where it was found.
 *
 * @param path     The skill's own directory (local step scripts are relative to it).
 * @param packName Manifest name of the owning pack, or its directory name.
 * @param packRoot Root directory of the owning pack.
 */
public record ResolvedSkill(Path path, String packName, Path packRoot, SkillDefinition skill) {

    public String name() {
        return skill.name();
    }

    public String directoryName() {
        return path.getFileName().toString();
    }
}
