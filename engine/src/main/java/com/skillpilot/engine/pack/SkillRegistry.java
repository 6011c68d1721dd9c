package com.skillpilot.engine.pack;

import com.skillpilot.engine.skill.ErrorCode;
import com.skillpilot.engine.skill.ResolvedSkill;
import com.skillpilot.engine.skill.SkillRunException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Immutable view of every installed pack and its skills.
 *
 * Built by {@link PackStore#open()} once per invocation and passed down to
 * the executor, so a single run sees one consistent set of packs even if
 * the installer writes to disk concurrently.
 *
 * <p>Skill lookup order (first hit wins):
 * <ol>
 *   <li>Packs in directory-name order.</li>
 *   <li>Within a pack, the skill whose directory is named after the request.</li>
 *   <li>Then any skill in that pack whose declared name matches.</li>
 * </ol>
 */
public class SkillRegistry {

    private static final Logger log = LoggerFactory.getLogger(SkillRegistry.class);

    private final List<InstalledPack> packs;

    public SkillRegistry(List<InstalledPack> packs) {
        this.packs = List.copyOf(packs);
        for (InstalledPack pack : this.packs) {
            for (ResolvedSkill skill : pack.skills()) {
                log.debug("Found skill '{}' v{} [{}] in pack '{}'",
                        skill.name(), skill.skill().version(), skill.skill().kind().label(), pack.name());
            }
        }
    }

    // ------------------------------------------------------------------
    // Lookup
    // ------------------------------------------------------------------

    public Optional<ResolvedSkill> find(String name) {
        for (InstalledPack pack : packs) {
            Optional<ResolvedSkill> byDirectory = pack.skills().stream()
                    .filter(s -> s.directoryName().equals(name))
                    .findFirst();
            if (byDirectory.isPresent()) return byDirectory;

            Optional<ResolvedSkill> byName = pack.skills().stream()
                    .filter(s -> s.name().equals(name))
                    .findFirst();
            if (byName.isPresent()) return byName;
        }
        return Optional.empty();
    }

    public ResolvedSkill get(String name) {
        return find(name).orElseThrow(() -> new SkillRunException(ErrorCode.SKILL_NOT_FOUND,
                "Skill '" + name + "' not found in any installed pack.",
                Map.of("skill", name)));
    }

    /** Pack by manifest name, falling back to directory name. */
    public Optional<InstalledPack> pack(String name) {
        return packs.stream()
                .filter(p -> name.equals(p.name()) || name.equals(p.directoryName()))
                .findFirst();
    }

    /** The workflow id the installer created for this skill, if any. */
    public Optional<String> provisionedWorkflowId(ResolvedSkill skill) {
        return packs.stream()
                .filter(p -> p.root().equals(skill.packRoot()))
                .findFirst()
                .flatMap(p -> p.provisionedSkillWorkflow(skill.name()));
    }

    public List<InstalledPack> packs() {
        return packs;
    }

    /** All skills of all packs, in lookup order. */
    public List<ResolvedSkill> skills() {
        return packs.stream().flatMap(p -> p.skills().stream()).toList();
    }
}
