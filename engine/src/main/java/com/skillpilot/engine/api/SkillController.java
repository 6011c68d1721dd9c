package com.skillpilot.engine.api;

import com.skillpilot.engine.api.dto.RunSkillRequest;
import com.skillpilot.engine.executor.ExecutionReport;
import com.skillpilot.engine.service.SkillDetail;
import com.skillpilot.engine.service.SkillRunService;
import com.skillpilot.engine.service.SkillSummary;
import com.skillpilot.engine.workflow.RunOptions;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * REST API over installed skills.
 *
 * GET  /skills                                : list every installed skill
 * GET  /skills/{name}                         : full definition of one skill
 * POST /skills/{name}/runs                    : run a skill and return its report
 * POST /packs/{pack}/entrypoints/{id}/runs    : run a pack entrypoint workflow
 *
 * Failures are rendered by {@link ApiExceptionHandler}.
 */
@RestController
public class SkillController {

    private final SkillRunService skillRunService;

    public SkillController(SkillRunService skillRunService) {
        this.skillRunService = skillRunService;
    }

    @GetMapping("/skills")
    public List<SkillSummary> listSkills() {
        return skillRunService.listSkills();
    }

    @GetMapping("/skills/{name}")
    public SkillDetail describeSkill(@PathVariable String name) {
        return skillRunService.describeSkill(name);
    }

    /**
     * Run a skill.
     *
     * Example:
     *   curl -X POST http://localhost:8080/skills/blog-pipeline/runs \
     *     -H "Content-Type: application/json" \
     *     -d '{"input":{"topic":"cats"},"timeoutMs":120000}'
     */
    @PostMapping("/skills/{name}/runs")
    public ExecutionReport runSkill(@PathVariable String name,
                                    @RequestBody(required = false) RunSkillRequest req) {
        RunSkillRequest body = req != null ? req : RunSkillRequest.empty();
        return skillRunService.runSkill(name, body.input(), optionsOf(body));
    }

    @PostMapping("/packs/{pack}/entrypoints/{id}/runs")
    public ExecutionReport runEntrypoint(@PathVariable String pack,
                                         @PathVariable String id,
                                         @RequestBody(required = false) RunSkillRequest req) {
        RunSkillRequest body = req != null ? req : RunSkillRequest.empty();
        return skillRunService.runEntrypoint(pack, id, body.input(), optionsOf(body));
    }

    private RunOptions optionsOf(RunSkillRequest body) {
        return skillRunService.options(body.waitForCompletion(), body.pollInterval(), body.timeout(),
                body.workspaceId(), body.validateRemotely());
    }
}
