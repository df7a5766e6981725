package io.cronagent.web;

import io.cronagent.CronService;
import io.cronagent.core.Job;
import io.cronagent.json.JobJson;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * REST surface of the cron service used by the dashboard. Jobs travel in their JSON wire form.
 */
@RestController
@RequestMapping("/api/v1/cron/jobs")
public class CronJobController {

    private final CronService cronService;

    public CronJobController(CronService cronService) {
        this.cronService = cronService;
    }

    @GetMapping
    public List<JobJson> list() {
        return cronService.list().stream().map(JobJson::from).toList();
    }

    @GetMapping("/{id}")
    public JobJson get(@PathVariable String id) {
        return JobJson.from(cronService.get(id));
    }

    /**
     * Create when the body has no id, otherwise apply the present fields to that job.
     */
    @PostMapping
    public JobJson save(@RequestBody JobJson body) {
        Job saved = isBlank(body.id())
                ? cronService.create(body.toDraft())
                : cronService.update(body.id(), body.toPatch());
        return JobJson.from(saved);
    }

    @DeleteMapping
    public ResponseEntity<Void> delete(@RequestParam String id) {
        cronService.delete(id);
        return ResponseEntity.noContent().build();
    }

    @PostMapping("/enable")
    public JobJson enable(@RequestBody EnableRequest body) {
        requireId(body.id());
        if (body.enabled() == null) {
            throw new IllegalArgumentException("enabled is required");
        }
        return JobJson.from(cronService.setEnabled(body.id(), body.enabled()));
    }

    @PostMapping("/test")
    public ResponseEntity<TestRunResponse> test(@RequestBody TestRequest body) {
        requireId(body.id());
        cronService.runNow(body.id());
        return ResponseEntity.status(HttpStatus.ACCEPTED).body(new TestRunResponse(body.id(), true));
    }

    public record EnableRequest(String id, Boolean enabled) {
    }

    public record TestRequest(String id) {
    }

    public record TestRunResponse(String id, boolean accepted) {
    }

    private static void requireId(String id) {
        if (isBlank(id)) {
            throw new IllegalArgumentException("id is required");
        }
    }

    private static boolean isBlank(String s) {
        return s == null || s.trim().isEmpty();
    }
}
