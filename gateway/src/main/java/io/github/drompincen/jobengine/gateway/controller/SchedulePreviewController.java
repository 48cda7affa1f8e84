package io.github.drompincen.jobengine.gateway.controller;

import io.github.drompincen.jobengine.protocol.api.SchedulePreviewDto;
import io.github.drompincen.jobengine.runtime.authoring.JobAuthoringService;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
public class SchedulePreviewController {

    private final JobAuthoringService authoringService;

    public SchedulePreviewController(JobAuthoringService authoringService) {
        this.authoringService = authoringService;
    }

    @GetMapping("/api/schedules/preview")
    public SchedulePreviewDto preview(@RequestParam String cron,
                                      @RequestParam(required = false) String timezone,
                                      @RequestParam(required = false) Integer count) {
        return authoringService.previewSchedule(cron, timezone, count);
    }
}
