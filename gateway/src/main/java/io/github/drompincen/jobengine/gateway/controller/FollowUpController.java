package io.github.drompincen.jobengine.gateway.controller;

import io.github.drompincen.jobengine.protocol.api.CreateFollowUpRequest;
import io.github.drompincen.jobengine.protocol.api.FollowUpDto;
import io.github.drompincen.jobengine.runtime.authoring.FollowUpService;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;

@RestController
public class FollowUpController {

    private final FollowUpService followUpService;

    public FollowUpController(FollowUpService followUpService) {
        this.followUpService = followUpService;
    }

    @PostMapping("/api/owners/{ownerId}/tasks/{taskId}/follow-ups")
    public ResponseEntity<FollowUpDto> create(@PathVariable String ownerId, @PathVariable String taskId,
                                              @RequestBody CreateFollowUpRequest req) {
        return ResponseEntity.status(HttpStatus.CREATED).body(followUpService.createFollowUp(ownerId, taskId, req));
    }
}
