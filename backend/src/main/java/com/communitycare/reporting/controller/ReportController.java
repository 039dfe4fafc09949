package com.communitycare.reporting.controller;

import com.communitycare.reporting.auth.ActorResolver;
import com.communitycare.reporting.dto.ReportDTO;
import com.communitycare.reporting.dto.ReportDraft;
import com.communitycare.reporting.dto.StatusUpdateRequest;
import com.communitycare.reporting.service.ReportLifecycleService;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/api/reports")
@CrossOrigin(origins = "*")
public class ReportController {

    private final ReportLifecycleService lifecycleService;
    private final ActorResolver actorResolver;

    public ReportController(ReportLifecycleService lifecycleService, ActorResolver actorResolver) {
        this.lifecycleService = lifecycleService;
        this.actorResolver = actorResolver;
    }

    @PostMapping
    public ResponseEntity<ReportDTO> submit(@RequestHeader(value = ActorResolver.ACTOR_HEADER, required = false) Long userId,
                                            @RequestBody ReportDraft draft) {
        ReportDTO created = lifecycleService.submitReport(actorResolver.resolve(userId), draft);
        return ResponseEntity.status(HttpStatus.CREATED).body(created);
    }

    @GetMapping
    public List<ReportDTO> list(@RequestHeader(value = ActorResolver.ACTOR_HEADER, required = false) Long userId,
                                @RequestParam(value = "scope", defaultValue = "mine") String scope) {
        return lifecycleService.listReports(actorResolver.resolve(userId), ReportLifecycleService.Scope.parse(scope));
    }

    @GetMapping("/{id}")
    public ReportDTO get(@RequestHeader(value = ActorResolver.ACTOR_HEADER, required = false) Long userId,
                         @PathVariable("id") Long reportId) {
        return lifecycleService.getReport(actorResolver.resolve(userId), reportId);
    }

    @PutMapping("/{id}/status")
    public ReportDTO updateStatus(@RequestHeader(value = ActorResolver.ACTOR_HEADER, required = false) Long userId,
                                  @PathVariable("id") Long reportId,
                                  @RequestBody StatusUpdateRequest request) {
        return lifecycleService.transitionStatus(actorResolver.resolve(userId), reportId,
                request != null ? request.getStatus() : null);
    }

    @DeleteMapping("/{id}")
    public ResponseEntity<Void> delete(@RequestHeader(value = ActorResolver.ACTOR_HEADER, required = false) Long userId,
                                       @PathVariable("id") Long reportId) {
        lifecycleService.deleteReport(actorResolver.resolve(userId), reportId);
        return ResponseEntity.noContent().build();
    }
}
