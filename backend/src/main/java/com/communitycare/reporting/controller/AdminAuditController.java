package com.communitycare.reporting.controller;

import com.communitycare.reporting.auth.ActorResolver;
import com.communitycare.reporting.dto.AuditLogEntryDTO;
import com.communitycare.reporting.service.AuditLogService;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/admin/audit")
@CrossOrigin(origins = "*")
public class AdminAuditController {

    private final AuditLogService auditLogService;
    private final ActorResolver actorResolver;

    public AdminAuditController(AuditLogService auditLogService, ActorResolver actorResolver) {
        this.auditLogService = auditLogService;
        this.actorResolver = actorResolver;
    }

    @GetMapping
    public List<AuditLogEntryDTO> list(@RequestHeader(value = ActorResolver.ACTOR_HEADER, required = false) Long userId,
                                       @RequestParam(value = "limit", required = false) Integer limit) {
        return auditLogService.list(actorResolver.resolve(userId), limit);
    }

    @DeleteMapping
    public Map<String, Object> clear(@RequestHeader(value = ActorResolver.ACTOR_HEADER, required = false) Long userId) {
        long removed = auditLogService.clear(actorResolver.resolve(userId));
        return Map.of("removed", removed);
    }
}
