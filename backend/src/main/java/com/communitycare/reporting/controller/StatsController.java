package com.communitycare.reporting.controller;

import com.communitycare.reporting.auth.Actor;
import com.communitycare.reporting.auth.ActorResolver;
import com.communitycare.reporting.dto.ReportStatsDTO;
import com.communitycare.reporting.dto.UserReportStatsDTO;
import com.communitycare.reporting.service.ReportStatisticsService;
import org.springframework.web.bind.annotation.*;

@RestController
@RequestMapping("/api/stats")
@CrossOrigin(origins = "*")
public class StatsController {

    private final ReportStatisticsService statisticsService;
    private final ActorResolver actorResolver;

    public StatsController(ReportStatisticsService statisticsService, ActorResolver actorResolver) {
        this.statisticsService = statisticsService;
        this.actorResolver = actorResolver;
    }

    @GetMapping("/global")
    public ReportStatsDTO global(@RequestHeader(value = ActorResolver.ACTOR_HEADER, required = false) Long userId) {
        actorResolver.resolve(userId);
        return statisticsService.globalStats();
    }

    @GetMapping("/me")
    public UserReportStatsDTO mine(@RequestHeader(value = ActorResolver.ACTOR_HEADER, required = false) Long userId) {
        Actor actor = actorResolver.resolve(userId);
        return statisticsService.userStats(actor.id());
    }
}
