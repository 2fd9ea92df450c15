package com.shlawgathon.pulse.backend.controller;

import com.shlawgathon.pulse.backend.dto.TeamStatusResponse;
import com.shlawgathon.pulse.backend.model.DeveloperState;
import com.shlawgathon.pulse.backend.service.DeveloperStateAssembler;
import com.shlawgathon.pulse.backend.service.StatusInsightService;
import com.shlawgathon.pulse.backend.service.TeamStatusService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.Clock;
import java.util.List;

@RestController
@RequestMapping("/api/team")
@Tag(name = "Team Status", description = "Live developer status board")
public class TeamStatusController {

    private final TeamStatusService teamStatusService;
    private final StatusInsightService statusInsightService;
    private final Clock clock;

    public TeamStatusController(TeamStatusService teamStatusService,
            StatusInsightService statusInsightService,
            Clock clock) {
        this.teamStatusService = teamStatusService;
        this.statusInsightService = statusInsightService;
        this.clock = clock;
    }

    @GetMapping("/status")
    @Operation(summary = "Get team status",
            description = "Current developer states, blocked developers first. With enhanced=true the statuses "
                    + "come from an LLM reading of each developer's latest conversations")
    public ResponseEntity<TeamStatusResponse> getStatus(
            @RequestParam(defaultValue = "false") boolean enhanced,
            @RequestParam(required = false) Long cacheMinutes,
            @RequestParam(required = false) Integer maxRecords) {
        List<DeveloperState> states = teamStatusService.getDeveloperStates();
        if (enhanced) {
            states = statusInsightService.enhance(states, cacheMinutes, maxRecords);
        }
        return ResponseEntity.ok(toResponse(states));
    }

    @PostMapping("/refresh")
    @Operation(summary = "Refresh team status", description = "Re-fetch recent records and recompute every state")
    public ResponseEntity<TeamStatusResponse> refresh() {
        return ResponseEntity.ok(toResponse(teamStatusService.refresh()));
    }

    private TeamStatusResponse toResponse(List<DeveloperState> states) {
        return TeamStatusResponse.builder()
                .developers(states)
                .activeCount(states.size())
                .blockedCount((int) states.stream().filter(DeveloperStateAssembler::needsAttention).count())
                .generatedAt(clock.instant())
                .build();
    }
}
