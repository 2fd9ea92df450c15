package com.shlawgathon.pulse.backend.websocket;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.shlawgathon.pulse.backend.model.DeveloperState;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.List;

/**
 * Frame pushed to team boards. {@code developer} is set on
 * {@code DEVELOPER_STATUS}, {@code developers} on {@code TEAM_REFRESHED}.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class TeamBoardMessage {

    private String type;
    private String userId;
    private DeveloperState developer;
    private List<DeveloperState> developers;
    private Instant sentAt;
}
