package com.shlawgathon.pulse.backend.dto;

import com.shlawgathon.pulse.backend.model.DeveloperState;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TeamStatusResponse {

    @Builder.Default
    private List<DeveloperState> developers = new ArrayList<>();

    private int activeCount;

    private int blockedCount;

    private Instant generatedAt;
}
