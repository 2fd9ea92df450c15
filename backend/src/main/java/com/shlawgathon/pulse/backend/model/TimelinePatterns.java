package com.shlawgathon.pulse.backend.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TimelinePatterns {

    /**
     * Time slot with the most events, e.g. "Morning".
     */
    private String peakTime;

    private String workStyle;

    @Builder.Default
    private List<String> challenges = new ArrayList<>();

    @Builder.Default
    private List<String> strengths = new ArrayList<>();
}
