package com.waterresources.streamnet.dto.network;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Outcome of a location fill / interpolation pass.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class InterpolationResult {

    private int lookedUpCount;
    private int interpolatedCount;
    private int extrapolatedCount;
    private int clampedCount;
    private int unlocatedCount;

    @Builder.Default
    private List<NetworkAdvisory> advisories = new ArrayList<>();
}
