package com.waterresources.streamnet.config;

import com.waterresources.streamnet.model.TributaryOrder;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Settings shared by the network services. Defaults apply when the
 * {@code streamnet.network.*} properties are not set.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class NetworkSettings {

    @Builder.Default
    private TributaryOrder tributaryOrder = TributaryOrder.ADDED_FIRST;

    @Builder.Default
    private boolean treatDryAsNaturalFlow = false;

    @Builder.Default
    private String endNodeId = "END";

    @Builder.Default
    private double nodeSpacing = 1.0;

    @Builder.Default
    private double spacingFraction = 0.06;

    @Builder.Default
    private double clampMarginFraction = 0.05;

    @Builder.Default
    private double insertEpsilon = 0.001;
}
