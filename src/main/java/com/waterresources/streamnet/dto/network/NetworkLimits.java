package com.waterresources.streamnet.dto.network;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Axis-aligned layout bounds: left x, bottom y, right x, top y.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class NetworkLimits {

    private double leftX;
    private double bottomY;
    private double rightX;
    private double topY;

    public double getWidth() {
        return rightX - leftX;
    }

    public double getHeight() {
        return topY - bottomY;
    }
}
