package com.waterresources.streamnet.dto.network;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Location {

    private double x;
    private double y;

    public static Location of(double x, double y) {
        return new Location(x, y);
    }
}
