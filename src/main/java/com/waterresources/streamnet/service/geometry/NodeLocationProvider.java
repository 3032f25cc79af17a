package com.waterresources.streamnet.service.geometry;

import com.waterresources.streamnet.dto.network.Location;

import java.util.Optional;

/**
 * Source of known node coordinates, typically a station database.
 */
public interface NodeLocationProvider {

    Optional<Location> lookupLocation(String nodeId);
}
