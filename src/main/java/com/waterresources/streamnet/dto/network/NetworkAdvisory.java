package com.waterresources.streamnet.dto.network;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Diagnostic produced alongside a successful operation. Never blocks the operation.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class NetworkAdvisory {

    public enum AdvisoryType {
        DUPLICATE_ID,           // requested id collided, node was renamed
        LOCATION_INTERPOLATED,
        LOCATION_EXTRAPOLATED,
        LOCATION_CLAMPED,       // moved back inside the layout bounds
        TYPE_CONVERTED          // legacy node type converted
    }

    private AdvisoryType type;
    private String nodeId;
    private String message;
}
