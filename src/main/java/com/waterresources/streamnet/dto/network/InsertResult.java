package com.waterresources.streamnet.dto.network;

import com.waterresources.streamnet.model.HydrologyNode;
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
public class InsertResult {

    private HydrologyNode node;
    private String requestedId;

    @Builder.Default
    private List<NetworkAdvisory> advisories = new ArrayList<>();

    /**
     * True when the requested id was already taken and the node got a suffixed id.
     */
    public boolean isRenamed() {
        return node != null && !node.getCommonId().equals(requestedId);
    }
}
