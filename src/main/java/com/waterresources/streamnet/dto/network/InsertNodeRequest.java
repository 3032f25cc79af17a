package com.waterresources.streamnet.dto.network;

import com.waterresources.streamnet.model.NodeType;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Parameters for inserting a node. {@code upstreamId} is optional: when it names a
 * node directly upstream of {@code downstreamId} the new node is placed between the
 * two, otherwise the new node starts a new branch off {@code downstreamId}.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class InsertNodeRequest {

    private String id;
    private NodeType type;
    private String description;
    private boolean naturalFlow;
    private boolean importNode;
    private boolean dryRiver;
    private String upstreamId;
    private String downstreamId;
}
