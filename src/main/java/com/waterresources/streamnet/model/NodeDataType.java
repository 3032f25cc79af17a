package com.waterresources.streamnet.model;

import java.util.function.Function;

/**
 * Secondary node attributes that {@code findNode(dataType, nodeType, value)} can match on.
 */
public enum NodeDataType {
    COMMON_ID(HydrologyNode::getCommonId),
    DESCRIPTION(HydrologyNode::getDescription),
    LINK(node -> node.getLink() > 0 ? String.valueOf(node.getLink()) : null);

    private final Function<HydrologyNode, String> extractor;

    NodeDataType(Function<HydrologyNode, String> extractor) {
        this.extractor = extractor;
    }

    public String valueOf(HydrologyNode node) {
        return extractor.apply(node);
    }
}
