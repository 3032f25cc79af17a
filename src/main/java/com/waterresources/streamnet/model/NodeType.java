package com.waterresources.streamnet.model;

import java.util.EnumSet;
import java.util.Locale;
import java.util.Set;

/**
 * Hydrologic element types that can appear in a stream network.
 */
public enum NodeType {
    BLANK("BLK", "BLANK"),
    DIVERSION("DIV", "DIV"),
    STREAMFLOW("FLO", "FLOW"),
    CONFLUENCE("CON", "CONFL"),
    INSTREAM_FLOW("ISF", "ISF"),
    RESERVOIR("RES", "RES"),
    IMPORT("IMP", "IMPORT"),
    BASEFLOW("BFL", "BFL"), // legacy, converted to OTHER + natural flow
    END("END", "END"),
    OTHER("OTH", "OTH"),
    UNKNOWN("UNK", "UNKNOWN"),
    STREAM("STR", "STREAM"),
    LABEL("LAB", "LABEL"),
    FORMULA("FOR", "FORMULA"),
    WELL("WEL", "WELL"),
    XCONFLUENCE("XCN", "XCONFL"),
    DIVERSION_AND_WELL("D&W", "D&W"),
    PLAN("PLN", "PLAN");

    private static final Set<NodeType> DECORATIVE =
            EnumSet.of(BLANK, CONFLUENCE, XCONFLUENCE, LABEL, STREAM, FORMULA);

    private static final Set<NodeType> REAL =
            EnumSet.of(STREAMFLOW, DIVERSION, DIVERSION_AND_WELL, RESERVOIR, INSTREAM_FLOW, WELL, OTHER, PLAN);

    private final String abbreviation;
    private final String displayName;

    NodeType(String abbreviation, String displayName) {
        this.abbreviation = abbreviation;
        this.displayName = displayName;
    }

    public String getAbbreviation() {
        return abbreviation;
    }

    public String getDisplayName() {
        return displayName;
    }

    /**
     * Confluence markers join reaches but are not physical stations.
     */
    public boolean isConfluence() {
        return this == CONFLUENCE || this == XCONFLUENCE;
    }

    /**
     * Types that only exist to shape the drawn network.
     */
    public boolean isDecorative() {
        return DECORATIVE.contains(this);
    }

    /**
     * Types that represent a physical station with data behind it.
     */
    public boolean isReal() {
        return REAL.contains(this);
    }

    /**
     * Resolve a type from its enum name, abbreviation, display name or one of the
     * legacy aliases, case-insensitive. Returns null if nothing matches.
     */
    public static NodeType lookup(String value) {
        if (value == null) return null;
        String v = value.trim();
        for (NodeType type : values()) {
            if (type.name().equalsIgnoreCase(v.replace(" ", "_"))
                    || type.abbreviation.equalsIgnoreCase(v)
                    || type.displayName.equalsIgnoreCase(v)) {
                return type;
            }
        }
        switch (v.toLowerCase(Locale.ROOT)) {
            case "diversion":
                return DIVERSION;
            case "dw":
            case "diversionandwell":
                return DIVERSION_AND_WELL;
            case "station":
                return STREAMFLOW;
            case "instream flow":
            case "minflow":
                return INSTREAM_FLOW;
            case "string":
                return LABEL;
            case "streamtop":
            case "stream top":
                return STREAM;
            default:
                return null;
        }
    }
}
