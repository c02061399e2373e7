package com.netmig.pan2tf.model;

import lombok.Value;

/**
 * One reference value of a canonical object after resolution
 */
@Value
public class ResolvedReference {

    /**
     * Field path the value sits under, e.g. {@code static} or {@code auto-key/ike-gateway}
     */
    String fieldPath;

    /**
     * The value as written in the export
     */
    String value;

    ReferenceKind kind;

    /**
     * Category of the referent, null unless linked
     */
    Category targetCategory;

    /**
     * Key of the referent, null unless linked
     */
    ObjectKey targetKey;

    /**
     * Target identifier of the referent, null until names are sanitised
     */
    String targetIdentifier;

    public boolean isLinked() {
        return kind == ReferenceKind.LINKED;
    }
}
