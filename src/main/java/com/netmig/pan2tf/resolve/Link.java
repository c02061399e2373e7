package com.netmig.pan2tf.resolve;

import com.netmig.pan2tf.model.ReferenceKind;
import lombok.Value;

/**
 * One reference value of a declaration and what it resolved to.
 * The target is set only for linked references.
 */
@Value
public class Link {
    String fieldPath;
    String value;
    ReferenceKind kind;
    Declaration target;

    public boolean isLinked() {
        return kind == ReferenceKind.LINKED;
    }

    /**
     * Stable text used when hashing, once the target hash is known.
     */
    public String canonical(String targetHash) {
        return fieldPath + "=" + value + "->" + kind + (targetHash != null ? ":" + targetHash : "");
    }
}
