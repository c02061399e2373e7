package com.netmig.pan2tf.model;

import lombok.Value;

/**
 * Identity of a canonical object: its category and structural content hash.
 */
@Value
public class ObjectKey {
    Category category;
    String hash;

    /**
     * First twelve hex digits, enough to tell keys apart in logs.
     */
    public String shortHash() {
        return hash.length() > 12 ? hash.substring(0, 12) : hash;
    }

    @Override
    public String toString() {
        return category.getToken() + "#" + shortHash();
    }
}
