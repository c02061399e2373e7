package com.netmig.pan2tf.model;

import lombok.Value;

/**
 * A name-only pointer to an object of one category.
 */
@Value
public class ObjectRef {
    Category category;
    String name;

    @Override
    public String toString() {
        return category.getToken() + " '" + name + "'";
    }
}
