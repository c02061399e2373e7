package com.netmig.pan2tf.model;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * A field of a category that names other objects.
 */
@Value
@Builder
public class ReferenceSpec {

    /**
     * Path of the value nodes relative to the object entry, e.g. {@code static/member}
     */
    String path;

    /**
     * Categories searched for the name, in order
     */
    @Singular
    List<Category> targets;

    @Builder.Default
    ReferencePolicy policy = ReferencePolicy.REQUIRED;

    @Singular("predefinedName")
    Set<String> predefined;

    /**
     * Shape of built-in names that are not listed one by one, e.g. region codes. May be null.
     */
    Pattern predefinedPattern;

    /**
     * Whether inline IP values are accepted in place of an object name
     */
    boolean literalAddress;

    /**
     * Path of the field holding the values, without a trailing member or entry step.
     */
    public String getFieldPath() {
        for (String suffix : List.of("/member", "/entry")) {
            if (path.endsWith(suffix)) {
                return path.substring(0, path.length() - suffix.length());
            }
        }
        return path;
    }

    public boolean isPredefined(String value) {
        return predefined.contains(value)
                || (predefinedPattern != null && predefinedPattern.matcher(value).matches());
    }

    public boolean isOptional() {
        return policy == ReferencePolicy.OPTIONAL;
    }
}
