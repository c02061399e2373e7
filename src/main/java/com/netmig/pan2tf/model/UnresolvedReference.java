package com.netmig.pan2tf.model;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;
import java.util.stream.Collectors;

/**
 * A reference that could not be satisfied, reported with its context
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class UnresolvedReference {

    private Category referrerCategory;
    private String referrerName;

    /**
     * Scope that declares the referring object, e.g. {@code device-group 'DG-Branch'}
     */
    private String scope;

    /**
     * Field holding the reference, null when the referrer is a stub declaration itself
     */
    private String fieldPath;
    private List<Category> targetCategories;
    private String missingName;

    /**
     * True when the name exists in the chain but only as pointer-only stubs
     */
    private boolean stubOnly;

    public String describe() {
        String targets = targetCategories.stream()
                .map(Category::getToken)
                .collect(Collectors.joining("/"));
        StringBuilder description = new StringBuilder()
                .append(targets).append(" '").append(missingName).append("'")
                .append(stubOnly ? " is only declared as a stub" : " is not declared in any visible scope");
        if (referrerCategory != null) {
            description.append(", referenced by ").append(referrerCategory.getToken())
                    .append(" '").append(referrerName).append("'");
            if (fieldPath != null) {
                description.append(" field ").append(fieldPath);
            }
        }
        return description.append(" in ").append(scope).toString();
    }
}
