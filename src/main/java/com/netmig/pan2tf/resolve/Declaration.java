package com.netmig.pan2tf.resolve;

import com.netmig.pan2tf.model.Category;
import com.netmig.pan2tf.model.ObjectRef;
import com.netmig.pan2tf.model.scope.ScopeChain;
import com.netmig.pan2tf.model.scope.ScopeFrame;
import com.netmig.pan2tf.model.tree.ConfigNode;
import com.netmig.pan2tf.model.tree.Placement;
import lombok.AllArgsConstructor;
import lombok.Getter;

/**
 * The effective authored declaration of one name in one scope frame.
 * Two declarations are equal when they sit in the same frame under the same category and name.
 */
@Getter
@AllArgsConstructor
public final class Declaration {

    private final ScopeFrame frame;
    private final Category category;
    private final String name;
    private final Placement placement;

    /**
     * Chain used to resolve this declaration's own references
     */
    private final ScopeChain chain;

    /**
     * Position in traversal order
     */
    private final int ordinal;

    public ConfigNode getNode() {
        return placement.getNode();
    }

    public ObjectRef toRef() {
        return new ObjectRef(category, name);
    }

    public String getId() {
        return frame.getId() + "|" + category.name() + "|" + name;
    }

    public String label() {
        return category.getToken() + " '" + name + "'";
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Declaration)) {
            return false;
        }
        return getId().equals(((Declaration) o).getId());
    }

    @Override
    public int hashCode() {
        return getId().hashCode();
    }

    @Override
    public String toString() {
        return label() + " in " + frame;
    }
}
