package com.netmig.pan2tf.dedup;

import com.netmig.pan2tf.model.ObjectKey;
import com.netmig.pan2tf.model.ResolvedReference;
import com.netmig.pan2tf.resolve.Declaration;
import lombok.Getter;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * One logical object after deduplication: the representative declaration
 * (first in traversal order) and every declaration sharing its key.
 */
@Getter
public class ObjectDefinition {

    private final ObjectKey key;
    private final Declaration representative;
    private final Map<String, Object> fields;
    private final List<ResolvedReference> references;
    private final int ordinal;
    private final List<Declaration> declarations = new ArrayList<>();

    public ObjectDefinition(ObjectKey key, Declaration representative, Map<String, Object> fields,
                            List<ResolvedReference> references, int ordinal) {
        this.key = key;
        this.representative = representative;
        this.fields = fields;
        this.references = List.copyOf(references);
        this.ordinal = ordinal;
        this.declarations.add(representative);
    }

    void addDeclaration(Declaration declaration) {
        declarations.add(declaration);
    }

    public List<Declaration> getDeclarations() {
        return Collections.unmodifiableList(declarations);
    }

    public String getName() {
        return representative.getName();
    }
}
