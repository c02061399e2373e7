package com.netmig.pan2tf.exception;

import com.netmig.pan2tf.model.UnresolvedReference;

import java.util.List;
import java.util.stream.Collectors;

/**
 * One or more references name objects that no scope in the chain declares.
 * Carries every unresolved reference collected, not only the first.
 */
public class UnresolvedReferenceException extends ConversionException {

    private final List<UnresolvedReference> unresolved;

    public UnresolvedReferenceException(List<UnresolvedReference> unresolved) {
        super(buildMessage(unresolved));
        this.unresolved = List.copyOf(unresolved);
    }

    public List<UnresolvedReference> getUnresolved() {
        return unresolved;
    }

    private static String buildMessage(List<UnresolvedReference> unresolved) {
        return unresolved.size() + " unresolved reference(s): " + unresolved.stream()
                .map(UnresolvedReference::describe)
                .collect(Collectors.joining("; "));
    }
}
