package com.netmig.pan2tf.resolve;

import com.netmig.pan2tf.model.UnresolvedReference;
import lombok.Value;

import java.util.List;

/**
 * References of one declaration after resolution, with the ones that failed
 */
@Value
public class Resolution {
    Declaration declaration;
    List<Link> links;
    List<UnresolvedReference> errors;

    public boolean hasErrors() {
        return !errors.isEmpty();
    }
}
