package com.netmig.pan2tf.resolve;

import com.netmig.pan2tf.model.ObjectRef;
import lombok.Value;

/**
 * An object name as seen from one scope, e.g. address 'addr-A' in device-group 'DG-Branch'.
 */
@Value
public class ScopedRef {
    String scopeId;
    ObjectRef ref;

    @Override
    public String toString() {
        return ref + " @ " + scopeId;
    }
}
