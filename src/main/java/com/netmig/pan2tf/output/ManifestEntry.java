package com.netmig.pan2tf.output;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * One line of emission-order.json
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class ManifestEntry {
    private int position;
    private String category;
    private String resourceType;
    private String identifier;
    private String name;
    private List<String> dependencies;
    private List<String> origins;
}
