package com.netmig.pan2tf.config;

import com.netmig.pan2tf.model.Category;
import com.netmig.pan2tf.naming.NamespaceMode;
import lombok.Data;

import java.util.ArrayList;
import java.util.List;

/**
 * Settings of a conversion run, read from conversion-config.yaml
 */
@Data
public class ConversionConfig {

    /**
     * Whether identifiers must be unique per resource type or across all types
     */
    private NamespaceMode namespaceMode = NamespaceMode.PER_CATEGORY;

    /**
     * Numeric suffixes tried for a colliding identifier before giving up
     */
    private int maxSuffixAttempts = 1000;

    /**
     * Fail the run on the first batch of unresolved references instead of
     * converting everything that did resolve
     */
    private boolean abortOnUnresolved = false;

    /**
     * Prefixes stripped from device group names when looking for their template
     */
    private List<String> templatePrefixes = new ArrayList<>(List.of("DG-", "dg-"));

    /**
     * Categories left out of the output. References to them are kept as plain names.
     */
    private List<Category> excludedCategories = new ArrayList<>();

    /**
     * Written in place of pre-shared keys, which exports never carry in clear text
     */
    private String secretPlaceholder = "***CHANGE_ME***";

    /**
     * Version constraint of the panos provider in provider.tf
     */
    private String providerVersion = "~> 2.0.7";

    /**
     * Version attribute of the root element of partition files
     */
    private String partitionVersion = "10.0.0";
}
