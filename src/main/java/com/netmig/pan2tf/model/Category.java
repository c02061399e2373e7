package com.netmig.pan2tf.model;

import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Object categories handled by the converter.
 * <p>
 * Each category knows where its entries live relative to a scope frame base,
 * its emission priority (lower first), the Terraform resource type it becomes
 * (null when the provider has no resource for it and the object is written as a
 * manual-configuration note) and the content fields whose absence marks a stub.
 */
public enum Category {

    TAG("tag", 0, "panos_administrative_tag", List.of("tag")),
    REGION("region", 10, null, List.of("region")),
    EXTERNAL_LIST("external_list", 10, "panos_external_list", List.of("external-list")),
    SCHEDULE("schedule", 10, null, List.of("schedule")),
    CUSTOM_URL_CATEGORY("custom_url_category", 10, "panos_custom_url_category",
            List.of("profiles/custom-url-category")),

    ADDRESS("address", 20, "panos_address_object", List.of("address"),
            Set.of("ip-netmask", "ip-range", "ip-wildcard", "fqdn")),
    SERVICE("service", 20, "panos_service_object", List.of("service"), Set.of("protocol")),
    APPLICATION_FILTER("application_filter", 20, "panos_application_filter", List.of("application-filter")),

    ADDRESS_GROUP("address_group", 30, "panos_address_group", List.of("address-group"),
            Set.of("static", "dynamic")),
    SERVICE_GROUP("service_group", 30, "panos_service_group", List.of("service-group"), Set.of("members")),
    APPLICATION_GROUP("application_group", 30, "panos_application_group", List.of("application-group"),
            Set.of("members")),

    ANTIVIRUS_PROFILE("antivirus_profile", 40, "panos_antivirus_security_profile", List.of("profiles/virus")),
    ANTI_SPYWARE_PROFILE("anti_spyware_profile", 40, "panos_anti_spyware_security_profile",
            List.of("profiles/spyware")),
    VULNERABILITY_PROFILE("vulnerability_profile", 40, "panos_vulnerability_security_profile",
            List.of("profiles/vulnerability")),
    URL_FILTERING_PROFILE("url_filtering_profile", 40, "panos_url_filtering_security_profile",
            List.of("profiles/url-filtering")),
    FILE_BLOCKING_PROFILE("file_blocking_profile", 40, "panos_file_blocking_security_profile",
            List.of("profiles/file-blocking")),
    WILDFIRE_ANALYSIS_PROFILE("wildfire_analysis_profile", 40, "panos_wildfire_analysis_security_profile",
            List.of("profiles/wildfire-analysis")),
    LOG_FORWARDING_PROFILE("log_forwarding_profile", 40, null, List.of("log-settings/profiles")),
    PROFILE_GROUP("profile_group", 45, "panos_security_profile_group", List.of("profile-group")),

    IKE_CRYPTO_PROFILE("ike_crypto_profile", 50, "panos_ike_crypto_profile",
            List.of("network/ike/crypto-profiles/ike-crypto-profiles")),
    IPSEC_CRYPTO_PROFILE("ipsec_crypto_profile", 50, "panos_ipsec_crypto_profile",
            List.of("network/ike/crypto-profiles/ipsec-crypto-profiles")),
    TUNNEL_MONITOR_PROFILE("tunnel_monitor_profile", 50, null, List.of("network/profiles/monitor-profile")),
    ZONE_PROTECTION_PROFILE("zone_protection_profile", 50, null,
            List.of("network/profiles/zone-protection-profile")),
    INTERFACE_MANAGEMENT_PROFILE("interface_management_profile", 50, "panos_management_profile",
            List.of("network/profiles/interface-management-profile")),

    ETHERNET_INTERFACE("ethernet_interface", 60, "panos_ethernet_interface", List.of("network/interface/ethernet")),
    ZONE("zone", 70, "panos_zone", List.of("vsys/entry/zone")),
    VIRTUAL_ROUTER("virtual_router", 70, "panos_virtual_router", List.of("network/virtual-router")),
    IKE_GATEWAY("ike_gateway", 80, "panos_ike_gateway", List.of("network/ike/gateway")),
    IPSEC_TUNNEL("ipsec_tunnel", 90, "panos_ipsec_tunnel", List.of("network/tunnel/ipsec")),

    SECURITY_RULE("security_rule", 100, "panos_security_rule_group", rulePaths("security")),
    NAT_RULE("nat_rule", 110, "panos_nat_rule_group", rulePaths("nat")),
    DECRYPTION_RULE("decryption_rule", 120, null, rulePaths("decryption")),
    PBF_RULE("pbf_rule", 130, null, rulePaths("pbf")),
    APPLICATION_OVERRIDE_RULE("application_override_rule", 140, null, rulePaths("application-override"));

    /**
     * Fields describing an object without changing what it is
     */
    public static final Set<String> METADATA_FIELDS = Set.of("description", "comments");

    public static final String PRE_RULEBASE = "pre-rulebase";
    public static final String POST_RULEBASE = "post-rulebase";
    public static final String LOCAL_RULEBASE = "rulebase";

    private final String token;
    private final int priority;
    private final String resourceType;
    private final List<String> paths;
    private final Set<String> contentFields;

    Category(String token, int priority, String resourceType, List<String> paths) {
        this(token, priority, resourceType, paths, Set.of());
    }

    Category(String token, int priority, String resourceType, List<String> paths, Set<String> contentFields) {
        this.token = token;
        this.priority = priority;
        this.resourceType = resourceType;
        this.paths = paths;
        this.contentFields = contentFields;
    }

    private static List<String> rulePaths(String type) {
        return List.of(PRE_RULEBASE + "/" + type + "/rules",
                POST_RULEBASE + "/" + type + "/rules",
                LOCAL_RULEBASE + "/" + type + "/rules");
    }

    public String getToken() {
        return token;
    }

    public int getPriority() {
        return priority;
    }

    public String getResourceType() {
        return resourceType;
    }

    /**
     * False when the provider has no resource for this category.
     */
    public boolean isManaged() {
        return resourceType != null;
    }

    public List<String> getPaths() {
        return paths;
    }

    public Set<String> getContentFields() {
        return contentFields;
    }

    public boolean isRule() {
        return paths.get(0).startsWith(PRE_RULEBASE + "/");
    }

    /**
     * Category whose entries live at a path relative to a scope base.
     */
    public static Optional<Category> forPath(String path) {
        for (Category category : values()) {
            if (category.paths.contains(path)) {
                return Optional.of(category);
            }
        }
        return Optional.empty();
    }

    /**
     * Rule base label for a matched path: pre, post or local. Null for non-rule paths.
     */
    public static String rulebaseOf(String path) {
        if (path.startsWith(PRE_RULEBASE + "/")) {
            return "pre";
        }
        if (path.startsWith(POST_RULEBASE + "/")) {
            return "post";
        }
        if (path.startsWith(LOCAL_RULEBASE + "/")) {
            return "local";
        }
        return null;
    }
}
