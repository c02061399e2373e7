package com.netmig.pan2tf.model;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

import static com.netmig.pan2tf.model.Category.*;

/**
 * Reference fields of every category: which paths of an entry name other
 * objects, and where those names are looked up.
 */
public final class ReferenceSpecs {

    private static final String ANY = "any";
    private static final Set<String> PREDEFINED_SERVICES =
            Set.of(ANY, "application-default", "service-http", "service-https");
    private static final Set<String> PREDEFINED_CRYPTO =
            Set.of("default", "Suite-B-GCM-128", "Suite-B-GCM-256");
    private static final Set<String> PREDEFINED_ADDRESSES = Set.of(ANY,
            "panw-highrisk-ip-list", "panw-known-ip-list", "panw-bulletproof-ip-list", "panw-torexit-ip-list");
    private static final Pattern REGION_CODE = Pattern.compile("[A-Z]{2}");
    private static final Category[] ADDRESS_TARGETS = {ADDRESS, ADDRESS_GROUP, REGION, EXTERNAL_LIST};

    private static final Map<Category, List<ReferenceSpec>> SPECS = new EnumMap<>(Category.class);

    static {
        List<ReferenceSpec> tagged = List.of(required("tag/member", TAG));
        SPECS.put(ADDRESS, tagged);
        SPECS.put(SERVICE, tagged);
        SPECS.put(ADDRESS_GROUP, List.of(
                required("static/member", ADDRESS, ADDRESS_GROUP),
                required("tag/member", TAG)));
        SPECS.put(SERVICE_GROUP, List.of(
                spec("members/member", SERVICE, SERVICE_GROUP)
                        .predefinedName("service-http").predefinedName("service-https").build(),
                required("tag/member", TAG)));
        SPECS.put(APPLICATION_GROUP, List.of(
                optional("members/member", APPLICATION_GROUP, APPLICATION_FILTER)));

        List<ReferenceSpec> groupProfiles = new ArrayList<>();
        profileSpecs("", groupProfiles);
        SPECS.put(PROFILE_GROUP, groupProfiles);

        SPECS.put(ETHERNET_INTERFACE, List.of(
                optional("layer3/interface-management-profile", INTERFACE_MANAGEMENT_PROFILE)));
        SPECS.put(ZONE, List.of(
                optional("network/layer3/member", ETHERNET_INTERFACE),
                optional("network/layer2/member", ETHERNET_INTERFACE),
                optional("network/virtual-wire/member", ETHERNET_INTERFACE),
                optional("network/tap/member", ETHERNET_INTERFACE),
                required("network/zone-protection-profile", ZONE_PROTECTION_PROFILE),
                optional("network/log-setting", LOG_FORWARDING_PROFILE)));
        SPECS.put(VIRTUAL_ROUTER, List.of(
                optional("interface/member", ETHERNET_INTERFACE)));
        SPECS.put(IKE_GATEWAY, List.of(
                spec("protocol/ikev1/ike-crypto-profile", IKE_CRYPTO_PROFILE).predefined(PREDEFINED_CRYPTO).build(),
                spec("protocol/ikev2/ike-crypto-profile", IKE_CRYPTO_PROFILE).predefined(PREDEFINED_CRYPTO).build(),
                optional("local-address/interface", ETHERNET_INTERFACE)));
        SPECS.put(IPSEC_TUNNEL, List.of(
                required("auto-key/ike-gateway/entry", IKE_GATEWAY),
                spec("auto-key/ipsec-crypto-profile", IPSEC_CRYPTO_PROFILE).predefined(PREDEFINED_CRYPTO).build(),
                spec("tunnel-monitor/tunnel-monitor-profile", TUNNEL_MONITOR_PROFILE)
                        .policy(ReferencePolicy.OPTIONAL).predefinedName("default").build(),
                optional("tunnel-interface", ETHERNET_INTERFACE)));

        List<ReferenceSpec> security = new ArrayList<>(ruleCommon("service/member"));
        security.add(spec("application/member", APPLICATION_GROUP, APPLICATION_FILTER)
                .policy(ReferencePolicy.OPTIONAL).predefinedName(ANY).build());
        security.add(spec("category/member", CUSTOM_URL_CATEGORY)
                .policy(ReferencePolicy.OPTIONAL).predefinedName(ANY).build());
        security.add(spec("profile-setting/group/member", PROFILE_GROUP).predefinedName("default").build());
        profileSpecs("profile-setting/profiles/", security);
        security.add(required("schedule", SCHEDULE));
        security.add(optional("log-setting", LOG_FORWARDING_PROFILE));
        SPECS.put(SECURITY_RULE, security);

        List<ReferenceSpec> nat = new ArrayList<>(ruleCommon("service"));
        nat.add(spec("to-interface", ETHERNET_INTERFACE).policy(ReferencePolicy.OPTIONAL).predefinedName(ANY).build());
        nat.add(translated("source-translation/dynamic-ip-and-port/translated-address/member"));
        nat.add(optional("source-translation/dynamic-ip-and-port/interface-address/interface", ETHERNET_INTERFACE));
        nat.add(translated("source-translation/dynamic-ip/translated-address/member"));
        nat.add(translated("source-translation/static-ip/translated-address"));
        nat.add(translated("destination-translation/translated-address"));
        SPECS.put(NAT_RULE, nat);

        List<ReferenceSpec> decryption = new ArrayList<>(ruleCommon("service/member"));
        decryption.add(spec("category/member", CUSTOM_URL_CATEGORY)
                .policy(ReferencePolicy.OPTIONAL).predefinedName(ANY).build());
        SPECS.put(DECRYPTION_RULE, decryption);

        SPECS.put(PBF_RULE, List.of(
                spec("from/zone/member", ZONE).policy(ReferencePolicy.OPTIONAL).predefinedName(ANY).build(),
                addresses("source/member"),
                addresses("destination/member"),
                services("service/member"),
                spec("application/member", APPLICATION_GROUP, APPLICATION_FILTER)
                        .policy(ReferencePolicy.OPTIONAL).predefinedName(ANY).build(),
                required("tag/member", TAG),
                optional("action/forward/egress-interface", ETHERNET_INTERFACE)));

        SPECS.put(APPLICATION_OVERRIDE_RULE, ruleCommon(null));
    }

    private ReferenceSpecs() {
    }

    /**
     * Reference fields of a category, empty when it names no other objects.
     */
    public static List<ReferenceSpec> of(Category category) {
        return Collections.unmodifiableList(SPECS.getOrDefault(category, List.of()));
    }

    private static List<ReferenceSpec> ruleCommon(String servicePath) {
        List<ReferenceSpec> specs = new ArrayList<>();
        specs.add(zones("from/member"));
        specs.add(zones("to/member"));
        specs.add(addresses("source/member"));
        specs.add(addresses("destination/member"));
        if (servicePath != null) {
            specs.add(services(servicePath));
        }
        specs.add(required("tag/member", TAG));
        return specs;
    }

    private static void profileSpecs(String prefix, List<ReferenceSpec> specs) {
        Map<String, Category> profiles = Map.of(
                "virus", ANTIVIRUS_PROFILE,
                "spyware", ANTI_SPYWARE_PROFILE,
                "vulnerability", VULNERABILITY_PROFILE,
                "url-filtering", URL_FILTERING_PROFILE,
                "file-blocking", FILE_BLOCKING_PROFILE,
                "wildfire-analysis", WILDFIRE_ANALYSIS_PROFILE);
        for (String type : List.of("virus", "spyware", "vulnerability", "url-filtering",
                "file-blocking", "wildfire-analysis")) {
            specs.add(spec(prefix + type + "/member", profiles.get(type))
                    .policy(ReferencePolicy.OPTIONAL)
                    .predefinedName("default")
                    .predefinedName("strict")
                    .build());
        }
    }

    private static ReferenceSpec zones(String path) {
        return spec(path, ZONE).policy(ReferencePolicy.OPTIONAL).predefinedName(ANY).build();
    }

    private static ReferenceSpec addresses(String path) {
        return spec(path, ADDRESS_TARGETS).predefined(PREDEFINED_ADDRESSES).predefinedPattern(REGION_CODE)
                .literalAddress(true).build();
    }

    private static ReferenceSpec services(String path) {
        return spec(path, SERVICE, SERVICE_GROUP).predefined(PREDEFINED_SERVICES).build();
    }

    private static ReferenceSpec translated(String path) {
        return spec(path, ADDRESS, ADDRESS_GROUP).literalAddress(true).build();
    }

    private static ReferenceSpec required(String path, Category... targets) {
        return spec(path, targets).build();
    }

    private static ReferenceSpec optional(String path, Category... targets) {
        return spec(path, targets).policy(ReferencePolicy.OPTIONAL).build();
    }

    private static ReferenceSpec.ReferenceSpecBuilder spec(String path, Category... targets) {
        return ReferenceSpec.builder().path(path).targets(Arrays.asList(targets));
    }
}
