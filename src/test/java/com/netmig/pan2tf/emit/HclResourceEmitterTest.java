package com.netmig.pan2tf.emit;

import com.netmig.pan2tf.model.CanonicalObject;
import com.netmig.pan2tf.model.Category;
import com.netmig.pan2tf.model.ObjectKey;
import com.netmig.pan2tf.model.ReferenceKind;
import com.netmig.pan2tf.model.ResolvedReference;
import org.junit.jupiter.api.*;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class HclResourceEmitterTest {

    private final HclResourceEmitter emitter = new HclResourceEmitter("***CHANGE_ME***");

    @Test
    @DisplayName("Address object with a linked tag")
    void testAddressObject() {
        ObjectKey tagKey = new ObjectKey(Category.TAG, "t");
        Map<String, Object> fields = new LinkedHashMap<>();
        fields.put("ip-netmask", "10.0.0.53/32");
        fields.put("tag", List.of("web", "ops"));
        CanonicalObject address = CanonicalObject.builder()
                .key(new ObjectKey(Category.ADDRESS, "a"))
                .identifier("dns_server")
                .name("dns-server")
                .fields(fields)
                .reference(new ResolvedReference("tag", "web", ReferenceKind.LINKED, Category.TAG, tagKey, "web"))
                .reference(new ResolvedReference("tag", "ops", ReferenceKind.EXTERNAL, null, null, null))
                .dependency(tagKey)
                .origin("shared")
                .build();

        String hcl = emitter.emit(address);

        assertTrue(hcl.startsWith("# Declared in: shared\n"), hcl);
        assertTrue(hcl.contains("resource \"panos_address_object\" \"dns_server\" {"), hcl);
        assertTrue(hcl.contains("  name = \"dns-server\""), hcl);
        assertTrue(hcl.contains("  ip_netmask = \"10.0.0.53/32\""), hcl);
        assertTrue(hcl.contains("  tag = [panos_administrative_tag.web.name, \"ops\"]"), hcl);
        assertTrue(hcl.endsWith("}\n"));
    }

    @Test
    @DisplayName("Rules are wrapped in a rule group")
    void testRuleGroup() {
        Map<String, Object> fields = new LinkedHashMap<>();
        fields.put("from", List.of("trust"));
        fields.put("action", "allow");
        fields.put("rulebase", "pre");
        CanonicalObject rule = CanonicalObject.builder()
                .key(new ObjectKey(Category.SECURITY_RULE, "r"))
                .identifier("allow_web")
                .name("allow-web")
                .fields(fields)
                .build();

        String hcl = emitter.emit(rule);

        assertTrue(hcl.contains("resource \"panos_security_rule_group\" \"allow_web\" {"), hcl);
        assertTrue(hcl.contains("rulebase         = \"pre-rulebase\""), hcl);
        assertTrue(hcl.contains("  rule {\n    name = \"allow-web\"\n"), hcl);
        assertTrue(hcl.contains("    from = [\"trust\"]"), hcl);
        assertFalse(hcl.contains("rulebase = \"pre\""), "The rulebase field is not a rule attribute");
    }

    @Test
    @DisplayName("Nested containers, flags and entry lists become blocks")
    void testNestedFields() {
        Map<String, Object> tcp = new LinkedHashMap<>();
        tcp.put("port", "443");
        tcp.put("override", Map.of());
        Map<String, Object> fields = new LinkedHashMap<>();
        fields.put("protocol", Map.of("tcp", tcp));
        CanonicalObject service = CanonicalObject.builder()
                .key(new ObjectKey(Category.SERVICE, "s"))
                .identifier("https")
                .name("https")
                .fields(fields)
                .build();

        String hcl = emitter.emit(service);

        assertTrue(hcl.contains("  protocol {\n    tcp {\n      port = \"443\"\n      override = true\n    }\n  }\n"), hcl);
    }

    @Test
    @DisplayName("Pre-shared keys are replaced by the placeholder")
    void testPreSharedKeyMasked() {
        CanonicalObject gateway = CanonicalObject.builder()
                .key(new ObjectKey(Category.IKE_GATEWAY, "g"))
                .identifier("gw_1")
                .name("gw-1")
                .fields(Map.of("authentication", Map.of("pre-shared-key", Map.of("key", "-AQ==secret"))))
                .build();

        String hcl = emitter.emit(gateway);

        assertTrue(hcl.contains("key = \"***CHANGE_ME***\""), hcl);
        assertFalse(hcl.contains("secret"), "The exported key must not be written");
    }

    @Test
    @DisplayName("Categories without a provider resource are written as notes")
    void testUnmanagedNote() {
        CanonicalObject schedule = CanonicalObject.builder()
                .key(new ObjectKey(Category.SCHEDULE, "s"))
                .identifier("nightly")
                .name("nightly")
                .fields(Map.of("schedule-type", Map.of("recurring", Map.of("daily", List.of("01:00-02:00")))))
                .build();

        String hcl = emitter.emit(schedule);

        assertTrue(hcl.startsWith("# schedule 'nightly': no panos provider resource, configure manually\n"), hcl);
        assertTrue(hcl.contains("#   schedule-type: {recurring={daily=[01:00-02:00]}}"), hcl);
        assertFalse(hcl.contains("resource \""));
    }

    @Test
    @DisplayName("String literals escape quotes and interpolation")
    void testQuote() {
        assertEquals("\"a \\\"b\\\" $${c} %%{d}\"", HclResourceEmitter.quote("a \"b\" ${c} %{d}"));
        assertEquals("\"line\\nbreak\"", HclResourceEmitter.quote("line\nbreak"));
        assertEquals("\"\"", HclResourceEmitter.quote(null));
    }
}
