package com.netmig.pan2tf.output;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.netmig.pan2tf.model.CanonicalObject;
import com.netmig.pan2tf.model.Category;
import com.netmig.pan2tf.model.ObjectKey;
import com.netmig.pan2tf.model.ReferenceKind;
import com.netmig.pan2tf.model.ResolvedReference;
import com.netmig.pan2tf.synth.EmittedResource;
import org.junit.jupiter.api.*;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class TerraformWriterTest {

    @TempDir
    Path outputDir;

    private List<EmittedResource> resources() {
        ObjectKey tagKey = new ObjectKey(Category.TAG, "t");
        CanonicalObject tag = CanonicalObject.builder().key(tagKey).identifier("web").name("web")
                .fields(Map.of()).origin("shared").build();
        CanonicalObject address = CanonicalObject.builder().key(new ObjectKey(Category.ADDRESS, "a"))
                .identifier("dns_server").name("dns-server").fields(Map.of("tag", List.of("web")))
                .reference(new ResolvedReference("tag", "web", ReferenceKind.LINKED, Category.TAG, tagKey, "web"))
                .dependency(tagKey).origin("shared").origin("device-group 'DG-Branch'").ordinal(1).build();
        return List.of(new EmittedResource(tag, "resource \"panos_administrative_tag\" \"web\" {}\n"),
                new EmittedResource(address, "resource \"panos_address_object\" \"dns_server\" {}\n"));
    }

    @Test
    @DisplayName("Provider, variables, category files and manifest are written")
    void testFilesWritten() throws Exception {
        List<Path> written = new TerraformWriter("~> 2.0.7").write(resources(), outputDir);

        assertEquals(5, written.size());
        assertTrue(Files.readString(outputDir.resolve("provider.tf")).contains("version = \"~> 2.0.7\""));
        assertTrue(Files.readString(outputDir.resolve("provider.tf")).contains("source  = \"PaloAltoNetworks/panos\""));
        String variables = Files.readString(outputDir.resolve("variables.tf"));
        assertTrue(variables.contains("variable \"panos_password\""));
        assertTrue(variables.contains("sensitive   = true"));
        assertTrue(Files.readString(outputDir.resolve("tag.tf")).contains("\"web\""));
        assertTrue(Files.readString(outputDir.resolve("address.tf")).startsWith("# address\n"));
    }

    @Test
    @DisplayName("Manifest lists resources in emission order with their dependencies")
    void testManifest() throws Exception {
        new TerraformWriter("~> 2.0.7").write(resources(), outputDir);

        JsonNode manifest = new ObjectMapper().readTree(outputDir.resolve(TerraformWriter.MANIFEST).toFile());
        assertEquals(2, manifest.size());
        assertEquals("web", manifest.get(0).get("identifier").asText());
        assertEquals(1, manifest.get(0).get("position").asInt());
        assertEquals("panos_address_object", manifest.get(1).get("resourceType").asText());
        assertEquals("web", manifest.get(1).get("dependencies").get(0).asText());
        assertEquals(2, manifest.get(1).get("origins").size());
    }

    @Test
    @DisplayName("File name follows the category token")
    void testFileName() {
        assertEquals("ike_gateway.tf", TerraformWriter.fileName(Category.IKE_GATEWAY));
    }
}
