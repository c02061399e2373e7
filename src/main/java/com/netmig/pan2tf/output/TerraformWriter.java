package com.netmig.pan2tf.output;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.netmig.pan2tf.model.CanonicalObject;
import com.netmig.pan2tf.model.Category;
import com.netmig.pan2tf.synth.EmittedResource;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Writes emitted resources to a Terraform working directory:
 * provider.tf, variables.tf, one file per category and emission-order.json.
 */
@Slf4j
public class TerraformWriter {

    public static final String MANIFEST = "emission-order.json";

    private final String providerVersion;
    private final ObjectMapper mapper;

    public TerraformWriter(String providerVersion) {
        this.providerVersion = providerVersion;
        this.mapper = new ObjectMapper();
        this.mapper.enable(SerializationFeature.INDENT_OUTPUT);
    }

    public List<Path> write(List<EmittedResource> resources, Path outputDir) throws IOException {
        Files.createDirectories(outputDir);
        List<Path> written = new ArrayList<>();
        written.add(writeFile(outputDir.resolve("provider.tf"), providerConfig()));
        written.add(writeFile(outputDir.resolve("variables.tf"), variables()));

        // Files follow the order in which their first resource is emitted
        Map<Category, StringBuilder> byCategory = new LinkedHashMap<>();
        List<ManifestEntry> manifest = new ArrayList<>();
        for (EmittedResource resource : resources) {
            CanonicalObject object = resource.getObject();
            byCategory.computeIfAbsent(object.getCategory(), this::fileHeader)
                    .append(resource.getText()).append('\n');
            manifest.add(new ManifestEntry(manifest.size() + 1, object.getCategory().getToken(),
                    object.getCategory().getResourceType(), object.getIdentifier(), object.getName(),
                    object.getDependencyIdentifiers(), object.getOrigins()));
        }
        for (Map.Entry<Category, StringBuilder> entry : byCategory.entrySet()) {
            written.add(writeFile(outputDir.resolve(fileName(entry.getKey())), entry.getValue().toString()));
        }

        Path manifestPath = outputDir.resolve(MANIFEST);
        mapper.writeValue(manifestPath.toFile(), manifest);
        written.add(manifestPath);

        log.info("Wrote {} file(s) with {} resource(s) to {}", written.size(), resources.size(), outputDir);
        return written;
    }

    public static String fileName(Category category) {
        return category.getToken() + ".tf";
    }

    private StringBuilder fileHeader(Category category) {
        StringBuilder header = new StringBuilder("# ").append(category.getToken()).append('\n');
        if (!category.isManaged()) {
            header.append("# The panos provider has no resource for these objects; they are listed for manual setup\n");
        }
        if (category == Category.IKE_GATEWAY) {
            header.append("# Pre-shared keys are placeholders and must be replaced before applying\n");
        }
        return header.append('\n');
    }

    private String providerConfig() {
        return "# Palo Alto Networks PAN-OS provider\n"
                + "terraform {\n"
                + "  required_providers {\n"
                + "    panos = {\n"
                + "      source  = \"PaloAltoNetworks/panos\"\n"
                + "      version = \"" + providerVersion + "\"\n"
                + "    }\n"
                + "  }\n"
                + "}\n"
                + "\n"
                + "provider \"panos\" {\n"
                + "  hostname = var.panos_hostname\n"
                + "  username = var.panos_username\n"
                + "  password = var.panos_password\n"
                + "}\n";
    }

    private String variables() {
        return variable("panos_hostname", "Hostname or IP of the firewall or Panorama", true, null)
                + "\n" + variable("panos_username", "Username for authentication", true, null)
                + "\n" + variable("panos_password", "Password for authentication", true, null)
                + "\n" + variable("device_group", "Device group name for Panorama", false, "shared");
    }

    private static String variable(String name, String description, boolean sensitive, String defaultValue) {
        StringBuilder block = new StringBuilder()
                .append("variable \"").append(name).append("\" {\n")
                .append("  description = \"").append(description).append("\"\n")
                .append("  type        = string\n");
        if (sensitive) {
            block.append("  sensitive   = true\n");
        }
        if (defaultValue != null) {
            block.append("  default     = \"").append(defaultValue).append("\"\n");
        }
        return block.append("}\n").toString();
    }

    private static Path writeFile(Path path, String content) throws IOException {
        Files.writeString(path, content, StandardCharsets.UTF_8);
        return path;
    }
}
