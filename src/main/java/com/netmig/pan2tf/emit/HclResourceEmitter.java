package com.netmig.pan2tf.emit;

import com.netmig.pan2tf.model.CanonicalObject;
import com.netmig.pan2tf.model.Category;
import com.netmig.pan2tf.model.ResolvedReference;
import com.netmig.pan2tf.resolve.FieldExtractor;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Renders canonical objects as Terraform resource blocks for the panos provider.
 * <p>
 * Linked references to managed resources become {@code <type>.<identifier>.name}
 * expressions so Terraform sees the dependency; every other value is a string.
 * Rules are wrapped in a rule group block. Objects of categories without a
 * provider resource are written as a commented manual-configuration note.
 */
public class HclResourceEmitter implements ResourceEmitter {

    private static final String INDENT = "  ";
    private static final String PRE_SHARED_KEY = "pre-shared-key";

    private final String secretPlaceholder;

    public HclResourceEmitter(String secretPlaceholder) {
        this.secretPlaceholder = secretPlaceholder;
    }

    @Override
    public String emit(CanonicalObject object) {
        Category category = object.getCategory();
        if (!category.isManaged()) {
            return emitNote(object);
        }

        Map<String, Map<String, ResolvedReference>> references = indexReferences(object);
        StringBuilder out = new StringBuilder();
        if (!object.getOrigins().isEmpty()) {
            out.append("# Declared in: ").append(String.join(", ", object.getOrigins())).append('\n');
        }
        out.append("resource \"").append(category.getResourceType()).append("\" \"")
                .append(object.getIdentifier()).append("\" {\n");

        if (category.isRule()) {
            Object rulebase = object.getFields().get(FieldExtractor.RULEBASE);
            out.append(INDENT).append("rulebase         = ").append(quote(rulebaseName(rulebase))).append('\n');
            out.append(INDENT).append("position_keyword = \"bottom\"\n\n");
            out.append(INDENT).append("rule {\n");
            out.append(INDENT).append(INDENT).append("name = ").append(quote(object.getName())).append('\n');
            renderFields(out, object.getFields(), "", 2, references);
            out.append(INDENT).append("}\n");
        } else {
            out.append(INDENT).append("name = ").append(quote(object.getName())).append('\n');
            renderFields(out, object.getFields(), "", 1, references);
        }
        out.append("}\n");
        return out.toString();
    }

    private String emitNote(CanonicalObject object) {
        StringBuilder out = new StringBuilder();
        out.append("# ").append(object.getCategory().getToken()).append(" '").append(object.getName())
                .append("': no panos provider resource, configure manually\n");
        for (Map.Entry<String, Object> field : object.getFields().entrySet()) {
            out.append("#   ").append(field.getKey()).append(": ").append(flatten(field.getValue())).append('\n');
        }
        List<String> dependencies = object.getDependencyIdentifiers();
        if (!dependencies.isEmpty()) {
            out.append("#   uses: ").append(String.join(", ", dependencies)).append('\n');
        }
        return out.toString();
    }

    @SuppressWarnings("unchecked")
    private void renderFields(StringBuilder out, Map<String, Object> fields, String parentPath, int depth,
                              Map<String, Map<String, ResolvedReference>> references) {
        String indent = INDENT.repeat(depth);
        for (Map.Entry<String, Object> field : fields.entrySet()) {
            String key = field.getKey();
            if (parentPath.isEmpty() && FieldExtractor.RULEBASE.equals(key)) {
                continue;
            }
            String path = parentPath.isEmpty() ? key : parentPath + "/" + key;
            String attribute = key.replace('-', '_');
            Object value = field.getValue();

            if (value instanceof String) {
                out.append(indent).append(attribute).append(" = ")
                        .append(renderValue(path, (String) value, references)).append('\n');
            } else if (value instanceof Map) {
                Map<String, Object> nested = (Map<String, Object>) value;
                if (nested.isEmpty()) {
                    out.append(indent).append(attribute).append(" = true\n");
                } else {
                    out.append(indent).append(attribute).append(" {\n");
                    renderFields(out, nested, path, depth + 1, references);
                    out.append(indent).append("}\n");
                }
            } else if (value instanceof List) {
                List<Object> list = (List<Object>) value;
                if (!list.isEmpty() && list.get(0) instanceof Map) {
                    for (Object element : list) {
                        out.append(indent).append(attribute).append(" {\n");
                        renderFields(out, (Map<String, Object>) element, path, depth + 1, references);
                        out.append(indent).append("}\n");
                    }
                } else {
                    String rendered = list.stream()
                            .map(element -> renderValue(path, String.valueOf(element), references))
                            .collect(Collectors.joining(", "));
                    out.append(indent).append(attribute).append(" = [").append(rendered).append("]\n");
                }
            }
        }
    }

    private String renderValue(String path, String value, Map<String, Map<String, ResolvedReference>> references) {
        if (path.equals(PRE_SHARED_KEY) || path.endsWith(PRE_SHARED_KEY + "/key")) {
            return quote(secretPlaceholder);
        }
        ResolvedReference reference = references.getOrDefault(path, Map.of()).get(value);
        if (reference != null && reference.isLinked() && reference.getTargetCategory().isManaged()) {
            return reference.getTargetCategory().getResourceType() + "." + reference.getTargetIdentifier() + ".name";
        }
        return quote(value);
    }

    private static Map<String, Map<String, ResolvedReference>> indexReferences(CanonicalObject object) {
        Map<String, Map<String, ResolvedReference>> index = new HashMap<>();
        for (ResolvedReference reference : object.getReferences()) {
            index.computeIfAbsent(reference.getFieldPath(), path -> new HashMap<>())
                    .put(reference.getValue(), reference);
        }
        return index;
    }

    private static String rulebaseName(Object rulebase) {
        if ("pre".equals(rulebase)) {
            return Category.PRE_RULEBASE;
        }
        if ("post".equals(rulebase)) {
            return Category.POST_RULEBASE;
        }
        return Category.LOCAL_RULEBASE;
    }

    @SuppressWarnings("unchecked")
    private static String flatten(Object value) {
        if (value instanceof Map) {
            Map<String, Object> map = (Map<String, Object>) value;
            if (map.isEmpty()) {
                return "yes";
            }
            return map.entrySet().stream()
                    .map(entry -> entry.getKey() + "=" + flatten(entry.getValue()))
                    .collect(Collectors.joining(" ", "{", "}"));
        }
        if (value instanceof List) {
            return ((List<Object>) value).stream()
                    .map(HclResourceEmitter::flatten)
                    .collect(Collectors.joining(", ", "[", "]"));
        }
        return String.valueOf(value).replace('\n', ' ');
    }

    /**
     * HCL string literal. Interpolation markers are escaped so source text is taken literally.
     */
    static String quote(String value) {
        if (value == null) {
            return "\"\"";
        }
        String escaped = value
                .replace("\\", "\\\\")
                .replace("\"", "\\\"")
                .replace("\n", "\\n")
                .replace("${", "$${")
                .replace("%{", "%%{");
        return "\"" + escaped + "\"";
    }
}
