package com.netmig.pan2tf.resolve;

import lombok.extern.slf4j.Slf4j;

import java.util.Collection;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Pairs a device group with the template carrying its network settings.
 * <p>
 * Tried in order: exact match after stripping a configured prefix from the group
 * name ({@code DG-Branch} matches {@code Branch}), exact match of the raw name,
 * then the first template whose name contains the stripped group name, ignoring case.
 */
@Slf4j
public class TemplateMatcher {

    private final List<String> prefixes;

    public TemplateMatcher(List<String> prefixes) {
        this.prefixes = prefixes != null ? List.copyOf(prefixes) : List.of();
    }

    public Optional<String> match(String groupName, Collection<String> templateNames) {
        String stripped = strip(groupName);
        if (templateNames.contains(stripped)) {
            return Optional.of(stripped);
        }
        if (templateNames.contains(groupName)) {
            return Optional.of(groupName);
        }
        if (!stripped.isEmpty()) {
            String needle = stripped.toLowerCase(Locale.ROOT);
            for (String template : templateNames) {
                if (template.toLowerCase(Locale.ROOT).contains(needle)) {
                    log.debug("Device group '{}' matched template '{}' by containment", groupName, template);
                    return Optional.of(template);
                }
            }
        }
        return Optional.empty();
    }

    String strip(String groupName) {
        for (String prefix : prefixes) {
            if (groupName.startsWith(prefix)) {
                return groupName.substring(prefix.length());
            }
        }
        return groupName;
    }
}
