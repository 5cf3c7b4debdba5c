package com.di.importgate.config;

import com.di.importgate.exception.ConfigurationException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.io.Resource;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Loads the warn-only override document. A missing document means no overrides.
 */
@Slf4j
@Service
public class WarnOnlyRulesLoader {

    private static final ObjectMapper JSON_MAPPER = new ObjectMapper();
    private static final ObjectMapper YAML_MAPPER = new ObjectMapper(new YAMLFactory());

    public WarnOnlyRules load(Resource resource) {
        if (resource == null || !resource.exists()) {
            log.info("[RULES] No warn-only document{}; no overrides apply",
                    resource == null ? "" : " at " + resource.getDescription());
            return WarnOnlyRules.empty();
        }
        String source = resource.getDescription();
        JsonNode root;
        try (InputStream in = resource.getInputStream()) {
            String name = resource.getFilename() == null ? "" : resource.getFilename().toLowerCase(Locale.ROOT);
            root = (name.endsWith(".yml") || name.endsWith(".yaml") ? YAML_MAPPER : JSON_MAPPER).readTree(in);
        } catch (IOException e) {
            throw new ConfigurationException(source, "unreadable: " + e.getMessage(), e);
        }
        if (root == null || root.isMissingNode() || root.isNull()) {
            return WarnOnlyRules.empty();
        }
        if (!root.isObject()) {
            throw new ConfigurationException(source, List.of("root must be an object of dataset -> [rule ids]"));
        }

        List<String> problems = new ArrayList<>();
        Map<String, List<String>> raw = new LinkedHashMap<>();
        Iterator<Map.Entry<String, JsonNode>> fields = root.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> entry = fields.next();
            if (!entry.getValue().isArray()) {
                problems.add(String.format("'%s' must map to an array of rule ids", entry.getKey()));
                continue;
            }
            List<String> ids = new ArrayList<>();
            entry.getValue().forEach(node -> {
                if (node.isTextual()) {
                    ids.add(node.asText());
                } else {
                    problems.add(String.format("'%s' contains a non-string rule id: %s", entry.getKey(), node));
                }
            });
            raw.put(entry.getKey(), ids);
        }
        if (!problems.isEmpty()) {
            throw new ConfigurationException(source, problems);
        }
        WarnOnlyRules rules = new WarnOnlyRules(raw);
        log.info("[RULES] Loaded warn-only overrides for {} dataset(s) from {}", raw.size(), source);
        return rules;
    }
}
