package com.di.importgate.config;

import com.di.importgate.exception.ConfigurationException;
import com.di.importgate.util.InputValidator;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.io.Resource;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.Iterator;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Reads the rule configuration document (JSON, or YAML for {@code .yml}/{@code .yaml})
 * and checks it against the template before binding it to {@link RuleConfig}.
 *
 * <p>Template: {@code rules} is a required array and {@code schema_version} the only other
 * top-level key. Each rule needs {@code rule_id}, {@code description}, {@code validator},
 * {@code scope} and {@code params}, and may have a boolean {@code enabled}. Every problem
 * is collected and reported in one {@link ConfigurationException}.
 */
@Slf4j
@Service
public class RuleConfigLoader {

    private static final ObjectMapper JSON_MAPPER = new ObjectMapper()
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, true)
            .enable(SerializationFeature.INDENT_OUTPUT);

    private static final ObjectMapper YAML_MAPPER = new ObjectMapper(new YAMLFactory())
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, true);

    private static final Set<String> TOP_LEVEL_KEYS = Set.of("rules", "schema_version");
    private static final List<String> REQUIRED_RULE_KEYS = List.of("rule_id", "description", "validator", "scope", "params");
    private static final Set<String> OPTIONAL_RULE_KEYS = Set.of("enabled");

    public RuleConfig load(Resource resource) {
        String source = resource.getDescription();
        if (!resource.exists()) {
            throw new ConfigurationException(source, List.of("file not found"));
        }
        JsonNode root;
        try (InputStream in = resource.getInputStream()) {
            root = mapperFor(resource.getFilename()).readTree(in);
        } catch (IOException e) {
            throw new ConfigurationException(source, "unreadable: " + e.getMessage(), e);
        }

        List<String> problems = validateTemplate(root);
        if (!problems.isEmpty()) {
            throw new ConfigurationException(source, problems);
        }
        try {
            RuleConfig config = JSON_MAPPER.treeToValue(root, RuleConfig.class);
            log.info("[RULES] Loaded {} rule(s) from {}", config.getRules().size(), source);
            return config;
        } catch (JsonProcessingException | IllegalArgumentException e) {
            throw new ConfigurationException(source, "cannot bind rules: " + e.getMessage(), e);
        }
    }

    /**
     * Writes the config as JSON, the format the validation engine reads.
     */
    public void write(RuleConfig config, Path target) throws IOException {
        Files.createDirectories(target.toAbsolutePath().getParent());
        JSON_MAPPER.writeValue(target.toFile(), config);
    }

    List<String> validateTemplate(JsonNode root) {
        List<String> problems = new ArrayList<>();
        if (root == null || !root.isObject()) {
            problems.add("root must be an object");
            return problems;
        }
        Iterator<String> keys = root.fieldNames();
        while (keys.hasNext()) {
            String key = keys.next();
            if (!TOP_LEVEL_KEYS.contains(key)) {
                problems.add(String.format("unknown top-level key '%s' (allowed: %s)", key, TOP_LEVEL_KEYS));
            }
        }
        if (root.has("schema_version") && !root.get("schema_version").isTextual()) {
            problems.add("schema_version must be a string");
        }
        JsonNode rules = root.get("rules");
        if (rules == null) {
            problems.add("missing required key 'rules'");
            return problems;
        }
        if (!rules.isArray()) {
            problems.add("'rules' must be an array");
            return problems;
        }

        Set<String> seen = new HashSet<>();
        for (int i = 0; i < rules.size(); i++) {
            validateRule(rules.get(i), "rules[" + i + "]", seen, problems);
        }
        return problems;
    }

    private void validateRule(JsonNode rule, String prefix, Set<String> seen, List<String> problems) {
        if (!rule.isObject()) {
            problems.add(prefix + ": must be an object");
            return;
        }
        for (String required : REQUIRED_RULE_KEYS) {
            if (!rule.has(required)) {
                problems.add(String.format("%s: missing required key '%s'", prefix, required));
            }
        }
        Iterator<Map.Entry<String, JsonNode>> fields = rule.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            JsonNode value = field.getValue();
            switch (field.getKey()) {
                case "rule_id" -> validateRuleId(value, prefix, seen, problems);
                case "description" -> {
                    if (!value.isTextual()) {
                        problems.add(prefix + ": description must be a string");
                    }
                }
                case "validator" -> {
                    if (!value.isTextual() || value.asText().isBlank()) {
                        problems.add(prefix + ": validator must be a non-empty string");
                    }
                }
                case "scope" -> validateScope(value, prefix, problems);
                case "params" -> {
                    if (!value.isObject()) {
                        problems.add(prefix + ": params must be an object");
                    }
                }
                case "enabled" -> {
                    if (!value.isBoolean()) {
                        problems.add(prefix + ": enabled must be a boolean");
                    }
                }
                default -> {
                    if (!OPTIONAL_RULE_KEYS.contains(field.getKey())) {
                        problems.add(String.format("%s: unknown rule key '%s'", prefix, field.getKey()));
                    }
                }
            }
        }
    }

    private void validateRuleId(JsonNode value, String prefix, Set<String> seen, List<String> problems) {
        if (!value.isTextual() || value.asText().isBlank()) {
            problems.add(prefix + ": rule_id must be a non-empty string");
        } else if (!InputValidator.isRuleId(value.asText())) {
            problems.add(String.format("%s: rule_id '%s' should be snake_case (e.g. check_min_value)", prefix, value.asText()));
        } else if (!seen.add(value.asText())) {
            problems.add(String.format("%s: duplicate rule_id '%s' (rule_id must be unique)", prefix, value.asText()));
        }
    }

    private void validateScope(JsonNode value, String prefix, List<String> problems) {
        if (!value.isObject()) {
            problems.add(prefix + ": scope must be an object");
            return;
        }
        JsonNode dataSource = value.get("data_source");
        if (dataSource == null || DataSource.fromWireName(dataSource.asText(null)).isEmpty()) {
            problems.add(prefix + ": scope.data_source must be one of [stats, lint, differ]");
        }
    }

    private static ObjectMapper mapperFor(String filename) {
        String name = filename == null ? "" : filename.toLowerCase(Locale.ROOT);
        return name.endsWith(".yml") || name.endsWith(".yaml") ? YAML_MAPPER : JSON_MAPPER;
    }
}
