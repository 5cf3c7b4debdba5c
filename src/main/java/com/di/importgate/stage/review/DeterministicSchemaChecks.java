package com.di.importgate.stage.review;

import com.di.importgate.pipeline.Finding;
import com.di.importgate.pipeline.Locator;
import com.di.importgate.pipeline.Severity;
import com.di.importgate.table.CsvTable;
import com.di.importgate.util.DateFormatUtils;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.TreeSet;
import java.util.regex.Pattern;

/**
 * Structural checks on the mapping file (and metadata files, when given) that need
 * no external reviewer.
 *
 * <p>Blocking: {@link #MISSING_PREFIX}, {@link #DUPLICATE_PROPERTY}, {@link #MISSPELLED_PROPERTY},
 * {@link #MISSING_REQUIRED_PROPERTY}, {@link #UNKNOWN_COLUMN}, {@link #EMPTY_MAPPING}.
 * Everything else is advisory.
 */
@Slf4j
@Component
public class DeterministicSchemaChecks {

    public static final String EMPTY_MAPPING = "EMPTY_MAPPING";
    public static final String MISSING_PREFIX = "MISSING_PREFIX";
    public static final String DUPLICATE_PROPERTY = "DUPLICATE_PROPERTY";
    public static final String MISSPELLED_PROPERTY = "MISSPELLED_PROPERTY";
    public static final String MISSING_REQUIRED_PROPERTY = "MISSING_REQUIRED_PROPERTY";
    public static final String UNKNOWN_COLUMN = "UNKNOWN_COLUMN";
    public static final String UNUSED_COLUMN = "UNUSED_COLUMN";
    public static final String INVALID_DATE_LITERAL = "INVALID_DATE_LITERAL";
    public static final String STATVAR_FORMAT = "STATVAR_FORMAT";
    public static final String METADATA_MISSING_PROPERTY = "METADATA_MISSING_PROPERTY";
    public static final String MISSING_VARIABLE_DEFINITION = "MISSING_VARIABLE_DEFINITION";
    public static final String MISSING_DENOMINATOR = "MISSING_DENOMINATOR";

    public static final Set<String> CODES = Set.of(EMPTY_MAPPING, MISSING_PREFIX, DUPLICATE_PROPERTY,
            MISSPELLED_PROPERTY, MISSING_REQUIRED_PROPERTY, UNKNOWN_COLUMN, UNUSED_COLUMN, INVALID_DATE_LITERAL,
            STATVAR_FORMAT, METADATA_MISSING_PROPERTY, MISSING_VARIABLE_DEFINITION, MISSING_DENOMINATOR);

    static final int MAX_UNUSED_COLUMNS = 10;
    static final int MAX_MISSING_DEFINITIONS = 20;

    static final Set<String> WELL_KNOWN_PROPERTIES = Set.of(
            "typeOf", "dcid", "name", "description", "alternateName",
            "variableMeasured", "observationAbout", "observationDate", "observationPeriod", "value",
            "unit", "scalingFactor", "measurementMethod", "measurementQualifier", "measurementDenominator",
            "populationType", "measuredProperty", "statType", "provenance", "memberOf", "subClassOf",
            "containedInPlace", "location", "isoCode");

    static final List<String> OBSERVATION_REQUIRED = List.of("variableMeasured", "observationAbout", "observationDate", "value");

    private static final Pattern STATVAR_ID = Pattern.compile("^[A-Z0-9][A-Za-z0-9]*(?:_[A-Z0-9][A-Za-z0-9]*)*$");

    /**
     * Runs every check.
     *
     * @param mappingFile display name of the mapping file, used in locators
     * @param nodes       parsed mapping nodes
     * @param table       data table, or null when it could not be read
     * @param metadata    parsed metadata files keyed by display name
     */
    public List<Finding> check(String mappingFile, List<McfNode> nodes, CsvTable table, List<MetadataFile> metadata) {
        List<Finding> findings = new ArrayList<>();
        if (nodes.isEmpty()) {
            findings.add(Finding.blocking(EMPTY_MAPPING, "Mapping file declares no Node blocks", Locator.of(mappingFile)));
            return findings;
        }
        for (McfNode node : nodes) {
            findings.addAll(missingPrefix(mappingFile, node));
            findings.addAll(duplicateProperties(mappingFile, node));
            findings.addAll(misspelledProperties(mappingFile, node));
            findings.addAll(missingObservationProperties(mappingFile, node));
            findings.addAll(invalidDateLiterals(mappingFile, node));
        }
        if (table != null && table.hasHeader()) {
            findings.addAll(unknownColumns(mappingFile, nodes, table.getHeader()));
            findings.addAll(unusedColumns(mappingFile, nodes, table.getHeader()));
        }
        Set<String> usedVariables = usedVariables(nodes, table);
        findings.addAll(variableFormat(mappingFile, usedVariables));
        for (MetadataFile file : metadata) {
            findings.addAll(metadataProperties(file));
            findings.addAll(missingDenominators(file));
        }
        if (!metadata.isEmpty()) {
            findings.addAll(missingDefinitions(metadata, usedVariables));
        }
        return findings;
    }

    // ---- blocking checks ----

    List<Finding> missingPrefix(String file, McfNode node) {
        List<Finding> findings = new ArrayList<>();
        for (McfNode.Property p : node.properties()) {
            boolean typed = p.key().equals("typeOf");
            boolean literalVariable = p.key().equals("variableMeasured") && McfParser.columnOf(p.value()) == null;
            if ((typed || literalVariable) && !p.value().isEmpty() && !McfParser.hasNamespace(p.value())) {
                findings.add(Finding.builder()
                        .code(MISSING_PREFIX)
                        .message(String.format("%s value '%s' has no namespace prefix", p.key(), p.value()))
                        .locator(Locator.at(file, p.line()))
                        .suggestion("Use dcs:" + p.value())
                        .build());
            }
        }
        return findings;
    }

    List<Finding> duplicateProperties(String file, McfNode node) {
        List<Finding> findings = new ArrayList<>();
        Set<String> seen = new HashSet<>();
        for (McfNode.Property p : node.properties()) {
            if (!seen.add(p.key())) {
                findings.add(Finding.blocking(DUPLICATE_PROPERTY,
                        String.format("Property '%s' is declared more than once in node %s", p.key(), node.id()),
                        Locator.at(file, p.line())));
            }
        }
        return findings;
    }

    List<Finding> misspelledProperties(String file, McfNode node) {
        List<Finding> findings = new ArrayList<>();
        for (McfNode.Property p : node.properties()) {
            if (WELL_KNOWN_PROPERTIES.contains(p.key())) {
                continue;
            }
            String closest = closestKnownProperty(p.key());
            if (closest != null) {
                findings.add(Finding.builder()
                        .code(MISSPELLED_PROPERTY)
                        .message(String.format("Property '%s' looks like a misspelling of '%s'", p.key(), closest))
                        .locator(Locator.at(file, p.line()))
                        .suggestion("Rename to " + closest)
                        .build());
            }
        }
        return findings;
    }

    List<Finding> missingObservationProperties(String file, McfNode node) {
        if (!node.isOfType("StatVarObservation")) {
            return List.of();
        }
        List<Finding> findings = new ArrayList<>();
        for (String required : OBSERVATION_REQUIRED) {
            if (node.has(required) || hasMisspelling(node, required)) {
                continue;
            }
            findings.add(Finding.builder()
                    .code(MISSING_REQUIRED_PROPERTY)
                    .message(String.format("StatVarObservation node %s has no '%s'", node.id(), required))
                    .locator(Locator.at(file, node.line()))
                    .suggestion(required.equals("value") ? "Map value to a numeric column, e.g. value: C:table->value" : null)
                    .build());
        }
        return findings;
    }

    List<Finding> unknownColumns(String file, List<McfNode> nodes, List<String> header) {
        Set<String> columns = new HashSet<>();
        header.forEach(h -> columns.add(h.strip()));
        List<Finding> findings = new ArrayList<>();
        for (String ref : McfParser.columnReferences(nodes)) {
            if (!columns.contains(ref)) {
                findings.add(Finding.builder()
                        .code(UNKNOWN_COLUMN)
                        .message(String.format("Column reference '%s' does not exist in the data table header (case-sensitive)", ref))
                        .locator(Locator.of(file))
                        .suggestion("Use a column id from the header or fix the typo")
                        .build());
            }
        }
        return findings;
    }

    // ---- advisory checks ----

    List<Finding> unusedColumns(String file, List<McfNode> nodes, List<String> header) {
        Set<String> refs = McfParser.columnReferences(nodes);
        List<String> unused = header.stream().map(String::strip).filter(h -> !h.isEmpty() && !refs.contains(h)).toList();
        List<Finding> findings = new ArrayList<>();
        for (String column : unused.subList(0, Math.min(MAX_UNUSED_COLUMNS, unused.size()))) {
            findings.add(Finding.advisory(UNUSED_COLUMN,
                    String.format("Data table column '%s' is not referenced by the mapping file", column), Locator.of(file)));
        }
        if (unused.size() > MAX_UNUSED_COLUMNS) {
            findings.add(Finding.advisory(UNUSED_COLUMN,
                    String.format("%d more unused data table column(s)", unused.size() - MAX_UNUSED_COLUMNS), Locator.of(file)));
        }
        return findings;
    }

    List<Finding> invalidDateLiterals(String file, McfNode node) {
        List<Finding> findings = new ArrayList<>();
        for (McfNode.Property p : node.properties()) {
            if (!p.key().equals("observationDate") || McfParser.columnOf(p.value()) != null) {
                continue;
            }
            if (!DateFormatUtils.isIsoDate(p.value())) {
                findings.add(Finding.builder()
                        .code(INVALID_DATE_LITERAL)
                        .message(String.format("observationDate literal '%s' is not YYYY, YYYY-MM or YYYY-MM-DD", p.value()))
                        .locator(Locator.at(file, p.line()))
                        .severity(Severity.ADVISORY)
                        .build());
            }
        }
        return findings;
    }

    List<Finding> variableFormat(String file, Set<String> variables) {
        List<Finding> findings = new ArrayList<>();
        for (String id : new TreeSet<>(variables)) {
            if (!STATVAR_ID.matcher(id).matches()) {
                findings.add(Finding.builder()
                        .code(STATVAR_FORMAT)
                        .message(String.format("Variable id '%s' is not UpperCamelCase segments joined by underscores", id))
                        .locator(Locator.of(file))
                        .severity(Severity.ADVISORY)
                        .suggestion("e.g. Count_Person")
                        .build());
            }
        }
        return findings;
    }

    List<Finding> metadataProperties(MetadataFile file) {
        List<Finding> findings = new ArrayList<>();
        for (McfNode node : file.nodes()) {
            List<String> required = new ArrayList<>(List.of("name", "description"));
            if (node.isOfType("StatisticalVariable")) {
                required.add("populationType");
                required.add("measuredProperty");
            }
            for (String key : required) {
                if (node.first(key).map(String::isBlank).orElse(true)) {
                    findings.add(Finding.advisory(METADATA_MISSING_PROPERTY,
                            String.format("Node %s has no '%s'", node.id(), key), Locator.at(file.name(), node.line())));
                }
            }
        }
        return findings;
    }

    List<Finding> missingDenominators(MetadataFile file) {
        List<Finding> findings = new ArrayList<>();
        for (McfNode node : file.nodes()) {
            String unit = node.first("unit").orElse("").toLowerCase(Locale.ROOT);
            String statType = node.first("statType").orElse("").toLowerCase(Locale.ROOT);
            String measured = node.first("measuredProperty").orElse("").toLowerCase(Locale.ROOT);
            boolean rate = unit.contains("percent") || statType.contains("rate") || measured.contains("rate");
            if (rate && node.first("measurementDenominator").map(String::isBlank).orElse(true)) {
                findings.add(Finding.builder()
                        .code(MISSING_DENOMINATOR)
                        .message(String.format("Percent/rate variable '%s' has no measurementDenominator", McfParser.stripNamespace(node.id())))
                        .locator(Locator.at(file.name(), node.line()))
                        .severity(Severity.ADVISORY)
                        .suggestion("Add measurementDenominator, e.g. dcs:Count_Person")
                        .build());
            }
        }
        return findings;
    }

    List<Finding> missingDefinitions(List<MetadataFile> metadata, Set<String> usedVariables) {
        Set<String> defined = new HashSet<>();
        metadata.forEach(m -> m.nodes().forEach(n -> defined.add(McfParser.stripNamespace(n.id()))));
        List<String> missing = new TreeSet<>(usedVariables).stream().filter(v -> !defined.contains(v)).toList();
        List<Finding> findings = new ArrayList<>();
        String file = metadata.get(0).name();
        for (String id : missing.subList(0, Math.min(MAX_MISSING_DEFINITIONS, missing.size()))) {
            findings.add(Finding.advisory(MISSING_VARIABLE_DEFINITION,
                    String.format("Variable '%s' is used by the import but not defined in the metadata files", id),
                    Locator.of(file)));
        }
        if (missing.size() > MAX_MISSING_DEFINITIONS) {
            findings.add(Finding.advisory(MISSING_VARIABLE_DEFINITION,
                    String.format("%d more variable(s) without a definition", missing.size() - MAX_MISSING_DEFINITIONS),
                    Locator.of(file)));
        }
        return findings;
    }

    // ---- helpers ----

    /**
     * Variable ids measured by the import: literals in the mapping, plus the values of
     * any column that variableMeasured maps to.
     */
    Set<String> usedVariables(List<McfNode> nodes, CsvTable table) {
        Set<String> ids = new LinkedHashSet<>();
        for (McfNode node : nodes) {
            for (McfNode.Property p : node.properties()) {
                if (!p.key().equals("variableMeasured") || p.value().isEmpty()) {
                    continue;
                }
                String column = McfParser.columnOf(p.value());
                if (column == null) {
                    ids.add(McfParser.stripNamespace(p.value()));
                } else if (table != null && table.columnIndex(column) >= 0) {
                    table.column(table.columnIndex(column)).stream()
                            .filter(v -> !v.isBlank())
                            .map(McfParser::stripNamespace)
                            .forEach(ids::add);
                }
            }
        }
        return ids;
    }

    static String closestKnownProperty(String key) {
        return closest(key, WELL_KNOWN_PROPERTIES);
    }

    /** Nearest candidate within the allowed distance; ties go to the alphabetically first name. */
    static String closest(String key, Collection<String> candidates) {
        int allowed = key.length() >= 8 ? 2 : 1;
        String best = null;
        int bestDistance = Integer.MAX_VALUE;
        for (String known : candidates) {
            int d = key.equalsIgnoreCase(known) ? 0 : EditDistance.between(key, known);
            if (d > allowed) {
                continue;
            }
            if (d < bestDistance || (d == bestDistance && known.compareTo(best) < 0)) {
                best = known;
                bestDistance = d;
            }
        }
        return best;
    }

    private static boolean hasMisspelling(McfNode node, String property) {
        return node.properties().stream().anyMatch(p -> property.equals(closestKnownProperty(p.key()))
                && !p.key().equals(property));
    }

    /**
     * A parsed metadata file.
     */
    public record MetadataFile(String name, List<McfNode> nodes) {
    }
}
