package com.di.importgate.stage.review;

import java.util.List;
import java.util.Optional;

/**
 * One {@code Node:} block of an MCF or template MCF file.
 *
 * @param id         value after {@code Node:}
 * @param line       1-based line of the {@code Node:} declaration
 * @param properties property lines in file order, duplicates kept
 */
public record McfNode(String id, int line, List<Property> properties) {

    public record Property(String key, String value, int line) {
    }

    /** First value of a property, if present. */
    public Optional<String> first(String key) {
        return properties.stream().filter(p -> p.key().equals(key)).map(Property::value).findFirst();
    }

    public boolean has(String key) {
        return properties.stream().anyMatch(p -> p.key().equals(key));
    }

    /** True when {@code typeOf} names the given type, with or without a namespace prefix. */
    public boolean isOfType(String type) {
        return properties.stream()
                .filter(p -> p.key().equals("typeOf"))
                .map(p -> McfParser.stripNamespace(p.value()))
                .anyMatch(type::equalsIgnoreCase);
    }
}
