package com.di.importgate.stage.review;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Collections;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Test cases for SchemaAdvisorRegistry.
 * Note: This test initializes the registry without a Spring context.
 */
@DisplayName("SchemaAdvisorRegistry Tests")
class SchemaAdvisorRegistryTest {

    @Test
    @DisplayName("Should throw exception for unsupported advisor type")
    void testGetAdvisor_UnsupportedType() {
        SchemaAdvisorRegistry registry = registry(List.of(new FixedAdvisor("process")));
        IllegalArgumentException ex = assertThrows(IllegalArgumentException.class,
            () -> registry.getAdvisor("unsupported"));
        assertTrue(ex.getMessage().contains("process"));
    }

    @Test
    @DisplayName("Should throw exception for null or blank advisor type")
    void testGetAdvisor_NullOrBlank() {
        SchemaAdvisorRegistry registry = registry(List.of(new FixedAdvisor("process")));
        assertThrows(IllegalArgumentException.class, () -> registry.getAdvisor(null));
        assertThrows(IllegalArgumentException.class, () -> registry.getAdvisor(" "));
        assertFalse(registry.hasAdvisor(null));
    }

    @Test
    @DisplayName("Should look up advisors case-insensitively")
    void testGetAdvisor_CaseInsensitive() {
        FixedAdvisor chat = new FixedAdvisor("chat");
        SchemaAdvisorRegistry registry = registry(List.of(new FixedAdvisor("process"), chat));
        assertSame(chat, registry.getAdvisor(" CHAT "));
        assertTrue(registry.hasAdvisor("Process"));
        assertEquals(Set.of("process", "chat"), registry.getRegisteredTypes());
    }

    @Test
    @DisplayName("Should return empty set when no advisors are registered")
    void testGetRegisteredTypes_Empty() {
        assertTrue(registry(Collections.emptyList()).getRegisteredTypes().isEmpty());
    }

    @Test
    @DisplayName("Should fail initialization on duplicate or blank types")
    void testInitialize_Invalid() {
        assertThrows(IllegalStateException.class,
            () -> registry(List.of(new FixedAdvisor("chat"), new FixedAdvisor("Chat"))));
        assertThrows(IllegalStateException.class, () -> registry(List.of(new FixedAdvisor(" "))));
    }

    private static SchemaAdvisorRegistry registry(List<SchemaAdvisor> advisors) {
        SchemaAdvisorRegistry registry = new SchemaAdvisorRegistry(advisors);
        registry.initialize();
        return registry;
    }

    private record FixedAdvisor(String type) implements SchemaAdvisor {
        @Override
        public List<AdvisorFinding> review(ReviewRequest request) {
            return List.of();
        }
    }
}
