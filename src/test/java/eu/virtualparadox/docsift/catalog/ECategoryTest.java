package eu.virtualparadox.docsift.catalog;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class ECategoryTest {

    @Test
    @DisplayName("Names, aliases and directory names resolve case-insensitively")
    void parsesAliases() {
        assertEquals(ECategory.INVOICES, ECategory.parse("invoice"));
        assertEquals(ECategory.CONTRACTS, ECategory.parse(" Contracts "));
        assertEquals(ECategory.CONTRACTS, ECategory.parse("employment-contracts"));
        assertEquals(ECategory.SUPPORT, ECategory.parse("CUSTOMER-SUPPORT"));
        assertEquals(ECategory.KNOWLEDGE, ECategory.parse("knowledge"));
    }

    @Test
    @DisplayName("Missing input selects invoices, unknown input is rejected")
    void defaultsAndRejects() {
        assertEquals(ECategory.INVOICES, ECategory.parse(null));
        assertEquals(ECategory.INVOICES, ECategory.parse("  "));
        IllegalArgumentException e = assertThrows(IllegalArgumentException.class, () -> ECategory.parse("recipes"));
        assertTrue(e.getMessage().contains("recipes"), e.getMessage());
    }

    @Test
    @DisplayName("Each category reads its own directory")
    void directoryNames() {
        assertEquals("invoices", ECategory.INVOICES.directoryName());
        assertEquals("employment-contracts", ECategory.CONTRACTS.directoryName());
        assertEquals("customer-support", ECategory.SUPPORT.directoryName());
        assertEquals("knowledge-base", ECategory.KNOWLEDGE.directoryName());
    }
}
