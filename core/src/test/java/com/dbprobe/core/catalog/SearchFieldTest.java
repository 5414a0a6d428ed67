package com.dbprobe.core.catalog;

import org.junit.jupiter.api.Test;

import java.util.EnumSet;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class SearchFieldTest {

    @Test
    void parsesCommaSeparatedFields() {
        assertEquals(EnumSet.of(SearchField.NAMES), SearchField.parse("names"));
        assertEquals(EnumSet.allOf(SearchField.class), SearchField.parse(" comments , names "));
        assertEquals(EnumSet.allOf(SearchField.class), SearchField.parse(null));
    }

    @Test
    void rejectsUnknownFields() {
        assertThrows(IllegalArgumentException.class, () -> SearchField.parse("names,owners"));
    }

    @Test
    void metadataQueryValidatesAndDefaults() {
        MetadataQuery query = new MetadataQuery("cust", " ", Set.of(), true, 10);
        assertNull(query.schema());
        assertTrue(query.searchesNames());
        assertTrue(query.searchesComments());
        assertThrows(IllegalArgumentException.class, () -> new MetadataQuery("", null, null, false, 10));
        assertThrows(IllegalArgumentException.class, () -> new MetadataQuery("x", null, null, false, 0));
    }

    @Test
    void procedureQueryDefaultsToEveryObjectType() {
        ProcedureQuery query = new ProcedureQuery("DIM_CUSTOMER", " ", null, List.of(), false, 100, 0);
        assertEquals(List.of(ObjectType.values()), query.objectTypes());
        assertNull(query.text());
        assertTrue(query.hasFilter());
    }

    @Test
    void objectTypesParseCatalogSpelling() {
        assertEquals(ObjectType.PACKAGE_BODY, ObjectType.fromCatalogName("package  body").orElseThrow());
        assertTrue(ObjectType.fromCatalogName("TRIGGER").isEmpty());
    }
}
