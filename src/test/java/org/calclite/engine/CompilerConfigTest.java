package org.calclite.engine;

import org.calclite.engine.transpiler.BigQueryDialect;
import org.calclite.engine.transpiler.DuckDBDialect;
import org.eclipse.collections.api.factory.Lists;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Properties;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Compiler Config Tests")
class CompilerConfigTest {

    @Test
    @DisplayName("The bundled resource matches the built-in defaults")
    void testLoadDefaults() {
        assertEquals(CompilerConfig.defaults(), CompilerConfig.load());
    }

    @Test
    @DisplayName("System properties override the resource")
    void testSystemPropertyOverride() {
        System.setProperty(CompilerConfig.DIALECT, "DuckDB");
        System.setProperty(CompilerConfig.MAX_MEDIUM_DEPTH, "9");
        try {
            CompilerConfig config = CompilerConfig.load();

            assertSame(DuckDBDialect.INSTANCE, config.dialect());
            assertEquals(9, config.maxMediumDepth());
            assertEquals(3, config.maxSimpleDepth());
        } finally {
            System.clearProperty(CompilerConfig.DIALECT);
            System.clearProperty(CompilerConfig.MAX_MEDIUM_DEPTH);
        }
    }

    @Test
    @DisplayName("Every key is read from properties")
    void testFromProperties() {
        // GIVEN properties naming every setting
        Properties properties = new Properties();
        properties.setProperty(CompilerConfig.MAX_SIMPLE_DEPTH, " 2 ");
        properties.setProperty(CompilerConfig.MAX_MEDIUM_DEPTH, "4");
        properties.setProperty(CompilerConfig.FALLBACK_PENALTY, "0.5");
        properties.setProperty(CompilerConfig.UNKNOWN_FUNCTION_PENALTY, "0.2");
        properties.setProperty(CompilerConfig.TABLE_REFERENCE, "t");
        properties.setProperty(CompilerConfig.SOURCE_TABLE, "db.orders");
        properties.setProperty(CompilerConfig.AMBIENT_DIMENSIONS, "Region, Segment,,");
        properties.setProperty(CompilerConfig.DIALECT, "duckdb");
        properties.setProperty(CompilerConfig.MAX_NESTING_DEPTH, "64");

        // WHEN loaded
        CompilerConfig config = CompilerConfig.fromProperties(properties);

        // THEN each is honoured
        assertEquals(new CompilerConfig(2, 4, 0.5, 0.2, "t", "db.orders",
                Lists.immutable.of("Region", "Segment"), DuckDBDialect.INSTANCE, 64), config);
        assertEquals(Lists.immutable.of("region", "segment"), config.generationContext().ambientDimensions());
    }

    @Test
    @DisplayName("The source table defaults to the table reference")
    void testSourceTableDefault() {
        Properties properties = new Properties();
        properties.setProperty(CompilerConfig.TABLE_REFERENCE, "orders");

        assertEquals("orders", CompilerConfig.fromProperties(properties).sourceTable());
    }

    @Test
    @DisplayName("Malformed values are rejected with the offending key")
    void testMalformedValues() {
        Properties badInt = new Properties();
        badInt.setProperty(CompilerConfig.MAX_SIMPLE_DEPTH, "three");
        IllegalArgumentException e = assertThrows(IllegalArgumentException.class,
                () -> CompilerConfig.fromProperties(badInt));
        assertTrue(e.getMessage().contains(CompilerConfig.MAX_SIMPLE_DEPTH));

        Properties badDialect = new Properties();
        badDialect.setProperty(CompilerConfig.DIALECT, "oracle");
        assertThrows(IllegalArgumentException.class, () -> CompilerConfig.fromProperties(badDialect));

        Properties badRange = new Properties();
        badRange.setProperty(CompilerConfig.FALLBACK_PENALTY, "2");
        assertThrows(IllegalArgumentException.class, () -> CompilerConfig.fromProperties(badRange));

        Properties noNesting = new Properties();
        noNesting.setProperty(CompilerConfig.MAX_NESTING_DEPTH, "0");
        assertThrows(IllegalArgumentException.class, () -> CompilerConfig.fromProperties(noNesting));
    }

    @Test
    @DisplayName("Dialect names are case-insensitive")
    void testDialectNames() {
        assertSame(BigQueryDialect.INSTANCE, CompilerConfig.dialect(" BigQuery "));
        assertSame(DuckDBDialect.INSTANCE, CompilerConfig.dialect("DUCKDB"));
    }
}
