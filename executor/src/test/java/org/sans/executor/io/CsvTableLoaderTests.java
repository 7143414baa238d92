package org.sans.executor.io;

import org.sans.compiler.errors.ErrorCode;
import org.sans.compiler.ir.Datasource;
import org.sans.compiler.ir.type.Column;
import org.sans.compiler.ir.type.ScalarType;
import org.sans.compiler.ir.type.Schema;
import org.sans.executor.ExecutionError;
import org.sans.executor.Table;
import org.junit.Assert;
import org.junit.Test;

import java.math.BigDecimal;
import java.util.List;

public class CsvTableLoaderTests {
    static final Schema SCHEMA = Schema.of(
            new Column("id", ScalarType.INT),
            new Column("score", ScalarType.DECIMAL),
            new Column("flag", ScalarType.BOOL),
            new Column("name", ScalarType.STRING));

    @Test
    public void typedLoad() {
        // Columns are matched by name; the file may order them differently
        Table table = CsvTableLoader.load("name,flag,score,id\n\"Smith, J\",yes,1.50,+7\n,false,,2\n", SCHEMA);
        Assert.assertEquals(2, table.size());
        Assert.assertEquals(7L, table.get(0, "id"));
        Assert.assertEquals(new BigDecimal("1.50"), table.get(0, "score"));
        Assert.assertEquals(true, table.get(0, "flag"));
        Assert.assertEquals("Smith, J", table.get(0, "name"));
        Assert.assertNull(table.get(1, "name"));
        Assert.assertNull(table.get(1, "score"));
    }

    @Test
    public void badValue() {
        try {
            CsvTableLoader.load("id,score,flag,name\nx,1,true,a\n", SCHEMA);
            Assert.fail("Expected a type mismatch");
        } catch (ExecutionError e) {
            Assert.assertEquals(ErrorCode.RUNTIME_TYPE_MISMATCH, e.code);
            Assert.assertTrue(e.getMessage().contains("Line 2"));
        }
    }

    @Test
    public void missingColumn() {
        try {
            CsvTableLoader.load("id,score\n1,2\n", SCHEMA);
            Assert.fail("Expected a schema mismatch");
        } catch (ExecutionError e) {
            Assert.assertEquals(ErrorCode.RUNTIME_SCHEMA_MISMATCH, e.code);
        }
    }

    @Test
    public void strings() {
        Table table = CsvTableLoader.loadStrings("a,b\n1,x\n");
        Assert.assertEquals(List.of("a", "b"), table.schema.names());
        Assert.assertEquals("1", table.get(0, "a"));
    }

    @Test
    public void emptyText() {
        Assert.assertEquals(0, CsvTableLoader.load("", SCHEMA).size());
    }

    @Test
    public void datasources() {
        Schema schema = Schema.of(new Column("k", ScalarType.INT));
        Table table = CsvTableLoader.load(Datasource.inline("d", "k\n1\n2\n", schema));
        Assert.assertEquals(2, table.size());
        try {
            CsvTableLoader.load(Datasource.csv("f", "f.csv", schema));
            Assert.fail("Expected an unbound datasource");
        } catch (ExecutionError e) {
            Assert.assertEquals(ErrorCode.RUNTIME_TABLE_UNDEFINED, e.code);
        }
    }
}
