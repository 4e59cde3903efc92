// file: sqlserver/src/test/java/io/schemasync/sqlserver/SqlServerStatementsTest.java
package io.schemasync.sqlserver;

import io.schemasync.core.DeclarationException;
import org.junit.jupiter.api.Test;

import java.util.List;

import static io.schemasync.core.declared.Declarations.*;
import static io.schemasync.sqlserver.SqlServerStatements.*;
import static org.junit.jupiter.api.Assertions.*;

class SqlServerStatementsTest {

    @Test
    void identifiers_are_bracket_quoted() {
        assertEquals("[Order Lines]", quote("Order Lines"));
        assertEquals("[odd]]name]", quote("odd]name"));
        assertEquals("[dbo].[Person]", qualified("dbo", "Person"));
    }

    @Test
    void column_definitions_carry_identity_only_when_adding() {
        var id = identityColumn("ID").build();

        assertEquals("[ID] int IDENTITY(1,1) NOT NULL", columnDefinition(id));
        assertEquals("[ID] int NOT NULL", alterColumnDefinition(id));
        assertEquals("[Name] varchar(255) NOT NULL", columnDefinition(varcharColumn("Name", 255).build()));
        assertEquals("[Total] numeric(10,2) NOT NULL", columnDefinition(numericColumn("Total", 10, 2).build()));
    }

    @Test
    void small_float_is_rendered_as_real() {
        assertEquals("[Weight] real NOT NULL", columnDefinition(floatColumn("Weight", true).build()));
        assertEquals("[Weight] float(53) NOT NULL", columnDefinition(floatColumn("Weight").build()));
        assertEquals("[Created] datetime2(7) NOT NULL", columnDefinition(column("Created", "datetime2").build()));
    }

    @Test
    void table_lookups_agree_on_sys_tables() {
        assertTrue(TABLE_EXISTS.contains("FROM sys.tables"));
        assertTrue(LIST_TABLES.contains("FROM sys.tables"));
        assertFalse(TABLE_EXISTS.contains("INFORMATION_SCHEMA"));
    }

    @Test
    void index_statement_lists_included_columns_and_placement() {
        String sql = createIndex("dbo", "Person", "IX_name", List.of("Name"), List.of("Email"),
                true, false, "page", true, "[ps_dbo_Person_created]([created])");

        assertEquals("CREATE UNIQUE NONCLUSTERED INDEX [IX_name] ON [dbo].[Person] ([Name]) INCLUDE ([Email])"
                + " WITH (DATA_COMPRESSION = PAGE, DROP_EXISTING = ON) ON [ps_dbo_Person_created]([created])", sql);
    }

    @Test
    void primary_key_statement() {
        assertEquals("ALTER TABLE [dbo].[Person] ADD CONSTRAINT [PK_id] PRIMARY KEY CLUSTERED ([ID]) WITH (DATA_COMPRESSION = NONE)",
                createPrimaryKey("dbo", "Person", "PK_id", List.of("ID"), true, null));
    }

    @Test
    void keywords_outside_their_sets_are_rejected() {
        assertEquals("BULK_LOGGED", recoveryModel("bulk_logged"));
        assertThrows(DeclarationException.class, () -> recoveryModel("FULL; DROP TABLE x"));
        assertThrows(DeclarationException.class, () -> compression("COLUMNSTORE"));
    }

    @Test
    void literals_escape_quotes() {
        assertEquals("C:\\O''Brien\\db.mdf", literal("C:\\O'Brien\\db.mdf"));
    }
}
