package com.example.retrosheet.schema;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.io.StringReader;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@Tag("unit")
class SchemaDeclarationLoaderTest {

    @Test
    void bundledDeclarationsCoverEveryRetrosheetEntity() {
        Map<String, List<ColumnDeclaration>> declarations = SchemaDeclarationLoader.loadBundled();
        SchemaRegistry registry = new SchemaRegistry(declarations);

        assertThat(declarations.keySet()).containsExactly("gamelog", "schedule", "park", "roster", "bio");
        assertThat(registry.schemaFor("gamelog").width()).isEqualTo(161);
        assertThat(registry.schemaFor("schedule").width()).isEqualTo(12);
        assertThat(registry.schemaFor("park").width()).isEqualTo(9);
        assertThat(registry.schemaFor("roster").width()).isEqualTo(8);
        assertThat(registry.schemaFor("roster").field(0)).isEqualTo(new FieldSpec("year", FieldType.INT16, false));
        assertThat(registry.schemaFor("gamelog").field(0)).isEqualTo(new FieldSpec("date", FieldType.TIMESTAMP_MILLIS, false));
    }

    @Test
    void appliesFlagDefaultsAndSkipsComments() throws Exception {
        String csv = "entity,column,type,autoincrement,nullable\n"
                + "# keys first\n"
                + "park,id,INTEGER,true,false\n"
                + "park,park_id,CHAR(5),,no\n"
                + "\n"
                + "park,name,VARCHAR(50),,\n";

        Map<String, List<ColumnDeclaration>> declarations = SchemaDeclarationLoader.load(new StringReader(csv), "inline");

        assertThat(declarations.get("park")).containsExactly(
                new ColumnDeclaration("id", RelationalType.INTEGER, true, false),
                new ColumnDeclaration("park_id", RelationalType.CHAR, false, false),
                new ColumnDeclaration("name", RelationalType.STRING, false, true));
    }

    @Test
    void unknownTypeFailsWithLocation() {
        String csv = "entity,column,type,autoincrement,nullable\n"
                + "park,opened,INTERVAL,,\n";

        assertThatThrownBy(() -> SchemaDeclarationLoader.load(new StringReader(csv), "schema.csv"))
                .isInstanceOf(SchemaDefinitionException.class)
                .hasMessageContaining("schema.csv:")
                .hasMessageContaining("park.opened");
    }

    @Test
    void invalidFlagFails() {
        String csv = "entity,column,type,autoincrement,nullable\n"
                + "park,name,TEXT,maybe,\n";

        assertThatThrownBy(() -> SchemaDeclarationLoader.load(new StringReader(csv), "inline"))
                .isInstanceOf(SchemaDefinitionException.class)
                .hasMessageContaining("maybe");
    }
}
