package com.example.retrosheet.columnar;

import com.example.retrosheet.schema.EntitySchema;
import com.example.retrosheet.schema.FieldSpec;
import com.example.retrosheet.schema.FieldType;
import com.example.retrosheet.schema.SchemaDefinitionException;
import org.apache.parquet.hadoop.metadata.CompressionCodecName;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@Tag("unit")
class ColumnEncodingPolicyTest {

    private static final EntitySchema ROSTER = new EntitySchema("roster", List.of(
            new FieldSpec("year", FieldType.INT16, false),
            new FieldSpec("player_id", FieldType.UTF8, false),
            new FieldSpec("debut", FieldType.TIMESTAMP_MILLIS, true)));

    @Test
    void defaultsToDictionaryAndZstd() {
        ColumnEncodingPolicy policy = ColumnEncodingPolicy.defaults();

        assertThat(policy.encodingOf("player_id")).isEqualTo(ColumnEncoding.DICTIONARY);
        assertThat(policy.getCodec()).isEqualTo(CompressionCodecName.ZSTD);
        assertThat(policy.effectiveSortKey(ROSTER)).isNull();
    }

    @Test
    void firstDeltaColumnInSchemaOrderBecomesSortKey() {
        ColumnEncodingPolicy policy = ColumnEncodingPolicy.builder()
                .encoding("debut", ColumnEncoding.DELTA)
                .encoding("year", ColumnEncoding.DELTA)
                .build();

        assertThat(policy.effectiveSortKey(ROSTER)).isEqualTo("year");
        assertThat(policy.toBuilder().sortKey("debut").build().effectiveSortKey(ROSTER)).isEqualTo("debut");
    }

    @Test
    void deltaOnTextColumnIsAConfigurationError() {
        ColumnEncodingPolicy policy = ColumnEncodingPolicy.builder().encoding("player_id", ColumnEncoding.DELTA).build();

        assertThatThrownBy(() -> policy.validate(ROSTER))
                .isInstanceOf(SchemaDefinitionException.class)
                .hasMessageContaining("player_id");
    }

    @Test
    void unknownSortKeyIsAConfigurationError() {
        ColumnEncodingPolicy policy = ColumnEncodingPolicy.builder().sortKey("season").build();

        assertThatThrownBy(() -> policy.validate(ROSTER)).isInstanceOf(SchemaDefinitionException.class);
    }
}
