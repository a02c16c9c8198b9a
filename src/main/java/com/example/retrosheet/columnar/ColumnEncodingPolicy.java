package com.example.retrosheet.columnar;

import com.example.retrosheet.schema.EntitySchema;
import com.example.retrosheet.schema.FieldSpec;
import com.example.retrosheet.schema.SchemaDefinitionException;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;
import org.apache.parquet.hadoop.metadata.CompressionCodecName;

import java.util.Map;

/**
 * Encoding of each column of one artifact, plus the single compression codec applied to all
 * of it. Columns not listed use {@link #getDefaultEncoding()}.
 */
@Value
@Builder(toBuilder = true)
public class ColumnEncodingPolicy {

    @Singular Map<String, ColumnEncoding> encodings;
    @Builder.Default ColumnEncoding defaultEncoding = ColumnEncoding.DICTIONARY;
    @Builder.Default CompressionCodecName codec = CompressionCodecName.ZSTD;
    /** Column rows are stably sorted on before writing; defaults to the first DELTA column. */
    String sortKey;

    public static ColumnEncodingPolicy defaults() {
        return builder().build();
    }

    public ColumnEncoding encodingOf(String column) {
        return encodings.getOrDefault(column, defaultEncoding);
    }

    /** The sort column for this schema, or null when rows keep stream order. */
    public String effectiveSortKey(EntitySchema schema) {
        if (sortKey != null) {
            return sortKey;
        }
        for (FieldSpec field : schema.getFields()) {
            if (encodingOf(field.getName()) == ColumnEncoding.DELTA) {
                return field.getName();
            }
        }
        return null;
    }

    /**
     * @throws SchemaDefinitionException for a column the schema lacks, or DELTA on a
     *         non-integral column
     */
    public void validate(EntitySchema schema) {
        if (defaultEncoding == ColumnEncoding.DELTA) {
            throw new SchemaDefinitionException(schema.getEntity() + ": DELTA cannot be the default encoding");
        }
        encodings.forEach((column, encoding) -> {
            int index = schema.indexOf(column);
            if (index < 0) {
                throw new SchemaDefinitionException(schema.getEntity() + ": encoding declared for unknown column '" + column + "'");
            }
            if (encoding == ColumnEncoding.DELTA && !schema.field(index).getType().isIntegral()) {
                throw new SchemaDefinitionException(schema.getEntity() + ": DELTA encoding needs an integer or timestamp column, '"
                        + column + "' is " + schema.field(index).getType());
            }
        });
        if (sortKey != null && schema.indexOf(sortKey) < 0) {
            throw new SchemaDefinitionException(schema.getEntity() + ": unknown sort key '" + sortKey + "'");
        }
    }
}
