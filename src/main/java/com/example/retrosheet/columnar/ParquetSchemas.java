package com.example.retrosheet.columnar;

import com.example.retrosheet.schema.EntitySchema;
import com.example.retrosheet.schema.FieldSpec;
import org.apache.parquet.schema.LogicalTypeAnnotation;
import org.apache.parquet.schema.MessageType;
import org.apache.parquet.schema.PrimitiveType.PrimitiveTypeName;
import org.apache.parquet.schema.Type.Repetition;
import org.apache.parquet.schema.Types;

/**
 * Maps an {@link EntitySchema} to the Parquet message type of its artifact.
 */
public final class ParquetSchemas {

    private ParquetSchemas() {}

    public static MessageType toMessageType(EntitySchema schema) {
        Types.MessageTypeBuilder builder = Types.buildMessage();
        for (FieldSpec field : schema.getFields()) {
            Repetition repetition = field.isNullable() ? Repetition.OPTIONAL : Repetition.REQUIRED;
            switch (field.getType()) {
                case INT16:
                    builder.primitive(PrimitiveTypeName.INT32, repetition)
                            .as(LogicalTypeAnnotation.intType(16, true)).named(field.getName());
                    break;
                case INT32:
                    builder.primitive(PrimitiveTypeName.INT32, repetition)
                            .as(LogicalTypeAnnotation.intType(32, true)).named(field.getName());
                    break;
                case FLOAT64:
                    builder.primitive(PrimitiveTypeName.DOUBLE, repetition).named(field.getName());
                    break;
                case UTF8:
                    builder.primitive(PrimitiveTypeName.BINARY, repetition)
                            .as(LogicalTypeAnnotation.stringType()).named(field.getName());
                    break;
                case BOOLEAN:
                    builder.primitive(PrimitiveTypeName.BOOLEAN, repetition).named(field.getName());
                    break;
                case TIMESTAMP_MILLIS:
                    builder.primitive(PrimitiveTypeName.INT64, repetition)
                            .as(LogicalTypeAnnotation.timestampType(true, LogicalTypeAnnotation.TimeUnit.MILLIS))
                            .named(field.getName());
                    break;
                default:
                    throw new IllegalStateException("Unhandled field type " + field.getType());
            }
        }
        return builder.named(schema.getEntity());
    }
}
