package com.example.retrosheet.schema;

import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Translates declared relational column lists into {@link EntitySchema}s.
 * <p>
 * All declarations are translated when the registry is built, so an unusable declaration
 * fails the run at startup instead of at read time. Columns flagged as autoincrement keys
 * are dropped; they never appear in the simple files.
 */
@Slf4j
public class SchemaRegistry {

    private final Map<String, EntitySchema> schemas;

    public SchemaRegistry(Map<String, List<ColumnDeclaration>> declarations) {
        Map<String, EntitySchema> built = new LinkedHashMap<>();
        declarations.forEach((entity, columns) -> built.put(entity, translate(entity, columns)));
        this.schemas = Collections.unmodifiableMap(built);
        log.debug("Schema registry built for entities {}", schemas.keySet());
    }

    /**
     * @throws SchemaDefinitionException if the entity was never declared
     */
    public EntitySchema schemaFor(String entity) {
        EntitySchema schema = schemas.get(entity);
        if (schema == null) {
            throw new SchemaDefinitionException("No schema declared for entity '" + entity + "'; declared: " + schemas.keySet());
        }
        return schema;
    }

    public Set<String> entities() {
        return schemas.keySet();
    }

    public static FieldType fieldTypeOf(RelationalType type) {
        // no default branch: a new RelationalType constant must be mapped here to compile
        return switch (type) {
            case INTEGER -> FieldType.INT32;
            case SMALLINT -> FieldType.INT16;
            case FLOAT -> FieldType.FLOAT64;
            case CHAR, STRING, TEXT -> FieldType.UTF8;
            case BOOLEAN -> FieldType.BOOLEAN;
            // some Parquet consumers cannot read DATE, so dates are carried as timestamps
            case DATE, DATETIME -> FieldType.TIMESTAMP_MILLIS;
        };
    }

    private static EntitySchema translate(String entity, List<ColumnDeclaration> columns) {
        if (columns == null || columns.isEmpty()) {
            throw new SchemaDefinitionException("Entity '" + entity + "' declares no columns");
        }
        Set<String> seen = new HashSet<>();
        List<FieldSpec> fields = new ArrayList<>();
        for (ColumnDeclaration column : columns) {
            if (!seen.add(column.getName())) {
                throw new SchemaDefinitionException("Entity '" + entity + "' declares column '" + column.getName() + "' twice");
            }
            if (column.isAutoincrement()) {
                continue;
            }
            fields.add(new FieldSpec(column.getName(), fieldTypeOf(column.getType()), column.isNullable()));
        }
        if (fields.isEmpty()) {
            throw new SchemaDefinitionException("Entity '" + entity + "' has only autoincrement columns");
        }
        return new EntitySchema(entity, fields);
    }
}
