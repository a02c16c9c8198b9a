package com.example.retrosheet.entity;

import com.example.retrosheet.columnar.ColumnEncodingPolicy;
import lombok.Builder;
import lombok.NonNull;
import lombok.Singular;
import lombok.Value;

import java.util.List;
import java.util.stream.Collectors;

/**
 * A logical entity: its name, its resolved source files and how to normalize and encode them.
 * Sources are kept in sorted path order whatever order they were added in.
 */
@Value
public class EntityDefinition {
    String name;
    List<SourceFile> sources;
    EntityRules rules;
    ColumnEncodingPolicy encoding;

    @Builder(toBuilder = true)
    private EntityDefinition(@NonNull String name, @Singular List<SourceFile> sources,
                             EntityRules rules, ColumnEncodingPolicy encoding) {
        this.name = name;
        this.sources = sources.stream().sorted().collect(Collectors.toUnmodifiableList());
        this.rules = rules != null ? rules : EntityRules.defaults();
        this.encoding = encoding != null ? encoding : ColumnEncodingPolicy.defaults();
    }
}
