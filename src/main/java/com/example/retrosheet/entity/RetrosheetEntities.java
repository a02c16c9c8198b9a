package com.example.retrosheet.entity;

import com.example.retrosheet.columnar.ColumnEncoding;
import com.example.retrosheet.columnar.ColumnEncodingPolicy;
import com.example.retrosheet.normalize.TrailingFieldFilter;
import com.example.retrosheet.schema.SchemaDefinitionException;
import lombok.Value;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * The Retrosheet simple files: where each entity's sources live under the Retrosheet download
 * directory and how they are normalized and encoded.
 */
public final class RetrosheetEntities {

    @Value
    static class Template {
        String name;
        String subdir;
        String glob;
        EntityRules rules;
        ColumnEncodingPolicy encoding;
    }

    private static final Map<String, Template> TEMPLATES = new LinkedHashMap<>();

    static {
        // Game logs legitimately repeat rows across sources; only games without event or box
        // score data are kept, the rest are built from the event files.
        add(new Template("gamelog", "gamelog", "*.TXT",
                EntityRules.builder().dedupe(false).rowFilter(TrailingFieldFilter.equalTo("N")).build(),
                ColumnEncodingPolicy.builder()
                        .encoding("date", ColumnEncoding.DELTA)
                        .encoding("visiting_line_score", ColumnEncoding.PLAIN)
                        .encoding("home_line_score", ColumnEncoding.PLAIN)
                        .encoding("additional_info", ColumnEncoding.PLAIN)
                        .build()));
        add(new Template("schedule", "schedule", "*.TXT",
                EntityRules.defaults(),
                ColumnEncodingPolicy.builder()
                        .encoding("date", ColumnEncoding.DELTA)
                        .encoding("makeup_dates", ColumnEncoding.PLAIN)
                        .build()));
        add(new Template("park", "misc", "parkcode.txt",
                EntityRules.builder().stripHeader(true).build(),
                ColumnEncodingPolicy.builder()
                        .encoding("park_id", ColumnEncoding.PLAIN)
                        .encoding("name", ColumnEncoding.PLAIN)
                        .encoding("aka", ColumnEncoding.PLAIN)
                        .encoding("notes", ColumnEncoding.PLAIN)
                        .build()));
        add(new Template("roster", "rosters", "*.ROS",
                EntityRules.builder().prependTag(true).build(),
                ColumnEncodingPolicy.builder()
                        .encoding("year", ColumnEncoding.DELTA)
                        .build()));
        add(new Template("bio", "misc", "biofile.csv",
                EntityRules.builder().stripHeader(true).build(),
                ColumnEncodingPolicy.builder()
                        .encoding("player_id", ColumnEncoding.PLAIN)
                        .encoding("birth_name", ColumnEncoding.PLAIN)
                        .encoding("cemetery", ColumnEncoding.PLAIN)
                        .encoding("cemetery_note", ColumnEncoding.PLAIN)
                        .encoding("name_change", ColumnEncoding.PLAIN)
                        .encoding("bat_change", ColumnEncoding.PLAIN)
                        .build()));
    }

    private RetrosheetEntities() {}

    private static void add(Template template) {
        TEMPLATES.put(template.getName(), template);
    }

    public static Set<String> names() {
        return TEMPLATES.keySet();
    }

    /**
     * Resolves the sources of the named entities under {@code retrosheetDir}, in the order given.
     *
     * @throws SchemaDefinitionException for a name that is not a Retrosheet entity
     */
    public static List<EntityDefinition> resolve(Path retrosheetDir, Collection<String> names) throws IOException {
        List<EntityDefinition> entities = new ArrayList<>();
        for (String name : names) {
            Template template = TEMPLATES.get(name);
            if (template == null) {
                throw new SchemaDefinitionException("Unknown entity '" + name + "'; known: " + TEMPLATES.keySet());
            }
            entities.add(EntityDefinition.builder()
                    .name(name)
                    .sources(SourceResolver.resolve(retrosheetDir.resolve(template.getSubdir()), template.getGlob()))
                    .rules(template.getRules())
                    .encoding(template.getEncoding())
                    .build());
        }
        return entities;
    }

    public static List<EntityDefinition> resolveAll(Path retrosheetDir) throws IOException {
        return resolve(retrosheetDir, names());
    }
}
