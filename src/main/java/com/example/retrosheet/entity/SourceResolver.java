package com.example.retrosheet.entity;

import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Lists the regular files of a directory matching a glob, in sorted path order.
 */
@Slf4j
public final class SourceResolver {

    private SourceResolver() {}

    public static List<SourceFile> resolve(Path dir, String glob) throws IOException {
        if (!Files.isDirectory(dir)) {
            log.warn("Source directory {} does not exist", dir);
            return Collections.emptyList();
        }
        List<SourceFile> files = new ArrayList<>();
        try (DirectoryStream<Path> stream = Files.newDirectoryStream(dir, glob)) {
            for (Path path : stream) {
                if (Files.isRegularFile(path)) {
                    files.add(SourceFile.of(path));
                }
            }
        }
        Collections.sort(files);
        log.debug("Resolved {} files for {}/{}", files.size(), dir, glob);
        return files;
    }
}
