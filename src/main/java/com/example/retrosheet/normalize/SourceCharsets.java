package com.example.retrosheet.normalize;

import com.ibm.icu.text.CharsetDetector;
import com.ibm.icu.text.CharsetMatch;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.Charset;
import java.nio.charset.IllegalCharsetNameException;
import java.nio.charset.StandardCharsets;
import java.nio.charset.UnsupportedCharsetException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Decides how source files are decoded. Either one fixed charset for every file, or
 * {@value #AUTO}, which runs ICU4J's detector over the head of each file. Retrosheet files
 * are a mix of ASCII, Latin-1 and UTF-8 depending on when they were last edited.
 */
@Slf4j
public final class SourceCharsets {

    public static final String AUTO = "auto";

    private static final int DETECTION_SAMPLE_BYTES = 64 * 1024;
    private static final int MIN_CONFIDENCE = 30;

    private final Charset fixed;
    private final Charset fallback;

    private SourceCharsets(Charset fixed, Charset fallback) {
        this.fixed = fixed;
        this.fallback = fallback;
    }

    public static SourceCharsets fixed(Charset charset) {
        return new SourceCharsets(charset, charset);
    }

    public static SourceCharsets detecting(Charset fallback) {
        return new SourceCharsets(null, fallback);
    }

    /**
     * Resolves a configured name: {@value #AUTO}, a Java charset name or alias, or a bare
     * code page such as {@code 1252}.
     *
     * @throws IllegalArgumentException if nothing matches
     */
    public static SourceCharsets of(String name) {
        if (name == null || name.isBlank() || AUTO.equalsIgnoreCase(name.trim())) {
            return detecting(StandardCharsets.UTF_8);
        }
        return fixed(resolveCharset(name));
    }

    static Charset resolveCharset(String name) {
        String n = name.trim();
        List<String> candidates = new ArrayList<>();
        candidates.add(n);
        String digits = n.replaceAll("\\D+", "");
        if (!digits.isEmpty()) {
            candidates.add("windows-" + digits);
            candidates.add("Cp" + digits);
            candidates.add("ISO-8859-" + digits);
        }
        for (String c : candidates) {
            try {
                Charset cs = Charset.forName(c);
                if (!c.equals(n)) {
                    log.info("Resolved charset '{}' -> '{}'", name, cs.name());
                }
                return cs;
            } catch (IllegalCharsetNameException | UnsupportedCharsetException ex) {
                log.debug("Charset.forName failed for '{}': {}", c, ex.getMessage());
            }
        }
        throw new IllegalArgumentException("Unknown charset '" + name + "'");
    }

    public Charset charsetFor(Path file) throws IOException {
        if (fixed != null) {
            return fixed;
        }
        byte[] head;
        try (InputStream in = Files.newInputStream(file)) {
            head = in.readNBytes(DETECTION_SAMPLE_BYTES);
        }
        if (head.length == 0) {
            return fallback;
        }
        CharsetDetector detector = new CharsetDetector();
        detector.setText(head);
        CharsetMatch match = detector.detect();
        if (match == null || match.getConfidence() < MIN_CONFIDENCE) {
            log.debug("No confident charset match for {}, using {}", file, fallback.name());
            return fallback;
        }
        try {
            Charset cs = Charset.forName(match.getName());
            log.debug("Detected charset {} (confidence {}) for {}", cs.name(), match.getConfidence(), file);
            return cs;
        } catch (IllegalCharsetNameException | UnsupportedCharsetException ex) {
            log.warn("Detected charset {} for {} is not supported by the JVM, using {}",
                    match.getName(), file, fallback.name());
            return fallback;
        }
    }

    @Override
    public String toString() {
        return fixed != null ? fixed.name() : AUTO + "(fallback " + fallback.name() + ")";
    }
}
