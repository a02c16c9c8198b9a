package com.example.retrosheet.normalize;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@Tag("unit")
class SourceCharsetsTest {

    @TempDir
    Path dir;

    @Test
    void resolvesNamesAndBareCodePages() {
        assertThat(SourceCharsets.resolveCharset("UTF-8")).isEqualTo(StandardCharsets.UTF_8);
        assertThat(SourceCharsets.resolveCharset("1252")).isEqualTo(Charset.forName("windows-1252"));
        assertThatThrownBy(() -> SourceCharsets.of("no-such-charset"))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void fixedCharsetIsUsedForEveryFile() throws Exception {
        Path file = dir.resolve("a.TXT");
        Files.writeString(file, "plain ascii", StandardCharsets.US_ASCII);

        assertThat(SourceCharsets.of("ISO-8859-1").charsetFor(file)).isEqualTo(StandardCharsets.ISO_8859_1);
    }

    @Test
    void autoFallsBackForEmptyFile() throws Exception {
        Path file = dir.resolve("empty.TXT");
        Files.write(file, new byte[0]);

        assertThat(SourceCharsets.of("auto").charsetFor(file)).isEqualTo(StandardCharsets.UTF_8);
        assertThat(SourceCharsets.of(null).toString()).startsWith("auto");
    }

    @Test
    void autoDetectsUtf8WithAccents() throws Exception {
        Path file = dir.resolve("biofile.csv");
        String text = "PLAYERID,LAST,FIRST\n"
                + "aparl001,Aparicio,Luis,Maracaibo,Venezuela\n".repeat(20)
                + "pereo001,Pérez,Óscar,Güiria,Venezuela\n".repeat(20);
        Files.writeString(file, text, StandardCharsets.UTF_8);

        assertThat(SourceCharsets.of("auto").charsetFor(file)).isEqualTo(StandardCharsets.UTF_8);
    }
}
