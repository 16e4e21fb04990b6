package org.smileyface.campuscrawler.writer;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.*;

class DocumentWriterTest {

    private static final String URL = "https://www.bracu.ac.bd/about/history";

    @TempDir
    Path tempDir;

    @Test
    void textOfExactlyMinimumLengthIsNotWritten() throws IOException {
        Path out = tempDir.resolve("docs");
        DocumentWriter writer = new DocumentWriter(out, 150, 80);

        boolean written = writer.write(URL, "History", "x".repeat(150));

        assertThat(written).isFalse();
        assertThat(out).doesNotExist();
    }

    @Test
    void textOneCharacterOverMinimumIsWritten() throws IOException {
        Path out = tempDir.resolve("docs");
        DocumentWriter writer = new DocumentWriter(out, 150, 80);
        String text = "x".repeat(151);

        boolean written = writer.write(URL, "History", text);

        Path file = out.resolve("wwwbracuacbd_about_history.txt");
        assertThat(written).isTrue();
        assertThat(file).exists();
        assertThat(Files.readString(file, StandardCharsets.UTF_8))
                .isEqualTo("Source URL: " + URL + "\nPage Title: History\n\n" + text);
    }

    @Test
    void lengthIsMeasuredInCharactersNotBytes() throws IOException {
        DocumentWriter writer = new DocumentWriter(tempDir, 150, 80);
        // 151 Bengali characters are far more than 151 bytes in UTF-8, 150 of them still too few
        assertThat(writer.write(URL, "", "ক".repeat(150))).isFalse();
        assertThat(writer.write(URL, "", "ক".repeat(151))).isTrue();
        assertThat(Files.readString(writer.resolvePath(URL), StandardCharsets.UTF_8)).endsWith("ক".repeat(151));
    }

    @Test
    void rewritingSamePageOverwritesFile() throws IOException {
        DocumentWriter writer = new DocumentWriter(tempDir, 10, 80);

        writer.write(URL, "Old", "old text that is long enough");
        writer.write(URL, "New", "new text that is long enough");

        String content = Files.readString(writer.resolvePath(URL), StandardCharsets.UTF_8);
        assertThat(content).contains("Page Title: New").doesNotContain("old text");
        try (var files = Files.list(tempDir)) {
            assertThat(files.count()).isEqualTo(1);
        }
    }

    @Test
    void nullTitleIsWrittenAsEmpty() throws IOException {
        DocumentWriter writer = new DocumentWriter(tempDir, 0, 80);
        writer.write(URL, null, "body");
        assertThat(Files.readString(writer.resolvePath(URL))).startsWith("Source URL: " + URL + "\nPage Title: \n\n");
    }

    @Test
    void fileNameIsCappedAtConfiguredLength() {
        DocumentWriter writer = new DocumentWriter(tempDir, 150, 20);
        assertThat(writer.resolvePath(URL).getFileName().toString()).isEqualTo("wwwbracuacbd_about_h.txt");
    }

    @Test
    void writeFailureSurfacesAsIOException() throws IOException {
        Path blocker = tempDir.resolve("not-a-dir");
        Files.writeString(blocker, "file in the way");
        DocumentWriter writer = new DocumentWriter(blocker, 0, 80);

        assertThatThrownBy(() -> writer.write(URL, "t", "some text")).isInstanceOf(IOException.class);
    }
}
