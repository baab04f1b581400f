package com.assign.x.processors.instrumentation;

import com.assign.x.processors.matcher.hungarian.HungarianSolver;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.stream.Stream;

import static org.assertj.core.api.Assertions.assertThat;

class HtmlStepWriterTest {

    @TempDir
    Path tempDir;

    @Test
    void writesOnePagePerTransition() throws IOException {
        Path out = tempDir.resolve("steps");
        Files.createDirectories(out);
        Files.writeString(out.resolve("stale.html"), "old run");
        HtmlStepWriter writer = new HtmlStepWriter(out);

        new HungarianSolver(new double[][]{{5, 4, 6, 3}, {3, 4, 6, 5}, {3, 4, 5, 6}, {5, 4, 3, 6}}, writer).solve();

        List<String> names;
        try (Stream<Path> files = Files.list(out)) {
            names = files.map(p -> p.getFileName().toString()).sorted().toList();
        }
        assertThat(names).doesNotContain("stale.html");
        assertThat(names).first().isEqualTo("step_000.html");
        assertThat(names).hasSizeGreaterThan(5);

        String first = Files.readString(out.resolve("step_000.html"));
        assertThat(first).contains("<table>", "REDUCED");

        String last = Files.readString(out.resolve(names.get(names.size() - 1)));
        assertThat(last).contains("SOLVED", "selected");
    }

    @Test
    void marksThePathWhileBuildingIt() throws IOException {
        Path out = tempDir.resolve("path");
        new HungarianSolver(new double[][]{{5, 4, 6, 3}, {3, 4, 6, 5}, {3, 4, 5, 6}, {5, 4, 3, 6}},
                new HtmlStepWriter(out)).solve();

        boolean pathPageFound;
        try (Stream<Path> files = Files.list(out)) {
            pathPageFound = files.map(HtmlStepWriterTest::read)
                    .anyMatch(html -> html.contains("BUILD_PATH") && html.contains("path\""));
        }
        assertThat(pathPageFound).isTrue();
    }

    private static String read(Path path) {
        try {
            return Files.readString(path);
        } catch (IOException e) {
            throw new java.io.UncheckedIOException(e);
        }
    }
}
