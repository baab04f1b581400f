package com.assign.x.processors.instrumentation;

import com.assign.x.dto.SolverSnapshot;
import com.assign.x.models.SolverState;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Comparator;
import java.util.stream.Stream;

/**
 * Writes one HTML page per solver transition ({@code step_000.html}, {@code step_001.html}, ...).
 * <p>
 * Covered rows and columns are shaded; selected zeros are green, prepared zeros blue and cells of the
 * alternating path magenta. The output directory is emptied before the first page is written.
 * </p>
 */
@Slf4j
public class HtmlStepWriter implements SolverStepListener {

    private static final String STYLE = """
            <style>
            table { font-family: arial, sans-serif; border-collapse: collapse; }
            td, th { border: 1px solid #dddddd; text-align: right; padding: 8px; }
            td.covered, th.covered { background-color: #f4cccc; }
            td.twice { background-color: #e06666; }
            td.selected { color: #00aa00; font-weight: bold; }
            td.prepared { color: #0000ff; font-weight: bold; }
            td.path { outline: 2px solid #ff00ff; }
            </style>
            """;

    private final Path outputDir;
    private boolean prepared;

    public HtmlStepWriter(Path outputDir) {
        this.outputDir = outputDir;
    }

    @Override
    public void onTransition(SolverState state, SolverSnapshot snapshot) {
        try {
            if (!prepared) {
                resetDirectory();
                prepared = true;
            }
            Path file = outputDir.resolve(String.format("step_%03d.html", snapshot.step()));
            Files.writeString(file, render(state, snapshot), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write step " + snapshot.step() + " to " + outputDir, e);
        }
    }

    public Path getOutputDir() {
        return outputDir;
    }

    private void resetDirectory() throws IOException {
        if (Files.exists(outputDir)) {
            try (Stream<Path> walk = Files.walk(outputDir)) {
                for (Path p : walk.sorted(Comparator.reverseOrder()).toList()) {
                    if (!p.equals(outputDir)) {
                        Files.delete(p);
                    }
                }
            }
        }
        Files.createDirectories(outputDir);
        log.info("Writing solver steps to {}", outputDir);
    }

    static String render(SolverState state, SolverSnapshot snapshot) {
        int n = snapshot.size();
        StringBuilder html = new StringBuilder();
        html.append("<!DOCTYPE html>\n<html>\n<head>\n").append(STYLE).append("</head>\n<body>\n");
        html.append("<h2>Step ").append(snapshot.step()).append(": ").append(state).append("</h2>\n");
        html.append("<table>\n<tr>\n<th>&nbsp;</th>\n");
        for (int j = 0; j < n; j++) {
            html.append(snapshot.coveredCols()[j] ? "<th class=\"covered\">" : "<th>").append(j).append("</th>\n");
        }
        html.append("</tr>\n");

        for (int i = 0; i < n; i++) {
            boolean rowCovered = snapshot.coveredRows()[i];
            html.append("<tr>\n").append(rowCovered ? "<th class=\"covered\">" : "<th>").append(i).append("</th>\n");
            for (int j = 0; j < n; j++) {
                html.append("<td class=\"").append(cellClasses(snapshot, i, j, rowCovered).trim()).append("\">")
                        .append(formatValue(snapshot.matrix()[i][j])).append("</td>\n");
            }
            html.append("</tr>\n");
        }
        html.append("</table>\n</body>\n</html>\n");
        return html.toString();
    }

    private static String cellClasses(SolverSnapshot snapshot, int i, int j, boolean rowCovered) {
        boolean colCovered = snapshot.coveredCols()[j];
        StringBuilder classes = new StringBuilder();
        if (rowCovered && colCovered) {
            classes.append("twice ");
        } else if (rowCovered || colCovered) {
            classes.append("covered ");
        }
        if (snapshot.isSelected(i, j)) {
            classes.append("selected ");
        } else if (snapshot.isPrepared(i, j)) {
            classes.append("prepared ");
        }
        if (snapshot.isOnPath(i, j)) {
            classes.append("path ");
        }
        return classes.toString();
    }

    private static String formatValue(double value) {
        if (value == Math.rint(value) && Math.abs(value) < 1e15) {
            return String.valueOf((long) value);
        }
        return String.format("%.4f", value);
    }
}
