package com.frameception.core.logs;

import com.frameception.core.model.BuildLogLine;
import com.frameception.core.model.BuildStream;
import com.frameception.core.model.LogEntry;

import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Filtered, annotated view over deployment build-log lines.
 */
public final class BuildLogView {

    static final String WARNING_PREFIX = "warning";

    private static final DateTimeFormatter UTC_FORMAT =
            DateTimeFormatter.RFC_1123_DATE_TIME.withZone(ZoneOffset.UTC);

    private BuildLogView() {}

    /**
     * Filters and annotates build-log lines. The returned stream is lazy and built from
     * {@code lines} on every call, so toggling {@code showAll} simply means calling again.
     *
     * @param lines   source lines, never modified
     * @param showAll false keeps only stderr lines that are not warnings
     */
    public static Stream<AnnotatedBuildLogLine> filter(List<BuildLogLine> lines, boolean showAll) {
        if (lines == null) {
            return Stream.empty();
        }
        return lines.stream()
                .filter(line -> showAll || isErrorLine(line))
                .filter(line -> !line.text().trim().isEmpty())
                .map(line -> new AnnotatedBuildLogLine(
                        line,
                        format(line.timestamp()),
                        line.stream() == BuildStream.STDERR));
    }

    /**
     * Joins the text of every error line nested in the given entries, one line each.
     */
    public static String errorText(List<LogEntry> entries) {
        return entries.stream()
                .flatMap(entry -> entry.buildLines().stream())
                .filter(BuildLogView::isErrorLine)
                .map(BuildLogLine::text)
                .filter(text -> !text.isBlank())
                .collect(Collectors.joining("\n"));
    }

    static boolean isErrorLine(BuildLogLine line) {
        return line.stream() == BuildStream.STDERR && !line.text().startsWith(WARNING_PREFIX);
    }

    private static String format(Instant timestamp) {
        return timestamp != null ? UTC_FORMAT.format(timestamp) : "";
    }
}
