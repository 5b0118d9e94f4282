package com.frameception.core.logs;

import com.frameception.core.model.BuildLogLine;
import com.frameception.core.model.BuildStream;
import com.frameception.core.model.LogSource;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

import static com.frameception.Fixtures.*;
import static org.junit.jupiter.api.Assertions.*;

class BuildLogViewTest {

    private final List<BuildLogLine> lines = List.of(
            stdout("1", "Installing dependencies"),
            stderr("2", "warning: deprecated package"),
            stderr("3", "Error: Cannot find module 'viem'"),
            stderr("4", "   "),
            BuildLogLine.of("5", BuildStream.OTHER, "exit 1", null),
            stderr(null, "Build failed"));

    private static List<String> texts(List<AnnotatedBuildLogLine> annotated) {
        return annotated.stream().map(a -> a.line().text()).toList();
    }

    @Test
    @DisplayName("error view keeps non-warning stderr lines with text")
    void errorsOnly() {
        var view = BuildLogView.filter(lines, false).toList();

        assertEquals(List.of("Error: Cannot find module 'viem'", "Build failed"), texts(view));
        assertTrue(view.stream().allMatch(AnnotatedBuildLogLine::error));
    }

    @Test
    @DisplayName("showAll keeps every non-blank line and flags only stderr as error")
    void showAll() {
        var view = BuildLogView.filter(lines, true).toList();

        assertEquals(5, view.size());
        assertFalse(view.get(0).error());
        assertTrue(view.get(1).error());
        assertFalse(view.get(3).error());
    }

    @Test
    @DisplayName("timestamps render as RFC 1123 in UTC, empty when missing")
    void timestamps() {
        BuildLogLine dated = BuildLogLine.of("d", BuildStream.STDERR, "boom", Instant.parse("2026-01-02T03:04:05Z"));
        BuildLogLine undated = BuildLogLine.of("u", BuildStream.STDERR, "bang", null);

        var view = BuildLogView.filter(List.of(dated, undated), true).toList();

        assertEquals("Fri, 2 Jan 2026 03:04:05 GMT", view.get(0).timestamp());
        assertEquals("", view.get(1).timestamp());
    }

    @Test
    @DisplayName("render key falls back to position when the line has no id")
    void renderKey() {
        var view = BuildLogView.filter(lines, false).toList();

        assertEquals("3", view.get(0).key(0));
        assertEquals("1", view.get(1).key(1));
    }

    @Test
    @DisplayName("every call builds a fresh stream and leaves the input untouched")
    void restartableAndNonMutating() {
        List<BuildLogLine> source = new ArrayList<>(lines);

        long errors = BuildLogView.filter(source, false).count();
        long all = BuildLogView.filter(source, true).count();
        long errorsAgain = BuildLogView.filter(source, false).count();

        assertEquals(errors, errorsAgain);
        assertTrue(all > errors);
        assertEquals(lines, source);
        assertEquals(0, BuildLogView.filter(null, true).count());
    }

    @Test
    @DisplayName("errorText joins error lines of all entries")
    void errorText() {
        var logs = List.of(
                entry("a", LogSource.BACKEND, 1),
                buildReport("r1", 5, stderr("1", "warning: slow"), stderr("2", "TS2304: Cannot find name 'x'")),
                buildReport("r2", 6, stdout("3", "done"), stderr("4", "Command failed")));

        assertEquals("TS2304: Cannot find name 'x'\nCommand failed", BuildLogView.errorText(logs));
        assertEquals("", BuildLogView.errorText(List.of()));
    }
}
