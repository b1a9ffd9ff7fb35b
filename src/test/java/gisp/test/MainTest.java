// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package gisp.test;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import gisp.cli.Arguments;
import gisp.cli.Main;
import static org.assertj.core.api.Assertions.assertThat;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

final class MainTest {
    @Test
    void replReportsBadLinesAndContinues() {
        final var run = run(List.of(), ")\n(if)\n\n(def x 1)\n(+ x 2)\nquit\n(def y 2)\n");
        assertThat(run.exitCode()).isZero();
        assertThat(run.err()).contains(
            "lex error at line 1, column 1: unexpected close paren",
            "lowering error at line 1, column 1: if expects 2 to 3 arguments but got 0\n  in form: (if)");
        assertThat(run.out())
            .startsWith(">> ")
            .contains("static long x = 1L;", "System.out.println(x + 2L);")
            .doesNotContain("y = 2L");
        assertThat(run.out().split(">> ", -1)).hasSize(7);
    }

    @ParameterizedTest
    @ValueSource(strings = {"exit", "quit", "q", "  q  "})
    void replExitCommands(final String command) {
        final var run = run(List.of(), command + "\n(def x 1)\n");
        assertThat(run.exitCode()).isZero();
        assertThat(run.out()).isEqualTo(">> ");
        assertThat(run.err()).isEmpty();
    }

    @Test
    void replEndsAtEndOfInput() {
        final var run = run(List.of(), "(def x 1)");
        assertThat(run.exitCode()).isZero();
        assertThat(run.out()).isEqualTo(">> static long x = 1L;" + System.lineSeparator() + ">> ");
    }

    @Test
    void fileModePrintsTheCompilationUnit() throws IOException {
        final var file = write("good.gisp", "(ns demo) (def x 1)");
        final var run = run(List.of("--class-name=Demo", file.toString()), "");
        assertThat(run.exitCode()).isZero();
        assertThat(run.out()).contains("package demo;", "public final class Demo {", "static long x = 1L;");
        assertThat(run.err()).isEmpty();
    }

    @Test
    void fileModeReportsDiagnosticsOnStandardError() throws IOException {
        final var file = write("bad.gisp", "(def x 1)\n(foo\n");
        final var run = run(List.of(file.toString()), "");
        assertThat(run.exitCode()).isEqualTo(1);
        assertThat(run.out()).isEmpty();
        assertThat(run.err()).startsWith(file + ": lex error at line 2, column 1: unclosed paren");
    }

    @Test
    void unreadableFileAbortsTheProcess() {
        final var missing = directory.resolve("missing.gisp");
        final var run = run(List.of(missing.toString()), "");
        assertThat(run.exitCode()).isEqualTo(1);
        assertThat(run.out()).isEmpty();
        assertThat(run.err()).contains("java.nio.file.NoSuchFileException", "Reading source file " + missing);
    }

    @Test
    void usageErrors() {
        final var run = run(List.of("--bogus"), "");
        assertThat(run.exitCode()).isEqualTo(64);
        assertThat(run.err()).contains("Unknown option: --bogus", Arguments.USAGE);
    }

    @TempDir
    Path directory;

    private Path write(final String name, final String contents) throws IOException {
        final var file = directory.resolve(name);
        Files.writeString(file, contents);
        return file;
    }

    private static Run run(final List<String> args, final String input) {
        final var out = new ByteArrayOutputStream();
        final var err = new ByteArrayOutputStream();
        final var exitCode = Main.run(
            args,
            new ByteArrayInputStream(input.getBytes(StandardCharsets.UTF_8)),
            new PrintStream(out, true, StandardCharsets.UTF_8),
            new PrintStream(err, true, StandardCharsets.UTF_8));
        return new Run(exitCode, out.toString(StandardCharsets.UTF_8), err.toString(StandardCharsets.UTF_8));
    }

    private record Run(int exitCode, String out, String err) {
    }
}
