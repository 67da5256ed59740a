package org.pragmatica.twistor.error;

import org.pragmatica.twistor.tree.SourceSpan;

import java.util.ArrayList;
import java.util.List;

/**
 * User-facing rendering of a syntax error against the expression text.
 *
 * <p>Example output:
 * <pre>
 * error[lex]: Unexpected character '$'
 *   --> 1:4
 *   |
 * 1 | Z1 $ Z2
 *   |    ^
 *   |
 * </pre>
 *
 * @param code    Error category shown in the header
 * @param message Primary error message
 * @param span    Source span the error refers to
 * @param notes   Additional notes or suggestions
 */
public record Diagnostic(
    String code,
    String message,
    SourceSpan span,
    List<String> notes
) {
    public Diagnostic {
        notes = List.copyOf(notes);
    }

    /**
     * Create a diagnostic for a lexer or parser failure.
     */
    public static Diagnostic of(TwistorSyntaxException error) {
        return new Diagnostic(error.kind(), error.reason(), error.span(), List.of());
    }

    /**
     * Add a note.
     */
    public Diagnostic withNote(String note) {
        var newNotes = new ArrayList<>(notes);
        newNotes.add(note);
        return new Diagnostic(code, message, span, newNotes);
    }

    /**
     * Add a help suggestion.
     */
    public Diagnostic withHelp(String help) {
        return withNote("help: " + help);
    }

    /**
     * Format with the offending line and a caret underline.
     *
     * @param source The expression text the error was raised for
     * @return Formatted diagnostic, one line per row, each terminated by a newline
     */
    public String format(String source) {
        var sb = new StringBuilder();
        var lines = source.split("\n", -1);
        var loc = span.start();

        sb.append("error[").append(code).append("]: ").append(message).append("\n");
        sb.append("  --> ").append(loc.line()).append(":").append(loc.column()).append("\n");

        int gutterWidth = String.valueOf(loc.line()).length();
        var gutter = " ".repeat(gutterWidth + 1) + "|";
        sb.append(gutter).append("\n");

        if (loc.line() >= 1 && loc.line() <= lines.length) {
            var lineContent = lines[loc.line() - 1];
            sb.append(String.format("%" + gutterWidth + "d", loc.line()))
              .append(" | ")
              .append(lineContent)
              .append("\n");
            sb.append(gutter)
              .append(" ")
              .append(" ".repeat(loc.column() - 1))
              .append("^".repeat(underlineLength(lineContent)))
              .append("\n");
        }

        sb.append(gutter).append("\n");
        for (var note : notes) {
            sb.append(" ".repeat(gutterWidth + 1)).append("= ").append(note).append("\n");
        }
        return sb.toString();
    }

    // Spans crossing a line break are underlined to the end of the first line
    private int underlineLength(String lineContent) {
        int available = lineContent.length() - (span.start().column() - 1);
        int length = span.end().line() == span.start().line()
                     ? span.length()
                     : available;
        return Math.max(1, Math.min(length, Math.max(available, 1)));
    }

    /**
     * Simple single-line format for quick display.
     */
    public String formatSimple() {
        var loc = span.start();
        return String.format("input:%d:%d: error[%s]: %s", loc.line(), loc.column(), code, message);
    }
}
