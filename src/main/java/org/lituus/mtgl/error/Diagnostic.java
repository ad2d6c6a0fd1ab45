package org.lituus.mtgl.error;

import org.lituus.mtgl.tree.SourceSpan;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.TreeSet;

/**
 * Report entry pointing into a card's oracle text, rendered Rust-style.
 *
 * <p>Example output:
 * <pre>
 * warning: unparsed span
 *   --> Lightning Bolt:1:1
 *    |
 *  1 | Frobnicate the wizzle, then draw a card.
 *    | ^^^^^^^^^^^^^^^^^^^^^ no clause rule matched
 *    |
 *    = note: tokens: word word word
 * </pre>
 *
 * @param severity severity level
 * @param code     optional code (e.g. "W001"), may be null
 * @param message  primary message
 * @param span     span on the card's oracle text (line = ability line)
 * @param labels   labeled spans
 * @param notes    trailing notes and help
 */
public record Diagnostic(
    Severity severity,
    String code,
    String message,
    SourceSpan span,
    List<Label> labels,
    List<String> notes
) {
    public enum Severity {
        ERROR("error"),
        WARNING("warning");

        private final String display;

        Severity(String display) {
            this.display = display;
        }

        public String display() {
            return display;
        }
    }

    /**
     * A labeled span; primary labels are underlined with ^, secondary ones with -.
     */
    public record Label(SourceSpan span, String message, boolean primary) {
        public static Label primary(SourceSpan span, String message) {
            return new Label(span, message, true);
        }

        public static Label secondary(SourceSpan span, String message) {
            return new Label(span, message, false);
        }
    }

    public static Diagnostic error(String message, SourceSpan span) {
        return new Diagnostic(Severity.ERROR, null, message, span, List.of(), List.of());
    }

    public static Diagnostic warning(String message, SourceSpan span) {
        return new Diagnostic(Severity.WARNING, null, message, span, List.of(), List.of());
    }

    public static Diagnostic warning(String code, String message, SourceSpan span) {
        return new Diagnostic(Severity.WARNING, code, message, span, List.of(), List.of());
    }

    public Diagnostic withLabel(String label) {
        return with(Label.primary(span, label), null);
    }

    public Diagnostic withSecondaryLabel(SourceSpan labelSpan, String label) {
        return with(Label.secondary(labelSpan, label), null);
    }

    public Diagnostic withNote(String note) {
        return with(null, "note: " + note);
    }

    public Diagnostic withHelp(String help) {
        return with(null, "help: " + help);
    }

    private Diagnostic with(Label label, String note) {
        var nextLabels = label == null ? labels : append(labels, label);
        var nextNotes = note == null ? notes : append(notes, note);
        return new Diagnostic(severity, code, message, span, nextLabels, nextNotes);
    }

    private static <T> List<T> append(List<T> list, T element) {
        var copy = new ArrayList<>(list);
        copy.add(element);
        return List.copyOf(copy);
    }

    /**
     * Render against the card's ability lines.
     *
     * @param lines ability lines of the card, line 1 first
     * @param card  card name shown in the location header
     */
    public String format(List<String> lines, String card) {
        var labeled = labels.isEmpty() ? List.of(Label.primary(span, "")) : labels;
        var touched = new TreeSet<Integer>();
        touched.add(span.start().line());
        labeled.forEach(label -> touched.add(label.span().start().line()));

        var gutter = " ".repeat(String.valueOf(touched.last()).length());
        var out = new StringBuilder(header(card));
        out.append(gutter).append(" |\n");
        for (int number : touched) {
            if (number < 1 || number > lines.size()) {
                continue;
            }
            var lineLabel = String.valueOf(number);
            out.append(" ".repeat(gutter.length() - lineLabel.length()))
               .append(lineLabel).append(" | ").append(lines.get(number - 1)).append('\n');
            var markers = underline(labeled, number);
            if (!markers.isEmpty()) {
                out.append(gutter).append(" | ").append(markers).append('\n');
            }
        }
        out.append(gutter).append(" |\n");
        notes.forEach(note -> out.append(gutter).append(" = ").append(note).append('\n'));
        return out.toString();
    }

    private String header(String card) {
        var location = span.start();
        return severity.display() + (code == null ? "" : "[" + code + "]") + ": " + message + "\n"
               + "  --> " + (card == null ? "" : card + ":") + location.line() + ":" + location.column() + "\n";
    }

    /**
     * Single-line form: {@code card:line:column: severity: message}.
     */
    public String formatSimple(String card) {
        var loc = span.start();
        return String.format("%s:%d:%d: %s: %s", card, loc.line(), loc.column(), severity.display(), message);
    }

    /**
     * Markers of the labels starting on one line, left to right: ^ for primary, - for secondary.
     */
    private static String underline(List<Label> labeled, int line) {
        var out = new StringBuilder();
        labeled.stream()
               .filter(label -> label.span().start().line() == line)
               .sorted(Comparator.comparingInt(label -> label.span().start().column()))
               .forEach(label -> {
                   var column = label.span().start().column();
                   while (out.length() < column - 1) {
                       out.append(' ');
                   }
                   out.append(String.valueOf(label.primary() ? '^' : '-')
                                    .repeat(Math.max(1, label.span().length())));
                   if (!label.message().isEmpty()) {
                       out.append(' ').append(label.message());
                   }
               });
        return out.toString();
    }
}
