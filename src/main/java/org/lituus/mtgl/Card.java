package org.lituus.mtgl;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * A card as handed over by the card database: its name, ability lines and type line.
 * Name or lines may be missing; such cards are rejected by the pipeline. The type line is optional.
 */
public record Card(String name, List<String> lines, String typeLine) {
    private static final Pattern LEVEL_HEADER = Pattern.compile("(?i)level \\d+(-\\d+|\\+)");
    private static final Pattern POWER_TOUGHNESS = Pattern.compile("[+-]?(\\d+|[xX])/[+-]?(\\d+|[xX])");

    public Card {
        if (lines != null) {
            lines = List.copyOf(lines);
        }
    }

    public Card(String name, List<String> lines) {
        this(name, lines, null);
    }

    /**
     * Whether the card is an instant or a sorcery, whose plain ability lines are spell abilities.
     */
    public boolean isSpell() {
        if (typeLine == null) {
            return false;
        }
        var types = typeLine.toLowerCase(Locale.ROOT);
        return types.contains("instant") || types.contains("sorcery");
    }

    public static Card fromOracle(String name, String oracleText) {
        return fromOracle(name, null, oracleText);
    }

    /**
     * Split oracle text into ability lines, one per text line; blank lines are dropped.
     *
     * <p>A level striation header ({@code LEVEL 2-6}) followed by a power/toughness line becomes one line
     * ({@code LEVEL 2-6 3/3}).
     */
    public static Card fromOracle(String name, String typeLine, String oracleText) {
        if (oracleText == null) {
            return new Card(name, null, typeLine);
        }
        var split = Arrays.stream(oracleText.split("\\R"))
                          .map(String::strip)
                          .filter(line -> !line.isEmpty())
                          .toList();
        var lines = new ArrayList<String>(split.size());
        for (int i = 0; i < split.size(); i++) {
            var line = split.get(i);
            if (LEVEL_HEADER.matcher(line).matches() && i + 1 < split.size()
                && POWER_TOUGHNESS.matcher(split.get(i + 1)).matches()) {
                line = line + " " + split.get(++i);
            }
            lines.add(line);
        }
        return new Card(name, lines, typeLine);
    }
}
