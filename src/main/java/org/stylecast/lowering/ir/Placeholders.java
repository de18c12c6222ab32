package org.stylecast.lowering.ir;

import java.util.OptionalInt;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Naming and recognition of slot placeholders ({@code <prefix><index>__}).
 */
public final class Placeholders {

    /** The prefix used unless configured otherwise. */
    public static final String DEFAULT_PREFIX = "__SC_EXPR_";

    private final String prefix;
    private final Pattern anywhere;
    private final Pattern exact;
    private final Pattern leading;
    private final Pattern standaloneLine;

    public Placeholders(String prefix) {
        this.prefix = prefix;
        String core = Pattern.quote(prefix) + "(\\d+)__";
        this.anywhere = Pattern.compile(core);
        this.exact = Pattern.compile("^" + core + "$");
        this.leading = Pattern.compile("^(" + core + ")\\s+([\\s\\S]+)$");
        this.standaloneLine = Pattern.compile("^" + core + "\\s*;?\\s*$");
    }

    /**
     * @param id The slot id.
     * @return The placeholder text for the slot.
     */
    public String placeholder(int id) {
        return prefix + id + "__";
    }

    /** @return Pattern finding placeholders anywhere; group 1 is the slot id. */
    public Pattern anywhere() {
        return anywhere;
    }

    /** @return Pattern matching text that is a placeholder followed by other text; groups: 1 placeholder, 2 id, 3 rest. */
    public Pattern leading() {
        return leading;
    }

    /**
     * @param text Text to inspect, expected to be trimmed.
     * @return The slot id if the text is exactly one placeholder.
     */
    public OptionalInt exactId(String text) {
        Matcher m = exact.matcher(text);
        return m.matches() ? OptionalInt.of(Integer.parseInt(m.group(1))) : OptionalInt.empty();
    }

    /**
     * @param line A trimmed source line.
     * @return The slot id if the line holds nothing but a placeholder and an optional semicolon.
     */
    public OptionalInt standaloneLineId(String line) {
        Matcher m = standaloneLine.matcher(line);
        return m.matches() ? OptionalInt.of(Integer.parseInt(m.group(1))) : OptionalInt.empty();
    }

    /**
     * @param text Text to inspect.
     * @return {@code true} if the text contains at least one placeholder.
     */
    public boolean containsAny(String text) {
        return anywhere.matcher(text).find();
    }
}
