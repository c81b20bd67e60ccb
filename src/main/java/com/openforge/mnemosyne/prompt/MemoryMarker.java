package com.openforge.mnemosyne.prompt;

import java.util.Objects;
import java.util.function.IntPredicate;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Wire format of an injected memory block.
 *
 * A block looks like:
 *
 *   <Mnemosyne> Long-term memory fragments:
 *   - [2025-05-01 10:00] user prefers tea
 *   - [2025-05-02 18:30] user lives in Lisbon
 *   </Mnemosyne>
 *
 * The block is delimited by an opening tag (the leading {@code <...>} token of
 * the configured prefix, or the whole prefix when it has none) and the suffix.
 * Matching is non-greedy and spans newlines, so several blocks in one string
 * are found separately.
 */
public final class MemoryMarker {

    public static final String DEFAULT_PREFIX = "<Mnemosyne> Long-term memory fragments:";
    public static final String DEFAULT_SUFFIX = "</Mnemosyne>";

    private static final Pattern LEADING_TAG = Pattern.compile("^\\s*(<[^<>\\s]+>)");

    private final String  prefix;
    private final String  suffix;
    private final Pattern blockPattern;

    private MemoryMarker(String prefix, String suffix) {
        this.prefix = Objects.requireNonNull(prefix, "prefix");
        this.suffix = Objects.requireNonNull(suffix, "suffix");
        if (suffix.isBlank()) {
            throw new IllegalArgumentException("Memory suffix must not be blank");
        }
        this.blockPattern = Pattern.compile(
                Pattern.quote(openingTag(prefix)) + ".*?" + Pattern.quote(suffix.strip()),
                Pattern.DOTALL);
    }

    public static MemoryMarker of(String prefix, String suffix) {
        return new MemoryMarker(prefix, suffix);
    }

    public static MemoryMarker defaults() {
        return new MemoryMarker(DEFAULT_PREFIX, DEFAULT_SUFFIX);
    }

    // ── Encode ───────────────────────────────────────────────────────────────

    /** Wraps already formatted entry lines (one per line, no trailing newline needed). */
    public String encode(String body) {
        StringBuilder sb = new StringBuilder(prefix).append('\n');
        if (body != null && !body.isEmpty()) {
            sb.append(body);
            if (!body.endsWith("\n")) sb.append('\n');
        }
        return sb.append(suffix).toString();
    }

    // ── Decode / strip ───────────────────────────────────────────────────────

    public int count(String text) {
        if (text == null || text.isEmpty()) return 0;
        Matcher m = blockPattern.matcher(text);
        int n = 0;
        while (m.find()) n++;
        return n;
    }

    public boolean contains(String text) {
        return text != null && blockPattern.matcher(text).find();
    }

    public String stripAll(String text) {
        if (text == null) return null;
        return blockPattern.matcher(text).replaceAll("");
    }

    /**
     * Removes every block whose running index fails {@code keep}.
     * Blocks are numbered from {@code firstIndex} in scan order, which lets a
     * caller number blocks across several strings.
     */
    public String strip(String text, int firstIndex, IntPredicate keep) {
        if (text == null || text.isEmpty()) return text;
        Matcher m = blockPattern.matcher(text);
        StringBuilder sb = new StringBuilder();
        int index = firstIndex;
        while (m.find()) {
            String replacement = keep.test(index) ? m.group() : "";
            m.appendReplacement(sb, Matcher.quoteReplacement(replacement));
            index++;
        }
        m.appendTail(sb);
        return sb.toString();
    }

    /** Keeps the last {@code keepLast} blocks of a single string; {@code keepLast <= 0} strips all. */
    public String stripKeepingLast(String text, int keepLast) {
        if (keepLast <= 0) return stripAll(text);
        int total = count(text);
        int firstKept = total - keepLast;
        return strip(text, 0, i -> i >= firstKept);
    }

    public String prefix() { return prefix; }

    public String suffix() { return suffix; }

    private static String openingTag(String prefix) {
        Matcher m = LEADING_TAG.matcher(prefix);
        if (m.find()) return m.group(1);
        String trimmed = prefix.strip();
        if (trimmed.isEmpty()) {
            throw new IllegalArgumentException("Memory prefix must not be blank");
        }
        return trimmed;
    }
}
