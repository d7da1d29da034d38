package com.claro.script.exec;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Compacted program text: blank lines and comment lines ("#" or "//") are removed,
 * order is preserved and every line keeps its original line number.
 * The index into this list is the program counter.
 */
public final class LineSequence {
    private final List<SourceLine> lines;
    private BlockResolver resolver;

    public LineSequence(List<SourceLine> lines) {
        this.lines = Collections.unmodifiableList(new ArrayList<>(lines));
    }

    public static LineSequence fromSource(String source) {
        return fromSource(source, 1);
    }

    /** @param firstLineNumber number reported for the first physical line of {@code source} */
    public static LineSequence fromSource(String source, int firstLineNumber) {
        if (source == null) throw new IllegalArgumentException("source must not be null");
        List<SourceLine> out = new ArrayList<>();
        String[] raw = source.split("\r?\n", -1);
        for (int i = 0; i < raw.length; i++) {
            String trimmed = raw[i].trim();
            if (trimmed.isEmpty() || isComment(trimmed)) continue;
            out.add(new SourceLine(trimmed, firstLineNumber + i));
        }
        return new LineSequence(out);
    }

    public static boolean isComment(String trimmed) {
        return trimmed.startsWith("#") || trimmed.startsWith("//");
    }

    public SourceLine get(int index) {
        return lines.get(index);
    }

    public int size() {
        return lines.size();
    }

    /** Lines in [from, to) as a standalone sequence, used for function bodies. */
    public LineSequence slice(int from, int to) {
        return new LineSequence(lines.subList(from, to));
    }

    /** Resolver bound to this sequence; its jump cache lives as long as the sequence. */
    public BlockResolver resolver() {
        if (resolver == null) resolver = new BlockResolver(this);
        return resolver;
    }
}
