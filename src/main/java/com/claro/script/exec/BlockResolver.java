package com.claro.script.exec;

import java.util.HashMap;
import java.util.Map;

/**
 * Finds the ELSE / EXCEPT / FINALLY / END lines that belong to a block opener.
 *
 * Scans forward from the opener with a depth counter: IF, WHILE, FOR, FUNC and TRY
 * go one level deeper, END at depth zero is the match, any other END goes one level up.
 * ELSE lines are checked backward against their owning IF.
 * Results are memoised per index; the line sequence never changes.
 */
public final class BlockResolver {

    /** Clause positions of one TRY block; -1 when a clause is absent. */
    public static final class TryLayout {
        public final int tryIndex;
        public final int exceptIndex;
        public final int finallyIndex;
        public final int endIndex;

        TryLayout(int tryIndex, int exceptIndex, int finallyIndex, int endIndex) {
            this.tryIndex = tryIndex;
            this.exceptIndex = exceptIndex;
            this.finallyIndex = finallyIndex;
            this.endIndex = endIndex;
        }

        public int tryBodyEnd() {
            if (exceptIndex >= 0) return exceptIndex;
            if (finallyIndex >= 0) return finallyIndex;
            return endIndex;
        }

        public int exceptBodyEnd() {
            return (finallyIndex >= 0) ? finallyIndex : endIndex;
        }

        public int finallyBodyStart() {
            return (finallyIndex >= 0) ? finallyIndex + 1 : endIndex;
        }
    }

    private final LineSequence lines;
    private final Map<Integer, Integer> closeCache = new HashMap<>();
    private final Map<Integer, Integer> elseOrCloseCache = new HashMap<>();
    private final Map<Integer, TryLayout> tryCache = new HashMap<>();
    private final Map<Integer, Integer> ownerCache = new HashMap<>();

    BlockResolver(LineSequence lines) {
        this.lines = lines;
    }

    /** Index of the END matching the opener at {@code openIndex}. */
    public int findClose(int openIndex) {
        Integer cached = closeCache.get(openIndex);
        if (cached != null) return cached;
        int found = scan(openIndex, false);
        closeCache.put(openIndex, found);
        return found;
    }

    /**
     * For IF: index of the depth-zero ELSE if there is one, otherwise of the matching END.
     * An IF with a second depth-zero ELSE is rejected.
     */
    public int findElseOrClose(int openIndex) {
        Integer cached = elseOrCloseCache.get(openIndex);
        if (cached != null) return cached;
        int found = scan(openIndex, true);
        if (lines.get(found).kind() == StatementKind.ELSE) {
            int second = scan(found, true);
            if (lines.get(second).kind() == StatementKind.ELSE) {
                throw new ClaroException(ErrorKind.INVALID_STATEMENT,
                        "IF block has more than one ELSE", lines.get(second).lineNumber());
            }
            closeCache.putIfAbsent(openIndex, second);
        }
        elseOrCloseCache.put(openIndex, found);
        return found;
    }

    /**
     * Index of the IF that owns the ELSE at {@code elseIndex}. Scans backward: END goes one
     * level deeper, an opener at depth zero is the owner and must be an IF whose ELSE this is.
     */
    public int findElseOwner(int elseIndex) {
        Integer cached = ownerCache.get(elseIndex);
        if (cached != null) return cached;

        SourceLine elseLine = lines.get(elseIndex);
        int depth = 0;
        int owner = -1;
        for (int i = elseIndex - 1; i >= 0; i--) {
            StatementKind kind = lines.get(i).kind();
            if (kind == null) continue;
            if (kind == StatementKind.END) {
                depth++;
            } else if (kind.opensBlock()) {
                if (depth == 0) {
                    owner = i;
                    break;
                }
                depth--;
            }
        }
        if (owner < 0 || lines.get(owner).kind() != StatementKind.IF) {
            throw new ClaroException(ErrorKind.INVALID_STATEMENT, "ELSE without IF", elseLine.lineNumber());
        }
        if (findElseOrClose(owner) != elseIndex) {
            throw new ClaroException(ErrorKind.INVALID_STATEMENT, "IF block has more than one ELSE", elseLine.lineNumber());
        }
        ownerCache.put(elseIndex, owner);
        return owner;
    }

    public TryLayout tryLayout(int tryIndex) {
        TryLayout cached = tryCache.get(tryIndex);
        if (cached != null) return cached;

        int end = findClose(tryIndex);
        int exceptIndex = -1;
        int finallyIndex = -1;
        int depth = 0;
        for (int i = tryIndex + 1; i < end; i++) {
            SourceLine line = lines.get(i);
            StatementKind kind = line.kind();
            if (kind == null) continue;
            if (kind.opensBlock()) {
                depth++;
            } else if (kind == StatementKind.END) {
                depth--;
            } else if (depth == 0 && kind == StatementKind.EXCEPT) {
                if (exceptIndex >= 0) {
                    throw new ClaroException(ErrorKind.INVALID_STATEMENT, "TRY block has more than one EXCEPT", line.lineNumber());
                }
                if (finallyIndex >= 0) {
                    throw new ClaroException(ErrorKind.INVALID_STATEMENT, "EXCEPT must come before FINALLY", line.lineNumber());
                }
                exceptIndex = i;
            } else if (depth == 0 && kind == StatementKind.FINALLY) {
                if (finallyIndex >= 0) {
                    throw new ClaroException(ErrorKind.INVALID_STATEMENT, "TRY block has more than one FINALLY", line.lineNumber());
                }
                finallyIndex = i;
            }
        }

        TryLayout layout = new TryLayout(tryIndex, exceptIndex, finallyIndex, end);
        tryCache.put(tryIndex, layout);
        return layout;
    }

    private int scan(int openIndex, boolean stopAtElse) {
        int depth = 0;
        for (int i = openIndex + 1; i < lines.size(); i++) {
            StatementKind kind = lines.get(i).kind();
            if (kind == null) continue;
            if (kind.opensBlock()) {
                depth++;
            } else if (kind == StatementKind.END) {
                if (depth == 0) return i;
                depth--;
            } else if (stopAtElse && depth == 0 && kind == StatementKind.ELSE) {
                return i;
            }
        }
        SourceLine opener = lines.get(openIndex);
        throw new ClaroException(ErrorKind.UNTERMINATED_BLOCK,
                opener.keyword() + " block has no matching END", opener.lineNumber());
    }
}
