package ai.rshell.parser;

import java.util.Optional;

/** Compound-statement keywords that must be closed by a matching keyword. */
public enum Opener {
    IF("if", "fi"),
    FOR("for", "done"),
    WHILE("while", "done"),
    UNTIL("until", "done"),
    CASE("case", "esac"),
    /** An unfinished construct whose opener could not be identified. */
    UNKNOWN("unknown", "unknown");

    private final String keyword;
    private final String closer;

    Opener(String keyword, String closer) {
        this.keyword = keyword;
        this.closer = closer;
    }

    public String keyword() {
        return keyword;
    }

    public String closer() {
        return closer;
    }

    public boolean closedBy(String word) {
        return this != UNKNOWN && closer.equals(word);
    }

    public static Optional<Opener> fromKeyword(String word) {
        for (var opener : values()) {
            if (opener != UNKNOWN && opener.keyword.equals(word)) {
                return Optional.of(opener);
            }
        }
        return Optional.empty();
    }
}
