package com.sagarmitra.language;

import java.util.Locale;

/**
 * Writing systems the guard recognises, each bound to its Unicode block.
 * Declaration order is the order in which a mismatch is reported.
 */
public enum Script {
    DEVANAGARI(0x0900, 0x097F),
    BENGALI(0x0980, 0x09FF),
    GUJARATI(0x0A80, 0x0AFF),
    GURMUKHI(0x0A00, 0x0A7F),
    KANNADA(0x0C80, 0x0CFF),
    MALAYALAM(0x0D00, 0x0D7F),
    ODIA(0x0B00, 0x0B7F),
    TAMIL(0x0B80, 0x0BFF),
    TELUGU(0x0C00, 0x0C7F),
    LATIN('A', 'z');

    private final int low;
    private final int high;

    Script(int low, int high) {
        this.low = low;
        this.high = high;
    }

    public boolean contains(int codePoint) {
        if (this == LATIN) {
            // ASCII letters only; accented Latin is left unclassified
            return (codePoint >= 'A' && codePoint <= 'Z') || (codePoint >= 'a' && codePoint <= 'z');
        }
        return codePoint >= low && codePoint <= high;
    }

    public String displayName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
