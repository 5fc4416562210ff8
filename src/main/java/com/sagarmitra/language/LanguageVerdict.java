package com.sagarmitra.language;

import org.springframework.lang.Nullable;

public record LanguageVerdict(boolean accepted, @Nullable String reason) {

    public static LanguageVerdict accept() {
        return new LanguageVerdict(true, null);
    }

    public static LanguageVerdict reject(String reason) {
        return new LanguageVerdict(false, reason);
    }
}
