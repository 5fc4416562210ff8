package com.sagarmitra.language;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.EnumSet;
import java.util.Set;

/**
 * Script-based acceptance check for free-text input.
 *
 * <p>Rules, in order:</p>
 * <ol>
 *     <li>fewer than {@value #MIN_MEANINGFUL_CHARS} meaningful characters: accept</li>
 *     <li>no recognised script, or Latin only: accept</li>
 *     <li>any non-Latin script outside the selected language's set: reject</li>
 *     <li>otherwise (native script, optionally mixed with Latin): accept</li>
 * </ol>
 */
@Component
@Slf4j
public class LanguageGuard {

    static final int MIN_MEANINGFUL_CHARS = 3;

    public LanguageVerdict validate(String text, String languageCode) {
        if (text == null || meaningfulLength(text) < MIN_MEANINGFUL_CHARS) {
            return LanguageVerdict.accept();
        }

        Set<Script> detected = detectScripts(text);
        if (detected.isEmpty() || detected.equals(EnumSet.of(Script.LATIN))) {
            return LanguageVerdict.accept();
        }

        Set<Script> allowed = SupportedLanguage.fromCode(languageCode)
                .map(SupportedLanguage::allowedScripts)
                .orElse(EnumSet.of(Script.LATIN));

        for (Script script : detected) {
            if (script == Script.LATIN || allowed.contains(script)) {
                continue;
            }
            String label = SupportedLanguage.labelFor(languageCode);
            log.debug("Language guard rejected input script={} language={}", script.displayName(), languageCode);
            return LanguageVerdict.reject("Detected " + script.displayName() + " script but selected language is "
                    + label + ". Please write in " + label + ".");
        }
        return LanguageVerdict.accept();
    }

    Set<Script> detectScripts(String text) {
        Set<Script> detected = EnumSet.noneOf(Script.class);
        text.codePoints().forEach(codePoint -> {
            for (Script script : Script.values()) {
                if (script.contains(codePoint)) {
                    detected.add(script);
                    break;
                }
            }
        });
        return detected;
    }

    int meaningfulLength(String text) {
        return (int) text.codePoints().filter(codePoint -> !isNoise(codePoint)).count();
    }

    private boolean isNoise(int codePoint) {
        if (Character.isWhitespace(codePoint) || Character.isDigit(codePoint)) {
            return true;
        }
        if (codePoint >= 0xFE00 && codePoint <= 0xFE0F) {
            // emoji variation selectors
            return true;
        }
        return switch (Character.getType(codePoint)) {
            case Character.CONNECTOR_PUNCTUATION,
                    Character.DASH_PUNCTUATION,
                    Character.START_PUNCTUATION,
                    Character.END_PUNCTUATION,
                    Character.INITIAL_QUOTE_PUNCTUATION,
                    Character.FINAL_QUOTE_PUNCTUATION,
                    Character.OTHER_PUNCTUATION,
                    Character.MATH_SYMBOL,
                    Character.CURRENCY_SYMBOL,
                    Character.MODIFIER_SYMBOL,
                    Character.OTHER_SYMBOL,
                    Character.FORMAT,
                    Character.SURROGATE -> true;
            default -> false;
        };
    }
}
