package com.sagarmitra.language;

import java.util.EnumSet;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;

/**
 * Languages a conversation can be held in. Every language accepts its native script
 * plus Latin, so romanised input (Hinglish and the like) always passes.
 */
public enum SupportedLanguage {
    EN("en", "English", null,
            "I can only understand English. Please write your message in English. 🙏"),
    HI("hi", "हिन्दी (Hindi)", Script.DEVANAGARI,
            "कृपया हिन्दी में लिखें। मैं केवल हिन्दी समझ सकता हूँ। Hinglish भी चलेगा! 🙏"),
    MR("mr", "मराठी (Marathi)", Script.DEVANAGARI,
            "कृपया मराठीत लिहा. मी फक्त मराठी समजू शकतो. 🙏"),
    ML("ml", "മലയാളം (Malayalam)", Script.MALAYALAM,
            "ദയവായി മലയാളത്തിൽ എഴുതുക. എനിക്ക് മലയാളം മാത്രമേ മനസ്സിലാകൂ. 🙏"),
    TA("ta", "தமிழ் (Tamil)", Script.TAMIL,
            "தயவுசெய்து தமிழில் எழுதுங்கள். எனக்கு தமிழ் மட்டுமே புரியும். 🙏"),
    TE("te", "తెలుగు (Telugu)", Script.TELUGU,
            "దయచేసి తెలుగులో రాయండి. నాకు తెలుగు మాత్రమే అర్థమవుతుంది. 🙏"),
    KN("kn", "ಕನ್ನಡ (Kannada)", Script.KANNADA,
            "ದಯವಿಟ್ಟು ಕನ್ನಡದಲ್ಲಿ ಬರೆಯಿರಿ. ನನಗೆ ಕನ್ನಡ ಮಾತ್ರ ಅರ್ಥವಾಗುತ್ತದೆ. 🙏"),
    BN("bn", "বাংলা (Bengali)", Script.BENGALI,
            "অনুগ্রহ করে বাংলায় লিখুন। আমি শুধু বাংলা বুঝতে পারি। 🙏"),
    GU("gu", "ગુજરાતી (Gujarati)", Script.GUJARATI,
            "કૃપા કરીને ગુજરાતીમાં લખો. હું ફક્ત ગુજરાતી સમજી શકું છું. 🙏"),
    OR("or", "ଓଡ଼ିଆ (Odia)", Script.ODIA,
            "ଦୟାକରି ଓଡ଼ିଆରେ ଲେଖନ୍ତୁ। ମୁଁ କେବଳ ଓଡ଼ିଆ ବୁଝିପାରେ। 🙏");

    private final String code;
    private final String label;
    private final Script nativeScript;
    private final String rejectionMessage;

    SupportedLanguage(String code, String label, Script nativeScript, String rejectionMessage) {
        this.code = code;
        this.label = label;
        this.nativeScript = nativeScript;
        this.rejectionMessage = rejectionMessage;
    }

    public String code() {
        return code;
    }

    public String label() {
        return label;
    }

    public Set<Script> allowedScripts() {
        return nativeScript == null ? EnumSet.of(Script.LATIN) : EnumSet.of(nativeScript, Script.LATIN);
    }

    public String rejectionMessage() {
        return rejectionMessage;
    }

    public static Optional<SupportedLanguage> fromCode(String code) {
        if (code == null) {
            return Optional.empty();
        }
        String normalized = code.trim().toLowerCase(Locale.ROOT);
        for (SupportedLanguage language : values()) {
            if (language.code.equals(normalized)) {
                return Optional.of(language);
            }
        }
        return Optional.empty();
    }

    /** Label used in prompts and rejection reasons; unknown codes are shown as-is. */
    public static String labelFor(String code) {
        return fromCode(code).map(SupportedLanguage::label).orElse(code);
    }

    public static String rejectionMessageFor(String code) {
        return fromCode(code).orElse(EN).rejectionMessage();
    }
}
