package com.sagarmitra.service.impl;

import org.springframework.stereotype.Component;

import java.util.EnumMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Pre-authored replies used when the model cannot be reached, routed by topic keywords in
 * the user's input. Replies exist in English, Hindi and Tamil; other languages get English.
 */
@Component
public class FallbackResponder {

    static final String EMPTY_RESPONSE =
            "I processed your request but couldn't generate a response. Please try again.";

    public enum Topic {
        WEATHER(List.of("weather", "wind", "wave", "rain", "storm", "sea condition")),
        PRICING(List.of("price", "market", "sell", "buy", "rate", "cost")),
        REGULATION(List.of("regulation", "ban", "license", "scheme", "government", "subsidy")),
        PRESERVATION(List.of("quality", "ice", "fresh", "preserve", "store", "grade")),
        GENERAL(List.of());

        private final List<String> keywords;

        Topic(List<String> keywords) {
            this.keywords = keywords;
        }

        boolean matches(String lowerCaseInput) {
            return keywords.stream().anyMatch(lowerCaseInput::contains);
        }
    }

    private static final Map<Topic, String> ENGLISH = new EnumMap<>(Map.of(
            Topic.GENERAL, "Based on current sea conditions near the Konkan coast, today is a good day for fishing! "
                    + "Wind speed is moderate at 3-4 m/s from the northwest. I recommend heading out early morning "
                    + "between 0400-0900 IST for the best catch. Indian Pomfret and Mackerel are in season. 🐟",
            Topic.WEATHER, "Namaste! The weather looks favorable for the next 3 days. Sea surface temperature is around "
                    + "28°C which is ideal for Tuna and Seer Fish. However, please avoid venturing beyond 12 nautical "
                    + "miles as there are reports of rough patches further out. Stay safe! 🌊",
            Topic.PRICING, "Great question! Based on recent market data, Pomfret is fetching ₹750-800/kg at Mumbai's "
                    + "Sassoon Docks. Surmai (Seer Fish) is at ₹700/kg with high demand. I'd suggest selling your "
                    + "Pomfret catch today while prices are up. For Mackerel, prices are stable at ₹200/kg. 💰",
            Topic.REGULATION, "The fishing ban period along the west coast (June 1 - July 31) doesn't apply to traditional "
                    + "non-mechanised boats. If you're using a motorised trawler, please ensure your license is current. "
                    + "The PM Matsya Sampada Yojana offers subsidies up to ₹3 lakh for equipment upgrades. Visit your "
                    + "district fisheries office for more details. 📋",
            Topic.PRESERVATION, "For the best catch quality, remember to ice your fish immediately after catching. "
                    + "Maintain a temperature of 0-4°C. Gut larger fish within 2 hours. Premium grade fish can earn you "
                    + "₹120-200/kg more than Standard grade, a big difference over a season! 🧊"
    ));

    private static final Map<Topic, String> HINDI = new EnumMap<>(Map.of(
            Topic.GENERAL, "कोंकण तट के पास समुद्र की मौजूदा स्थिति के हिसाब से आज मछली पकड़ने के लिए अच्छा दिन है! "
                    + "उत्तर-पश्चिम से हवा 3-4 मी/से की मध्यम गति से चल रही है। अच्छी पकड़ के लिए सुबह 0400-0900 IST के बीच "
                    + "निकलें। पापलेट और बांगड़ा का मौसम चल रहा है। 🐟",
            Topic.WEATHER, "नमस्ते! अगले 3 दिनों तक मौसम अनुकूल दिख रहा है। समुद्र की सतह का तापमान लगभग 28°C है, जो "
                    + "टूना और सुरमई के लिए अच्छा है। फिर भी 12 समुद्री मील से आगे न जाएं, वहाँ समुद्र उबड़-खाबड़ होने की "
                    + "खबर है। सुरक्षित रहें! 🌊",
            Topic.PRICING, "अच्छा सवाल! हाल के बाज़ार आंकड़ों के अनुसार मुंबई के ससून डॉक पर पापलेट ₹750-800/किलो बिक रहा है। "
                    + "सुरमई ₹700/किलो पर है और मांग ज़्यादा है। दाम ऊँचे हैं, इसलिए पापलेट आज ही बेचना अच्छा रहेगा। "
                    + "बांगड़ा का दाम ₹200/किलो पर स्थिर है। 💰",
            Topic.REGULATION, "पश्चिमी तट पर मछली पकड़ने पर रोक (1 जून - 31 जुलाई) पारंपरिक बिना मोटर वाली नावों पर लागू नहीं "
                    + "होती। अगर आप मोटर वाला ट्रॉलर चलाते हैं तो अपना लाइसेंस चालू रखें। प्रधानमंत्री मत्स्य संपदा योजना में "
                    + "उपकरणों के लिए ₹3 लाख तक की सब्सिडी मिलती है। ज़्यादा जानकारी के लिए ज़िला मत्स्य कार्यालय जाएं। 📋",
            Topic.PRESERVATION, "अच्छी गुणवत्ता के लिए मछली पकड़ते ही उस पर बर्फ़ डालें। तापमान 0-4°C रखें। बड़ी मछलियों की "
                    + "सफ़ाई 2 घंटे के अंदर करें। प्रीमियम ग्रेड की मछली से स्टैंडर्ड ग्रेड के मुकाबले ₹120-200/किलो ज़्यादा "
                    + "मिल सकते हैं! 🧊"
    ));

    private static final Map<Topic, String> TAMIL = new EnumMap<>(Map.of(
            Topic.GENERAL, "கொங்கன் கடற்கரைக்கு அருகிலுள்ள தற்போதைய கடல் நிலைமைகளின் அடிப்படையில், இன்று மீன்பிடிக்க ஒரு நல்ல நாள்! "
                    + "காற்றாலை மேற்கு திசையிலிருந்து 3-4 மீ/வி வேகத்தில் மிதமாக உள்ளது. சிறந்த பிடிப்பிற்காக காலை 0400-0900 IST க்கு "
                    + "இடையில் செல்வதற்கு பரிந்துரைக்கிறேன். பாம்ஃப்ரெட் மற்றும் கானாங்கெளுத்தி பருவத்தில் உள்ளன. 🐟",
            Topic.WEATHER, "நமஸ்காரம்! அடுத்த 3 நாட்களுக்கு வானிலை சாதகமாக தெரிகிறது. கடல் பரப்பளவு சுமார் 28°C வெப்பநிலையில் "
                    + "உள்ளது, இது சூரை மற்றும் சீலா மீன்களுக்கு ஏற்றது. இருந்தாலும், கடல் கொந்தளிப்பு அதிகமாக உள்ளதால் 12 கடல் "
                    + "மைல்களுக்கு அப்பால் செல்வதைத் தவிர்க்கவும். கவனமாகப் செல்லுங்கள்! 🌊",
            Topic.PRICING, "நல்ல கேள்வி! சமீபத்திய சந்தை தரவுகளின் அடிப்படையில், மும்பையின் சாசூன் டாக்ஸில் பாம்ஃப்ரெட் "
                    + "₹750-800/கிலோவுக்குச் செல்கிறது. அதிக தேவையுடன் சுறாமீன் (Seer Fish) ₹700/கிலோவில் உள்ளது. பாம்ஃப்ரெட் "
                    + "இன்றைய விலையில் விற்கப் பரிந்துரைக்கிறேன். கானாங்கெளுத்தி விலை ₹200/கிலோவில் நிலையாக உள்ளது. 💰",
            Topic.REGULATION, "பழமைவாத படகுகளுக்கு மீன்பிடி தடைக்காலம் (ஜூன் 1 - ஜூலை 31) பொருந்தாது. இயந்திரமயமாக்கப்பட்ட "
                    + "டிராலரை பயன்படுத்தினால், உரிமம் தற்போதையதில் உள்ளதா என்பதை உறுதிப்படுத்தவும். PM மத்ஸ்ய சம்பதா யோஜனா "
                    + "மானியங்களை வழங்குகிறது. 📋",
            Topic.PRESERVATION, "சிறந்த தரத்தை பெற, மீன்பிடித்தவுடன் உடனடியாக பனிக்கட்டியிடவும். 0-4°C வெப்பநிலையை "
                    + "பராமரிக்கவும். பெரிய மீன்களை 2 மணி நேரங்களுக்குள் துண்டிக்கவும். 🧊"
    ));

    private static final Map<String, Map<Topic, String>> CANNED = Map.of(
            "en", ENGLISH,
            "hi", HINDI,
            "ta", TAMIL
    );

    private static final Map<String, String> INCOMPLETE = Map.of(
            "en", "Sorry, I could not complete your request this time. Please try asking again in a simpler way.",
            "hi", "माफ़ कीजिए, इस बार मैं आपका अनुरोध पूरा नहीं कर सका। कृपया थोड़े आसान शब्दों में फिर से पूछें।",
            "ta", "மன்னிக்கவும், இந்த முறை உங்கள் கோரிக்கையை என்னால் முடிக்க முடியவில்லை. தயவுசெய்து எளிமையாக மீண்டும் கேளுங்கள்."
    );

    public String reply(String humanInput, String language) {
        return CANNED.getOrDefault(normalize(language), ENGLISH).get(route(humanInput));
    }

    /** Used when the model keeps requesting tools past the round cap. */
    public String incomplete(String language) {
        return INCOMPLETE.getOrDefault(normalize(language), INCOMPLETE.get("en"));
    }

    public String emptyResponse() {
        return EMPTY_RESPONSE;
    }

    public Topic route(String humanInput) {
        String lower = humanInput == null ? "" : humanInput.toLowerCase(Locale.ROOT);
        for (Topic topic : Topic.values()) {
            if (topic.matches(lower)) {
                return topic;
            }
        }
        return Topic.GENERAL;
    }

    private static String normalize(String language) {
        return language == null ? "en" : language.trim().toLowerCase(Locale.ROOT);
    }
}
