package io.campus.core.language;

import java.lang.Character.UnicodeScript;
import java.util.EnumMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Detects Indic languages and English from the Unicode script of the letters in the text. Devanagari text is
 * split between Hindi, Marathi and Rajasthani by marker words and defaults to Hindi.
 */
public final class ScriptLanguageDetector implements LanguageDetector {
    private static final Map<UnicodeScript, String> SCRIPT_LANGUAGES = new EnumMap<>(UnicodeScript.class);
    private static final Set<String> MARATHI_MARKERS = Set.of(
        "आहे", "आहेत", "आणि", "काय", "मला", "तुम्ही", "नाही", "कधी", "कुठे", "पाहिजे"
    );
    private static final Set<String> RAJASTHANI_MARKERS = Set.of(
        "म्हारो", "म्हारी", "थारो", "थारी", "कांई", "कोनी", "म्हने", "थाने", "छे", "सूं"
    );

    static {
        SCRIPT_LANGUAGES.put(UnicodeScript.DEVANAGARI, "hi");
        SCRIPT_LANGUAGES.put(UnicodeScript.GUJARATI, "gu");
        SCRIPT_LANGUAGES.put(UnicodeScript.GURMUKHI, "pa");
        SCRIPT_LANGUAGES.put(UnicodeScript.TAMIL, "ta");
        SCRIPT_LANGUAGES.put(UnicodeScript.BENGALI, "bn");
        SCRIPT_LANGUAGES.put(UnicodeScript.TELUGU, "te");
        SCRIPT_LANGUAGES.put(UnicodeScript.KANNADA, "kn");
        SCRIPT_LANGUAGES.put(UnicodeScript.MALAYALAM, "ml");
        SCRIPT_LANGUAGES.put(UnicodeScript.ORIYA, "or");
        SCRIPT_LANGUAGES.put(UnicodeScript.LATIN, "en");
    }

    private final double confidenceFloor;
    private final int minLetters;

    public ScriptLanguageDetector(double confidenceFloor, int minLetters) {
        this.confidenceFloor = Math.max(0.0, Math.min(1.0, confidenceFloor));
        this.minLetters = Math.max(1, minLetters);
    }

    @Override
    public LanguageDetection detect(String text) throws DetectionAmbiguousException {
        if (text == null || text.isBlank()) {
            throw new DetectionAmbiguousException("text is empty");
        }

        Map<UnicodeScript, Integer> counts = new EnumMap<>(UnicodeScript.class);
        int letters = 0;
        for (int i = 0; i < text.length(); ) {
            int codePoint = text.codePointAt(i);
            i += Character.charCount(codePoint);
            if (!Character.isLetter(codePoint)) {
                continue;
            }
            letters++;
            counts.merge(UnicodeScript.of(codePoint), 1, Integer::sum);
        }
        if (letters < minLetters) {
            throw new DetectionAmbiguousException("text has " + letters + " letters, need at least " + minLetters);
        }

        UnicodeScript dominant = null;
        int dominantCount = 0;
        for (Map.Entry<UnicodeScript, Integer> entry : counts.entrySet()) {
            if (entry.getValue() > dominantCount) {
                dominant = entry.getKey();
                dominantCount = entry.getValue();
            }
        }

        double confidence = (double) dominantCount / letters;
        if (confidence < confidenceFloor) {
            throw new DetectionAmbiguousException(String.format(
                Locale.ROOT,
                "mixed script text, dominant %s at %.2f below floor %.2f",
                dominant,
                confidence,
                confidenceFloor
            ));
        }

        String language = SCRIPT_LANGUAGES.get(dominant);
        if (language == null) {
            throw new DetectionAmbiguousException("unsupported script " + dominant);
        }
        if (dominant == UnicodeScript.DEVANAGARI) {
            language = refineDevanagari(text);
        }
        return new LanguageDetection(language, confidence);
    }

    private String refineDevanagari(String text) {
        List<String> tokens = List.of(text.split("[\\s\\p{Punct}।॥]+"));
        int marathi = 0;
        int rajasthani = 0;
        for (String token : tokens) {
            if (MARATHI_MARKERS.contains(token)) {
                marathi++;
            }
            if (RAJASTHANI_MARKERS.contains(token)) {
                rajasthani++;
            }
        }
        if (marathi == 0 && rajasthani == 0) {
            return "hi";
        }
        return marathi >= rajasthani ? "mr" : "raj";
    }
}
