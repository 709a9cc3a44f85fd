package io.campus.core.language;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

public final class Languages {
    private static final Map<String, String> NAMES = new LinkedHashMap<>();
    private static final Map<String, String> TRANSLATION_CODES = Map.of("raj", "hi");

    static {
        NAMES.put("en", "English");
        NAMES.put("hi", "Hindi");
        NAMES.put("raj", "Rajasthani");
        NAMES.put("gu", "Gujarati");
        NAMES.put("mr", "Marathi");
        NAMES.put("pa", "Punjabi");
        NAMES.put("ta", "Tamil");
        NAMES.put("bn", "Bengali");
        NAMES.put("te", "Telugu");
        NAMES.put("kn", "Kannada");
        NAMES.put("ml", "Malayalam");
        NAMES.put("or", "Odia");
    }

    private Languages() {
    }

    public static String normalize(String code) {
        return code == null ? "" : code.trim().toLowerCase(Locale.ROOT);
    }

    public static String displayName(String code) {
        String normalized = normalize(code);
        return NAMES.getOrDefault(normalized, normalized);
    }

    /**
     * Code understood by translation backends. Variants without their own model map onto a close relative.
     */
    public static String translationCode(String code) {
        String normalized = normalize(code);
        return TRANSLATION_CODES.getOrDefault(normalized, normalized);
    }

    public static boolean sameForTranslation(String first, String second) {
        return translationCode(first).equals(translationCode(second));
    }

    public static List<Map<String, String>> describe(List<String> codes) {
        List<Map<String, String>> out = new ArrayList<>();
        for (String code : codes) {
            out.add(Map.of("code", normalize(code), "name", displayName(code)));
        }
        return out;
    }
}
