package io.campus.core.language;

public interface LanguageDetector {

    /**
     * Classifies the language of raw user text.
     *
     * @throws DetectionAmbiguousException when the text is empty, too short, or too mixed to classify
     */
    LanguageDetection detect(String text) throws DetectionAmbiguousException;
}
