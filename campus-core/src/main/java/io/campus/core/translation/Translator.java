package io.campus.core.translation;

public interface Translator {
    String name();

    /**
     * Translates {@code text} between two language codes. Returns the text unchanged when both codes resolve to
     * the same translation language.
     *
     * @throws TranslationUnavailableException for unsupported pairs or upstream failures
     */
    String translate(String text, String sourceLanguage, String targetLanguage) throws TranslationUnavailableException;
}
