package io.campus.core.translation;

import io.campus.core.language.Languages;

public abstract class AbstractTranslator implements Translator {

    @Override
    public final String translate(String text, String sourceLanguage, String targetLanguage)
        throws TranslationUnavailableException {
        if (text == null || text.isBlank()) {
            return text == null ? "" : text;
        }
        if (Languages.sameForTranslation(sourceLanguage, targetLanguage)) {
            return text;
        }
        String source = Languages.translationCode(sourceLanguage);
        String target = Languages.translationCode(targetLanguage);
        if (source.isBlank() || target.isBlank()) {
            throw new TranslationUnavailableException("missing language code for " + name());
        }
        String translated = doTranslate(text, source, target);
        if (translated == null || translated.isBlank()) {
            throw new TranslationUnavailableException(name() + " returned an empty translation for " + source + "->" + target);
        }
        return translated.trim();
    }

    protected abstract String doTranslate(String text, String source, String target) throws TranslationUnavailableException;
}
