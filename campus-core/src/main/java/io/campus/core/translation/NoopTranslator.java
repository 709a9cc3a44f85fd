package io.campus.core.translation;

/**
 * Used when translation is switched off. Same-language calls pass through; everything else is unavailable.
 */
public final class NoopTranslator extends AbstractTranslator {

    @Override
    public String name() {
        return "none";
    }

    @Override
    protected String doTranslate(String text, String source, String target) throws TranslationUnavailableException {
        throw new TranslationUnavailableException("translation is disabled");
    }
}
