package io.campus.core.translation;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Tries translators in order. With an attempt timeout, a translator that hangs past it is cancelled and the
 * next one gets its turn, so a stalled first choice cannot use up the caller's whole deadline.
 */
public final class FallbackTranslator implements Translator {
    private static final Logger LOG = LoggerFactory.getLogger(FallbackTranslator.class);
    private static final AtomicInteger THREADS = new AtomicInteger();

    private final List<Translator> chain;
    private final Duration attemptTimeout;
    private final ExecutorService executor;

    public FallbackTranslator(List<Translator> chain) {
        this(chain, null);
    }

    public FallbackTranslator(List<Translator> chain, Duration attemptTimeout) {
        this.chain = List.copyOf(chain);
        this.attemptTimeout = attemptTimeout;
        this.executor = attemptTimeout == null ? null : Executors.newCachedThreadPool(runnable -> {
            Thread thread = new Thread(runnable, "campus-translate-" + THREADS.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        });
    }

    @Override
    public String name() {
        return "chain";
    }

    @Override
    public String translate(String text, String sourceLanguage, String targetLanguage) throws TranslationUnavailableException {
        TranslationUnavailableException last = new TranslationUnavailableException("no translators in fallback chain");
        for (Translator translator : chain) {
            try {
                String translated = attempt(translator, text, sourceLanguage, targetLanguage);
                LOG.debug("Translator {} served {}->{}", translator.name(), sourceLanguage, targetLanguage);
                return translated;
            } catch (TranslationUnavailableException e) {
                LOG.warn("Translator {} failed for {}->{}: {}", translator.name(), sourceLanguage, targetLanguage, e.getMessage());
                last = e;
            }
            if (Thread.currentThread().isInterrupted()) {
                break;
            }
        }
        throw last;
    }

    private String attempt(Translator translator, String text, String source, String target) throws TranslationUnavailableException {
        if (executor == null) {
            return translator.translate(text, source, target);
        }
        Future<String> future = executor.submit(() -> translator.translate(text, source, target));
        long timeoutMs = Math.max(1, attemptTimeout.toMillis());
        try {
            return future.get(timeoutMs, TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            throw new TranslationUnavailableException(translator.name() + " timed out after " + timeoutMs + "ms");
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof TranslationUnavailableException unavailable) {
                throw unavailable;
            }
            throw new TranslationUnavailableException(translator.name() + " failed: " + cause.getMessage(), cause);
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            throw new TranslationUnavailableException("translation interrupted", e);
        }
    }
}
