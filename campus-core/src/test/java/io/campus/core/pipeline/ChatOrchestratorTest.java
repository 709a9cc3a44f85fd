package io.campus.core.pipeline;

import static org.assertj.core.api.Assertions.assertThat;

import io.campus.core.config.model.AssistantSettings;
import io.campus.core.escalation.EscalationPolicy;
import io.campus.core.escalation.EscalationReason;
import io.campus.core.escalation.EscalationRecord;
import io.campus.core.escalation.InMemoryEscalationStore;
import io.campus.core.generation.RetryPolicy;
import io.campus.core.generation.RetryingGenerationClient;
import io.campus.core.language.ScriptLanguageDetector;
import io.campus.core.model.ChatMessage;
import io.campus.core.model.ChatRequest;
import io.campus.core.model.ChatResponse;
import io.campus.core.model.Degradation;
import io.campus.core.model.Turn;
import io.campus.core.model.TurnRole;
import io.campus.core.observability.AuditEvent;
import io.campus.core.observability.AuditStore;
import io.campus.core.observability.InMemoryAuditStore;
import io.campus.core.observability.ObservabilityService;
import io.campus.core.provider.CompletionOptions;
import io.campus.core.provider.EchoProvider;
import io.campus.core.provider.LlmException;
import io.campus.core.provider.LlmProvider;
import io.campus.core.provider.LlmResponse;
import io.campus.core.retrieval.FaqEntry;
import io.campus.core.retrieval.FileKnowledgeStore;
import io.campus.core.retrieval.KnowledgeIngestor;
import io.campus.core.retrieval.KnowledgeRetriever;
import io.campus.core.retrieval.RetrievedChunk;
import io.campus.core.retrieval.Retriever;
import io.campus.core.session.InMemorySessionStore;
import io.campus.core.session.Session;
import io.campus.core.session.SessionHistory;
import io.campus.core.translation.FallbackTranslator;
import io.campus.core.translation.NoopTranslator;
import io.campus.core.translation.TranslationUnavailableException;
import io.campus.core.translation.Translator;
import java.io.IOException;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class ChatOrchestratorTest {

    private static final String FALLBACK = "A staff member will follow up with you shortly.";
    private static final String ERROR = "The assistant is temporarily unavailable.";
    private static final List<String> SUGGESTIONS = List.of("What are the library hours?", "When are fees due?");

    @TempDir
    Path tempDir;

    private StageExecutor stages;
    private InMemorySessionStore sessions;
    private InMemoryEscalationStore escalations;
    private ObservabilityService observability;

    @BeforeEach
    void setUp() {
        stages = new StageExecutor();
        sessions = new InMemorySessionStore();
        escalations = new InMemoryEscalationStore();
        observability = new ObservabilityService(new InMemoryAuditStore(), Clock.systemUTC());
    }

    @AfterEach
    void tearDown() {
        stages.close();
    }

    @Test
    void shouldAnswerLibraryHoursFromFaqWithoutEscalating() throws Exception {
        Retriever retriever = faqRetriever();
        ChatOrchestrator orchestrator = orchestrator(retriever, new NoopTranslator(),
            new FixedProvider("The library is open 8am to 10pm on weekdays.\n[intent: library]"), settings(Duration.ofSeconds(5)))
            .build();

        ChatResponse response = orchestrator.handle(new ChatRequest("What are the library hours?", "s-lib", null));

        assertThat(response.failed()).isFalse();
        assertThat(response.responseText()).isEqualTo("The library is open 8am to 10pm on weekdays.");
        assertThat(response.detectedLanguage()).isEqualTo("en");
        assertThat(response.responseLanguage()).isEqualTo("en");
        assertThat(response.intent()).isEqualTo("library");
        assertThat(response.needsEscalation()).isFalse();
        assertThat(response.escalationReason()).isNull();
        assertThat(response.confidence()).isGreaterThanOrEqualTo(0.5);
        assertThat(response.sources()).isNotEmpty();
        assertThat(response.sources().get(0).title()).isEqualTo("What are the library hours?");
        assertThat(sessions.turnCount("s-lib")).isEqualTo(2);
        assertThat(escalations.all()).isEmpty();

        List<AuditEvent> events = observability.recent(10);
        assertThat(events).singleElement().satisfies(event -> {
            assertThat(event.type()).isEqualTo(ObservabilityService.CHAT_COMPLETED);
            assertThat(event.attributes()).containsEntry("session_id", "s-lib").containsEntry("escalated", false);
        });
    }

    @Test
    void shouldEscalateLowConfidenceWhenNothingIsRetrieved() throws Exception {
        ChatOrchestrator orchestrator = orchestrator(faqRetriever(), new NoopTranslator(),
            new FixedProvider("I do not know, a staff member can help."), settings(Duration.ofSeconds(5)))
            .build();

        ChatResponse response = orchestrator.handle(new ChatRequest("Where can I get a parking permit?", "s-park", null));

        assertThat(response.sources()).isEmpty();
        assertThat(response.confidence()).isEqualTo(0.2);
        assertThat(response.needsEscalation()).isTrue();
        assertThat(response.escalationReason()).isEqualTo("low_confidence");
        assertThat(response.suggestedQuestions()).isEqualTo(SUGGESTIONS);
        assertThat(escalations.all()).singleElement().satisfies(record -> {
            assertThat(record.sessionId()).isEqualTo("s-park");
            assertThat(record.reason()).isEqualTo(EscalationReason.LOW_CONFIDENCE);
        });
    }

    @Test
    void shouldReturnFallbackAndEscalateWhenGenerationRetriesAreExhausted() {
        FailingProvider provider = new FailingProvider();
        ChatOrchestrator orchestrator = orchestrator(fixedRetriever(0.9), new NoopTranslator(), provider, settings(Duration.ofSeconds(5)))
            .build();

        ChatResponse response = orchestrator.handle(new ChatRequest("When are fees due?", "s-fees", null));

        assertThat(provider.calls.get()).isEqualTo(3);
        assertThat(response.failed()).isFalse();
        assertThat(response.responseText()).isEqualTo(FALLBACK);
        assertThat(response.needsEscalation()).isTrue();
        assertThat(response.escalationReason()).isEqualTo("generation_failure");
        assertThat(escalations.all()).extracting(EscalationRecord::reason).containsExactly(EscalationReason.GENERATION_FAILURE);
        Turn assistant = sessions.loadHistory("s-fees", 2).get(1);
        assertThat(assistant.degradations()).contains(Degradation.GENERATION_DEGRADED);
    }

    @Test
    void shouldEscalateExplicitHumanRequest() {
        ChatOrchestrator orchestrator = orchestrator(fixedRetriever(0.9), new NoopTranslator(),
            new FixedProvider("Fees are due by 15 August."), settings(Duration.ofSeconds(5)))
            .build();

        ChatResponse response = orchestrator.handle(new ChatRequest("Let me talk to a human about fees", "s-human", null));

        assertThat(response.needsEscalation()).isTrue();
        assertThat(response.escalationReason()).isEqualTo("explicit_request");
        assertThat(response.responseText()).isEqualTo("Fees are due by 15 August.");
    }

    @Test
    void shouldTranslateThroughPivotAndBack() {
        DictionaryTranslator translator = new DictionaryTranslator(Map.of(
            "पुस्तकालय कब खुलता है?", "What are the library hours?"
        ));
        ChatOrchestrator orchestrator = orchestrator(faqRetriever(), translator, new EchoProvider("echo"), settings(Duration.ofSeconds(5)))
            .build();

        ChatResponse response = orchestrator.handle(new ChatRequest("पुस्तकालय कब खुलता है?", "s-hi", null));

        assertThat(response.detectedLanguage()).isEqualTo("hi");
        assertThat(response.responseLanguage()).isEqualTo("hi");
        assertThat(response.responseText()).isEqualTo("hi: [echo] What are the library hours?");
        assertThat(response.sources()).isNotEmpty();
        assertThat(response.suggestedQuestions()).allSatisfy(question -> assertThat(question).startsWith("hi: "));

        List<Turn> history = sessions.loadHistory("s-hi", 2);
        assertThat(history.get(0).content()).isEqualTo("पुस्तकालय कब खुलता है?");
        assertThat(history.get(0).pivotContent()).isEqualTo("What are the library hours?");
        assertThat(history.get(1).pivotContent()).isEqualTo("[echo] What are the library hours?");
        assertThat(history.get(1).degraded()).isFalse();
    }

    @Test
    void shouldPassTextThroughWhenTranslationIsUnavailable() {
        ChatOrchestrator orchestrator = orchestrator(fixedRetriever(0.9), new NoopTranslator(), new EchoProvider("echo"),
            settings(Duration.ofSeconds(5)))
            .build();

        ChatResponse response = orchestrator.handle(new ChatRequest("पुस्तकालय कब खुलता है?", "s-noop", null));

        assertThat(response.failed()).isFalse();
        assertThat(response.responseText()).isEqualTo("[echo] पुस्तकालय कब खुलता है?");
        List<Turn> history = sessions.loadHistory("s-noop", 2);
        assertThat(history.get(0).degradations()).containsExactly(Degradation.TRANSLATION_DEGRADED);
        assertThat(history.get(1).degradations()).contains(Degradation.TRANSLATION_DEGRADED);
    }

    @Test
    void shouldAnswerInRequestedLanguage() {
        DictionaryTranslator translator = new DictionaryTranslator(Map.of());
        ChatOrchestrator orchestrator = orchestrator(fixedRetriever(0.9), translator, new FixedProvider("Fees are due by 15 August."),
            settings(Duration.ofSeconds(5)))
            .build();

        ChatResponse response = orchestrator.handle(new ChatRequest("When are fees due?", "s-req", "hi"));

        assertThat(response.detectedLanguage()).isEqualTo("en");
        assertThat(response.responseLanguage()).isEqualTo("hi");
        assertThat(response.responseText()).isEqualTo("hi: Fees are due by 15 August.");
    }

    @Test
    void shouldFallBackToSessionLanguageWhenDetectionIsAmbiguous() {
        sessions.appendTurns(Session.open("s-amb", "hi", Instant.EPOCH), List.of());
        DictionaryTranslator translator = new DictionaryTranslator(Map.of());
        ChatOrchestrator orchestrator = orchestrator(fixedRetriever(0.9), translator, new FixedProvider("Roll number 2024"),
            settings(Duration.ofSeconds(5)))
            .build();

        ChatResponse response = orchestrator.handle(new ChatRequest("2024?", "s-amb", null));

        assertThat(response.detectedLanguage()).isEqualTo("hi");
        List<Turn> history = sessions.loadHistory("s-amb", 2);
        assertThat(history.get(0).degradations()).contains(Degradation.LANGUAGE_FALLBACK);
    }

    @Test
    void shouldUseDefaultLanguageForUnsupportedScript() {
        ChatOrchestrator orchestrator = orchestrator(fixedRetriever(0.9), new NoopTranslator(), new FixedProvider("ok"),
            settings(Duration.ofSeconds(5)))
            .build();

        ChatResponse response = orchestrator.handle(new ChatRequest("গ্রন্থাগার কখন খোলে?", "s-bn", null));

        assertThat(response.detectedLanguage()).isEqualTo("en");
        assertThat(sessions.loadHistory("s-bn", 1).get(0).degradations()).contains(Degradation.LANGUAGE_FALLBACK);
    }

    @Test
    void shouldDegradeRetrievalThatMissesItsDeadline() {
        Retriever slow = (text, k) -> {
            try {
                Thread.sleep(5_000);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            return List.of(new RetrievedChunk("faq:late", "Late", "too late", 0.9));
        };
        ChatOrchestrator orchestrator = orchestrator(slow, new NoopTranslator(), new FixedProvider("Please ask the office."),
            settings(Duration.ofMillis(200)))
            .build();

        long started = System.nanoTime();
        ChatResponse response = orchestrator.handle(new ChatRequest("When are fees due?", "s-slow", null));
        long elapsedMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - started);

        assertThat(elapsedMs).isLessThan(4_000);
        assertThat(response.sources()).isEmpty();
        assertThat(response.escalationReason()).isEqualTo("low_confidence");
        assertThat(sessions.loadHistory("s-slow", 2).get(1).degradations()).contains(Degradation.RETRIEVAL_UNAVAILABLE);
    }

    @Test
    void shouldReturnSessionUnavailableWithoutWritingAnything() throws Exception {
        BrokenSessions broken = new BrokenSessions();
        ChatOrchestrator orchestrator = orchestrator(fixedRetriever(0.9), new NoopTranslator(), new FixedProvider("unused"),
            settings(Duration.ofSeconds(5)))
            .sessions(broken)
            .build();

        ChatResponse response = orchestrator.handle(new ChatRequest("When are fees due?", "s-broken", null));

        assertThat(response.failed()).isTrue();
        assertThat(response.error()).isEqualTo(ChatOrchestrator.SESSION_UNAVAILABLE);
        assertThat(response.responseText()).isEqualTo(ERROR);
        assertThat(broken.appends.get()).isZero();
        assertThat(escalations.all()).isEmpty();
        assertThat(observability.recent(10)).singleElement()
            .satisfies(event -> assertThat(event.type()).isEqualTo(ObservabilityService.CHAT_FAILED));
    }

    @Test
    void shouldKeepConcurrentTurnsOfOneSessionPaired() throws Exception {
        ExecutorService pool = Executors.newFixedThreadPool(8);
        try {
            ChatOrchestrator orchestrator = orchestrator(fixedRetriever(0.9), new NoopTranslator(), new EchoProvider("echo"),
                settings(Duration.ofSeconds(5)))
                .requestExecutor(pool)
                .build();

            List<CompletableFuture<ChatResponse>> futures = new ArrayList<>();
            for (int i = 0; i < 20; i++) {
                futures.add(orchestrator.submit(new ChatRequest("question number " + i, "s-busy", "en")));
            }
            CompletableFuture.allOf(futures.toArray(new CompletableFuture[0])).get(30, TimeUnit.SECONDS);
        } finally {
            pool.shutdownNow();
        }

        List<Turn> history = sessions.loadHistory("s-busy", 100);
        assertThat(history).hasSize(40);
        assertThat(history.stream().filter(turn -> turn.role() == TurnRole.USER).map(Turn::content).distinct().count())
            .isEqualTo(20);
        for (int i = 0; i < history.size(); i += 2) {
            Turn user = history.get(i);
            Turn assistant = history.get(i + 1);
            assertThat(user.role()).isEqualTo(TurnRole.USER);
            assertThat(assistant.role()).isEqualTo(TurnRole.ASSISTANT);
            assertThat(assistant.content()).isEqualTo("[echo] " + user.content());
        }
    }

    @Test
    void shouldAssignSessionIdWhenMissing() {
        ChatOrchestrator orchestrator = orchestrator(fixedRetriever(0.9), new NoopTranslator(), new FixedProvider("ok"),
            settings(Duration.ofSeconds(5)))
            .build();

        ChatResponse response = orchestrator.handle(ChatRequest.of("When are fees due?"));

        assertThat(response.sessionId()).isNotBlank();
        assertThat(sessions.turnCount(response.sessionId())).isEqualTo(2);
    }

    @Test
    void shouldSuggestRelatedFaqQuestions() {
        Retriever retriever = (text, k) -> List.of(
            new RetrievedChunk("faq:fees", "When are fees due?", "By 15 August.", 0.9),
            new RetrievedChunk("faq:late", "Is there a late fee?", "Yes, 500 rupees.", 0.7),
            new RetrievedChunk("doc:handbook#2", "Handbook", "Fee refunds take two weeks.", 0.6),
            new RetrievedChunk("faq:refund", "How do refunds work?", "Apply at the accounts office.", 0.5)
        );
        ChatOrchestrator orchestrator = orchestrator(retriever, new NoopTranslator(), new FixedProvider("By 15 August."),
            settings(Duration.ofSeconds(5)))
            .build();

        ChatResponse response = orchestrator.handle(new ChatRequest("When are fees due?", "s-sugg", null));

        assertThat(response.suggestedQuestions()).containsExactly("Is there a late fee?", "How do refunds work?");
        assertThat(response.sources()).hasSize(4);
    }

    @Test
    void shouldStillAnswerAndEscalateWhenTurnsCannotBePersisted() {
        UnwritableSessions unwritable = new UnwritableSessions();
        ChatOrchestrator orchestrator = orchestrator(fixedRetriever(0.9), new NoopTranslator(),
            new FixedProvider("Someone from the office will contact you."), settings(Duration.ofSeconds(5)))
            .sessions(unwritable)
            .build();

        ChatResponse response = orchestrator.handle(new ChatRequest("I want to talk to a human about my fees", "s-ro", null));

        assertThat(response.failed()).isFalse();
        assertThat(response.responseText()).isEqualTo("Someone from the office will contact you.");
        assertThat(response.needsEscalation()).isTrue();
        assertThat(response.escalationReason()).isEqualTo("explicit_request");
        assertThat(unwritable.appends.get()).isEqualTo(1);
        assertThat(escalations.all()).singleElement().satisfies(record -> {
            assertThat(record.sessionId()).isEqualTo("s-ro");
            assertThat(record.reason()).isEqualTo(EscalationReason.EXPLICIT_REQUEST);
        });
    }

    @Test
    void shouldReturnFallbackWhenGenerationMissesItsDeadline() {
        ChatOrchestrator orchestrator = orchestrator(fixedRetriever(0.9), new NoopTranslator(), new StalledProvider(),
            settings(Duration.ofSeconds(5), Duration.ofMillis(200)))
            .build();

        long started = System.nanoTime();
        ChatResponse response = orchestrator.handle(new ChatRequest("When are fees due?", "s-stall", null));
        long elapsedMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - started);

        assertThat(elapsedMs).isLessThan(4_000);
        assertThat(response.failed()).isFalse();
        assertThat(response.responseText()).isEqualTo(FALLBACK);
        assertThat(response.needsEscalation()).isTrue();
        assertThat(response.escalationReason()).isEqualTo("generation_failure");
        assertThat(escalations.all()).extracting(EscalationRecord::reason).containsExactly(EscalationReason.GENERATION_FAILURE);
        assertThat(sessions.loadHistory("s-stall", 2).get(1).degradations()).contains(Degradation.GENERATION_DEGRADED);
    }

    @Test
    void shouldMoveToNextTranslatorWhenFirstStallsInsideStageDeadline() {
        Translator chain = new FallbackTranslator(List.of(
            new StalledTranslator(),
            new DictionaryTranslator(Map.of("पुस्तकालय कब खुलता है?", "What are the library hours?"))
        ), Duration.ofMillis(150));
        ChatOrchestrator orchestrator = orchestrator(fixedRetriever(0.9), chain, new EchoProvider("echo"),
            settings(Duration.ofMillis(500), Duration.ofSeconds(5)))
            .build();

        ChatResponse response = orchestrator.handle(new ChatRequest("पुस्तकालय कब खुलता है?", "s-chain", null));

        assertThat(response.responseText()).isEqualTo("hi: [echo] What are the library hours?");
        List<Turn> history = sessions.loadHistory("s-chain", 2);
        assertThat(history.get(0).pivotContent()).isEqualTo("What are the library hours?");
        assertThat(history.get(0).degradations()).doesNotContain(Degradation.TRANSLATION_DEGRADED);
        assertThat(history.get(1).degradations()).doesNotContain(Degradation.TRANSLATION_DEGRADED);
    }

    @Test
    void shouldWriteAuditEventsOfDifferentSessionsInParallel() throws Exception {
        OverlapAuditStore audit = new OverlapAuditStore(2);
        ExecutorService pool = Executors.newFixedThreadPool(2);
        try {
            ChatOrchestrator orchestrator = orchestrator(fixedRetriever(0.9), new NoopTranslator(), new EchoProvider("echo"),
                settings(Duration.ofSeconds(5)))
                .observability(new ObservabilityService(audit, Clock.systemUTC()))
                .requestExecutor(pool)
                .build();

            CompletableFuture<ChatResponse> first = orchestrator.submit(new ChatRequest("When are fees due?", "session-a", "en"));
            CompletableFuture<ChatResponse> second = orchestrator.submit(new ChatRequest("When are fees due?", "session-b", "en"));
            CompletableFuture.allOf(first, second).get(10, TimeUnit.SECONDS);
        } finally {
            pool.shutdownNow();
        }

        assertThat(audit.maxConcurrent.get()).isEqualTo(2);
        assertThat(audit.events).hasSize(2);
    }

    @Test
    void shouldReleaseSessionBeforeWritingAuditEvent() throws Exception {
        BlockingAuditStore audit = new BlockingAuditStore();
        ExecutorService pool = Executors.newFixedThreadPool(2);
        try {
            ChatOrchestrator orchestrator = orchestrator(fixedRetriever(0.9), new NoopTranslator(), new EchoProvider("echo"),
                settings(Duration.ofSeconds(5)))
                .observability(new ObservabilityService(audit, Clock.systemUTC()))
                .requestExecutor(pool)
                .build();

            CompletableFuture<ChatResponse> first = orchestrator.submit(new ChatRequest("first question", "s-audit", "en"));
            assertThat(audit.entered.await(5, TimeUnit.SECONDS)).isTrue();

            ChatResponse second = orchestrator.submit(new ChatRequest("second question", "s-audit", "en")).get(5, TimeUnit.SECONDS);

            assertThat(second.responseText()).isEqualTo("[echo] second question");
            assertThat(first).isNotDone();
            audit.release.countDown();
            assertThat(first.get(5, TimeUnit.SECONDS).responseText()).isEqualTo("[echo] first question");
        } finally {
            audit.release.countDown();
            pool.shutdownNow();
        }

        assertThat(sessions.turnCount("s-audit")).isEqualTo(4);
    }

    private Retriever faqRetriever() {
        FileKnowledgeStore store = new FileKnowledgeStore(tempDir.resolve("knowledge/chunks.json"));
        try {
            new KnowledgeIngestor(store).ingestFaqs(List.of(
                new FaqEntry("library", "What are the library hours?", "The library is open 8am to 10pm on weekdays.", "library"),
                new FaqEntry("fees", "When is the fee deadline?", "Semester fees are due by the 15th of August.", "fees")
            ));
        } catch (IOException e) {
            throw new IllegalStateException(e);
        }
        return new KnowledgeRetriever(store, 0.3);
    }

    private static Retriever fixedRetriever(double score) {
        return (text, k) -> List.of(new RetrievedChunk("faq:fees", "When are fees due?", "Fees are due by 15 August.", score));
    }

    private ChatOrchestrator.Builder orchestrator(Retriever retriever, Translator translator, LlmProvider provider, PipelineSettings settings) {
        return ChatOrchestrator.builder()
            .detector(new ScriptLanguageDetector(0.6, 2))
            .translator(translator)
            .retriever(retriever)
            .sessions(sessions)
            .generation(new RetryingGenerationClient(
                provider,
                "test-model",
                CompletionOptions.defaults(),
                new RetryPolicy(3, Duration.ZERO, Duration.ZERO),
                FALLBACK,
                duration -> {
                }
            ))
            .escalationPolicy(new EscalationPolicy(0.5, AssistantSettings.defaults().escalationPatterns()))
            .escalations(escalations)
            .observability(observability)
            .stages(stages)
            .settings(settings);
    }

    private static PipelineSettings settings(Duration timeout) {
        return settings(timeout, timeout);
    }

    private static PipelineSettings settings(Duration timeout, Duration generationTimeout) {
        return new PipelineSettings(
            "en",
            "en",
            List.of("en", "hi", "raj", "gu", "mr", "pa", "ta"),
            5,
            6000,
            10,
            FALLBACK,
            ERROR,
            SUGGESTIONS,
            timeout,
            timeout,
            timeout,
            generationTimeout
        );
    }

    private record FixedProvider(String reply) implements LlmProvider {
        @Override
        public String name() {
            return "fixed";
        }

        @Override
        public LlmResponse complete(String model, List<ChatMessage> messages, CompletionOptions options) {
            return new LlmResponse(reply, Map.of());
        }
    }

    private static final class FailingProvider implements LlmProvider {
        private final AtomicInteger calls = new AtomicInteger();

        @Override
        public String name() {
            return "failing";
        }

        @Override
        public LlmResponse complete(String model, List<ChatMessage> messages, CompletionOptions options) throws LlmException {
            calls.incrementAndGet();
            throw LlmException.forStatus(503, "overloaded");
        }
    }

    // prefixes outbound text with the target code; inbound text is looked up
    private static final class DictionaryTranslator implements Translator {
        private final Map<String, String> toPivot;

        DictionaryTranslator(Map<String, String> toPivot) {
            this.toPivot = toPivot;
        }

        @Override
        public String name() {
            return "dictionary";
        }

        @Override
        public String translate(String text, String sourceLanguage, String targetLanguage) throws TranslationUnavailableException {
            if (sourceLanguage.equals(targetLanguage)) {
                return text;
            }
            if ("en".equals(targetLanguage)) {
                String known = toPivot.get(text);
                if (known == null) {
                    throw new TranslationUnavailableException("no entry for " + text);
                }
                return known;
            }
            return targetLanguage + ": " + text;
        }
    }

    private static final class StalledProvider implements LlmProvider {
        @Override
        public String name() {
            return "stalled";
        }

        @Override
        public LlmResponse complete(String model, List<ChatMessage> messages, CompletionOptions options) throws LlmException {
            try {
                Thread.sleep(5_000);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            throw LlmException.transientFailure("stalled", -1, null);
        }
    }

    private static final class StalledTranslator implements Translator {
        @Override
        public String name() {
            return "stalled";
        }

        @Override
        public String translate(String text, String sourceLanguage, String targetLanguage) throws TranslationUnavailableException {
            try {
                Thread.sleep(2_000);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            throw new TranslationUnavailableException("stalled");
        }
    }

    private static final class UnwritableSessions implements SessionHistory {
        private final AtomicInteger appends = new AtomicInteger();

        @Override
        public Optional<Session> find(String sessionId) {
            return Optional.empty();
        }

        @Override
        public List<Turn> loadHistory(String sessionId, int limit) {
            return List.of();
        }

        @Override
        public void appendTurns(Session session, List<Turn> turns) throws IOException {
            appends.incrementAndGet();
            throw new IOException("disk full");
        }
    }

    // waits until the expected number of writers are inside append at the same time
    private static final class OverlapAuditStore implements AuditStore {
        private final List<AuditEvent> events = new CopyOnWriteArrayList<>();
        private final AtomicInteger inside = new AtomicInteger();
        private final AtomicInteger maxConcurrent = new AtomicInteger();
        private final CountDownLatch arrived;

        OverlapAuditStore(int writers) {
            this.arrived = new CountDownLatch(writers);
        }

        @Override
        public List<AuditEvent> load() {
            return List.copyOf(events);
        }

        @Override
        public void append(AuditEvent event) throws IOException {
            maxConcurrent.accumulateAndGet(inside.incrementAndGet(), Math::max);
            try {
                arrived.countDown();
                arrived.await(2, TimeUnit.SECONDS);
                events.add(event);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new IOException("interrupted", e);
            } finally {
                inside.decrementAndGet();
            }
        }
    }

    // holds the first append until released
    private static final class BlockingAuditStore implements AuditStore {
        private final CountDownLatch entered = new CountDownLatch(1);
        private final CountDownLatch release = new CountDownLatch(1);
        private final AtomicBoolean first = new AtomicBoolean(true);
        private final List<AuditEvent> events = new CopyOnWriteArrayList<>();

        @Override
        public List<AuditEvent> load() {
            return List.copyOf(events);
        }

        @Override
        public void append(AuditEvent event) throws IOException {
            if (first.compareAndSet(true, false)) {
                entered.countDown();
                try {
                    release.await(10, TimeUnit.SECONDS);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    throw new IOException("interrupted", e);
                }
            }
            events.add(event);
        }
    }

    private static final class BrokenSessions implements SessionHistory {
        private final AtomicInteger appends = new AtomicInteger();

        @Override
        public Optional<Session> find(String sessionId) throws IOException {
            throw new IOException("database is locked");
        }

        @Override
        public List<Turn> loadHistory(String sessionId, int limit) throws IOException {
            throw new IOException("database is locked");
        }

        @Override
        public void appendTurns(Session session, List<Turn> turns) {
            appends.incrementAndGet();
        }
    }
}
