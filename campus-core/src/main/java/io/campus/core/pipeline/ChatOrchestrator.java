package io.campus.core.pipeline;

import io.campus.core.context.ContextBuilder;
import io.campus.core.context.Prompt;
import io.campus.core.escalation.ConfidenceScorer;
import io.campus.core.escalation.EscalationDecision;
import io.campus.core.escalation.EscalationPolicy;
import io.campus.core.escalation.EscalationRecord;
import io.campus.core.escalation.EscalationSink;
import io.campus.core.generation.GenerationClient;
import io.campus.core.generation.GenerationOutcome;
import io.campus.core.language.LanguageDetection;
import io.campus.core.language.LanguageDetector;
import io.campus.core.language.Languages;
import io.campus.core.model.ChatRequest;
import io.campus.core.model.ChatResponse;
import io.campus.core.model.Degradation;
import io.campus.core.model.SourceView;
import io.campus.core.model.Turn;
import io.campus.core.model.TurnRole;
import io.campus.core.observability.ObservabilityService;
import io.campus.core.retrieval.RetrievedChunk;
import io.campus.core.retrieval.Retriever;
import io.campus.core.session.Session;
import io.campus.core.session.SessionHistory;
import io.campus.core.session.SessionLocks;
import io.campus.core.translation.Translator;
import java.io.IOException;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.Executors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs one chat message through detection, translation, retrieval, prompt assembly, generation, scoring and
 * persistence. Every stage failure short of an unreadable session store degrades to a fallback; the caller
 * always receives a response.
 *
 * <p>Requests for the same session are serialized from the history read through the final append.
 */
public final class ChatOrchestrator {
    public static final String SESSION_UNAVAILABLE = "session_unavailable";
    public static final String INTERNAL_ERROR = "internal_error";
    static final int SOURCE_PREVIEW_CHARS = 300;
    static final int MAX_SUGGESTIONS = 3;

    private static final Logger LOG = LoggerFactory.getLogger(ChatOrchestrator.class);

    private final LanguageDetector detector;
    private final Translator translator;
    private final Retriever retriever;
    private final SessionHistory sessions;
    private final ContextBuilder contextBuilder;
    private final GenerationClient generation;
    private final ConfidenceScorer scorer;
    private final EscalationPolicy escalationPolicy;
    private final EscalationSink escalations;
    private final ObservabilityService observability;
    private final StageExecutor stages;
    private final SessionLocks locks;
    private final PipelineSettings settings;
    private final Clock clock;
    private final Executor requestExecutor;

    private ChatOrchestrator(Builder builder) {
        this.detector = Objects.requireNonNull(builder.detector, "detector must not be null");
        this.translator = Objects.requireNonNull(builder.translator, "translator must not be null");
        this.retriever = Objects.requireNonNull(builder.retriever, "retriever must not be null");
        this.sessions = Objects.requireNonNull(builder.sessions, "sessions must not be null");
        this.generation = Objects.requireNonNull(builder.generation, "generation must not be null");
        this.escalations = Objects.requireNonNull(builder.escalations, "escalations must not be null");
        this.settings = Objects.requireNonNull(builder.settings, "settings must not be null");
        this.escalationPolicy = Objects.requireNonNull(builder.escalationPolicy, "escalationPolicy must not be null");
        this.contextBuilder = builder.contextBuilder == null
            ? new ContextBuilder(settings.maxHistoryTurns())
            : builder.contextBuilder;
        this.scorer = builder.scorer == null ? new ConfidenceScorer() : builder.scorer;
        this.observability = builder.observability;
        this.stages = builder.stages == null ? new StageExecutor() : builder.stages;
        this.locks = builder.locks == null ? new SessionLocks() : builder.locks;
        this.clock = builder.clock == null ? Clock.systemUTC() : builder.clock;
        this.requestExecutor = builder.requestExecutor == null
            ? Executors.newCachedThreadPool(StageExecutor.daemonThreads("campus-chat-"))
            : builder.requestExecutor;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Handles the request off the calling thread. Cancelling the returned future discards the result but does
     * not stop the pipeline; the turn is still persisted.
     */
    public CompletableFuture<ChatResponse> submit(ChatRequest request) {
        return CompletableFuture.supplyAsync(() -> handle(request), requestExecutor);
    }

    public ChatResponse handle(ChatRequest request) {
        String sessionId = request.sessionId() == null ? UUID.randomUUID().toString() : request.sessionId();
        Handled handled;
        try (SessionLocks.Held ignored = locks.acquire(sessionId)) {
            handled = process(sessionId, request);
        } catch (RuntimeException e) {
            LOG.error("Chat pipeline failed unexpectedly for session {}", sessionId, e);
            return ChatResponse.error(sessionId, settings.errorResponse(), fallbackLanguage(request), INTERNAL_ERROR);
        }
        // outside the session lock
        recordAudit(handled.auditType(), handled.audit());
        return handled.response();
    }

    private Handled process(String sessionId, ChatRequest request) {
        PipelineRun run = new PipelineRun(sessionId, clock);

        Optional<Session> existing;
        List<Turn> history;
        try {
            existing = sessions.find(sessionId);
            history = sessions.loadHistory(sessionId, settings.maxHistoryTurns());
        } catch (IOException e) {
            LOG.error("Session store unavailable for session {}: {}", sessionId, e.getMessage());
            return new Handled(
                ChatResponse.error(sessionId, settings.errorResponse(), fallbackLanguage(request), SESSION_UNAVAILABLE),
                ObservabilityService.CHAT_FAILED,
                Map.of("session_id", sessionId, "error", SESSION_UNAVAILABLE)
            );
        }

        String message = request.message();
        Set<Degradation> inbound = EnumSet.noneOf(Degradation.class);
        String detected = resolveLanguage(sessionId, message, existing, inbound);
        String pivotMessage = toPivot(sessionId, message, detected, inbound);
        run.advance(PipelineStage.LANGUAGE_RESOLVED);

        Set<Degradation> outbound = EnumSet.noneOf(Degradation.class);
        outbound.addAll(inbound);
        List<RetrievedChunk> chunks = retrieve(sessionId, pivotMessage, outbound);
        run.advance(PipelineStage.RETRIEVED);

        Prompt prompt = contextBuilder.build(chunks, history, pivotMessage, settings.contextBudgetChars());
        if (prompt.droppedHistoryTurns() > 0 || prompt.droppedChunks() > 0) {
            LOG.debug("Prompt for session {} dropped {} history turns and {} chunks",
                sessionId, prompt.droppedHistoryTurns(), prompt.droppedChunks());
        }
        run.advance(PipelineStage.CONTEXT_BUILT);

        GenerationOutcome outcome = generate(sessionId, prompt);
        if (outcome.degraded()) {
            outbound.add(Degradation.GENERATION_DEGRADED);
        }
        run.advance(PipelineStage.GENERATED);

        String responseLanguage = settings.supports(request.language()) ? Languages.normalize(request.language()) : detected;
        String answer = fromPivot(sessionId, outcome.answer(), responseLanguage, outbound);
        run.advance(PipelineStage.TRANSLATED);

        double confidence = scorer.score(chunks, outcome);
        EscalationDecision decision = escalationPolicy.decide(confidence, outcome.degraded(), List.of(message, pivotMessage));
        run.advance(PipelineStage.SCORED);

        Instant now = clock.instant();
        List<String> sourceIds = chunks.stream().map(RetrievedChunk::sourceId).toList();
        Turn userTurn = Turn.user(message, pivotMessage, detected, inbound, now);
        Turn assistantTurn = new Turn(
            TurnRole.ASSISTANT,
            answer,
            outcome.answer(),
            responseLanguage,
            outcome.intent(),
            confidence,
            sourceIds,
            decision.escalate(),
            outbound,
            now
        );
        Session session = existing
            .map(found -> found.touch(detected, now))
            .orElseGet(() -> Session.open(sessionId, detected, now));
        persist(session, userTurn, assistantTurn, decision);
        run.advance(PipelineStage.PERSISTED);

        ChatResponse response = new ChatResponse(
            sessionId,
            answer,
            detected,
            responseLanguage,
            outcome.intent(),
            confidence,
            sources(chunks),
            decision.escalate(),
            suggestions(sessionId, chunks, responseLanguage),
            decision.reasonCode(),
            null
        );
        run.advance(PipelineStage.COMPLETED);
        LOG.debug("Session {} completed in {}ms, stages {}", sessionId, run.elapsed().toMillis(), run.timings());
        return new Handled(response, ObservabilityService.CHAT_COMPLETED, completionAudit(response, outbound, run));
    }

    private String resolveLanguage(String sessionId, String message, Optional<Session> existing, Set<Degradation> degradations) {
        try {
            LanguageDetection detection = stages.call("detection", settings.detectionTimeout(), () -> detector.detect(message));
            if (settings.supports(detection.languageCode())) {
                return Languages.normalize(detection.languageCode());
            }
            LOG.warn("Session {} detected unsupported language {}", sessionId, detection.languageCode());
        } catch (StageException e) {
            LOG.warn("Session {} language detection fell back: {}", sessionId, e.getMessage());
        }
        degradations.add(Degradation.LANGUAGE_FALLBACK);
        return existing
            .map(Session::language)
            .filter(settings::supports)
            .orElse(settings.defaultLanguage());
    }

    private String toPivot(String sessionId, String message, String language, Set<Degradation> degradations) {
        if (Languages.sameForTranslation(language, settings.pivotLanguage())) {
            return message;
        }
        try {
            return stages.call("translation", settings.translationTimeout(),
                () -> translator.translate(message, language, settings.pivotLanguage()));
        } catch (StageException e) {
            LOG.warn("Session {} inbound translation {}->{} degraded: {}", sessionId, language, settings.pivotLanguage(), e.getMessage());
            degradations.add(Degradation.TRANSLATION_DEGRADED);
            return message;
        }
    }

    private String fromPivot(String sessionId, String answer, String language, Set<Degradation> degradations) {
        if (Languages.sameForTranslation(settings.pivotLanguage(), language)) {
            return answer;
        }
        try {
            return stages.call("translation", settings.translationTimeout(),
                () -> translator.translate(answer, settings.pivotLanguage(), language));
        } catch (StageException e) {
            LOG.warn("Session {} outbound translation {}->{} degraded: {}", sessionId, settings.pivotLanguage(), language, e.getMessage());
            degradations.add(Degradation.TRANSLATION_DEGRADED);
            return answer;
        }
    }

    private List<RetrievedChunk> retrieve(String sessionId, String pivotMessage, Set<Degradation> degradations) {
        try {
            List<RetrievedChunk> chunks = stages.call("retrieval", settings.retrievalTimeout(),
                () -> retriever.query(pivotMessage, settings.retrievalK()));
            return chunks == null ? List.of() : chunks;
        } catch (StageException e) {
            LOG.warn("Session {} retrieval unavailable: {}", sessionId, e.getMessage());
            degradations.add(Degradation.RETRIEVAL_UNAVAILABLE);
            return List.of();
        }
    }

    private GenerationOutcome generate(String sessionId, Prompt prompt) {
        try {
            return stages.call("generation", settings.generationTimeout(), () -> generation.generate(prompt));
        } catch (StageException e) {
            LOG.warn("Session {} generation degraded: {}", sessionId, e.getMessage());
            return GenerationOutcome.fallback(settings.fallbackResponse(), e.getMessage(), 0);
        }
    }

    private void persist(Session session, Turn userTurn, Turn assistantTurn, EscalationDecision decision) {
        try {
            sessions.appendTurns(session, List.of(userTurn, assistantTurn));
        } catch (IOException e) {
            LOG.warn("Session {} turns were not persisted: {}", session.id(), e.getMessage());
        }
        if (!decision.escalate()) {
            return;
        }
        try {
            EscalationRecord record = escalations.create(session.id(), decision.reason());
            LOG.info("Session {} escalated ({}) as {}", session.id(), decision.reasonCode(), record.id());
        } catch (IOException e) {
            LOG.warn("Session {} escalation ({}) was not recorded: {}", session.id(), decision.reasonCode(), e.getMessage());
        }
    }

    private List<SourceView> sources(List<RetrievedChunk> chunks) {
        List<SourceView> views = new ArrayList<>(chunks.size());
        for (RetrievedChunk chunk : chunks) {
            String text = chunk.text();
            String preview = text.length() > SOURCE_PREVIEW_CHARS ? text.substring(0, SOURCE_PREVIEW_CHARS) + "..." : text;
            views.add(new SourceView(chunk.title(), preview, chunk.score()));
        }
        return views;
    }

    private List<String> suggestions(String sessionId, List<RetrievedChunk> chunks, String language) {
        Set<String> related = new LinkedHashSet<>();
        for (int i = 1; i < chunks.size() && related.size() < MAX_SUGGESTIONS; i++) {
            RetrievedChunk chunk = chunks.get(i);
            if (chunk.faq() && !chunk.title().isBlank()) {
                related.add(chunk.title());
            }
        }
        List<String> pivot = related.isEmpty() ? settings.defaultSuggestions() : List.copyOf(related);
        if (Languages.sameForTranslation(settings.pivotLanguage(), language)) {
            return pivot;
        }
        List<String> translated = new ArrayList<>(pivot.size());
        for (String question : pivot) {
            try {
                translated.add(stages.call("translation", settings.translationTimeout(),
                    () -> translator.translate(question, settings.pivotLanguage(), language)));
            } catch (StageException e) {
                LOG.debug("Session {} kept untranslated suggestion: {}", sessionId, e.getMessage());
                translated.add(question);
            }
        }
        return translated;
    }

    private Map<String, Object> completionAudit(ChatResponse response, Set<Degradation> degradations, PipelineRun run) {
        Map<String, Object> attributes = new LinkedHashMap<>();
        attributes.put("session_id", response.sessionId());
        attributes.put("detected_language", response.detectedLanguage());
        attributes.put("response_language", response.responseLanguage());
        attributes.put("intent", response.intent() == null ? "" : response.intent());
        attributes.put("confidence", response.confidence());
        attributes.put("escalated", response.needsEscalation());
        attributes.put("escalation_reason", response.escalationReason() == null ? "" : response.escalationReason());
        attributes.put("degradations", degradations.stream().map(Degradation::code).toList());
        attributes.put("sources", response.sources().size());
        attributes.put("duration_ms", run.elapsed().toMillis());
        return attributes;
    }

    private void recordAudit(String type, Map<String, Object> attributes) {
        if (observability == null) {
            return;
        }
        try {
            observability.record(type, attributes);
        } catch (IOException e) {
            LOG.debug("Failed to record audit event {}: {}", type, e.getMessage());
        }
    }

    private String fallbackLanguage(ChatRequest request) {
        return settings.supports(request.language()) ? Languages.normalize(request.language()) : settings.defaultLanguage();
    }

    private record Handled(ChatResponse response, String auditType, Map<String, Object> audit) {
    }

    public static final class Builder {
        private LanguageDetector detector;
        private Translator translator;
        private Retriever retriever;
        private SessionHistory sessions;
        private ContextBuilder contextBuilder;
        private GenerationClient generation;
        private ConfidenceScorer scorer;
        private EscalationPolicy escalationPolicy;
        private EscalationSink escalations;
        private ObservabilityService observability;
        private StageExecutor stages;
        private SessionLocks locks;
        private PipelineSettings settings;
        private Clock clock;
        private Executor requestExecutor;

        private Builder() {
        }

        public Builder detector(LanguageDetector detector) {
            this.detector = detector;
            return this;
        }

        public Builder translator(Translator translator) {
            this.translator = translator;
            return this;
        }

        public Builder retriever(Retriever retriever) {
            this.retriever = retriever;
            return this;
        }

        public Builder sessions(SessionHistory sessions) {
            this.sessions = sessions;
            return this;
        }

        public Builder contextBuilder(ContextBuilder contextBuilder) {
            this.contextBuilder = contextBuilder;
            return this;
        }

        public Builder generation(GenerationClient generation) {
            this.generation = generation;
            return this;
        }

        public Builder scorer(ConfidenceScorer scorer) {
            this.scorer = scorer;
            return this;
        }

        public Builder escalationPolicy(EscalationPolicy escalationPolicy) {
            this.escalationPolicy = escalationPolicy;
            return this;
        }

        public Builder escalations(EscalationSink escalations) {
            this.escalations = escalations;
            return this;
        }

        public Builder observability(ObservabilityService observability) {
            this.observability = observability;
            return this;
        }

        public Builder stages(StageExecutor stages) {
            this.stages = stages;
            return this;
        }

        public Builder locks(SessionLocks locks) {
            this.locks = locks;
            return this;
        }

        public Builder settings(PipelineSettings settings) {
            this.settings = settings;
            return this;
        }

        public Builder clock(Clock clock) {
            this.clock = clock;
            return this;
        }

        public Builder requestExecutor(Executor requestExecutor) {
            this.requestExecutor = requestExecutor;
            return this;
        }

        public ChatOrchestrator build() {
            return new ChatOrchestrator(this);
        }
    }
}
