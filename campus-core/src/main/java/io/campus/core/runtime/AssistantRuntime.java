package io.campus.core.runtime;

import io.campus.core.config.ConfigPaths;
import io.campus.core.config.model.AssistantConfig;
import io.campus.core.config.model.AssistantSettings;
import io.campus.core.config.model.GenerationConfig;
import io.campus.core.config.model.ProviderConfig;
import io.campus.core.config.model.StorageConfig;
import io.campus.core.config.model.TimeoutsConfig;
import io.campus.core.config.model.TranslationConfig;
import io.campus.core.escalation.EscalationPolicy;
import io.campus.core.escalation.EscalationSink;
import io.campus.core.escalation.InMemoryEscalationStore;
import io.campus.core.escalation.SqliteEscalationStore;
import io.campus.core.generation.RetryPolicy;
import io.campus.core.generation.RetryingGenerationClient;
import io.campus.core.language.ScriptLanguageDetector;
import io.campus.core.observability.FileAuditStore;
import io.campus.core.observability.ObservabilityService;
import io.campus.core.pipeline.ChatOrchestrator;
import io.campus.core.pipeline.PipelineSettings;
import io.campus.core.pipeline.StageExecutor;
import io.campus.core.provider.CompletionOptions;
import io.campus.core.provider.EchoProvider;
import io.campus.core.provider.GeminiProvider;
import io.campus.core.provider.LlmProvider;
import io.campus.core.provider.OpenAiCompatProvider;
import io.campus.core.provider.ProviderRegistry;
import io.campus.core.retrieval.FileKnowledgeStore;
import io.campus.core.retrieval.KnowledgeIngestor;
import io.campus.core.retrieval.KnowledgeRetriever;
import io.campus.core.retrieval.KnowledgeStore;
import io.campus.core.session.InMemorySessionStore;
import io.campus.core.session.SessionHistory;
import io.campus.core.session.SqliteSessionStore;
import io.campus.core.translation.FallbackTranslator;
import io.campus.core.translation.GoogleTranslateTranslator;
import io.campus.core.translation.LlmTranslator;
import io.campus.core.translation.NoopTranslator;
import io.campus.core.translation.Translator;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Everything one running assistant needs, assembled from configuration.
 */
public final class AssistantRuntime implements AutoCloseable {
    private static final Logger LOG = LoggerFactory.getLogger(AssistantRuntime.class);
    static final String OPENAI_BASE = "https://api.openai.com/v1";
    static final String GEMINI_BASE = "https://generativelanguage.googleapis.com/v1beta";

    private final AssistantConfig config;
    private final Path workspace;
    private final ChatOrchestrator orchestrator;
    private final KnowledgeStore knowledgeStore;
    private final KnowledgeIngestor ingestor;
    private final Translator translator;
    private final EscalationSink escalations;
    private final ObservabilityService observability;
    private final StageExecutor stages;

    private AssistantRuntime(
        AssistantConfig config,
        Path workspace,
        ChatOrchestrator orchestrator,
        KnowledgeStore knowledgeStore,
        Translator translator,
        EscalationSink escalations,
        ObservabilityService observability,
        StageExecutor stages
    ) {
        this.config = config;
        this.workspace = workspace;
        this.orchestrator = orchestrator;
        this.knowledgeStore = knowledgeStore;
        this.ingestor = new KnowledgeIngestor(knowledgeStore);
        this.translator = translator;
        this.escalations = escalations;
        this.observability = observability;
        this.stages = stages;
    }

    public static AssistantRuntime open(AssistantConfig config) throws IOException {
        AssistantSettings assistant = config.assistant();
        StorageConfig storage = config.storage();
        Path workspace = ConfigPaths.resolveWorkspace(assistant.workspace());
        Files.createDirectories(workspace);

        ProviderRegistry providers = providerRegistry(config);
        GenerationConfig generation = config.generation();
        LlmProvider provider = providers.require(generation.provider());

        KnowledgeStore knowledgeStore = new FileKnowledgeStore(ConfigPaths.resolveInWorkspace(workspace, storage.knowledgePath()));
        Translator translator = translator(config.translation(), config.timeouts(), provider, generation.model());

        SessionHistory sessions;
        EscalationSink escalations;
        if (storage.inMemory()) {
            sessions = new InMemorySessionStore();
            escalations = new InMemoryEscalationStore();
        } else {
            Path database = ConfigPaths.resolveInWorkspace(workspace, storage.databasePath());
            sessions = new SqliteSessionStore(database);
            escalations = new SqliteEscalationStore(database, Clock.systemUTC());
        }
        ObservabilityService observability = new ObservabilityService(
            new FileAuditStore(ConfigPaths.resolveInWorkspace(workspace, storage.auditPath())),
            Clock.systemUTC(),
            escalations,
            knowledgeStore
        );

        StageExecutor stages = new StageExecutor();
        ChatOrchestrator orchestrator = ChatOrchestrator.builder()
            .detector(new ScriptLanguageDetector(assistant.detectionConfidenceFloor(), assistant.detectionMinLetters()))
            .translator(translator)
            .retriever(new KnowledgeRetriever(knowledgeStore, assistant.minScore()))
            .sessions(sessions)
            .generation(new RetryingGenerationClient(
                provider,
                generation.model(),
                new CompletionOptions(generation.temperature(), generation.maxTokens()),
                new RetryPolicy(
                    generation.maxAttempts(),
                    Duration.ofMillis(generation.initialBackoffMs()),
                    Duration.ofMillis(generation.maxBackoffMs())
                ),
                assistant.fallbackResponse()
            ))
            .escalationPolicy(new EscalationPolicy(assistant.confidenceThreshold(), assistant.escalationPatterns()))
            .escalations(escalations)
            .observability(observability)
            .stages(stages)
            .settings(PipelineSettings.from(config))
            .build();

        LOG.info("Assistant ready: provider={}, model={}, translation={}, storage={}",
            provider.name(), generation.model(), translator.name(), storage.inMemory() ? "memory" : "sqlite");
        return new AssistantRuntime(config, workspace, orchestrator, knowledgeStore, translator, escalations, observability, stages);
    }

    static ProviderRegistry providerRegistry(AssistantConfig config) {
        ProviderRegistry registry = new ProviderRegistry();
        ProviderConfig openai = config.providers().openai();
        ProviderConfig gemini = config.providers().gemini();
        // each attempt must end before the generation stage deadline so it can still be retried
        Duration attempt = config.timeouts().generationAttempt();
        registry.register(new OpenAiCompatProvider(
            "openai", openai.apiKey(), baseOrDefault(openai, OPENAI_BASE), openai.extraHeaders(), attempt));
        registry.register(new GeminiProvider("gemini", gemini.apiKey(), baseOrDefault(gemini, GEMINI_BASE), attempt));
        registry.register(new EchoProvider("echo"));
        return registry;
    }

    static Translator translator(TranslationConfig translation, TimeoutsConfig timeouts, LlmProvider provider, String model) {
        Duration attempt = timeouts.translationAttempt();
        String mode = translation.mode() == null ? "chain" : translation.mode().trim().toLowerCase(Locale.ROOT);
        switch (mode) {
            case "none":
                return new NoopTranslator();
            case "google":
                return new GoogleTranslateTranslator(translation.googleApiKey(), translation.googleApiBase(), attempt);
            case "llm":
                return new LlmTranslator(provider, model);
            case "chain":
                List<Translator> chain = new ArrayList<>();
                if (translation.googleConfigured()) {
                    chain.add(new GoogleTranslateTranslator(translation.googleApiKey(), translation.googleApiBase(), attempt));
                }
                chain.add(new LlmTranslator(provider, model));
                return new FallbackTranslator(chain, attempt);
            default:
                throw new IllegalArgumentException("Unknown translation mode: " + translation.mode());
        }
    }

    private static String baseOrDefault(ProviderConfig provider, String fallback) {
        return provider.apiBase() == null || provider.apiBase().isBlank() ? fallback : provider.apiBase();
    }

    public AssistantConfig config() {
        return config;
    }

    public Path workspace() {
        return workspace;
    }

    public ChatOrchestrator orchestrator() {
        return orchestrator;
    }

    public KnowledgeStore knowledgeStore() {
        return knowledgeStore;
    }

    public KnowledgeIngestor ingestor() {
        return ingestor;
    }

    public Translator translator() {
        return translator;
    }

    public EscalationSink escalations() {
        return escalations;
    }

    public ObservabilityService observability() {
        return observability;
    }

    @Override
    public void close() {
        stages.close();
    }
}
