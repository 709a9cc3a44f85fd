package io.campus.cli;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.campus.core.config.model.AssistantConfig;
import io.campus.core.model.ChatRequest;
import io.campus.core.model.ChatResponse;
import io.campus.core.model.InvalidChatRequestException;
import io.campus.core.model.SourceView;
import io.campus.core.runtime.AssistantRuntime;
import java.util.Locale;
import java.util.concurrent.Callable;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

@Command(name = "ask", description = "Ask the assistant a question")
public final class AskCommand implements Callable<Integer> {
    private final CliContext context;

    @Parameters(index = "0", arity = "1", description = "Question to ask")
    String message;

    @Option(names = {"-s", "--session"}, description = "Session id to continue")
    String sessionId;

    @Option(names = {"-l", "--language"}, description = "Preferred response language code")
    String language;

    @Option(names = "--json", description = "Print the full response as JSON")
    boolean json;

    public AskCommand(CliContext context) {
        this.context = context;
    }

    @Override
    public Integer call() {
        ChatRequest request;
        try {
            request = new ChatRequest(message, sessionId, language);
        } catch (InvalidChatRequestException e) {
            System.err.println("Invalid " + e.field() + ": " + e.getMessage());
            return 2;
        }

        try {
            AssistantConfig config = context.configService().load(context.configPath());
            try (AssistantRuntime runtime = context.runtimeFactory().open(config)) {
                ChatResponse response = runtime.orchestrator().handle(request);
                if (json) {
                    System.out.println(new ObjectMapper().writerWithDefaultPrettyPrinter().writeValueAsString(response));
                } else {
                    print(response);
                }
                return response.failed() ? 1 : 0;
            }
        } catch (Exception e) {
            System.err.println("Ask command failed: " + e.getMessage());
            return 1;
        }
    }

    private void print(ChatResponse response) {
        System.out.println(response.responseText());
        System.out.println();
        System.out.println(String.format(Locale.ROOT, "session: %s  language: %s -> %s  confidence: %.2f",
            response.sessionId(), response.detectedLanguage(), response.responseLanguage(), response.confidence()));
        if (response.intent() != null) {
            System.out.println("intent: " + response.intent());
        }
        if (response.needsEscalation()) {
            System.out.println("escalated: " + response.escalationReason());
        }
        for (SourceView source : response.sources()) {
            System.out.println(String.format(Locale.ROOT, "source: %s (%.2f)", source.title(), source.score()));
        }
        for (String suggestion : response.suggestedQuestions()) {
            System.out.println("suggested: " + suggestion);
        }
    }
}
