package io.campus.cli;

import io.campus.core.config.ConfigPaths;
import io.campus.core.config.model.AssistantConfig;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.concurrent.Callable;
import picocli.CommandLine.Command;

@Command(name = "status", description = "Show configuration and storage status")
public final class StatusCommand implements Callable<Integer> {
    private final CliContext context;

    public StatusCommand(CliContext context) {
        this.context = context;
    }

    @Override
    public Integer call() {
        try {
            AssistantConfig config = context.configService().load(context.configPath());
            Path workspace = ConfigPaths.resolveWorkspace(config.assistant().workspace());
            Path knowledge = ConfigPaths.resolveInWorkspace(workspace, config.storage().knowledgePath());
            System.out.println("Config path: " + context.configPath());
            System.out.println("Config exists: " + Files.exists(context.configPath()));
            System.out.println("Workspace: " + workspace);
            System.out.println("Languages: " + String.join(", ", config.assistant().supportedLanguages())
                + " (pivot " + config.assistant().pivotLanguage() + ")");
            System.out.println("Generation: " + config.generation().provider() + " / " + config.generation().model());
            System.out.println("OpenAI configured: " + config.providers().openai().configured());
            System.out.println("Gemini configured: " + config.providers().gemini().configured());
            System.out.println("Translation mode: " + config.translation().mode()
                + " (google configured: " + config.translation().googleConfigured() + ")");
            System.out.println("Storage: " + config.storage().backend());
            System.out.println("Knowledge file: " + knowledge + (Files.exists(knowledge) ? "" : " (missing)"));
            return 0;
        } catch (Exception e) {
            System.err.println("Status command failed: " + e.getMessage());
            return 1;
        }
    }
}
