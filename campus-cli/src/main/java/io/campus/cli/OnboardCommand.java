package io.campus.cli;

import io.campus.core.config.ConfigPaths;
import io.campus.core.config.OnboardResult;
import io.campus.core.config.model.AssistantConfig;
import io.campus.core.config.model.ProviderConfig;
import io.campus.core.config.model.StorageConfig;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.concurrent.Callable;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

@Command(name = "onboard", description = "Write default config and prepare the knowledge, session and audit stores")
public final class OnboardCommand implements Callable<Integer> {
    private final CliContext context;

    @Option(names = "--overwrite", description = "Replace an existing config with the defaults")
    boolean overwrite;

    public OnboardCommand(CliContext context) {
        this.context = context;
    }

    @Override
    public Integer call() {
        try {
            OnboardResult result = context.configService().onboard(context.configPath(), overwrite);
            if (result.createdConfig()) {
                System.out.println("Created config: " + result.configPath());
            } else if (result.overwrittenConfig()) {
                System.out.println("Reset config to defaults: " + result.configPath());
            } else {
                System.out.println("Kept existing config: " + result.configPath());
            }

            AssistantConfig config = context.configService().load(result.configPath());
            Path workspace = result.workspacePath();
            StorageConfig storage = config.storage();
            Path knowledge = prepare(workspace, storage.knowledgePath());
            Path audit = prepare(workspace, storage.auditPath());

            System.out.println("Workspace: " + workspace);
            System.out.println("Knowledge store: " + knowledge);
            if (storage.inMemory()) {
                System.out.println("Sessions and escalations: in memory (lost on restart)");
            } else {
                System.out.println("Sessions and escalations: " + prepare(workspace, storage.databasePath()));
            }
            System.out.println("Audit log: " + audit);

            String provider = config.generation().provider();
            if (!providerReady(config, provider)) {
                System.out.println("Set providers." + provider + ".apiKey before answering questions");
            }
            if ("chain".equalsIgnoreCase(config.translation().mode()) && !config.translation().googleConfigured()) {
                System.out.println("No Google Translate key; the chain will translate with " + provider + " only");
            }
            if (!Files.exists(knowledge)) {
                System.out.println("Next: campus ingest --faq <faqs.json>");
            }
            return 0;
        } catch (Exception e) {
            System.err.println("Onboard failed: " + e.getMessage());
            return 1;
        }
    }

    private static Path prepare(Path workspace, String rawPath) throws IOException {
        Path resolved = ConfigPaths.resolveInWorkspace(workspace, rawPath);
        Path parent = resolved.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        return resolved;
    }

    private static boolean providerReady(AssistantConfig config, String provider) {
        ProviderConfig settings = switch (provider == null ? "" : provider) {
            case "openai" -> config.providers().openai();
            case "gemini" -> config.providers().gemini();
            default -> null;
        };
        return settings == null || settings.configured();
    }
}
