package io.campus.app;

import io.campus.cli.AskCommand;
import io.campus.cli.CampusCliCommand;
import io.campus.cli.CliContext;
import io.campus.cli.GatewayCommand;
import io.campus.cli.IngestCommand;
import io.campus.cli.OnboardCommand;
import io.campus.cli.StatusCommand;
import io.campus.core.api.ChatGateway;
import io.campus.core.config.ConfigPaths;
import io.campus.core.config.ConfigService;
import io.campus.core.config.model.AssistantConfig;
import io.campus.core.config.model.GatewayConfig;
import io.campus.core.runtime.AssistantRuntime;
import java.nio.file.Path;
import java.util.concurrent.CountDownLatch;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;

public final class CampusAssistantApplication {
    private static final Logger LOG = LoggerFactory.getLogger(CampusAssistantApplication.class);

    private CampusAssistantApplication() {
    }

    public static void main(String[] args) {
        ConfigService configService = new ConfigService();
        Path configPath = ConfigPaths.defaultConfigPath();

        CliContext context = new CliContext(
            configService,
            configPath,
            AssistantRuntime::open,
            portOverride -> runGateway(configService, configPath, portOverride)
        );

        CommandLine commandLine = new CommandLine(new CampusCliCommand());
        commandLine.addSubcommand("onboard", new OnboardCommand(context));
        commandLine.addSubcommand("status", new StatusCommand(context));
        commandLine.addSubcommand("ask", new AskCommand(context));
        commandLine.addSubcommand("ingest", new IngestCommand(context));
        commandLine.addSubcommand("gateway", new GatewayCommand(context));

        int exitCode = commandLine.execute(args);
        System.exit(exitCode);
    }

    private static int runGateway(ConfigService configService, Path configPath, Integer portOverride) throws Exception {
        AssistantConfig config = configService.load(configPath);
        GatewayConfig gateway = config.gateway();
        if (portOverride != null) {
            gateway = new GatewayConfig(gateway.host(), portOverride, gateway.corsOrigins());
        }

        CountDownLatch shutdown = new CountDownLatch(1);
        try (AssistantRuntime runtime = AssistantRuntime.open(config);
             ChatGateway server = new ChatGateway(
                 gateway,
                 runtime.orchestrator(),
                 config.assistant(),
                 runtime.translator(),
                 runtime.observability()
             )) {
            Runtime.getRuntime().addShutdownHook(new Thread(shutdown::countDown));
            server.start();
            System.out.println("Gateway started on http://127.0.0.1:" + server.port());
            System.out.println("Endpoints: POST /api/v1/chat, GET /api/v1/chat/welcome, GET /api/v1/chat/languages, "
                + "GET /dashboard/summary, GET /healthz");
            shutdown.await();
            LOG.info("Gateway shutting down");
        }
        return 0;
    }
}
