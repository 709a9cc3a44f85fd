package io.campus.cli;

import static org.assertj.core.api.Assertions.assertThat;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.campus.core.config.ConfigService;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import picocli.CommandLine;

class AskCommandIntegrationTest {

    private MockWebServer server;

    @TempDir
    Path tempDir;

    @BeforeEach
    void setUp() throws IOException {
        server = new MockWebServer();
        server.start();
    }

    @AfterEach
    void tearDown() throws IOException {
        server.shutdown();
    }

    @Test
    void shouldAskThroughHttpProvider() throws Exception {
        server.enqueue(new MockResponse()
            .setHeader("Content-Type", "application/json")
            .setBody("""
                {
                  "choices": [
                    { "message": { "content": "Please contact the accounts office. [intent: fees]" } }
                  ]
                }
                """));
        CliContext context = new CliContext(new ConfigService(), writeConfig());

        CommandOutput output = run(new AskCommand(context), "When are fees due?", "--session", "cli-1");

        assertThat(output.code()).isEqualTo(0);
        assertThat(output.stdout())
            .contains("Please contact the accounts office.")
            .contains("session: cli-1")
            .contains("intent: fees")
            .contains("escalated: low_confidence")
            .contains("suggested: What are the library hours?")
            .doesNotContain("[intent:");
        assertThat(server.getRequestCount()).isEqualTo(1);
        assertThat(server.takeRequest().getHeader("Authorization")).isEqualTo("Bearer sk-test");
    }

    @Test
    void shouldPrintJsonResponse() throws Exception {
        server.enqueue(new MockResponse().setBody("{\"choices\": [{\"message\": {\"content\": \"Hello\"}}]}"));
        CliContext context = new CliContext(new ConfigService(), writeConfig());

        CommandOutput output = run(new AskCommand(context), "hello there", "--json");

        assertThat(output.code()).isEqualTo(0);
        JsonNode json = new ObjectMapper().readTree(output.stdout());
        assertThat(json.path("response").asText()).isEqualTo("Hello");
        assertThat(json.path("session_id").asText()).isNotBlank();
    }

    @Test
    void shouldFallBackWhenProviderKeepsFailing() throws Exception {
        for (int i = 0; i < 3; i++) {
            server.enqueue(new MockResponse().setResponseCode(503).setBody("overloaded"));
        }
        CliContext context = new CliContext(new ConfigService(), writeConfig());

        CommandOutput output = run(new AskCommand(context), "When are fees due?");

        assertThat(output.code()).isEqualTo(0);
        assertThat(output.stdout())
            .contains("I'm sorry, I couldn't find a reliable answer right now.")
            .contains("escalated: generation_failure");
        assertThat(server.getRequestCount()).isEqualTo(3);
    }

    @Test
    void shouldRejectInvalidSessionId() throws Exception {
        CliContext context = new CliContext(new ConfigService(), writeConfig());

        CommandOutput output = run(new AskCommand(context), "hello", "--session", "not valid!");

        assertThat(output.code()).isEqualTo(2);
        assertThat(server.getRequestCount()).isZero();
    }

    private Path writeConfig() throws IOException {
        Path configPath = tempDir.resolve("config.json");
        Files.writeString(configPath, """
            {
              "assistant": {"workspace": "%s"},
              "generation": {
                "provider": "openai",
                "model": "gpt-test",
                "initial_backoff_ms": 1,
                "max_backoff_ms": 5
              },
              "providers": {
                "openai": {"api_key": "sk-test", "api_base": "%s"}
              },
              "translation": {"mode": "none"},
              "storage": {"backend": "memory"}
            }
            """.formatted(tempDir.resolve("workspace").toString().replace("\\", "\\\\"), server.url("/v1").toString()),
            StandardCharsets.UTF_8);
        return configPath;
    }

    static CommandOutput run(Object command, String... args) {
        PrintStream originalOut = System.out;
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        int code;
        try {
            System.setOut(new PrintStream(out, true, StandardCharsets.UTF_8));
            code = new CommandLine(command).execute(args);
        } finally {
            System.setOut(originalOut);
        }
        return new CommandOutput(code, out.toString(StandardCharsets.UTF_8));
    }

    record CommandOutput(int code, String stdout) {
    }
}
