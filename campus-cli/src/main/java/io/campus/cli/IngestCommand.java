package io.campus.cli;

import io.campus.core.config.model.AssistantConfig;
import io.campus.core.runtime.AssistantRuntime;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

@Command(name = "ingest", description = "Index FAQ files and extracted document text into the knowledge store")
public final class IngestCommand implements Callable<Integer> {
    private final CliContext context;

    @Option(names = "--faq", description = "JSON file with [{question, answer, category}] entries")
    List<Path> faqFiles = new ArrayList<>();

    @Option(names = "--document", description = "Plain text file; its name becomes the document id")
    List<Path> documents = new ArrayList<>();

    @Option(names = "--remove", description = "Document id to remove, e.g. doc:handbook or faq:1")
    List<String> removals = new ArrayList<>();

    public IngestCommand(CliContext context) {
        this.context = context;
    }

    @Override
    public Integer call() {
        if (faqFiles.isEmpty() && documents.isEmpty() && removals.isEmpty()) {
            System.err.println("Nothing to ingest: pass --faq, --document or --remove");
            return 2;
        }
        try {
            AssistantConfig config = context.configService().load(context.configPath());
            try (AssistantRuntime runtime = context.runtimeFactory().open(config)) {
                for (Path faq : faqFiles) {
                    int count = runtime.ingestor().ingestFaqFile(faq);
                    System.out.println("Indexed " + count + " FAQ entries from " + faq);
                }
                for (Path document : documents) {
                    int count = runtime.ingestor().ingestDocumentFile(document);
                    System.out.println("Indexed " + count + " chunks from " + document);
                }
                for (String documentId : removals) {
                    boolean removed = runtime.knowledgeStore().remove(documentId);
                    System.out.println((removed ? "Removed " : "Not found: ") + documentId);
                }
                System.out.println("Knowledge store holds " + runtime.knowledgeStore().count() + " chunks");
                return 0;
            }
        } catch (Exception e) {
            System.err.println("Ingest failed: " + e.getMessage());
            return 1;
        }
    }
}
