package eu.virtualparadox.ragqa.application.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import jakarta.annotation.PostConstruct;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

@Configuration
@ConfigurationProperties(prefix = "ragqa")
@Getter @Setter
public class ApplicationConfig {

    private Retrieval retrieval = new Retrieval();
    private Index index = new Index();
    private Embedding embedding = new Embedding();
    private Limits limits = new Limits();

    @PostConstruct
    public void ensureFolders() throws IOException {
        if (index.getPath() != null && index.getType() == IndexType.LUCENE) {
            Files.createDirectories(index.getPath());
        }
        if (embedding.getModels() != null) {
            Files.createDirectories(embedding.getModels());
        }
    }

    public enum IndexType {
        MEMORY,
        LUCENE
    }

    @Getter @Setter
    public static class Retrieval {
        /** Passages handed to the answer synthesizer per question. */
        private int topK = 3;
    }

    @Getter @Setter
    public static class Index {
        private IndexType type = IndexType.MEMORY;
        /** On-disk location of the Lucene index. */
        private Path path;
        /** Passages returned per {@code scanAll} page. */
        private int pageSize = 1000;
    }

    @Getter @Setter
    public static class Embedding {
        private Path models;
        /** Worker threads embedding one ingestion's passages. */
        private int threads = 4;
        /** Passages per embedding call. */
        private int batchSize = 16;
        /** ONNX Runtime intra-op threads per session. */
        private int onnxThreads = Math.max(1, Runtime.getRuntime().availableProcessors() - 1);
    }

    @Getter @Setter
    public static class Limits {
        private int maxQuestionChars = 4_000;
        private int maxTextChars = 5_000_000;
    }
}
