package eu.virtualparadox.ragqa.application.config;

import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.apache.lucene.index.IndexWriter;
import org.apache.lucene.index.IndexWriterConfig;
import org.apache.lucene.search.SearcherManager;
import org.apache.lucene.store.Directory;
import org.apache.lucene.store.FSDirectory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Opens the on-disk Lucene index (Directory, IndexWriter, SearcherManager) when
 * {@code ragqa.index.type=lucene} and closes it on shutdown.
 */
@Configuration
@ConditionalOnProperty(name = "ragqa.index.type", havingValue = "lucene")
@Slf4j
public class LuceneConfig {

    private Directory directory;
    private IndexWriter indexWriter;
    private SearcherManager searcherManager;

    /**
     * @param props application properties
     * @return opened {@link Directory} under {@code ragqa.index.path}
     * @throws IOException if the path cannot be created or opened
     */
    @Bean
    public Directory luceneDirectory(final ApplicationConfig props) throws IOException {
        final Path indexPath = props.getIndex().getPath();
        if (indexPath == null) {
            throw new IllegalStateException("ragqa.index.path is required for the lucene index");
        }
        Files.createDirectories(indexPath);
        log.info("Opening Lucene index at {}", indexPath.toAbsolutePath());
        this.directory = FSDirectory.open(indexPath);
        return this.directory;
    }

    /**
     * Only stored and keyword fields are written, so the default analyzer is enough.
     *
     * @param dir Lucene directory
     * @return {@link IndexWriter} in create-or-append mode
     * @throws IOException on writer creation error
     */
    @Bean
    public IndexWriter indexWriter(final Directory dir) throws IOException {
        final IndexWriterConfig cfg = new IndexWriterConfig()
                .setOpenMode(IndexWriterConfig.OpenMode.CREATE_OR_APPEND);
        this.indexWriter = new IndexWriter(dir, cfg);
        return this.indexWriter;
    }

    @Bean
    public SearcherManager searcherManager(final IndexWriter writer) throws IOException {
        this.searcherManager = new SearcherManager(writer, null);
        return this.searcherManager;
    }

    @PreDestroy
    public void close() {
        try { if (searcherManager != null) searcherManager.close(); } catch (Exception e) {
            log.error("Unable to close SearcherManager", e);
        }

        try { if (indexWriter != null) indexWriter.close(); } catch (Exception e) {
            log.error("Unable to close IndexWriter", e);
        }

        try { if (directory != null) directory.close(); } catch (Exception e) {
            log.error("Unable to close Directory", e);
        }
    }
}
