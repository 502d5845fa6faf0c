package io.reminor.core.engine;

import io.reminor.core.analysis.EmotionAnalysisService;
import io.reminor.core.analysis.EmotionAnalyzer;
import io.reminor.core.analysis.FileAnalysisCache;
import io.reminor.core.analysis.KeywordEmotionAnalyzer;
import io.reminor.core.analysis.LlmEmotionAnalyzer;
import io.reminor.core.annotation.AnnotationStore;
import io.reminor.core.annotation.FileAnnotationStore;
import io.reminor.core.annotation.SqliteAnnotationStore;
import io.reminor.core.config.ConfigPaths;
import io.reminor.core.config.model.EmbeddingConfig;
import io.reminor.core.config.model.ReminorConfig;
import io.reminor.core.embedding.EmbeddingProvider;
import io.reminor.core.embedding.HashingEmbeddingProvider;
import io.reminor.core.embedding.OpenAiEmbeddingProvider;
import io.reminor.core.journal.FileEntryStore;
import io.reminor.core.search.entity.EntityIndexBuilder;
import io.reminor.core.search.entity.HeuristicEntityExtractor;
import io.reminor.core.search.lexical.Bm25LexicalIndex;
import io.reminor.core.search.lexical.LexicalSearchProvider;
import io.reminor.core.search.vector.FileVectorStore;
import io.reminor.core.search.vector.VectorIndex;
import io.reminor.core.temporal.TemporalQueryResolver;
import io.reminor.core.text.Language;
import java.io.IOException;
import java.nio.file.Path;
import java.time.Clock;
import java.util.Locale;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Builds a {@link ReminorRuntime}. Layout under the data directory:
 * {@code <date>.txt} entries, {@code .index/} vectors and the SQLite annotation database,
 * {@code .annotations/} file annotations, {@code .cache/analysis/} cached analyses.
 */
public final class ReminorRuntimeFactory {
    private static final Logger LOG = LoggerFactory.getLogger(ReminorRuntimeFactory.class);

    private ReminorRuntimeFactory() {
    }

    public static ReminorRuntime open(ReminorConfig config) throws IOException {
        return open(config, Clock.systemDefaultZone());
    }

    public static ReminorRuntime open(ReminorConfig config, Clock clock) throws IOException {
        Path dataDir = ConfigPaths.resolveDataDir(config.journal().dataDir());
        FileEntryStore entries = new FileEntryStore(dataDir);
        Language language = Language.fromCode(config.journal().language());

        VectorIndex vectors = new VectorIndex(
            embeddingProvider(config.embedding()),
            new FileVectorStore(dataDir.resolve(".index").resolve("vectors.json")),
            config.retrieval().similarityFloor()
        );
        Optional<LexicalSearchProvider> lexical = Optional.of(new Bm25LexicalIndex());
        EntityIndexBuilder entityBuilder = new EntityIndexBuilder(
            new HeuristicEntityExtractor(Optional.empty(), config.retrieval().domainVocabulary())
        );
        AnnotationStore annotations = annotationStore(config.journal().annotationBackend(), dataDir, clock);

        JournalEngine engine = new JournalEngine(
            entries,
            vectors,
            lexical,
            entityBuilder,
            annotations,
            new TemporalQueryResolver(clock, clock.getZone()),
            language,
            config.retrieval()
        );
        engine.start();

        FileAnalysisCache cache = new FileAnalysisCache(
            dataDir.resolve(".cache").resolve("analysis"),
            config.analysis().schemaVersion(),
            clock
        );
        KeywordEmotionAnalyzer keywords = new KeywordEmotionAnalyzer();
        EmotionAnalyzer analyzer = config.analysis().configured() ? new LlmEmotionAnalyzer(config.analysis()) : keywords;
        EmotionAnalysisService analysis = new EmotionAnalysisService(entries, annotations, cache, analyzer, keywords, config.analysis());

        JournalImporter importer = new JournalImporter(entries, engine, clock, clock.getZone());
        return new ReminorRuntime(config, dataDir, entries, engine, analysis, cache, importer, clock);
    }

    static Optional<EmbeddingProvider> embeddingProvider(EmbeddingConfig config) {
        String provider = config.provider() == null ? "" : config.provider().trim().toLowerCase(Locale.ROOT);
        return switch (provider) {
            case "hashing" -> Optional.of(new HashingEmbeddingProvider(config.dimension()));
            case "openai" -> {
                if (!config.configured()) {
                    LOG.warn("Embedding provider 'openai' has no API key; semantic search disabled");
                    yield Optional.empty();
                }
                yield Optional.of(new OpenAiEmbeddingProvider(config.apiKey(), config.apiBase(), config.model()));
            }
            case "none", "" -> Optional.empty();
            default -> {
                LOG.warn("Unknown embedding provider '{}'; semantic search disabled", config.provider());
                yield Optional.empty();
            }
        };
    }

    static AnnotationStore annotationStore(String backend, Path dataDir, Clock clock) throws IOException {
        if ("sqlite".equalsIgnoreCase(backend)) {
            return new SqliteAnnotationStore(dataDir.resolve(".index").resolve("annotations.db"), clock);
        }
        return new FileAnnotationStore(dataDir.resolve(".annotations"), clock);
    }
}
