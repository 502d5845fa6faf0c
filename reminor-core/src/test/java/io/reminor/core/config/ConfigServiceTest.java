package io.reminor.core.config;

import static org.assertj.core.api.Assertions.assertThat;

import io.reminor.core.config.model.ReminorConfig;
import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class ConfigServiceTest {

    @TempDir
    Path tempDir;

    @Test
    void shouldLoadDefaultsWhenConfigMissing() throws Exception {
        ConfigService service = new ConfigService();

        ReminorConfig config = service.load(tempDir.resolve("config.json"));

        assertThat(config.journal().language()).isEqualTo("it");
        assertThat(config.retrieval().similarityFloor()).isEqualTo(0.2);
        assertThat(config.retrieval().semanticScale()).isEqualTo(20.0);
        assertThat(config.retrieval().monthBonus()).isEqualTo(15.0);
        assertThat(config.analysis().schemaVersion()).isEqualTo("2.0");
        assertThat(config.analysis().configured()).isFalse();
    }

    @Test
    void shouldMergePartialConfigWithDefaults() throws Exception {
        ConfigService service = new ConfigService();
        Path configPath = tempDir.resolve("config.json");
        Files.writeString(configPath, """
            {
              "journal": { "language": "en" },
              "retrieval": { "monthBonus": 20.0 },
              "analysis": { "apiKey": "gsk-test" }
            }
            """);

        ReminorConfig config = service.load(configPath);

        assertThat(config.journal().language()).isEqualTo("en");
        assertThat(config.journal().annotationBackend()).isEqualTo("file");
        assertThat(config.retrieval().monthBonus()).isEqualTo(20.0);
        assertThat(config.retrieval().snippetWindow()).isEqualTo(400);
        assertThat(config.retrieval().domainVocabulary()).contains("pizza", "sardegna");
        assertThat(config.analysis().configured()).isTrue();
        assertThat(config.analysis().model()).isEqualTo("llama-3.3-70b-versatile");
    }

    @Test
    void initShouldCreateConfigAndJournalDirectory() throws Exception {
        ConfigService service = new ConfigService();
        Path configPath = tempDir.resolve(".reminor/config.json");
        Path journal = tempDir.resolve("journal");
        Files.createDirectories(configPath.getParent());
        Files.writeString(configPath, """
            { "journal": { "dataDir": "%s" } }
            """.formatted(journal.toString().replace("\\", "\\\\")));

        boolean created = service.init(configPath);

        assertThat(created).isFalse();
        assertThat(Files.isDirectory(journal)).isTrue();
        assertThat(Files.readString(configPath)).contains("schemaVersion");
    }
}
