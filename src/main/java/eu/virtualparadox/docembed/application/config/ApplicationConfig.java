package eu.virtualparadox.docembed.application.config;

import eu.virtualparadox.docembed.model.repository.HuggingFaceHubRepository;
import eu.virtualparadox.docembed.rag.embed.EmbeddingModelFactory;
import eu.virtualparadox.docembed.rag.pooling.AggregationPolicy;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import jakarta.annotation.PostConstruct;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

@Configuration
@ConfigurationProperties(prefix = "docembed")
@Getter @Setter
public class ApplicationConfig {

    private String modelId;
    private String revision = EmbeddingModelFactory.DEFAULT_REVISION;
    private boolean useLegacyWeights = false;

    /** Hub download cache. */
    private Path cache;

    /** When set, models are read from this folder instead of the hub. */
    private Path models;

    private String hubEndpoint = HuggingFaceHubRepository.DEFAULT_ENDPOINT;
    private String hubToken;

    private double firstChunkWeight = AggregationPolicy.DEFAULT_FIRST_CHUNK_WEIGHT;
    private double otherChunkWeight = AggregationPolicy.DEFAULT_OTHER_CHUNK_WEIGHT;
    private boolean renormalizeAggregate = false;

    @PostConstruct
    public void ensureFolders() throws IOException {
        if (cache != null) Files.createDirectories(cache);
        if (models != null) Files.createDirectories(models);
    }
}
