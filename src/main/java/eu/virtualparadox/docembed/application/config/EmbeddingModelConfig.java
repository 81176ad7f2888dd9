package eu.virtualparadox.docembed.application.config;

import eu.virtualparadox.docembed.model.repository.HuggingFaceHubRepository;
import eu.virtualparadox.docembed.model.repository.LocalModelRepository;
import eu.virtualparadox.docembed.model.repository.ModelRepository;
import eu.virtualparadox.docembed.rag.embed.ChunkedEmbeddingModel;
import eu.virtualparadox.docembed.rag.embed.EmbeddingModelFactory;
import eu.virtualparadox.docembed.rag.pooling.AggregationPolicy;
import lombok.extern.slf4j.Slf4j;
import okhttp3.OkHttpClient;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

/**
 * Wires the model repository, the aggregation policy and the single shared embedding model.
 * <p>The model is loaded once at startup and closed on shutdown.</p>
 */
@Configuration
@Slf4j
public class EmbeddingModelConfig {

    @Bean
    public OkHttpClient hubHttpClient() {
        return new OkHttpClient.Builder()
                .connectTimeout(Duration.ofSeconds(30))
                .readTimeout(Duration.ofMinutes(5))
                .build();
    }

    /**
     * Local folder when {@code docembed.models} is set, the hub (with on-disk cache) otherwise.
     */
    @Bean
    public ModelRepository modelRepository(final ApplicationConfig props, final OkHttpClient hubHttpClient) {
        if (props.getModels() != null) {
            log.info("Reading models from local folder {}", props.getModels());
            return new LocalModelRepository(props.getModels());
        }
        if (props.getCache() == null) {
            throw new IllegalStateException("Either docembed.models or docembed.cache must be configured");
        }
        log.info("Reading models from {} (cache: {})", props.getHubEndpoint(), props.getCache());
        return new HuggingFaceHubRepository(hubHttpClient, props.getHubEndpoint(), props.getCache(), props.getHubToken());
    }

    @Bean
    public AggregationPolicy aggregationPolicy(final ApplicationConfig props) {
        return new AggregationPolicy(props.getFirstChunkWeight(), props.getOtherChunkWeight(), props.isRenormalizeAggregate());
    }

    @Bean
    public EmbeddingModelFactory embeddingModelFactory(final ModelRepository modelRepository,
                                                       final AggregationPolicy aggregationPolicy) {
        return new EmbeddingModelFactory(modelRepository, aggregationPolicy);
    }

    @Bean(destroyMethod = "close")
    public ChunkedEmbeddingModel embeddingModel(final EmbeddingModelFactory factory, final ApplicationConfig props) {
        return factory.create(props.getModelId(), props.getRevision(), props.isUseLegacyWeights());
    }
}
