package eu.virtualparadox.docembed.application.runner;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import eu.virtualparadox.docembed.rag.embed.EmbeddingService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.stereotype.Component;

import java.io.PrintStream;
import java.util.List;

/**
 * Embeds every non-option command line argument and prints one JSON array per line.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class EmbedCommandLineRunner implements ApplicationRunner {

    private final EmbeddingService embeddingService;
    private final ObjectMapper objectMapper;

    @Override
    public void run(final ApplicationArguments args) throws JsonProcessingException {
        final List<String> texts = args.getNonOptionArgs();
        if (texts.isEmpty()) {
            log.info("No text given; model ready with dimension {}", embeddingService.dimension());
            return;
        }
        print(embeddingService.embedAll(texts), System.out);
    }

    void print(final List<float[]> vectors, final PrintStream out) throws JsonProcessingException {
        for (final float[] vector : vectors) {
            out.println(objectMapper.writeValueAsString(vector));
        }
    }
}
