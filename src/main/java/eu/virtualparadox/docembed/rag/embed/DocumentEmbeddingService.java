package eu.virtualparadox.docembed.rag.embed;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

@Service
@Slf4j
@RequiredArgsConstructor
public final class DocumentEmbeddingService implements EmbeddingService {

    private final ChunkedEmbeddingModel model;

    @Override
    public float[] embed(final String text) {
        return model.predict(text);
    }

    @Override
    public List<float[]> embedAll(final List<String> texts) {
        final List<float[]> result = new ArrayList<>(texts.size());
        for (final String text : texts) {
            result.add(model.predict(text));
        }
        log.debug("Embedded {} texts", texts.size());
        return result;
    }

    @Override
    public int dimension() {
        return model.getHiddenSize();
    }
}
