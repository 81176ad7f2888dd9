package eu.virtualparadox.docembed.model.repository;

import eu.virtualparadox.docembed.error.ModelLoadException;
import lombok.extern.slf4j.Slf4j;

import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Offline {@link ModelRepository} reading {@code <root>/<modelId>/<fileName>}.
 * <p>The revision is not part of the layout; whatever is on disk is used.</p>
 */
@Slf4j
public final class LocalModelRepository implements ModelRepository {

    private final Path root;

    public LocalModelRepository(final Path root) {
        this.root = root;
    }

    @Override
    public Path fetch(final String modelId, final String revision, final String fileName) {
        final Path file = root.resolve(modelId).resolve(fileName).normalize();
        if (!file.startsWith(root.normalize())) {
            throw new ModelLoadException("Model file escapes repository root: " + modelId + "/" + fileName);
        }
        if (!Files.isRegularFile(file)) {
            throw new ModelLoadException("Model file not found: " + file);
        }
        log.debug("Using local model file {} (revision '{}' ignored)", file, revision);
        return file;
    }
}
