package eu.virtualparadox.docembed.model.repository;

import eu.virtualparadox.docembed.error.ModelLoadException;

import java.nio.file.Path;

/**
 * Source of model files (configuration, tokenizer, weights) addressed by model id and revision.
 */
public interface ModelRepository {

    /**
     * Makes a file of the given model available on the local file system.
     *
     * @param modelId  repository id, e.g. {@code sentence-transformers/all-MiniLM-L6-v2}
     * @param revision branch, tag or commit
     * @param fileName path of the file inside the repository
     * @return readable local path
     * @throws ModelLoadException if the file cannot be obtained
     */
    Path fetch(String modelId, String revision, String fileName);
}
