package eu.virtualparadox.docembed.model.repository;

import eu.virtualparadox.docembed.error.ModelLoadException;
import lombok.extern.slf4j.Slf4j;
import okhttp3.HttpUrl;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.Response;
import okhttp3.ResponseBody;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;

/**
 * {@link ModelRepository} downloading files from a Hugging Face compatible hub into a local cache.
 *
 * <h2>Cache layout</h2>
 * <pre>
 *     {cacheDir}/{modelId with '/' replaced by '--'}/{revision}/{fileName}
 * </pre>
 * A file already present in the cache is returned without any network access. Downloads are
 * written to a temporary file next to the target and moved into place once complete, so an
 * interrupted download never leaves a truncated file behind. There is no retry.
 */
@Slf4j
public final class HuggingFaceHubRepository implements ModelRepository {

    public static final String DEFAULT_ENDPOINT = "https://huggingface.co";

    private final OkHttpClient http;
    private final HttpUrl endpoint;
    private final Path cacheDir;
    private final String token;

    /**
     * @param http     shared HTTP client
     * @param endpoint hub base URL, e.g. {@link #DEFAULT_ENDPOINT}
     * @param cacheDir download cache root
     * @param token    optional access token for gated/private repositories (may be {@code null} or blank)
     */
    public HuggingFaceHubRepository(final OkHttpClient http,
                                    final String endpoint,
                                    final Path cacheDir,
                                    final String token) {
        final HttpUrl parsed = HttpUrl.parse(endpoint);
        if (parsed == null) {
            throw new IllegalArgumentException("Invalid hub endpoint: " + endpoint);
        }
        this.http = http;
        this.endpoint = parsed;
        this.cacheDir = cacheDir;
        this.token = token;
    }

    @Override
    public Path fetch(final String modelId, final String revision, final String fileName) {
        final Path target = cacheDir
                .resolve(modelId.replace("/", "--"))
                .resolve(revision)
                .resolve(fileName)
                .normalize();
        if (!target.startsWith(cacheDir.normalize())) {
            throw new ModelLoadException("Model file escapes cache root: " + modelId + "@" + revision + "/" + fileName);
        }

        if (Files.isRegularFile(target)) {
            log.debug("Cache hit for {}@{}/{}", modelId, revision, fileName);
            return target;
        }

        final HttpUrl url = resolveUrl(modelId, revision, fileName);
        final Request.Builder request = new Request.Builder().url(url).get();
        if (token != null && !token.isBlank()) {
            request.header("Authorization", "Bearer " + token);
        }

        log.info("Downloading {}", url);
        try (Response resp = http.newCall(request.build()).execute()) {
            if (!resp.isSuccessful()) {
                throw new ModelLoadException("Download of " + url + " failed: HTTP " + resp.code());
            }
            final ResponseBody body = resp.body();
            if (body == null) {
                throw new ModelLoadException("Download of " + url + " returned no body");
            }

            Files.createDirectories(target.getParent());
            final Path tmp = Files.createTempFile(target.getParent(), target.getFileName().toString(), ".part");
            try (InputStream in = body.byteStream()) {
                Files.copy(in, tmp, StandardCopyOption.REPLACE_EXISTING);
                Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            } finally {
                Files.deleteIfExists(tmp);
            }
            return target;
        } catch (final IOException e) {
            throw new ModelLoadException("Download of " + url + " failed", e);
        }
    }

    private HttpUrl resolveUrl(final String modelId, final String revision, final String fileName) {
        final HttpUrl.Builder url = endpoint.newBuilder()
                .addPathSegments(modelId)
                .addPathSegment("resolve")
                .addPathSegment(revision);
        return url.addPathSegments(fileName).build();
    }
}
