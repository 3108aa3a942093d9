package org.databridge.hierarchy.compiler;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Ticker;
import org.databridge.hierarchy.model.ProjectSnapshot;
import org.databridge.hierarchy.transpiler.SQLDialect;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Duration;
import java.util.HexFormat;
import java.util.function.Supplier;

/**
 * Compilation results keyed by a SHA-256 hash of everything that determines them: the
 * project's nodes and formulas, the source mapping and, for rendered SQL, the dialect.
 *
 * <p>Entries never go stale, since a changed project hashes to a new key, but both caches
 * are bounded: each holds at most {@code maximumSize} entries and drops entries not read for
 * {@code expireAfterAccess}.
 */
public final class CompilationCache {

    private static final Logger LOGGER = LoggerFactory.getLogger(CompilationCache.class);

    public static final long DEFAULT_MAXIMUM_SIZE = 1_000;
    public static final Duration DEFAULT_EXPIRE_AFTER_ACCESS = Duration.ofMinutes(30);

    private final Cache<String, CompiledProject> compiled;
    private final Cache<String, RenderedProject> rendered;

    public CompilationCache() {
        this(DEFAULT_MAXIMUM_SIZE, DEFAULT_EXPIRE_AFTER_ACCESS);
    }

    /**
     * @param maximumSize       Entries kept per cache, compiled and rendered counted apart
     * @param expireAfterAccess Idle time after which an entry is dropped
     */
    public CompilationCache(long maximumSize, Duration expireAfterAccess) {
        this(maximumSize, expireAfterAccess, Ticker.systemTicker());
    }

    CompilationCache(long maximumSize, Duration expireAfterAccess, Ticker ticker) {
        if (maximumSize <= 0) {
            throw new IllegalArgumentException("Cache maximum size must be positive, got " + maximumSize);
        }
        if (expireAfterAccess.isNegative() || expireAfterAccess.isZero()) {
            throw new IllegalArgumentException("Cache expiry must be positive, got " + expireAfterAccess);
        }
        this.compiled = Caffeine.newBuilder()
                .maximumSize(maximumSize)
                .expireAfterAccess(expireAfterAccess)
                .ticker(ticker)
                .executor(Runnable::run)
                .build();
        this.rendered = Caffeine.newBuilder()
                .maximumSize(maximumSize)
                .expireAfterAccess(expireAfterAccess)
                .ticker(ticker)
                .executor(Runnable::run)
                .build();
    }

    /**
     * Dialect-neutral compilation of a project.
     */
    public CompiledProject compiled(ProjectSnapshot snapshot, SourceMapping mapping,
                                    Supplier<CompiledProject> compilation) {
        String key = contentHash(snapshot, mapping, null);
        CompiledProject hit = compiled.getIfPresent(key);
        if (hit != null) {
            LOGGER.debug("Compilation cache hit for project {}", snapshot.projectId());
            return hit;
        }
        return compiled.get(key, k -> compilation.get());
    }

    /**
     * Per-dialect SQL of a project.
     */
    public RenderedProject rendered(ProjectSnapshot snapshot, SourceMapping mapping, SQLDialect dialect,
                                    Supplier<RenderedProject> rendering) {
        String key = contentHash(snapshot, mapping, dialect);
        RenderedProject hit = rendered.getIfPresent(key);
        if (hit != null) {
            LOGGER.debug("Rendered SQL cache hit for project {} ({})", snapshot.projectId(), dialect.name());
            return hit;
        }
        return rendered.get(key, k -> rendering.get());
    }

    /**
     * Entries currently held, after pending evictions have run.
     */
    public long size() {
        compiled.cleanUp();
        rendered.cleanUp();
        return compiled.estimatedSize() + rendered.estimatedSize();
    }

    public void invalidateAll() {
        compiled.invalidateAll();
        rendered.invalidateAll();
    }

    /**
     * Hex SHA-256 of the canonical text of (nodes, formulas, mapping, dialect). Snapshots and
     * mappings keep their maps sorted, so equal content always hashes equal.
     *
     * @param dialect The dialect, or null for dialect-neutral results
     */
    public static String contentHash(ProjectSnapshot snapshot, SourceMapping mapping, SQLDialect dialect) {
        String canonical = snapshot.projectId() + '\u0000' + snapshot.projectName()
                + '\u0000' + snapshot.nodes()
                + '\u0000' + snapshot.formulas()
                + '\u0000' + mapping
                + '\u0000' + (dialect == null ? "" : dialect.name());
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(digest.digest(canonical.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
