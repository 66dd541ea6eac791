package com.capgate.gatekeeper.workspace;

import com.capgate.gatekeeper.model.CommitResult;
import com.capgate.gatekeeper.model.Diff;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.MapperFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardCopyOption;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.ArrayList;
import java.util.HexFormat;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Applies batches of unified diffs to files under a fixed workspace root.
 *
 * This is the only code path in the service that writes workspace files:
 * both the auto-approved request path and the approve path of the gate
 * end up in {@link #apply}.
 *
 * <p>Per diff, in order:
 * <ol>
 *   <li>Resolve the path under the root; anything that normalises outside
 *       it fails with PATH_ESCAPE before touching the disk.</li>
 *   <li>Read the current content ("" if the file is new) and patch it;
 *       a mismatch fails with PATCH_REJECTED.</li>
 *   <li>Write to a temp sibling and move it over the target, so a single
 *       file is never left half-written.</li>
 * </ol>
 *
 * The batch is fail-fast and not transactional: the first failure stops
 * the batch and files written by earlier diffs stay written.
 */
@Component
public class PatchApplicator {

    private static final Logger log = LoggerFactory.getLogger(PatchApplicator.class);

    // Sorted keys and no pretty printing: the same (diffs, message) always
    // serialises to the same bytes.
    private static final ObjectMapper CANONICAL = JsonMapper.builder()
            .enable(MapperFeature.SORT_PROPERTIES_ALPHABETICALLY)
            .enable(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS)
            .build();

    private final Path          root;
    private final MeterRegistry meterRegistry;

    public PatchApplicator(
            @Value("${capgate.workspace.root:work}") String workspaceRoot,
            MeterRegistry meterRegistry) {
        this.root          = Paths.get(workspaceRoot).toAbsolutePath().normalize();
        this.meterRegistry = meterRegistry;
        try {
            Files.createDirectories(root);
        } catch (IOException e) {
            throw new IllegalStateException("Cannot create workspace root " + root, e);
        }
        log.info("Workspace root: {}", root);
    }

    public Path root() {
        return root;
    }

    /**
     * Apply every diff in order, then hash the batch.
     *
     * @throws WorkspaceException PATH_ESCAPE, PATCH_REJECTED or IO_FAILURE for the first failing diff
     */
    public CommitResult apply(List<Diff> diffs, String message) {
        Timer.Sample sample = Timer.start(meterRegistry);
        String outcome = "error";   // until the whole batch has gone through
        try {
            List<String> applied = new ArrayList<>(diffs.size());
            for (Diff diff : diffs) {
                applyOne(diff);
                applied.add(diff.path());
            }
            String sha = commitSha(diffs, message);
            outcome = "success";
            log.info("Applied {} diff(s) as {} ({})", applied.size(), sha, message);
            return new CommitResult(sha, applied);
        } catch (WorkspaceException e) {
            outcome = e.getKind().name().toLowerCase();
            log.warn("Patch batch stopped: {}", e.getMessage());
            throw e;
        } finally {
            sample.stop(meterRegistry.timer("capgate.patch.apply.duration", "outcome", outcome));
        }
    }

    /**
     * Hex SHA-256 over the canonical JSON of {@code {diffs, message}}.
     * A pure function of its inputs; used for traceability, not as a VCS commit id.
     */
    public static String commitSha(List<Diff> diffs, String message) {
        Map<String, Object> tuple = new LinkedHashMap<>();
        tuple.put("diffs",   diffs);
        tuple.put("message", message);
        try {
            byte[] canonical = CANONICAL.writeValueAsBytes(tuple);
            byte[] digest    = MessageDigest.getInstance("SHA-256").digest(canonical);
            return HexFormat.of().formatHex(digest);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Cannot serialize diff batch for hashing", e);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    // ------------------------------------------------------------------
    // Single diff
    // ------------------------------------------------------------------

    private void applyOne(Diff diff) {
        Path target = resolveContained(diff.path());
        try {
            Path parent = target.getParent();
            Files.createDirectories(parent);
            // Re-check against real paths: a symlinked directory inside the
            // root must not lead outside it.
            Path realRoot = root.toRealPath();
            if (!parent.toRealPath().startsWith(realRoot)) {
                throw new WorkspaceException(WorkspaceException.Kind.PATH_ESCAPE, diff.path(),
                        "parent directory resolves outside the workspace root");
            }
            if (Files.isSymbolicLink(target) && !linkStaysInside(target, realRoot)) {
                throw new WorkspaceException(WorkspaceException.Kind.PATH_ESCAPE, diff.path(),
                        "symbolic link resolves outside the workspace root");
            }
            if (Files.isDirectory(target)) {
                throw new WorkspaceException(WorkspaceException.Kind.IO_FAILURE, diff.path(),
                        "target is a directory");
            }

            String current = Files.exists(target)
                    ? Files.readString(target, StandardCharsets.UTF_8)
                    : "";
            String next;
            try {
                next = UnifiedDiffPatcher.apply(current, diff.patch());
            } catch (UnifiedDiffPatcher.PatchMismatchException e) {
                throw new WorkspaceException(WorkspaceException.Kind.PATCH_REJECTED, diff.path(),
                        e.getMessage(), e);
            }

            writeAtomically(target, next);
            meterRegistry.counter("capgate.patch.files.written").increment();
            log.debug("Wrote {} ({} chars)", diff.path(), next.length());
        } catch (IOException e) {
            throw new WorkspaceException(WorkspaceException.Kind.IO_FAILURE, diff.path(),
                    e.getMessage(), e);
        }
    }

    /**
     * Resolve a caller-supplied path strictly below the root.
     *
     * Absolute paths resolve to themselves and fail; {@code ..} segments are
     * normalised away first, so "a/../../x" fails as well. The root itself
     * is not a writable target.
     */
    Path resolveContained(String relativePath) {
        if (relativePath == null || relativePath.isBlank()) {
            throw new WorkspaceException(WorkspaceException.Kind.PATH_ESCAPE, String.valueOf(relativePath),
                    "empty path");
        }
        Path resolved;
        try {
            resolved = root.resolve(relativePath).toAbsolutePath().normalize();
        } catch (InvalidPathException e) {
            throw new WorkspaceException(WorkspaceException.Kind.PATH_ESCAPE, relativePath,
                    "not a valid path", e);
        }
        // Path.startsWith compares whole name elements, so "/work-other" is
        // not inside "/work".
        if (resolved.equals(root) || !resolved.startsWith(root)) {
            throw new WorkspaceException(WorkspaceException.Kind.PATH_ESCAPE, relativePath,
                    "resolves outside the workspace root");
        }
        return resolved;
    }

    // Dangling links are judged by where they point, not rejected as I/O errors.
    private static boolean linkStaysInside(Path link, Path realRoot) throws IOException {
        if (Files.exists(link)) {
            return link.toRealPath().startsWith(realRoot);
        }
        Path pointsTo = link.getParent().toRealPath()
                .resolve(Files.readSymbolicLink(link))
                .normalize();
        return pointsTo.startsWith(realRoot);
    }

    private static void writeAtomically(Path target, String content) throws IOException {
        Path tmp = Files.createTempFile(target.getParent(), "." + target.getFileName(), ".tmp");
        try {
            Files.writeString(tmp, content, StandardCharsets.UTF_8);
            try {
                Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING);
            }
        } finally {
            Files.deleteIfExists(tmp);
        }
    }
}
