package io.evalsandbox.core.policy;

import io.evalsandbox.core.error.AccessDeniedException;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Enforces a {@link CapabilityPolicy}. Runtimes call one {@code check*} method before every filesystem,
 * network or process operation; a refusal raises {@link AccessDeniedException} naming the {@link AccessKind},
 * otherwise the call returns and the operation proceeds.
 *
 * <p>
 * Path checks resolve symlinks on the longest existing prefix of the path before comparing against the
 * roots, so a link inside an allowed subtree cannot reach outside it. Decisions depend only on the policy and
 * the filesystem, never on earlier calls: the same denied request is refused identically every time.
 */
public final class CapabilityGuard {

    private final CapabilityPolicy policy;
    private final List<Path> readRoots;
    private final List<Path> writeRoots;

    public CapabilityGuard(CapabilityPolicy policy) {
        this.policy = policy;
        this.writeRoots = canonicalRoots(policy.writeRoots());
        this.readRoots = canonicalRoots(policy.readRoots());
    }

    public CapabilityPolicy policy() {
        return policy;
    }

    /**
     * Checks that {@code rawPath} may be read.
     *
     * @return the resolved, canonical path to operate on
     * @throws AccessDeniedException with kind {@link AccessKind#READ} when refused
     */
    public Path checkRead(String rawPath) {
        Path path = resolve(rawPath, AccessKind.READ);
        if (!isUnder(path, readRoots) && !isUnder(path, writeRoots)) {
            throw new AccessDeniedException(AccessKind.READ, rawPath);
        }
        return path;
    }

    /**
     * Checks that {@code rawPath} may be created, overwritten or deleted.
     *
     * @return the resolved, canonical path to operate on
     * @throws AccessDeniedException with kind {@link AccessKind#WRITE} when refused
     */
    public Path checkWrite(String rawPath) {
        Path path = resolve(rawPath, AccessKind.WRITE);
        if (!isUnder(path, writeRoots)) {
            throw new AccessDeniedException(AccessKind.WRITE, rawPath);
        }
        return path;
    }

    /** Checks an outbound connection to {@code host:port}. */
    public void checkConnect(String host, int port) {
        if (!policy.networkAllowed()) {
            throw new AccessDeniedException(AccessKind.NETWORK, host + ":" + port);
        }
    }

    /** Checks binding a listening socket on {@code port}. */
    public void checkListen(int port) {
        if (!policy.networkAllowed()) {
            throw new AccessDeniedException(AccessKind.NETWORK, "listen :" + port);
        }
    }

    /** Checks launching {@code command} as a child process. */
    public void checkExecute(String command) {
        if (!policy.processAllowed()) {
            throw new AccessDeniedException(AccessKind.EXECUTE, command);
        }
    }

    private Path resolve(String rawPath, AccessKind kind) {
        if (rawPath == null || rawPath.isEmpty() || rawPath.indexOf('\0') >= 0) {
            throw new AccessDeniedException(kind, String.valueOf(rawPath).replace('\0', '?'));
        }
        Path candidate;
        try {
            candidate = policy.workingDirectory().resolve(rawPath).normalize();
        } catch (InvalidPathException e) {
            throw new AccessDeniedException(kind, rawPath);
        }
        Path canonical = canonicalize(candidate);
        if (canonical == null) {
            throw new AccessDeniedException(kind, rawPath);
        }
        return canonical;
    }

    private static boolean isUnder(Path path, List<Path> roots) {
        for (Path root : roots) {
            if (path.startsWith(root)) {
                return true;
            }
        }
        return false;
    }

    private static List<Path> canonicalRoots(Set<Path> roots) {
        return roots.stream()
                .map(root -> {
                    Path canonical = canonicalize(root);
                    return canonical != null ? canonical : root;
                })
                .collect(Collectors.toUnmodifiableList());
    }

    /**
     * Resolves symlinks on the longest existing prefix of an absolute, normalized path and re-appends the
     * missing tail. Returns {@code null} when the existing prefix cannot be resolved.
     */
    private static Path canonicalize(Path path) {
        Deque<Path> missing = new ArrayDeque<>();
        Path existing = path;
        while (existing != null && !Files.exists(existing)) {
            Path name = existing.getFileName();
            if (name != null) {
                missing.push(name);
            }
            existing = existing.getParent();
        }
        if (existing == null) {
            return path;
        }
        Path real;
        try {
            real = existing.toRealPath();
        } catch (IOException e) {
            return null;
        }
        while (!missing.isEmpty()) {
            real = real.resolve(missing.pop().toString());
        }
        return real;
    }
}
