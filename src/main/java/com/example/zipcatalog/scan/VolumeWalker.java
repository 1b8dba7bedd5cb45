package com.example.zipcatalog.scan;

import com.example.zipcatalog.model.ErrorKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.AccessDeniedException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.LinkOption;
import java.nio.file.Path;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Deque;
import java.util.HashSet;
import java.util.Iterator;
import java.util.List;
import java.util.Locale;
import java.util.NoSuchElementException;
import java.util.Set;
import java.util.Spliterator;
import java.util.Spliterators;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;

/**
 * Finds candidate ZIP archives beneath a volume root.
 *
 * <p>Traversal is breadth-first with directory listings sorted by name, so two walks of an
 * unchanged tree yield the same sequence. Nothing is read until the returned stream is consumed,
 * and every call starts a fresh walk. Symbolic links are not followed unless the policy asks for it,
 * in which case directories already visited (by real path) are skipped to avoid cycles.
 */
public final class VolumeWalker {
    private static final Logger LOGGER = LoggerFactory.getLogger(VolumeWalker.class);
    private static final String ARCHIVE_SUFFIX = ".zip";

    public Stream<Path> discover(Path root, ScanPolicy policy) {
        return discover(root, policy, WalkListener.IGNORE);
    }

    public Stream<Path> discover(Path root, ScanPolicy policy, WalkListener listener) {
        Iterator<Path> iterator = new CandidateIterator(root, policy, listener);
        return StreamSupport.stream(
                Spliterators.spliteratorUnknownSize(iterator, Spliterator.ORDERED | Spliterator.NONNULL),
                false);
    }

    static boolean isArchiveName(Path path) {
        Path name = path.getFileName();
        return name != null && name.toString().toLowerCase(Locale.ROOT).endsWith(ARCHIVE_SUFFIX);
    }

    private static final class CandidateIterator implements Iterator<Path> {
        private final Path root;
        private final ScanPolicy policy;
        private final WalkListener listener;
        private final LinkOption[] linkOptions;
        private final Deque<Path> pendingDirectories = new ArrayDeque<>();
        private final Deque<Path> candidates = new ArrayDeque<>();
        private final Set<Path> visited = new HashSet<>();
        private boolean started;

        private CandidateIterator(Path root, ScanPolicy policy, WalkListener listener) {
            this.root = root.toAbsolutePath().normalize();
            this.policy = policy;
            this.listener = listener;
            this.linkOptions = policy.followLinks() ? new LinkOption[0] : new LinkOption[]{LinkOption.NOFOLLOW_LINKS};
        }

        @Override
        public boolean hasNext() {
            if (!started) {
                started = true;
                start();
            }
            while (candidates.isEmpty() && !pendingDirectories.isEmpty()) {
                scanDirectory(pendingDirectories.removeFirst());
            }
            return !candidates.isEmpty();
        }

        @Override
        public Path next() {
            if (!hasNext()) {
                throw new NoSuchElementException();
            }
            return candidates.removeFirst();
        }

        private void start() {
            if (!Files.exists(root, linkOptions)) {
                skip(root, ErrorKind.IO_FAILURE, "volume root does not exist");
                return;
            }
            if (!Files.isDirectory(root, linkOptions)) {
                skip(root, ErrorKind.IO_FAILURE, "volume root is not a directory");
                return;
            }
            if (policy.mode() == ScanMode.FULL_VOLUME) {
                pendingDirectories.addLast(root);
                return;
            }
            List<Path> children = list(root);
            if (children == null) {
                return;
            }
            for (Path child : children) {
                if (Files.isDirectory(child, linkOptions) && policy.isMarker(child.getFileName().toString())) {
                    LOGGER.info("Found marker folder {}", child);
                    pendingDirectories.addLast(child);
                }
            }
        }

        private void scanDirectory(Path directory) {
            if (policy.followLinks() && !markVisited(directory)) {
                return;
            }
            List<Path> children = list(directory);
            if (children == null) {
                return;
            }
            for (Path child : children) {
                if (!policy.followLinks() && Files.isSymbolicLink(child)) {
                    LOGGER.debug("Not following symbolic link {}", child);
                    continue;
                }
                if (Files.isDirectory(child, linkOptions)) {
                    if (policy.isExcluded(child.getFileName().toString())) {
                        LOGGER.debug("Skipping excluded directory {}", child);
                        continue;
                    }
                    pendingDirectories.addLast(child);
                } else if (Files.isRegularFile(child, linkOptions) && isArchiveName(child)) {
                    candidates.addLast(child);
                }
            }
        }

        private boolean markVisited(Path directory) {
            try {
                return visited.add(directory.toRealPath());
            } catch (IOException ex) {
                skip(directory, ArchiveProbeException.classify(ex), "cannot resolve real path: " + ex.getMessage());
                return false;
            }
        }

        private List<Path> list(Path directory) {
            List<Path> children = new ArrayList<>();
            try (DirectoryStream<Path> stream = Files.newDirectoryStream(directory)) {
                for (Path child : stream) {
                    children.add(child);
                }
            } catch (AccessDeniedException ex) {
                skip(directory, ErrorKind.PERMISSION_DENIED, "permission denied");
                return null;
            } catch (IOException ex) {
                skip(directory, ErrorKind.IO_FAILURE, "cannot list directory: " + ex.getMessage());
                return null;
            }
            children.sort(Comparator.comparing(path -> path.getFileName().toString()));
            return children;
        }

        private void skip(Path path, ErrorKind kind, String reason) {
            LOGGER.warn("Skipping {}: {}", path, reason);
            listener.skipped(path, kind, reason);
        }
    }
}
