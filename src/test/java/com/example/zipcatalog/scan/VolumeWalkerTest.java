package com.example.zipcatalog.scan;

import com.example.zipcatalog.model.ErrorKind;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.junit.jupiter.api.Assumptions.assumeTrue;

class VolumeWalkerTest {
    private final VolumeWalker walker = new VolumeWalker();

    @Test
    void findsArchivesBreadthFirstInNameOrder() throws Exception {
        Path root = Files.createTempDirectory("walker-full");
        Files.createDirectories(root.resolve("b/deeper"));
        Files.createDirectories(root.resolve("a"));
        Files.writeString(root.resolve("b/deeper/z.zip"), "x");
        Files.writeString(root.resolve("b/y.ZIP"), "x");
        Files.writeString(root.resolve("a/x.zip"), "x");
        Files.writeString(root.resolve("a/notes.txt"), "x");
        Files.writeString(root.resolve("top.zip"), "x");

        List<String> found = relative(root, walker.discover(root, ScanPolicy.fullVolume(Set.of())));

        assertEquals(List.of("top.zip", "a/x.zip", "b/y.ZIP", "b/deeper/z.zip"), found);
    }

    @Test
    void skipsExcludedDirectoriesIgnoringCase() throws Exception {
        Path root = Files.createTempDirectory("walker-excluded");
        Files.createDirectories(root.resolve("Node_Modules"));
        Files.createDirectories(root.resolve("keep"));
        Files.writeString(root.resolve("Node_Modules/hidden.zip"), "x");
        Files.writeString(root.resolve("keep/visible.zip"), "x");

        List<String> found = relative(root, walker.discover(root, ScanPolicy.fullVolume(Set.of("node_modules"))));

        assertEquals(List.of("keep/visible.zip"), found);
    }

    @Test
    void markerModeOnlyEntersMarkerFoldersBelowTheRoot() throws Exception {
        Path root = Files.createTempDirectory("walker-marker");
        Files.createDirectories(root.resolve("GoogleTakeout/2021"));
        Files.createDirectories(root.resolve("other/GoogleTakeout"));
        Files.writeString(root.resolve("GoogleTakeout/2021/takeout-001.zip"), "x");
        Files.writeString(root.resolve("other/GoogleTakeout/nested.zip"), "x");
        Files.writeString(root.resolve("loose.zip"), "x");

        List<String> found = relative(root, walker.discover(root, ScanPolicy.markerFolders(Set.of("googletakeout"))));

        assertEquals(List.of("GoogleTakeout/2021/takeout-001.zip"), found);
    }

    @Test
    void missingRootIsReportedAndYieldsNothing() throws Exception {
        Path root = Files.createTempDirectory("walker-missing").resolve("not-there");
        List<ErrorKind> skips = new ArrayList<>();

        try (Stream<Path> stream = walker.discover(root, ScanPolicy.fullVolume(Set.of()),
                (path, kind, reason) -> skips.add(kind))) {
            assertEquals(0, stream.count());
        }
        assertEquals(List.of(ErrorKind.IO_FAILURE), skips);
    }

    @Test
    void walkStartsOnlyWhenConsumed() throws Exception {
        Path root = Files.createTempDirectory("walker-lazy").resolve("not-there");
        List<Path> skipped = new ArrayList<>();

        Stream<Path> stream = walker.discover(root, ScanPolicy.fullVolume(Set.of()), (path, kind, reason) -> skipped.add(path));

        assertTrue(skipped.isEmpty());
        stream.close();
    }

    @Test
    void doesNotFollowSymbolicLinksByDefault() throws Exception {
        Path root = treeWithLinkBackToRoot("walker-nofollow");

        List<String> found = relative(root, walker.discover(root, ScanPolicy.fullVolume(Set.of())));

        assertEquals(List.of("a/x.zip"), found);
    }

    @Test
    void followingLinksVisitsEachDirectoryOnce() throws Exception {
        Path root = treeWithLinkBackToRoot("walker-follow");
        ScanPolicy policy = new ScanPolicy(ScanMode.FULL_VOLUME, Set.of(), Set.of(), Set.of(), true);

        List<String> found = relative(root, walker.discover(root, policy));

        assertEquals(List.of("a/x.zip"), found);
    }

    @Test
    void recognisesZipNamesCaseInsensitively() {
        assertTrue(VolumeWalker.isArchiveName(Path.of("a/B.Zip")));
        assertTrue(!VolumeWalker.isArchiveName(Path.of("a/b.zip.part")));
    }

    private static Path treeWithLinkBackToRoot(String prefix) throws IOException {
        Path root = Files.createTempDirectory(prefix);
        Files.createDirectories(root.resolve("a"));
        Files.writeString(root.resolve("a/x.zip"), "x");
        try {
            Files.createSymbolicLink(root.resolve("a/loop"), root);
        } catch (IOException | UnsupportedOperationException ex) {
            assumeTrue(false, "symbolic links not supported here: " + ex.getMessage());
        }
        return root;
    }

    private static List<String> relative(Path root, Stream<Path> paths) {
        try (paths) {
            return paths.map(path -> root.toAbsolutePath().normalize().relativize(path).toString().replace('\\', '/'))
                    .collect(Collectors.toList());
        }
    }
}
