package io.rollcron.internal.sync;

import java.io.IOException;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.LinkOption;
import java.nio.file.Path;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.StandardCopyOption;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.ArrayList;
import java.util.List;

/**
 * One-way mirror of a local directory: additions, modifications and deletions of {@code source} are
 * applied to {@code target}. VCS metadata is excluded. Files are compared by size and modification time.
 */
final class TreeMirror {

    private TreeMirror() {
    }

    /**
     * @return number of entries created, updated or deleted in {@code target}
     */
    static int mirror(Path source, Path target) throws IOException {
        Files.createDirectories(target);
        int[] changes = {0};

        Files.walkFileTree(source, new SimpleFileVisitor<>() {
            @Override
            public FileVisitResult preVisitDirectory(Path dir, BasicFileAttributes attrs) throws IOException {
                if (FileTrees.isVcsDir(source, dir)) {
                    return FileVisitResult.SKIP_SUBTREE;
                }
                Path dest = target.resolve(source.relativize(dir).toString());
                if (Files.exists(dest, LinkOption.NOFOLLOW_LINKS) && !Files.isDirectory(dest, LinkOption.NOFOLLOW_LINKS)) {
                    Files.delete(dest);
                    changes[0]++;
                }
                if (!Files.exists(dest, LinkOption.NOFOLLOW_LINKS)) {
                    Files.createDirectories(dest);
                    changes[0]++;
                }
                return FileVisitResult.CONTINUE;
            }

            @Override
            public FileVisitResult visitFile(Path file, BasicFileAttributes attrs) throws IOException {
                Path dest = target.resolve(source.relativize(file).toString());
                if (Files.isDirectory(dest, LinkOption.NOFOLLOW_LINKS)) {
                    FileTrees.deleteRecursively(dest);
                } else if (isUpToDate(file, dest, attrs)) {
                    return FileVisitResult.CONTINUE;
                }
                Files.copy(file, dest, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.COPY_ATTRIBUTES,
                        LinkOption.NOFOLLOW_LINKS);
                changes[0]++;
                return FileVisitResult.CONTINUE;
            }
        });

        List<Path> stale = new ArrayList<>();
        Files.walkFileTree(target, new SimpleFileVisitor<>() {
            @Override
            public FileVisitResult preVisitDirectory(Path dir, BasicFileAttributes attrs) {
                if (dir.equals(target)) {
                    return FileVisitResult.CONTINUE;
                }
                Path src = source.resolve(target.relativize(dir).toString());
                if (FileTrees.isVcsDir(target, dir) || !Files.isDirectory(src, LinkOption.NOFOLLOW_LINKS)) {
                    stale.add(dir);
                    return FileVisitResult.SKIP_SUBTREE;
                }
                return FileVisitResult.CONTINUE;
            }

            @Override
            public FileVisitResult visitFile(Path file, BasicFileAttributes attrs) {
                Path src = source.resolve(target.relativize(file).toString());
                if (!Files.exists(src, LinkOption.NOFOLLOW_LINKS)) {
                    stale.add(file);
                }
                return FileVisitResult.CONTINUE;
            }
        });
        for (Path path : stale) {
            FileTrees.deleteRecursively(path);
            changes[0]++;
        }
        return changes[0];
    }

    private static boolean isUpToDate(Path file, Path dest, BasicFileAttributes attrs) throws IOException {
        if (!Files.exists(dest, LinkOption.NOFOLLOW_LINKS)) {
            return false;
        }
        BasicFileAttributes existing = Files.readAttributes(dest, BasicFileAttributes.class, LinkOption.NOFOLLOW_LINKS);
        if (attrs.isSymbolicLink() || existing.isSymbolicLink()) {
            return attrs.isSymbolicLink() && existing.isSymbolicLink()
                    && Files.readSymbolicLink(file).equals(Files.readSymbolicLink(dest));
        }
        return existing.size() == attrs.size()
                && existing.lastModifiedTime().equals(attrs.lastModifiedTime());
    }
}
