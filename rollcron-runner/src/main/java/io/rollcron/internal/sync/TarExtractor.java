package io.rollcron.internal.sync;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.FileSystems;
import java.nio.file.Files;
import java.nio.file.LinkOption;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardOpenOption;
import java.nio.file.attribute.PosixFilePermission;
import java.util.EnumSet;
import java.util.Set;

/**
 * Minimal reader for the ustar/pax archives produced by {@code git archive --format=tar}.
 *
 * <p>Handles regular files, directories, symbolic links and pax {@code path}/{@code linkpath} records.
 * Absolute entry names, names escaping the target directory and writes through symbolic links are rejected
 * with a {@link SyncException}.
 */
final class TarExtractor {

    private static final int BLOCK = 512;

    private static final boolean POSIX = FileSystems.getDefault().supportedFileAttributeViews().contains("posix");

    private TarExtractor() {
    }

    static void extract(InputStream in, Path targetDir) throws IOException {
        Path root = targetDir.toRealPath();
        byte[] header = new byte[BLOCK];
        String paxPath = null;
        String paxLink = null;

        while (true) {
            if (!readFully(in, header)) {
                throw new SyncException("Truncated tar archive");
            }
            if (isZeroBlock(header)) {
                return;
            }
            verifyChecksum(header);

            char type = (char) header[156];
            long size = parseOctal(header, 124, 12);
            String name = paxPath != null ? paxPath : entryName(header);
            String link = paxLink != null ? paxLink : cString(header, 157, 100);

            switch (type) {
                case 'x' -> {
                    byte[] records = readBody(in, size);
                    paxPath = paxValue(records, "path");
                    paxLink = paxValue(records, "linkpath");
                    continue;
                }
                case 'g' -> {
                    skip(in, padded(size));
                    continue;
                }
                default -> {
                    // regular entry, handled below
                }
            }
            paxPath = null;
            paxLink = null;

            Path dest = resolveInside(root, name);
            int mode = (int) parseOctal(header, 100, 8);
            switch (type) {
                case '5' -> {
                    Files.createDirectories(dest);
                    applyMode(dest, mode);
                    skip(in, padded(size));
                }
                case '2' -> {
                    ensureParent(root, dest);
                    if (Paths.get(link).isAbsolute()) {
                        throw new SyncException("Refusing absolute symlink target: " + name + " -> " + link);
                    }
                    Files.deleteIfExists(dest);
                    Files.createSymbolicLink(dest, Paths.get(link));
                    skip(in, padded(size));
                }
                case '0', '\0', '7' -> {
                    ensureParent(root, dest);
                    if (Files.isSymbolicLink(dest)) {
                        throw new SyncException("Refusing to write through symlink: " + name);
                    }
                    try (OutputStream out = Files.newOutputStream(dest,
                            StandardOpenOption.CREATE, StandardOpenOption.TRUNCATE_EXISTING, StandardOpenOption.WRITE)) {
                        copy(in, out, size);
                    }
                    skip(in, padded(size) - size);
                    applyMode(dest, mode);
                }
                default -> skip(in, padded(size)); // hard links, devices, fifos: not part of a git tree
            }
        }
    }

    static Path resolveInside(Path root, String name) {
        if (name.isEmpty() || name.startsWith("/") || Paths.get(name).isAbsolute()) {
            throw new SyncException("Refusing absolute or empty archive path: '" + name + "'");
        }
        Path dest = root.resolve(name).normalize();
        if (!dest.startsWith(root)) {
            throw new SyncException("Refusing archive path outside target directory: " + name);
        }
        return dest;
    }

    private static void ensureParent(Path root, Path dest) throws IOException {
        if (dest.equals(root)) {
            throw new SyncException("Refusing to replace the target directory itself");
        }
        Path parent = dest.getParent();
        Files.createDirectories(parent);
        if (!parent.toRealPath().startsWith(root)) {
            throw new SyncException("Refusing archive path through symlink: " + root.relativize(dest));
        }
    }

    private static void applyMode(Path path, int mode) throws IOException {
        if (!POSIX || mode == 0 || Files.isSymbolicLink(path)) {
            return;
        }
        Set<PosixFilePermission> perms = EnumSet.noneOf(PosixFilePermission.class);
        PosixFilePermission[] order = {
                PosixFilePermission.OTHERS_EXECUTE, PosixFilePermission.OTHERS_WRITE, PosixFilePermission.OTHERS_READ,
                PosixFilePermission.GROUP_EXECUTE, PosixFilePermission.GROUP_WRITE, PosixFilePermission.GROUP_READ,
                PosixFilePermission.OWNER_EXECUTE, PosixFilePermission.OWNER_WRITE, PosixFilePermission.OWNER_READ
        };
        for (int bit = 0; bit < order.length; bit++) {
            if ((mode & (1 << bit)) != 0) {
                perms.add(order[bit]);
            }
        }
        perms.add(PosixFilePermission.OWNER_READ);
        perms.add(PosixFilePermission.OWNER_WRITE);
        if (Files.isDirectory(path, LinkOption.NOFOLLOW_LINKS)) {
            perms.add(PosixFilePermission.OWNER_EXECUTE);
        }
        Files.setPosixFilePermissions(path, perms);
    }

    private static String entryName(byte[] header) {
        String name = cString(header, 0, 100);
        String magic = cString(header, 257, 5);
        if ("ustar".equals(magic)) {
            String prefix = cString(header, 345, 155);
            if (!prefix.isEmpty()) {
                return prefix + "/" + name;
            }
        }
        return name;
    }

    // record lengths count bytes, so values are decoded one record at a time
    private static String paxValue(byte[] records, String key) {
        int pos = 0;
        while (pos < records.length) {
            int space = indexOf(records, (byte) ' ', pos);
            if (space < 0) {
                break;
            }
            int len;
            try {
                len = Integer.parseInt(new String(records, pos, space - pos, StandardCharsets.US_ASCII));
            } catch (NumberFormatException e) {
                throw new SyncException("Malformed pax header", e);
            }
            if (len <= 0) {
                throw new SyncException("Malformed pax header");
            }
            int end = Math.min(records.length, pos + len);
            int eq = indexOf(records, (byte) '=', space + 1);
            if (eq > space + 1 && eq < end) {
                String recordKey = new String(records, space + 1, eq - space - 1, StandardCharsets.UTF_8);
                if (recordKey.equals(key)) {
                    // drop the trailing newline
                    int valueEnd = Math.max(eq + 1, end - 1);
                    return new String(records, eq + 1, valueEnd - eq - 1, StandardCharsets.UTF_8);
                }
            }
            pos = end;
        }
        return null;
    }

    private static int indexOf(byte[] bytes, byte value, int from) {
        for (int i = from; i < bytes.length; i++) {
            if (bytes[i] == value) {
                return i;
            }
        }
        return -1;
    }

    private static void verifyChecksum(byte[] header) {
        long expected = parseOctal(header, 148, 8);
        long sum = 0;
        for (int i = 0; i < BLOCK; i++) {
            sum += (i >= 148 && i < 156) ? ' ' : (header[i] & 0xff);
        }
        if (sum != expected) {
            throw new SyncException("Corrupt tar header (checksum mismatch)");
        }
    }

    static long parseOctal(byte[] buf, int offset, int length) {
        long value = 0;
        int end = offset + length;
        int i = offset;
        while (i < end && (buf[i] == ' ' || buf[i] == 0)) {
            i++;
        }
        for (; i < end; i++) {
            byte b = buf[i];
            if (b == 0 || b == ' ') {
                break;
            }
            if (b < '0' || b > '7') {
                throw new SyncException("Invalid octal number in tar header");
            }
            value = (value << 3) + (b - '0');
        }
        return value;
    }

    private static String cString(byte[] buf, int offset, int length) {
        int end = offset;
        while (end < offset + length && buf[end] != 0) {
            end++;
        }
        return new String(buf, offset, end - offset, StandardCharsets.UTF_8);
    }

    private static boolean isZeroBlock(byte[] block) {
        for (byte b : block) {
            if (b != 0) {
                return false;
            }
        }
        return true;
    }

    private static long padded(long size) {
        return (size + BLOCK - 1) / BLOCK * BLOCK;
    }

    private static byte[] readBody(InputStream in, long size) throws IOException {
        if (size > Integer.MAX_VALUE) {
            throw new SyncException("Tar header record too large");
        }
        ByteArrayOutputStream buf = new ByteArrayOutputStream((int) size);
        copy(in, buf, size);
        skip(in, padded(size) - size);
        return buf.toByteArray();
    }

    private static void copy(InputStream in, OutputStream out, long size) throws IOException {
        byte[] buf = new byte[8192];
        long remaining = size;
        while (remaining > 0) {
            int n = in.read(buf, 0, (int) Math.min(buf.length, remaining));
            if (n < 0) {
                throw new SyncException("Truncated tar archive");
            }
            out.write(buf, 0, n);
            remaining -= n;
        }
    }

    private static void skip(InputStream in, long count) throws IOException {
        long remaining = count;
        while (remaining > 0) {
            long n = in.skip(remaining);
            if (n <= 0) {
                if (in.read() < 0) {
                    throw new SyncException("Truncated tar archive");
                }
                n = 1;
            }
            remaining -= n;
        }
    }

    private static boolean readFully(InputStream in, byte[] buf) throws IOException {
        int off = 0;
        while (off < buf.length) {
            int n = in.read(buf, off, buf.length - off);
            if (n < 0) {
                return false;
            }
            off += n;
        }
        return true;
    }
}
