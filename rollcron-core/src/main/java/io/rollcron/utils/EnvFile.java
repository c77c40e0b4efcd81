package io.rollcron.utils;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Reader for {@code .env} files: {@code KEY=VALUE} per line, blank lines and {@code #} comments skipped,
 * surrounding single or double quotes removed from values.
 */
public final class EnvFile {

    public static final String FILE_NAME = ".env";

    private EnvFile() {
    }

    /**
     * Load {@code .env} from the given directory. A missing file yields an empty map.
     */
    public static Map<String, String> load(Path dir) throws IOException {
        Path file = dir.resolve(FILE_NAME);
        if (!Files.isRegularFile(file)) {
            return Map.of();
        }
        return parse(Files.readString(file, StandardCharsets.UTF_8));
    }

    public static Map<String, String> parse(String content) {
        Map<String, String> vars = new LinkedHashMap<>();
        for (String raw : content.split("\\R")) {
            String line = raw.trim();
            if (line.isEmpty() || line.startsWith("#")) {
                continue;
            }
            int eq = line.indexOf('=');
            if (eq < 0) {
                continue;
            }
            String key = line.substring(0, eq).trim();
            if (key.isEmpty()) {
                continue;
            }
            vars.put(key, unquote(line.substring(eq + 1).trim()));
        }
        return vars;
    }

    private static String unquote(String value) {
        if (value.length() >= 2) {
            char first = value.charAt(0);
            char last = value.charAt(value.length() - 1);
            if ((first == '"' && last == '"') || (first == '\'' && last == '\'')) {
                return value.substring(1, value.length() - 1);
            }
        }
        return value;
    }
}
