package org.promoharvest.pipeline.utils;

import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * Expands {@code ${NAME}} placeholders and a leading {@code ~} in configured paths.
 * Placeholders resolve against system properties first, then environment variables.
 */
public final class PathExpansion {

    private PathExpansion() {
    }

    /**
     * @throws IllegalArgumentException on an unclosed or undefined placeholder
     */
    public static String expandPath(String path) {
        if (path == null) {
            return null;
        }
        String expanded = path;
        if (expanded.equals("~") || expanded.startsWith("~/")) {
            expanded = System.getProperty("user.home") + expanded.substring(1);
        }
        if (!expanded.contains("${")) {
            return expanded;
        }
        StringBuilder result = new StringBuilder();
        int pos = 0;
        while (pos < expanded.length()) {
            int startVar = expanded.indexOf("${", pos);
            if (startVar == -1) {
                result.append(expanded, pos, expanded.length());
                break;
            }
            result.append(expanded, pos, startVar);
            int endVar = expanded.indexOf('}', startVar + 2);
            if (endVar == -1) {
                throw new IllegalArgumentException("Unclosed variable in path: " + path);
            }
            String varName = expanded.substring(startVar + 2, endVar);
            String value = System.getProperty(varName);
            if (value == null) {
                value = System.getenv(varName);
            }
            if (value == null) {
                throw new IllegalArgumentException("Undefined variable '${" + varName + "}' in path: " + path);
            }
            result.append(value);
            pos = endVar + 1;
        }
        return result.toString();
    }

    public static Path resolve(String path) {
        return Paths.get(expandPath(path));
    }
}
