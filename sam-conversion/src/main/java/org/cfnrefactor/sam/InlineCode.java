package org.cfnrefactor.sam;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;

/**
 * Text clean-up for code that lives inside a template ({@code ZipFile}, AppSync {@code Code}).
 */
public final class InlineCode {

    private static final int TAB_WIDTH = 2;

    private InlineCode() {}

    /**
     * Normalize inline source so it reads as a block:
     * escaped single-line source is unescaped, CRLF becomes LF, blank leading and trailing lines go,
     * the common space indentation is removed and tabs are expanded to 2-column stops.
     */
    public static String prepare(String source) {
        String decoded = source.contains("\n") ? source : unescape(source);
        decoded = decoded.replace("\r\n", "\n");
        List<String> lines = new ArrayList<>(Arrays.asList(decoded.split("\n", -1)));
        while (!lines.isEmpty() && lines.get(0).isBlank()) {
            lines.remove(0);
        }
        while (!lines.isEmpty() && lines.get(lines.size() - 1).isBlank()) {
            lines.remove(lines.size() - 1);
        }
        if (lines.isEmpty()) {
            return "";
        }
        int indent = Integer.MAX_VALUE;
        for (String line : lines) {
            if (!line.isBlank()) {
                indent = Math.min(indent, leadingSpaces(line));
            }
        }
        List<String> result = new ArrayList<>(lines.size());
        for (String line : lines) {
            String dedented = line.length() >= indent ? line.substring(indent) : line;
            result.add(expandTabs(dedented));
        }
        return String.join("\n", result);
    }

    /**
     * File name for staged inline function code: the module part of the handler plus an extension
     * chosen from the runtime, e.g. {@code index.handler} on {@code python3.12} gives {@code index.py}.
     */
    public static String inferFileName(String handler, String runtime) {
        String base = "index";
        if (handler != null && !handler.isBlank()) {
            String module = handler.split("::", 2)[0];
            module = module.split("\\.", 2)[0];
            int slash = module.indexOf('/');
            if (slash >= 0) {
                module = module.substring(slash + 1);
            }
            module = module.replaceAll("[^A-Za-z0-9_\\-]", "_");
            if (!module.isEmpty()) {
                base = module;
            }
        }
        return base + runtimeExtension(runtime);
    }

    static String runtimeExtension(String runtime) {
        if (runtime == null) {
            return ".js";
        }
        String lowered = runtime.toLowerCase(Locale.ROOT);
        if (lowered.startsWith("python")) {
            return ".py";
        }
        if (lowered.startsWith("ruby")) {
            return ".rb";
        }
        if (lowered.startsWith("dotnet")) {
            return ".cs";
        }
        if (lowered.startsWith("go")) {
            return ".go";
        }
        if (lowered.startsWith("java")) {
            return ".java";
        }
        if (lowered.contains("provided")) {
            return ".txt";
        }
        return ".js";
    }

    static String unescape(String text) {
        if (!text.contains("\\")) {
            return text;
        }
        StringBuilder out = new StringBuilder(text.length());
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (c != '\\' || i + 1 == text.length()) {
                out.append(c);
                continue;
            }
            char next = text.charAt(++i);
            switch (next) {
                case 'n':
                    out.append('\n');
                    break;
                case 't':
                    out.append('\t');
                    break;
                case 'r':
                    out.append('\r');
                    break;
                case '\\':
                case '"':
                case '\'':
                    out.append(next);
                    break;
                default:
                    out.append(c).append(next);
            }
        }
        return out.toString();
    }

    private static int leadingSpaces(String line) {
        int count = 0;
        while (count < line.length() && line.charAt(count) == ' ') {
            count++;
        }
        return count;
    }

    private static String expandTabs(String line) {
        if (line.indexOf('\t') < 0) {
            return line;
        }
        StringBuilder out = new StringBuilder();
        for (int i = 0; i < line.length(); i++) {
            char c = line.charAt(i);
            if (c == '\t') {
                int spaces = TAB_WIDTH - (out.length() % TAB_WIDTH);
                out.append(" ".repeat(spaces));
            } else {
                out.append(c);
            }
        }
        return out.toString();
    }
}
