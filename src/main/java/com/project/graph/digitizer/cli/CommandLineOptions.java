package com.project.graph.digitizer.cli;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Arguments of command-line mode:
 * <pre>
 *   &lt;image&gt; [--output &lt;path&gt; | --output=&lt;path&gt;] [--show-plot]
 * </pre>
 * Options starting with {@code --spring.} or {@code --app.} are Spring property
 * overrides and are ignored here.
 */
public record CommandLineOptions(Path image, Path output, boolean showPlot) {

    static final String OUTPUT = "--output";
    static final String SHOW_PLOT = "--show-plot";

    public static boolean hasPositionalArgument(String[] args) {
        for (String a : args) {
            if (!a.startsWith("--")) return true;
        }
        return false;
    }

    /**
     * True only when {@code --show-plot} is given and the platform can open a window.
     * Everything else runs with AWT in headless mode.
     */
    public static boolean needsDisplay(String[] args, Map<String, String> env, String osName) {
        if (!Arrays.asList(args).contains(SHOW_PLOT)) {
            return false;
        }
        String os = osName == null ? "" : osName.toLowerCase(Locale.ROOT);
        if (os.startsWith("windows") || os.startsWith("mac")) {
            return true;
        }
        return isSet(env.get("DISPLAY")) || isSet(env.get("WAYLAND_DISPLAY"));
    }

    private static boolean isSet(String v) {
        return v != null && !v.isBlank();
    }

    /**
     * @param defaultOutput used when no {@code --output} is given
     * @throws IllegalArgumentException on an unknown option, a missing value or a missing image
     */
    public static CommandLineOptions parse(String[] args, Path defaultOutput) {
        List<String> positional = new ArrayList<>();
        Path output = defaultOutput;
        boolean showPlot = false;

        for (int i = 0; i < args.length; i++) {
            String a = args[i];
            if (a.equals(SHOW_PLOT)) {
                showPlot = true;
            } else if (a.equals(OUTPUT)) {
                if (i + 1 >= args.length || args[i + 1].startsWith("--")) {
                    throw new IllegalArgumentException(OUTPUT + " needs a path");
                }
                output = Path.of(args[++i]);
            } else if (a.startsWith(OUTPUT + "=")) {
                String value = a.substring(OUTPUT.length() + 1);
                if (value.isEmpty()) {
                    throw new IllegalArgumentException(OUTPUT + " needs a path");
                }
                output = Path.of(value);
            } else if (a.startsWith("--spring.") || a.startsWith("--app.") || a.startsWith("--logging.")) {
                continue;
            } else if (a.startsWith("--")) {
                throw new IllegalArgumentException("Unknown option: " + a);
            } else {
                positional.add(a);
            }
        }

        if (positional.isEmpty()) {
            throw new IllegalArgumentException("Missing image path. Usage: <image> [--output <path>] [--show-plot]");
        }
        if (positional.size() > 1) {
            throw new IllegalArgumentException("Expected one image path but got " + positional);
        }
        return new CommandLineOptions(Path.of(positional.get(0)), output, showPlot);
    }
}
