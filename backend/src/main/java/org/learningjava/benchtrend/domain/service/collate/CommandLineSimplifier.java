package org.learningjava.benchtrend.domain.service.collate;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Shortens command lines for display: path-like tokens lose their directories
 * ({@code /opt/som/som.jar} becomes {@code som.jar}) and whitespace collapses.
 */
public final class CommandLineSimplifier {

    private static final Pattern PATH_TOKEN = Pattern.compile("(?<![\\w.\\-])(?:[\\w.\\-]*/)+([\\w.\\-]+)");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    private CommandLineSimplifier() { }

    public static String simplify(String commandLine) {
        if (commandLine == null) return null;
        Matcher m = PATH_TOKEN.matcher(commandLine);
        String withoutDirs = m.replaceAll(r -> Matcher.quoteReplacement(r.group(1)));
        return WHITESPACE.matcher(withoutDirs).replaceAll(" ").trim();
    }
}
