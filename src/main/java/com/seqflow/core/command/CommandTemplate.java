package com.seqflow.core.command;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Ordered argument list with named {@code {placeholder}} references.
 *
 * <p>Arguments are never joined into a shell string, so values need no quoting.
 * An argument consisting of exactly one placeholder expands to one argument per
 * bound value; a placeholder embedded in a longer argument is replaced by the
 * comma-joined values.
 */
public final class CommandTemplate {

    private static final Logger log = LoggerFactory.getLogger(CommandTemplate.class);

    static final Pattern PLACEHOLDER = Pattern.compile("\\{([A-Za-z_][A-Za-z0-9_]*)}");

    private final List<String> arguments;

    private CommandTemplate(List<String> arguments) {
        if (arguments.isEmpty()) {
            throw new IllegalArgumentException("Command template must have at least one argument");
        }
        this.arguments = List.copyOf(arguments);
    }

    public static CommandTemplate of(String... arguments) {
        return new CommandTemplate(List.of(arguments));
    }

    public static CommandTemplate of(List<String> arguments) {
        return new CommandTemplate(arguments);
    }

    public static Builder builder(String executable) {
        return new Builder(executable);
    }

    public List<String> arguments() {
        return arguments;
    }

    /**
     * Placeholder names in order of first appearance.
     */
    public Set<String> placeholders() {
        var names = new LinkedHashSet<String>();
        for (String argument : arguments) {
            Matcher matcher = PLACEHOLDER.matcher(argument);
            while (matcher.find()) {
                names.add(matcher.group(1));
            }
        }
        return Collections.unmodifiableSet(names);
    }

    /**
     * Substitutes every placeholder.
     *
     * @param values bound values by placeholder name
     * @return the final argument vector
     * @throws UnresolvedPlaceholderException when a placeholder has no binding
     */
    public List<String> render(Map<String, List<String>> values) {
        Set<String> missing = new TreeSet<>(placeholders());
        missing.removeAll(values.keySet());
        if (!missing.isEmpty()) {
            throw new UnresolvedPlaceholderException(
                    "Unresolved placeholders " + missing + " in command: " + this, missing);
        }

        var argv = new ArrayList<String>(arguments.size());
        for (String argument : arguments) {
            Matcher whole = PLACEHOLDER.matcher(argument);
            if (whole.matches()) {
                argv.addAll(values.get(whole.group(1)));
                continue;
            }
            Matcher matcher = PLACEHOLDER.matcher(argument);
            var sb = new StringBuilder();
            while (matcher.find()) {
                String joined = String.join(",", values.get(matcher.group(1)));
                matcher.appendReplacement(sb, Matcher.quoteReplacement(joined));
            }
            matcher.appendTail(sb);
            argv.add(sb.toString());
        }
        log.debug("Rendered command: {}", argv);
        return argv;
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof CommandTemplate other && arguments.equals(other.arguments);
    }

    @Override
    public int hashCode() {
        return arguments.hashCode();
    }

    @Override
    public String toString() {
        return String.join(" ", arguments);
    }

    public static final class Builder {

        private final List<String> arguments = new ArrayList<>();

        private Builder(String executable) {
            arguments.add(executable);
        }

        public Builder arg(String argument) {
            arguments.add(argument);
            return this;
        }

        /** Adds a flag followed by its value. */
        public Builder option(String flag, String value) {
            arguments.add(flag);
            arguments.add(value);
            return this;
        }

        /** Adds a flag followed by a placeholder reference. */
        public Builder placeholder(String flag, String name) {
            return option(flag, "{" + name + "}");
        }

        public CommandTemplate build() {
            return new CommandTemplate(arguments);
        }
    }
}
