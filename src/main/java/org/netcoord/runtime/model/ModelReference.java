package org.netcoord.runtime.model;

import java.util.Locale;
import java.util.Objects;

/**
 * How a model is located: either a built-in alias or a fully-qualified class name.
 */
public sealed interface ModelReference permits ModelReference.BuiltinAlias, ModelReference.QualifiedReference {

    /**
     * @return The text used to look the model up.
     */
    String value();

    /**
     * Parses a configured reference. Text containing a {@code '.'} is a class name, anything
     * else is an alias (compared case-insensitively).
     *
     * @param text The configured reference.
     * @return The parsed reference.
     * @throws IllegalArgumentException if the text is blank.
     */
    static ModelReference parse(String text) {
        if (text == null || text.isBlank()) {
            throw new IllegalArgumentException("Model reference must not be blank");
        }
        String trimmed = text.trim();
        return trimmed.indexOf('.') > 0
                ? new QualifiedReference(trimmed)
                : new BuiltinAlias(trimmed.toLowerCase(Locale.ROOT));
    }

    record BuiltinAlias(String name) implements ModelReference {
        public BuiltinAlias {
            Objects.requireNonNull(name, "name");
        }

        @Override
        public String value() {
            return name;
        }
    }

    record QualifiedReference(String className) implements ModelReference {
        public QualifiedReference {
            Objects.requireNonNull(className, "className");
        }

        @Override
        public String value() {
            return className;
        }
    }
}
