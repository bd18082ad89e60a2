package io.gdcc.repository.collections.repository;

import io.gdcc.repository.collections.error.InvalidArgumentException;
import io.gdcc.repository.collections.rels.Vocabulary;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/** Persistent identifier of a repository object, {@code namespace:localname}. */
public record Pid(String namespace, String localName) {
    private static final Pattern PID_PATTERN =
            Pattern.compile("^([A-Za-z0-9.-]+):((?:[A-Za-z0-9.~_-]|%[0-9A-F]{2})+)$");

    /**
     * Parses a PID, accepting the {@code info:fedora/} URI form as well.
     *
     * @throws InvalidArgumentException when the value is not a well-formed PID
     */
    public static Pid parse(String value) {
        if (value == null) {
            throw new InvalidArgumentException("PID must not be null");
        }
        Matcher matcher = PID_PATTERN.matcher(Vocabulary.toPid(value.trim()));
        if (!matcher.matches()) {
            throw new InvalidArgumentException("Malformed PID: '" + value + "'");
        }
        return new Pid(matcher.group(1), matcher.group(2));
    }

    public static boolean isValid(String value) {
        return value != null && PID_PATTERN.matcher(Vocabulary.toPid(value.trim())).matches();
    }

    public String uri() {
        return Vocabulary.FEDORA_URI_PREFIX + this;
    }

    @Override
    public String toString() {
        return namespace + ":" + localName;
    }
}
