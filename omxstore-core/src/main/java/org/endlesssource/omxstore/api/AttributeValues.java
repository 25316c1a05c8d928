package org.endlesssource.omxstore.api;

import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.function.Predicate;
import java.util.regex.Pattern;

/**
 * Helpers for reading attribute values written in the conventional grammar:
 * <pre>
 *   num        0 or a positive integer without leading zeros
 *   size       &lt;num&gt;x&lt;num&gt;
 *   ratio      &lt;num&gt;:&lt;num&gt;
 *   range&lt;T&gt;   &lt;T&gt;-&lt;T&gt;
 *   list&lt;T&gt;    comma separated &lt;T&gt;
 *   enum&lt;...&gt;  one of the listed values
 * </pre>
 * Keys prefixed {@code supports-} use 0/1 for no/yes, boolean keys prefixed
 * {@code feature-} use 0/1 for optional/required.
 * <p>
 * The store never applies these to its own data; values stay opaque there.
 */
public final class AttributeValues {
    public static final String SUPPORTS_PREFIX = "supports-";
    public static final String FEATURE_PREFIX = "feature-";

    private static final Pattern NUM = Pattern.compile("0|[1-9][0-9]*");

    private AttributeValues() {
    }

    public record Size(long width, long height) {
    }

    public record Ratio(long numerator, long denominator) {
    }

    public record Range(String lower, String upper) {
    }

    public static boolean isNum(String value) {
        return value != null && NUM.matcher(value).matches();
    }

    public static Optional<Long> parseNum(String value) {
        if (!isNum(value)) {
            return Optional.empty();
        }
        try {
            return Optional.of(Long.parseLong(value));
        } catch (NumberFormatException ex) {
            return Optional.empty();
        }
    }

    public static boolean isSize(String value) {
        return parseSize(value).isPresent();
    }

    public static Optional<Size> parseSize(String value) {
        return parsePair(value, 'x').map(pair -> new Size(pair[0], pair[1]));
    }

    public static boolean isRatio(String value) {
        return parseRatio(value).isPresent();
    }

    public static Optional<Ratio> parseRatio(String value) {
        return parsePair(value, ':').map(pair -> new Ratio(pair[0], pair[1]));
    }

    /**
     * Splits {@code lo-hi} and checks both bounds with {@code element}.
     *
     * @param value attribute value
     * @param element grammar of each bound, e.g. {@code AttributeValues::isSize}
     * @return the bounds if both sides match
     */
    public static Optional<Range> parseRange(String value, Predicate<String> element) {
        if (value == null) {
            return Optional.empty();
        }
        int dash = value.indexOf('-');
        if (dash < 0 || dash != value.lastIndexOf('-')) {
            return Optional.empty();
        }
        String lower = value.substring(0, dash);
        String upper = value.substring(dash + 1);
        if (!element.test(lower) || !element.test(upper)) {
            return Optional.empty();
        }
        return Optional.of(new Range(lower, upper));
    }

    public static boolean isRange(String value, Predicate<String> element) {
        return parseRange(value, element).isPresent();
    }

    public static boolean isEnum(String value, Collection<String> allowed) {
        return value != null && allowed.contains(value);
    }

    /**
     * Splits a {@code list<T>} value. An empty value is an empty list.
     */
    public static List<String> splitList(String value) {
        if (value == null || value.isEmpty()) {
            return List.of();
        }
        return List.of(value.split(",", -1));
    }

    public static boolean isList(String value, Predicate<String> element) {
        return value != null && splitList(value).stream().allMatch(element);
    }

    public static Optional<String> find(List<Attribute> attributes, String key) {
        for (Attribute attribute : attributes) {
            if (attribute.key().equals(key)) {
                return Optional.of(attribute.value());
            }
        }
        return Optional.empty();
    }

    /**
     * @return true when {@code supports-<name>} is present and set to 1
     */
    public static boolean isSupported(List<Attribute> attributes, String name) {
        return find(attributes, SUPPORTS_PREFIX + name).map("1"::equals).orElse(false);
    }

    /**
     * @return true when {@code feature-<name>} is present and set to 1
     */
    public static boolean isFeatureRequired(List<Attribute> attributes, String name) {
        return find(attributes, FEATURE_PREFIX + name).map("1"::equals).orElse(false);
    }

    private static Optional<long[]> parsePair(String value, char separator) {
        if (value == null) {
            return Optional.empty();
        }
        int index = value.indexOf(separator);
        if (index < 0 || index != value.lastIndexOf(separator)) {
            return Optional.empty();
        }
        Optional<Long> first = parseNum(value.substring(0, index));
        Optional<Long> second = parseNum(value.substring(index + 1));
        if (first.isEmpty() || second.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(new long[]{first.get(), second.get()});
    }
}
