package com.example.jsonecho;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/** A compiled route path such as {@code /api/users/:id} or {@code /api/users/{id}}. */
public final class PathPattern {
    private final List<Segment> segments;
    private final int literalPrefixLength;
    private final String canonical;

    private PathPattern(List<Segment> segments) {
        this.segments = Collections.unmodifiableList(segments);
        this.literalPrefixLength = countLiteralPrefix(segments);
        this.canonical = render(segments);
    }

    /**
     * @throws IllegalArgumentException on an unmatched brace, an empty parameter name or a path that
     *                                  does not start with {@code /}
     */
    public static PathPattern compile(String template) {
        String trimmed = template == null ? "" : template.trim();
        if (!trimmed.startsWith("/")) {
            throw new IllegalArgumentException("Path must start with '/': " + template);
        }
        List<Segment> segments = new ArrayList<>();
        for (String part : trimmed.split("/")) {
            if (part.isEmpty()) {
                continue;
            }
            segments.add(parseSegment(part, template));
        }
        return new PathPattern(segments);
    }

    private static Segment parseSegment(String part, String template) {
        if (part.startsWith(":")) {
            return Segment.parameter(requireName(part.substring(1), template));
        }
        if (part.startsWith("{")) {
            if (!part.endsWith("}")) {
                throw new IllegalArgumentException("Unmatched '{' in path template: " + template);
            }
            return Segment.parameter(requireName(part.substring(1, part.length() - 1), template));
        }
        if (part.indexOf('{') >= 0 || part.indexOf('}') >= 0) {
            throw new IllegalArgumentException("Braces must enclose a whole segment: " + template);
        }
        return Segment.literal(part);
    }

    private static String requireName(String name, String template) {
        if (name.isBlank()) {
            throw new IllegalArgumentException("Empty parameter name in path template: " + template);
        }
        return name.trim();
    }

    /**
     * Matches a concrete request path segment by segment and returns the bound parameters, in the
     * order they appear in the pattern.
     */
    public Optional<Map<String, String>> match(String concretePath) {
        if (concretePath == null) {
            return Optional.empty();
        }
        List<String> parts = splitConcrete(concretePath);
        if (parts.size() != segments.size()) {
            return Optional.empty();
        }
        Map<String, String> params = new LinkedHashMap<>();
        for (int i = 0; i < segments.size(); i++) {
            Segment segment = segments.get(i);
            String value = parts.get(i);
            if (segment.parameter()) {
                params.put(segment.value(), value);
            } else if (!segment.value().equals(value)) {
                return Optional.empty();
            }
        }
        return Optional.of(params);
    }

    private static List<String> splitConcrete(String path) {
        List<String> parts = new ArrayList<>();
        for (String part : path.split("/")) {
            if (!part.isEmpty()) {
                parts.add(part);
            }
        }
        return parts;
    }

    /** Number of literal segments before the first parameter; higher means more specific. */
    public int literalPrefixLength() {
        return literalPrefixLength;
    }

    public boolean hasParameters() {
        return segments.stream().anyMatch(Segment::parameter);
    }

    public List<String> parameterNames() {
        return segments.stream().filter(Segment::parameter).map(Segment::value).toList();
    }

    private static int countLiteralPrefix(List<Segment> segments) {
        int count = 0;
        for (Segment segment : segments) {
            if (segment.parameter()) {
                break;
            }
            count++;
        }
        return count;
    }

    private static String render(List<Segment> segments) {
        if (segments.isEmpty()) {
            return "/";
        }
        StringBuilder builder = new StringBuilder();
        for (Segment segment : segments) {
            builder.append('/');
            if (segment.parameter()) {
                builder.append(':');
            }
            builder.append(segment.value());
        }
        return builder.toString();
    }

    @Override
    public boolean equals(Object other) {
        return other instanceof PathPattern pattern && canonical.equals(pattern.canonical);
    }

    @Override
    public int hashCode() {
        return canonical.hashCode();
    }

    @Override
    public String toString() {
        return canonical;
    }

    private record Segment(String value, boolean parameter) {
        static Segment literal(String value) {
            return new Segment(value, false);
        }

        static Segment parameter(String name) {
            return new Segment(name, true);
        }
    }
}
