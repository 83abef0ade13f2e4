package com.instruments.core.match;

import com.instruments.api.LabelMatcher;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Segment-wise wildcard matching of dotted labels.
 *
 * <p>Rules, with {@code .} as the default separator:
 * <ul>
 *   <li>A pattern without {@code *} matches only the identical label.</li>
 *   <li>Otherwise pattern and label are split on the separator and compared
 *       segment by segment, for as many segments as the pattern has.</li>
 *   <li>A {@code *} segment matches any label segment, including a missing one.</li>
 *   <li>A segment containing {@code *} (e.g. {@code req*}) matches as a
 *       wildcard within that segment.</li>
 *   <li>Any other segment must be equal, and must exist in the label.</li>
 *   <li>Label segments beyond the pattern's length are ignored.</li>
 * </ul>
 *
 * <p>Examples: {@code foo.*} matches {@code foo.bar.tex};
 * {@code foo.*.tex} matches {@code foo.bar.tex} and {@code foo.bike.tex};
 * {@code test.event.*} matches {@code test.event} and {@code test.event.1};
 * {@code test.event} matches only {@code test.event}.
 */
public final class GlobLabelMatcher implements LabelMatcher {

    private static final String WILDCARD = "*";

    private final String separator;

    public GlobLabelMatcher() {
        this(".");
    }

    public GlobLabelMatcher(String separator) {
        if (separator == null || separator.isEmpty()) {
            throw new IllegalArgumentException("Separator cannot be empty");
        }
        this.separator = separator;
    }

    @Override
    public List<String> match(String pattern, Collection<String> labels) {
        if (pattern == null) {
            throw new IllegalArgumentException("Pattern cannot be null");
        }
        CompiledPattern compiled = compile(pattern);
        List<String> matches = new ArrayList<>();
        for (String label : labels) {
            if (compiled.matches(label)) {
                matches.add(label);
            }
        }
        return matches;
    }

    /**
     * @return whether a single label matches the pattern
     */
    public boolean matches(String pattern, String label) {
        return compile(pattern).matches(label);
    }

    private CompiledPattern compile(String pattern) {
        if (!pattern.contains(WILDCARD)) {
            return new CompiledPattern(pattern, null);
        }
        String[] parts = split(pattern);
        Object[] segments = new Object[parts.length];
        for (int i = 0; i < parts.length; i++) {
            String part = parts[i];
            if (part.equals(WILDCARD) || !part.contains(WILDCARD)) {
                segments[i] = part;
            } else {
                segments[i] = segmentRegex(part);
            }
        }
        return new CompiledPattern(pattern, segments);
    }

    private static Pattern segmentRegex(String part) {
        StringBuilder regex = new StringBuilder();
        for (String literal : part.split("\\*", -1)) {
            if (regex.length() > 0) {
                regex.append(".*");
            }
            regex.append(Pattern.quote(literal));
        }
        return Pattern.compile(regex.toString());
    }

    private String[] split(String value) {
        return value.split(Pattern.quote(separator), -1);
    }

    private final class CompiledPattern {
        private final String text;
        private final Object[] segments;

        CompiledPattern(String text, Object[] segments) {
            this.text = text;
            this.segments = segments;
        }

        boolean matches(String label) {
            if (segments == null) {
                return text.equals(label);
            }
            String[] labelParts = split(label);
            for (int i = 0; i < segments.length; i++) {
                Object segment = segments[i];
                if (WILDCARD.equals(segment)) {
                    continue;
                }
                if (i >= labelParts.length) {
                    return false;
                }
                boolean segmentMatches = segment instanceof Pattern
                        ? ((Pattern) segment).matcher(labelParts[i]).matches()
                        : segment.equals(labelParts[i]);
                if (!segmentMatches) {
                    return false;
                }
            }
            return true;
        }
    }
}
