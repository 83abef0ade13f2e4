/*
 * Copyright (c) 2025 Instruments
 * Licensed under the Apache License, Version 2.0
 */
package com.instruments.api;

import java.util.Collection;
import java.util.List;

/**
 * Pattern-based discovery of metric labels.
 */
@FunctionalInterface
public interface LabelMatcher {

    /**
     * Returns the labels matching the pattern, in the iteration order of
     * {@code labels}.
     *
     * @param pattern wildcard pattern, e.g. {@code foo.*.tex}
     * @param labels  candidate labels
     * @return matching labels, never null
     */
    List<String> match(String pattern, Collection<String> labels);
}
