/**
 * Copyright (C) 2025 Hal Hildebrand. All rights reserved.
 *
 * This file is part of the Planar Convex Hull library
 *
 * This program is free software: you can redistribute it and/or modify
 * it under the terms of the GNU Affero General Public License as
 * published by the Free Software Foundation, either version 3 of the
 * License, or (at your option) any later version.
 *
 * This program is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 * GNU Affero General Public License for more details.
 *
 * You should have received a copy of the GNU Affero General Public License
 * along with this program.  If not, see <http://www.gnu.org/licenses/>.
 */
package com.hellblazer.hull;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Arrays;
import java.util.Locale;

/**
 * Factory for creating ConvexHull implementations.
 *
 * @author <a href="mailto:hal.hildebrand@gmail.com">Hal Hildebrand</a>
 */
public class ConvexHullFactory {

    /**
     * System property selecting the default algorithm
     */
    public static final String ALGORITHM_PROPERTY = "hull.algorithm";

    public static final Algorithm DEFAULT_ALGORITHM = Algorithm.MONOTONE_CHAIN;

    private static final Logger log = LoggerFactory.getLogger(ConvexHullFactory.class);

    private static ConvexHull instance;

    /**
     * Algorithms available.
     */
    public enum Algorithm {
        GIFT_WRAPPING,  // O(n·h), output sensitive
        GRAHAM_SCAN,    // O(n log n), angular sort about the leftmost point
        MONOTONE_CHAIN, // O(n log n), lexicographic sort, two chains
        QUICKHULL       // expected O(n log n), O(n²) worst case
    }

    /**
     * Create a new instance of the given algorithm.
     */
    public static ConvexHull create(Algorithm algorithm) {
        switch (algorithm) {
            case GIFT_WRAPPING:
                return new GiftWrapping();
            case GRAHAM_SCAN:
                return new GrahamScan();
            case QUICKHULL:
                return new QuickHull();
            case MONOTONE_CHAIN:
            default:
                return new MonotoneChain();
        }
    }

    /**
     * Create a new instance of the algorithm named by the system property 'hull.algorithm'.
     * Valid values: gift_wrapping, graham_scan, monotone_chain, quickhull
     * Default: monotone_chain
     */
    public static ConvexHull create() {
        Algorithm algorithm = parse(System.getProperty(ALGORITHM_PROPERTY, ""));
        log.info("Using {} convex hull", algorithm);
        return create(algorithm);
    }

    /**
     * Parse an algorithm name, case insensitive. Blank or unknown names give the default.
     */
    public static Algorithm parse(String name) {
        if (name == null || name.isBlank()) {
            return DEFAULT_ALGORITHM;
        }
        try {
            return Algorithm.valueOf(name.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            log.warn("Invalid convex hull algorithm: {}. Valid values are: {}. Using {}", name,
                     Arrays.toString(Algorithm.values()), DEFAULT_ALGORITHM);
            return DEFAULT_ALGORITHM;
        }
    }

    /**
     * Get a singleton instance of the default ConvexHull.
     * The instance is created on first access and cached.
     */
    public static synchronized ConvexHull getInstance() {
        if (instance == null) {
            instance = create();
        }
        return instance;
    }

    /**
     * Force recreation of the singleton instance.
     * Useful if the algorithm property changes at runtime.
     */
    public static synchronized void reset() {
        instance = null;
    }
}
