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

import com.hellblazer.hull.ConvexHullFactory.Algorithm;
import com.hellblazer.hull.geometry.Point2D;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collection;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Computes hulls according to a {@link HullConfiguration}: enforces the configured minimum input size and, when
 * validation is enabled, checks each result with a {@link HullValidator}. Stateless apart from its configuration, so
 * one engine may serve concurrent callers.
 *
 * @author <a href="mailto:hal.hildebrand@gmail.com">Hal Hildebrand</a>
 */
public class ConvexHullEngine {
    private static final Logger log = LoggerFactory.getLogger(ConvexHullEngine.class);

    private final HullConfiguration configuration;
    private final ConvexHull        hull;
    private final HullValidator     validator = new HullValidator();

    public ConvexHullEngine() {
        this(HullConfiguration.getDefault());
    }

    public ConvexHullEngine(HullConfiguration configuration) {
        this.configuration = configuration;
        this.hull = ConvexHullFactory.create(configuration.getAlgorithm());
        log.debug("Created engine with {}", configuration);
    }

    /**
     * Compute the hull with the configured algorithm.
     *
     * @throws IllegalArgumentException if the input has fewer points than configured
     * @throws HullValidationException  if validation is enabled and the result is not a valid hull
     */
    public List<Point2D> compute(Collection<Point2D> points) {
        return compute(hull, points);
    }

    /**
     * Compute the hull with every algorithm, for cross validation.
     *
     * @return the hull of each algorithm, in declaration order
     */
    public Map<Algorithm, List<Point2D>> computeAll(Collection<Point2D> points) {
        Map<Algorithm, List<Point2D>> results = new EnumMap<>(Algorithm.class);
        for (Algorithm algorithm : Algorithm.values()) {
            results.put(algorithm, compute(ConvexHullFactory.create(algorithm), points));
        }
        return results;
    }

    public HullConfiguration getConfiguration() {
        return configuration;
    }

    public String getImplementationName() {
        return hull.getImplementationName();
    }

    private List<Point2D> compute(ConvexHull algorithm, Collection<Point2D> points) {
        checkSize(points);
        List<Point2D> result = algorithm.compute(points);
        if (configuration.isValidationEnabled()) {
            var validation = validator.validate(result, points);
            if (!validation.isValid()) {
                log.warn("{} produced an invalid hull: {}", algorithm.getImplementationName(), validation);
                throw new HullValidationException(
                algorithm.getImplementationName() + " produced an invalid hull: " + validation);
            }
        }
        return result;
    }

    private void checkSize(Collection<Point2D> points) {
        if (points == null) {
            throw new IllegalArgumentException("Points must not be null");
        }
        if (points.size() < configuration.getMinimumPoints()) {
            throw new IllegalArgumentException(
            "Configured to require at least " + configuration.getMinimumPoints() + " points, got " + points.size());
        }
    }
}
