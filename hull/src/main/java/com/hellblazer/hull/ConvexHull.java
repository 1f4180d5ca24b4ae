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

import com.hellblazer.hull.geometry.Point2D;

import java.util.Collection;
import java.util.List;

/**
 * A convex hull algorithm over a finite planar point set.
 * <p>
 * The hull is returned as an open, counter-clockwise boundary: the polygon interior lies to the left of every directed
 * edge, and the first vertex is not repeated at the end. Implementations hold no mutable state between calls, never
 * modify the caller's collection, and return a fresh list.
 * <p>
 * Input is expected in general position. Duplicate or collinear points produce implementation specific results.
 *
 * @author <a href="mailto:hal.hildebrand@gmail.com">Hal Hildebrand</a>
 */
public interface ConvexHull {

    /**
     * Smallest point set accepted by every implementation.
     */
    int MINIMUM_POINTS = 3;

    /**
     * Compute the hull of the given points.
     *
     * @param points at least three points with finite coordinates
     * @return the hull vertices in counter-clockwise order
     * @throws IllegalArgumentException if points is null, contains null, or has fewer than three elements
     */
    List<Point2D> compute(Collection<Point2D> points);

    /**
     * Get the implementation name for debugging/logging.
     */
    String getImplementationName();
}
