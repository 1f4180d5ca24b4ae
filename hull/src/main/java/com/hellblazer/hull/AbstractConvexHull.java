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
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;

/**
 * Shared precondition checks and working copy handling for the hull algorithms. Subclasses receive a private,
 * mutable copy of the input that they are free to reorder.
 *
 * @author <a href="mailto:hal.hildebrand@gmail.com">Hal Hildebrand</a>
 */
public abstract class AbstractConvexHull implements ConvexHull {

    protected final Logger log = LoggerFactory.getLogger(getClass());

    @Override
    public final List<Point2D> compute(Collection<Point2D> points) {
        List<Point2D> working = workingCopy(points);
        List<Point2D> hull = hull(working);
        if (log.isDebugEnabled()) {
            log.debug("{} hull of {} points has {} vertices", getImplementationName(), points.size(), hull.size());
        }
        return Collections.unmodifiableList(hull);
    }

    @Override
    public String toString() {
        return getImplementationName();
    }

    /**
     * Compute the counter-clockwise hull of the working set.
     *
     * @param points private copy of the input, at least {@link #MINIMUM_POINTS} non null points
     * @return a new list holding the hull
     */
    protected abstract List<Point2D> hull(List<Point2D> points);

    static List<Point2D> workingCopy(Collection<Point2D> points) {
        if (points == null) {
            throw new IllegalArgumentException("Points must not be null");
        }
        if (points.size() < MINIMUM_POINTS) {
            throw new IllegalArgumentException(
            "A convex hull requires at least " + MINIMUM_POINTS + " points, got " + points.size());
        }
        List<Point2D> working = new ArrayList<>(points.size());
        for (Point2D p : points) {
            if (p == null) {
                throw new IllegalArgumentException("Points must not contain null");
            }
            working.add(p);
        }
        return working;
    }
}
