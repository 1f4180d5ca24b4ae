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

import com.hellblazer.hull.geometry.CcwComparator;
import com.hellblazer.hull.geometry.Planar;
import com.hellblazer.hull.geometry.Point2D;

import java.util.ArrayList;
import java.util.List;

/**
 * The gift wrapping (Jarvis march) algorithm. Starting from the leftmost point, repeatedly selects the candidate that
 * has every other point to its left. O(n·h) for h hull vertices; no sorting.
 *
 * @author <a href="mailto:hal.hildebrand@gmail.com">Hal Hildebrand</a>
 */
public class GiftWrapping extends AbstractConvexHull {

    @Override
    public String getImplementationName() {
        return "GiftWrapping";
    }

    @Override
    protected List<Point2D> hull(List<Point2D> points) {
        Point2D start = Planar.leftmost(points);
        List<Point2D> hull = new ArrayList<>();

        Point2D current = start;
        do {
            hull.add(current);
            if (hull.size() > points.size()) {
                throw new IllegalStateException(
                "Gift wrapping did not close after " + points.size() + " vertices, input is degenerate");
            }

            // The most clockwise candidate as seen from the current hull point
            var order = new CcwComparator(current);
            Point2D next = null;
            for (Point2D candidate : points) {
                if (candidate.equals(current)) {
                    continue;
                }
                if (next == null || order.precedes(candidate, next)) {
                    next = candidate;
                }
            }
            if (next == null) {
                // every point coincides with the start
                break;
            }
            current = next;
        } while (!current.equals(start));

        return hull;
    }
}
