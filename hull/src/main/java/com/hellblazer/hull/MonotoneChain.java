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

import com.hellblazer.hull.geometry.Planar;
import com.hellblazer.hull.geometry.Point2D;

import java.util.ArrayList;
import java.util.List;

/**
 * Andrew's monotone chain. Sorts the points lexicographically and builds the lower and upper chains with the same
 * left turn test as the Graham scan. O(n log n).
 *
 * @author <a href="mailto:hal.hildebrand@gmail.com">Hal Hildebrand</a>
 */
public class MonotoneChain extends AbstractConvexHull {

    @Override
    public String getImplementationName() {
        return "MonotoneChain";
    }

    @Override
    protected List<Point2D> hull(List<Point2D> points) {
        points.sort(Planar.LEXICOGRAPHIC);

        List<Point2D> lower = new ArrayList<>();
        for (int i = 0; i < points.size(); i++) {
            push(lower, points.get(i));
        }

        List<Point2D> upper = new ArrayList<>();
        for (int i = points.size() - 1; i >= 0; i--) {
            push(upper, points.get(i));
        }

        // Both chains hold both endpoints, so leave them out of the upper chain
        List<Point2D> hull = new ArrayList<>(lower.size() + upper.size());
        hull.addAll(lower);
        if (upper.size() > 2) {
            hull.addAll(upper.subList(1, upper.size() - 1));
        }
        return hull;
    }

    private static void push(List<Point2D> chain, Point2D p) {
        while (chain.size() >= 2 && Planar.orientation(chain.get(chain.size() - 2), chain.get(chain.size() - 1), p)
                                    <= 0) {
            chain.remove(chain.size() - 1);
        }
        chain.add(p);
    }
}
