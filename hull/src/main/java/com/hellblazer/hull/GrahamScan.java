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
import java.util.Collections;
import java.util.List;

/**
 * The Graham scan. Sorts the points by angle about the leftmost point, then walks them keeping only strict left
 * turns. O(n log n), dominated by the sort. Points collinear with a hull edge are discarded.
 *
 * @author <a href="mailto:hal.hildebrand@gmail.com">Hal Hildebrand</a>
 */
public class GrahamScan extends AbstractConvexHull {

    @Override
    public String getImplementationName() {
        return "GrahamScan";
    }

    @Override
    protected List<Point2D> hull(List<Point2D> points) {
        // Put our leftmost point at index 0
        Collections.swap(points, 0, indexOfLeftmost(points));
        Point2D pivot = points.get(0);

        // Sort the rest into counter-clockwise order about the pivot
        points.subList(1, points.size()).sort(new CcwComparator(pivot));

        List<Point2D> hull = new ArrayList<>();
        hull.add(points.get(0));
        hull.add(points.get(1));
        hull.add(points.get(2));

        for (int i = 3; i < points.size(); i++) {
            Point2D candidate = points.get(i);
            // Pop anything that does not make a left turn with the candidate
            while (hull.size() >= 2 && Planar.orientation(hull.get(hull.size() - 2), hull.get(hull.size() - 1),
                                                          candidate) <= 0) {
                hull.remove(hull.size() - 1);
            }
            hull.add(candidate);
        }
        return hull;
    }

    private static int indexOfLeftmost(List<Point2D> points) {
        int index = 0;
        for (int i = 1; i < points.size(); i++) {
            if (Planar.isLeftOf(points.get(i), points.get(index))) {
                index = i;
            }
        }
        return index;
    }
}
