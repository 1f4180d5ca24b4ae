/**
 * Copyright (C) 2025 Hal Hildebrand. All rights reserved.
 *
 * This program is free software: you can redistribute it and/or modify it under
 * the terms of the GNU Affero General Public License as published by the Free
 * Software Foundation, either version 3 of the License, or (at your option) any
 * later version.
 *
 * This program is distributed in the hope that it will be useful, but WITHOUT
 * ANY WARRANTY; without even the implied warranty of MERCHANTABILITY or FITNESS
 * FOR A PARTICULAR PURPOSE. See the GNU Affero General Public License for more
 * details.
 *
 * You should have received a copy of the GNU Affero General Public License
 * along with this program. If not, see <http://www.gnu.org/licenses/>.
 */
package com.hellblazer.hull.geometry;

import java.util.Comparator;

/**
 * A comparator that orders points by increasing counter-clockwise angle about a fixed pivot.
 *
 * Point b precedes point c when c lies counter-clockwise of the ray from the pivot through b. The ordering is only
 * consistent when every compared point lies in an open half-plane bounded by a line through the pivot, as is the case
 * when the pivot is the lexicographically smallest point of the set. Points collinear with the pivot, and points equal
 * to it, compare as 0; the caller's sort decides their order.
 *
 * The pivot coordinates are copied at construction.
 *
 * @author <a href="mailto:hal.hildebrand@gmail.com">Hal Hildebrand</a>
 */
public class CcwComparator implements Comparator<Point2D> {

    private final double pivotX;
    private final double pivotY;

    public CcwComparator(Point2D pivot) {
        this(pivot.x, pivot.y);
    }

    public CcwComparator(double pivotX, double pivotY) {
        this.pivotX = pivotX;
        this.pivotY = pivotY;
    }

    @Override
    public int compare(Point2D b, Point2D c) {
        double turn = Planar.orientation(pivotX, pivotY, b.x, b.y, c.x, c.y);
        if (turn > 0) {
            return -1;
        }
        return turn < 0 ? 1 : 0;
    }

    /**
     * @return true if b strictly precedes c
     */
    public boolean precedes(Point2D b, Point2D c) {
        return compare(b, c) < 0;
    }
}
