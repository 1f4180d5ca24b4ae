/**
 * Copyright (C) 2025 Hal Hildebrand. All rights reserved.
 *
 * This program is free software: you can redistribute it and/or modify it under the terms of the GNU Affero General
 * Public License as published by the Free Software Foundation, either version 3 of the License, or (at your option) any
 * later version.
 *
 * This program is distributed in the hope that it will be useful, but WITHOUT ANY WARRANTY; without even the implied
 * warranty of MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE. See the GNU Affero General Public License for more
 * details.
 *
 * You should have received a copy of the GNU Affero General Public License along with this program. If not, see
 * <http://www.gnu.org/licenses/>.
 */
package com.hellblazer.hull.geometry;

import java.util.Collection;
import java.util.Comparator;
import java.util.Iterator;
import java.util.List;

/**
 * Planar predicates and distance functions shared by the hull algorithms. Plain floating point throughout; no
 * epsilon and no exact arithmetic, so results on near degenerate input are as fragile as the underlying doubles.
 *
 * @author <a href="mailto:hal.hildebrand@gmail.com">Hal Hildebrand</a>
 */
public final class Planar {

    /**
     * Lexicographic order by x, then y. Equal points compare as 0.
     */
    public static final Comparator<Point2D> LEXICOGRAPHIC = (a, b) -> {
        if (isLeftOf(a, b)) {
            return -1;
        }
        return isLeftOf(b, a) ? 1 : 0;
    };

    private Planar() {
    }

    /**
     * The z component of the cross product of (b - a) and (c - a), i.e. twice the signed area of triangle abc.
     *
     * @return positive if c is counter-clockwise of the directed segment a→b, negative if clockwise, zero if the
     *         three points are collinear
     */
    public static double orientation(Point2D a, Point2D b, Point2D c) {
        return orientation(a.x, a.y, b.x, b.y, c.x, c.y);
    }

    public static double orientation(double ax, double ay, double bx, double by, double cx, double cy) {
        return (bx - ax) * (cy - ay) - (by - ay) * (cx - ax);
    }

    /**
     * @return true if a is lexicographically before b
     */
    public static boolean isLeftOf(Point2D a, Point2D b) {
        return a.x < b.x || (a.x == b.x && a.y < b.y);
    }

    /**
     * The Euclidean length of segment (a, b)
     */
    public static double length(Point2D a, Point2D b) {
        double dx = b.x - a.x;
        double dy = b.y - a.y;
        return Math.sqrt(dx * dx + dy * dy);
    }

    /**
     * Unsigned distance of p from the line through a and b. Not finite when a and b coincide.
     */
    public static double distanceToLine(Point2D a, Point2D b, Point2D p) {
        return Math.abs(orientation(a, b, p)) / length(a, b);
    }

    /**
     * Index of the point farthest from the line through a and b. The earliest of equally distant points wins.
     *
     * @throws IllegalArgumentException if points is empty
     */
    public static int farthestPoint(Point2D a, Point2D b, List<Point2D> points) {
        if (points.isEmpty()) {
            throw new IllegalArgumentException("No points to search");
        }
        int idxMax = 0;
        double distMax = distanceToLine(a, b, points.get(0));
        for (int i = 1; i < points.size(); i++) {
            double distCurr = distanceToLine(a, b, points.get(i));
            if (distCurr > distMax) {
                idxMax = i;
                distMax = distCurr;
            }
        }
        return idxMax;
    }

    /**
     * The lexicographically smallest point; the first one encountered on ties.
     */
    public static Point2D leftmost(Collection<Point2D> points) {
        return extreme(points, true);
    }

    /**
     * The lexicographically largest point; the first one encountered on ties.
     */
    public static Point2D rightmost(Collection<Point2D> points) {
        return extreme(points, false);
    }

    private static Point2D extreme(Collection<Point2D> points, boolean min) {
        Iterator<Point2D> it = points.iterator();
        if (!it.hasNext()) {
            throw new IllegalArgumentException("No points to search");
        }
        Point2D best = it.next();
        while (it.hasNext()) {
            Point2D p = it.next();
            if (min ? isLeftOf(p, best) : isLeftOf(best, p)) {
                best = p;
            }
        }
        return best;
    }
}
