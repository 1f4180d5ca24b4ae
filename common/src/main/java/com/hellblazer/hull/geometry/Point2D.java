/*
 * Copyright (c) 2025 Hal Hildebrand. All rights reserved.
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

package com.hellblazer.hull.geometry;

/**
 * Immutable 2D point with double coordinates.
 * Points have no identity beyond their coordinate values.
 *
 * @author hal.hildebrand
 */
public final class Point2D {

    /** X coordinate */
    public final double x;

    /** Y coordinate */
    public final double y;

    /**
     * Create a new 2D point.
     *
     * @param x X coordinate
     * @param y Y coordinate
     */
    public Point2D(double x, double y) {
        this.x = x;
        this.y = y;
    }

    /**
     * Create a point at the origin (0, 0).
     *
     * @return Point at origin
     */
    public static Point2D origin() {
        return new Point2D(0, 0);
    }

    /**
     * Calculate squared Euclidean distance to another point.
     * Avoids sqrt() for performance.
     *
     * @param other Other point
     * @return Squared distance
     */
    public double distanceSquared(Point2D other) {
        double dx = x - other.x;
        double dy = y - other.y;
        return dx * dx + dy * dy;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof Point2D other)) return false;
        return Double.compare(x, other.x) == 0 && Double.compare(y, other.y) == 0;
    }

    @Override
    public int hashCode() {
        return 31 * Double.hashCode(x) + Double.hashCode(y);
    }

    @Override
    public String toString() {
        return String.format("Point2D(%s, %s)", x, y);
    }
}
