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

import java.util.ArrayList;
import java.util.List;
import java.util.Random;

/**
 * Random point sets for demonstrations, tests and benchmarks. Every method draws from the supplied Random so that
 * seeded runs are reproducible.
 *
 * @author <a href="mailto:hal.hildebrand@gmail.com">Hal Hildebrand</a>
 */
public final class PointGenerator {

    private PointGenerator() {
    }

    /**
     * Points uniformly distributed in the square [min, max]².
     */
    public static List<Point2D> uniform(Random random, int count, double min, double max) {
        if (count < 0) {
            throw new IllegalArgumentException("Count must be non-negative: " + count);
        }
        List<Point2D> points = new ArrayList<>(count);
        for (int i = 0; i < count; i++) {
            points.add(new Point2D(random(random, min, max), random(random, min, max)));
        }
        return points;
    }

    /**
     * Points uniformly distributed inside the disc of the given radius about the origin, by rejection.
     */
    public static List<Point2D> inDisc(Random random, int count, double radius) {
        if (count < 0) {
            throw new IllegalArgumentException("Count must be non-negative: " + count);
        }
        double radiusSquared = radius * radius;
        var origin = Point2D.origin();
        List<Point2D> points = new ArrayList<>(count);
        while (points.size() < count) {
            var p = new Point2D(random(random, -radius, radius), random(random, -radius, radius));
            if (p.distanceSquared(origin) < radiusSquared) {
                points.add(p);
            }
        }
        return points;
    }

    /**
     * Points on the circle of the given radius about the origin at random angles. Every point is a hull vertex, which
     * makes this the worst case for output sensitive algorithms.
     */
    public static List<Point2D> onCircle(Random random, int count, double radius) {
        if (count < 0) {
            throw new IllegalArgumentException("Count must be non-negative: " + count);
        }
        List<Point2D> points = new ArrayList<>(count);
        for (int i = 0; i < count; i++) {
            double theta = random.nextDouble() * 2.0 * Math.PI;
            points.add(new Point2D(radius * Math.cos(theta), radius * Math.sin(theta)));
        }
        return points;
    }

    /**
     * Generate a bounded random double
     */
    public static double random(Random random, double min, double max) {
        var result = random.nextDouble();
        if (min > max) {
            result *= min - max;
            result += max;
        } else {
            result *= max - min;
            result += min;
        }
        return result;
    }
}
