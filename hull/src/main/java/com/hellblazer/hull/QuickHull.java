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

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/**
 * Quickhull. Splits the points by the segment between the lexicographic extremes, then repeatedly partitions each
 * side about the point farthest from its base segment. Expected O(n log n), O(n²) on adversarial input.
 * <p>
 * The partitioning runs off an explicit work list rather than the call stack. Each partition step pushes, in reverse,
 * the step for the points before its farthest point, an emit of the farthest point, and the step for the points after
 * it, so popping the list yields hull vertices in counter-clockwise order.
 *
 * @author <a href="mailto:hal.hildebrand@gmail.com">Hal Hildebrand</a>
 */
public class QuickHull extends AbstractConvexHull {

    @Override
    public String getImplementationName() {
        return "QuickHull";
    }

    @Override
    protected List<Point2D> hull(List<Point2D> points) {
        Point2D a = Planar.leftmost(points);
        Point2D b = Planar.rightmost(points);

        // Points on the segment (a, b) are not hull vertices
        List<Point2D> below = new ArrayList<>();
        List<Point2D> above = new ArrayList<>();
        for (Point2D p : points) {
            double turn = Planar.orientation(a, b, p);
            if (turn < 0) {
                below.add(p);
            } else if (turn > 0) {
                above.add(p);
            }
        }

        List<Point2D> hull = new ArrayList<>();
        hull.add(a);

        Deque<Step> work = new ArrayDeque<>();
        work.push(new Partition(above, b, a));
        work.push(new Emit(b));
        work.push(new Partition(below, a, b));

        int peak = work.size();
        while (!work.isEmpty()) {
            Step step = work.pop();
            if (step instanceof Emit emit) {
                hull.add(emit.vertex());
            } else if (step instanceof Partition partition) {
                split(partition, work);
                peak = Math.max(peak, work.size());
            }
        }
        log.trace("Quickhull work list peaked at {} steps", peak);
        return hull;
    }

    /**
     * Points in the partition lie strictly right of from→to. Replace the partition with the steps for the points right
     * of from→f, the vertex f, and the points right of f→to.
     */
    private void split(Partition partition, Deque<Step> work) {
        List<Point2D> points = partition.points();
        if (points.isEmpty()) {
            return;
        }
        Point2D from = partition.from();
        Point2D to = partition.to();
        Point2D f = points.get(Planar.farthestPoint(from, to, points));

        List<Point2D> before = new ArrayList<>();
        List<Point2D> after = new ArrayList<>();
        for (Point2D p : points) {
            if (Planar.orientation(from, f, p) < 0) {
                before.add(p);
            } else if (Planar.orientation(f, to, p) < 0) {
                after.add(p);
            }
        }

        work.push(new Partition(after, f, to));
        work.push(new Emit(f));
        work.push(new Partition(before, from, f));
    }

    private sealed interface Step permits Partition, Emit {
    }

    private record Partition(List<Point2D> points, Point2D from, Point2D to) implements Step {
    }

    private record Emit(Point2D vertex) implements Step {
    }
}
