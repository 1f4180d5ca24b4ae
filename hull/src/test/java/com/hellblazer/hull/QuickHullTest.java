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
package com.hellblazer.hull;

import com.hellblazer.hull.geometry.Point2D;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Random;

import static org.junit.jupiter.api.Assertions.*;

/**
 * @author hal.hildebrand
 */
public class QuickHullTest {

    private final QuickHull quickHull = new QuickHull();

    @Test
    @DisplayName("Points on the segment between the extremes are not vertices")
    public void testDiameterPointsDropped() {
        var points = List.of(new Point2D(0, 0), new Point2D(0.5, 0.5), new Point2D(1, 0), new Point2D(1, 1),
                             new Point2D(0, 1), new Point2D(0.75, 0.75));

        assertEquals(List.of(new Point2D(0, 0), new Point2D(1, 0), new Point2D(1, 1), new Point2D(0, 1)),
                     quickHull.compute(points));
    }

    @Test
    @DisplayName("Nested partitions emit vertices in counter-clockwise order")
    public void testPartitionOrder() {
        // Regular octagon, every vertex found through a different partition
        List<Point2D> points = new ArrayList<>();
        for (int i = 0; i < 8; i++) {
            double theta = Math.toRadians(10 + 45 * i);
            points.add(new Point2D(10 * Math.cos(theta), 10 * Math.sin(theta)));
        }
        points.add(new Point2D(0, 0));
        points.add(new Point2D(1, -2));

        var hull = quickHull.compute(points);

        assertEquals(8, hull.size());
        // Leftmost octagon vertex is at 190 degrees (index 4), counter-clockwise continues with 5, 6, 7, 0..3
        for (int i = 0; i < 8; i++) {
            assertEquals(points.get((4 + i) % 8), hull.get(i), "Vertex " + i);
        }
    }

    @Test
    @DisplayName("A large hull does not exhaust the call stack")
    public void testManyHullVertices() {
        // Integer points on y = x², exact in doubles, every one a vertex of the lower chain
        int n = 10_000;
        List<Point2D> parabola = new ArrayList<>();
        for (int x = -n; x <= n; x++) {
            parabola.add(new Point2D(x, (double) x * x));
        }
        List<Point2D> points = new ArrayList<>(parabola);
        Collections.shuffle(points, new Random(0x666));

        var hull = assertDoesNotThrow(() -> quickHull.compute(points));

        assertEquals(parabola, hull);
    }

    @Test
    @DisplayName("Duplicated vertices appear once")
    public void testDuplicates() {
        var points = List.of(new Point2D(0, 0), new Point2D(2, -1), new Point2D(2, -1), new Point2D(3, 3),
                             new Point2D(0, 0), new Point2D(1, 1));

        assertEquals(List.of(new Point2D(0, 0), new Point2D(2, -1), new Point2D(3, 3)), quickHull.compute(points));
    }
}
