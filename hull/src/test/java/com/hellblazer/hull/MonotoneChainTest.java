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

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * @author hal.hildebrand
 */
public class MonotoneChainTest {

    private static final List<Point2D> UNIT_SQUARE = List.of(new Point2D(0, 0), new Point2D(1, 0),
                                                             new Point2D(1, 1), new Point2D(0, 1));

    private final MonotoneChain monotoneChain = new MonotoneChain();

    @Test
    @DisplayName("Midpoints of every edge are excluded")
    public void testCollinearExcluded() {
        var points = List.of(new Point2D(0.5, 0), new Point2D(1, 0.5), new Point2D(0.5, 1), new Point2D(0, 0.5),
                             new Point2D(0, 0), new Point2D(1, 0), new Point2D(1, 1), new Point2D(0, 1));

        assertEquals(UNIT_SQUARE, monotoneChain.compute(points));
    }

    @Test
    @DisplayName("Duplicates collapse to a single vertex")
    public void testDuplicates() {
        var points = List.of(new Point2D(1, 1), new Point2D(0, 0), new Point2D(1, 0), new Point2D(0, 0),
                             new Point2D(1, 1), new Point2D(0, 1));

        assertEquals(UNIT_SQUARE, monotoneChain.compute(points));
    }

    @Test
    @DisplayName("Collinear input degenerates to its two extremes")
    public void testAllCollinear() {
        var points = List.of(new Point2D(2, 2), new Point2D(0, 0), new Point2D(1, 1));

        assertEquals(List.of(new Point2D(0, 0), new Point2D(2, 2)), monotoneChain.compute(points));
    }
}
