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

import org.junit.jupiter.api.Test;

import java.util.HashSet;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for the Point2D value type.
 *
 * @author hal.hildebrand
 */
public class Point2DTest {

    @Test
    public void testConstruction() {
        var point = new Point2D(1.5, -2.25);
        assertEquals(1.5, point.x);
        assertEquals(-2.25, point.y);
    }

    @Test
    public void testOrigin() {
        var origin = Point2D.origin();
        assertEquals(0.0, origin.x);
        assertEquals(0.0, origin.y);
    }

    @Test
    public void testDistanceSquared() {
        var p1 = new Point2D(0, 0);
        var p2 = new Point2D(3, 4);
        assertEquals(25.0, p1.distanceSquared(p2));
        assertEquals(25.0, p2.distanceSquared(p1));
    }

    @Test
    public void testValueEquality() {
        var p1 = new Point2D(1, 2);
        var p2 = new Point2D(1, 2);
        var p3 = new Point2D(2, 1);

        assertEquals(p1, p2);
        assertEquals(p1.hashCode(), p2.hashCode());
        assertNotEquals(p1, p3);
        assertNotEquals(p1, null);
        assertNotEquals(p1, "Point2D(1.0, 2.0)");

        var set = new HashSet<Point2D>();
        set.add(p1);
        set.add(p2);
        set.add(p3);
        assertEquals(2, set.size());
    }

    @Test
    public void testToString() {
        assertEquals("Point2D(1.0, -2.5)", new Point2D(1, -2.5).toString());
    }
}
