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
public class HullValidatorTest {

    private static final Point2D A = new Point2D(0, 0);
    private static final Point2D B = new Point2D(4, 0);
    private static final Point2D C = new Point2D(4, 4);
    private static final Point2D D = new Point2D(0, 4);
    private static final Point2D INSIDE = new Point2D(1, 2);

    private final HullValidator validator = new HullValidator();

    @Test
    public void testValidHull() {
        var result = validator.validate(List.of(A, B, C, D), List.of(A, B, C, D, INSIDE));
        assertTrue(result.isValid(), result.toString());
        assertEquals(4, result.vertexCount);
    }

    @Test
    @DisplayName("A clockwise hull fails every turn and every point lies outside some edge")
    public void testClockwise() {
        var result = validator.validate(List.of(A, D, C, B), List.of(A, B, C, D, INSIDE));
        assertFalse(result.isValid());
        assertEquals(4, result.turnViolations);
        assertEquals(5, result.containmentViolations);
    }

    @Test
    public void testMissingVertex() {
        var result = validator.validate(List.of(A, B, D), List.of(A, B, C, D, INSIDE));
        assertFalse(result.isValid());
        assertEquals(0, result.turnViolations);
        assertEquals(1, result.containmentViolations);
    }

    @Test
    public void testCollinearVertex() {
        var result = validator.validate(List.of(A, new Point2D(2, 0), B, C, D), List.of(A, B, C, D));
        assertFalse(result.isValid());
        assertEquals(1, result.turnViolations);
        assertEquals(0, result.containmentViolations);
    }

    @Test
    public void testDuplicateVertex() {
        var result = validator.validate(List.of(A, B, B, C, D), List.of(A, B, C, D));
        assertFalse(result.isValid());
        assertEquals(1, result.duplicateVertices);
    }

    @Test
    @DisplayName("Fewer than three vertices is never a valid hull")
    public void testTooSmall() {
        var result = validator.validate(List.of(A, C), List.of(A, new Point2D(2, 2), C));
        assertFalse(result.isValid());
        assertEquals(2, result.vertexCount);
    }

    @Test
    public void testSameVertices() {
        assertTrue(HullValidator.sameVertices(List.of(A, B, C, D), List.of(C, D, A, B)));
        assertTrue(HullValidator.sameVertices(List.of(A, B, C, D), List.of(A, D, C, B)));
        assertFalse(HullValidator.sameVertices(List.of(A, B, C, D), List.of(A, B, C)));
        assertFalse(HullValidator.sameVertices(List.of(A, B, C), List.of(A, B, D)));
    }

    @Test
    public void testNormalize() {
        assertEquals(List.of(A, B, C, D), HullValidator.normalize(List.of(C, D, A, B)));
        assertEquals(List.of(A, B, C, D), HullValidator.normalize(List.of(A, B, C, D)));
        assertEquals(List.of(), HullValidator.normalize(List.of()));
    }
}
