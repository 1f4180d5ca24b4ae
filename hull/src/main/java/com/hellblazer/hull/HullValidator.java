/**
 * Copyright (C) 2025 Hal Hildebrand. All rights reserved.
 *
 * This file is part of the Planar Convex Hull library
 *
 * This program is free software: you can redistribute it and/or modify it under the terms of the GNU Affero General
 * Public License as published by the Free Software Foundation, either version 3 of the License, or (at your option) any
 * later version.
 *
 * This program is distributed in the hope that it will be useful, but WITHOUT ANY WARRANTY; without even the implied
 * warranty of MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the GNU Affero General Public License for more
 * details.
 *
 * You should have received a copy of the GNU Affero General Public License along with this program.  If not, see
 * <http://www.gnu.org/licenses/>.
 */
package com.hellblazer.hull;

import com.hellblazer.hull.geometry.Planar;
import com.hellblazer.hull.geometry.Point2D;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Checks a computed hull against its input: strict left turns at every vertex, every input point on or left of every
 * edge, and no repeated vertex.
 *
 * @author <a href="mailto:hal.hildebrand@gmail.com">Hal Hildebrand</a>
 */
public class HullValidator {

    /**
     * Validate the hull of the given points.
     *
     * @param hull   counter-clockwise hull, open (first vertex not repeated)
     * @param points the input the hull was computed from
     * @return validation result with counts
     */
    public ValidationResult validate(List<Point2D> hull, Collection<Point2D> points) {
        int n = hull.size();
        if (n < ConvexHull.MINIMUM_POINTS) {
            return new ValidationResult(n, 0, 0, 0);
        }

        int turnViolations = 0;
        for (int i = 0; i < n; i++) {
            if (Planar.orientation(hull.get(i), hull.get((i + 1) % n), hull.get((i + 2) % n)) <= 0) {
                turnViolations++;
            }
        }

        // Points outside at least one edge
        int containmentViolations = 0;
        for (Point2D p : points) {
            for (int i = 0; i < n; i++) {
                if (Planar.orientation(hull.get(i), hull.get((i + 1) % n), p) < 0) {
                    containmentViolations++;
                    break;
                }
            }
        }

        int duplicates = n - new HashSet<>(hull).size();

        return new ValidationResult(n, turnViolations, containmentViolations, duplicates);
    }

    /**
     * @return true if both hulls hold the same vertices, ignoring order and starting point
     */
    public static boolean sameVertices(List<Point2D> a, List<Point2D> b) {
        if (a.size() != b.size()) {
            return false;
        }
        Set<Point2D> vertices = new HashSet<>(a);
        return vertices.equals(new HashSet<>(b));
    }

    /**
     * Rotate a hull so that it starts at its lexicographically smallest vertex. Traversal direction is kept.
     */
    public static List<Point2D> normalize(List<Point2D> hull) {
        if (hull.isEmpty()) {
            return List.of();
        }
        int start = hull.indexOf(Planar.leftmost(hull));
        List<Point2D> rotated = new ArrayList<>(hull);
        Collections.rotate(rotated, -start);
        return rotated;
    }

    /**
     * Result of a hull validation.
     */
    public static class ValidationResult {
        public final int vertexCount;
        public final int turnViolations;
        public final int containmentViolations;
        public final int duplicateVertices;

        public ValidationResult(int vertexCount, int turnViolations, int containmentViolations,
                                int duplicateVertices) {
            this.vertexCount = vertexCount;
            this.turnViolations = turnViolations;
            this.containmentViolations = containmentViolations;
            this.duplicateVertices = duplicateVertices;
        }

        public boolean isValid() {
            return vertexCount >= ConvexHull.MINIMUM_POINTS && turnViolations == 0 && containmentViolations == 0
            && duplicateVertices == 0;
        }

        @Override
        public String toString() {
            return String.format(
            "ValidationResult[vertices=%d, turnViolations=%d, containmentViolations=%d, duplicates=%d]", vertexCount,
            turnViolations, containmentViolations, duplicateVertices);
        }
    }
}
