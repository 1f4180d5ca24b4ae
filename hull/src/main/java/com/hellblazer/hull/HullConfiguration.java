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

/**
 * Configuration for the ConvexHullEngine.
 *
 * @author <a href="mailto:hal.hildebrand@gmail.com">Hal Hildebrand</a>
 */
public class HullConfiguration {

    private final ConvexHullFactory.Algorithm algorithm;
    private final boolean                     enableValidation;
    private final int                         minimumPoints;

    /**
     * Private constructor - use builder.
     */
    private HullConfiguration(Builder builder) {
        this.algorithm = builder.algorithm;
        this.enableValidation = builder.enableValidation;
        this.minimumPoints = builder.minimumPoints;
    }

    /**
     * Get the default configuration.
     * - Algorithm: MONOTONE_CHAIN
     * - Validation: disabled
     * - Minimum points: 3
     */
    public static HullConfiguration getDefault() {
        return new Builder().build();
    }

    /**
     * Get a configuration that checks every hull it produces.
     * - Algorithm: MONOTONE_CHAIN
     * - Validation: enabled
     */
    public static HullConfiguration getValidated() {
        return new Builder().withValidation(true).build();
    }

    public static Builder newBuilder() {
        return new Builder();
    }

    // Getters
    public ConvexHullFactory.Algorithm getAlgorithm() {
        return algorithm;
    }

    public boolean isValidationEnabled() {
        return enableValidation;
    }

    public int getMinimumPoints() {
        return minimumPoints;
    }

    @Override
    public String toString() {
        return String.format("HullConfiguration[algorithm=%s, validation=%s, minimumPoints=%d]", algorithm,
                             enableValidation, minimumPoints);
    }

    /**
     * Builder for HullConfiguration.
     */
    public static class Builder {
        private ConvexHullFactory.Algorithm algorithm        = ConvexHullFactory.DEFAULT_ALGORITHM;
        private boolean                     enableValidation = false;
        private int                         minimumPoints    = ConvexHull.MINIMUM_POINTS;

        public Builder withAlgorithm(ConvexHullFactory.Algorithm algorithm) {
            if (algorithm == null) {
                throw new IllegalArgumentException("Algorithm must not be null");
            }
            this.algorithm = algorithm;
            return this;
        }

        public Builder withValidation(boolean enable) {
            this.enableValidation = enable;
            return this;
        }

        public Builder withMinimumPoints(int minimumPoints) {
            if (minimumPoints < ConvexHull.MINIMUM_POINTS) {
                throw new IllegalArgumentException(
                "Minimum points must be at least " + ConvexHull.MINIMUM_POINTS + ": " + minimumPoints);
            }
            this.minimumPoints = minimumPoints;
            return this;
        }

        public HullConfiguration build() {
            return new HullConfiguration(this);
        }
    }
}
