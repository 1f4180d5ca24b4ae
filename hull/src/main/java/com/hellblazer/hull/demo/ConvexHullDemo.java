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
package com.hellblazer.hull.demo;

import com.hellblazer.hull.ConvexHullEngine;
import com.hellblazer.hull.ConvexHullFactory.Algorithm;
import com.hellblazer.hull.HullValidator;
import com.hellblazer.hull.geometry.Point2D;
import com.hellblazer.hull.geometry.PointGenerator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;
import java.util.Random;

/**
 * Generates a random point set, runs every hull algorithm over it and logs each hull.
 * <p>
 * Usage: {@code ConvexHullDemo [count [seed]]}, by default 100 points in [-100, 100]² with seed 0x666.
 *
 * @author <a href="mailto:hal.hildebrand@gmail.com">Hal Hildebrand</a>
 */
public class ConvexHullDemo {
    public static final int    DEFAULT_COUNT = 100;
    public static final long   DEFAULT_SEED  = 0x666;
    public static final double LOW           = -100.0;
    public static final double HIGH          = 100.0;

    private static final Logger log = LoggerFactory.getLogger(ConvexHullDemo.class);

    public static void main(String[] args) {
        int status = run(args);
        if (status != 0) {
            System.exit(status);
        }
    }

    /**
     * @return process exit status
     */
    static int run(String[] args) {
        int count;
        long seed;
        try {
            count = args.length > 0 ? Integer.parseInt(args[0]) : DEFAULT_COUNT;
            seed = args.length > 1 ? Long.decode(args[1]) : DEFAULT_SEED;
        } catch (NumberFormatException e) {
            log.error("Usage: ConvexHullDemo [count [seed]]: {}", e.getMessage());
            return 1;
        }
        if (count < 3) {
            log.error("Usage: ConvexHullDemo [count [seed]]: count must be at least 3, got {}", count);
            return 1;
        }

        List<Point2D> points = PointGenerator.uniform(new Random(seed), count, LOW, HIGH);
        Map<Algorithm, List<Point2D>> hulls = new ConvexHullEngine().computeAll(points);

        hulls.forEach((algorithm, hull) -> {
            log.info("{} point count: {}", algorithm, hull.size());
            hull.forEach(p -> log.info("{}, {}", p.x, p.y));
        });

        var reference = hulls.get(Algorithm.MONOTONE_CHAIN);
        hulls.forEach((algorithm, hull) -> {
            if (!HullValidator.sameVertices(reference, hull)) {
                log.warn("{} disagrees with {}", algorithm, Algorithm.MONOTONE_CHAIN);
            }
        });
        return 0;
    }
}
