/**
 * Copyright (C) 2025 Hal Hildebrand. All rights reserved.
 *
 * This file is part of the Mobility registry.
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
package com.hellblazer.mobility.registry;

import javax.vecmath.Point3d;
import javax.vecmath.Tuple3d;
import java.util.Objects;

/**
 * Immutable spatial coordinates of a simulated node. Units are whatever the caller uses (typically meters).
 * <p>
 * The registry never hands out its internal storage; every Position returned is a value copy.
 *
 * @param x      x coordinate
 * @param y      y coordinate
 * @param height vertical coordinate, mapped to z when converted to vecmath types
 * @author hal.hildebrand
 */
public record Position(double x, double y, double height) {

    /**
     * Position every slot starts at.
     */
    public static final Position ORIGIN = new Position(0.0, 0.0, 0.0);

    /**
     * Create a position from a vecmath tuple (z becomes height).
     *
     * @param tuple source coordinates
     * @return position with the tuple's coordinates
     */
    public static Position of(Tuple3d tuple) {
        Objects.requireNonNull(tuple, "Tuple cannot be null");
        return new Position(tuple.x, tuple.y, tuple.z);
    }

    /**
     * Euclidean distance to another position.
     *
     * @param other the other position
     * @return sqrt(dx^2 + dy^2 + dheight^2)
     */
    public double distance(Position other) {
        return toPoint3d().distance(other.toPoint3d());
    }

    /**
     * @return a new vecmath point (x, y, height)
     */
    public Point3d toPoint3d() {
        return new Point3d(x, y, height);
    }
}
