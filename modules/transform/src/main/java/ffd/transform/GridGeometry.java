// ******************************************************************************
//
// Title:       FFD.
// Description: FFD - Free-Form Deformation Models for Image Registration.
// Copyright:   Copyright (c) The FFD Developers 2024.
//
// This file is part of FFD.
//
// FFD is free software; you can redistribute it and/or modify it
// under the terms of the GNU General Public License version 3 as published by
// the Free Software Foundation.
//
// FFD is distributed in the hope that it will be useful, but WITHOUT
// ANY WARRANTY; without even the implied warranty of MERCHANTABILITY or FITNESS
// FOR A PARTICULAR PURPOSE. See the GNU General Public License for more
// details.
//
// You should have received a copy of the GNU General Public License along with
// FFD; if not, write to the Free Software Foundation, Inc., 59 Temple
// Place, Suite 330, Boston, MA 02111-1307 USA
//
// Linking this library statically or dynamically with other modules is making a
// combined work based on this library. Thus, the terms and conditions of the
// GNU General Public License cover the whole combination.
//
// As a special exception, the copyright holders of this library give you
// permission to link this library with independent modules to produce an
// executable, regardless of the license terms of these independent modules, and
// to copy and distribute the resulting executable under terms of your choice,
// provided that you also meet, for each linked independent module, the terms
// and conditions of the license of that module. An independent module is a
// module which is not derived from or based on this library. If you modify this
// library, you may extend this exception to your version of the library, but
// you are not obligated to do so. If you do not wish to do so, delete this
// exception statement from your version.
//
// ******************************************************************************
package ffd.transform;

import static java.lang.String.format;
import static org.apache.commons.math3.util.FastMath.floor;

import java.util.Arrays;

/**
 * The GridGeometry class describes a regular 3D lattice of control vertices: the number of
 * vertices along each axis, the physical position of the first vertex and the physical spacing
 * between adjacent vertices.
 * <p>
 * Vertices are addressed with 1-based indices (1..size) along each axis. The linear vertex index
 * varies fastest along x, then y, then z.
 *
 * @since 1.0
 */
public class GridGeometry {

  /** The dimension of the grid. */
  public static final int DIMENSION = 3;

  private static final int X = 0;
  private static final int Y = 1;
  private static final int Z = 2;

  private final int[] size;
  private final double[] spacing;
  private final double[] origin;
  private final double[] inverseSpacing;
  private final int vertexCount;

  /** A single vertex at the origin with unit spacing. */
  public GridGeometry() {
    this(new int[] {1, 1, 1}, new double[] {1.0, 1.0, 1.0}, new double[] {0.0, 0.0, 0.0});
  }

  /**
   * Constructor for GridGeometry. The arrays are copied.
   *
   * @param size number of vertices along each axis (each at least 1).
   * @param spacing physical distance between adjacent vertices along each axis (each positive).
   * @param origin physical coordinates of vertex (1, 1, 1).
   * @throws IllegalArgumentException if an array is not of length 3, or a size or spacing is
   *     not positive.
   */
  public GridGeometry(int[] size, double[] spacing, double[] origin) {
    checkLength("size", size == null ? -1 : size.length);
    checkLength("spacing", spacing == null ? -1 : spacing.length);
    checkLength("origin", origin == null ? -1 : origin.length);
    long count = 1;
    for (int d = 0; d < DIMENSION; d++) {
      if (size[d] < 1) {
        throw new IllegalArgumentException(
            format(" Grid size %s must be positive along every axis.", Arrays.toString(size)));
      }
      if (!(spacing[d] > 0.0) || Double.isInfinite(spacing[d])) {
        throw new IllegalArgumentException(
            format(" Grid spacing %s must be positive along every axis.", Arrays.toString(spacing)));
      }
      if (!Double.isFinite(origin[d])) {
        throw new IllegalArgumentException(
            format(" Grid origin %s must be finite.", Arrays.toString(origin)));
      }
      count *= size[d];
    }
    // Three parameters per vertex must fit in a Java array.
    if (count * DIMENSION > Integer.MAX_VALUE - 8) {
      throw new IllegalArgumentException(
          format(" Grid size %s has too many vertices.", Arrays.toString(size)));
    }
    this.size = size.clone();
    this.spacing = spacing.clone();
    this.origin = origin.clone();
    inverseSpacing = new double[DIMENSION];
    for (int d = 0; d < DIMENSION; d++) {
      inverseSpacing[d] = 1.0 / spacing[d];
    }
    vertexCount = (int) count;
  }

  /**
   * Number of vertices along each axis.
   *
   * @return a copy of the grid size.
   */
  public int[] getSize() {
    return size.clone();
  }

  /**
   * Number of vertices along one axis.
   *
   * @param axis 0-based axis.
   * @return the number of vertices.
   */
  public int getSize(int axis) {
    return size[axis];
  }

  /**
   * Physical distance between vertices along each axis.
   *
   * @return a copy of the grid spacing.
   */
  public double[] getSpacing() {
    return spacing.clone();
  }

  /**
   * Physical distance between vertices along one axis.
   *
   * @param axis 0-based axis.
   * @return the spacing.
   */
  public double getSpacing(int axis) {
    return spacing[axis];
  }

  /**
   * Physical coordinates of the first vertex.
   *
   * @return a copy of the grid origin.
   */
  public double[] getOrigin() {
    return origin.clone();
  }

  /**
   * Physical coordinate of the first vertex along one axis.
   *
   * @param axis 0-based axis.
   * @return the origin.
   */
  public double getOrigin(int axis) {
    return origin[axis];
  }

  /**
   * Total number of vertices.
   *
   * @return nx * ny * nz.
   */
  public int getVertexCount() {
    return vertexCount;
  }

  /**
   * Number of displacement parameters carried by the grid.
   *
   * @return 3 * nx * ny * nz.
   */
  public int getParameterCount() {
    return DIMENSION * vertexCount;
  }

  /**
   * Convert a physical point to fractional, 1-based grid coordinates. No bounds are checked.
   *
   * @param point physical coordinates.
   * @param grid receives the grid coordinates (may be the input array).
   */
  public void toGridCoordinate(double[] point, double[] grid) {
    for (int d = 0; d < DIMENSION; d++) {
      grid[d] = (point[d] - origin[d]) * inverseSpacing[d] + 1.0;
    }
  }

  /**
   * Convert a physical point to fractional, 1-based grid coordinates.
   *
   * @param point physical coordinates.
   * @return the grid coordinates.
   */
  public double[] toGridCoordinate(double[] point) {
    double[] grid = new double[DIMENSION];
    toGridCoordinate(point, grid);
    return grid;
  }

  /**
   * Convert fractional, 1-based grid coordinates to a physical point.
   *
   * @param grid grid coordinates.
   * @param point receives the physical coordinates (may be the input array).
   */
  public void toPhysicalCoordinate(double[] grid, double[] point) {
    for (int d = 0; d < DIMENSION; d++) {
      point[d] = (grid[d] - 1.0) * spacing[d] + origin[d];
    }
  }

  /**
   * Check whether an index lies on the grid along one axis.
   *
   * @param axis 0-based axis.
   * @param index 1-based vertex index.
   * @return true if 1 &lt;= index &lt;= size[axis].
   */
  public boolean contains(int axis, int index) {
    return index >= 1 && index <= size[axis];
  }

  /**
   * Check whether a vertex lies on the grid.
   *
   * @param ix 1-based x index.
   * @param iy 1-based y index.
   * @param iz 1-based z index.
   * @return true if all three indices are in range.
   */
  public boolean contains(int ix, int iy, int iz) {
    return contains(X, ix) && contains(Y, iy) && contains(Z, iz);
  }

  /**
   * Linear offset of a vertex, with x varying fastest.
   *
   * @param ix 1-based x index.
   * @param iy 1-based y index.
   * @param iz 1-based z index.
   * @return the 0-based linear vertex index.
   * @throws IndexOutOfBoundsException if any index is outside [1, size].
   */
  public int vertexIndex(int ix, int iy, int iz) {
    if (!contains(ix, iy, iz)) {
      throw new IndexOutOfBoundsException(
          format(" Vertex (%d, %d, %d) is outside grid %s.", ix, iy, iz, Arrays.toString(size)));
    }
    return linearIndex(ix, iy, iz);
  }

  /**
   * Linear offset of a vertex that is known to be on the grid.
   *
   * @param ix 1-based x index.
   * @param iy 1-based y index.
   * @param iz 1-based z index.
   * @return the 0-based linear vertex index.
   */
  int linearIndex(int ix, int iy, int iz) {
    return (ix - 1) + size[X] * ((iy - 1) + size[Y] * (iz - 1));
  }

  /**
   * Physical position of a vertex.
   *
   * @param ix 1-based x index.
   * @param iy 1-based y index.
   * @param iz 1-based z index.
   * @param position receives the physical coordinates.
   * @throws IndexOutOfBoundsException if any index is outside [1, size].
   */
  public void getVertexPosition(int ix, int iy, int iz, double[] position) {
    vertexIndex(ix, iy, iz);
    position[X] = origin[X] + (ix - 1) * spacing[X];
    position[Y] = origin[Y] + (iy - 1) * spacing[Y];
    position[Z] = origin[Z] + (iz - 1) * spacing[Z];
  }

  /**
   * Physical positions of all vertices, in linear vertex order.
   *
   * @return a (nx * ny * nz)-by-3 array.
   */
  public double[][] getGridVertices() {
    double[][] vertices = new double[vertexCount][DIMENSION];
    int index = 0;
    for (int iz = 1; iz <= size[Z]; iz++) {
      for (int iy = 1; iy <= size[Y]; iy++) {
        for (int ix = 1; ix <= size[X]; ix++) {
          getVertexPosition(ix, iy, iz, vertices[index++]);
        }
      }
    }
    return vertices;
  }

  /**
   * Index of the vertex at or below a fractional grid coordinate.
   *
   * @param gridCoordinate fractional grid coordinate along one axis.
   * @return floor(gridCoordinate).
   */
  static int cell(double gridCoordinate) {
    return (int) floor(gridCoordinate);
  }

  /** {@inheritDoc} */
  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (o == null || getClass() != o.getClass()) {
      return false;
    }
    GridGeometry that = (GridGeometry) o;
    return Arrays.equals(size, that.size)
        && Arrays.equals(spacing, that.spacing)
        && Arrays.equals(origin, that.origin);
  }

  /** {@inheritDoc} */
  @Override
  public int hashCode() {
    int result = Arrays.hashCode(size);
    result = 31 * result + Arrays.hashCode(spacing);
    result = 31 * result + Arrays.hashCode(origin);
    return result;
  }

  /** {@inheritDoc} */
  @Override
  public String toString() {
    return format(" Grid size %s, spacing %s, origin %s", Arrays.toString(size),
        Arrays.toString(spacing), Arrays.toString(origin));
  }

  private static void checkLength(String name, int length) {
    if (length != DIMENSION) {
      throw new IllegalArgumentException(
          format(" Grid %s must have %d elements (found %d).", name, DIMENSION, length));
    }
  }
}
