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
import static java.lang.System.arraycopy;
import static java.util.Arrays.fill;

/**
 * The ParameterVector holds one displacement vector per grid vertex in a flat array of
 * 3 * nx * ny * nz values. The displacement of the vertex with linear index v occupies elements
 * 3v (x), 3v + 1 (y) and 3v + 2 (z):
 * <br>
 * [vx111 vy111 vz111 vx211 vy211 vz211 ... vxIJK vyIJK vzIJK]
 * <p>
 * Writes are not synchronized. The owner must not modify parameters while an evaluation batch is
 * reading them.
 *
 * @since 1.0
 */
public class ParameterVector {

  private static final int DIM = GridGeometry.DIMENSION;
  private static final String[] COMPONENT_NAMES = {"vx", "vy", "vz"};

  private final GridGeometry geometry;
  private final double[] values;

  /**
   * Constructs a zero displacement for every vertex of the grid.
   *
   * @param geometry the grid.
   */
  public ParameterVector(GridGeometry geometry) {
    this.geometry = geometry;
    values = new double[geometry.getParameterCount()];
  }

  /**
   * The grid these parameters belong to.
   *
   * @return the grid geometry.
   */
  public GridGeometry getGeometry() {
    return geometry;
  }

  /**
   * Number of parameters.
   *
   * @return 3 * nx * ny * nz.
   */
  public int size() {
    return values.length;
  }

  /**
   * Get a single parameter.
   *
   * @param index 0-based parameter index.
   * @return the parameter value.
   */
  public double get(int index) {
    return values[index];
  }

  /**
   * Set a single parameter.
   *
   * @param index 0-based parameter index.
   * @param value the new value.
   */
  public void set(int index, double value) {
    values[index] = value;
  }

  /**
   * Copy of all parameters.
   *
   * @return the parameter array.
   */
  public double[] toArray() {
    return values.clone();
  }

  /**
   * Replace all parameters.
   *
   * @param newValues the new parameters (copied).
   * @throws IllegalArgumentException if the length is not 3 * nx * ny * nz.
   */
  public void setAll(double[] newValues) {
    if (newValues == null || newValues.length != values.length) {
      throw new IllegalArgumentException(format(" Expected %d parameters (found %d).",
          values.length, newValues == null ? 0 : newValues.length));
    }
    arraycopy(newValues, 0, values, 0, values.length);
  }

  /** Reset every displacement to zero. */
  public void clear() {
    fill(values, 0.0);
  }

  /**
   * Index of the first parameter of a vertex.
   *
   * @param ix 1-based x index.
   * @param iy 1-based y index.
   * @param iz 1-based z index.
   * @return 3 * vertexIndex.
   * @throws IndexOutOfBoundsException if the vertex is not on the grid.
   */
  public int parameterIndex(int ix, int iy, int iz) {
    return DIM * geometry.vertexIndex(ix, iy, iz);
  }

  /**
   * Get one component of the displacement of a vertex.
   *
   * @param ix 1-based x index.
   * @param iy 1-based y index.
   * @param iz 1-based z index.
   * @param component 0 (x), 1 (y) or 2 (z).
   * @return the displacement component.
   */
  public double getComponent(int ix, int iy, int iz, int component) {
    return values[parameterIndex(ix, iy, iz) + checkComponent(component)];
  }

  /**
   * Set one component of the displacement of a vertex.
   *
   * @param ix 1-based x index.
   * @param iy 1-based y index.
   * @param iz 1-based z index.
   * @param component 0 (x), 1 (y) or 2 (z).
   * @param value the displacement component.
   */
  public void setComponent(int ix, int iy, int iz, int component, double value) {
    values[parameterIndex(ix, iy, iz) + checkComponent(component)] = value;
  }

  /**
   * Get the displacement of a vertex.
   *
   * @param ix 1-based x index.
   * @param iy 1-based y index.
   * @param iz 1-based z index.
   * @param displacement receives the displacement vector.
   */
  public void getDisplacement(int ix, int iy, int iz, double[] displacement) {
    arraycopy(values, parameterIndex(ix, iy, iz), displacement, 0, DIM);
  }

  /**
   * Set the displacement of a vertex.
   *
   * @param ix 1-based x index.
   * @param iy 1-based y index.
   * @param iz 1-based z index.
   * @param displacement the displacement vector.
   */
  public void setDisplacement(int ix, int iy, int iz, double[] displacement) {
    if (displacement.length != DIM) {
      throw new IllegalArgumentException(
          format(" A displacement has %d components (found %d).", DIM, displacement.length));
    }
    arraycopy(displacement, 0, values, parameterIndex(ix, iy, iz), DIM);
  }

  /**
   * Displacements of all vertices, in linear vertex order.
   *
   * @return a (nx * ny * nz)-by-3 array.
   */
  public double[][] getVertexShifts() {
    int n = geometry.getVertexCount();
    double[][] shifts = new double[n][DIM];
    for (int v = 0; v < n; v++) {
      arraycopy(values, DIM * v, shifts[v], 0, DIM);
    }
    return shifts;
  }

  /**
   * Names of the parameters, such as vx_1_1_1, vy_1_1_1, vz_1_1_1, vx_2_1_1 ...
   *
   * @return the parameter names.
   */
  public String[] getParameterNames() {
    String[] names = new String[values.length];
    int index = 0;
    for (int iz = 1; iz <= geometry.getSize(2); iz++) {
      for (int iy = 1; iy <= geometry.getSize(1); iy++) {
        for (int ix = 1; ix <= geometry.getSize(0); ix++) {
          for (String component : COMPONENT_NAMES) {
            names[index++] = format("%s_%d_%d_%d", component, ix, iy, iz);
          }
        }
      }
    }
    return names;
  }

  /**
   * Read access to the parameter buffer for evaluation. Callers must not modify it.
   *
   * @return the backing array.
   */
  double[] buffer() {
    return values;
  }

  private static int checkComponent(int component) {
    if (component < 0 || component >= DIM) {
      throw new IllegalArgumentException(
          format(" Displacement component %d is not in 0..%d.", component, DIM - 1));
    }
    return component;
  }
}
