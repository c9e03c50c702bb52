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

import java.util.Arrays;
import java.util.Objects;

/**
 * A plain record of the state of a transform: its type name, the control grid and the parameter
 * vector. Arrays are copied on the way in and out.
 *
 * @since 1.0
 */
public final class TransformRecord {

  private final String type;
  private final int[] gridSize;
  private final double[] gridSpacing;
  private final double[] gridOrigin;
  private final double[] parameters;

  /**
   * Constructor for TransformRecord.
   *
   * @param type the transform type name.
   * @param gridSize number of vertices along each axis.
   * @param gridSpacing distance between vertices along each axis.
   * @param gridOrigin position of the first vertex.
   * @param parameters the parameter vector.
   */
  public TransformRecord(String type, int[] gridSize, double[] gridSpacing, double[] gridOrigin,
      double[] parameters) {
    this.type = Objects.requireNonNull(type, " A transform record needs a type.");
    this.gridSize = Objects.requireNonNull(gridSize, " A transform record needs a grid size.")
        .clone();
    this.gridSpacing = Objects.requireNonNull(gridSpacing,
        " A transform record needs a grid spacing.").clone();
    this.gridOrigin = Objects.requireNonNull(gridOrigin,
        " A transform record needs a grid origin.").clone();
    this.parameters = Objects.requireNonNull(parameters,
        " A transform record needs parameters.").clone();
  }

  public String getType() {
    return type;
  }

  public int[] getGridSize() {
    return gridSize.clone();
  }

  public double[] getGridSpacing() {
    return gridSpacing.clone();
  }

  public double[] getGridOrigin() {
    return gridOrigin.clone();
  }

  public double[] getParameters() {
    return parameters.clone();
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
    TransformRecord that = (TransformRecord) o;
    return type.equals(that.type)
        && Arrays.equals(gridSize, that.gridSize)
        && Arrays.equals(gridSpacing, that.gridSpacing)
        && Arrays.equals(gridOrigin, that.gridOrigin)
        && Arrays.equals(parameters, that.parameters);
  }

  /** {@inheritDoc} */
  @Override
  public int hashCode() {
    int result = type.hashCode();
    result = 31 * result + Arrays.hashCode(gridSize);
    result = 31 * result + Arrays.hashCode(gridSpacing);
    result = 31 * result + Arrays.hashCode(gridOrigin);
    result = 31 * result + Arrays.hashCode(parameters);
    return result;
  }

  /** {@inheritDoc} */
  @Override
  public String toString() {
    return format(" %s record: grid size %s, spacing %s, origin %s, %d parameters", type,
        Arrays.toString(gridSize), Arrays.toString(gridSpacing), Arrays.toString(gridOrigin),
        parameters.length);
  }
}
