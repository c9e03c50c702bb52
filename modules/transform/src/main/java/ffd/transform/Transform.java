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

/**
 * The Transform interface defines the spatial capability of a transform: mapping points and
 * computing the spatial Jacobian of the mapping.
 * <p>
 * Points are rows of a N-by-d array, where d is the dimension of the transform.
 *
 * @since 1.0
 */
public interface Transform {

  /**
   * The dimension of the space the transform operates in.
   *
   * @return the number of coordinates of each point.
   */
  int getDimension();

  /**
   * The variant of this transform.
   *
   * @return the TransformType.
   */
  TransformType getTransformType();

  /**
   * Transform a single point.
   *
   * @param point the input point.
   * @param result receives the transformed point (may be the input array).
   */
  void transformPoint(double[] point, double[] result);

  /**
   * Transform a batch of points.
   *
   * @param points N-by-d input points.
   * @return N-by-d transformed points.
   */
  default double[][] transformPoint(double[][] points) {
    double[][] result = new double[points.length][getDimension()];
    for (int i = 0; i < points.length; i++) {
      transformPoint(points[i], result[i]);
    }
    return result;
  }

  /**
   * Spatial Jacobian of the transform at a single point. Row is the output axis and column is the
   * differentiation axis.
   *
   * @param point the input point.
   * @param jacobian receives the d-by-d Jacobian matrix.
   */
  void jacobianMatrix(double[] point, double[][] jacobian);

  /**
   * Spatial Jacobian of the transform for a batch of points.
   *
   * @param points N-by-d input points.
   * @return N-by-d-by-d Jacobian matrices.
   */
  default double[][][] jacobianMatrix(double[][] points) {
    int d = getDimension();
    double[][][] result = new double[points.length][d][d];
    for (int i = 0; i < points.length; i++) {
      jacobianMatrix(points[i], result[i]);
    }
    return result;
  }
}
