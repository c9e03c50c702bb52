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
 * A Transform whose mapping is controlled by a flat vector of real parameters. Optimizers update
 * the parameters between evaluation batches and use the parametric Jacobian to convert a gradient
 * with respect to transformed positions into a gradient with respect to the parameters.
 *
 * @since 1.0
 */
public interface ParametricTransform extends Transform {

  /**
   * Get a copy of the current parameters.
   *
   * @return the parameters, in transform specific order.
   */
  double[] getParameters();

  /**
   * Replace all parameters.
   *
   * @param values the new parameters.
   * @throws IllegalArgumentException if the number of values does not match the parameter count.
   */
  void setParameters(double[] values);

  /**
   * The number of parameters.
   *
   * @return the parameter count.
   */
  int getParameterCount();

  /**
   * Names of the parameters, in parameter order.
   *
   * @return parameter names.
   */
  String[] getParameterNames();

  /**
   * Derivative of the transformed position with respect to each parameter at a single point.
   *
   * @param point the input point.
   * @param jacobian receives the d-by-P sensitivity matrix.
   */
  void parametricJacobian(double[] point, double[][] jacobian);

  /**
   * Derivative of the transformed position with respect to each parameter for a batch of points.
   *
   * @param points N-by-d input points.
   * @return N-by-d-by-P sensitivity matrices.
   */
  default double[][][] parametricJacobian(double[][] points) {
    double[][][] result = new double[points.length][getDimension()][getParameterCount()];
    for (int i = 0; i < points.length; i++) {
      parametricJacobian(points[i], result[i]);
    }
    return result;
  }
}
