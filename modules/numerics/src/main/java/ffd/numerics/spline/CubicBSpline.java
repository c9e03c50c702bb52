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
package ffd.numerics.spline;

import static java.lang.String.format;

/**
 * Static methods to evaluate and differentiate the four pieces of the uniform cubic b-Spline.
 * <p>
 * For a fractional position u in [0, 1) inside a unit cell, piece i (i = 0..3) is the weight of
 * the control vertex at relative offset i - 1. The pieces are:
 * <br>
 * b0(u) = (1 - u)^3 / 6
 * <br>
 * b1(u) = (3u^3 - 6u^2 + 4) / 6
 * <br>
 * b2(u) = (-3u^3 + 3u^2 + 3u + 1) / 6
 * <br>
 * b3(u) = u^3 / 6
 * <p>
 * The four pieces sum to one for every u (partition of unity), and their first and second
 * derivatives sum to zero.
 *
 * @see <a href="http://www.springer.com/mathematics/analysis/book/978-0-387-95366-3"
 * target="_blank"> C. de Boor, A Practical Guide to Splines. (Springer, New York, 2001) </a>
 * @since 1.0
 */
public class CubicBSpline {

  /** Number of basis pieces, and number of control vertices supporting a point per axis. */
  public static final int ORDER = 4;

  /** Offset of piece 0 relative to the floor of the grid coordinate. */
  public static final int FIRST_OFFSET = -1;

  /** Highest derivative order that is not identically zero inside a cell. */
  public static final int MAX_DERIVATIVE = 2;

  private static final double ONE_SIXTH = 1.0 / 6.0;

  /** Do not allow instantiation of CubicBSpline. All methods are static. */
  private CubicBSpline() {
  }

  /**
   * Value of b-Spline piece i at u.
   *
   * @param i piece index (0..3).
   * @param u fractional position in the unit cell.
   * @return b_i(u).
   */
  public static double value(int i, double u) {
    switch (i) {
      case 0:
        double v = 1.0 - u;
        return ONE_SIXTH * v * v * v;
      case 1:
        return ONE_SIXTH * (u * u * (3.0 * u - 6.0) + 4.0);
      case 2:
        return ONE_SIXTH * (u * (u * (-3.0 * u + 3.0) + 3.0) + 1.0);
      case 3:
        return ONE_SIXTH * u * u * u;
      default:
        throw new IllegalArgumentException(format(" Cubic b-Spline piece %d is not in 0..3.", i));
    }
  }

  /**
   * First derivative of b-Spline piece i with respect to u.
   *
   * @param i piece index (0..3).
   * @param u fractional position in the unit cell.
   * @return db_i(u)/du.
   */
  public static double firstDerivative(int i, double u) {
    switch (i) {
      case 0:
        double v = 1.0 - u;
        return -0.5 * v * v;
      case 1:
        return u * (1.5 * u - 2.0);
      case 2:
        return u * (-1.5 * u + 1.0) + 0.5;
      case 3:
        return 0.5 * u * u;
      default:
        throw new IllegalArgumentException(format(" Cubic b-Spline piece %d is not in 0..3.", i));
    }
  }

  /**
   * Second derivative of b-Spline piece i with respect to u.
   *
   * @param i piece index (0..3).
   * @param u fractional position in the unit cell.
   * @return d2b_i(u)/du2.
   */
  public static double secondDerivative(int i, double u) {
    switch (i) {
      case 0:
        return 1.0 - u;
      case 1:
        return 3.0 * u - 2.0;
      case 2:
        return 1.0 - 3.0 * u;
      case 3:
        return u;
      default:
        throw new IllegalArgumentException(format(" Cubic b-Spline piece %d is not in 0..3.", i));
    }
  }

  /**
   * Derivative of b-Spline piece i of the requested order.
   *
   * @param i piece index (0..3).
   * @param u fractional position in the unit cell.
   * @param deriveOrder 0 = value, 1 = first derivative, 2 = second derivative.
   * @return the requested derivative.
   */
  public static double derivative(int i, double u, int deriveOrder) {
    switch (deriveOrder) {
      case 0:
        return value(i, u);
      case 1:
        return firstDerivative(i, u);
      case 2:
        return secondDerivative(i, u);
      default:
        throw new IllegalArgumentException(
            format(" Derivative order %d is not in 0..%d.", deriveOrder, MAX_DERIVATIVE));
    }
  }

  /**
   * Generate the four cubic b-Spline coefficients.
   *
   * @param u A double in the range [0.0, 1.0].
   * @param coefficients b-Spline coefficients (length at least 4).
   */
  public static void bSpline(double u, double[] coefficients) {
    for (int i = 0; i < ORDER; i++) {
      coefficients[i] = value(i, u);
    }
  }

  /**
   * Generate the cubic b-Spline coefficients and their derivatives.
   *
   * @param u A double in the range [0.0, 1.0].
   * @param deriveOrder Derivative order (0, 1 or 2).
   * @param coefficients The b-Spline coefficient array of size [4][deriveOrder + 1]; element
   *     [i][k] receives the k-th derivative of piece i.
   */
  public static void bSplineDerivatives(double u, int deriveOrder, double[][] coefficients) {
    if (deriveOrder < 0 || deriveOrder > MAX_DERIVATIVE) {
      throw new IllegalArgumentException(
          format(" Derivative order %d is not in 0..%d.", deriveOrder, MAX_DERIVATIVE));
    }
    for (int i = 0; i < ORDER; i++) {
      double[] ci = coefficients[i];
      ci[0] = value(i, u);
      if (deriveOrder > 0) {
        ci[1] = firstDerivative(i, u);
        if (deriveOrder > 1) {
          ci[2] = secondDerivative(i, u);
        }
      }
    }
  }
}
