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

import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;

import ffd.utilities.FFDTest;
import java.util.Random;

import org.junit.Before;
import org.junit.Test;

/**
 * Test derivatives with respect to the vertex displacements.
 */
public class ParametricJacobianTest extends FFDTest {

  private final Random random = new Random(99);
  private BSplineTransform3D transform;
  private double[] parameters;
  private double[][] points;

  @Before
  public void setUp() {
    transform = new BSplineTransform3D(new int[] {5, 4, 6}, new double[] {1.0, 1.5, 2.0},
        new double[] {0.5, -1.0, 2.0});
    parameters = new double[transform.getParameterCount()];
    for (int i = 0; i < parameters.length; i++) {
      parameters[i] = random.nextGaussian();
    }
    transform.setParameters(parameters);
    points = new double[25][3];
    for (double[] point : points) {
      point[0] = -1.0 + 7.0 * random.nextDouble();
      point[1] = -3.0 + 8.0 * random.nextDouble();
      point[2] = -1.0 + 14.0 * random.nextDouble();
    }
  }

  @Test
  public void testTransformIsLinearInParameters() {
    int nParams = transform.getParameterCount();
    double[][] jacobian = new double[3][nParams];
    double[] result = new double[3];
    for (double[] point : points) {
      transform.parametricJacobian(point, jacobian);
      transform.transformPoint(point, result);
      for (int a = 0; a < 3; a++) {
        double displacement = 0.0;
        for (int m = 0; m < nParams; m++) {
          displacement += jacobian[a][m] * parameters[m];
        }
        assertEquals(result[a] - point[a], displacement, 1.0e-10);
      }
    }
  }

  @Test
  public void testOnlyMatchingComponentIsNonZero() {
    int nParams = transform.getParameterCount();
    double[][] jacobian = new double[3][nParams];
    for (double[] point : points) {
      transform.parametricJacobian(point, jacobian);
      int nonZero = 0;
      for (int a = 0; a < 3; a++) {
        for (int m = 0; m < nParams; m++) {
          if (jacobian[a][m] != 0.0) {
            assertEquals(a, m % 3);
            nonZero++;
          }
        }
      }
      assertTrue(nonZero <= 3 * BSplineTransform3D.SUPPORT_SIZE);
    }
  }

  @Test
  public void testDenseMatchesSparse() {
    int[] vertices = new int[BSplineTransform3D.SUPPORT_SIZE];
    double[] weights = new double[BSplineTransform3D.SUPPORT_SIZE];
    double[][][] dense = transform.parametricJacobian(points);
    for (int n = 0; n < points.length; n++) {
      double[] expected = new double[transform.getParameterCount()];
      int count = transform.supportWeights(points[n], vertices, weights);
      for (int s = 0; s < count; s++) {
        expected[3 * vertices[s] + 1] = weights[s];
      }
      assertArrayEquals(expected, dense[n][1], 0.0);
    }
  }

  @Test
  public void testAccumulateParameterGradient() {
    int nParams = transform.getParameterCount();
    double[][] pointGradients = new double[points.length][3];
    for (double[] g : pointGradients) {
      for (int a = 0; a < 3; a++) {
        g[a] = random.nextGaussian();
      }
    }
    double[] gradient = new double[nParams];
    gradient[0] = 1.0;
    transform.accumulateParameterGradient(points, pointGradients, gradient);

    double[] expected = new double[nParams];
    expected[0] = 1.0;
    double[][] jacobian = new double[3][nParams];
    for (int n = 0; n < points.length; n++) {
      transform.parametricJacobian(points[n], jacobian);
      for (int a = 0; a < 3; a++) {
        for (int m = 0; m < nParams; m++) {
          expected[m] += pointGradients[n][a] * jacobian[a][m];
        }
      }
    }
    assertArrayEquals(expected, gradient, 1.0e-12);
  }

  @Test
  public void testZeroOutsideGrid() {
    double[][] jacobian = new double[3][transform.getParameterCount()];
    jacobian[0][0] = 5.0;
    transform.parametricJacobian(new double[] {1000.0, 0.0, 0.0}, jacobian);
    for (double[] row : jacobian) {
      assertArrayEquals(new double[row.length], row, 0.0);
    }
  }

  @Test(expected = IllegalArgumentException.class)
  public void testWrongColumnCount() {
    transform.parametricJacobian(points[0], new double[3][transform.getParameterCount() - 1]);
  }

  @Test(expected = IllegalArgumentException.class)
  public void testWrongGradientLength() {
    transform.accumulateParameterGradient(points, new double[points.length][3], new double[3]);
  }

  @Test(expected = IllegalArgumentException.class)
  public void testSmallSupportArrays() {
    transform.supportWeights(points[0], new int[8], new double[8]);
  }
}
