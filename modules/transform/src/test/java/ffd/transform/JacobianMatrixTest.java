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

import static org.junit.Assert.assertEquals;

import ffd.utilities.FFDTest;
import java.util.Arrays;
import java.util.Collection;
import java.util.Random;

import org.junit.Before;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.Parameterized;
import org.junit.runners.Parameterized.Parameters;

/**
 * Compare analytic spatial derivatives to finite differences for several grid geometries.
 */
@RunWith(Parameterized.class)
public class JacobianMatrixTest extends FFDTest {

  private static final double step = 1.0e-5;
  private static final double tolerance = 1.0e-6;

  private final String info;
  private final GridGeometry geometry;
  private final long seed;
  private BSplineTransform3D transform;
  private double[][] points;

  public JacobianMatrixTest(String info, int[] size, double[] spacing, double[] origin,
      long seed) {
    this.info = info;
    this.geometry = new GridGeometry(size, spacing, origin);
    this.seed = seed;
  }

  @Parameters
  public static Collection<Object[]> data() {
    return Arrays.asList(new Object[][] {
        {"Unit spacing", new int[] {6, 6, 6}, new double[] {1.0, 1.0, 1.0},
            new double[] {0.0, 0.0, 0.0}, 11L},
        {"Anisotropic spacing", new int[] {5, 7, 6}, new double[] {2.0, 0.5, 1.25},
            new double[] {-3.0, 1.0, 4.0}, 12L},
        {"Coarse grid", new int[] {4, 4, 4}, new double[] {10.0, 12.0, 8.0},
            new double[] {100.0, -50.0, 0.0}, 13L}
    });
  }

  @Before
  public void setUp() {
    Random random = new Random(seed);
    transform = new BSplineTransform3D(geometry);
    double[] parameters = new double[transform.getParameterCount()];
    for (int i = 0; i < parameters.length; i++) {
      parameters[i] = random.nextDouble() * 2.0 - 1.0;
    }
    transform.setParameters(parameters);

    // Sample the grid box and a margin around it, where the support is truncated.
    points = new double[40][3];
    for (double[] point : points) {
      double[] grid = new double[3];
      for (int d = 0; d < 3; d++) {
        grid[d] = (geometry.getSize(d) + 2.0) * random.nextDouble();
      }
      geometry.toPhysicalCoordinate(grid, point);
    }
  }

  @Test
  public void testJacobianMatrix() {
    double[][] jacobian = new double[3][3];
    double[] plus = new double[3];
    double[] minus = new double[3];
    for (double[] point : points) {
      transform.jacobianMatrix(point, jacobian);
      for (int b = 0; b < 3; b++) {
        double h = step * geometry.getSpacing(b);
        double[] x = point.clone();
        x[b] = point[b] + h;
        transform.transformPoint(x, plus);
        x[b] = point[b] - h;
        transform.transformPoint(x, minus);
        for (int a = 0; a < 3; a++) {
          double fd = (plus[a] - minus[a]) / (2.0 * h);
          assertEquals(info + " dT" + a + "/dx" + b, fd, jacobian[a][b], tolerance);
        }
      }
    }
  }

  @Test
  public void testBatchMatchesSinglePoint() {
    double[][][] batch = transform.jacobianMatrix(points);
    double[][] jacobian = new double[3][3];
    for (int n = 0; n < points.length; n++) {
      transform.jacobianMatrix(points[n], jacobian);
      for (int a = 0; a < 3; a++) {
        for (int b = 0; b < 3; b++) {
          assertEquals(info, jacobian[a][b], batch[n][a][b], 0.0);
        }
      }
    }
  }
}
