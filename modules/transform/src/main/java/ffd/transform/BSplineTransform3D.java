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

import static ffd.numerics.spline.CubicBSpline.FIRST_OFFSET;
import static ffd.numerics.spline.CubicBSpline.ORDER;
import static java.lang.String.format;
import static java.util.Arrays.fill;

import ffd.numerics.spline.CubicBSpline;
import ffd.utilities.FFDProperties;
import java.util.logging.Level;
import java.util.logging.Logger;

import org.apache.commons.configuration2.CompositeConfiguration;

/**
 * The BSplineTransform3D class is a free-form deformation: a cubic b-Spline displacement field
 * defined by one displacement vector at each vertex of a regular 3D grid. A point p maps to
 * <br>
 * T(p) = p + sum_v b_i(u_x) * b_j(u_y) * b_k(u_z) * d_v
 * <br>
 * where the sum runs over the 4 x 4 x 4 vertices around p, (u_x, u_y, u_z) is the position of p
 * inside its grid cell and d_v is the displacement of vertex v.
 * <p>
 * Support vertices that fall outside the grid are skipped rather than clamped or mirrored. Near
 * the grid boundary the basis weights therefore sum to less than one and the displacement is
 * under-weighted; points far outside the grid are not displaced at all.
 * <p>
 * Evaluation never modifies the transform and may run concurrently on many threads. Parameter
 * updates must not overlap an evaluation of the same instance.
 *
 * @see <a href="http://dx.doi.org/10.1109/42.796284" target="_blank"> D. Rueckert et al., Nonrigid
 * registration using free-form deformations: application to breast MR images. IEEE Trans. Med.
 * Imaging 18, 712-721 (1999) </a>
 * @since 1.0
 */
public class BSplineTransform3D implements ParametricTransform {

  private static final Logger logger = Logger.getLogger(BSplineTransform3D.class.getName());

  private static final int DIM = GridGeometry.DIMENSION;
  private static final int X = 0;
  private static final int Y = 1;
  private static final int Z = 2;

  /** Maximum number of control vertices supporting a point. */
  public static final int SUPPORT_SIZE = ORDER * ORDER * ORDER;

  private GridGeometry geometry;
  private ParameterVector parameters;
  private PointBatchExecutor batchExecutor = new PointBatchExecutor();
  private boolean boundaryReport = true;

  /** A transform on a single vertex grid, with zero displacement. */
  public BSplineTransform3D() {
    this(new GridGeometry());
  }

  /**
   * Constructor for BSplineTransform3D with zero displacement.
   *
   * @param size number of vertices along each axis.
   * @param spacing physical distance between vertices along each axis.
   * @param origin physical coordinates of the first vertex.
   */
  public BSplineTransform3D(int[] size, double[] spacing, double[] origin) {
    this(new GridGeometry(size, spacing, origin));
  }

  /**
   * Constructor for BSplineTransform3D with zero displacement.
   *
   * @param geometry the control grid.
   */
  public BSplineTransform3D(GridGeometry geometry) {
    this(geometry, null);
  }

  /**
   * Constructor for BSplineTransform3D with zero displacement.
   *
   * @param geometry the control grid.
   * @param properties configuration (may be null); reads ffd-boundary-report.
   */
  public BSplineTransform3D(GridGeometry geometry, CompositeConfiguration properties) {
    this.geometry = geometry;
    parameters = new ParameterVector(geometry);
    boundaryReport = FFDProperties.getBoolean(properties, FFDProperties.BOUNDARY_REPORT, true);
    if (logger.isLoggable(Level.FINE)) {
      logger.fine(toString());
    }
  }

  /**
   * Install the executor used by batch operations. The caller keeps ownership and closes it.
   *
   * @param batchExecutor the executor (null restores serial evaluation).
   */
  public void setBatchExecutor(PointBatchExecutor batchExecutor) {
    this.batchExecutor = batchExecutor == null ? new PointBatchExecutor() : batchExecutor;
  }

  /**
   * The executor used by batch operations.
   *
   * @return the batch executor.
   */
  public PointBatchExecutor getBatchExecutor() {
    return batchExecutor;
  }

  /**
   * The control grid.
   *
   * @return the grid geometry.
   */
  public GridGeometry getGridGeometry() {
    return geometry;
  }

  /**
   * Replace the control grid. The parameters are reallocated to zero displacement.
   *
   * @param geometry the new control grid.
   */
  public void setGridGeometry(GridGeometry geometry) {
    this.geometry = geometry;
    parameters = new ParameterVector(geometry);
    logger.fine(format(" Control grid replaced; %d parameters reset to zero.",
        parameters.size()));
  }

  /**
   * The displacement parameters, for in-place updates by the owner.
   *
   * @return the parameter vector.
   */
  public ParameterVector getParameterVector() {
    return parameters;
  }

  /** {@inheritDoc} */
  @Override
  public int getDimension() {
    return DIM;
  }

  /** {@inheritDoc} */
  @Override
  public TransformType getTransformType() {
    return TransformType.BSPLINE_3D;
  }

  /** {@inheritDoc} */
  @Override
  public double[] getParameters() {
    return parameters.toArray();
  }

  /** {@inheritDoc} */
  @Override
  public void setParameters(double[] values) {
    parameters.setAll(values);
  }

  /** {@inheritDoc} */
  @Override
  public int getParameterCount() {
    return parameters.size();
  }

  /** {@inheritDoc} */
  @Override
  public String[] getParameterNames() {
    return parameters.getParameterNames();
  }

  /**
   * Physical positions of the grid vertices, x varying fastest.
   *
   * @return a (nx * ny * nz)-by-3 array.
   */
  public double[][] getGridVertices() {
    return geometry.getGridVertices();
  }

  /**
   * Displacement of each grid vertex, x varying fastest.
   *
   * @return a (nx * ny * nz)-by-3 array.
   */
  public double[][] getVertexShifts() {
    return parameters.getVertexShifts();
  }

  public double getUx(int ix, int iy, int iz) {
    return parameters.getComponent(ix, iy, iz, X);
  }

  public double getUy(int ix, int iy, int iz) {
    return parameters.getComponent(ix, iy, iz, Y);
  }

  public double getUz(int ix, int iy, int iz) {
    return parameters.getComponent(ix, iy, iz, Z);
  }

  public void setUx(int ix, int iy, int iz, double ux) {
    parameters.setComponent(ix, iy, iz, X, ux);
  }

  public void setUy(int ix, int iy, int iz, double uy) {
    parameters.setComponent(ix, iy, iz, Y, uy);
  }

  public void setUz(int ix, int iy, int iz, double uz) {
    parameters.setComponent(ix, iy, iz, Z, uz);
  }

  /**
   * Get the displacement of a grid vertex.
   *
   * @param ix 1-based x index.
   * @param iy 1-based y index.
   * @param iz 1-based z index.
   * @param displacement receives the displacement.
   * @throws IndexOutOfBoundsException if the vertex is not on the grid.
   */
  public void getVertexDisplacement(int ix, int iy, int iz, double[] displacement) {
    parameters.getDisplacement(ix, iy, iz, displacement);
  }

  /**
   * Set the displacement of a grid vertex.
   *
   * @param ix 1-based x index.
   * @param iy 1-based y index.
   * @param iz 1-based z index.
   * @param displacement the displacement.
   * @throws IndexOutOfBoundsException if the vertex is not on the grid.
   */
  public void setVertexDisplacement(int ix, int iy, int iz, double[] displacement) {
    parameters.setDisplacement(ix, iy, iz, displacement);
  }

  /**
   * Check whether all 64 vertices supporting a point lie on the grid. Only for such points do the
   * basis weights sum to one.
   *
   * @param point physical coordinates.
   * @return true if the support is complete.
   */
  public boolean hasFullSupport(double[] point) {
    checkPoint(point);
    double[] grid = geometry.toGridCoordinate(point);
    for (int d = 0; d < DIM; d++) {
      int cell = GridGeometry.cell(grid[d]);
      if (!geometry.contains(d, cell + FIRST_OFFSET)
          || !geometry.contains(d, cell + FIRST_OFFSET + ORDER - 1)) {
        return false;
      }
    }
    return true;
  }

  /** {@inheritDoc} */
  @Override
  public void transformPoint(double[] point, double[] result) {
    checkOutput(result);
    int[] cell = new int[DIM];
    double[][][] w = new double[DIM][ORDER][1];
    locate(point, 0, cell, w);
    double[] p = parameters.buffer();

    double dx = 0.0;
    double dy = 0.0;
    double dz = 0.0;
    for (int k = 0; k < ORDER; k++) {
      int iz = cell[Z] + FIRST_OFFSET + k;
      if (!geometry.contains(Z, iz)) {
        continue;
      }
      double bz = w[Z][k][0];
      for (int j = 0; j < ORDER; j++) {
        int iy = cell[Y] + FIRST_OFFSET + j;
        if (!geometry.contains(Y, iy)) {
          continue;
        }
        double byz = w[Y][j][0] * bz;
        for (int i = 0; i < ORDER; i++) {
          int ix = cell[X] + FIRST_OFFSET + i;
          if (!geometry.contains(X, ix)) {
            continue;
          }
          double b = w[X][i][0] * byz;
          int index = DIM * geometry.linearIndex(ix, iy, iz);
          dx += b * p[index];
          dy += b * p[index + 1];
          dz += b * p[index + 2];
        }
      }
    }
    result[X] = point[X] + dx;
    result[Y] = point[Y] + dy;
    result[Z] = point[Z] + dz;
  }

  /** {@inheritDoc} */
  @Override
  public double[][] transformPoint(double[][] points) {
    checkPoints(points);
    double[][] result = new double[points.length][DIM];
    batchExecutor.execute(points.length, (start, end) -> {
      for (int n = start; n < end; n++) {
        transformPoint(points[n], result[n]);
      }
    });
    if (boundaryReport && logger.isLoggable(Level.FINE)) {
      reportBoundary(points);
    }
    return result;
  }

  /** {@inheritDoc} */
  @Override
  public void jacobianMatrix(double[] point, double[][] jacobian) {
    checkOutput(jacobian);
    int[] cell = new int[DIM];
    double[][][] w = new double[DIM][ORDER][2];
    locate(point, 1, cell, w);
    double[] p = parameters.buffer();
    double isx = 1.0 / geometry.getSpacing(X);
    double isy = 1.0 / geometry.getSpacing(Y);
    double isz = 1.0 / geometry.getSpacing(Z);

    // The transform is the identity plus the displacement.
    for (int a = 0; a < DIM; a++) {
      fill(jacobian[a], 0, DIM, 0.0);
      jacobian[a][a] = 1.0;
    }

    for (int k = 0; k < ORDER; k++) {
      int iz = cell[Z] + FIRST_OFFSET + k;
      if (!geometry.contains(Z, iz)) {
        continue;
      }
      double bz = w[Z][k][0];
      double dbz = w[Z][k][1];
      for (int j = 0; j < ORDER; j++) {
        int iy = cell[Y] + FIRST_OFFSET + j;
        if (!geometry.contains(Y, iy)) {
          continue;
        }
        double by = w[Y][j][0];
        double dby = w[Y][j][1];
        for (int i = 0; i < ORDER; i++) {
          int ix = cell[X] + FIRST_OFFSET + i;
          if (!geometry.contains(X, ix)) {
            continue;
          }
          double bx = w[X][i][0];
          double dbx = w[X][i][1];
          double gx = dbx * by * bz * isx;
          double gy = bx * dby * bz * isy;
          double gz = bx * by * dbz * isz;
          int index = DIM * geometry.linearIndex(ix, iy, iz);
          for (int a = 0; a < DIM; a++) {
            double v = p[index + a];
            double[] row = jacobian[a];
            row[X] += gx * v;
            row[Y] += gy * v;
            row[Z] += gz * v;
          }
        }
      }
    }
  }

  /** {@inheritDoc} */
  @Override
  public double[][][] jacobianMatrix(double[][] points) {
    checkPoints(points);
    double[][][] result = new double[points.length][DIM][DIM];
    batchExecutor.execute(points.length, (start, end) -> {
      for (int n = start; n < end; n++) {
        jacobianMatrix(points[n], result[n]);
      }
    });
    return result;
  }

  /**
   * Second partial derivative of each displacement component with respect to two physical axes.
   *
   * @param point physical coordinates.
   * @param axisI first differentiation axis (1, 2 or 3).
   * @param axisJ second differentiation axis (1, 2 or 3).
   * @param result receives d2u_x/dIdJ, d2u_y/dIdJ and d2u_z/dIdJ.
   * @throws IllegalArgumentException if an axis is not 1, 2 or 3.
   */
  public void secondDerivatives(double[] point, int axisI, int axisJ, double[] result) {
    checkAxis(axisI);
    checkAxis(axisJ);
    checkOutput(result);

    // Derivative order of the basis along each axis.
    int[] order = new int[DIM];
    order[axisI - 1]++;
    order[axisJ - 1]++;
    int ox = order[X];
    int oy = order[Y];
    int oz = order[Z];

    int[] cell = new int[DIM];
    double[][][] w = new double[DIM][ORDER][CubicBSpline.MAX_DERIVATIVE + 1];
    locate(point, CubicBSpline.MAX_DERIVATIVE, cell, w);
    double[] p = parameters.buffer();

    double d2x = 0.0;
    double d2y = 0.0;
    double d2z = 0.0;
    for (int k = 0; k < ORDER; k++) {
      int iz = cell[Z] + FIRST_OFFSET + k;
      if (!geometry.contains(Z, iz)) {
        continue;
      }
      double bz = w[Z][k][oz];
      for (int j = 0; j < ORDER; j++) {
        int iy = cell[Y] + FIRST_OFFSET + j;
        if (!geometry.contains(Y, iy)) {
          continue;
        }
        double byz = w[Y][j][oy] * bz;
        for (int i = 0; i < ORDER; i++) {
          int ix = cell[X] + FIRST_OFFSET + i;
          if (!geometry.contains(X, ix)) {
            continue;
          }
          double b = w[X][i][ox] * byz;
          int index = DIM * geometry.linearIndex(ix, iy, iz);
          d2x += b * p[index];
          d2y += b * p[index + 1];
          d2z += b * p[index + 2];
        }
      }
    }

    // Chain rule from grid units to physical units.
    double scale = 1.0 / (geometry.getSpacing(axisI - 1) * geometry.getSpacing(axisJ - 1));
    result[X] = d2x * scale;
    result[Y] = d2y * scale;
    result[Z] = d2z * scale;
  }

  /**
   * Second partial derivatives for a batch of points.
   *
   * @param points N-by-3 physical coordinates.
   * @param axisI first differentiation axis (1, 2 or 3).
   * @param axisJ second differentiation axis (1, 2 or 3).
   * @return N-by-3 second derivatives of the displacement components.
   * @throws IllegalArgumentException if an axis is not 1, 2 or 3.
   */
  public double[][] secondDerivatives(double[][] points, int axisI, int axisJ) {
    checkAxis(axisI);
    checkAxis(axisJ);
    checkPoints(points);
    double[][] result = new double[points.length][DIM];
    batchExecutor.execute(points.length, (start, end) -> {
      for (int n = start; n < end; n++) {
        secondDerivatives(points[n], axisI, axisJ, result[n]);
      }
    });
    return result;
  }

  /**
   * Bending energy density at a point. For each axis the three displacement components of the
   * pure second derivative along that axis are summed and squared; the three squares are summed.
   *
   * @param point physical coordinates.
   * @return the curvature operator.
   */
  public double curvatureOperator(double[] point) {
    double[] d2 = new double[DIM];
    double curvature = 0.0;
    for (int axis = 1; axis <= DIM; axis++) {
      secondDerivatives(point, axis, axis, d2);
      double sum = d2[X] + d2[Y] + d2[Z];
      curvature += sum * sum;
    }
    return curvature;
  }

  /**
   * Bending energy density for a batch of points.
   *
   * @param points N-by-3 physical coordinates.
   * @return the curvature operator of each point.
   */
  public double[] curvatureOperator(double[][] points) {
    checkPoints(points);
    double[] result = new double[points.length];
    batchExecutor.execute(points.length, (start, end) -> {
      for (int n = start; n < end; n++) {
        result[n] = curvatureOperator(points[n]);
      }
    });
    return result;
  }

  /**
   * The control vertices supporting a point and their tensor product basis weights. This is the
   * sparse form of the parametric Jacobian: parameter 3v + a has derivative weight[n] for output
   * axis a, where v = vertices[n].
   *
   * @param point physical coordinates.
   * @param vertices receives the 0-based linear indices of the in-grid support vertices (length
   *     at least 64).
   * @param weights receives the matching weights (length at least 64).
   * @return the number of support vertices on the grid.
   */
  public int supportWeights(double[] point, int[] vertices, double[] weights) {
    if (vertices.length < SUPPORT_SIZE || weights.length < SUPPORT_SIZE) {
      throw new IllegalArgumentException(
          format(" Support arrays must hold %d entries.", SUPPORT_SIZE));
    }
    int[] cell = new int[DIM];
    double[][][] w = new double[DIM][ORDER][1];
    locate(point, 0, cell, w);

    int count = 0;
    for (int k = 0; k < ORDER; k++) {
      int iz = cell[Z] + FIRST_OFFSET + k;
      if (!geometry.contains(Z, iz)) {
        continue;
      }
      double bz = w[Z][k][0];
      for (int j = 0; j < ORDER; j++) {
        int iy = cell[Y] + FIRST_OFFSET + j;
        if (!geometry.contains(Y, iy)) {
          continue;
        }
        double byz = w[Y][j][0] * bz;
        for (int i = 0; i < ORDER; i++) {
          int ix = cell[X] + FIRST_OFFSET + i;
          if (!geometry.contains(X, ix)) {
            continue;
          }
          vertices[count] = geometry.linearIndex(ix, iy, iz);
          weights[count] = w[X][i][0] * byz;
          count++;
        }
      }
    }
    return count;
  }

  /** {@inheritDoc} */
  @Override
  public void parametricJacobian(double[] point, double[][] jacobian) {
    int nParams = parameters.size();
    if (jacobian.length != DIM) {
      throw new IllegalArgumentException(
          format(" The parametric Jacobian has %d rows (found %d).", DIM, jacobian.length));
    }
    for (int a = 0; a < DIM; a++) {
      if (jacobian[a].length != nParams) {
        throw new IllegalArgumentException(format(
            " The parametric Jacobian has %d columns (found %d).", nParams, jacobian[a].length));
      }
      fill(jacobian[a], 0.0);
    }
    int[] vertices = new int[SUPPORT_SIZE];
    double[] weights = new double[SUPPORT_SIZE];
    int count = supportWeights(point, vertices, weights);
    for (int n = 0; n < count; n++) {
      int index = DIM * vertices[n];
      for (int a = 0; a < DIM; a++) {
        jacobian[a][index + a] = weights[n];
      }
    }
  }

  /** {@inheritDoc} */
  @Override
  public double[][][] parametricJacobian(double[][] points) {
    checkPoints(points);
    int nParams = parameters.size();
    double[][][] result = new double[points.length][DIM][nParams];
    batchExecutor.execute(points.length, (start, end) -> {
      for (int n = start; n < end; n++) {
        parametricJacobian(points[n], result[n]);
      }
    });
    return result;
  }

  /**
   * Chain rule from a gradient with respect to transformed positions to a gradient with respect
   * to the parameters: gradient[3v + a] += sum_n pointGradients[n][a] * weight(points[n], v).
   *
   * @param points N-by-3 physical coordinates.
   * @param pointGradients N-by-3 derivative of a scalar with respect to each transformed point.
   * @param gradient parameter gradient to accumulate into.
   */
  public void accumulateParameterGradient(double[][] points, double[][] pointGradients,
      double[] gradient) {
    checkPoints(points);
    if (pointGradients.length != points.length) {
      throw new IllegalArgumentException(format(" Expected %d point gradients (found %d).",
          points.length, pointGradients.length));
    }
    if (gradient.length != parameters.size()) {
      throw new IllegalArgumentException(format(" Expected a gradient of %d parameters (found %d).",
          parameters.size(), gradient.length));
    }
    int[] vertices = new int[SUPPORT_SIZE];
    double[] weights = new double[SUPPORT_SIZE];
    for (int n = 0; n < points.length; n++) {
      double[] g = pointGradients[n];
      if (g.length != DIM) {
        throw new IllegalArgumentException(
            format(" Point gradient %d has %d components (expected %d).", n, g.length, DIM));
      }
      int count = supportWeights(points[n], vertices, weights);
      for (int s = 0; s < count; s++) {
        int index = DIM * vertices[s];
        double w = weights[s];
        gradient[index] += g[X] * w;
        gradient[index + 1] += g[Y] * w;
        gradient[index + 2] += g[Z] * w;
      }
    }
  }

  /** {@inheritDoc} */
  @Override
  public String toString() {
    return format(" Cubic b-Spline transform (3D)\n%s\n Parameters: %d", geometry,
        parameters.size());
  }

  /**
   * Locate a point on the grid: the cell (floor of the grid coordinate) along each axis and the
   * basis coefficients for the fractional position inside the cell.
   *
   * @param point physical coordinates.
   * @param deriveOrder highest basis derivative required.
   * @param cell receives the cell index along each axis.
   * @param weights receives [axis][piece][derivative] basis coefficients.
   */
  private void locate(double[] point, int deriveOrder, int[] cell, double[][][] weights) {
    checkPoint(point);
    double[] grid = geometry.toGridCoordinate(point);
    for (int d = 0; d < DIM; d++) {
      int c = GridGeometry.cell(grid[d]);
      cell[d] = c;
      CubicBSpline.bSplineDerivatives(grid[d] - c, deriveOrder, weights[d]);
    }
  }

  private void reportBoundary(double[][] points) {
    int truncated = 0;
    for (double[] point : points) {
      if (!hasFullSupport(point)) {
        truncated++;
      }
    }
    if (truncated > 0) {
      logger.fine(format(" %d of %d points have b-Spline support truncated by the grid boundary.",
          truncated, points.length));
    }
  }

  private static void checkPoint(double[] point) {
    if (point.length != DIM) {
      throw new IllegalArgumentException(
          format(" A point has %d coordinates (found %d).", DIM, point.length));
    }
  }

  private static void checkOutput(double[] result) {
    if (result == null || result.length < DIM) {
      throw new IllegalArgumentException(format(" The result array needs %d elements (found %d).",
          DIM, result == null ? 0 : result.length));
    }
  }

  private static void checkOutput(double[][] matrix) {
    if (matrix == null || matrix.length < DIM) {
      throw new IllegalArgumentException(format(" The result matrix needs %d rows (found %d).",
          DIM, matrix == null ? 0 : matrix.length));
    }
    for (double[] row : matrix) {
      if (row == null || row.length < DIM) {
        throw new IllegalArgumentException(format(" The result matrix needs %d columns.", DIM));
      }
    }
  }

  private static void checkPoints(double[][] points) {
    for (int n = 0; n < points.length; n++) {
      if (points[n] == null || points[n].length != DIM) {
        throw new IllegalArgumentException(format(" Point %d has %d coordinates (expected %d).",
            n, points[n] == null ? 0 : points[n].length, DIM));
      }
    }
  }

  private static void checkAxis(int axis) {
    if (axis < 1 || axis > DIM) {
      throw new IllegalArgumentException(format(" Axis %d is not in 1..%d.", axis, DIM));
    }
  }
}
