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

import ffd.utilities.FFDTest;
import org.junit.Test;

/**
 * Test the layout of the flat parameter vector.
 */
public class ParameterVectorTest extends FFDTest {

  private final GridGeometry geometry = new GridGeometry(new int[] {3, 2, 2},
      new double[] {1.0, 1.0, 1.0}, new double[3]);

  @Test
  public void testLayout() {
    ParameterVector parameters = new ParameterVector(geometry);
    assertEquals(36, parameters.size());
    assertEquals(0, parameters.parameterIndex(1, 1, 1));
    assertEquals(3, parameters.parameterIndex(2, 1, 1));
    assertEquals(9, parameters.parameterIndex(1, 2, 1));
    assertEquals(18, parameters.parameterIndex(1, 1, 2));

    parameters.setDisplacement(2, 2, 1, new double[] {1.0, 2.0, 3.0});
    assertEquals(1.0, parameters.get(12), 0.0);
    assertEquals(2.0, parameters.get(13), 0.0);
    assertEquals(3.0, parameters.get(14), 0.0);
    assertEquals(2.0, parameters.getComponent(2, 2, 1, 1), 0.0);
    assertArrayEquals(new double[] {1.0, 2.0, 3.0}, parameters.getVertexShifts()[4], 0.0);
  }

  @Test
  public void testParameterNames() {
    String[] names = new ParameterVector(geometry).getParameterNames();
    assertEquals(36, names.length);
    assertEquals("vx_1_1_1", names[0]);
    assertEquals("vy_1_1_1", names[1]);
    assertEquals("vz_1_1_1", names[2]);
    assertEquals("vx_2_1_1", names[3]);
    assertEquals("vz_3_2_2", names[35]);
  }

  @Test
  public void testSetAllAndClear() {
    ParameterVector parameters = new ParameterVector(geometry);
    double[] values = new double[36];
    for (int i = 0; i < values.length; i++) {
      values[i] = i;
    }
    parameters.setAll(values);
    values[0] = -1.0;
    assertEquals(0.0, parameters.get(0), 0.0);
    assertArrayEquals(new double[] {33.0, 34.0, 35.0},
        parameters.getVertexShifts()[11], 0.0);
    parameters.clear();
    assertArrayEquals(new double[36], parameters.toArray(), 0.0);
  }

  @Test(expected = IllegalArgumentException.class)
  public void testSetAllLengthMismatch() {
    new ParameterVector(geometry).setAll(new double[35]);
  }

  @Test(expected = IllegalArgumentException.class)
  public void testInvalidComponent() {
    new ParameterVector(geometry).setComponent(1, 1, 1, 3, 1.0);
  }

  @Test(expected = IndexOutOfBoundsException.class)
  public void testInvalidVertex() {
    new ParameterVector(geometry).getComponent(4, 1, 1, 0);
  }
}
