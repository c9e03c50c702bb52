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

/**
 * Supported transform variants, each tagged with the type name used in serialized records.
 *
 * @since 1.0
 */
public enum TransformType {
  BSPLINE_3D("BSplineTransformModel3D");

  private final String recordName;

  TransformType(String recordName) {
    this.recordName = recordName;
  }

  /**
   * The type name stored in a TransformRecord.
   *
   * @return the record type name.
   */
  public String getRecordName() {
    return recordName;
  }

  /**
   * Look up a TransformType from its record type name.
   *
   * @param recordName the record type name.
   * @return the matching TransformType.
   * @throws IllegalArgumentException if no transform uses the name.
   */
  public static TransformType fromRecordName(String recordName) {
    for (TransformType type : values()) {
      if (type.recordName.equals(recordName)) {
        return type;
      }
    }
    throw new IllegalArgumentException(format(" Unknown transform type %s.", recordName));
  }
}
