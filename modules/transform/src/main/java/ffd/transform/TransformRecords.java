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
 * Static methods to convert transforms to and from TransformRecords.
 *
 * @since 1.0
 */
public class TransformRecords {

  /** Do not allow instantiation. All methods are static. */
  private TransformRecords() {
  }

  /**
   * Convert a transform to a record.
   *
   * @param transform the transform.
   * @return a record holding a copy of the transform state.
   */
  public static TransformRecord toRecord(ParametricTransform transform) {
    switch (transform.getTransformType()) {
      case BSPLINE_3D:
        if (!(transform instanceof BSplineTransform3D)) {
          throw new IllegalArgumentException(format(" %s reports type %s but is not a %s.",
              transform.getClass().getSimpleName(), TransformType.BSPLINE_3D,
              BSplineTransform3D.class.getSimpleName()));
        }
        BSplineTransform3D bSpline = (BSplineTransform3D) transform;
        GridGeometry geometry = bSpline.getGridGeometry();
        return new TransformRecord(TransformType.BSPLINE_3D.getRecordName(), geometry.getSize(),
            geometry.getSpacing(), geometry.getOrigin(), bSpline.getParameters());
      default:
        throw new IllegalArgumentException(
            format(" No record format for %s.", transform.getTransformType()));
    }
  }

  /**
   * Create a transform from a record.
   *
   * @param record the record.
   * @return a new transform that behaves like the one the record was made from.
   * @throws IllegalArgumentException if the type is unknown or the record is inconsistent.
   */
  public static ParametricTransform fromRecord(TransformRecord record) {
    TransformType type = TransformType.fromRecordName(record.getType());
    switch (type) {
      case BSPLINE_3D:
        GridGeometry geometry = new GridGeometry(record.getGridSize(), record.getGridSpacing(),
            record.getGridOrigin());
        BSplineTransform3D transform = new BSplineTransform3D(geometry);
        transform.setParameters(record.getParameters());
        return transform;
      default:
        throw new IllegalArgumentException(format(" No record format for %s.", type));
    }
  }
}
