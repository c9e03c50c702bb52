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

import java.io.File;
import java.io.IOException;
import java.util.Arrays;
import java.util.logging.Logger;
import java.util.stream.Collectors;

import org.apache.commons.configuration2.PropertiesConfiguration;
import org.apache.commons.configuration2.builder.FileBasedConfigurationBuilder;
import org.apache.commons.configuration2.builder.fluent.Parameters;
import org.apache.commons.configuration2.ex.ConfigurationException;
import org.apache.commons.configuration2.io.FileHandler;

/**
 * The TransformRecordFilter reads and writes TransformRecords as properties files:
 * <pre>
 * type = BSplineTransformModel3D
 * grid-size = 4,4,4
 * grid-spacing = 1.0,1.0,1.0
 * grid-origin = 0.0,0.0,0.0
 * parameters = 0.0,0.25,...
 * </pre>
 * Values are written with enough digits to be read back exactly.
 *
 * @since 1.0
 */
public class TransformRecordFilter {

  private static final Logger logger = Logger.getLogger(TransformRecordFilter.class.getName());

  static final String TYPE = "type";
  static final String GRID_SIZE = "grid-size";
  static final String GRID_SPACING = "grid-spacing";
  static final String GRID_ORIGIN = "grid-origin";
  static final String PARAMETERS = "parameters";

  private static final String DELIMITER = ",";

  /** Do not allow instantiation. All methods are static. */
  private TransformRecordFilter() {
  }

  /**
   * Write a record to a properties file.
   *
   * @param record the record.
   * @param file the destination.
   * @throws IOException if the file cannot be written.
   */
  public static void writeFile(TransformRecord record, File file) throws IOException {
    PropertiesConfiguration configuration = new PropertiesConfiguration();
    configuration.setHeader(" FFD transform record.");
    configuration.setProperty(TYPE, record.getType());
    configuration.setProperty(GRID_SIZE, Arrays.stream(record.getGridSize())
        .mapToObj(Integer::toString).collect(Collectors.joining(DELIMITER)));
    configuration.setProperty(GRID_SPACING, join(record.getGridSpacing()));
    configuration.setProperty(GRID_ORIGIN, join(record.getGridOrigin()));
    configuration.setProperty(PARAMETERS, join(record.getParameters()));
    try {
      new FileHandler(configuration).save(file);
    } catch (ConfigurationException e) {
      throw new IOException(format(" Could not write transform record to %s.", file), e);
    }
    logger.info(format(" Wrote %s to %s.", record.getType(), file));
  }

  /**
   * Read a record from a properties file.
   *
   * @param file the source.
   * @return the record.
   * @throws IOException if the file cannot be read or is not a valid record.
   */
  public static TransformRecord readFile(File file) throws IOException {
    PropertiesConfiguration configuration;
    try {
      FileBasedConfigurationBuilder<PropertiesConfiguration> builder =
          new FileBasedConfigurationBuilder<>(PropertiesConfiguration.class)
              .configure(new Parameters().properties()
                  .setFile(file)
                  .setThrowExceptionOnMissing(true)
                  .setIncludesAllowed(false));
      configuration = builder.getConfiguration();
    } catch (ConfigurationException e) {
      throw new IOException(format(" Could not read transform record from %s.", file), e);
    }

    String type = required(configuration, TYPE, file);
    try {
      int[] gridSize = Arrays.stream(split(required(configuration, GRID_SIZE, file)))
          .mapToInt(Integer::parseInt).toArray();
      double[] gridSpacing = parse(required(configuration, GRID_SPACING, file));
      double[] gridOrigin = parse(required(configuration, GRID_ORIGIN, file));
      double[] parameters = parse(required(configuration, PARAMETERS, file));
      TransformRecord record =
          new TransformRecord(type, gridSize, gridSpacing, gridOrigin, parameters);
      logger.info(format(" Read %s from %s.", type, file));
      return record;
    } catch (NumberFormatException e) {
      throw new IOException(format(" Malformed number in transform record %s.", file), e);
    }
  }

  private static String required(PropertiesConfiguration configuration, String key, File file)
      throws IOException {
    if (!configuration.containsKey(key)) {
      throw new IOException(format(" Transform record %s has no %s entry.", file, key));
    }
    return configuration.getString(key);
  }

  private static String join(double[] values) {
    return Arrays.stream(values).mapToObj(Double::toString)
        .collect(Collectors.joining(DELIMITER));
  }

  private static String[] split(String value) {
    String trimmed = value.trim();
    if (trimmed.isEmpty()) {
      return new String[0];
    }
    String[] tokens = trimmed.split(DELIMITER);
    for (int i = 0; i < tokens.length; i++) {
      tokens[i] = tokens[i].trim();
    }
    return tokens;
  }

  private static double[] parse(String value) {
    return Arrays.stream(split(value)).mapToDouble(Double::parseDouble).toArray();
  }
}
