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
package ffd.utilities;

import static java.lang.String.format;

import java.io.File;
import java.util.Arrays;
import java.util.Iterator;
import java.util.logging.Level;
import java.util.logging.Logger;

import org.apache.commons.configuration2.CompositeConfiguration;
import org.apache.commons.configuration2.PropertiesConfiguration;
import org.apache.commons.configuration2.SystemConfiguration;
import org.apache.commons.configuration2.builder.FileBasedConfigurationBuilder;
import org.apache.commons.configuration2.builder.fluent.Parameters;
import org.apache.commons.configuration2.ex.ConfigurationException;
import org.apache.commons.io.FilenameUtils;

/**
 * Loads the layered configuration used by FFD.
 *
 * @since 1.0
 */
public class FFDProperties {

  private static final Logger logger = Logger.getLogger(FFDProperties.class.getName());

  /** Number of threads used to evaluate a batch of points. */
  public static final String THREADS = "ffd-threads";

  /** Batches smaller than this are evaluated on the calling thread. */
  public static final String PARALLEL_THRESHOLD = "ffd-parallel-threshold";

  /** Report points whose b-Spline support is truncated by the grid boundary. */
  public static final String BOUNDARY_REPORT = "ffd-boundary-report";

  /** Environment variable naming a system wide property file. */
  public static final String ENVIRONMENT_VARIABLE = "FFD_PROPERTIES";

  /** Do not allow instantiation. All methods are static. */
  private FFDProperties() {
  }

  /**
   * Sets up configuration properties in the following precedence order:
   * <p>
   * 1.) Java system properties a.) -Dkey=value from the Java command line b.)
   * System.setProperty("key","value") within Java code.
   * <p>
   * 2.) Transform specific properties (for example transform.properties). If the file itself is a
   * properties file it is used directly.
   * <p>
   * 3.) User specific properties (~/.ffd/ffd.properties)
   * <p>
   * 4.) System wide properties (file defined by environment variable FFD_PROPERTIES)
   *
   * @param file a file whose basename locates a property file (may be null).
   * @return a {@link org.apache.commons.configuration2.CompositeConfiguration} object.
   * @since 1.0
   */
  public static CompositeConfiguration loadProperties(File file) {

    CompositeConfiguration properties = new CompositeConfiguration();

    // JVM system properties are read first.
    PropertiesConfiguration systemConfiguration = new PropertiesConfiguration();
    systemConfiguration.append(new SystemConfiguration());
    systemConfiguration.setHeader("JVM system properties (i.e. command line -Dkey=value pairs).");
    properties.addConfiguration(systemConfiguration);

    // Transform specific options are 2nd.
    if (file != null) {
      File propertyFile = locatePropertyFile(file);
      if (propertyFile != null) {
        addPropertyFile(properties, propertyFile, "Transform properties");
      }
    }

    // User specific options are 3rd.
    String filename = System.getProperty("user.home") + File.separator + ".ffd" + File.separator
        + "ffd.properties";
    File userPropFile = new File(filename);
    if (userPropFile.exists() && userPropFile.canRead()) {
      addPropertyFile(properties, userPropFile, "FFD user property file");
    }

    // System wide options are last.
    filename = System.getenv(ENVIRONMENT_VARIABLE);
    if (filename != null) {
      File systemPropFile = new File(filename);
      if (systemPropFile.exists() && systemPropFile.canRead()) {
        addPropertyFile(properties, systemPropFile, "Environment variable " + ENVIRONMENT_VARIABLE);
      }
    }

    // Echo the interpolated configuration.
    if (logger.isLoggable(Level.FINE)) {
      Iterator<String> i = properties.getKeys();
      StringBuilder sb = new StringBuilder();
      sb.append(format("\n %-30s %s\n", "Property", "Value"));
      while (i.hasNext()) {
        String s = i.next();
        if (s.startsWith("ffd")) {
          sb.append(format(" %-30s %s\n", s, Arrays.toString(properties.getList(s).toArray())));
        }
      }
      logger.fine(sb.toString());
    }

    return properties;
  }

  /**
   * Read an integer property, falling back to the default for missing or unparsable values.
   *
   * @param properties the configuration.
   * @param key the property key.
   * @param defaultValue value used when the key is absent or invalid.
   * @return the property value.
   */
  public static int getInt(CompositeConfiguration properties, String key, int defaultValue) {
    if (properties == null || !properties.containsKey(key)) {
      return defaultValue;
    }
    try {
      return properties.getInt(key, defaultValue);
    } catch (RuntimeException e) {
      logger.warning(format(" Could not parse %s (%s); using %d.", key,
          properties.getString(key), defaultValue));
      return defaultValue;
    }
  }

  /**
   * Read a boolean property, falling back to the default for missing or unparsable values.
   *
   * @param properties the configuration.
   * @param key the property key.
   * @param defaultValue value used when the key is absent or invalid.
   * @return the property value.
   */
  public static boolean getBoolean(CompositeConfiguration properties, String key,
      boolean defaultValue) {
    if (properties == null || !properties.containsKey(key)) {
      return defaultValue;
    }
    try {
      return properties.getBoolean(key, defaultValue);
    } catch (RuntimeException e) {
      logger.warning(format(" Could not parse %s (%s); using %b.", key,
          properties.getString(key), defaultValue));
      return defaultValue;
    }
  }

  /**
   * Find the property file that belongs to the given file.
   *
   * @param file a properties file, or a file with a sibling properties file.
   * @return the property file, or null if none exists.
   */
  static File locatePropertyFile(File file) {
    String extension = FilenameUtils.getExtension(file.getName());
    if ((extension.equalsIgnoreCase("properties") || extension.equalsIgnoreCase("prop"))
        && file.exists()) {
      return file;
    }
    String basename = FilenameUtils.removeExtension(file.getAbsolutePath());
    File candidate = new File(basename + ".properties");
    if (candidate.exists()) {
      return candidate;
    }
    candidate = new File(basename + ".prop");
    if (candidate.exists()) {
      return candidate;
    }
    return null;
  }

  /**
   * Read a properties file and add it to the composite with the lowest precedence so far.
   *
   * @param properties the composite configuration.
   * @param propertyFile the file to read.
   * @param description header describing the source of the file.
   */
  private static void addPropertyFile(CompositeConfiguration properties, File propertyFile,
      String description) {
    if (!propertyFile.canRead()) {
      logger.warning(format(" Property file %s is not readable.", propertyFile));
      return;
    }
    try {
      FileBasedConfigurationBuilder<PropertiesConfiguration> builder =
          new FileBasedConfigurationBuilder<>(PropertiesConfiguration.class)
              .configure(new Parameters().properties()
                  .setFile(propertyFile)
                  .setThrowExceptionOnMissing(true)
                  .setIncludesAllowed(false));
      PropertiesConfiguration configuration = builder.getConfiguration();
      configuration.setHeader(description + " (" + propertyFile + ").");
      properties.addConfiguration(configuration);
    } catch (ConfigurationException e) {
      logger.log(Level.WARNING, format(" Error loading %s.", propertyFile), e);
    }
  }
}
