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
import static org.junit.Assert.fail;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Properties;
import java.util.logging.Level;
import java.util.logging.Logger;

import org.apache.commons.io.FileUtils;
import org.junit.After;
import org.junit.AfterClass;
import org.junit.Before;
import org.junit.BeforeClass;

/**
 * Base class for FFD unit tests.
 * <p>
 * The level of the "ffd" loggers is set from the ffd.test.log System property (WARNING unless
 * overridden) for the duration of each test class. System properties are snapshotted before each
 * test and put back afterwards, so a test may set configuration keys freely. A test can ask for
 * a scratch directory with {@link #registerTemporaryDirectory()}; it is removed once the test
 * ends.
 */
public abstract class FFDTest {

  protected static final Logger logger = Logger.getLogger(FFDTest.class.getName());

  /** Level of the ffd loggers outside of tests. */
  private static final Level defaultLevel = parseLevel("ffd.log", Level.INFO);
  /** Level of the ffd loggers while a test class runs. */
  private static final Level testLevel = parseLevel("ffd.test.log", Level.WARNING);

  private Properties savedProperties;
  private Path scratchDirectory;

  /** Apply the test logging level. */
  @BeforeClass
  public static void beforeClass() {
    setLevels(testLevel);
  }

  /** Put the logging levels back. */
  @AfterClass
  public static void afterClass() {
    setLevels(defaultLevel);
  }

  /** Snapshot the System properties. */
  @Before
  public void beforeTest() {
    savedProperties = new Properties();
    Properties current = System.getProperties();
    for (String key : current.stringPropertyNames()) {
      savedProperties.setProperty(key, current.getProperty(key));
    }
  }

  /** Restore System properties and remove the scratch directory. */
  @After
  public void afterTest() {
    if (savedProperties != null) {
      System.setProperties(savedProperties);
    }
    deleteTemporaryDirectory();
  }

  /**
   * A scratch directory for the current test. Calling this again replaces the previous directory.
   *
   * @return the new directory.
   */
  public Path registerTemporaryDirectory() {
    deleteTemporaryDirectory();
    try {
      scratchDirectory = Files.createTempDirectory("ffd-" + getClass().getSimpleName());
    } catch (IOException e) {
      fail(format(" Unable to create a scratch directory for %s: %s",
          getClass().getSimpleName(), e));
    }
    return scratchDirectory;
  }

  /** Remove the scratch directory, if one was created. */
  private void deleteTemporaryDirectory() {
    if (scratchDirectory == null) {
      return;
    }
    try {
      FileUtils.deleteDirectory(scratchDirectory.toFile());
    } catch (IOException e) {
      fail(format(" Unable to remove scratch directory %s: %s", scratchDirectory, e));
    } finally {
      scratchDirectory = null;
    }
  }

  private static void setLevels(Level level) {
    Logger.getLogger("ffd").setLevel(level);
    logger.setLevel(level);
  }

  private static Level parseLevel(String key, Level fallback) {
    String value = System.getProperty(key);
    if (value == null) {
      return fallback;
    }
    try {
      return Level.parse(value.trim().toUpperCase());
    } catch (IllegalArgumentException e) {
      logger.warning(format(" Unrecognized %s level %s; using %s.", key, value, fallback));
      return fallback;
    }
  }
}
