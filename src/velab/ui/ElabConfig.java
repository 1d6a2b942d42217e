package velab.ui;

import java.io.File;
import java.io.FileInputStream;
import java.io.IOException;
import java.io.InputStream;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.Constructor;
import org.yaml.snakeyaml.error.YAMLException;

/**
 * Data-Class to hold elaboration options.
 */
public class ElabConfig {

  public boolean typecheck = true;
  public int max_loop_iterations = 65536;

  public boolean inline = false;

  /** Reads a configuration file. Keys not present keep their default. An empty file yields the defaults. */
  public static ElabConfig load(File file) throws DesignFormatException {
    Yaml yaml = new Yaml(new Constructor(ElabConfig.class, new LoaderOptions()));
    try (InputStream in = new FileInputStream(file)) {
      ElabConfig ret = yaml.load(in);
      if (ret == null)
        return new ElabConfig();
      if (ret.max_loop_iterations <= 0)
        throw new DesignFormatException("Malformed configuration " + file + ": max_loop_iterations must be positive, is "
                                        + ret.max_loop_iterations);
      return ret;
    } catch (IOException e) {
      throw new DesignFormatException("Cannot read configuration " + file, e);
    } catch (YAMLException | ClassCastException e) {
      throw new DesignFormatException("Malformed configuration " + file + ": " + e.getMessage(), e);
    }
  }
}
