package fsmgen.ui;

import java.io.File;
import java.io.FileInputStream;
import java.io.IOException;
import java.io.InputStream;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.TypeDescription;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.Constructor;
import org.yaml.snakeyaml.error.YAMLException;

/**
 * Data-Class to hold tool options.
 */
public class FSMGenConfig {
  protected static final Logger logger = LogManager.getLogger();

  /** Log every generated schedule at info level. */
  public boolean dump_fsm = false;
  /** Fail unless the static pass reduces the whole control program to one enable. */
  public boolean force = false;
  /** Start a group in the cycle its predecessor finishes. */
  public boolean early_transitions = false;
  /** Merge directly nested bounded loops in static programs. */
  public boolean denest_loops = true;
  /** Sort assignments into dataflow order after lowering. */
  public boolean order_dataflow = true;

  /**
   * Loads options from a YAML file, either tagged {@code !FSMGenConfig} or as a plain map of the field names.
   * Falls back to the defaults if the file cannot be read.
   */
  public static FSMGenConfig load(File file) {
    Constructor yamlConstructor = new Constructor(FSMGenConfig.class, new LoaderOptions());
    yamlConstructor.addTypeDescription(new TypeDescription(FSMGenConfig.class, "!FSMGenConfig"));
    Yaml yamlConfig = new Yaml(yamlConstructor);
    try (InputStream readFile = new FileInputStream(file)) {
      Object parseResult = yamlConfig.load(readFile);
      if (parseResult instanceof FSMGenConfig)
        return (FSMGenConfig)parseResult;
      logger.warn("Config file {} is empty, using default options", file.getPath());
    } catch (IOException | YAMLException e) {
      logger.warn("Cannot load config file {}, using default options: {}", file.getPath(), e.getMessage());
    }
    return new FSMGenConfig();
  }

  @Override
  public String toString() {
    return "FSMGenConfig(dump_fsm=" + dump_fsm + ", force=" + force + ", early_transitions=" + early_transitions +
        ", denest_loops=" + denest_loops + ", order_dataflow=" + order_dataflow + ")";
  }
}
