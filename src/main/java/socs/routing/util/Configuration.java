package socs.routing.util;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import com.typesafe.config.ConfigParseOptions;
import com.typesafe.config.ConfigValueFactory;

import java.io.File;
import java.util.ArrayList;
import java.util.List;

/**
 * Read-only view over a HOCON topology file.
 * <p/>
 * Keys missing from the file fall back to the bundled {@code reference.conf}.
 */
public class Configuration {

  private Config _config;

  public Configuration(String path) {
    this(ConfigFactory.parseFile(new File(path), ConfigParseOptions.defaults().setAllowMissing(false)));
  }

  public Configuration(Config config) {
    _config = config.withFallback(ConfigFactory.defaultReference()).resolve();
  }

  public static Configuration parseString(String hocon) {
    return new Configuration(ConfigFactory.parseString(hocon));
  }

  public String getString(String key) {
    return _config.getString(key);
  }

  public boolean getBoolean(String key) {
    return _config.getBoolean(key);
  }

  public int getInt(String key) {
    return _config.getInt(key);
  }

  public long getLong(String key) {
    return _config.getLong(key);
  }

  public List<String> getStringList(String key) {
    return _config.getStringList(key);
  }

  /** Each element of an object list, wrapped without the reference fallback. */
  public List<Configuration> getConfigList(String key) {
    List<Configuration> list = new ArrayList<Configuration>();
    for (Config c : _config.getConfigList(key)) {
      Configuration entry = new Configuration();
      entry._config = c;
      list.add(entry);
    }
    return list;
  }

  /** Returns a copy with {@code key} overridden, e.g. the algorithm given on the command line. */
  public Configuration withEntry(String key, Object value) {
    Configuration copy = new Configuration();
    copy._config = _config.withValue(key, ConfigValueFactory.fromAnyRef(value));
    return copy;
  }

  private Configuration() {
  }
}
