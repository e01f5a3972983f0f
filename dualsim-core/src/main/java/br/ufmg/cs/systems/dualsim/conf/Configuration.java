package br.ufmg.cs.systems.dualsim.conf;

import org.apache.log4j.Level;
import org.apache.log4j.Logger;

import java.io.Serializable;
import java.util.HashMap;
import java.util.Map;
import java.util.Properties;

public class Configuration implements Serializable {
   private static final Logger LOG = Logger.getLogger(Configuration.class);

   public static final String CONF_PREFIX = "dualsim.";
   public static final String CONF_SELF_LOOPS = "dualsim.selfloops";
   public static final boolean CONF_SELF_LOOPS_DEFAULT = false;
   public static final String CONF_LOG_LEVEL = "dualsim.log.level";
   public static final String CONF_LOG_LEVEL_DEFAULT = "INFO";

   private final Map<String, String> properties;

   public Configuration() {
      this.properties = new HashMap<>();
   }

   public Configuration(Map<String, String> properties) {
      this.properties = new HashMap<>(properties);
   }

   public Configuration(Properties properties) {
      this();
      for (String key : properties.stringPropertyNames()) {
         this.properties.put(key, properties.getProperty(key));
      }
   }

   /**
    * @return configuration holding every system property under
    * {@link #CONF_PREFIX}
    */
   public static Configuration fromSystemProperties() {
      Configuration configuration = new Configuration();
      Properties sysProps = System.getProperties();
      for (String key : sysProps.stringPropertyNames()) {
         if (key.startsWith(CONF_PREFIX)) {
            configuration.set(key, sysProps.getProperty(key));
         }
      }
      return configuration;
   }

   public Configuration set(String key, String value) {
      properties.put(key, value);
      return this;
   }

   public String getString(String key, String defaultValue) {
      String value = properties.get(key);
      return value != null ? value.trim() : defaultValue;
   }

   public Boolean getBoolean(String key, Boolean defaultValue) {
      String value = getString(key, null);
      if (value == null) return defaultValue;

      if (value.equalsIgnoreCase("true")) {
         return true;
      } else if (value.equalsIgnoreCase("false")) {
         return false;
      } else {
         throw new IllegalArgumentException("Invalid boolean for " + key +
                 ": " + value);
      }
   }

   public boolean isSelfLoopsEnabled() {
      return getBoolean(CONF_SELF_LOOPS, CONF_SELF_LOOPS_DEFAULT);
   }

   public Configuration setSelfLoopsEnabled(boolean selfLoops) {
      return set(CONF_SELF_LOOPS, Boolean.toString(selfLoops));
   }

   public String getLogLevel() {
      return getString(CONF_LOG_LEVEL, CONF_LOG_LEVEL_DEFAULT);
   }

   /**
    * Applies {@link #CONF_LOG_LEVEL} to the root logger of this project
    */
   public void applyLogLevel() {
      String levelStr = getLogLevel();
      Level level = Level.toLevel(levelStr, null);
      if (level == null) {
         throw new IllegalArgumentException("Invalid log level for " +
                 CONF_LOG_LEVEL + ": " + levelStr);
      }
      Logger.getLogger("br.ufmg.cs.systems.dualsim").setLevel(level);
      LOG.debug("Log level set to " + level);
   }

   @Override
   public String toString() {
      return "Configuration(" + properties + ")";
   }
}
