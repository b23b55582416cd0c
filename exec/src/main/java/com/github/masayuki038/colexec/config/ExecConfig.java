package com.github.masayuki038.colexec.config;

import com.google.common.base.Preconditions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.util.Properties;

/**
 * Pipeline-wide tunables.
 *
 * <p>Read from {@code colexec.properties} on the classpath. A JVM system property with the same
 * key overrides the file.
 */
public class ExecConfig {

  private static final Logger logger = LoggerFactory.getLogger(ExecConfig.class);

  public static final String RESOURCE = "colexec.properties";
  public static final String BATCH_SIZE_KEY = "colexec.batch.size";
  public static final String HASH_BUCKETS_KEY = "colexec.hash.buckets";

  public static final int DEFAULT_BATCH_SIZE = 1024;
  public static final int DEFAULT_HASH_BUCKETS = 1024;

  private static volatile ExecConfig instance;

  private final int batchSize;
  private final int hashBuckets;

  public ExecConfig(int batchSize, int hashBuckets) {
    Preconditions.checkArgument(batchSize > 0, "batch size must be positive: %s", batchSize);
    Preconditions.checkArgument(hashBuckets > 0, "bucket count must be positive: %s", hashBuckets);
    this.batchSize = batchSize;
    this.hashBuckets = hashBuckets;
  }

  /**
   * Configuration loaded once from the classpath and system properties.
   */
  public static ExecConfig get() {
    ExecConfig config = instance;
    if (config == null) {
      synchronized (ExecConfig.class) {
        config = instance;
        if (config == null) {
          config = load(ExecConfig.class.getClassLoader(), System.getProperties());
          instance = config;
        }
      }
    }
    return config;
  }

  static ExecConfig load(ClassLoader classLoader, Properties overrides) {
    Properties properties = new Properties();
    try (InputStream in = classLoader.getResourceAsStream(RESOURCE)) {
      if (in != null) {
        properties.load(in);
      } else {
        logger.debug("{} not found on classpath, using defaults", RESOURCE);
      }
    } catch (IOException e) {
      logger.warn("Failed to read {}, using defaults", RESOURCE, e);
    }
    properties.putAll(overrides);
    return fromProperties(properties);
  }

  public static ExecConfig fromProperties(Properties properties) {
    int batchSize = positiveInt(properties, BATCH_SIZE_KEY, DEFAULT_BATCH_SIZE);
    int hashBuckets = positiveInt(properties, HASH_BUCKETS_KEY, DEFAULT_HASH_BUCKETS);
    logger.debug("batchSize={}, hashBuckets={}", batchSize, hashBuckets);
    return new ExecConfig(batchSize, hashBuckets);
  }

  private static int positiveInt(Properties properties, String key, int defaultValue) {
    String value = properties.getProperty(key);
    if (value == null) {
      return defaultValue;
    }
    try {
      int parsed = Integer.parseInt(value.trim());
      if (parsed > 0) {
        return parsed;
      }
      logger.warn("{}={} is not positive, using {}", key, value, defaultValue);
    } catch (NumberFormatException e) {
      logger.warn("{}={} is not a number, using {}", key, value, defaultValue);
    }
    return defaultValue;
  }

  public int getBatchSize() {
    return batchSize;
  }

  public int getHashBuckets() {
    return hashBuckets;
  }

  @Override
  public String toString() {
    return "ExecConfig{batchSize=" + batchSize + ", hashBuckets=" + hashBuckets + "}";
  }
}
