package io.intellixity.docclients.mongo;

import com.mongodb.MongoClientSettings;
import org.bson.UuidRepresentation;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.TimeUnit;

/**
 * Maps registry client options onto {@link MongoClientSettings}.\n
 *
 * Values may be typed (Boolean/Number/enum) or strings, since property binding delivers strings.\n
 * Options win over the same setting given in the connection string.\n
 */
public final class MongoClientOptions {
  public static final String APP_NAME = "appName";
  public static final String RETRY_WRITES = "retryWrites";
  public static final String RETRY_READS = "retryReads";
  public static final String UUID_REPRESENTATION = "uuidRepresentation";
  public static final String CONNECT_TIMEOUT_MS = "connectTimeoutMS";
  public static final String SOCKET_TIMEOUT_MS = "socketTimeoutMS";
  public static final String SERVER_SELECTION_TIMEOUT_MS = "serverSelectionTimeoutMS";
  public static final String MAX_POOL_SIZE = "maxPoolSize";
  public static final String MIN_POOL_SIZE = "minPoolSize";
  public static final String MAX_CONNECTION_IDLE_TIME_MS = "maxConnectionIdleTimeMS";

  public static final Set<String> SUPPORTED = Set.of(
      APP_NAME, RETRY_WRITES, RETRY_READS, UUID_REPRESENTATION,
      CONNECT_TIMEOUT_MS, SOCKET_TIMEOUT_MS, SERVER_SELECTION_TIMEOUT_MS,
      MAX_POOL_SIZE, MIN_POOL_SIZE, MAX_CONNECTION_IDLE_TIME_MS);

  /** Baseline every Mongo client starts from. */
  public static final Map<String, Object> DEFAULTS = defaults();

  private MongoClientOptions() {}

  private static Map<String, Object> defaults() {
    Map<String, Object> m = new LinkedHashMap<>();
    m.put(RETRY_WRITES, true);
    m.put(RETRY_READS, true);
    m.put(UUID_REPRESENTATION, UuidRepresentation.STANDARD.name());
    return Map.copyOf(m);
  }

  /**
   * Applies {@code options} to the builder.
   *
   * @throws IllegalArgumentException on unknown keys or values of the wrong type
   */
  public static MongoClientSettings.Builder apply(MongoClientSettings.Builder b, Map<String, Object> options) {
    if (options == null) return b;
    for (var e : options.entrySet()) {
      String key = e.getKey();
      Object v = e.getValue();
      switch (key) {
        case APP_NAME -> b.applicationName(asString(key, v));
        case RETRY_WRITES -> b.retryWrites(asBoolean(key, v));
        case RETRY_READS -> b.retryReads(asBoolean(key, v));
        case UUID_REPRESENTATION -> b.uuidRepresentation(asUuidRepresentation(v));
        case CONNECT_TIMEOUT_MS -> {
          int ms = asInt(key, v);
          b.applyToSocketSettings(s -> s.connectTimeout(ms, TimeUnit.MILLISECONDS));
        }
        case SOCKET_TIMEOUT_MS -> {
          int ms = asInt(key, v);
          b.applyToSocketSettings(s -> s.readTimeout(ms, TimeUnit.MILLISECONDS));
        }
        case SERVER_SELECTION_TIMEOUT_MS -> {
          long ms = asLong(key, v);
          b.applyToClusterSettings(c -> c.serverSelectionTimeout(ms, TimeUnit.MILLISECONDS));
        }
        case MAX_POOL_SIZE -> {
          int n = asInt(key, v);
          b.applyToConnectionPoolSettings(p -> p.maxSize(n));
        }
        case MIN_POOL_SIZE -> {
          int n = asInt(key, v);
          b.applyToConnectionPoolSettings(p -> p.minSize(n));
        }
        case MAX_CONNECTION_IDLE_TIME_MS -> {
          long ms = asLong(key, v);
          b.applyToConnectionPoolSettings(p -> p.maxConnectionIdleTime(ms, TimeUnit.MILLISECONDS));
        }
        default -> throw new IllegalArgumentException("Unsupported Mongo client option '" + key + "'. Supported: " + SUPPORTED);
      }
    }
    return b;
  }

  private static String asString(String key, Object v) {
    if (v instanceof CharSequence cs) return cs.toString();
    throw typeError(key, v, "string");
  }

  private static boolean asBoolean(String key, Object v) {
    if (v instanceof Boolean bool) return bool;
    if (v instanceof CharSequence cs) {
      String s = cs.toString().trim();
      if ("true".equalsIgnoreCase(s)) return true;
      if ("false".equalsIgnoreCase(s)) return false;
    }
    throw typeError(key, v, "boolean");
  }

  private static int asInt(String key, Object v) {
    long l = asLong(key, v);
    if (l < Integer.MIN_VALUE || l > Integer.MAX_VALUE) throw typeError(key, v, "int");
    return (int) l;
  }

  private static long asLong(String key, Object v) {
    if (v instanceof Integer || v instanceof Long || v instanceof Short || v instanceof Byte) {
      return ((Number) v).longValue();
    }
    if (v instanceof CharSequence cs) {
      try {
        return Long.parseLong(cs.toString().trim());
      } catch (NumberFormatException e) {
        throw typeError(key, v, "integer");
      }
    }
    throw typeError(key, v, "integer");
  }

  private static UuidRepresentation asUuidRepresentation(Object v) {
    if (v instanceof UuidRepresentation u) return u;
    if (v instanceof CharSequence cs) {
      try {
        return UuidRepresentation.valueOf(cs.toString().trim().toUpperCase(Locale.ROOT));
      } catch (IllegalArgumentException e) {
        throw new IllegalArgumentException("Unknown uuidRepresentation '" + cs + "'", e);
      }
    }
    throw typeError(UUID_REPRESENTATION, v, "UuidRepresentation name");
  }

  private static IllegalArgumentException typeError(String key, Object v, String expected) {
    String type = (v == null) ? "null" : v.getClass().getSimpleName();
    return new IllegalArgumentException("Mongo client option '" + key + "' must be " + expected + " (got " + type + ": " + v + ")");
  }
}
