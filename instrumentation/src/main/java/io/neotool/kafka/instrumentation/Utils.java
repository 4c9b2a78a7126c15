package io.neotool.kafka.instrumentation;

import java.util.Map;

public class Utils {
  /**
   * CopyTags copies "key, value, key, value, ..." varargs into the destination map.
   *
   * <p>A trailing key without a value is ignored.
   *
   * @param destination map to copy tags into.
   * @param source array to copy tags from.
   * @return number of key-value pairs copied.
   */
  public static int copyTags(Map<String, String> destination, String... source) {
    int pairs = 0;
    for (int i = 0; i + 1 < source.length; i += 2) {
      destination.put(source[i], source[i + 1]);
      pairs++;
    }
    return pairs;
  }
}
