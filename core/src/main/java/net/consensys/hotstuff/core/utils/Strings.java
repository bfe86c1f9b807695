package net.consensys.hotstuff.core.utils;

import java.lang.reflect.Field;
import java.lang.reflect.Modifier;
import java.util.Arrays;

public class Strings {

  /**
   * Prints the instance fields of an object, including the inherited ones. Static and synthetic
   * fields (e.g. the reference to an enclosing protocol) are skipped.
   */
  public static String toString(Object o) {
    StringBuilder sb = new StringBuilder();

    for (Class<?> c = o.getClass(); c != null && c != Object.class; c = c.getSuperclass()) {
      for (Field f : c.getDeclaredFields()) {
        if (Modifier.isStatic(f.getModifiers()) || f.isSynthetic()) {
          continue;
        }
        try {
          f.setAccessible(true);
          String v = valueOf(f.get(o));
          if (sb.length() != 0) {
            sb.append(", ");
          }
          sb.append(f.getName()).append("=").append(v);
        } catch (IllegalAccessException | RuntimeException e) {
          // Not accessible (e.g. module restrictions): we print what we can see.
          if (sb.length() != 0) {
            sb.append(", ");
          }
          sb.append(f.getName()).append("=?");
        }
      }
    }

    return o.getClass().getSimpleName() + "{" + sb + "}";
  }

  private static String valueOf(Object v) {
    if (v instanceof Object[]) {
      return Arrays.toString((Object[]) v);
    }
    if (v instanceof byte[]) {
      return "byte[" + ((byte[]) v).length + "]";
    }
    return String.valueOf(v);
  }
}
