package io.gwswuse.core;

/**
 * The closed vocabulary of water use sectors a convention may describe.
 */
public enum Sector {
  irrigation, domestic, manufacturing, thermal_power, livestock;

  public static boolean isValid(String s) {
    for (Sector sector : values()) {
      if (sector.name().equals(s)) return true;
    }
    return false;
  }
}
