package ca.gc.cra.vigil.domain.frame;

/**
 * Overlay colour in RGB order.
 *
 * @param red red component {@code [0,255]}
 * @param green green component {@code [0,255]}
 * @param blue blue component {@code [0,255]}
 * @since 0.1.0
 */
public record Rgb(int red, int green, int blue) {
  /** Neutral colour used when a class has no configured colour. */
  public static final Rgb WHITE = new Rgb(255, 255, 255);

  public Rgb {
    red = clamp(red);
    green = clamp(green);
    blue = clamp(blue);
  }

  /**
   * Parses {@code "r,g,b"}.
   *
   * @param value comma-separated components
   * @return parsed colour
   * @throws IllegalArgumentException if the value is not three integers
   */
  public static Rgb parse(String value) {
    if (value == null || value.isBlank()) {
      throw new IllegalArgumentException("colour must be r,g,b");
    }
    String[] parts = value.split(",");
    if (parts.length != 3) {
      throw new IllegalArgumentException("colour must be r,g,b (was " + value + ")");
    }
    try {
      return new Rgb(
          Integer.parseInt(parts[0].trim()),
          Integer.parseInt(parts[1].trim()),
          Integer.parseInt(parts[2].trim()));
    } catch (NumberFormatException ex) {
      throw new IllegalArgumentException("colour must be r,g,b (was " + value + ")", ex);
    }
  }

  private static int clamp(int component) {
    return Math.max(0, Math.min(255, component));
  }
}
