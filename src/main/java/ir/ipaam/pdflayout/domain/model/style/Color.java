package ir.ipaam.pdflayout.domain.model.style;

/** An RGB colour with channels in the range 0-255. */
public record Color(int red, int green, int blue) {

    public static final Color BLACK = new Color(0, 0, 0);
    public static final Color WHITE = new Color(255, 255, 255);

    public Color {
        checkChannel("red", red);
        checkChannel("green", green);
        checkChannel("blue", blue);
    }

    public static Color rgb(int red, int green, int blue) {
        return new Color(red, green, blue);
    }

    public static Color gray(int level) {
        return new Color(level, level, level);
    }

    public java.awt.Color toAwtColor() {
        return new java.awt.Color(red, green, blue);
    }

    private static void checkChannel(String name, int value) {
        if (value < 0 || value > 255) {
            throw new IllegalArgumentException(name + " channel out of range 0-255: " + value);
        }
    }
}
