package io.lighting.renamer.context;

public record ImageDimensions(int width, int height) {
    public static final ImageDimensions NONE = new ImageDimensions(0, 0);

    public ImageDimensions {
        if (width < 0 || height < 0) {
            throw new IllegalArgumentException("Image dimensions must not be negative: " + width + "x" + height);
        }
    }

    public boolean isEmpty() {
        return width == 0 && height == 0;
    }
}
