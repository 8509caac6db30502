package com.layerpaint;

/**
 * Straight (non-premultiplied) 8-bit RGBA color. A canvas cell holding {@code null}
 * instead of an Rgba has never been painted and lets lower layers show through.
 */
public record Rgba(int r, int g, int b, int a)
{
	public static final Rgba BLACK = new Rgba(0, 0, 0, 255);
	public static final Rgba WHITE = new Rgba(255, 255, 255, 255);

	public Rgba
	{
		if ((r | g | b | a) >>> 8 != 0)
		{
			throw new IllegalArgumentException(
					"Channel out of range 0-255: (" + r + ", " + g + ", " + b + ", " + a + ")");
		}
	}

	public static Rgba opaque(int r, int g, int b)
	{
		return new Rgba(r, g, b, 255);
	}

	public static Rgba fromArgb(int argb)
	{
		return new Rgba((argb >> 16) & 0xFF, (argb >> 8) & 0xFF, argb & 0xFF, (argb >>> 24) & 0xFF);
	}

	public int toArgb()
	{
		return (a << 24) | (r << 16) | (g << 8) | b;
	}

	public Rgba withAlpha(int alpha)
	{
		return new Rgba(r, g, b, alpha);
	}
}
