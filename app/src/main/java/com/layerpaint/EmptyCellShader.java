package com.layerpaint;

/**
 * Supplies the displayed color for a cell no visible layer has painted.
 */
@FunctionalInterface
public interface EmptyCellShader
{
	Rgba shade(int x, int y);

	Rgba CHECK_LIGHT = Rgba.opaque(200, 200, 200);
	Rgba CHECK_DARK = Rgba.opaque(160, 160, 160);

	static EmptyCellShader checkerboard(int checkSize)
	{
		if (checkSize <= 0)
		{
			throw new IllegalArgumentException("Checker size must be positive: " + checkSize);
		}
		return (x, y) -> ((x / checkSize + y / checkSize) % 2 == 0) ? CHECK_LIGHT : CHECK_DARK;
	}
}
