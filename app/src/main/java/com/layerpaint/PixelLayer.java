package com.layerpaint;

/**
 * One named raster plane. Cells are stored row-major; {@code null} means unpainted.
 */
public class PixelLayer
{
	String name;
	boolean visible;

	final int width;
	final int height;
	final Rgba[] cells;

	PixelLayer(String name, int width, int height)
	{
		this(name, true, width, height, new Rgba[cellCount(width, height)]);
	}

	PixelLayer(String name, boolean visible, int width, int height, Rgba[] cells)
	{
		if (cells.length != cellCount(width, height))
		{
			throw new IllegalArgumentException(
					"Layer '" + name + "' has " + cells.length + " cells, expected " + (width * height));
		}
		this.name = name;
		this.visible = visible;
		this.width = width;
		this.height = height;
		this.cells = cells;
	}

	/**
	 * Number of cells in a {@code width} x {@code height} plane.
	 *
	 * @throws IllegalArgumentException if the count does not fit in an int
	 */
	static int cellCount(int width, int height)
	{
		try
		{
			return Math.multiplyExact(width, height);
		}
		catch (ArithmeticException e)
		{
			throw new IllegalArgumentException("Canvas too large: " + width + "x" + height, e);
		}
	}

	public String name()
	{
		return name;
	}

	public boolean isVisible()
	{
		return visible;
	}

	Rgba get(int x, int y)
	{
		return cells[y * width + x];
	}

	void set(int x, int y, Rgba color)
	{
		cells[y * width + x] = color;
	}

	/** Cell by row-major index, for serialization. */
	Rgba cell(int index)
	{
		return cells[index];
	}
}
