package com.layerpaint;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * User-saved swatches. Duplicates are rejected; once full, adding a color evicts the oldest.
 */
public class SavedPalette
{
	public static final int DEFAULT_CAPACITY = 16;

	private final int capacity;
	private final List<Rgba> colors = new ArrayList<>();

	public SavedPalette()
	{
		this(DEFAULT_CAPACITY);
	}

	public SavedPalette(int capacity)
	{
		if (capacity <= 0)
		{
			throw new IllegalArgumentException("Palette capacity must be positive: " + capacity);
		}
		this.capacity = capacity;
	}

	/**
	 * @return false if the color was already saved
	 */
	public boolean add(Rgba color)
	{
		if (color == null || colors.contains(color)) return false;
		if (colors.size() >= capacity)
		{
			colors.remove(0);
		}
		colors.add(color);
		return true;
	}

	public void remove(int index)
	{
		if (index >= 0 && index < colors.size())
		{
			colors.remove(index);
		}
	}

	/** Returns the swatch at {@code index}, or null when out of range. */
	public Rgba get(int index)
	{
		return index >= 0 && index < colors.size() ? colors.get(index) : null;
	}

	public int size()
	{
		return colors.size();
	}

	public int capacity()
	{
		return capacity;
	}

	public List<Rgba> colors()
	{
		return Collections.unmodifiableList(colors);
	}
}
