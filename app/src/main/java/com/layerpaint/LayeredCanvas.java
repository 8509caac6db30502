package com.layerpaint;

import java.awt.image.BufferedImage;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Ordered stack of equally sized {@link PixelLayer}s (index 0 at the bottom) with an active
 * layer selector. Index and coordinate arguments outside the valid range are ignored rather
 * than rejected, since interactive tools produce them routinely.
 */
public class LayeredCanvas
{
	public static final String DEFAULT_LAYER_NAME = "Background";

	private final int width;
	private final int height;
	private final List<PixelLayer> layers;
	private int activeLayerIndex;

	// Starts dirty so the first render pulls the pixels
	private boolean dirty = true;

	public LayeredCanvas(int width, int height)
	{
		if (width <= 0 || height <= 0)
		{
			throw new IllegalArgumentException("Canvas dimensions must be positive: " + width + "x" + height);
		}
		PixelLayer.cellCount(width, height);
		this.width = width;
		this.height = height;
		this.layers = new ArrayList<>();
		this.layers.add(new PixelLayer(DEFAULT_LAYER_NAME, width, height));
		this.activeLayerIndex = 0;
	}

	LayeredCanvas(int width, int height, List<PixelLayer> layers, int activeLayerIndex)
	{
		if (layers.isEmpty())
		{
			throw new IllegalArgumentException("A canvas needs at least one layer");
		}
		if (activeLayerIndex < 0 || activeLayerIndex >= layers.size())
		{
			throw new IllegalArgumentException("Active layer " + activeLayerIndex + " out of range");
		}
		for (PixelLayer layer : layers)
		{
			if (layer.width != width || layer.height != height)
			{
				throw new IllegalArgumentException(String.format(
						"Layer '%s' is %dx%d (expected %dx%d)", layer.name, layer.width, layer.height, width, height));
			}
		}
		this.width = width;
		this.height = height;
		this.layers = new ArrayList<>(layers);
		this.activeLayerIndex = activeLayerIndex;
	}

	public int width()
	{
		return width;
	}

	public int height()
	{
		return height;
	}

	public boolean contains(int x, int y)
	{
		return x >= 0 && x < width && y >= 0 && y < height;
	}

	boolean hasLayer(int index)
	{
		return index >= 0 && index < layers.size();
	}

	// --- Pixel access ---

	/**
	 * Composited color: the first painted cell of a visible layer, scanning from the top.
	 */
	public Rgba get(int x, int y)
	{
		if (!contains(x, y)) return null;
		for (int i = layers.size() - 1; i >= 0; i--)
		{
			PixelLayer layer = layers.get(i);
			if (!layer.visible) continue;
			Rgba color = layer.get(x, y);
			if (color != null) return color;
		}
		return null;
	}

	public Rgba getActive(int x, int y)
	{
		return getOnLayer(activeLayerIndex, x, y);
	}

	public void setActive(int x, int y, Rgba color)
	{
		setOnLayer(activeLayerIndex, x, y, color);
	}

	public Rgba getOnLayer(int layerIndex, int x, int y)
	{
		if (!hasLayer(layerIndex) || !contains(x, y)) return null;
		return layers.get(layerIndex).get(x, y);
	}

	public void setOnLayer(int layerIndex, int x, int y, Rgba color)
	{
		if (!hasLayer(layerIndex) || !contains(x, y)) return;
		layers.get(layerIndex).set(x, y, color);
		dirty = true;
	}

	// --- Layer management ---

	public int layerCount()
	{
		return layers.size();
	}

	public List<PixelLayer> layers()
	{
		return Collections.unmodifiableList(layers);
	}

	public PixelLayer layer(int index)
	{
		return hasLayer(index) ? layers.get(index) : null;
	}

	public int activeLayerIndex()
	{
		return activeLayerIndex;
	}

	public boolean isActiveLayerVisible()
	{
		return layers.get(activeLayerIndex).visible;
	}

	public void setActiveLayer(int index)
	{
		if (hasLayer(index))
		{
			activeLayerIndex = index;
		}
	}

	/**
	 * Appends a blank layer on top of the stack and makes it active.
	 */
	public void addLayer(String name)
	{
		layers.add(new PixelLayer(name, width, height));
		activeLayerIndex = layers.size() - 1;
		dirty = true;
	}

	/**
	 * Removes a layer unless it is the only one left.
	 *
	 * @return true if a layer was removed
	 */
	public boolean removeLayer(int index)
	{
		if (layers.size() <= 1 || !hasLayer(index)) return false;
		layers.remove(index);
		if (activeLayerIndex >= layers.size())
		{
			activeLayerIndex = layers.size() - 1;
		}
		dirty = true;
		return true;
	}

	/**
	 * Swaps a layer with its neighbour. The active selection follows the layer it pointed at.
	 *
	 * @return the index the layer ended up at, or -1 if nothing moved
	 */
	public int moveLayer(int index, LayerMove move)
	{
		int target = index + move.offset;
		if (!hasLayer(index) || !hasLayer(target)) return -1;
		Collections.swap(layers, index, target);
		if (activeLayerIndex == index)
		{
			activeLayerIndex = target;
		}
		else if (activeLayerIndex == target)
		{
			activeLayerIndex = index;
		}
		dirty = true;
		return target;
	}

	public void toggleVisibility(int index)
	{
		if (!hasLayer(index)) return;
		PixelLayer layer = layers.get(index);
		layer.visible = !layer.visible;
		dirty = true;
	}

	public void rename(int index, String name)
	{
		if (!hasLayer(index) || name == null) return;
		layers.get(index).name = name;
	}

	// --- Readout ---

	public void markDirty()
	{
		dirty = true;
	}

	public boolean isDirty()
	{
		return dirty;
	}

	/**
	 * Returns whether the canvas changed since the last call, and clears the flag.
	 */
	public boolean consumeDirty()
	{
		boolean wasDirty = dirty;
		dirty = false;
		return wasDirty;
	}

	/**
	 * Composited pixels, row-major, 4 bytes per pixel in R, G, B, A order.
	 */
	public byte[] renderToRgba(EmptyCellShader emptyCells)
	{
		byte[] out = new byte[width * height * 4];
		int i = 0;
		for (int y = 0; y < height; y++)
		{
			for (int x = 0; x < width; x++)
			{
				Rgba color = get(x, y);
				if (color == null)
				{
					color = emptyCells.shade(x, y);
				}
				out[i++] = (byte) color.r();
				out[i++] = (byte) color.g();
				out[i++] = (byte) color.b();
				out[i++] = (byte) color.a();
			}
		}
		return out;
	}

	/**
	 * Flattens the visible layers into an ARGB image; unpainted cells stay fully transparent.
	 */
	public BufferedImage toImage()
	{
		BufferedImage image = new BufferedImage(width, height, BufferedImage.TYPE_INT_ARGB);
		for (int y = 0; y < height; y++)
		{
			for (int x = 0; x < width; x++)
			{
				Rgba color = get(x, y);
				if (color != null)
				{
					image.setRGB(x, y, color.toArgb());
				}
			}
		}
		return image;
	}

	/**
	 * Builds a single-layer canvas from an image. Only pixels with non-zero alpha become painted.
	 */
	public static LayeredCanvas fromImage(BufferedImage image)
	{
		LayeredCanvas canvas = new LayeredCanvas(image.getWidth(), image.getHeight());
		PixelLayer background = canvas.layers.get(0);
		for (int y = 0; y < image.getHeight(); y++)
		{
			for (int x = 0; x < image.getWidth(); x++)
			{
				int argb = image.getRGB(x, y);
				if ((argb >>> 24) != 0)
				{
					background.set(x, y, Rgba.fromArgb(argb));
				}
			}
		}
		return canvas;
	}
}
