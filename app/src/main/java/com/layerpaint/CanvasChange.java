package com.layerpaint;

/**
 * A single-cell delta on one layer. Colors may be {@code null} (unpainted).
 */
public record CanvasChange(int x, int y, int layerIndex, Rgba oldColor, Rgba newColor)
{
	CanvasChange onLayer(int newLayerIndex)
	{
		return new CanvasChange(x, y, newLayerIndex, oldColor, newColor);
	}
}
