package com.layerpaint;

import java.util.Objects;

/**
 * Tool settings the surrounding UI reads and writes directly. Range limits (size, hardness)
 * are the UI's job; nothing here validates them.
 */
public class ToolState
{
	Tool tool = Tool.BRUSH;
	Rgba primaryColor = Rgba.BLACK;
	Rgba secondaryColor = Rgba.WHITE;
	final SavedPalette savedColors;
	BrushStyle brushStyle;
	int eraserSize;

	public ToolState()
	{
		this(EditorSettings.defaults());
	}

	public ToolState(EditorSettings settings)
	{
		this.savedColors = new SavedPalette(settings.maxSavedColors());
		this.brushStyle = new BrushStyle();
		this.brushStyle.setSize(settings.defaultBrushSize());
		this.eraserSize = settings.defaultEraserSize();
	}

	public Tool tool() { return tool; }
	public Rgba primaryColor() { return primaryColor; }
	public Rgba secondaryColor() { return secondaryColor; }
	public SavedPalette savedColors() { return savedColors; }
	public BrushStyle brushStyle() { return brushStyle; }
	public int eraserSize() { return eraserSize; }

	public void setTool(Tool tool) { this.tool = Objects.requireNonNull(tool); }
	public void setPrimaryColor(Rgba color) { this.primaryColor = Objects.requireNonNull(color); }
	public void setSecondaryColor(Rgba color) { this.secondaryColor = Objects.requireNonNull(color); }
	public void setBrushStyle(BrushStyle brushStyle) { this.brushStyle = Objects.requireNonNull(brushStyle); }
	public void setEraserSize(int eraserSize) { this.eraserSize = eraserSize; }

	public Rgba color(boolean secondary)
	{
		return secondary ? secondaryColor : primaryColor;
	}

	public void usePrimaryFromSaved(int index)
	{
		Rgba color = savedColors.get(index);
		if (color != null) primaryColor = color;
	}

	public void useSecondaryFromSaved(int index)
	{
		Rgba color = savedColors.get(index);
		if (color != null) secondaryColor = color;
	}
}
