package com.layerpaint;

import com.google.gson.annotations.SerializedName;

public enum BrushShape
{
	@SerializedName("Round") ROUND("Round"),
	@SerializedName("Flat") FLAT("Flat"),
	@SerializedName("Bright") BRIGHT("Bright"),
	@SerializedName("Filbert") FILBERT("Filbert"),
	@SerializedName("Fan") FAN("Fan"),
	@SerializedName("Angle") ANGLE("Angle"),
	@SerializedName("Mop") MOP("Mop"),
	@SerializedName("Rigger") RIGGER("Rigger");

	final String displayName;

	BrushShape(String displayName)
	{
		this.displayName = displayName;
	}

	public String displayName()
	{
		return displayName;
	}

	/** Shapes whose thickness or aspect follows the stroke direction when drawing lines. */
	boolean followsStrokeDirection()
	{
		return this == FLAT || this == ANGLE || this == FILBERT;
	}
}
