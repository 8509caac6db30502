package com.layerpaint;

public enum Tool
{
	BRUSH,
	ERASER,
	PAINT_BUCKET,
	COLOR_PICKER,
	LINE
}
