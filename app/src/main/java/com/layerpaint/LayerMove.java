package com.layerpaint;

/**
 * Direction for {@link LayeredCanvas#moveLayer}. Layer index 0 is the bottom of the stack.
 */
public enum LayerMove
{
	TOWARD_TOP(1),
	TOWARD_BOTTOM(-1);

	final int offset;

	LayerMove(int offset)
	{
		this.offset = offset;
	}
}
