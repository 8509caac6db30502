package com.layerpaint;

/**
 * A rotated coordinate frame anchored on a brush centre. Candidate pixels are translated
 * into the frame and tested against an axis-aligned shape, which lets every rotated
 * footprint (rectangle, ellipse, parallelogram) share one scan loop.
 */
final class LocalFrame
{
	@FunctionalInterface
	interface LocalShape
	{
		boolean contains(double localX, double localY);
	}

	@FunctionalInterface
	interface PixelVisitor
	{
		void visit(int x, int y);
	}

	private final double cos;
	private final double sin;

	private LocalFrame(double radians)
	{
		this.cos = Math.cos(radians);
		this.sin = Math.sin(radians);
	}

	static LocalFrame rotatedDegrees(double degrees)
	{
		return new LocalFrame(Math.toRadians(degrees));
	}

	static LocalFrame rotatedRadians(double radians)
	{
		return new LocalFrame(radians);
	}

	double localX(double dx, double dy)
	{
		return dx * cos + dy * sin;
	}

	double localY(double dx, double dy)
	{
		return -dx * sin + dy * cos;
	}

	/**
	 * Visits every pixel within {@code halfExtent} of the rounded centre whose offset from the
	 * exact centre falls inside {@code shape} once rotated into this frame.
	 */
	void scan(double centerX, double centerY, int halfExtent, LocalShape shape, PixelVisitor visitor)
	{
		int originX = (int) Math.round(centerX);
		int originY = (int) Math.round(centerY);
		for (int dy = -halfExtent; dy <= halfExtent; dy++)
		{
			for (int dx = -halfExtent; dx <= halfExtent; dx++)
			{
				int px = originX + dx;
				int py = originY + dy;
				double relX = px - centerX;
				double relY = py - centerY;
				if (shape.contains(localX(relX, relY), localY(relX, relY)))
				{
					visitor.visit(px, py);
				}
			}
		}
	}

	// --- Axis-aligned shapes in local coordinates ---

	static LocalShape rectangle(double width, double thickness)
	{
		double halfW = width / 2.0;
		double halfT = thickness / 2.0;
		return (lx, ly) -> Math.abs(lx) <= halfW && Math.abs(ly) <= halfT;
	}

	static LocalShape ellipse(double semiMajor, double semiMinor)
	{
		double a2 = semiMajor * semiMajor;
		double b2 = semiMinor * semiMinor;
		return (lx, ly) -> (lx * lx) / a2 + (ly * ly) / b2 <= 1.0;
	}

	/**
	 * A rectangle whose thickness axis is offset by {@code lx * tan(shear)} along its width.
	 */
	static LocalShape shearedRectangle(double width, double thickness, double shearDegrees)
	{
		double halfW = width / 2.0;
		double halfT = thickness / 2.0;
		double tan = Math.tan(Math.toRadians(shearDegrees));
		return (lx, ly) -> Math.abs(lx) <= halfW && Math.abs(ly - lx * tan) <= halfT;
	}
}
