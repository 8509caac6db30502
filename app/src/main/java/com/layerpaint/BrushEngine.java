package com.layerpaint;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Rasterizes brush dabs and pointer segments onto the active layer. Every pixel write goes
 * through the {@link ChangeLog}, so overlapping dabs along a line cost no history entries.
 */
public class BrushEngine
{
	private static final Logger logger = LoggerFactory.getLogger(BrushEngine.class);

	static final double FAN_SPREAD_DEGREES = 90.0;
	static final double ANGLE_SHEAR_DEGREES = 45.0;
	static final double FLAT_THICKNESS_RATIO = 0.25;
	static final double BRIGHT_THICKNESS_RATIO = 0.20;
	static final double FAN_THICKNESS_RATIO = 0.05;
	static final double FAN_MAX_THICKNESS_RATIO = 0.20;
	static final double MOP_OPACITY = 0.3;
	static final double MOP_MIN_HARDNESS = 0.01;
	static final double MOP_MAX_HARDNESS = 0.25;
	static final double RIGGER_RADIUS = 1.0;

	@FunctionalInterface
	interface LatticeVisitor
	{
		void visit(int x, int y);
	}

	private final LayeredCanvas canvas;
	private final ChangeLog changeLog;

	public BrushEngine(ChangeLog changeLog)
	{
		this.changeLog = changeLog;
		this.canvas = changeLog.canvas();
	}

	// --- Public drawing operations ---

	/**
	 * Stamps one brush footprint centred on (x, y). A {@code null} fill clears pixels.
	 */
	public void drawPoint(BrushStyle style, int x, int y, Rgba fill)
	{
		if (!canvas.isActiveLayerVisible()) return;
		stamp(style.copy(), x, y, fill);
	}

	/**
	 * Stamps the brush at every lattice point between the two ends, inclusive.
	 */
	public void drawLine(BrushStyle style, int x0, int y0, int x1, int y1, Rgba fill)
	{
		if (!canvas.isActiveLayerVisible()) return;
		BrushStyle lineStyle = style.copy();
		lineStyle.hardness = directionalHardness(lineStyle.shape, lineStyle.hardness, lineStyle.angle, x1 - x0, y1 - y0);
		if (lineStyle.hardness != style.hardness)
		{
			logger.trace("Stroke direction adjusted {} hardness {} -> {}", lineStyle.shape, style.hardness, lineStyle.hardness);
		}
		bresenham(x0, y0, x1, y1, (x, y) -> stamp(lineStyle, x, y, fill));
	}

	/**
	 * Clears a disk of radius {@code eraserSize} around (x, y) on the active layer.
	 */
	public void erasePoint(int eraserSize, int x, int y)
	{
		if (!canvas.isActiveLayerVisible()) return;
		stampHardDisk(x, y, eraserSize, null);
	}

	public void eraseLine(int eraserSize, int x0, int y0, int x1, int y1)
	{
		if (!canvas.isActiveLayerVisible()) return;
		bresenham(x0, y0, x1, y1, (x, y) -> stampHardDisk(x, y, eraserSize, null));
	}

	// --- Shape dispatch ---

	private void stamp(BrushStyle style, int x, int y, Rgba fill)
	{
		switch (style.shape)
		{
			case ROUND -> stampRound(x, y, style.size / 2.0, style.hardness, fill);
			case MOP -> stampMop(x, y, style.size / 2.0, style.hardness, fill);
			case RIGGER -> stampHardDisk(x, y, RIGGER_RADIUS, fill);
			case FLAT -> stampFlat(x, y, style, fill);
			case BRIGHT -> stampBright(x, y, style, fill);
			case ANGLE -> stampAngle(x, y, style, fill);
			case FILBERT -> stampFilbert(x, y, style, fill);
			case FAN -> stampFan(x, y, style, fill);
		}
	}

	private void stampRound(int cx, int cy, double radius, double hardness, Rgba fill)
	{
		int extent = (int) Math.ceil(radius);
		double radiusSq = radius * radius;
		double hardRadius = radius * hardness;
		for (int dy = -extent; dy <= extent; dy++)
		{
			for (int dx = -extent; dx <= extent; dx++)
			{
				double distSq = dx * dx + dy * dy;
				if (distSq > radiusSq) continue;
				if (fill == null)
				{
					changeLog.record(cx + dx, cy + dy, null);
					continue;
				}
				double multiplier = edgeFalloff(Math.sqrt(distSq), radius, hardRadius);
				int alpha = (int) Math.round(fill.a() * multiplier);
				changeLog.record(cx + dx, cy + dy, fill.withAlpha(alpha));
			}
		}
	}

	private void stampMop(int cx, int cy, double radius, double hardness, Rgba fill)
	{
		if (fill == null) return;
		double mopHardness = clamp(hardness * 0.24 + MOP_MIN_HARDNESS, MOP_MIN_HARDNESS, MOP_MAX_HARDNESS);

		if (radius < 0.5)
		{
			int alpha = (int) Math.round(fill.a() * MOP_OPACITY);
			if (alpha > 0)
			{
				changeLog.record(cx, cy, fill.withAlpha(alpha));
			}
			return;
		}

		int extent = (int) Math.ceil(radius);
		double radiusSq = radius * radius;
		double hardRadius = radius * mopHardness;
		for (int dy = -extent; dy <= extent; dy++)
		{
			for (int dx = -extent; dx <= extent; dx++)
			{
				double distSq = dx * dx + dy * dy;
				if (distSq > radiusSq) continue;
				double multiplier = edgeFalloff(Math.sqrt(distSq), radius, hardRadius);
				int alpha = (int) Math.round(fill.a() * MOP_OPACITY * multiplier);
				if (alpha > 0)
				{
					changeLog.record(cx + dx, cy + dy, fill.withAlpha(alpha));
				}
			}
		}
	}

	private void stampHardDisk(int cx, int cy, double radius, Rgba fill)
	{
		int extent = (int) Math.ceil(radius);
		double radiusSq = radius * radius;
		for (int dy = -extent; dy <= extent; dy++)
		{
			for (int dx = -extent; dx <= extent; dx++)
			{
				if (dx * dx + dy * dy <= radiusSq)
				{
					changeLog.record(cx + dx, cy + dy, fill);
				}
			}
		}
	}

	private void stampFlat(int cx, int cy, BrushStyle style, Rgba fill)
	{
		double width = style.size;
		double thickness = Math.max(1.0, style.hardness * width * FLAT_THICKNESS_RATIO);
		int extent = (int) Math.ceil(Math.hypot(width, thickness) / 2.0);
		LocalFrame.rotatedDegrees(style.angle)
				.scan(cx, cy, extent, LocalFrame.rectangle(width, thickness), (x, y) -> changeLog.record(x, y, fill));
	}

	private void stampBright(int cx, int cy, BrushStyle style, Rgba fill)
	{
		double width = style.size;
		double thickness = Math.max(1.0, width * BRIGHT_THICKNESS_RATIO);
		int extent = (int) Math.ceil(Math.hypot(width, thickness) / 2.0);
		LocalFrame.rotatedDegrees(style.angle)
				.scan(cx, cy, extent, LocalFrame.rectangle(width, thickness), (x, y) -> changeLog.record(x, y, fill));
	}

	private void stampAngle(int cx, int cy, BrushStyle style, Rgba fill)
	{
		double width = style.size;
		double thickness = Math.max(1.0, style.hardness * width * FLAT_THICKNESS_RATIO);
		double maxShearOffset = (width / 2.0) * Math.abs(Math.tan(Math.toRadians(ANGLE_SHEAR_DEGREES)));
		int extent = (int) Math.ceil(Math.hypot(width, thickness) / 2.0 + maxShearOffset);
		LocalFrame.rotatedDegrees(style.angle)
				.scan(cx, cy, extent, LocalFrame.shearedRectangle(width, thickness, ANGLE_SHEAR_DEGREES),
						(x, y) -> changeLog.record(x, y, fill));
	}

	private void stampFilbert(int cx, int cy, BrushStyle style, Rgba fill)
	{
		double semiMajor = style.size / 2.0;
		double semiMinor = style.size * clamp(style.hardness, 0.1, 1.0) / 2.0;
		if (semiMajor < 0.5 || semiMinor < 0.5)
		{
			changeLog.record(cx, cy, fill);
			return;
		}
		int extent = (int) Math.ceil(Math.max(semiMajor, semiMinor));
		LocalFrame.rotatedDegrees(style.angle)
				.scan(cx, cy, extent, LocalFrame.ellipse(semiMajor, semiMinor), (x, y) -> changeLog.record(x, y, fill));
	}

	private void stampFan(int cx, int cy, BrushStyle style, Rgba fill)
	{
		int bristles = Math.max(2, style.bristleCount != null ? style.bristleCount : BrushStyle.DEFAULT_BRISTLE_COUNT);
		double length = Math.max(1.0, style.size);
		double thickness = Math.min(Math.max(style.hardness * length * FAN_THICKNESS_RATIO, 1.0),
				length * FAN_MAX_THICKNESS_RATIO);
		double spread = Math.toRadians(FAN_SPREAD_DEGREES);
		double rotation = Math.toRadians(style.angle);
		int extent = (int) Math.ceil(Math.hypot(length, thickness) / 2.0);
		LocalFrame.LocalShape bristle = LocalFrame.rectangle(length, thickness);

		for (int i = 0; i < bristles; i++)
		{
			double position = (double) i / (bristles - 1);
			double bristleAngle = (position - 0.5) * spread + rotation;
			// Bristles start at the centre and extend outwards
			double midX = cx + (length / 2.0) * Math.cos(bristleAngle);
			double midY = cy + (length / 2.0) * Math.sin(bristleAngle);
			LocalFrame.rotatedRadians(bristleAngle)
					.scan(midX, midY, extent, bristle, (x, y) -> changeLog.record(x, y, fill));
		}
	}

	// --- Geometry helpers ---

	/**
	 * Alpha multiplier: 1 inside the hard core, falling linearly to 0 at the outer radius.
	 */
	static double edgeFalloff(double distance, double radius, double hardRadius)
	{
		if (distance <= hardRadius) return 1.0;
		if (radius <= hardRadius) return 0.0;
		return clamp((radius - distance) / (radius - hardRadius), 0.0, 1.0);
	}

	/**
	 * Hardness used for a line segment. Flat, Angle and Filbert brushes get thinner when the
	 * stroke runs along the brush axis and fuller when it runs across it.
	 */
	static double directionalHardness(BrushShape shape, double hardness, double brushAngleDegrees, double dx, double dy)
	{
		if (!shape.followsStrokeDirection() || Math.hypot(dx, dy) <= 0.1)
		{
			return hardness;
		}

		double diff = Math.abs(Math.atan2(dy, dx) - Math.toRadians(brushAngleDegrees));
		if (diff > Math.PI)
		{
			diff = 2.0 * Math.PI - diff;
		}
		if (diff > Math.PI / 2.0)
		{
			diff = Math.PI - diff;
		}
		double thicknessFactor = Math.sin(diff / (Math.PI / 2.0));

		if (shape == BrushShape.FILBERT)
		{
			return clamp(hardness * (1.0 - thicknessFactor) + thicknessFactor, 0.1, 1.0);
		}
		return clamp(hardness * Math.max(thicknessFactor, 0.1), 0.01, 1.0);
	}

	/**
	 * Integer Bresenham walk, visiting both end points.
	 */
	static void bresenham(int x0, int y0, int x1, int y1, LatticeVisitor visitor)
	{
		int dx = Math.abs(x1 - x0);
		int sx = x0 < x1 ? 1 : -1;
		int dy = -Math.abs(y1 - y0);
		int sy = y0 < y1 ? 1 : -1;
		int err = dx + dy;
		int x = x0;
		int y = y0;
		while (true)
		{
			visitor.visit(x, y);
			if (x == x1 && y == y1) break;
			int e2 = 2 * err;
			if (e2 >= dy)
			{
				err += dy;
				x += sx;
			}
			if (e2 <= dx)
			{
				err += dx;
				y += sy;
			}
		}
	}

	static double clamp(double value, double min, double max)
	{
		return Math.max(min, Math.min(max, value));
	}
}
