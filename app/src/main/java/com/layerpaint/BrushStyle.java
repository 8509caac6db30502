package com.layerpaint;

import java.util.Objects;

/**
 * Live brush settings edited by the tool panel. Drawing code works on a {@link #copy()} so
 * that changing a setting mid-stroke never alters pixels already rasterized.
 */
public class BrushStyle
{
	public static final int DEFAULT_BRISTLE_COUNT = 10;

	BrushShape shape;
	double size;
	double angle;       // degrees, [-180, 180]
	double hardness;    // [0, 1]
	Integer bristleCount;
	Double taperStrength; // reserved, not used by any shape yet

	public BrushStyle()
	{
		this(BrushShape.ROUND, 10.0, 0.0, 1.0, DEFAULT_BRISTLE_COUNT, null);
	}

	public BrushStyle(BrushShape shape, double size, double angle, double hardness,
					  Integer bristleCount, Double taperStrength)
	{
		this.shape = Objects.requireNonNull(shape);
		this.size = size;
		this.angle = angle;
		this.hardness = hardness;
		this.bristleCount = bristleCount;
		this.taperStrength = taperStrength;
	}

	/**
	 * The brush an old document's single integer size maps to.
	 */
	public static BrushStyle roundOfSize(double size)
	{
		return new BrushStyle(BrushShape.ROUND, size, 0.0, 1.0, null, null);
	}

	public BrushStyle copy()
	{
		return new BrushStyle(shape, size, angle, hardness, bristleCount, taperStrength);
	}

	public BrushShape shape() { return shape; }
	public double size() { return size; }
	public double angle() { return angle; }
	public double hardness() { return hardness; }
	public Integer bristleCount() { return bristleCount; }
	public Double taperStrength() { return taperStrength; }

	public void setShape(BrushShape shape) { this.shape = Objects.requireNonNull(shape); }
	public void setSize(double size) { this.size = size; }
	public void setAngle(double angle) { this.angle = angle; }
	public void setHardness(double hardness) { this.hardness = hardness; }
	public void setBristleCount(Integer bristleCount) { this.bristleCount = bristleCount; }
	public void setTaperStrength(Double taperStrength) { this.taperStrength = taperStrength; }

	@Override
	public boolean equals(Object o)
	{
		if (this == o) return true;
		if (!(o instanceof BrushStyle other)) return false;
		return shape == other.shape
				&& Double.compare(size, other.size) == 0
				&& Double.compare(angle, other.angle) == 0
				&& Double.compare(hardness, other.hardness) == 0
				&& Objects.equals(bristleCount, other.bristleCount)
				&& Objects.equals(taperStrength, other.taperStrength);
	}

	@Override
	public int hashCode()
	{
		return Objects.hash(shape, size, angle, hardness, bristleCount, taperStrength);
	}

	@Override
	public String toString()
	{
		return String.format("%s size=%.1f angle=%.1f hardness=%.2f", shape.displayName, size, angle, hardness);
	}
}
