package com.layerpaint;

import java.util.ArrayList;
import java.util.List;
import java.util.function.IntUnaryOperator;

/**
 * One undo unit: the changes of a single gesture, in the order they were applied.
 */
public record Stroke(List<CanvasChange> changes)
{
	public Stroke
	{
		changes = List.copyOf(changes);
	}

	public int size()
	{
		return changes.size();
	}

	public boolean isEmpty()
	{
		return changes.isEmpty();
	}

	/**
	 * Rewrites layer indexes; changes mapped to a negative index are dropped.
	 */
	Stroke remapLayers(IntUnaryOperator mapping)
	{
		List<CanvasChange> remapped = new ArrayList<>(changes.size());
		for (CanvasChange change : changes)
		{
			int layer = mapping.applyAsInt(change.layerIndex());
			if (layer < 0) continue;
			remapped.add(layer == change.layerIndex() ? change : change.onLayer(layer));
		}
		return new Stroke(remapped);
	}
}
