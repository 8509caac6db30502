package com.layerpaint;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Objects;
import java.util.function.IntUnaryOperator;

/**
 * Delta-based undo history. Pixel writes go through {@link #record} into an in-progress
 * buffer that {@link #commitStroke} turns into one undo step. Every change remembers the
 * layer it was made on, so undo and redo land on that layer whichever layer is active.
 */
public class ChangeLog
{
	private static final Logger logger = LoggerFactory.getLogger(ChangeLog.class);

	public static final int DEFAULT_CAPACITY = 20;

	private final LayeredCanvas canvas;
	private final int capacity;

	// Oldest at the head, newest at the tail
	private final Deque<Stroke> undoStack = new ArrayDeque<>();
	private final Deque<Stroke> redoStack = new ArrayDeque<>();

	private List<CanvasChange> pending = new ArrayList<>();

	public ChangeLog(LayeredCanvas canvas)
	{
		this(canvas, DEFAULT_CAPACITY);
	}

	public ChangeLog(LayeredCanvas canvas, int capacity)
	{
		if (capacity <= 0)
		{
			throw new IllegalArgumentException("Undo capacity must be positive: " + capacity);
		}
		this.canvas = Objects.requireNonNull(canvas);
		this.capacity = capacity;
	}

	public LayeredCanvas canvas()
	{
		return canvas;
	}

	/**
	 * Writes a color to the active layer, remembering the previous value. Writes that would
	 * not change the cell, and coordinates outside the canvas, are ignored.
	 *
	 * @return true if the cell changed
	 */
	public boolean record(int x, int y, Rgba color)
	{
		if (!canvas.contains(x, y)) return false;
		Rgba old = canvas.getActive(x, y);
		if (Objects.equals(old, color)) return false;
		pending.add(new CanvasChange(x, y, canvas.activeLayerIndex(), old, color));
		canvas.setActive(x, y, color);
		return true;
	}

	/**
	 * Closes the in-progress stroke and pushes it as one undo step.
	 *
	 * @return true if there was anything to commit
	 */
	public boolean commitStroke()
	{
		if (pending.isEmpty()) return false;
		pushUndo(new Stroke(pending));
		redoStack.clear();
		logger.debug("Committed stroke of {} changes (undo depth {})", pending.size(), undoStack.size());
		pending = new ArrayList<>();
		return true;
	}

	/**
	 * Reverts and forgets the uncommitted changes, as if the gesture never happened.
	 */
	public void abandonStroke()
	{
		if (pending.isEmpty()) return;
		for (int i = pending.size() - 1; i >= 0; i--)
		{
			CanvasChange change = pending.get(i);
			canvas.setOnLayer(change.layerIndex(), change.x(), change.y(), change.oldColor());
		}
		logger.debug("Abandoned stroke of {} changes", pending.size());
		pending = new ArrayList<>();
		canvas.markDirty();
	}

	/**
	 * Reverts the newest stroke. A stroke still in progress is committed first, so it is the
	 * one reverted.
	 */
	public boolean undo()
	{
		commitStroke();
		Stroke stroke = undoStack.pollLast();
		if (stroke == null) return false;

		List<CanvasChange> changes = stroke.changes();
		CanvasChange[] mirror = new CanvasChange[changes.size()];
		for (int i = changes.size() - 1; i >= 0; i--)
		{
			CanvasChange change = changes.get(i);
			Rgba overwritten = canvas.getOnLayer(change.layerIndex(), change.x(), change.y());
			canvas.setOnLayer(change.layerIndex(), change.x(), change.y(), change.oldColor());
			mirror[i] = new CanvasChange(change.x(), change.y(), change.layerIndex(), change.oldColor(), overwritten);
		}
		redoStack.addLast(new Stroke(List.of(mirror)));
		canvas.markDirty();
		return true;
	}

	/**
	 * Reapplies the newest undone stroke. A stroke still in progress is committed first, which
	 * clears the redo stack like any other new stroke.
	 */
	public boolean redo()
	{
		commitStroke();
		Stroke stroke = redoStack.pollLast();
		if (stroke == null) return false;

		List<CanvasChange> inverse = new ArrayList<>(stroke.size());
		for (CanvasChange change : stroke.changes())
		{
			Rgba overwritten = canvas.getOnLayer(change.layerIndex(), change.x(), change.y());
			canvas.setOnLayer(change.layerIndex(), change.x(), change.y(), change.newColor());
			inverse.add(new CanvasChange(change.x(), change.y(), change.layerIndex(), overwritten, change.newColor()));
		}
		pushUndo(new Stroke(inverse));
		canvas.markDirty();
		return true;
	}

	private void pushUndo(Stroke stroke)
	{
		undoStack.addLast(stroke);
		while (undoStack.size() > capacity)
		{
			undoStack.pollFirst();
		}
	}

	// --- Keeping recorded layer indexes valid ---

	/**
	 * Call after two layers traded places so history keeps following the layers themselves.
	 */
	public void layersSwapped(int a, int b)
	{
		remapAll(layer -> layer == a ? b : (layer == b ? a : layer));
	}

	/**
	 * Call after a layer was deleted. Changes on that layer are discarded.
	 */
	public void layerRemoved(int index)
	{
		remapAll(layer -> layer == index ? -1 : (layer > index ? layer - 1 : layer));
	}

	private void remapAll(IntUnaryOperator mapping)
	{
		remapStack(undoStack, mapping);
		remapStack(redoStack, mapping);
		pending = new ArrayList<>(new Stroke(pending).remapLayers(mapping).changes());
	}

	private static void remapStack(Deque<Stroke> stack, IntUnaryOperator mapping)
	{
		List<Stroke> remapped = new ArrayList<>(stack.size());
		for (Stroke original : stack)
		{
			Stroke stroke = original.remapLayers(mapping);
			if (!stroke.isEmpty())
			{
				remapped.add(stroke);
			}
		}
		stack.clear();
		stack.addAll(remapped);
	}

	// --- State ---

	public boolean canUndo()
	{
		return !undoStack.isEmpty();
	}

	public boolean canRedo()
	{
		return !redoStack.isEmpty();
	}

	public boolean hasPendingChanges()
	{
		return !pending.isEmpty();
	}

	public int undoDepth()
	{
		return undoStack.size();
	}

	public int redoDepth()
	{
		return redoStack.size();
	}

	public int capacity()
	{
		return capacity;
	}

	/** Snapshot of the undo stack, oldest first. */
	List<Stroke> undoStrokes()
	{
		return List.copyOf(undoStack);
	}
}
