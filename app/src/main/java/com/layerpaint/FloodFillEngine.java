package com.layerpaint;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.Objects;

/**
 * Paint bucket: replaces the 4-connected region of the seed's color on the active layer.
 */
public class FloodFillEngine
{
	private static final Logger logger = LoggerFactory.getLogger(FloodFillEngine.class);

	private final LayeredCanvas canvas;
	private final ChangeLog changeLog;

	public FloodFillEngine(ChangeLog changeLog)
	{
		this.changeLog = changeLog;
		this.canvas = changeLog.canvas();
	}

	/**
	 * Fills from the seed cell. Returns the number of cells written.
	 */
	public int paintBucket(int seedX, int seedY, Rgba fill)
	{
		if (!canvas.contains(seedX, seedY)) return 0;
		if (!canvas.isActiveLayerVisible()) return 0;

		Rgba target = canvas.getActive(seedX, seedY);
		if (Objects.equals(target, fill)) return 0;

		int width = canvas.width();
		int height = canvas.height();
		boolean[] visited = new boolean[width * height];
		// Cells are packed as y * width + x; a cell may be queued more than once before it is visited
		ArrayDeque<Integer> queue = new ArrayDeque<>(1024);
		queue.add(seedY * width + seedX);

		int written = 0;
		while (!queue.isEmpty())
		{
			int idx = queue.poll();
			if (visited[idx]) continue;
			int x = idx % width;
			int y = idx / width;
			if (!Objects.equals(canvas.getActive(x, y), target)) continue;

			visited[idx] = true;
			if (changeLog.record(x, y, fill))
			{
				written++;
			}

			if (x > 0) queue.add(idx - 1);
			if (x + 1 < width) queue.add(idx + 1);
			if (y > 0) queue.add(idx - width);
			if (y + 1 < height) queue.add(idx + width);
		}

		logger.debug("Paint bucket at ({}, {}) filled {} cells", seedX, seedY, written);
		return written;
	}
}
