package com.layerpaint;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.awt.Point;
import java.nio.file.Path;

/**
 * One open document and the editing state around it. The UI forwards pointer events here;
 * every call runs to completion on the caller's thread.
 */
public class PaintSession
{
	private static final Logger logger = LoggerFactory.getLogger(PaintSession.class);

	private final DocumentFiles files;
	private final LayeredCanvas canvas;
	private final ToolState toolState;
	private final ChangeLog changeLog;
	private final BrushEngine brushEngine;
	private final FloodFillEngine fillEngine;
	private final EmptyCellShader emptyCells;

	// Gesture state
	private Point lastPosition;
	private Tool strokeTool;
	private Rgba strokeColor;
	private boolean drawing;
	private Point pendingLineStart;

	private boolean unsavedChanges;
	private Path lastSavePath;

	public PaintSession(int width, int height)
	{
		this(new LayeredCanvas(width, height), null, EditorSettings.load());
	}

	public PaintSession(LayeredCanvas canvas, ToolState toolState, EditorSettings settings)
	{
		this.files = new DocumentFiles(settings);
		this.canvas = canvas;
		this.toolState = toolState != null ? toolState : new ToolState(settings);
		this.changeLog = new ChangeLog(canvas, settings.maxUndoSteps());
		this.brushEngine = new BrushEngine(changeLog);
		this.fillEngine = new FloodFillEngine(changeLog);
		this.emptyCells = EmptyCellShader.checkerboard(settings.checkerSize());
	}

	/**
	 * Opens any supported file as a new session. The path is remembered for quick save.
	 */
	public static PaintSession open(Path path, EditorSettings settings) throws DocumentException
	{
		LoadedDocument document = new DocumentFiles(settings).open(path);
		PaintSession session = new PaintSession(document.canvas(), document.toolState(), settings);
		session.lastSavePath = path;
		return session;
	}

	public LayeredCanvas canvas() { return canvas; }
	public ToolState toolState() { return toolState; }
	public ChangeLog changeLog() { return changeLog; }
	public boolean hasUnsavedChanges() { return unsavedChanges; }
	public Path lastSavePath() { return lastSavePath; }
	public Point pendingLineStart() { return pendingLineStart == null ? null : new Point(pendingLineStart); }

	// --- Pointer gestures ---

	public void pointerPressed(int x, int y, boolean secondary)
	{
		Rgba color = toolState.color(secondary);
		switch (toolState.tool())
		{
			case BRUSH ->
			{
				strokeColor = color;
				brushEngine.drawPoint(toolState.brushStyle(), x, y, color);
				beginDrag(x, y);
			}
			case ERASER ->
			{
				brushEngine.erasePoint(toolState.eraserSize(), x, y);
				beginDrag(x, y);
			}
			case PAINT_BUCKET ->
			{
				fillEngine.paintBucket(x, y, color);
				commit();
			}
			case COLOR_PICKER -> pickColor(x, y, secondary);
			case LINE -> placeLinePoint(x, y, color);
		}
	}

	public void pointerDragged(int x, int y)
	{
		if (!drawing) return;
		if (strokeTool == Tool.ERASER)
		{
			brushEngine.eraseLine(toolState.eraserSize(), lastPosition.x, lastPosition.y, x, y);
		}
		else
		{
			brushEngine.drawLine(toolState.brushStyle(), lastPosition.x, lastPosition.y, x, y, strokeColor);
		}
		lastPosition = new Point(x, y);
	}

	public void pointerReleased()
	{
		if (!drawing) return;
		drawing = false;
		lastPosition = null;
		strokeTool = null;
		commit();
	}

	/**
	 * Drops a pending line start point, or rolls back a stroke that is still being drawn.
	 */
	public void cancel()
	{
		if (pendingLineStart != null)
		{
			logger.debug("Line start at {},{} discarded", pendingLineStart.x, pendingLineStart.y);
			pendingLineStart = null;
		}
		if (changeLog.hasPendingChanges())
		{
			changeLog.abandonStroke();
		}
		drawing = false;
		lastPosition = null;
		strokeTool = null;
	}

	private void beginDrag(int x, int y)
	{
		drawing = true;
		strokeTool = toolState.tool();
		lastPosition = new Point(x, y);
	}

	private void placeLinePoint(int x, int y, Rgba color)
	{
		if (pendingLineStart == null)
		{
			pendingLineStart = new Point(x, y);
			return;
		}
		brushEngine.drawLine(toolState.brushStyle(), pendingLineStart.x, pendingLineStart.y, x, y, color);
		pendingLineStart = null;
		commit();
	}

	private void commit()
	{
		if (changeLog.commitStroke())
		{
			unsavedChanges = true;
		}
	}

	/**
	 * Copies the composited color under the pointer. Unpainted cells leave the color unchanged.
	 */
	public void pickColor(int x, int y, boolean secondary)
	{
		Rgba picked = canvas.get(x, y);
		if (picked == null) return;
		if (secondary)
		{
			toolState.setSecondaryColor(picked);
		}
		else
		{
			toolState.setPrimaryColor(picked);
		}
	}

	// --- History ---

	/**
	 * Ends any drag in progress where it is, then reverts the newest stroke.
	 */
	public void undo()
	{
		pointerReleased();
		if (changeLog.undo())
		{
			unsavedChanges = true;
		}
	}

	public void redo()
	{
		pointerReleased();
		if (changeLog.redo())
		{
			unsavedChanges = true;
		}
	}

	// --- Layers ---

	public void addLayer(String name)
	{
		canvas.addLayer(name);
		unsavedChanges = true;
	}

	public void removeLayer(int index)
	{
		if (canvas.removeLayer(index))
		{
			changeLog.layerRemoved(index);
			unsavedChanges = true;
		}
	}

	public void moveLayer(int index, LayerMove move)
	{
		int target = canvas.moveLayer(index, move);
		if (target >= 0)
		{
			changeLog.layersSwapped(index, target);
			unsavedChanges = true;
		}
	}

	public void toggleLayerVisibility(int index)
	{
		if (canvas.hasLayer(index))
		{
			canvas.toggleVisibility(index);
			unsavedChanges = true;
		}
	}

	public void renameLayer(int index, String name)
	{
		if (canvas.hasLayer(index) && name != null)
		{
			canvas.rename(index, name);
			unsavedChanges = true;
		}
	}

	public void setActiveLayer(int index)
	{
		canvas.setActiveLayer(index);
	}

	// --- Saved colors ---

	public void saveColor(Rgba color)
	{
		if (toolState.savedColors().add(color))
		{
			unsavedChanges = true;
		}
	}

	public void removeSavedColor(int index)
	{
		SavedPalette palette = toolState.savedColors();
		int before = palette.size();
		palette.remove(index);
		if (palette.size() != before)
		{
			unsavedChanges = true;
		}
	}

	// --- Rendering ---

	/**
	 * Composited RGBA bytes if anything changed since the last call, otherwise null.
	 */
	public byte[] renderIfDirty()
	{
		return canvas.consumeDirty() ? canvas.renderToRgba(emptyCells) : null;
	}

	// --- Files ---

	public void save(Path path) throws DocumentException
	{
		files.save(path, canvas, toolState);
		unsavedChanges = false;
		lastSavePath = path;
	}

	public void quickSave() throws DocumentException
	{
		if (lastSavePath == null)
		{
			throw new DocumentException(DocumentException.Reason.NO_SAVE_PATH, "Document has not been saved yet");
		}
		save(lastSavePath);
	}
}
