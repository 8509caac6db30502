package com.layerpaint;

import com.google.gson.FieldNamingPolicy;
import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

/**
 * Reads and writes the layered document format (JSON). Decoding tries the current schema
 * first and then each older schema in turn, migrating the first one that parses.
 */
public class DocumentCodec
{
	private static final Logger logger = LoggerFactory.getLogger(DocumentCodec.class);

	private final Gson gson;
	private final EditorSettings settings;
	private final List<DocumentSchema> schemas;

	public DocumentCodec()
	{
		this(EditorSettings.defaults());
	}

	public DocumentCodec(EditorSettings settings)
	{
		this.settings = settings;
		this.gson = new GsonBuilder()
				.setFieldNamingPolicy(FieldNamingPolicy.LOWER_CASE_WITH_UNDERSCORES)
				.serializeNulls()
				.create();
		this.schemas = List.of(new CurrentSchema(), new BrushSizeSchema());
	}

	// --- Wire model ---

	static class DocumentFile
	{
		int width;
		int height;
		List<LayerData> layers;
		int activeLayerIndex;
		int[] primaryColor;
		int[] secondaryColor;
		List<int[]> savedColors;
		BrushStyleData currentBrushStyle;
		int eraserSize;
	}

	/** Documents written before brush shapes existed: one integer brush size. */
	static class BrushSizeDocumentFile
	{
		int width;
		int height;
		List<LayerData> layers;
		int activeLayerIndex;
		int[] primaryColor;
		int[] secondaryColor;
		List<int[]> savedColors;
		int brushSize;
		int eraserSize;
	}

	static class LayerData
	{
		String name;
		List<int[]> data;
		boolean visible;
	}

	static class BrushStyleData
	{
		BrushShape brushType;
		double size;
		double angle;
		double hardness;
		Integer bristleCount;
		Double taperStrength;
	}

	/**
	 * One known version of the document layout, parsed straight into the current wire model.
	 */
	interface DocumentSchema
	{
		String name();

		DocumentFile parse(JsonObject root) throws JsonParseException;
	}

	private class CurrentSchema implements DocumentSchema
	{
		@Override
		public String name()
		{
			return "current";
		}

		@Override
		public DocumentFile parse(JsonObject root)
		{
			requireMembers(root, "width", "height", "layers", "active_layer_index", "primary_color",
					"secondary_color", "saved_colors", "current_brush_style", "eraser_size");
			JsonElement style = root.get("current_brush_style");
			if (!style.isJsonObject())
			{
				throw new JsonParseException("current_brush_style is not an object");
			}
			requireMembers(style.getAsJsonObject(), "brush_type", "size", "angle", "hardness");
			DocumentFile file = gson.fromJson(root, DocumentFile.class);
			if (file.currentBrushStyle.brushType == null)
			{
				throw new JsonParseException("Unknown brush type: " + style.getAsJsonObject().get("brush_type"));
			}
			return file;
		}
	}

	private class BrushSizeSchema implements DocumentSchema
	{
		@Override
		public String name()
		{
			return "brush-size";
		}

		@Override
		public DocumentFile parse(JsonObject root)
		{
			requireMembers(root, "width", "height", "layers", "active_layer_index", "primary_color",
					"secondary_color", "saved_colors", "brush_size", "eraser_size");
			return migrate(gson.fromJson(root, BrushSizeDocumentFile.class));
		}
	}

	/**
	 * Maps the single brush size onto a hard round brush; everything else carries over as is.
	 */
	static DocumentFile migrate(BrushSizeDocumentFile old)
	{
		DocumentFile file = new DocumentFile();
		file.width = old.width;
		file.height = old.height;
		file.layers = old.layers;
		file.activeLayerIndex = old.activeLayerIndex;
		file.primaryColor = old.primaryColor;
		file.secondaryColor = old.secondaryColor;
		file.savedColors = old.savedColors;
		file.currentBrushStyle = toData(BrushStyle.roundOfSize(old.brushSize));
		file.eraserSize = old.eraserSize;
		return file;
	}

	private static void requireMembers(JsonObject object, String... names)
	{
		for (String name : names)
		{
			if (!object.has(name) || object.get(name).isJsonNull())
			{
				throw new JsonParseException("Missing field '" + name + "'");
			}
		}
	}

	// --- Encoding ---

	public byte[] encode(LayeredCanvas canvas, ToolState toolState)
	{
		DocumentFile file = new DocumentFile();
		file.width = canvas.width();
		file.height = canvas.height();
		file.layers = new ArrayList<>(canvas.layerCount());
		for (PixelLayer layer : canvas.layers())
		{
			LayerData data = new LayerData();
			data.name = layer.name();
			data.visible = layer.isVisible();
			data.data = new ArrayList<>(layer.cells.length);
			for (int i = 0; i < layer.cells.length; i++)
			{
				data.data.add(toWire(layer.cell(i)));
			}
			file.layers.add(data);
		}
		file.activeLayerIndex = canvas.activeLayerIndex();
		file.primaryColor = toWire(toolState.primaryColor());
		file.secondaryColor = toWire(toolState.secondaryColor());
		file.savedColors = new ArrayList<>();
		for (Rgba color : toolState.savedColors().colors())
		{
			file.savedColors.add(toWire(color));
		}
		file.currentBrushStyle = toData(toolState.brushStyle());
		file.eraserSize = toolState.eraserSize();

		return gson.toJson(file).getBytes(StandardCharsets.UTF_8);
	}

	// --- Decoding ---

	public LoadedDocument decode(byte[] content) throws DocumentException
	{
		JsonObject root;
		try
		{
			JsonElement element = JsonParser.parseString(new String(content, StandardCharsets.UTF_8));
			if (!element.isJsonObject())
			{
				throw new DocumentException(DocumentException.Reason.DECODE, "Document is not a JSON object");
			}
			root = element.getAsJsonObject();
		}
		catch (JsonParseException e)
		{
			throw new DocumentException(DocumentException.Reason.DECODE, "Document is not valid JSON", e);
		}

		List<String> failures = new ArrayList<>();
		JsonParseException lastError = null;
		for (DocumentSchema schema : schemas)
		{
			try
			{
				LoadedDocument document = build(schema.parse(root));
				if (schema != schemas.get(0))
				{
					logger.info("Migrated document from the {} schema", schema.name());
				}
				return document;
			}
			catch (JsonParseException e)
			{
				logger.debug("Document does not match the {} schema: {}", schema.name(), e.getMessage());
				failures.add(schema.name() + ": " + e.getMessage());
				lastError = e;
			}
		}
		throw new DocumentException(DocumentException.Reason.DECODE,
				"Not a document in any known format (" + String.join("; ", failures) + ")", lastError);
	}

	private LoadedDocument build(DocumentFile file)
	{
		if (file.width <= 0 || file.height <= 0)
		{
			throw new JsonParseException("Invalid dimensions " + file.width + "x" + file.height);
		}
		if (file.layers == null || file.layers.isEmpty())
		{
			throw new JsonParseException("Document has no layers");
		}
		if (file.activeLayerIndex < 0 || file.activeLayerIndex >= file.layers.size())
		{
			throw new JsonParseException("Active layer " + file.activeLayerIndex + " out of range");
		}

		int cellCount;
		try
		{
			cellCount = PixelLayer.cellCount(file.width, file.height);
		}
		catch (IllegalArgumentException e)
		{
			throw new JsonParseException(e.getMessage(), e);
		}
		List<PixelLayer> layers = new ArrayList<>(file.layers.size());
		for (LayerData data : file.layers)
		{
			if (data == null || data.name == null || data.data == null)
			{
				throw new JsonParseException("Incomplete layer entry");
			}
			if (data.data.size() != cellCount)
			{
				throw new JsonParseException(String.format("Layer '%s' has %d pixels, expected %d",
						data.name, data.data.size(), cellCount));
			}
			Rgba[] cells = new Rgba[cellCount];
			for (int i = 0; i < cellCount; i++)
			{
				int[] pixel = data.data.get(i);
				cells[i] = pixel == null ? null : fromWire(pixel);
			}
			layers.add(new PixelLayer(data.name, data.visible, file.width, file.height, cells));
		}
		LayeredCanvas canvas = new LayeredCanvas(file.width, file.height, layers, file.activeLayerIndex);

		ToolState toolState = new ToolState(settings);
		toolState.setPrimaryColor(fromWire(file.primaryColor));
		toolState.setSecondaryColor(fromWire(file.secondaryColor));
		for (int[] saved : file.savedColors)
		{
			toolState.savedColors().add(fromWire(saved));
		}
		BrushStyleData style = file.currentBrushStyle;
		toolState.setBrushStyle(new BrushStyle(style.brushType, style.size, style.angle, style.hardness,
				style.bristleCount, style.taperStrength));
		toolState.setEraserSize(file.eraserSize);

		return new LoadedDocument(canvas, toolState);
	}

	// --- Field conversion ---

	static BrushStyleData toData(BrushStyle style)
	{
		BrushStyleData data = new BrushStyleData();
		data.brushType = style.shape();
		data.size = style.size();
		data.angle = style.angle();
		data.hardness = style.hardness();
		data.bristleCount = style.bristleCount();
		data.taperStrength = style.taperStrength();
		return data;
	}

	private static int[] toWire(Rgba color)
	{
		return color == null ? null : new int[]{color.r(), color.g(), color.b(), color.a()};
	}

	private static Rgba fromWire(int[] rgba)
	{
		if (rgba == null || rgba.length != 4)
		{
			throw new JsonParseException("Color must have 4 channels");
		}
		try
		{
			return new Rgba(rgba[0], rgba[1], rgba[2], rgba[3]);
		}
		catch (IllegalArgumentException e)
		{
			throw new JsonParseException(e.getMessage(), e);
		}
	}
}
