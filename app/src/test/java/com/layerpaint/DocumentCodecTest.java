package com.layerpaint;

import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;

import static org.junit.jupiter.api.Assertions.*;

class DocumentCodecTest
{
	private static final Rgba RED = Rgba.opaque(255, 0, 0);
	private static final Rgba HALF_GREEN = new Rgba(0, 255, 0, 128);

	private final DocumentCodec codec = new DocumentCodec();

	private static byte[] utf8(String json)
	{
		return json.getBytes(StandardCharsets.UTF_8);
	}

	// --- Current schema ---

	@Test
	void saveThenLoadRestoresEverything() throws Exception
	{
		LayeredCanvas canvas = new LayeredCanvas(3, 2);
		canvas.setActive(0, 0, RED);
		canvas.addLayer("Ink");
		canvas.setActive(2, 1, HALF_GREEN);
		canvas.addLayer("Hidden");
		canvas.toggleVisibility(2);
		canvas.setActiveLayer(1);

		ToolState tools = new ToolState();
		tools.setPrimaryColor(HALF_GREEN);
		tools.setSecondaryColor(RED);
		tools.savedColors().add(RED);
		tools.savedColors().add(Rgba.WHITE);
		tools.setBrushStyle(new BrushStyle(BrushShape.FAN, 14.5, -30, 0.4, 6, null));
		tools.setEraserSize(9);

		LoadedDocument loaded = codec.decode(codec.encode(canvas, tools));
		LayeredCanvas restored = loaded.canvas();

		assertEquals(3, restored.width());
		assertEquals(2, restored.height());
		assertEquals(3, restored.layerCount());
		assertEquals(1, restored.activeLayerIndex());
		for (int i = 0; i < canvas.layerCount(); i++)
		{
			assertEquals(canvas.layer(i).name(), restored.layer(i).name());
			assertEquals(canvas.layer(i).isVisible(), restored.layer(i).isVisible());
			for (int y = 0; y < 2; y++)
			{
				for (int x = 0; x < 3; x++)
				{
					assertEquals(canvas.getOnLayer(i, x, y), restored.getOnLayer(i, x, y));
				}
			}
		}

		ToolState restoredTools = loaded.toolState();
		assertEquals(HALF_GREEN, restoredTools.primaryColor());
		assertEquals(RED, restoredTools.secondaryColor());
		assertEquals(tools.savedColors().colors(), restoredTools.savedColors().colors());
		assertEquals(tools.brushStyle(), restoredTools.brushStyle());
		assertEquals(9, restoredTools.eraserSize());
	}

	@Test
	void encodesDocumentFieldNames()
	{
		String json = new String(codec.encode(new LayeredCanvas(1, 1), new ToolState()), StandardCharsets.UTF_8);

		assertTrue(json.contains("\"active_layer_index\":0"));
		assertTrue(json.contains("\"current_brush_style\""));
		assertTrue(json.contains("\"brush_type\":\"Round\""));
		assertTrue(json.contains("\"data\":[null]"), "Unpainted cells are written as null");
		assertTrue(json.contains("\"eraser_size\":3"));
		assertEquals("Round", BrushShape.ROUND.displayName());
	}

	// --- Migration ---

	@Test
	void brushSizeDocumentMigratesToRoundBrush() throws Exception
	{
		String legacy = "{\"width\":2,\"height\":1,"
				+ "\"layers\":[{\"name\":\"Background\",\"data\":[[255,0,0,255],null],\"visible\":true}],"
				+ "\"active_layer_index\":0,"
				+ "\"primary_color\":[0,0,0,255],\"secondary_color\":[255,255,255,255],"
				+ "\"saved_colors\":[[1,2,3,255]],"
				+ "\"brush_size\":7,\"eraser_size\":4}";

		LoadedDocument loaded = codec.decode(utf8(legacy));

		BrushStyle style = loaded.toolState().brushStyle();
		assertEquals(BrushShape.ROUND, style.shape());
		assertEquals(7.0, style.size());
		assertEquals(1.0, style.hardness());
		assertEquals(0.0, style.angle());
		assertEquals(4, loaded.toolState().eraserSize());
		assertEquals(RED, loaded.canvas().get(0, 0));
		assertNull(loaded.canvas().get(1, 0));
		assertEquals(new Rgba(1, 2, 3, 255), loaded.toolState().savedColors().get(0));
	}

	@Test
	void migrateCopiesEverythingButBrush()
	{
		DocumentCodec.BrushSizeDocumentFile old = new DocumentCodec.BrushSizeDocumentFile();
		old.width = 5;
		old.height = 6;
		old.activeLayerIndex = 2;
		old.brushSize = 12;
		old.eraserSize = 8;

		DocumentCodec.DocumentFile file = DocumentCodec.migrate(old);
		assertEquals(5, file.width);
		assertEquals(6, file.height);
		assertEquals(2, file.activeLayerIndex);
		assertEquals(8, file.eraserSize);
		assertEquals(BrushShape.ROUND, file.currentBrushStyle.brushType);
		assertEquals(12.0, file.currentBrushStyle.size);
		assertNull(file.currentBrushStyle.bristleCount);
	}

	// --- Rejected input ---

	@Test
	void notJsonIsDecodeError()
	{
		DocumentException e = assertThrows(DocumentException.class, () -> codec.decode(utf8("this is not json {")));
		assertEquals(DocumentException.Reason.DECODE, e.reason());
	}

	@Test
	void jsonArrayIsDecodeError()
	{
		DocumentException e = assertThrows(DocumentException.class, () -> codec.decode(utf8("[1,2,3]")));
		assertEquals(DocumentException.Reason.DECODE, e.reason());
	}

	@Test
	void documentWithoutBrushFieldsMatchesNoSchema()
	{
		String json = "{\"width\":1,\"height\":1,"
				+ "\"layers\":[{\"name\":\"Background\",\"data\":[null],\"visible\":true}],"
				+ "\"active_layer_index\":0,"
				+ "\"primary_color\":[0,0,0,255],\"secondary_color\":[255,255,255,255],"
				+ "\"saved_colors\":[],\"eraser_size\":3}";

		DocumentException e = assertThrows(DocumentException.class, () -> codec.decode(utf8(json)));
		assertEquals(DocumentException.Reason.DECODE, e.reason());
		assertTrue(e.getMessage().contains("current"));
		assertTrue(e.getMessage().contains("brush-size"));
	}

	@Test
	void wrongPixelCountIsDecodeError()
	{
		String json = "{\"width\":2,\"height\":2,"
				+ "\"layers\":[{\"name\":\"Background\",\"data\":[null,null,null],\"visible\":true}],"
				+ "\"active_layer_index\":0,"
				+ "\"primary_color\":[0,0,0,255],\"secondary_color\":[255,255,255,255],"
				+ "\"saved_colors\":[],\"brush_size\":3,\"eraser_size\":3}";

		DocumentException e = assertThrows(DocumentException.class, () -> codec.decode(utf8(json)));
		assertEquals(DocumentException.Reason.DECODE, e.reason());
	}

	@Test
	void dimensionsOverflowingCellCountAreDecodeError()
	{
		String json = "{\"width\":65536,\"height\":65536,"
				+ "\"layers\":[{\"name\":\"Background\",\"data\":[],\"visible\":true}],"
				+ "\"active_layer_index\":0,"
				+ "\"primary_color\":[0,0,0,255],\"secondary_color\":[255,255,255,255],"
				+ "\"saved_colors\":[],\"brush_size\":3,\"eraser_size\":3}";

		DocumentException e = assertThrows(DocumentException.class, () -> codec.decode(utf8(json)));
		assertEquals(DocumentException.Reason.DECODE, e.reason());
		assertTrue(e.getMessage().contains("65536x65536"));
	}

	@Test
	void activeLayerOutOfRangeIsDecodeError()
	{
		String json = "{\"width\":1,\"height\":1,"
				+ "\"layers\":[{\"name\":\"Background\",\"data\":[null],\"visible\":true}],"
				+ "\"active_layer_index\":1,"
				+ "\"primary_color\":[0,0,0,255],\"secondary_color\":[255,255,255,255],"
				+ "\"saved_colors\":[],\"brush_size\":3,\"eraser_size\":3}";

		assertThrows(DocumentException.class, () -> codec.decode(utf8(json)));
	}

	@Test
	void channelOutOfRangeIsDecodeError()
	{
		String json = "{\"width\":1,\"height\":1,"
				+ "\"layers\":[{\"name\":\"Background\",\"data\":[[300,0,0,255]],\"visible\":true}],"
				+ "\"active_layer_index\":0,"
				+ "\"primary_color\":[0,0,0,255],\"secondary_color\":[255,255,255,255],"
				+ "\"saved_colors\":[],\"brush_size\":3,\"eraser_size\":3}";

		DocumentException e = assertThrows(DocumentException.class, () -> codec.decode(utf8(json)));
		assertEquals(DocumentException.Reason.DECODE, e.reason());
	}

	@Test
	void unknownBrushTypeIsDecodeError()
	{
		String json = "{\"width\":1,\"height\":1,"
				+ "\"layers\":[{\"name\":\"Background\",\"data\":[null],\"visible\":true}],"
				+ "\"active_layer_index\":0,"
				+ "\"primary_color\":[0,0,0,255],\"secondary_color\":[255,255,255,255],"
				+ "\"saved_colors\":[],\"eraser_size\":3,"
				+ "\"current_brush_style\":{\"brush_type\":\"Sponge\",\"size\":5,\"angle\":0,\"hardness\":1}}";

		DocumentException e = assertThrows(DocumentException.class, () -> codec.decode(utf8(json)));
		assertEquals(DocumentException.Reason.DECODE, e.reason());
	}
}
