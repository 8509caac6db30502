package com.layerpaint;

import org.junit.jupiter.api.Test;

import java.io.ByteArrayInputStream;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;

import static org.junit.jupiter.api.Assertions.*;

class EditorSettingsTest
{
	private static InputStream yaml(String text)
	{
		return new ByteArrayInputStream(text.getBytes(StandardCharsets.UTF_8));
	}

	@Test
	void bundledSettingsMatchDefaults()
	{
		assertEquals(EditorSettings.defaults(), EditorSettings.load());
	}

	@Test
	void missingKeysFallBackIndividually()
	{
		EditorSettings settings = EditorSettings.load(yaml("max_undo_steps: 5\ndefault_brush_size: 2.5\n"));
		assertEquals(5, settings.maxUndoSteps());
		assertEquals(2.5, settings.defaultBrushSize());
		assertEquals(16, settings.maxSavedColors());
		assertEquals(8, settings.checkerSize());
	}

	@Test
	void nonNumericValueIsIgnored()
	{
		EditorSettings settings = EditorSettings.load(yaml("checker_size: large\n"));
		assertEquals(8, settings.checkerSize());
	}

	@Test
	void invalidYamlFallsBackToDefaults()
	{
		assertEquals(EditorSettings.defaults(), EditorSettings.load(yaml("max_undo_steps: [1, 2\n")));
		assertEquals(EditorSettings.defaults(), EditorSettings.load(yaml("- just\n- a list\n")));
		assertEquals(EditorSettings.defaults(), EditorSettings.load(yaml("")));
	}

	@Test
	void nonPositiveLimitFallsBackToDefaults()
	{
		assertEquals(EditorSettings.defaults(), EditorSettings.load(yaml("max_undo_steps: 0\n")));
	}

	@Test
	void settingsShapeNewToolState()
	{
		EditorSettings settings = new EditorSettings(4, 2, 8, 6, 3.0);
		ToolState tools = new ToolState(settings);
		assertEquals(2, tools.savedColors().capacity());
		assertEquals(6, tools.eraserSize());
		assertEquals(3.0, tools.brushStyle().size());
		assertEquals(BrushShape.ROUND, tools.brushStyle().shape());
	}
}
