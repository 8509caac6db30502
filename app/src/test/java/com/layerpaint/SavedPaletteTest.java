package com.layerpaint;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class SavedPaletteTest
{
	@Test
	void rejectsDuplicatesAndNull()
	{
		SavedPalette palette = new SavedPalette();
		assertTrue(palette.add(Rgba.BLACK));
		assertFalse(palette.add(new Rgba(0, 0, 0, 255)));
		assertFalse(palette.add(null));
		assertEquals(1, palette.size());
	}

	@Test
	void fullPaletteEvictsOldest()
	{
		SavedPalette palette = new SavedPalette(3);
		for (int i = 0; i < 4; i++)
		{
			palette.add(Rgba.opaque(i, 0, 0));
		}
		assertEquals(3, palette.size());
		assertEquals(List.of(Rgba.opaque(1, 0, 0), Rgba.opaque(2, 0, 0), Rgba.opaque(3, 0, 0)), palette.colors());
	}

	@Test
	void removeAndGetIgnoreBadIndexes()
	{
		SavedPalette palette = new SavedPalette();
		palette.add(Rgba.WHITE);
		palette.add(Rgba.BLACK);

		palette.remove(5);
		assertEquals(2, palette.size());
		palette.remove(0);
		assertEquals(Rgba.BLACK, palette.get(0));
		assertNull(palette.get(1));
		assertNull(palette.get(-1));
	}

	@Test
	void colorsViewIsReadOnly()
	{
		SavedPalette palette = new SavedPalette();
		assertThrows(UnsupportedOperationException.class, () -> palette.colors().add(Rgba.WHITE));
	}

	@Test
	void toolStatePicksFromSavedSwatches()
	{
		ToolState tools = new ToolState();
		Rgba teal = Rgba.opaque(0, 128, 128);
		tools.savedColors().add(teal);

		tools.useSecondaryFromSaved(0);
		tools.usePrimaryFromSaved(4);
		assertEquals(teal, tools.secondaryColor());
		assertEquals(Rgba.BLACK, tools.primaryColor());
		assertEquals(teal, tools.color(true));
	}
}
