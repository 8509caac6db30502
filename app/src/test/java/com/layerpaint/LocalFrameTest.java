package com.layerpaint;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class LocalFrameTest
{
	@Test
	void unrotatedFrameIsIdentity()
	{
		LocalFrame frame = LocalFrame.rotatedDegrees(0);
		assertEquals(3.0, frame.localX(3, -2));
		assertEquals(-2.0, frame.localY(3, -2));
	}

	@Test
	void quarterTurnSwapsAxes()
	{
		LocalFrame frame = LocalFrame.rotatedDegrees(90);
		assertEquals(1.0, frame.localX(0, 1), 1e-12);
		assertEquals(-1.0, frame.localY(1, 0), 1e-12);
	}

	@Test
	void scanVisitsCellsInsideShape()
	{
		List<int[]> visited = new ArrayList<>();
		LocalFrame.rotatedDegrees(0).scan(5, 5, 3, LocalFrame.rectangle(2, 0), (x, y) -> visited.add(new int[]{x, y}));

		assertEquals(3, visited.size());
		assertArrayEquals(new int[]{4, 5}, visited.get(0));
		assertArrayEquals(new int[]{6, 5}, visited.get(2));
	}

	@Test
	void shapesTestLocalCoordinates()
	{
		assertTrue(LocalFrame.ellipse(4, 2).contains(4, 0));
		assertFalse(LocalFrame.ellipse(4, 2).contains(0, 2.1));
		assertTrue(LocalFrame.shearedRectangle(4, 1, 45).contains(2, 2));
		assertFalse(LocalFrame.shearedRectangle(4, 1, 45).contains(2, 0));
	}
}
