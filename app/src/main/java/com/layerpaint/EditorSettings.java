package com.layerpaint;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.error.YAMLException;

import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.util.Map;

/**
 * Editor limits and defaults, read from {@code editor-settings.yml} on the classpath.
 * Missing keys, or a missing or unreadable file, fall back to the built-in values.
 */
public record EditorSettings(
		int maxUndoSteps,
		int maxSavedColors,
		int checkerSize,
		int defaultEraserSize,
		double defaultBrushSize)
{
	public static final String RESOURCE = "/editor-settings.yml";

	private static final Logger logger = LoggerFactory.getLogger(EditorSettings.class);

	public EditorSettings
	{
		if (maxUndoSteps <= 0 || maxSavedColors <= 0 || checkerSize <= 0)
		{
			throw new IllegalArgumentException(String.format(
					"Settings must be positive (undo=%d, palette=%d, checker=%d)",
					maxUndoSteps, maxSavedColors, checkerSize));
		}
	}

	public static EditorSettings defaults()
	{
		return new EditorSettings(ChangeLog.DEFAULT_CAPACITY, SavedPalette.DEFAULT_CAPACITY, 8, 3, 10.0);
	}

	public static EditorSettings load()
	{
		try (InputStream in = EditorSettings.class.getResourceAsStream(RESOURCE))
		{
			if (in == null)
			{
				logger.info("No {} on the classpath, using defaults", RESOURCE);
				return defaults();
			}
			return load(in);
		}
		catch (IOException e)
		{
			logger.warn("Could not read {}, using defaults", RESOURCE, e);
			return defaults();
		}
	}

	public static EditorSettings load(InputStream in)
	{
		EditorSettings fallback = defaults();
		try (Reader reader = new InputStreamReader(in, StandardCharsets.UTF_8))
		{
			Object loaded = new Yaml().load(reader);
			if (!(loaded instanceof Map<?, ?> yamlData))
			{
				logger.warn("Editor settings are empty or not a mapping, using defaults");
				return fallback;
			}
			EditorSettings settings = new EditorSettings(
					getInt(yamlData, "max_undo_steps", fallback.maxUndoSteps()),
					getInt(yamlData, "max_saved_colors", fallback.maxSavedColors()),
					getInt(yamlData, "checker_size", fallback.checkerSize()),
					getInt(yamlData, "default_eraser_size", fallback.defaultEraserSize()),
					getDouble(yamlData, "default_brush_size", fallback.defaultBrushSize()));
			logger.debug("Loaded editor settings: {}", settings);
			return settings;
		}
		catch (IOException | YAMLException | IllegalArgumentException e)
		{
			logger.warn("Invalid editor settings, using defaults", e);
			return fallback;
		}
	}

	private static int getInt(Map<?, ?> map, String key, int fallback)
	{
		Object value = map.get(key);
		if (value instanceof Number n) return n.intValue();
		if (value != null)
		{
			logger.warn("Ignoring non-numeric setting {}: {}", key, value);
		}
		return fallback;
	}

	private static double getDouble(Map<?, ?> map, String key, double fallback)
	{
		Object value = map.get(key);
		if (value instanceof Number n) return n.doubleValue();
		if (value != null)
		{
			logger.warn("Ignoring non-numeric setting {}: {}", key, value);
		}
		return fallback;
	}
}
