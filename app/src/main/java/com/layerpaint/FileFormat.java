package com.layerpaint;

import java.nio.file.Path;
import java.util.Locale;

/**
 * File formats recognised by extension. Only {@link #DOCUMENT} keeps layers; the raster
 * formats store a flattened composite.
 */
public enum FileFormat
{
	PNG("png", true),
	JPEG("jpg", false),
	BMP("bmp", false),
	TIFF("tiff", true),
	GIF("gif", true),
	WEBP("webp", true),
	DOCUMENT("rustiq", true),
	UNKNOWN("", false);

	private final String extension;
	private final boolean supportsAlpha;

	FileFormat(String extension, boolean supportsAlpha)
	{
		this.extension = extension;
		this.supportsAlpha = supportsAlpha;
	}

	public static FileFormat fromExtension(String ext)
	{
		return switch (ext.toLowerCase(Locale.ROOT))
		{
			case "png" -> PNG;
			case "jpg", "jpeg" -> JPEG;
			case "bmp" -> BMP;
			case "tiff", "tif" -> TIFF;
			case "gif" -> GIF;
			case "webp" -> WEBP;
			case "rustiq" -> DOCUMENT;
			default -> UNKNOWN;
		};
	}

	public static FileFormat fromPath(Path path)
	{
		Path fileName = path.getFileName();
		if (fileName == null) return UNKNOWN;
		String name = fileName.toString();
		int dot = name.lastIndexOf('.');
		if (dot < 0 || dot == name.length() - 1) return UNKNOWN;
		return fromExtension(name.substring(dot + 1));
	}

	/** Canonical extension, without the dot. */
	public String extension()
	{
		return extension;
	}

	public boolean isRaster()
	{
		return this != DOCUMENT && this != UNKNOWN;
	}

	boolean supportsAlpha()
	{
		return supportsAlpha;
	}

	/** Format name understood by {@link javax.imageio.ImageIO}. */
	String imageIoName()
	{
		return this == JPEG ? "jpeg" : extension;
	}
}
