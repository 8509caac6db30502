package com.layerpaint;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.awt.image.BufferedImage;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Opens and saves files, choosing the format from the file extension. Layered documents go
 * through {@link DocumentCodec}; raster formats export or import a flattened single layer.
 */
public class DocumentFiles
{
	private static final Logger logger = LoggerFactory.getLogger(DocumentFiles.class);

	private final DocumentCodec codec;
	private final EditorSettings settings;

	public DocumentFiles(EditorSettings settings)
	{
		this.settings = settings;
		this.codec = new DocumentCodec(settings);
	}

	public void save(Path path, LayeredCanvas canvas, ToolState toolState) throws DocumentException
	{
		FileFormat format = requireKnown(path);
		if (format == FileFormat.DOCUMENT)
		{
			byte[] content = codec.encode(canvas, toolState);
			try
			{
				Files.write(path, content);
			}
			catch (IOException e)
			{
				throw new DocumentException(DocumentException.Reason.IO, "Could not write " + path, e);
			}
			logger.info("Saved {} layers ({}x{}) to {}", canvas.layerCount(), canvas.width(), canvas.height(), path);
			return;
		}

		if (!RasterCodec.canWrite(format))
		{
			throw new DocumentException(DocumentException.Reason.UNSUPPORTED_FORMAT,
					"Saving as " + format.extension() + " is not supported: " + path);
		}
		try
		{
			RasterCodec.write(canvas.toImage(), path.toFile(), format);
		}
		catch (IOException e)
		{
			throw new DocumentException(DocumentException.Reason.IO, "Could not export " + path, e);
		}
		logger.info("Exported flattened {}x{} image to {}", canvas.width(), canvas.height(), path);
	}

	public LoadedDocument open(Path path) throws DocumentException
	{
		FileFormat format = requireKnown(path);
		if (format == FileFormat.DOCUMENT)
		{
			byte[] content;
			try
			{
				content = Files.readAllBytes(path);
			}
			catch (IOException e)
			{
				throw new DocumentException(DocumentException.Reason.IO, "Could not read " + path, e);
			}
			LoadedDocument document = codec.decode(content);
			logger.info("Opened {} ({} layers, {}x{})", path, document.canvas().layerCount(),
					document.canvas().width(), document.canvas().height());
			return document;
		}

		BufferedImage image;
		try
		{
			image = RasterCodec.read(path.toFile());
		}
		catch (IOException e)
		{
			throw new DocumentException(DocumentException.Reason.IO, "Could not open image " + path, e);
		}
		logger.info("Imported {}x{} image from {}", image.getWidth(), image.getHeight(), path);
		return new LoadedDocument(LayeredCanvas.fromImage(image), new ToolState(settings));
	}

	private static FileFormat requireKnown(Path path) throws DocumentException
	{
		FileFormat format = FileFormat.fromPath(path);
		if (format == FileFormat.UNKNOWN)
		{
			throw new DocumentException(DocumentException.Reason.UNSUPPORTED_FORMAT, "Format not supported: " + path);
		}
		return format;
	}
}
