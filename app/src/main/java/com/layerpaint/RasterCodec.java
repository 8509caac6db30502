package com.layerpaint;

import org.apache.commons.imaging.ImageInfo;
import org.apache.commons.imaging.Imaging;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.imageio.ImageIO;
import java.awt.Color;
import java.awt.Graphics2D;
import java.awt.image.BufferedImage;
import java.io.File;
import java.io.IOException;

/**
 * Flattened single-image import and export. ImageIO does the work where it has a codec;
 * Commons Imaging covers formats the JDK cannot read and reports image metadata.
 */
class RasterCodec
{
	private static final Logger logger = LoggerFactory.getLogger(RasterCodec.class);

	static boolean canWrite(FileFormat format)
	{
		return ImageIO.getImageWritersByFormatName(format.imageIoName()).hasNext();
	}

	static void write(BufferedImage argb, File file, FileFormat format) throws IOException
	{
		BufferedImage output = format.supportsAlpha() ? argb : flattenOnto(argb, Color.WHITE);
		if (!ImageIO.write(output, format.imageIoName(), file))
		{
			throw new IOException("No " + format.imageIoName() + " writer accepted the image");
		}
		logger.debug("Wrote {}x{} {} to {}", argb.getWidth(), argb.getHeight(), format, file);
	}

	static BufferedImage read(File file) throws IOException
	{
		BufferedImage image = ImageIO.read(file);
		if (image == null)
		{
			// No ImageIO reader for this format (WebP on a stock JDK)
			image = Imaging.getBufferedImage(file);
		}
		if (image == null)
		{
			throw new IOException("Unable to decode image: " + file.getName());
		}

		if (logger.isDebugEnabled())
		{
			try
			{
				ImageInfo info = Imaging.getImageInfo(file);
				logger.debug("Read {} ({}, {} bpp{})", file.getName(), info.getFormat().getName(),
						info.getBitsPerPixel(), info.isTransparent() ? ", transparent" : "");
			}
			catch (IOException e)
			{
				logger.debug("No image metadata for {}: {}", file.getName(), e.getMessage());
			}
		}
		return image;
	}

	/**
	 * Draws an image with alpha over an opaque background, for formats that cannot store alpha.
	 */
	static BufferedImage flattenOnto(BufferedImage src, Color background)
	{
		BufferedImage rgb = new BufferedImage(src.getWidth(), src.getHeight(), BufferedImage.TYPE_INT_RGB);
		Graphics2D g2d = rgb.createGraphics();
		try
		{
			g2d.setColor(background);
			g2d.fillRect(0, 0, src.getWidth(), src.getHeight());
			g2d.drawImage(src, 0, 0, null);
		}
		finally
		{
			g2d.dispose();
		}
		return rgb;
	}
}
