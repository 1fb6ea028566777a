/*
 * CC BY-SA 4.0
 *
 * The code is licensed with "Attribution-ShareAlike 4.0 International license".
 * See the license details:
 *     https://creativecommons.org/licenses/by-sa/4.0/
 *
 * Copyright (C) 2021 LandsatFire contributors
 */
package de.mpicbg.ulman.fire.workers;

import net.imglib2.Cursor;
import net.imglib2.img.Img;
import net.imglib2.type.logic.BitType;
import net.imglib2.type.numeric.integer.UnsignedByteType;

import de.mpicbg.ulman.fire.util.FireClass;

/**
 * Forces the outer border of a classification image to the background class.
 * Within that border the moving window reaches outside the image, and since
 * real scenes often have no-data collars next to valid data, detections there
 * are not trusted at all.
 */
public class EdgeMasker
{
	/**
	 * If 'enabled', returns a copy of 'classes' where every pixel closer than
	 * 'borderWidth' pixels to any image edge is set to background, otherwise
	 * returns 'classes' itself. The input image is never modified.
	 */
	public static
	Img<UnsignedByteType> apply(final Img<UnsignedByteType> classes,
	                            final int borderWidth, final boolean enabled)
	{
		if (borderWidth < 0)
			throw new IllegalArgumentException("Border width must not be negative, got "+borderWidth+".");
		if (!enabled) return classes;

		final long width  = classes.dimension(0);
		final long height = classes.dimension(1);

		final Img<UnsignedByteType> out = classes.copy();
		final Cursor<UnsignedByteType> c = out.localizingCursor();
		while (c.hasNext())
		{
			c.fwd();
			final long x = c.getLongPosition(0) - classes.min(0);
			final long y = c.getLongPosition(1) - classes.min(1);
			if (isInBorder(x,y, width,height, borderWidth))
				c.get().set(FireClass.BACKGROUND.value);
		}

		return out;
	}

	/**
	 * Returns a copy of the 'mask' with every pixel of the border cleared,
	 * used for the potential fire mask so that it agrees with the masked
	 * classification. The input mask is never modified.
	 */
	public static
	Img<BitType> applyToMask(final Img<BitType> mask, final int borderWidth)
	{
		if (borderWidth < 0)
			throw new IllegalArgumentException("Border width must not be negative, got "+borderWidth+".");

		final long width  = mask.dimension(0);
		final long height = mask.dimension(1);

		final Img<BitType> out = mask.copy();
		final Cursor<BitType> c = out.localizingCursor();
		while (c.hasNext())
		{
			c.fwd();
			final long x = c.getLongPosition(0) - mask.min(0);
			final long y = c.getLongPosition(1) - mask.min(1);
			if (isInBorder(x,y, width,height, borderWidth))
				c.get().setZero();
		}

		return out;
	}

	///whether the pixel [x,y] of an image of the given size falls into the border
	public static
	boolean isInBorder(final long x, final long y, final long width, final long height,
	                   final int borderWidth)
	{
		return x < borderWidth || y < borderWidth
		    || x >= width-borderWidth || y >= height-borderWidth;
	}
}
