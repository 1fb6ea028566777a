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
import net.imglib2.img.array.ArrayImgs;
import net.imglib2.type.logic.BitType;

/**
 * Bit images pack 64 pixels into one long, so they cannot be written from
 * several threads at once. Workers thus fill a plain row-major flag array
 * in parallel and convert it here, in one sequential sweep.
 */
class MaskImgs
{
	static
	Img<BitType> toBitImg(final boolean[] flags, final int width, final int height)
	{
		if (flags.length != width*height)
			throw new IllegalArgumentException("Flags array does not match the image size.");

		final Img<BitType> mask = ArrayImgs.bits(width,height);

		//NB: flat iteration order of an ArrayImg is the row-major order
		final Cursor<BitType> c = mask.cursor();
		int off = 0;
		while (c.hasNext())
			c.next().set( flags[off++] );

		return mask;
	}
}
