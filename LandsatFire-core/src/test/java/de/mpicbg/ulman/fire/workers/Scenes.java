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

import net.imglib2.RandomAccess;
import net.imglib2.img.Img;
import net.imglib2.img.array.ArrayImgs;
import net.imglib2.type.logic.BitType;
import net.imglib2.type.numeric.integer.UnsignedByteType;
import net.imglib2.type.numeric.real.FloatType;

import de.mpicbg.ulman.fire.util.LandsatBands;

/** Synthetic Landsat scenes for the tests. */
class Scenes
{
	///typical vegetated land, a valid background sample
	static final float[] VEGETATION = { 0.10f, 0.08f, 0.07f, 0.06f, 0.25f, 0.20f, 0.12f };
	///passes the unambiguous fire test only
	static final float[] UNAMBIGUOUS = { 0.10f, 0.08f, 0.07f, 0.06f, 0.20f, 0.40f, 0.90f };
	///passes both the DN folding and the unambiguous fire test
	static final float[] DN_FOLD_AND_FIRE = { 0.10f, 0.08f, 0.07f, 0.06f, 0.50f, 0.90f, 1.50f };
	///fire candidate that is not unambiguous, stands out of VEGETATION
	static final float[] POTENTIAL = { 0.10f, 0.08f, 0.07f, 0.06f, 0.20f, 0.15f, 0.45f };
	///clear water (R4 > R5 > R6 > R7, green over blue)
	static final float[] WATER = { 0.09f, 0.07f, 0.08f, 0.05f, 0.03f, 0.02f, 0.01f };

	/** The band images, row-major, index [band][y*width+x]. */
	final float[][] data;
	final int width;
	final int height;

	Scenes(final int width, final int height, final float[] filler)
	{
		this.width = width;
		this.height = height;
		data = new float[LandsatBands.NO_OF_BANDS][width*height];
		for (int b=0; b < LandsatBands.NO_OF_BANDS; ++b)
			java.util.Arrays.fill(data[b], filler[b]);
	}

	Scenes set(final int x, final int y, final float[] rho)
	{
		for (int b=0; b < LandsatBands.NO_OF_BANDS; ++b)
			data[b][y*width+x] = rho[b];
		return this;
	}

	Scenes setBand(final int x, final int y, final int bandNo, final float value)
	{
		data[bandNo-1][y*width+x] = value;
		return this;
	}

	@SuppressWarnings("unchecked")
	LandsatBands toBands()
	{
		final Img<FloatType>[] imgs = new Img[LandsatBands.NO_OF_BANDS];
		for (int b=0; b < LandsatBands.NO_OF_BANDS; ++b)
			imgs[b] = ArrayImgs.floats(data[b].clone(), width,height);
		return new LandsatBands(imgs);
	}

	static
	Img<BitType> mask(final boolean[] flags, final int width, final int height)
	{
		return MaskImgs.toBitImg(flags, width,height);
	}

	static
	int classAt(final Img<UnsignedByteType> img, final int x, final int y)
	{
		final RandomAccess<UnsignedByteType> ra = img.randomAccess();
		ra.setPosition(new long[] {x,y});
		return ra.get().get();
	}

	static
	boolean bitAt(final Img<BitType> img, final int x, final int y)
	{
		final RandomAccess<BitType> ra = img.randomAccess();
		ra.setPosition(new long[] {x,y});
		return ra.get().get();
	}
}
