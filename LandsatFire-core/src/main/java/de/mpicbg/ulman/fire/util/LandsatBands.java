/*
 * CC BY-SA 4.0
 *
 * The code is licensed with "Attribution-ShareAlike 4.0 International license".
 * See the license details:
 *     https://creativecommons.org/licenses/by-sa/4.0/
 *
 * Copyright (C) 2021 LandsatFire contributors
 */
package de.mpicbg.ulman.fire.util;

import net.imglib2.RandomAccessibleInterval;
import net.imglib2.type.numeric.real.FloatType;
import net.imglib2.view.Views;

/**
 * The seven reflective Landsat-8 OLI bands (1..7) of one scene, all of the
 * same 2D size, each with its own no-data value. The images are only read,
 * never written, by the workers.
 */
public class LandsatBands
{
	public static final int NO_OF_BANDS = 7;

	///human readable names of the bands, index 0 is band 1
	public static final String[] BAND_NAMES = {
		"Coastal Aerosol", "Blue", "Green", "Red", "NIR", "SWIR 1", "SWIR 2" };

	private final RandomAccessibleInterval<FloatType>[] bands;
	private final float[] noData;

	private final long width;
	private final long height;

	/**
	 * Takes the bands in the order band 1 to band 7. No-data values are
	 * set to NaN which means that only non-finite pixel values are invalid.
	 */
	@SafeVarargs
	public LandsatBands(final RandomAccessibleInterval<FloatType>... inBands)
	{
		this(defaultNoData(), inBands);
	}

	/**
	 * Takes the bands in the order band 1 to band 7, and the no-data
	 * value of every band (NaN to disable no-data for that band).
	 */
	@SuppressWarnings("unchecked")
	public LandsatBands(final float[] noDataValues,
	                    final RandomAccessibleInterval<FloatType>... inBands)
	{
		if (inBands == null || inBands.length != NO_OF_BANDS)
			throw new IllegalArgumentException("Exactly "+NO_OF_BANDS+" bands are expected.");
		if (noDataValues == null || noDataValues.length != NO_OF_BANDS)
			throw new IllegalArgumentException("Exactly "+NO_OF_BANDS+" no-data values are expected.");

		for (int b=0; b < NO_OF_BANDS; ++b)
		{
			if (inBands[b] == null)
				throw new IllegalArgumentException("Band "+(b+1)+" is missing.");
			if (inBands[b].numDimensions() != 2)
				throw new ShapeMismatchException("Band "+(b+1)+" is not a 2D image, it has "
					+inBands[b].numDimensions()+" dimensions.");
		}

		width  = inBands[0].dimension(0);
		height = inBands[0].dimension(1);
		for (int b=1; b < NO_OF_BANDS; ++b)
			if (inBands[b].dimension(0) != width || inBands[b].dimension(1) != height)
				throw new ShapeMismatchException("Band "+(b+1)+" ("+BAND_NAMES[b]+") has size "
					+inBands[b].dimension(0)+" x "+inBands[b].dimension(1)
					+" but band 1 has size "+width+" x "+height+".");

		bands = new RandomAccessibleInterval[NO_OF_BANDS];
		for (int b=0; b < NO_OF_BANDS; ++b)
			bands[b] = Views.zeroMin(inBands[b]);

		noData = noDataValues.clone();
	}

	private static
	float[] defaultNoData()
	{
		final float[] nd = new float[NO_OF_BANDS];
		java.util.Arrays.fill(nd, Float.NaN);
		return nd;
	}

	///returns band 1..7, the image is zero-min
	public RandomAccessibleInterval<FloatType> band(final int bandNo)
	{
		checkBandNo(bandNo);
		return bands[bandNo-1];
	}

	///returns the no-data value of band 1..7
	public float noData(final int bandNo)
	{
		checkBandNo(bandNo);
		return noData[bandNo-1];
	}

	public long width()
	{ return width; }

	public long height()
	{ return height; }

	/**
	 * Checks the values of one pixel, given in the order band 1 to band 7
	 * (rho[0] is band 1), are all finite and none equals its band's no-data value.
	 */
	public boolean isValidPixel(final float[] rho)
	{
		for (int b=0; b < NO_OF_BANDS; ++b)
		{
			if (!Float.isFinite(rho[b])) return false;
			if (rho[b] == noData[b]) return false;
		}
		return true;
	}

	private static
	void checkBandNo(final int bandNo)
	{
		if (bandNo < 1 || bandNo > NO_OF_BANDS)
			throw new IllegalArgumentException("Band number must be within 1.."+NO_OF_BANDS+", got "+bandNo+".");
	}
}
