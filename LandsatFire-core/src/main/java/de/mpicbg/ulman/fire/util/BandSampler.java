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

import net.imglib2.RandomAccess;
import net.imglib2.type.numeric.real.FloatType;

/**
 * Reads all seven band values of a pixel at once. Every worker thread
 * needs its own sampler since the underlying RandomAccesses are not
 * thread-safe.
 */
public class BandSampler
{
	private final LandsatBands bands;
	private final RandomAccess<FloatType>[] ras;

	@SuppressWarnings("unchecked")
	public BandSampler(final LandsatBands bands)
	{
		this.bands = bands;
		ras = new RandomAccess[LandsatBands.NO_OF_BANDS];
		for (int b=0; b < LandsatBands.NO_OF_BANDS; ++b)
			ras[b] = bands.band(b+1).randomAccess();
	}

	/** Fills rho[0..6] with bands 1..7 at [x,y] and returns whether
	    the pixel is valid (all finite, no no-data). */
	public boolean read(final long x, final long y, final float[] rho)
	{
		for (int b=0; b < LandsatBands.NO_OF_BANDS; ++b)
		{
			ras[b].setPosition(x,0);
			ras[b].setPosition(y,1);
			rho[b] = ras[b].get().getRealFloat();
		}
		return bands.isValidPixel(rho);
	}
}
