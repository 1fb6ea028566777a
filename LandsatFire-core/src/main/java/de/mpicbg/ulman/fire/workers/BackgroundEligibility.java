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

import org.scijava.log.LogService;

import net.imglib2.img.Img;
import net.imglib2.type.logic.BitType;

import de.mpicbg.ulman.fire.util.BandSampler;
import de.mpicbg.ulman.fire.util.FireParams;
import de.mpicbg.ulman.fire.util.LandsatBands;
import de.mpicbg.ulman.fire.util.PixelTests;

/**
 * Decides which pixels may serve as samples of the ambient (non-fire)
 * background, see PixelTests.isBackground() for the actual test.
 */
public class BackgroundEligibility
{
	///shortcuts to some Fiji services
	private final LogService log;

	///how many threads to use when sweeping the image
	public int noOfThreads = Runtime.getRuntime().availableProcessors();

	///a constructor requiring connection to Fiji report/log services
	public BackgroundEligibility(final LogService _log)
	{
		//check that non-null was given for _log!
		if (_log == null)
			throw new NullPointerException("No log service supplied.");

		log = _log;
	}

	/**
	 * Returns a new mask image, of the same size as the bands, with 'true'
	 * at pixels that are valid background samples. The bands are not modified.
	 * Should there be no valid pixel at all in the bands, the mask is all
	 * 'false' and a warning is reported.
	 */
	public Img<BitType> computeMask(final LandsatBands bands, final FireParams params)
	{
		final int width  = (int)bands.width();
		final int height = (int)bands.height();
		final boolean[] flags = new boolean[width*height];

		//per-row counters so that the stripes never write into the same element
		final long[] validCnt = new long[height];
		final long[] eligibleCnt = new long[height];

		ParallelStripes.run(height, noOfThreads, (yFrom,yTo) ->
		{
			final BandSampler sampler = new BandSampler(bands);
			final float[] rho = new float[LandsatBands.NO_OF_BANDS];

			for (int y=yFrom; y < yTo; ++y)
			{
				for (int x=0; x < width; ++x)
				{
					if (!sampler.read(x,y,rho)) continue;
					++validCnt[y];

					if (PixelTests.isBackground(rho,params))
					{
						flags[y*width + x] = true;
						++eligibleCnt[y];
					}
				}
			}
		} );

		long valid = 0, eligible = 0;
		for (int y=0; y < height; ++y)
		{
			valid += validCnt[y];
			eligible += eligibleCnt[y];
		}

		final double imgSize = (double)width * (double)height;
		if (valid == 0)
			log.warn("Input bands have no valid pixel, no background sample is available.");
		log.info("valid pixels     : "+valid+" ( "+100.0*valid/imgSize+" %)");
		log.info("background pixels: "+eligible+" ( "+100.0*eligible/imgSize+" %)");

		return MaskImgs.toBitImg(flags, width,height);
	}
}
