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
import net.imglib2.img.array.ArrayImgs;
import net.imglib2.loops.LoopBuilder;
import net.imglib2.type.logic.BitType;
import net.imglib2.type.numeric.real.DoubleType;

import de.mpicbg.ulman.fire.util.BackgroundStatistics;
import de.mpicbg.ulman.fire.util.FireConfig;
import de.mpicbg.ulman.fire.util.FireMasks;
import de.mpicbg.ulman.fire.util.FireParams;
import de.mpicbg.ulman.fire.util.LandsatBands;
import de.mpicbg.ulman.fire.util.PixelTests;

public class FireDetector
{
	///shortcuts to some Fiji services
	private final LogService log;

	///a constructor requiring connection to Fiji report/log services
	public FireDetector(final LogService _log)
	{
		//check that non-null was given for _log!
		if (_log == null)
			throw new NullPointerException("No log service supplied.");

		log = _log;
	}

	/** The thresholds of the algorithm, calculate() works on a copy of them. */
	public FireParams params = new FireParams();


	//---------------------------------------------------------------------/
	/**
	 * This is the main fire detector. It runs, in this order, the background
	 * eligibility test, the windowed background statistics of rho7 and of
	 * R75, the per-pixel classification and (optionally) the edge masking.
	 * Every stage creates new images, the 'bands' are only read.
	 *
	 * The configuration is checked against the bands before any image is
	 * created, InvalidWindowSizeException is thrown if the window does not fit.
	 */
	public FireMasks calculate(final LandsatBands bands, final FireConfig config)
	{
		if (bands == null || config == null)
			throw new IllegalArgumentException("No bands or no configuration supplied.");
		config.validateFor(bands.width(), bands.height());

		log.info("Fire detection on "+bands.width()+" x "+bands.height()+" pixels");
		log.info("Configuration: "+config);
		//own copy, the caller may change 'params' while we are running
		final FireParams p = new FireParams(params);
		log.info("Thresholds: "+p);
		final long timeStart = System.currentTimeMillis();

		//which pixels can be used as background samples
		final BackgroundEligibility eligibility = new BackgroundEligibility(log);
		eligibility.noOfThreads = config.noOfThreads;
		final Img<BitType> eligible = eligibility.computeMask(bands, p);

		//local background statistics of the fire-sensitive band and of the ratio
		final WindowedStatistics stats = new WindowedStatistics(log);
		stats.noOfThreads = config.noOfThreads;

		log.info("Computing background statistics of band 7 with "
			+config.windowSize+" x "+config.windowSize+" window...");
		final BackgroundStatistics rho7Stats
			= stats.compute(bands.band(7), eligible, config.windowSize);

		log.info("Computing background statistics of band ratio 7/5...");
		final BackgroundStatistics r75Stats
			= stats.compute(ratio75(bands), eligible, config.windowSize);

		//the decision itself
		final FireClassifier classifier = new FireClassifier(log);
		classifier.noOfThreads = config.noOfThreads;
		FireMasks masks = classifier.classify(bands, eligible, rho7Stats, r75Stats, p);

		if (config.maskEdges)
		{
			log.info("Masking "+config.edgeBorderWidth+" pixels wide image border.");
			masks = masks.withEdgeMasked(
				EdgeMasker.apply(masks.classes, config.edgeBorderWidth, true),
				EdgeMasker.applyToMask(masks.potentialFire, config.edgeBorderWidth) );
		}

		final long timeEnd = System.currentTimeMillis();
		log.info(String.format("Fire detection completed. Time taken: %.2f seconds",
			(timeEnd-timeStart)/1000.0));

		return masks;
	}

	///creates the image of rho7/rho5, NaN where rho5 is 0
	static
	Img<DoubleType> ratio75(final LandsatBands bands)
	{
		final Img<DoubleType> r75 = ArrayImgs.doubles(bands.width(), bands.height());
		LoopBuilder.setImages(bands.band(7), bands.band(5), r75).forEachPixel(
			(b7,b5,r) -> r.setReal( PixelTests.ratio(b7.getRealDouble(), b5.getRealDouble()) ) );
		return r75;
	}
}
