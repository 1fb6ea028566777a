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

import net.imglib2.RandomAccess;
import net.imglib2.RandomAccessibleInterval;
import net.imglib2.img.Img;
import net.imglib2.img.array.ArrayImgs;
import net.imglib2.type.logic.BitType;
import net.imglib2.type.numeric.integer.UnsignedByteType;
import net.imglib2.type.numeric.real.DoubleType;
import net.imglib2.view.Views;

import de.mpicbg.ulman.fire.util.BackgroundStatistics;
import de.mpicbg.ulman.fire.util.BandSampler;
import de.mpicbg.ulman.fire.util.FireClass;
import de.mpicbg.ulman.fire.util.FireMasks;
import de.mpicbg.ulman.fire.util.FireParams;
import de.mpicbg.ulman.fire.util.LandsatBands;
import de.mpicbg.ulman.fire.util.PixelTests;

/**
 * Assigns every pixel exactly one FireClass. The tests are evaluated in
 * the order DN folding, unambiguous fire, potential fire, and the first
 * one that passes decides; background is the default.
 */
public class FireClassifier
{
	///shortcuts to some Fiji services
	private final LogService log;

	///how many threads to use when sweeping the image
	public int noOfThreads = Runtime.getRuntime().availableProcessors();

	///a constructor requiring connection to Fiji report/log services
	public FireClassifier(final LogService _log)
	{
		//check that non-null was given for _log!
		if (_log == null)
			throw new NullPointerException("No log service supplied.");

		log = _log;
	}


	/**
	 * The decision for a single pixel. The 'rho' holds bands 1..7 of the pixel,
	 * 'valid' tells if these are all usable, 'eligible' if the pixel itself is
	 * a background sample, and the rest are the local background statistics
	 * of R75 and rho7 (with their common weight) around the pixel.
	 */
	public static
	FireClass classifyPixel(final float[] rho, final boolean valid, final boolean eligible,
	                        final double weight,
	                        final double r75Mean, final double r75StdDev,
	                        final double rho7Mean, final double rho7StdDev,
	                        final FireParams p)
	{
		if (!valid) return FireClass.BACKGROUND;

		if (PixelTests.isDnFolding(rho,p)) return FireClass.DN_FOLDING;
		if (PixelTests.isUnambiguousFire(rho,p)) return FireClass.UNAMBIGUOUS;

		if (isPotentialFire(rho,eligible,weight, r75Mean,r75StdDev, rho7Mean,rho7StdDev, p))
			return FireClass.POTENTIAL_FIRE;

		return FireClass.BACKGROUND;
	}

	/** Background samples are never potential fires; the others must pass
	    the candidate test and stand out of their local background. */
	public static
	boolean isPotentialFire(final float[] rho, final boolean eligible,
	                        final double weight,
	                        final double r75Mean, final double r75StdDev,
	                        final double rho7Mean, final double rho7StdDev,
	                        final FireParams p)
	{
		if (eligible) return false;
		if (!PixelTests.isFireCandidate(rho,p)) return false;

		return PixelTests.exceedsBackground(PixelTests.r75(rho), rho[6], weight,
		                                    r75Mean,r75StdDev, rho7Mean,rho7StdDev, p);
	}


	/**
	 * Classifies all pixels of the bands. The 'rho7Stats' and 'r75Stats' must
	 * have been computed over the 'eligible' mask, their weights are thus the
	 * same and only the weight of 'rho7Stats' is consulted. Returns a fresh
	 * classification image together with the masks of the individual tests.
	 */
	public FireMasks classify(final LandsatBands bands,
	                          final RandomAccessibleInterval<BitType> eligibleMask,
	                          final BackgroundStatistics rho7Stats,
	                          final BackgroundStatistics r75Stats,
	                          final FireParams params)
	{
		final int width  = (int)bands.width();
		final int height = (int)bands.height();
		final RandomAccessibleInterval<BitType> eligible = Views.zeroMin(eligibleMask);

		for (int n=0; n < 2; ++n)
		{
			if (eligible.dimension(n) != bands.band(1).dimension(n))
				throw new IllegalArgumentException("Eligibility mask and bands"
					+" are not of the same size.");
			if (rho7Stats.weight.dimension(n) != eligible.dimension(n)
			 || r75Stats.weight.dimension(n) != eligible.dimension(n))
				throw new IllegalArgumentException("Background statistics and bands"
					+" are not of the same size.");
		}

		final byte[] classes = new byte[width*height];
		final boolean[] dnFoldFlags = new boolean[width*height];
		final boolean[] fireFlags = new boolean[width*height];
		final boolean[] waterFlags = new boolean[width*height];
		final boolean[] potentialFlags = new boolean[width*height];

		ParallelStripes.run(height, noOfThreads, (yFrom,yTo) ->
		{
			final BandSampler sampler = new BandSampler(bands);
			final float[] rho = new float[LandsatBands.NO_OF_BANDS];

			final RandomAccess<BitType> eRA = eligible.randomAccess();
			final RandomAccess<DoubleType> wRA = rho7Stats.weight.randomAccess();
			final RandomAccess<DoubleType> b7mRA = rho7Stats.mean.randomAccess();
			final RandomAccess<DoubleType> b7sRA = rho7Stats.stdDev.randomAccess();
			final RandomAccess<DoubleType> rmRA = r75Stats.mean.randomAccess();
			final RandomAccess<DoubleType> rsRA = r75Stats.stdDev.randomAccess();

			for (int y=yFrom; y < yTo; ++y)
			{
				for (int x=0; x < width; ++x)
				{
					final int off = y*width + x;
					if (!sampler.read(x,y,rho)) continue; //class 0 already

					eRA.setPosition(x,0); eRA.setPosition(y,1);
					wRA.setPosition(eRA);
					b7mRA.setPosition(eRA);
					b7sRA.setPosition(eRA);
					rmRA.setPosition(eRA);
					rsRA.setPosition(eRA);

					final boolean isEligible = eRA.get().get();
					final double weight = wRA.get().getRealDouble();

					dnFoldFlags[off] = PixelTests.isDnFolding(rho,params);
					fireFlags[off] = PixelTests.isUnambiguousFire(rho,params);
					waterFlags[off] = PixelTests.isWater(rho,params);
					potentialFlags[off] = isPotentialFire(rho, isEligible, weight,
						rmRA.get().getRealDouble(), rsRA.get().getRealDouble(),
						b7mRA.get().getRealDouble(), b7sRA.get().getRealDouble(), params);

					//the precedence, mirrors classifyPixel()
					final FireClass c
						= dnFoldFlags[off]    ? FireClass.DN_FOLDING
						: fireFlags[off]      ? FireClass.UNAMBIGUOUS
						: potentialFlags[off] ? FireClass.POTENTIAL_FIRE
						:                       FireClass.BACKGROUND;
					classes[off] = (byte)c.value;
				}
			}
		} );

		final Img<UnsignedByteType> classImg = ArrayImgs.unsignedBytes(classes, width,height);
		final FireMasks masks = new FireMasks(classImg,
			eligibleCopy(eligible, width,height),
			MaskImgs.toBitImg(fireFlags, width,height),
			MaskImgs.toBitImg(dnFoldFlags, width,height),
			MaskImgs.toBitImg(waterFlags, width,height),
			MaskImgs.toBitImg(potentialFlags, width,height));

		reportHistogram(masks.classHistogram(), (double)width*height);
		return masks;
	}

	private static
	Img<BitType> eligibleCopy(final RandomAccessibleInterval<BitType> eligible,
	                          final int width, final int height)
	{
		final boolean[] flags = new boolean[width*height];
		final RandomAccess<BitType> eRA = eligible.randomAccess();
		for (int y=0; y < height; ++y)
		{
			eRA.setPosition(y,1);
			for (int x=0; x < width; ++x)
			{
				eRA.setPosition(x,0);
				flags[y*width + x] = eRA.get().get();
			}
		}
		return MaskImgs.toBitImg(flags, width,height);
	}

	private void reportHistogram(final long[] hist, final double imgSize)
	{
		for (FireClass c : FireClass.values())
			log.info(String.format("%-15s: %d ( %.4f %%)", c.label, hist[c.value], 100.0*hist[c.value]/imgSize));
	}
}
