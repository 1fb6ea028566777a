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
import net.imglib2.img.array.ArrayImgs;
import net.imglib2.type.logic.BitType;
import net.imglib2.type.numeric.RealType;
import net.imglib2.view.Views;

import de.mpicbg.ulman.fire.util.BackgroundStatistics;
import de.mpicbg.ulman.fire.util.InvalidWindowSizeException;

public class WindowedStatistics
{
	///shortcuts to some Fiji services
	private final LogService log;

	///how many threads to use for the window sums
	public int noOfThreads = Runtime.getRuntime().availableProcessors();

	///a constructor requiring connection to Fiji report/log services
	public WindowedStatistics(final LogService _log)
	{
		//check that non-null was given for _log!
		if (_log == null)
			throw new NullPointerException("No log service supplied.");

		log = _log;
	}


	/**
	 * For every pixel, considers the windowSize x windowSize window centred
	 * at it and computes over only those window pixels that are flagged in
	 * the 'eligible' mask:
	 *
	 * weight = eligibleCount / windowSize^2
	 * mean   = sum(V) / eligibleCount
	 * stdDev = sqrt( sum(V^2)/eligibleCount - mean^2 )
	 *
	 * The window is zero-padded: outside the image the pixels count as
	 * not eligible with value 0. If the window has no eligible pixel,
	 * all three outputs are 0. Non-finite values of V are treated as not
	 * eligible.
	 *
	 * The three window sums are obtained with a separable running-sum box
	 * filter, so the cost does not depend on the window size.
	 */
	public <T extends RealType<T>>
	BackgroundStatistics compute(final RandomAccessibleInterval<T> values,
	                             final RandomAccessibleInterval<BitType> eligible,
	                             final int windowSize)
	{
		if (values.numDimensions() != 2 || eligible.numDimensions() != 2)
			throw new IllegalArgumentException("Only 2D images are supported.");
		for (int n=0; n < 2; ++n)
			if (values.dimension(n) != eligible.dimension(n))
				throw new IllegalArgumentException("Value image and eligibility mask"
					+" are not of the same size.");

		final int width  = (int)values.dimension(0);
		final int height = (int)values.dimension(1);
		checkWindowSize(windowSize, width, height);

		//masked copies of the inputs: [eligibility, V*e, V*V*e]
		final double[] cnt = new double[width*height];
		final double[] sum = new double[width*height];
		final double[] sq  = new double[width*height];

		final RandomAccessibleInterval<T> zValues = Views.zeroMin(values);
		final RandomAccessibleInterval<BitType> zEligible = Views.zeroMin(eligible);

		ParallelStripes.run(height, noOfThreads, (yFrom,yTo) ->
		{
			final RandomAccess<T> vRA = zValues.randomAccess();
			final RandomAccess<BitType> eRA = zEligible.randomAccess();
			for (int y=yFrom; y < yTo; ++y)
			{
				vRA.setPosition(y,1);
				eRA.setPosition(y,1);
				int off = y*width;
				for (int x=0; x < width; ++x, ++off)
				{
					vRA.setPosition(x,0);
					eRA.setPosition(x,0);
					if (!eRA.get().get()) continue;

					final double v = vRA.get().getRealDouble();
					if (!Double.isFinite(v)) continue;

					cnt[off] = 1;
					sum[off] = v;
					sq[off]  = v*v;
				}
			}
		} );

		final double[] cntSum = boxSum(cnt, width,height, windowSize);
		final double[] valSum = boxSum(sum, width,height, windowSize);
		final double[] sqSum  = boxSum(sq,  width,height, windowSize);

		//finish the statistics, re-using the window-sum arrays for the outputs
		final double area = (double)windowSize * (double)windowSize;
		final long[] degenerate = new long[height];

		ParallelStripes.run(height, noOfThreads, (yFrom,yTo) ->
		{
			for (int y=yFrom; y < yTo; ++y)
			{
				int off = y*width;
				for (int x=0; x < width; ++x, ++off)
				{
					//counts of ones are exact in doubles, rounding only removes drift
					final double count = Math.rint(cntSum[off]);
					if (count < 1)
					{
						cntSum[off] = 0;
						valSum[off] = 0;
						sqSum[off]  = 0;
						++degenerate[y];
						continue;
					}

					final double mean = valSum[off] / count;
					final double var  = sqSum[off] / count - mean*mean;

					cntSum[off] = count / area;
					valSum[off] = mean;
					sqSum[off]  = var > 0 ? Math.sqrt(var) : 0;
				}
			}
		} );

		long degenerateCount = 0;
		for (long d : degenerate) degenerateCount += d;
		if (degenerateCount > 0)
			log.warn("No background sample within the window of "+degenerateCount
				+" pixels ("+100.0*degenerateCount/((double)width*height)+" %), their statistics are set to 0.");

		return new BackgroundStatistics(
			ArrayImgs.doubles(cntSum, width,height),
			ArrayImgs.doubles(valSum, width,height),
			ArrayImgs.doubles(sqSum,  width,height),
			degenerateCount);
	}


	/**
	 * Returns a new array where every pixel holds the sum of 'data' over the
	 * windowSize x windowSize window centred at it; outside the image the
	 * data is considered to be 0. The 'data' is a row-major image of the
	 * given width and height, and is left untouched.
	 */
	public double[] boxSum(final double[] data, final int width, final int height,
	                       final int windowSize)
	{
		if (data.length != width*height)
			throw new IllegalArgumentException("Data array does not match the image size.");
		checkWindowSize(windowSize, width, height);

		final int r = windowSize/2;
		final double[] rowSums = new double[data.length];
		final double[] outSums = new double[data.length];

		//horizontal pass, rows are independent
		ParallelStripes.run(height, noOfThreads, (yFrom,yTo) ->
		{
			for (int y=yFrom; y < yTo; ++y)
				slidingSum(data, y*width, 1, width, r, rowSums);
		} );

		//vertical pass, columns are independent
		ParallelStripes.run(width, noOfThreads, (xFrom,xTo) ->
		{
			for (int x=xFrom; x < xTo; ++x)
				slidingSum(rowSums, x, width, height, r, outSums);
		} );

		return outSums;
	}

	/**
	 * 1D zero-padded moving sum of radius 'r' along the line that starts
	 * at 'offset' and visits 'length' elements 'stride' apart.
	 */
	private static
	void slidingSum(final double[] in, final int offset, final int stride, final int length,
	                final int r, final double[] out)
	{
		//sum of the window centred at position 0: [-r,r] clipped to the line
		double acc = 0;
		for (int i=0; i <= r && i < length; ++i)
			acc += in[offset + i*stride];

		for (int i=0; i < length; ++i)
		{
			out[offset + i*stride] = acc;

			//slide to i+1: the element i+r+1 enters, the element i-r leaves
			final int enter = i+r+1;
			final int leave = i-r;
			if (enter < length) acc += in[offset + enter*stride];
			if (leave >= 0)     acc -= in[offset + leave*stride];
		}
	}

	static
	void checkWindowSize(final int windowSize, final long width, final long height)
	{
		if (windowSize <= 0 || (windowSize & 1) == 0)
			throw new InvalidWindowSizeException("Window size must be a positive odd number, got "+windowSize+".");
		if (windowSize > width || windowSize > height)
			throw new InvalidWindowSizeException("Window size "+windowSize
				+" exceeds the image size "+width+" x "+height+".");
	}
}
