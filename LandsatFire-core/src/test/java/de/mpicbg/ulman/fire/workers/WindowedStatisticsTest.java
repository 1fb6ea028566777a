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

import org.junit.Before;
import org.junit.Test;
import org.scijava.log.LogService;
import org.scijava.log.StderrLogService;

import net.imglib2.RandomAccess;
import net.imglib2.img.Img;
import net.imglib2.img.array.ArrayImgs;
import net.imglib2.type.logic.BitType;
import net.imglib2.type.numeric.real.DoubleType;

import java.util.Random;

import de.mpicbg.ulman.fire.util.BackgroundStatistics;
import de.mpicbg.ulman.fire.util.InvalidWindowSizeException;

import static org.junit.Assert.*;

public class WindowedStatisticsTest
{
	private LogService log;
	private WindowedStatistics stats;

	@Before
	public void setUp()
	{
		log = new StderrLogService();
		stats = new WindowedStatistics(log);
	}

	@Test(expected = NullPointerException.class)
	public void testConstructorRejectsNullLog()
	{
		new WindowedStatistics(null);
	}

	@Test
	public void testUniformEligibilityEqualsPlainMean()
	{
		final int w = 9, h = 9, k = 5;
		final double[] v = new double[w*h];
		final boolean[] e = new boolean[w*h];
		for (int i=0; i < v.length; ++i)
		{
			v[i] = (i % 7) * 0.5 + 1.0;
			e[i] = true;
		}

		final BackgroundStatistics s
			= stats.compute(ArrayImgs.doubles(v, w,h), Scenes.mask(e, w,h), k);

		//window fully inside the image, centred at [4,4]
		double sum = 0;
		for (int y=2; y <= 6; ++y)
			for (int x=2; x <= 6; ++x)
				sum += v[y*w+x];

		assertEquals(1.0, at(s.weight,4,4), 1e-12);
		assertEquals(sum/25.0, at(s.mean,4,4), 1e-12);
	}

	@Test
	public void testVarianceIdentityMatchesBruteForce()
	{
		final Random rnd = new Random(20160101L);
		final int w = 37, h = 29, k = 7;

		for (int round=0; round < 3; ++round)
		{
			final double[] v = new double[w*h];
			final boolean[] e = new boolean[w*h];
			for (int i=0; i < v.length; ++i)
			{
				v[i] = rnd.nextDouble() * 2.0 + 0.1;
				e[i] = rnd.nextDouble() < 0.6;
			}

			final BackgroundStatistics s
				= stats.compute(ArrayImgs.doubles(v, w,h), Scenes.mask(e, w,h), k);

			for (int y=0; y < h; ++y)
				for (int x=0; x < w; ++x)
				{
					final double[] ref = bruteForce(v,e, w,h, x,y, k);
					assertEquals(ref[0], at(s.weight,x,y), 1e-12);
					assertRelativelyEquals(ref[1], at(s.mean,x,y), 1e-9);
					assertRelativelyEquals(ref[2], at(s.stdDev,x,y), 1e-9);
				}
		}
	}

	@Test
	public void testWeightOfFourteenEligibleOutOfTwentyFive()
	{
		final int w = 10, h = 10, k = 5;
		final boolean[] e = new boolean[w*h];

		//window centred at [5,5] covers x,y in 3..7, flag 14 of its 25 pixels
		int flagged = 0;
		for (int y=3; y <= 7; ++y)
			for (int x=3; x <= 7; ++x)
				if (flagged < 14)
				{
					e[y*w+x] = true;
					++flagged;
				}

		final BackgroundStatistics s
			= stats.compute(ArrayImgs.doubles(new double[w*h], w,h), Scenes.mask(e, w,h), k);
		assertEquals(0.56, at(s.weight,5,5), 1e-12);
	}

	@Test
	public void testCornerWindowIsZeroPadded()
	{
		final int w = 8, h = 8, k = 5;
		final double[] v = new double[w*h];
		final boolean[] e = new boolean[w*h];
		java.util.Arrays.fill(v, 3.0);
		java.util.Arrays.fill(e, true);

		final BackgroundStatistics s
			= stats.compute(ArrayImgs.doubles(v, w,h), Scenes.mask(e, w,h), k);

		//only 3x3 of the 5x5 corner window lies inside the image
		assertEquals(9.0/25.0, at(s.weight,0,0), 1e-12);
		assertTrue(at(s.weight,0,0) < at(s.weight,4,4));
		assertEquals(1.0, at(s.weight,4,4), 1e-12);

		//padding does not leak zeros into the mean
		assertEquals(3.0, at(s.mean,0,0), 1e-12);
		assertEquals(0.0, at(s.stdDev,0,0), 1e-6);
	}

	@Test
	public void testEmptyWindowGivesZeros()
	{
		final int w = 12, h = 12, k = 3;
		final double[] v = new double[w*h];
		final boolean[] e = new boolean[w*h];
		java.util.Arrays.fill(v, 5.0);
		//only the top-left pixel is a background sample
		e[0] = true;

		final BackgroundStatistics s
			= stats.compute(ArrayImgs.doubles(v, w,h), Scenes.mask(e, w,h), k);

		assertEquals(0.0, at(s.weight,8,8), 0.0);
		assertEquals(0.0, at(s.mean,8,8), 0.0);
		assertEquals(0.0, at(s.stdDev,8,8), 0.0);
		assertEquals(w*h - 4, s.degenerateCount);

		for (DoubleType d : s.stdDev)
			assertFalse(Double.isNaN(d.get()));
	}

	@Test
	public void testNonFiniteValuesAreIgnored()
	{
		final int w = 5, h = 5, k = 3;
		final double[] v = new double[w*h];
		final boolean[] e = new boolean[w*h];
		java.util.Arrays.fill(v, 2.0);
		java.util.Arrays.fill(e, true);
		v[2*w+2] = Double.NaN;

		final BackgroundStatistics s
			= stats.compute(ArrayImgs.doubles(v, w,h), Scenes.mask(e, w,h), k);

		assertEquals(8.0/9.0, at(s.weight,2,2), 1e-12);
		assertEquals(2.0, at(s.mean,2,2), 1e-12);
	}

	@Test
	public void testThreadCountDoesNotChangeResults()
	{
		final Random rnd = new Random(7L);
		final int w = 64, h = 41, k = 11;
		final double[] v = new double[w*h];
		final boolean[] e = new boolean[w*h];
		for (int i=0; i < v.length; ++i)
		{
			v[i] = rnd.nextGaussian();
			e[i] = rnd.nextBoolean();
		}
		final Img<BitType> mask = Scenes.mask(e, w,h);

		stats.noOfThreads = 1;
		final BackgroundStatistics single = stats.compute(ArrayImgs.doubles(v, w,h), mask, k);
		stats.noOfThreads = 5;
		final BackgroundStatistics multi = stats.compute(ArrayImgs.doubles(v, w,h), mask, k);

		assertArrayEquals(toArray(single.mean), toArray(multi.mean), 0.0);
		assertArrayEquals(toArray(single.stdDev), toArray(multi.stdDev), 0.0);
		assertArrayEquals(toArray(single.weight), toArray(multi.weight), 0.0);
	}

	@Test
	public void testBoxSumOfOnes()
	{
		final int w = 6, h = 4, k = 3;
		final double[] ones = new double[w*h];
		java.util.Arrays.fill(ones, 1.0);

		final double[] sums = stats.boxSum(ones, w,h, k);
		assertEquals(4.0, sums[0], 0.0);          //corner
		assertEquals(6.0, sums[2], 0.0);          //top edge
		assertEquals(9.0, sums[1*w+2], 0.0);      //interior
		assertEquals(1.0, ones[0], 0.0);          //input untouched
	}

	@Test(expected = InvalidWindowSizeException.class)
	public void testEvenWindowIsRejected()
	{
		stats.compute(ArrayImgs.doubles(10,10), ArrayImgs.bits(10,10), 4);
	}

	@Test(expected = InvalidWindowSizeException.class)
	public void testTooLargeWindowIsRejected()
	{
		stats.compute(ArrayImgs.doubles(10,20), ArrayImgs.bits(10,20), 11);
	}

	@Test(expected = IllegalArgumentException.class)
	public void testSizeMismatchIsRejected()
	{
		stats.compute(ArrayImgs.doubles(10,10), ArrayImgs.bits(10,11), 3);
	}


	///returns {weight, mean, stdDev} by the definition, with explicit deviations
	private static
	double[] bruteForce(final double[] v, final boolean[] e, final int w, final int h,
	                    final int cx, final int cy, final int k)
	{
		final int r = k/2;
		int cnt = 0;
		double sum = 0;
		for (int y=cy-r; y <= cy+r; ++y)
			for (int x=cx-r; x <= cx+r; ++x)
				if (x >= 0 && y >= 0 && x < w && y < h && e[y*w+x])
				{
					++cnt;
					sum += v[y*w+x];
				}
		if (cnt == 0) return new double[] {0,0,0};

		final double mean = sum/cnt;
		double dev = 0;
		for (int y=cy-r; y <= cy+r; ++y)
			for (int x=cx-r; x <= cx+r; ++x)
				if (x >= 0 && y >= 0 && x < w && y < h && e[y*w+x])
					dev += (v[y*w+x]-mean) * (v[y*w+x]-mean);

		return new double[] { cnt/(double)(k*k), mean, Math.sqrt(dev/cnt) };
	}

	private static
	double at(final Img<DoubleType> img, final int x, final int y)
	{
		final RandomAccess<DoubleType> ra = img.randomAccess();
		ra.setPosition(new long[] {x,y});
		return ra.get().get();
	}

	private static
	void assertRelativelyEquals(final double expected, final double actual, final double relTol)
	{
		final double tol = Math.max(Math.abs(expected) * relTol, 1e-12);
		assertEquals(expected, actual, tol);
	}

	private static
	double[] toArray(final Img<DoubleType> img)
	{
		final double[] out = new double[(int)img.size()];
		int i = 0;
		for (DoubleType d : img) out[i++] = d.get();
		return out;
	}
}
