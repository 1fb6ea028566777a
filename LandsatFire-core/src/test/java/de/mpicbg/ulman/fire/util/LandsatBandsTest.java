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

import org.junit.Test;

import net.imglib2.RandomAccessibleInterval;
import net.imglib2.img.array.ArrayImgs;
import net.imglib2.type.numeric.real.FloatType;
import net.imglib2.view.Views;

import static org.junit.Assert.*;

public class LandsatBandsTest
{
	@SuppressWarnings("unchecked")
	private static
	RandomAccessibleInterval<FloatType>[] bands(final long w, final long h)
	{
		final RandomAccessibleInterval<FloatType>[] b = new RandomAccessibleInterval[7];
		for (int i=0; i < 7; ++i) b[i] = ArrayImgs.floats(w,h);
		return b;
	}

	@Test
	public void testSizeAndAccess()
	{
		final LandsatBands lb = new LandsatBands(bands(12,7));
		assertEquals(12, lb.width());
		assertEquals(7, lb.height());
		assertEquals(12, lb.band(7).dimension(0));
		assertTrue(Float.isNaN(lb.noData(3)));
		assertEquals("SWIR 2", LandsatBands.BAND_NAMES[6]);
	}

	@Test
	public void testOffsetBandsAreZeroMin()
	{
		final RandomAccessibleInterval<FloatType>[] b = bands(5,5);
		b[2] = Views.translate(b[2], 10, 20);
		final LandsatBands lb = new LandsatBands(b);
		assertEquals(0, lb.band(3).min(0));
		assertEquals(0, lb.band(3).min(1));
	}

	@Test(expected = ShapeMismatchException.class)
	public void testSizeMismatchIsRejected()
	{
		final RandomAccessibleInterval<FloatType>[] b = bands(10,10);
		b[4] = ArrayImgs.floats(10,9);
		new LandsatBands(b);
	}

	@Test(expected = ShapeMismatchException.class)
	public void testNon2DIsRejected()
	{
		final RandomAccessibleInterval<FloatType>[] b = bands(10,10);
		b[0] = ArrayImgs.floats(10,10,3);
		new LandsatBands(b);
	}

	@Test(expected = IllegalArgumentException.class)
	public void testMissingBandIsRejected()
	{
		final RandomAccessibleInterval<FloatType>[] b = bands(10,10);
		final RandomAccessibleInterval<FloatType>[] six = java.util.Arrays.copyOf(b, 6);
		new LandsatBands(six);
	}

	@Test(expected = IllegalArgumentException.class)
	public void testBandNumberOutOfRange()
	{
		new LandsatBands(bands(3,3)).band(8);
	}

	@Test
	public void testPixelValidity()
	{
		final float[] nd = { -1, -1, -1, -1, -1, -1, Float.NaN };
		final LandsatBands lb = new LandsatBands(nd, bands(3,3));
		assertTrue(lb.isValidPixel(new float[] { 0,0,0,0,0,0,-1 }));
		assertFalse(lb.isValidPixel(new float[] { -1,0,0,0,0,0,0 }));
		assertFalse(lb.isValidPixel(new float[] { 0,0,0,0,0,Float.POSITIVE_INFINITY,0 }));
		assertFalse(lb.isValidPixel(new float[] { 0,0,0,0,0,0,Float.NaN }));
	}

	@Test
	public void testFireClassValues()
	{
		assertEquals(FireClass.POTENTIAL_FIRE, FireClass.fromValue(3));
		assertEquals("DN Folding", FireClass.fromValue(1).label);
	}

	@Test(expected = IllegalArgumentException.class)
	public void testUnknownFireClassValue()
	{
		FireClass.fromValue(4);
	}
}
