/*
 * CC BY-SA 4.0
 *
 * The code is licensed with "Attribution-ShareAlike 4.0 International license".
 * See the license details:
 *     https://creativecommons.org/licenses/by-sa/4.0/
 *
 * Copyright (C) 2021 LandsatFire contributors
 */
package de.mpicbg.ulman.fire.vector;

import org.junit.Before;
import org.junit.Test;
import org.scijava.log.StderrLogService;

import net.imglib2.img.Img;
import net.imglib2.img.array.ArrayImgs;
import net.imglib2.type.numeric.integer.UnsignedByteType;

import org.locationtech.jts.geom.Envelope;
import org.locationtech.jts.geom.Polygon;
import org.locationtech.jts.geom.util.AffineTransformation;

import java.util.List;
import java.util.Random;

import de.mpicbg.ulman.fire.util.FireClass;

import static org.junit.Assert.*;

public class ClassPolygonizerTest
{
	private ClassPolygonizer polygonizer;

	@Before
	public void setUp()
	{
		polygonizer = new ClassPolygonizer(new StderrLogService());
	}

	private static
	Img<UnsignedByteType> img(final int w, final int h, final int... values)
	{
		final byte[] b = new byte[values.length];
		for (int i=0; i < values.length; ++i) b[i] = (byte)values[i];
		return ArrayImgs.unsignedBytes(b, w,h);
	}

	@Test
	public void testRegionsAndAreas()
	{
		final List<ClassPolygon> polys = polygonizer.polygonize(img(4,4,
			0,0,0,0,
			0,3,3,0,
			0,3,0,0,
			0,0,0,2), null);

		assertEquals(3, polys.size());
		assertEquals(FireClass.BACKGROUND, polys.get(0).fireClass);
		assertEquals(12.0, polys.get(0).geometry.getArea(), 1e-9);
		assertEquals(FireClass.POTENTIAL_FIRE, polys.get(1).fireClass);
		assertEquals(3.0, polys.get(1).geometry.getArea(), 1e-9);
		assertEquals(3, polys.get(1).size);
		assertEquals(FireClass.UNAMBIGUOUS, polys.get(2).fireClass);
		assertEquals(new Envelope(3,4, 3,4), polys.get(2).geometry.getEnvelopeInternal());
	}

	@Test
	public void testEnclosedRegionMakesHole()
	{
		final List<ClassPolygon> polys = polygonizer.polygonize(img(5,5,
			0,0,0,0,0,
			0,2,2,2,0,
			0,2,0,2,0,
			0,2,2,2,0,
			0,0,0,0,0), null);

		assertEquals(3, polys.size());
		final ClassPolygon ring = polys.get(1);
		assertEquals(FireClass.UNAMBIGUOUS, ring.fireClass);
		assertTrue(ring.geometry instanceof Polygon);
		assertEquals(1, ((Polygon)ring.geometry).getNumInteriorRing());
		assertEquals(8.0, ring.geometry.getArea(), 1e-9);
		assertTrue(ring.geometry.isValid());
		assertEquals(new Envelope(1,4, 1,4), ring.geometry.getEnvelopeInternal());
	}

	@Test
	public void testDiagonalPixelsAreNotConnected()
	{
		final List<ClassPolygon> polys = polygonizer.polygonize(img(2,2,
			3,0,
			0,3), null);
		assertEquals(4, polys.size());
	}

	@Test
	public void testAreasSumToClassCounts()
	{
		final Random rnd = new Random(3L);
		final int w = 30, h = 20;
		final int[] v = new int[w*h];
		final long[] counts = new long[4];
		for (int i=0; i < v.length; ++i)
		{
			v[i] = rnd.nextInt(10) < 7 ? 0 : 1+rnd.nextInt(3);
			++counts[v[i]];
		}

		final double[] areas = new double[4];
		for (ClassPolygon p : polygonizer.polygonize(img(w,h, v), null))
		{
			assertTrue(p.geometry.isValid());
			areas[p.value()] += p.geometry.getArea();
		}

		for (int c=0; c < 4; ++c)
			assertEquals(counts[c], areas[c], 1e-6);
	}

	@Test
	public void testTransformIsApplied()
	{
		final AffineTransformation t = GeoTransforms.fromGdal(
			new double[] { 1000.0, 30.0, 0.0, 2000.0, 0.0, -30.0 });
		final List<ClassPolygon> polys = polygonizer.polygonize(img(2,1, 2,2), t);

		assertEquals(1, polys.size());
		assertEquals(new Envelope(1000,1060, 1970,2000), polys.get(0).geometry.getEnvelopeInternal());
		assertEquals(60*30, polys.get(0).geometry.getArea(), 1e-6);
	}

	@Test
	public void testLabelRegions()
	{
		final int[] labels = new int[6];
		final int n = ClassPolygonizer.labelRegions(new int[] {1,1,0, 0,1,0}, labels, 3,2);
		assertEquals(3, n);
		assertArrayEquals(new int[] {1,1,2, 3,1,2}, labels);
	}

	@Test
	public void testLabelRegionsFollowsWindingRegions()
	{
		//a U of class 1 whose arms are joined only through the bottom row,
		//and class 0 inside the U separated from the outer class 0 pixels
		final int[] classes = {
			1,0,1,0,
			1,0,1,0,
			1,1,1,0 };
		final int[] labels = new int[classes.length];

		assertEquals(3, ClassPolygonizer.labelRegions(classes, labels, 4,3));
		assertArrayEquals(new int[] {
			1,2,1,3,
			1,2,1,3,
			1,1,1,3 }, labels);
	}

	@Test(expected = IllegalArgumentException.class)
	public void testLabelRegionsRejectsNegativeClasses()
	{
		ClassPolygonizer.labelRegions(new int[] {0,-1}, new int[2], 2,1);
	}
}
