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

import org.scijava.log.LogService;

import ij.process.FloatProcessor;
import ij.process.FloodFiller;

import net.imglib2.Cursor;
import net.imglib2.RandomAccessibleInterval;
import net.imglib2.type.numeric.integer.UnsignedByteType;
import net.imglib2.view.Views;

import org.locationtech.jts.geom.Envelope;
import org.locationtech.jts.geom.Geometry;
import org.locationtech.jts.geom.GeometryFactory;
import org.locationtech.jts.geom.util.AffineTransformation;
import org.locationtech.jts.operation.union.UnaryUnionOp;
import org.locationtech.jts.simplify.DouglasPeuckerSimplifier;

import java.util.ArrayList;
import java.util.List;

import de.mpicbg.ulman.fire.util.FireClass;

/**
 * Turns the classification image into polygons: every 4-connected region
 * of pixels of the same class (background included) becomes one polygon,
 * with holes where other regions are enclosed. Pixel [x,y] covers the
 * square [x,x+1] x [y,y+1] in pixel coordinates.
 */
public class ClassPolygonizer
{
	///shortcuts to some Fiji services
	private final LogService log;

	private final GeometryFactory geometryFactory = new GeometryFactory();

	///a constructor requiring connection to Fiji report/log services
	public ClassPolygonizer(final LogService _log)
	{
		//check that non-null was given for _log!
		if (_log == null)
			throw new NullPointerException("No log service supplied.");

		log = _log;
	}


	/**
	 * Returns the regions in the order of their top-left-most pixel. If
	 * the 'transform' is not null, the polygons are mapped through it.
	 */
	public List<ClassPolygon> polygonize(final RandomAccessibleInterval<UnsignedByteType> classImg,
	                                     final AffineTransformation transform)
	{
		if (classImg.numDimensions() != 2)
			throw new IllegalArgumentException("Only 2D classification images are supported.");

		final int width  = (int)classImg.dimension(0);
		final int height = (int)classImg.dimension(1);

		//row-major copy of the classes
		final int[] classes = new int[width*height];
		final Cursor<UnsignedByteType> c = Views.flatIterable(Views.zeroMin(classImg)).cursor();
		for (int i=0; c.hasNext(); ++i)
			classes[i] = c.next().get();

		final int[] labels = new int[width*height];
		final int noOfRegions = labelRegions(classes, labels, width, height);
		log.info("Polygonizing "+noOfRegions+" regions...");

		//collect the horizontal runs of every region
		final List<List<Geometry>> runs = new ArrayList<>(noOfRegions);
		final int[] regionClass = new int[noOfRegions];
		final long[] regionSize = new long[noOfRegions];
		for (int r=0; r < noOfRegions; ++r) runs.add(new ArrayList<>());

		for (int y=0; y < height; ++y)
		{
			int x = 0;
			while (x < width)
			{
				final int label = labels[y*width + x];
				int xEnd = x+1;
				while (xEnd < width && labels[y*width + xEnd] == label) ++xEnd;

				runs.get(label-1).add( geometryFactory.toGeometry(new Envelope(x,xEnd, y,y+1)) );
				regionClass[label-1] = classes[y*width + x];
				regionSize[label-1] += xEnd-x;
				x = xEnd;
			}
		}

		final List<ClassPolygon> polygons = new ArrayList<>(noOfRegions);
		final long[] perClass = new long[FireClass.values().length];
		for (int r=0; r < noOfRegions; ++r)
		{
			Geometry g = UnaryUnionOp.union(runs.get(r), geometryFactory);
			runs.set(r, null);

			//drops the vertices between the merged runs, the outline is kept exactly
			g = DouglasPeuckerSimplifier.simplify(g, 0.0);
			if (transform != null) g = transform.transform(g);

			final FireClass fc = FireClass.fromValue(regionClass[r]);
			polygons.add(new ClassPolygon(fc, g, regionSize[r]));
			++perClass[fc.value];
		}

		for (FireClass fc : FireClass.values())
			log.info(String.format("%-15s: %d polygons", fc.label, perClass[fc.value]));

		return polygons;
	}

	///region labels are kept as exact float values, hence at most 2^24 of them
	static final int MAX_REGIONS = 1 << 24;

	/**
	 * Finds 4-connected regions of equal 'classes' values, writes labels 1..N
	 * into 'labels' in the order of the first pixel of every region, and
	 * returns N. The 'classes' must not be negative.
	 */
	static
	int labelRegions(final int[] classes, final int[] labels, final int width, final int height)
	{
		//class values stay non-negative, already labelled regions turn negative
		final float[] pixels = new float[width*height];
		for (int i=0; i < pixels.length; ++i)
		{
			if (classes[i] < 0)
				throw new IllegalArgumentException("Negative class value "+classes[i]+" at pixel "+i+".");
			pixels[i] = classes[i];
		}

		final FloatProcessor ip = new FloatProcessor(width,height, pixels);
		final FloodFiller filler = new FloodFiller(ip);

		int noOfRegions = 0;
		for (int i=0; i < pixels.length; ++i)
		{
			if (ip.getf(i) < 0) continue;

			if (noOfRegions == MAX_REGIONS)
				throw new IllegalStateException("More than "+MAX_REGIONS+" regions to polygonize.");
			ip.setValue( -(++noOfRegions) );
			filler.fill(i % width, i / width);
		}

		for (int i=0; i < pixels.length; ++i)
			labels[i] = (int)-ip.getf(i);
		return noOfRegions;
	}
}
