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

import org.locationtech.jts.geom.util.AffineTransformation;

/** Builders of pixel-corner to map coordinate transforms. */
public class GeoTransforms
{
	/**
	 * From the six GDAL geotransform coefficients, which map the pixel
	 * corner (col,row) to (gt[0] + col*gt[1] + row*gt[2], gt[3] + col*gt[4] + row*gt[5]).
	 */
	public static
	AffineTransformation fromGdal(final double[] gt)
	{
		if (gt == null || gt.length != 6)
			throw new IllegalArgumentException("Geotransform must have exactly 6 coefficients.");
		return new AffineTransformation(gt[1], gt[2], gt[0], gt[4], gt[5], gt[3]);
	}

	/**
	 * From the six lines A,D,B,E,C,F of an ESRI world file. The world file
	 * refers to the centre of the top-left pixel, hence the half pixel shift.
	 */
	public static
	AffineTransformation fromWorldFile(final double[] w)
	{
		if (w == null || w.length != 6)
			throw new IllegalArgumentException("World file must have exactly 6 values.");
		final double a = w[0], d = w[1], b = w[2], e = w[3], c = w[4], f = w[5];
		return fromGdal(new double[] { c - 0.5*a - 0.5*b, a, b,
		                               f - 0.5*d - 0.5*e, d, e });
	}
}
