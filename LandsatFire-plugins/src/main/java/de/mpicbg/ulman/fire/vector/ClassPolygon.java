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

import org.locationtech.jts.geom.Geometry;

import de.mpicbg.ulman.fire.util.FireClass;

/** One connected region of pixels of the same class. */
public class ClassPolygon
{
	public final FireClass fireClass;
	public final Geometry geometry;
	///number of pixels in the region
	public final long size;

	public ClassPolygon(final FireClass fireClass, final Geometry geometry, final long size)
	{
		this.fireClass = fireClass;
		this.geometry = geometry;
		this.size = size;
	}

	public int value()
	{ return fireClass.value; }

	@Override
	public String toString()
	{
		return fireClass.label+" ("+fireClass.value+"), "+size+" px";
	}
}
