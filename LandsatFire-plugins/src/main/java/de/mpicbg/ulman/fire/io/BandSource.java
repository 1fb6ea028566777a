/*
 * CC BY-SA 4.0
 *
 * The code is licensed with "Attribution-ShareAlike 4.0 International license".
 * See the license details:
 *     https://creativecommons.org/licenses/by-sa/4.0/
 *
 * Copyright (C) 2021 LandsatFire contributors
 */
package de.mpicbg.ulman.fire.io;

import java.io.IOException;

import org.locationtech.jts.geom.util.AffineTransformation;

import de.mpicbg.ulman.fire.util.LandsatBands;

/** Provider of the seven co-registered reflectance bands of one scene. */
public interface BandSource
{
	/** Loads bands 1..7, fails if any of them is missing or unreadable. */
	LandsatBands load() throws IOException;

	/** Path prefix that the outputs of this scene are named after. */
	String baseName();

	/** Pixel-corner to map coordinates transform of the scene,
	    or null if the scene is not georeferenced. */
	AffineTransformation geoTransform() throws IOException;
}
