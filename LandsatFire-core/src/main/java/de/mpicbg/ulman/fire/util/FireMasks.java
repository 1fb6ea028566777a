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

import net.imglib2.img.Img;
import net.imglib2.type.logic.BitType;
import net.imglib2.type.numeric.integer.UnsignedByteType;

/**
 * Outcome of one fire detection run: the classification image (values
 * of {@link FireClass}) and the masks of the individual tests that lead
 * to it. The test masks are independent of the class precedence, e.g.,
 * a pixel can be both in the unambiguous and the DN folding mask.
 */
public class FireMasks
{
	///the classification image, values 0..3
	public final Img<UnsignedByteType> classes;

	public final Img<BitType> eligibleBackground;
	public final Img<BitType> unambiguousFire;
	public final Img<BitType> dnFolding;
	public final Img<BitType> water;
	///pixels that passed the candidate and the contextual test
	public final Img<BitType> potentialFire;

	public FireMasks(final Img<UnsignedByteType> classes,
	                 final Img<BitType> eligibleBackground,
	                 final Img<BitType> unambiguousFire,
	                 final Img<BitType> dnFolding,
	                 final Img<BitType> water,
	                 final Img<BitType> potentialFire)
	{
		this.classes = classes;
		this.eligibleBackground = eligibleBackground;
		this.unambiguousFire = unambiguousFire;
		this.dnFolding = dnFolding;
		this.water = water;
		this.potentialFire = potentialFire;
	}

	///returns a copy of this with the classification and the potential fire images replaced
	public FireMasks withEdgeMasked(final Img<UnsignedByteType> newClasses,
	                                final Img<BitType> newPotentialFire)
	{
		return new FireMasks(newClasses, eligibleBackground,
			unambiguousFire, dnFolding, water, newPotentialFire);
	}

	///counts pixels of every class, index is the class value
	public long[] classHistogram()
	{
		final long[] hist = new long[FireClass.values().length];
		for (UnsignedByteType v : classes)
			++hist[v.get()];
		return hist;
	}
}
