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

/**
 * The four mutually exclusive pixel classes of the classification image.
 * The numeric value is what is stored in the output image and in the
 * 'Value' attribute of the vector output, the name goes into its 'Class'.
 */
public enum FireClass
{
	BACKGROUND(0, "Background"),
	DN_FOLDING(1, "DN Folding"),
	UNAMBIGUOUS(2, "Unambiguous"),
	POTENTIAL_FIRE(3, "Potential Fire");

	public final int value;
	public final String label;

	FireClass(final int value, final String label)
	{
		this.value = value;
		this.label = label;
	}

	///maps the stored pixel value back to its class
	public static
	FireClass fromValue(final int value)
	{
		for (FireClass c : values())
			if (c.value == value) return c;

		throw new IllegalArgumentException("No fire class with value "+value+".");
	}
}
