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

/** Reports input band images that do not share the same 2D size. */
public class ShapeMismatchException extends IllegalArgumentException
{
	private static final long serialVersionUID = 1L;

	public ShapeMismatchException(final String msg)
	{
		super(msg);
	}
}
