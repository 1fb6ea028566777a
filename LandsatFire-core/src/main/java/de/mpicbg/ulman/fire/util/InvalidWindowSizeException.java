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

/** Reports a moving window size that is even, non-positive, or larger than the image. */
public class InvalidWindowSizeException extends IllegalArgumentException
{
	private static final long serialVersionUID = 1L;

	public InvalidWindowSizeException(final String msg)
	{
		super(msg);
	}
}
