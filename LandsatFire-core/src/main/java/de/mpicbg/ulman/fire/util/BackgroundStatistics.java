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
import net.imglib2.type.numeric.real.DoubleType;

/**
 * Per-pixel statistics of the background samples within the moving window
 * around every pixel: the fraction of the window that is eligible background
 * (the weight), and the mean and standard deviation of some quantity over
 * only these eligible samples. Where the weight is 0 all three are 0.
 */
public class BackgroundStatistics
{
	public final Img<DoubleType> weight;
	public final Img<DoubleType> mean;
	public final Img<DoubleType> stdDev;

	///number of pixels whose window contained no background sample at all
	public final long degenerateCount;

	public BackgroundStatistics(final Img<DoubleType> weight,
	                            final Img<DoubleType> mean,
	                            final Img<DoubleType> stdDev,
	                            final long degenerateCount)
	{
		this.weight = weight;
		this.mean = mean;
		this.stdDev = stdDev;
		this.degenerateCount = degenerateCount;
	}
}
